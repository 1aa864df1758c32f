package works.trickle.codec;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lets a consumer tell the parser to stop producing events.
 * Once cancelled, stays cancelled.
 */
public final class CancellationToken {
	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	/**
	 * @return true if this call did the cancelling
	 */
	public boolean cancel() {
		return cancelled.compareAndSet(false, true);
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

	@Override
	public String toString() {
		return "CancellationToken(" + (isCancelled() ? "cancelled" : "active") + ")";
	}
}
