package works.trickle.codec;

import java.util.concurrent.CancellationException;

/**
 * Receives the events produced by {@link EventParser}, one at a time, in order.
 */
@FunctionalInterface
public interface EventSink {
	/**
	 * May block until the consumer is ready for the event.
	 *
	 * @throws CancellationException if the consumer no longer wants events;
	 * the parse is abandoned without delivering any more.
	 */
	void accept(JsonEvent event) throws InterruptedException;
}
