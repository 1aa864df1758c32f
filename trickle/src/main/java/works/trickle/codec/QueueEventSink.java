package works.trickle.codec;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.SynchronousQueue;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * An {@link EventSink} that hands events to a consumer through a {@link BlockingQueue}.
 * <p>
 * With a {@link SynchronousQueue}, each event is handed off directly:
 * the parser waits for the consumer to take it, so it can never get ahead.
 * A bounded buffering queue lets it get ahead by that many events.
 * <p>
 * While waiting, the sink checks the {@link CancellationToken} every {@code pollInterval},
 * so a consumer that stops taking events doesn't leave the parser blocked forever.
 */
public final class QueueEventSink implements EventSink {
	private final BlockingQueue<JsonEvent> queue;
	private final CancellationToken token;
	private final long pollIntervalNanos;

	public QueueEventSink(BlockingQueue<JsonEvent> queue, CancellationToken token, Duration pollInterval) {
		this.queue = requireNonNull(queue);
		this.token = requireNonNull(token);
		this.pollIntervalNanos = pollInterval.toNanos();
		if (pollIntervalNanos <= 0) {
			throw new IllegalArgumentException("Poll interval must be positive: " + pollInterval);
		}
	}

	@Override
	public void accept(JsonEvent event) throws InterruptedException {
		do {
			if (token.isCancelled()) {
				throw new CancellationException("Consumer cancelled the parse before " + event.type());
			}
		} while (!queue.offer(event, pollIntervalNanos, NANOSECONDS));
	}
}
