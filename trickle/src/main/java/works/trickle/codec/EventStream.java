package works.trickle.codec;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.trickle.codec.JsonEvent.EndOfStream;
import works.trickle.exceptions.JsonProcessingException;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Runs an {@link EventParser} on its own thread and hands its events
 * to the consumer one at a time.
 * <p>
 * By default the events pass through a {@link SynchronousQueue}, so the parser
 * stays exactly one event ahead of the consumer and memory use doesn't depend on
 * how fast the consumer is.
 * <p>
 * The consumer should either read through to the {@link EndOfStream} event,
 * or call {@link #close()}. Otherwise the parser thread stays blocked
 * waiting to deliver its next event, holding the input open.
 * Closing cancels the parse; the parser thread notices at its next event,
 * closes the input, and exits.
 */
public final class EventStream implements Iterator<JsonEvent>, AutoCloseable {
	private final BlockingQueue<JsonEvent> queue;
	private final CancellationToken token = new CancellationToken();
	private final Duration pollInterval;
	private final Thread worker;

	/**
	 * Set if the parser thread dies with something other than
	 * a parse error, which would have been delivered as an event.
	 */
	private volatile Throwable workerFailure;

	private boolean finished = false;

	private EventStream(EventParser parser, BlockingQueue<JsonEvent> queue, Duration pollInterval) {
		this.queue = queue;
		this.pollInterval = pollInterval;
		QueueEventSink sink = new QueueEventSink(queue, token, pollInterval);
		this.worker = new Thread(() -> runParser(parser, sink), "trickle-parser-" + THREAD_COUNTER.incrementAndGet());
		this.worker.setDaemon(true);
	}

	/**
	 * Starts parsing in the background, with events handed off directly to the consumer.
	 * Both sides check for the other going away every
	 * {@link ParserSettings#cancellationPollInterval()} of the parser's settings.
	 */
	public static EventStream start(EventParser parser) {
		return start(parser, new SynchronousQueue<>(), parser.settings().cancellationPollInterval());
	}

	/**
	 * @param queue conveys the events to the consumer; a bounded queue lets the parser
	 *              get ahead of the consumer by up to its capacity
	 * @param pollInterval how often each side checks whether the other has gone away
	 */
	public static EventStream start(EventParser parser, BlockingQueue<JsonEvent> queue, Duration pollInterval) {
		EventStream result = new EventStream(parser, queue, pollInterval);
		result.worker.start();
		return result;
	}

	private void runParser(EventParser parser, QueueEventSink sink) {
		try (parser) {
			parser.parse(sink);
		} catch (CancellationException e) {
			LOGGER.debug("Parse cancelled by consumer after {} documents", parser.documentCount());
		} catch (InterruptedException e) {
			if (!token.isCancelled()) {
				LOGGER.warn("Parser thread interrupted", e);
				workerFailure = e;
			}
			Thread.currentThread().interrupt();
		} catch (RuntimeException | Error e) {
			LOGGER.warn("Parser thread failed", e);
			workerFailure = e;
		}
	}

	/**
	 * @return false once {@link EndOfStream} has been returned, or after {@link #close()}
	 */
	@Override
	public boolean hasNext() {
		return !finished;
	}

	/**
	 * Waits for the parser to produce the next event.
	 *
	 * @throws JsonProcessingException if the parser thread died without finishing,
	 * or this thread is interrupted while waiting
	 */
	@Override
	public JsonEvent next() {
		if (finished) {
			throw new NoSuchElementException();
		}

		JsonEvent result;
		try {
			while ((result = queue.poll(pollInterval.toNanos(), NANOSECONDS)) == null) {
				if (!worker.isAlive() && queue.isEmpty()) {
					finished = true;
					throw new JsonProcessingException("Parser thread ended without finishing the stream", workerFailure);
				}
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			close();
			throw new JsonProcessingException("Interrupted while waiting for the next event", e);
		}

		if (result instanceof EndOfStream) {
			finished = true;
		}
		return result;
	}

	/**
	 * The returned stream closes this object when it is closed.
	 */
	public Stream<JsonEvent> stream() {
		return StreamSupport
			.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
			.onClose(this::close);
	}

	Duration pollInterval() {
		return pollInterval;
	}

	/**
	 * Waits for the parser thread to exit.
	 *
	 * @return true if it exited within the given time
	 */
	public boolean awaitTermination(Duration timeout) throws InterruptedException {
		worker.join(timeout.toMillis());
		return !worker.isAlive();
	}

	/**
	 * Stops the parse if it's still going. Events not yet taken are discarded.
	 */
	@Override
	public void close() {
		finished = true;
		if (token.cancel() && worker.isAlive()) {
			LOGGER.debug("Cancelling {}", worker.getName());
			worker.interrupt();
		}
	}

	private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();
	private static final Logger LOGGER = LoggerFactory.getLogger(EventStream.class);
}
