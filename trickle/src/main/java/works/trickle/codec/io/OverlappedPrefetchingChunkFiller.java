package works.trickle.codec.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uses a background thread to read from a stream
 * while the foreground thread processes previously read data.
 * This ensures that the parsing runs at the full speed of either
 * the processing or the I/O, whichever is slower.
 * <p>
 * A read failure in the background is reported by {@link #nextChunk()}
 * once all the chunks read before it have been handed out.
 * <p>
 * Calling {@link #close()} will close the underlying stream.
 */
public final class OverlappedPrefetchingChunkFiller implements ChunkFiller {
	private final InputStream stream;
	private final BlockingQueue<byte[]> emptyBuffers;
	private final BlockingQueue<ByteChunk> filledBuffers;
	private final Thread backgroundThread;
	private volatile IOException failure;
	private volatile boolean closed;

	public OverlappedPrefetchingChunkFiller(InputStream stream) {
		// We aim to use an integer number of memory pages for the array object.
		this(stream, 10*4096 - 16, 2); // 16 = array header
	}

	/**
	 * @param numBuffers if only 1, no overlapping will occur.
	 */
	public OverlappedPrefetchingChunkFiller(InputStream stream, int bufferSize, int numBuffers) {
		if (bufferSize < 1) {
			throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
		}
		if (numBuffers < 1) {
			throw new IllegalArgumentException("Need at least one buffer: " + numBuffers);
		}
		this.stream = stream;
		this.emptyBuffers = new ArrayBlockingQueue<>(numBuffers);
		this.filledBuffers = new ArrayBlockingQueue<>(numBuffers + 1); // +1 for the sentinel

		for (int i = 0; i < numBuffers; i++) {
			emptyBuffers.add(new byte[bufferSize]);
		}

		backgroundThread = new Thread(this::fillBuffers, "overlapped-prefetcher-" + THREAD_COUNTER.incrementAndGet());
		backgroundThread.setDaemon(true);
		backgroundThread.start();
	}

	private void fillBuffers() {
		try {
			while (true) {
				byte[] buffer = emptyBuffers.take();
				int length;
				try {
					length = stream.read(buffer, 0, buffer.length);
				} catch (IOException e) {
					if (closed) {
						LOGGER.debug("Stream closed while prefetching", e);
					} else {
						failure = e;
					}
					filledBuffers.put(EOF_SENTINEL);
					break;
				}
				if (length == -1) {
					filledBuffers.put(EOF_SENTINEL);
					break;
				}

				filledBuffers.put(new ByteChunk(buffer, 0, length));
			}
		} catch (InterruptedException e) {
			LOGGER.debug("Prefetcher interrupted");
			Thread.currentThread().interrupt();
		}
	}

	/**
	 * @return the next filled buffer, or null if EOF.
	 * @throws UncheckedIOException if the background read failed, or wrapping
	 * an {@link InterruptedIOException} if this thread is interrupted while waiting
	 */
	@Override
	public ByteChunk nextChunk() {
		ByteChunk result;
		try {
			result = filledBuffers.take();
		} catch (InterruptedException e) {
			// Not the end of the input, so it mustn't look like one
			Thread.currentThread().interrupt();
			InterruptedIOException failure = new InterruptedIOException("Interrupted while waiting for prefetched data");
			failure.initCause(e);
			throw new UncheckedIOException(failure);
		}
		if (result == EOF_SENTINEL) {
			// Leave it there so subsequent calls also see EOF
			filledBuffers.offer(EOF_SENTINEL);
			IOException e = failure;
			if (e != null) {
				throw new UncheckedIOException(e);
			}
			return null;
		} else {
			return result;
		}
	}

	/**
	 * Recycle a buffer after use.
	 */
	@Override
	public void recycleChunk(ByteChunk chunk) {
		var succeeded = emptyBuffers.offer(chunk.bytes());
		if (!succeeded) {
			LOGGER.debug("Buffer pool full, discarding buffer");
		}
	}

	@Override
	public void close() {
		closed = true;
		backgroundThread.interrupt();
		try {
			stream.close();
		} catch (IOException e) {
			LOGGER.debug("Ignoring exception closing stream", e);
		}
	}

	private static final ByteChunk EOF_SENTINEL = new ByteChunk(new byte[0], 0, 0);
	private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();
	private static final Logger LOGGER = LoggerFactory.getLogger(OverlappedPrefetchingChunkFiller.class);
}
