package works.trickle.codec.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * A {@link ChunkFiller} that reads chunks on demand from an {@link InputStream}.
 * This offers simplicity, and eliminates the overhead of the background thread
 * and queue used by {@link OverlappedPrefetchingChunkFiller},
 * but the drawback is that it cannot possibly run at the full speed
 * of whichever is the limiting factor (processing or I/O)
 * because the two operations are interleaved instead of overlapped.
 * <p>
 * Calling {@link #close()} will close the underlying stream.
 */
public class SynchronousChunkFiller implements ChunkFiller {
	public static final int DEFAULT_CHUNK_SIZE = 40_000;

	final InputStream stream;
	final byte[] buffer;

	public SynchronousChunkFiller(InputStream stream) {
		this(stream, DEFAULT_CHUNK_SIZE);
	}

	public SynchronousChunkFiller(InputStream stream, int chunkSize) {
		if (chunkSize < 1) {
			throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
		}
		this.stream = stream;
		buffer = new byte[chunkSize];
	}

	@Override
	public ByteChunk nextChunk() {
		int length;
		try {
			length = stream.read(buffer, 0, buffer.length);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		if (length == -1) {
			return null;
		}

		return new ByteChunk(buffer, 0, length);
	}

	@Override
	public void recycleChunk(ByteChunk chunk) {
		assert chunk.bytes() == this.buffer;
	}

	@Override
	public void close() {
		try {
			stream.close();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}
