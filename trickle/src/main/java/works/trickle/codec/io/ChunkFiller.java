package works.trickle.codec.io;

import java.io.UncheckedIOException;

/**
 * Supplies a series of byte chunks for processing
 * and allows them to be reused when the caller is finished.
 * This is how a byte source produces data for consumption by {@link ByteCursor}.
 * <p>
 * The results of calling {@link #nextChunk()} multiple times
 * without recycling the previous chunk are undefined.
 * The implementation may hang, may overwrite the chunk previously returned, etc.
 */
public interface ChunkFiller extends AutoCloseable {
	/**
	 * @return the next chunk, or null at the end of the input.
	 * A chunk may be empty.
	 * @throws UncheckedIOException if the underlying source fails
	 */
	ByteChunk nextChunk();

	void recycleChunk(ByteChunk chunk);

	@Override void close(); // No throws Exception
}
