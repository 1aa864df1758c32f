package works.trickle.codec.io;

import static java.util.Objects.checkFromToIndex;

/**
 * Hands out an in-memory byte range as one chunk, then reports end of input.
 * The array is not copied, so the caller must not modify it while parsing.
 */
public final class ByteArrayChunkFiller implements ChunkFiller {
	private final ByteChunk chunk;
	private boolean delivered = false;

	public ByteArrayChunkFiller(byte[] bytes) {
		this(bytes, 0, bytes.length);
	}

	/**
	 * @param start index of the first byte of input
	 * @param stop index one past the last byte of input
	 */
	public ByteArrayChunkFiller(byte[] bytes, int start, int stop) {
		checkFromToIndex(start, stop, bytes.length);
		this.chunk = new ByteChunk(bytes, start, stop);
	}

	@Override
	public ByteChunk nextChunk() {
		if (delivered) {
			return null;
		}
		delivered = true;
		return chunk;
	}

	@Override
	public void recycleChunk(ByteChunk chunk) {
		assert chunk == this.chunk;
	}

	@Override
	public void close() {
		// The array belongs to the caller
	}
}
