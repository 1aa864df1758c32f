package works.trickle.codec.io;

/**
 * @param bytes the byte array containing the chunk data.
 *              Owned by the {@link ChunkFiller} that produced it;
 *              readers must not retain it after {@link ChunkFiller#recycleChunk recycling}.
 * @param start the index of the first byte in the chunk containing data
 * @param stop  the index one past the last byte in the chunk containing data
 */
public record ByteChunk(
	byte[] bytes,
	int start,
	int stop
) {
	int length() {
		return stop - start;
	}
}
