package works.trickle.codec.io;

import java.util.Arrays;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * Growable byte buffer for accumulating one scalar's raw bytes.
 * Each parse owns its own; it is reset, not reallocated, between scalars.
 */
final class ScratchBuffer {
	private byte[] bytes;
	private int length;

	ScratchBuffer() {
		this(64);
	}

	ScratchBuffer(int initialCapacity) {
		bytes = new byte[initialCapacity];
	}

	void reset() {
		length = 0;
	}

	void append(int b) {
		if (length == bytes.length) {
			bytes = Arrays.copyOf(bytes, bytes.length * 2);
		}
		bytes[length++] = (byte) b;
	}

	byte[] bytes() {
		return bytes;
	}

	int length() {
		return length;
	}

	/**
	 * One char per byte. Only meaningful for ASCII content such as numbers and literals.
	 */
	String asLatin1String() {
		return new String(bytes, 0, length, ISO_8859_1);
	}
}
