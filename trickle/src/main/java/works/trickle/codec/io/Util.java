package works.trickle.codec.io;

import java.util.stream.LongStream;

public class Util {
	private static final long WHITESPACE_CHARS = LongStream
		.of('\t', '\n', 0x0B, '\f', '\r', ' ')
		.map(n -> 1L << n)
		.sum();

	/**
	 * Not in the JSON grammar, but accepted when extended whitespace is enabled:
	 * the Latin-1 "next line" and "no-break space" bytes.
	 */
	static final int NEXT_LINE = 0x85;
	static final int NO_BREAK_SPACE = 0xA0;

	/**
	 * @param b a byte value in 0..255, or -1 for end of input
	 */
	public static boolean fast_isWhitespace(int b) {
		// The position to check in WHITESPACE_CHARS
		long bit = 1L << b;

		// Zero if definitely not whitespace
		// Can have false positives
		long bitIsSet = WHITESPACE_CHARS & bit;

		// All ones if b is negative or greater than the largest whitespace char
		long isNegative = (long)b >> 63;
		long isTooBig = (63L - b) >> 63;

		long answer = bitIsSet & ~(isNegative | isTooBig);
		return answer != 0;
	}

	public static boolean isWhitespace(int b, boolean extended) {
		return fast_isWhitespace(b)
			|| (extended && (b == NEXT_LINE || b == NO_BREAK_SPACE));
	}

	public static boolean isDigit(int b) {
		return b >= '0' && b <= '9';
	}

	public static boolean isNumberChar(int b) {
		return isDigit(b) || b == '.' || b == '-' || b == '+' || b == 'e' || b == 'E';
	}

	/**
	 * Renders a byte for a diagnostic message, the way it would appear
	 * if the input were Latin-1.
	 */
	public static String printable(int b) {
		if (b < 0) {
			return "end of input";
		}
		return String.valueOf((char) b);
	}
}
