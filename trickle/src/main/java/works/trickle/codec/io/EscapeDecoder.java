package works.trickle.codec.io;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Turns the raw bytes between a JSON string's quotes into text.
 * <p>
 * Runs of ordinary bytes are decoded as UTF-8, with malformed sequences
 * replaced by U+FFFD. Escapes are rewritten; a {@code \}{@code u} surrogate
 * that doesn't form a valid pair with the escape after it becomes U+FFFD.
 */
final class EscapeDecoder {
	static final char REPLACEMENT_CHAR = '\uFFFD';

	private EscapeDecoder() { }

	static String decode(byte[] s, int length) throws MalformedStringException {
		// Fast path: nothing to rewrite
		int r = 0;
		while (r < length) {
			int c = s[r] & 0xFF;
			if (c == '\\' || c == '"' || c < 0x20) {
				break;
			}
			r++;
		}
		if (r == length) {
			return new String(s, 0, length, UTF_8);
		}

		StringBuilder sb = new StringBuilder(length);
		int runStart = 0;
		while (r < length) {
			int c = s[r] & 0xFF;
			if (c == '\\') {
				appendRun(sb, s, runStart, r);
				r++;
				if (r >= length) {
					throw new MalformedStringException("Backslash at end of string");
				}
				int esc = s[r++] & 0xFF;
				switch (esc) {
					case '"', '\\', '/', '\'' -> sb.append((char) esc);
					case 'b' -> sb.append('\b');
					case 'f' -> sb.append('\f');
					case 'n' -> sb.append('\n');
					case 'r' -> sb.append('\r');
					case 't' -> sb.append('\t');
					case 'u' -> r = decodeUnicodeEscape(s, r, length, sb);
					default -> throw new MalformedStringException("Invalid escape: \\" + (char) esc);
				}
				runStart = r;
			} else if (c == '"') {
				throw new MalformedStringException("Unescaped quote at index " + r);
			} else if (c < 0x20) {
				throw new MalformedStringException("Unescaped control character 0x" + Integer.toHexString(c) + " at index " + r);
			} else {
				r++;
			}
		}
		appendRun(sb, s, runStart, length);
		return sb.toString();
	}

	/**
	 * @param r index just after the {@code u}
	 * @return index just after the consumed escape(s)
	 */
	private static int decodeUnicodeEscape(byte[] s, int r, int length, StringBuilder sb) throws MalformedStringException {
		int unit = hex4(s, r, length);
		if (unit == -1) {
			throw new MalformedStringException("Invalid unicode escape at index " + (r - 2));
		}
		r += 4;
		char c = (char) unit;
		if (!Character.isSurrogate(c)) {
			sb.append(c);
			return r;
		}

		if (Character.isHighSurrogate(c)
			&& r + 1 < length && s[r] == '\\' && s[r+1] == 'u'
		) {
			int next = hex4(s, r + 2, length);
			if (next != -1 && Character.isLowSurrogate((char) next)) {
				sb.appendCodePoint(Character.toCodePoint(c, (char) next));
				return r + 6;
			}
		}

		// Not part of a valid pair. Whatever follows is decoded on its own.
		sb.append(REPLACEMENT_CHAR);
		return r;
	}

	/**
	 * @return the value of the four hex digits at {@code start}, or -1 if there aren't four
	 */
	private static int hex4(byte[] s, int start, int length) {
		if (start + 4 > length) {
			return -1;
		}
		int value = 0;
		for (int i = start; i < start + 4; i++) {
			int b = s[i] & 0xFF;
			int digit = (b < 0x80) ? Character.digit(b, 16) : -1;
			if (digit == -1) {
				return -1;
			}
			value = (value << 4) | digit;
		}
		return value;
	}

	private static void appendRun(StringBuilder sb, byte[] s, int start, int stop) {
		if (stop > start) {
			sb.append(new String(s, start, stop - start, UTF_8));
		}
	}

	static final class MalformedStringException extends Exception {
		MalformedStringException(String message) {
			super(message);
		}
	}
}
