package works.trickle.codec.io;

import works.trickle.codec.JsonEvent.FloatValue;
import works.trickle.codec.JsonEvent.IntegerValue;
import works.trickle.codec.JsonEvent.NumberValue;
import works.trickle.codec.io.EscapeDecoder.MalformedStringException;

import static works.trickle.codec.io.ByteCursor.END;
import static works.trickle.codec.io.Util.printable;

/**
 * Reads the scalar values: strings, numbers, booleans and null.
 * <p>
 * Each method throws a {@link works.trickle.exceptions.JsonParseException JsonParseException}
 * located at the cursor if the input doesn't contain what it expects.
 */
public final class ScalarLexer {
	private final ByteCursor cursor;
	private final ScratchBuffer scratch = new ScratchBuffer();

	public ScalarLexer(ByteCursor cursor) {
		this.cursor = cursor;
	}

	/**
	 * Skips whitespace, then reads a complete quoted string.
	 */
	public String readString() {
		int b = cursor.skipWhitespace();
		if (b == END) {
			throw cursor.unexpectedEnd();
		}
		if (b != '"') {
			throw cursor.syntaxError("expected \" but got " + printable(b), b);
		}

		scratch.reset();
		while (true) {
			b = cursor.advance();
			if (b == END) {
				throw cursor.unexpectedEnd();
			} else if (b == '"') {
				break;
			}
			scratch.append(b);
			if (b == '\\') {
				// Whatever is escaped can't end the string
				b = cursor.advance();
				if (b == END) {
					throw cursor.unexpectedEnd();
				}
				scratch.append(b);
			}
		}

		try {
			return EscapeDecoder.decode(scratch.bytes(), scratch.length());
		} catch (MalformedStringException e) {
			throw cursor.escapeError(e);
		}
	}

	/**
	 * Reads the longest run of characters that can appear in a number.
	 * It's a {@link FloatValue} if it has a fraction or exponent,
	 * and otherwise an {@link IntegerValue}.
	 */
	public NumberValue readNumber() {
		scratch.reset();
		boolean isFloat = false;
		while (true) {
			int b = cursor.advance();
			if (b == END) {
				// Numbers only appear inside objects and arrays, so there must be more
				throw cursor.unexpectedEnd();
			} else if (b == '.' || b == 'e' || b == 'E') {
				isFloat = true;
			} else if (!Util.isNumberChar(b)) {
				cursor.pushBack();
				break;
			}
			scratch.append(b);
		}

		String text = scratch.asLatin1String();
		try {
			if (isFloat) {
				double value = Double.parseDouble(text);
				if (Double.isInfinite(value)) {
					throw new NumberFormatException("value out of range: " + text);
				}
				return new FloatValue(value);
			} else {
				return new IntegerValue(Long.parseLong(text));
			}
		} catch (NumberFormatException e) {
			throw cursor.numberError(e);
		}
	}

	public boolean readBoolean() {
		String word = readBytes(4);
		if ("true".equals(word)) {
			return true;
		} else if (!"fals".equals(word)) {
			throw cursor.syntaxError("expected true or false but got " + word, -1);
		}

		int b = cursor.advance();
		if (b == END) {
			throw cursor.unexpectedEnd();
		} else if (b != 'e') {
			throw cursor.syntaxError("expected e but got " + printable(b), b);
		}
		return false;
	}

	public void readNull() {
		String word = readBytes(4);
		if (!"null".equals(word)) {
			throw cursor.syntaxError("expected null but got " + word, -1);
		}
	}

	private String readBytes(int n) {
		scratch.reset();
		for (int i = 0; i < n; i++) {
			int b = cursor.advance();
			if (b == END) {
				throw cursor.unexpectedEnd();
			}
			scratch.append(b);
		}
		return scratch.asLatin1String();
	}
}
