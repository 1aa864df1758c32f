package works.trickle.exceptions;

/**
 * A string's contents could not be decoded:
 * a malformed escape sequence or an unescaped control character.
 * The cause, if any, describes exactly what was wrong.
 */
public final class JsonEscapeException extends JsonParseException {
	public static final String DETAIL = "unable to decode string into a valid UTF-8 string";

	public JsonEscapeException(Throwable cause, int line, int position, long offset) {
		super(DETAIL, line, position, offset, cause);
	}
}
