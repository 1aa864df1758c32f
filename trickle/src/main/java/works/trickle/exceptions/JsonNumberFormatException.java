package works.trickle.exceptions;

/**
 * A numeric literal could not be parsed as the representation its text calls for.
 */
public final class JsonNumberFormatException extends JsonParseException {
	public JsonNumberFormatException(NumberFormatException cause, int line, int position, long offset) {
		super(String.valueOf(cause.getMessage()), line, position, offset, cause);
	}
}
