package works.trickle.exceptions;

/**
 * The input ended while a value was still incomplete.
 * <p>
 * Running out of input right after a complete top-level value is not an error.
 */
public final class UnexpectedEndOfInputException extends JsonParseException {
	public static final String DETAIL = "unexpected end of file";

	public UnexpectedEndOfInputException(int line, int position, long offset) {
		super(DETAIL, line, position, offset);
	}
}
