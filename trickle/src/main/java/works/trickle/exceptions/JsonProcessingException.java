package works.trickle.exceptions;

/**
 * An unexpected error has occurred in the parsing machinery itself.
 * <p>
 * This does not indicate a problem with the input JSON, but rather that
 * something unexpected has gone wrong, such as the parser thread dying.
 * A correctly written parser would not throw this exception.
 */
public final class JsonProcessingException extends JsonException {
	public JsonProcessingException(String message, Throwable cause) {
		super(message, cause);
	}
}
