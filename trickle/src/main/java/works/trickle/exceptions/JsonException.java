package works.trickle.exceptions;

public sealed abstract class JsonException extends RuntimeException permits JsonParseException, JsonProcessingException {
	protected JsonException(String message) {
		super(message);
	}

	protected JsonException(String message, Throwable cause) {
		super(message, cause);
	}
}
