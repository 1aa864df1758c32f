package works.trickle.exceptions;

import java.io.IOException;

/**
 * The byte source failed with something other than a clean end of input.
 */
public final class JsonSourceException extends JsonParseException {
	public JsonSourceException(IOException cause, int line, int position, long offset) {
		super(String.valueOf(cause.getMessage()), line, position, offset, cause);
	}

	@Override
	public synchronized IOException getCause() {
		return (IOException) super.getCause();
	}
}
