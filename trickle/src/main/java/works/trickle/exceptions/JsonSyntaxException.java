package works.trickle.exceptions;

/**
 * The input text is not valid JSON: a delimiter or value starter
 * was not what the grammar expected at that point.
 */
public final class JsonSyntaxException extends JsonParseException {
	private final int offendingByte;

	public JsonSyntaxException(String detail, int offendingByte, int line, int position, long offset) {
		super(detail, line, position, offset);
		this.offendingByte = offendingByte;
	}

	/**
	 * @return the byte found where something else was expected, or -1 if not applicable
	 */
	public int offendingByte() {
		return offendingByte;
	}
}
