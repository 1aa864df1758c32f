package works.trickle.exceptions;

/**
 * The parse could not be completed.
 * Carries the cursor coordinates at the point of failure:
 * the line (1-based) and the position within that line (0-based)
 * of the last byte consumed, plus the absolute byte offset in the input.
 * <p>
 * These are never thrown out of the parser. They are delivered to the consumer
 * in the terminal {@link works.trickle.codec.JsonEvent.EndOfStream EndOfStream} event.
 */
public sealed abstract class JsonParseException extends JsonException permits
	JsonSyntaxException,
	UnexpectedEndOfInputException,
	JsonEscapeException,
	JsonNumberFormatException,
	JsonSourceException
{
	private final String detail;
	private final int line;
	private final int position;
	private final long offset;

	protected JsonParseException(String detail, int line, int position, long offset) {
		super(render(detail, line, position));
		this.detail = detail;
		this.line = line;
		this.position = position;
		this.offset = offset;
	}

	protected JsonParseException(String detail, int line, int position, long offset, Throwable cause) {
		super(render(detail, line, position), cause);
		this.detail = detail;
		this.line = line;
		this.position = position;
		this.offset = offset;
	}

	/**
	 * @return the diagnostic without location information, like {@code expected : but got x}
	 */
	public String detail() {
		return detail;
	}

	public int line() {
		return line;
	}

	public int position() {
		return position;
	}

	/**
	 * @return the number of bytes consumed from the start of the input, across all documents
	 */
	public long offset() {
		return offset;
	}

	private static String render(String detail, int line, int position) {
		return detail + " (line " + line + ", position " + position + ")";
	}
}
