package works.trickle.codec;

/**
 * The kind of a {@link JsonEvent}.
 */
public enum EventType {
	OBJECT_START,

	/**
	 * Marks that the next {@link #STRING} event is a member name.
	 */
	OBJECT_KEY,

	/**
	 * Marks that the next event begins a member's value.
	 */
	OBJECT_VALUE,

	OBJECT_END,
	ARRAY_START,
	ARRAY_END,
	STRING,
	NUMBER,
	BOOLEAN,
	NULL,
	END_OF_STREAM;

	/**
	 * @return the type of the event that a value starting with the given byte would produce,
	 * or null if no value can start with it.
	 */
	public static EventType startingWith(int b) {
		return switch (b) {
			case '"' -> STRING;
			case 't', 'f' -> BOOLEAN;
			case 'n' -> NULL;
			case '{' -> OBJECT_START;
			case '[' -> ARRAY_START;
			case '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', '-', '+' -> NUMBER;
			default -> null;
		};
	}
}
