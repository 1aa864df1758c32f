package works.trickle.codec;

import works.trickle.exceptions.JsonParseException;

/**
 * One unit of the stream produced by {@link EventParser}.
 * <p>
 * Events that carry no data are singletons, available as constants here.
 * The others are records that compare by value.
 * Number events come in two distinct representations,
 * so {@code 10} and {@code 10.0} produce unequal events.
 */
public sealed interface JsonEvent {
	EventType type();

	JsonEvent OBJECT_START = new ObjectStart();
	JsonEvent OBJECT_KEY = new ObjectKey();
	JsonEvent OBJECT_VALUE = new ObjectValue();
	JsonEvent OBJECT_END = new ObjectEnd();
	JsonEvent ARRAY_START = new ArrayStart();
	JsonEvent ARRAY_END = new ArrayEnd();
	JsonEvent NULL_VALUE = new NullValue();

	record ObjectStart() implements JsonEvent {
		@Override public EventType type() { return EventType.OBJECT_START; }
	}

	record ObjectKey() implements JsonEvent {
		@Override public EventType type() { return EventType.OBJECT_KEY; }
	}

	record ObjectValue() implements JsonEvent {
		@Override public EventType type() { return EventType.OBJECT_VALUE; }
	}

	record ObjectEnd() implements JsonEvent {
		@Override public EventType type() { return EventType.OBJECT_END; }
	}

	record ArrayStart() implements JsonEvent {
		@Override public EventType type() { return EventType.ARRAY_START; }
	}

	record ArrayEnd() implements JsonEvent {
		@Override public EventType type() { return EventType.ARRAY_END; }
	}

	record StringValue(String value) implements JsonEvent {
		@Override public EventType type() { return EventType.STRING; }
	}

	sealed interface NumberValue extends JsonEvent {
		/**
		 * @return a {@link Long} or a {@link Double}, depending on the representation
		 */
		Number number();

		@Override default EventType type() { return EventType.NUMBER; }
	}

	record IntegerValue(long value) implements NumberValue {
		@Override public Number number() { return value; }
	}

	record FloatValue(double value) implements NumberValue {
		@Override public Number number() { return value; }
	}

	record BooleanValue(boolean value) implements JsonEvent {
		public static final BooleanValue TRUE = new BooleanValue(true);
		public static final BooleanValue FALSE = new BooleanValue(false);

		public static BooleanValue of(boolean value) {
			return value ? TRUE : FALSE;
		}

		@Override public EventType type() { return EventType.BOOLEAN; }
	}

	record NullValue() implements JsonEvent {
		@Override public EventType type() { return EventType.NULL; }
	}

	/**
	 * Always the last event.
	 *
	 * @param error why the parse stopped, or null if the input was completely parsed
	 */
	record EndOfStream(JsonParseException error) implements JsonEvent {
		private static final EndOfStream SUCCESS = new EndOfStream(null);

		public static EndOfStream success() {
			return SUCCESS;
		}

		public boolean succeeded() {
			return error == null;
		}

		@Override public EventType type() { return EventType.END_OF_STREAM; }
	}
}
