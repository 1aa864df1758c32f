package works.trickle.codec;

import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.trickle.codec.JsonEvent.BooleanValue;
import works.trickle.codec.JsonEvent.EndOfStream;
import works.trickle.codec.JsonEvent.StringValue;
import works.trickle.codec.io.ByteArrayChunkFiller;
import works.trickle.codec.io.ByteCursor;
import works.trickle.codec.io.ChunkFiller;
import works.trickle.codec.io.OverlappedPrefetchingChunkFiller;
import works.trickle.codec.io.ScalarLexer;
import works.trickle.codec.io.SynchronousChunkFiller;
import works.trickle.exceptions.JsonParseException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static works.trickle.codec.JsonEvent.ARRAY_END;
import static works.trickle.codec.JsonEvent.ARRAY_START;
import static works.trickle.codec.JsonEvent.NULL_VALUE;
import static works.trickle.codec.JsonEvent.OBJECT_END;
import static works.trickle.codec.JsonEvent.OBJECT_KEY;
import static works.trickle.codec.JsonEvent.OBJECT_START;
import static works.trickle.codec.JsonEvent.OBJECT_VALUE;
import static works.trickle.codec.ParserSettings.CoordinateMode.PER_DOCUMENT;
import static works.trickle.codec.io.ByteCursor.END;
import static works.trickle.codec.io.Util.printable;

/**
 * Turns JSON text into a sequence of {@link JsonEvent}s without building the document in memory.
 * <p>
 * The input is a sequence of top-level objects and arrays, optionally separated by whitespace.
 * Each complete rule of the grammar produces one event, as soon as it's recognized.
 * For example, {@code {"foo": "bar"}} produces
 * {@code OBJECT_START, OBJECT_KEY, StringValue[foo], OBJECT_VALUE, StringValue[bar], OBJECT_END},
 * and then the stream ends with {@link EndOfStream}.
 * <p>
 * Any error stops the parse; nothing is skipped or retried.
 * The error is delivered in the {@link EndOfStream} event rather than thrown.
 * <p>
 * A parser can be used only once. Calling {@link #close()} will close the underlying source.
 */
public final class EventParser implements AutoCloseable {
	private final ParserSettings settings;
	private final ByteCursor cursor;
	private final ScalarLexer lexer;

	private EventSink sink;
	private int depth = 0;
	private long documentCount = 0;

	public EventParser(ChunkFiller filler, ParserSettings settings) {
		this.settings = requireNonNull(settings);
		this.cursor = new ByteCursor(requireNonNull(filler), settings.extendedWhitespace());
		this.lexer = new ScalarLexer(cursor);
	}

	public static EventParser create(InputStream stream) {
		return create(stream, ParserSettings.defaults());
	}

	/**
	 * The stream will be closed when the parser is closed.
	 */
	public static EventParser create(InputStream stream, ParserSettings settings) {
		ChunkFiller filler = settings.prefetch()
			? new OverlappedPrefetchingChunkFiller(stream, settings.chunkSize(), 2)
			: new SynchronousChunkFiller(stream, settings.chunkSize());
		return new EventParser(filler, settings);
	}

	/**
	 * @param utf8Bytes complete JSON text, possibly containing several top-level values
	 */
	public static EventParser create(byte[] utf8Bytes) {
		return create(utf8Bytes, ParserSettings.defaults());
	}

	/**
	 * {@link ParserSettings#chunkSize()} and {@link ParserSettings#prefetch()} don't apply here,
	 * since the whole input is already in memory.
	 */
	public static EventParser create(byte[] utf8Bytes, ParserSettings settings) {
		return new EventParser(new ByteArrayChunkFiller(utf8Bytes), settings);
	}

	public static EventParser create(String json) {
		return create(json.getBytes(UTF_8));
	}

	/**
	 * Parses the entire input on the calling thread, sending every event to {@code sink},
	 * ending with exactly one {@link EndOfStream}.
	 *
	 * @throws java.util.concurrent.CancellationException if the sink refuses an event
	 * @throws InterruptedException if interrupted while the sink is blocked
	 * @throws IllegalStateException if this parser has already been used
	 */
	public void parse(EventSink sink) throws InterruptedException {
		if (this.sink != null) {
			throw new IllegalStateException("Parser has already been used");
		}
		this.sink = requireNonNull(sink);
		LOGGER.debug("Parsing with {}", settings);

		JsonParseException error = null;
		try {
			parseStream();
		} catch (JsonParseException e) {
			LOGGER.debug("Parse failed after {} complete documents", documentCount, e);
			error = e;
		}

		LOGGER.debug("Parsed {} documents, {} bytes", documentCount, cursor.offset());
		emit((error == null) ? EndOfStream.success() : new EndOfStream(error));
	}

	ParserSettings settings() {
		return settings;
	}

	/**
	 * @return number of top-level values parsed completely so far
	 */
	public long documentCount() {
		return documentCount;
	}

	private void parseStream() throws InterruptedException {
		int b = cursor.skipWhitespace();
		if (b == END) {
			throw cursor.unexpectedEnd();
		}

		while (true) {
			switch (b) {
				case '{' -> {
					cursor.pushBack();
					parseObject();
				}
				case '[' -> {
					cursor.pushBack();
					parseArray();
				}
				default -> throw cursor.syntaxError("unexpected character " + printable(b), b);
			}
			documentCount++;

			// End of input is fine here, since we've just finished a value
			b = cursor.skipWhitespace();
			if (b == END) {
				if (cursor.sourceFailure() != null) {
					throw cursor.unexpectedEnd();
				}
				return;
			}

			if (settings.coordinateMode() == PER_DOCUMENT) {
				cursor.pushBack();
				cursor.resetCoordinates();
				b = cursor.advance();
			}
		}
	}

	private void parseObject() throws InterruptedException {
		int b = cursor.skipWhitespace();
		if (b == END) {
			throw cursor.unexpectedEnd();
		} else if (b != '{') {
			throw cursor.syntaxError("expected { but got " + printable(b), b);
		}

		enterContainer(b);
		emit(OBJECT_START);

		b = cursor.skipWhitespace();
		if (b == END) {
			throw cursor.unexpectedEnd();
		} else if (b == '}') {
			exitContainer();
			emit(OBJECT_END);
			return;
		}
		cursor.pushBack();

		while (true) {
			emit(OBJECT_KEY);
			emit(new StringValue(lexer.readString()));

			b = cursor.skipWhitespace();
			if (b == END) {
				throw cursor.unexpectedEnd();
			} else if (b != ':') {
				throw cursor.syntaxError("expected : but got " + printable(b), b);
			}

			emit(OBJECT_VALUE);
			parseValue();

			b = cursor.skipWhitespace();
			if (b == END) {
				throw cursor.unexpectedEnd();
			} else if (b == '}') {
				break;
			} else if (b != ',') {
				throw cursor.syntaxError("expected , but got " + printable(b), b);
			}
		}

		exitContainer();
		emit(OBJECT_END);
	}

	private void parseArray() throws InterruptedException {
		int b = cursor.skipWhitespace();
		if (b == END) {
			throw cursor.unexpectedEnd();
		} else if (b != '[') {
			throw cursor.syntaxError("expected [ but got " + printable(b), b);
		}

		enterContainer(b);
		emit(ARRAY_START);

		b = cursor.skipWhitespace();
		if (b == END) {
			throw cursor.unexpectedEnd();
		} else if (b == ']') {
			exitContainer();
			emit(ARRAY_END);
			return;
		}
		cursor.pushBack();

		while (true) {
			parseValue();

			b = cursor.skipWhitespace();
			if (b == END) {
				throw cursor.unexpectedEnd();
			} else if (b == ']') {
				break;
			} else if (b != ',') {
				throw cursor.syntaxError("expected , but got " + printable(b), b);
			}
		}

		exitContainer();
		emit(ARRAY_END);
	}

	private void parseValue() throws InterruptedException {
		int b = cursor.skipWhitespace();
		if (b == END) {
			throw cursor.unexpectedEnd();
		}

		EventType type = EventType.startingWith(b);
		if (type == null) {
			throw cursor.syntaxError("unexpected character " + printable(b), b);
		}
		cursor.pushBack();

		switch (type) {
			case STRING -> emit(new StringValue(lexer.readString()));
			case NUMBER -> emit(lexer.readNumber());
			case BOOLEAN -> emit(BooleanValue.of(lexer.readBoolean()));
			case NULL -> {
				lexer.readNull();
				emit(NULL_VALUE);
			}
			case OBJECT_START -> parseObject();
			case ARRAY_START -> parseArray();
			default -> throw new AssertionError("Unexpected value type " + type);
		}
	}

	private void enterContainer(int b) {
		if (++depth > settings.maxDepth()) {
			throw cursor.syntaxError("maximum nesting depth " + settings.maxDepth() + " exceeded", b);
		}
	}

	private void exitContainer() {
		--depth;
	}

	private void emit(JsonEvent event) throws InterruptedException {
		sink.accept(event);
	}

	@Override
	public void close() {
		cursor.close();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(EventParser.class);
}
