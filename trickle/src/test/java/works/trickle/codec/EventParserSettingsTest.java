package works.trickle.codec;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.SequenceInputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import works.trickle.TestUtils;
import works.trickle.codec.JsonEvent.EndOfStream;
import works.trickle.codec.JsonEvent.IntegerValue;
import works.trickle.codec.ParserSettings.CoordinateMode;
import works.trickle.exceptions.JsonParseException;
import works.trickle.exceptions.JsonSourceException;
import works.trickle.exceptions.JsonSyntaxException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.trickle.TestUtils.utf8;
import static works.trickle.codec.JsonEvent.ARRAY_END;
import static works.trickle.codec.JsonEvent.ARRAY_START;
import static works.trickle.codec.JsonEvent.OBJECT_END;
import static works.trickle.codec.JsonEvent.OBJECT_START;
import static works.trickle.codec.ParserSettings.CoordinateMode.PER_DOCUMENT;
import static works.trickle.codec.ParserSettings.CoordinateMode.STREAM_ABSOLUTE;

class EventParserSettingsTest {

	@Test
	void defaults() {
		ParserSettings settings = ParserSettings.defaults();
		assertEquals(1000, settings.maxDepth());
		assertEquals(PER_DOCUMENT, settings.coordinateMode());
		assertTrue(settings.extendedWhitespace());
		assertFalse(settings.prefetch());
		assertEquals(Duration.ofMillis(100), settings.cancellationPollInterval());
	}

	@Test
	void toBuilderPreservesEverything() {
		ParserSettings original = ParserSettings.builder()
			.maxDepth(5)
			.coordinateMode(STREAM_ABSOLUTE)
			.extendedWhitespace(false)
			.chunkSize(123)
			.prefetch(true)
			.cancellationPollInterval(Duration.ofMillis(7))
			.build();
		ParserSettings copy = original.toBuilder().build();
		assertNotSame(original, copy);
		assertEquals(original.toString(), copy.toString());
		assertSame(ParserSettings.defaults(), ParserSettings.defaults());
	}

	@Test
	void invalidSettings() {
		assertThrows(IllegalArgumentException.class, () -> ParserSettings.builder().maxDepth(0));
		assertThrows(IllegalArgumentException.class, () -> ParserSettings.builder().chunkSize(0));
		assertThrows(IllegalArgumentException.class, () -> ParserSettings.builder().cancellationPollInterval(Duration.ZERO));
		assertThrows(NullPointerException.class, () -> ParserSettings.builder().coordinateMode(null));
	}

	@Test
	void perDocumentCoordinates() {
		JsonParseException e = errorFor("{}\n[]\n\n  {f}", PER_DOCUMENT);
		assertEquals(1, e.line());
		assertEquals(2, e.position());
		assertEquals(11, e.offset());
	}

	@Test
	void streamAbsoluteCoordinates() {
		JsonParseException e = errorFor("{}\n[]\n\n  {f}", STREAM_ABSOLUTE);
		assertEquals(4, e.line());
		assertEquals(4, e.position());
		assertEquals(11, e.offset());
	}

	@Test
	void coordinateModeDoesNotAffectEvents() {
		String json = "{}\n[1]\n{}";
		assertEquals(
			TestUtils.successfulEvents(parser(utf8(json), settings(PER_DOCUMENT))),
			TestUtils.successfulEvents(parser(utf8(json), settings(STREAM_ABSOLUTE))));
	}

	@Test
	void maxDepth() {
		ParserSettings settings = ParserSettings.builder().maxDepth(3).build();
		assertEquals(6, TestUtils.successfulEvents(parser(utf8("[[[]]]"), settings)).size());

		List<JsonEvent> events = TestUtils.allEvents(parser(utf8("[{\"a\": [[]]}]"), settings));
		JsonSyntaxException e = assertInstanceOf(JsonSyntaxException.class, ((EndOfStream) events.get(events.size() - 1)).error());
		assertEquals("maximum nesting depth 3 exceeded", e.detail());
		assertEquals('[', e.offendingByte());
	}

	@Test
	void depthResetsBetweenDocuments() {
		ParserSettings settings = ParserSettings.builder().maxDepth(2).build();
		List<JsonEvent> events = TestUtils.successfulEvents(parser(utf8("[[]] [[]] {\"a\":{}}"), settings));
		assertEquals(15, events.size());
	}

	static final byte[] EXTENDED_WHITESPACE = {
		'[', '1', ',', (byte) 0xA0, '2', (byte) 0x85, ']'
	};

	@Test
	void extendedWhitespaceAccepted() {
		ParserSettings settings = ParserSettings.builder().extendedWhitespace(true).build();
		assertEquals(
			List.of(ARRAY_START, new IntegerValue(1), new IntegerValue(2), ARRAY_END),
			TestUtils.successfulEvents(parser(EXTENDED_WHITESPACE, settings)));
	}

	@Test
	void extendedWhitespaceRejected() {
		ParserSettings settings = ParserSettings.builder().extendedWhitespace(false).build();
		List<JsonEvent> events = TestUtils.allEvents(parser(EXTENDED_WHITESPACE, settings));
		JsonSyntaxException e = assertInstanceOf(JsonSyntaxException.class, ((EndOfStream) events.get(events.size() - 1)).error());
		assertEquals(0xA0, e.offendingByte());
		assertEquals(4, e.position());
	}

	@Test
	void inputStreamWithPrefetching() {
		ParserSettings settings = ParserSettings.builder().prefetch(true).chunkSize(4).build();
		String json = "{\"numbers\": [1, 2, 3], \"nested\": {\"deeper\": [true, null]}} [\"next\"]";
		assertEquals(
			TestUtils.successfulEvents(EventParser.create(json)),
			TestUtils.successfulEvents(EventParser.create(new ByteArrayInputStream(utf8(json)), settings)));
	}

	@Test
	void sourceFailureInsideDocument() {
		IOException failure = new IOException("Connection reset");
		List<JsonEvent> events = TestUtils.allEvents(EventParser.create(failingAfter("[1, 2", failure)));
		assertEquals(List.of(ARRAY_START, new IntegerValue(1)), events.subList(0, 2));
		JsonSourceException e = assertInstanceOf(JsonSourceException.class, ((EndOfStream) events.get(2)).error());
		assertSame(failure, e.getCause());
		assertEquals("Connection reset", e.detail());
	}

	@Test
	void sourceFailureBetweenDocuments() {
		IOException failure = new IOException("Connection reset");
		List<JsonEvent> events = TestUtils.allEvents(EventParser.create(failingAfter("{}\n", failure)));
		assertEquals(List.of(OBJECT_START, OBJECT_END), events.subList(0, 2));
		JsonSourceException e = assertInstanceOf(JsonSourceException.class, ((EndOfStream) events.get(2)).error());
		assertSame(failure, e.getCause());
	}

	@Test
	void sourceFailureWithPrefetching() {
		IOException failure = new IOException("Disk on fire");
		ParserSettings settings = ParserSettings.builder().prefetch(true).chunkSize(2).build();
		List<JsonEvent> events = TestUtils.allEvents(EventParser.create(failingAfter("[\"abc\", ", failure), settings));
		JsonSourceException e = assertInstanceOf(JsonSourceException.class, ((EndOfStream) events.get(events.size() - 1)).error());
		assertSame(failure, e.getCause());
	}

	@Test
	void interruptBetweenDocumentsIsNotSuccess() throws InterruptedException {
		ParserSettings settings = ParserSettings.builder().prefetch(true).chunkSize(2).build();
		List<JsonEvent> events = new ArrayList<>();
		try (EventParser parser = EventParser.create(new ByteArrayInputStream(utf8("{}[1, 2, 3]")), settings)) {
			parser.parse(event -> {
				events.add(event);
				if (event == OBJECT_END) {
					Thread.currentThread().interrupt();
				}
			});
		} finally {
			Thread.interrupted();
		}
		assertEquals(List.of(OBJECT_START, OBJECT_END), events.subList(0, 2));
		assertEquals(3, events.size());
		JsonSourceException e = assertInstanceOf(JsonSourceException.class, ((EndOfStream) events.get(2)).error());
		assertInstanceOf(InterruptedIOException.class, e.getCause());
	}

	@Test
	void parserIsSingleUse() throws InterruptedException {
		try (EventParser parser = EventParser.create("[]")) {
			parser.parse(event -> { });
			assertEquals(1, parser.documentCount());
			assertThrows(IllegalStateException.class, () -> parser.parse(event -> { }));
		}
	}

	@Test
	void documentCount() throws InterruptedException {
		try (EventParser parser = EventParser.create("{} [] {\"a\": [1]} [")) {
			parser.parse(event -> { });
			assertEquals(3, parser.documentCount());
		}
	}

	static ParserSettings settings(CoordinateMode mode) {
		return ParserSettings.builder().coordinateMode(mode).build();
	}

	static EventParser parser(byte[] bytes, ParserSettings settings) {
		return EventParser.create(bytes, settings);
	}

	static JsonParseException errorFor(String json, CoordinateMode mode) {
		List<JsonEvent> events = TestUtils.allEvents(parser(utf8(json), settings(mode)));
		EndOfStream last = (EndOfStream) events.get(events.size() - 1);
		assertFalse(last.succeeded());
		return last.error();
	}

	/**
	 * @return a stream that delivers {@code json} and then throws {@code failure}
	 */
	static InputStream failingAfter(String json, IOException failure) {
		return new SequenceInputStream(new ByteArrayInputStream(utf8(json)), new InputStream() {
			@Override
			public int read() throws IOException {
				throw failure;
			}
		});
	}
}
