package works.trickle.codec.io;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.SequenceInputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class OverlappedPrefetchingChunkFillerTest {
	static final int CHUNK_SIZE = 16;

	@Test
	@Order(1) // If this doesn't work, we're pretty hosed
	void eof() {
		byte[] data = new byte[0];
		try (ChunkFiller prefetcher = new OverlappedPrefetchingChunkFiller(new ByteArrayInputStream(data))) {
			assertNull(prefetcher.nextChunk());
			assertNull(prefetcher.nextChunk(), "EOF is sticky");
		}
	}

	@Test
	void singleSmallBuffer() {
		// Two full chunks plus one byte
		var ones = "1".repeat(CHUNK_SIZE);
		var twos = "2".repeat(CHUNK_SIZE);
		byte[] data = (ones + twos + "4").getBytes(UTF_8);
		try (ChunkFiller prefetcher = new OverlappedPrefetchingChunkFiller(new ByteArrayInputStream(data), CHUNK_SIZE, 1)) {
			ByteChunk buf1 = prefetcher.nextChunk();
			assertEquals(CHUNK_SIZE, buf1.length());
			assertArrayEquals(ones.getBytes(UTF_8), Arrays.copyOfRange(buf1.bytes(), buf1.start(), buf1.stop()));
			prefetcher.recycleChunk(buf1);

			ByteChunk buf2 = prefetcher.nextChunk();
			assertEquals(CHUNK_SIZE, buf2.length());
			assertEquals(twos, new String(buf2.bytes(), buf2.start(), buf2.length(), UTF_8));
			prefetcher.recycleChunk(buf2);

			ByteChunk buf3 = prefetcher.nextChunk();
			assertEquals(1, buf3.length());
			assertEquals("4", new String(buf3.bytes(), buf3.start(), buf3.length(), UTF_8));
			prefetcher.recycleChunk(buf3);

			assertNull(prefetcher.nextChunk());
		}
	}

	@Test
	void multipleTinyBuffers() {
		int numChunks = 100;
		byte[] data = "abcdef".repeat(numChunks).getBytes(UTF_8);
		try (ChunkFiller prefetcher = new OverlappedPrefetchingChunkFiller(new ByteArrayInputStream(data), 6, 3)) {
			for (int i = 0; i < numChunks; i++) {
				ByteChunk buf = prefetcher.nextChunk();
				assertEquals(6, buf.length());
				assertArrayEquals("abcdef".getBytes(UTF_8), Arrays.copyOfRange(buf.bytes(), buf.start(), buf.stop()));
				prefetcher.recycleChunk(buf);
			}
			assertNull(prefetcher.nextChunk());
		}
	}

	@Test
	void recycleAllowsReuse() {
		var xs = "x".repeat(CHUNK_SIZE);
		var ys = "y".repeat(CHUNK_SIZE);
		byte[] data = (xs+ys).getBytes(UTF_8);
		try (ChunkFiller prefetcher = new OverlappedPrefetchingChunkFiller(new ByteArrayInputStream(data), CHUNK_SIZE, 1)) {
			ByteChunk buf1 = prefetcher.nextChunk();
			assertEquals(CHUNK_SIZE, buf1.length());
			assertArrayEquals(xs.getBytes(UTF_8), Arrays.copyOfRange(buf1.bytes(), buf1.start(), buf1.stop()));
			prefetcher.recycleChunk(buf1);

			ByteChunk buf2 = prefetcher.nextChunk();
			assertSame(buf1.bytes(), buf2.bytes());
			assertEquals(CHUNK_SIZE, buf2.length());
			assertEquals(ys, new String(buf2.bytes(), buf2.start(), buf2.length(), UTF_8));
			prefetcher.recycleChunk(buf2);

			assertNull(prefetcher.nextChunk());
		}
	}

	@Test
	void readFailureFollowsEarlierChunks() {
		IOException failure = new IOException("Simulated read failure");
		InputStream failing = new SequenceInputStream(
			new ByteArrayInputStream("good".getBytes(UTF_8)),
			new InputStream() {
				@Override
				public int read() throws IOException {
					throw failure;
				}
			});
		try (ChunkFiller prefetcher = new OverlappedPrefetchingChunkFiller(failing, CHUNK_SIZE, 2)) {
			ByteChunk buf = prefetcher.nextChunk();
			assertEquals("good", new String(buf.bytes(), buf.start(), buf.length(), UTF_8));
			prefetcher.recycleChunk(buf);

			UncheckedIOException e = assertThrows(UncheckedIOException.class, prefetcher::nextChunk);
			assertSame(failure, e.getCause());
			assertThrows(UncheckedIOException.class, prefetcher::nextChunk, "Failure is sticky");
		}
	}

	@Test
	void interruptIsNotEndOfInput() {
		byte[] data = "abc".getBytes(UTF_8);
		try (ChunkFiller prefetcher = new OverlappedPrefetchingChunkFiller(new ByteArrayInputStream(data), CHUNK_SIZE, 1)) {
			Thread.currentThread().interrupt();
			UncheckedIOException e = assertThrows(UncheckedIOException.class, prefetcher::nextChunk);
			assertInstanceOf(InterruptedIOException.class, e.getCause());
			assertTrue(Thread.interrupted(), "Interrupt flag should be preserved");

			ByteChunk buf = prefetcher.nextChunk();
			assertEquals("abc", new String(buf.bytes(), buf.start(), buf.length(), UTF_8));
		} finally {
			Thread.interrupted();
		}
	}

	@Test
	void invalidArguments() {
		ByteArrayInputStream in = new ByteArrayInputStream(new byte[0]);
		assertThrows(IllegalArgumentException.class, () -> new OverlappedPrefetchingChunkFiller(in, 0, 1));
		assertThrows(IllegalArgumentException.class, () -> new OverlappedPrefetchingChunkFiller(in, 1, 0));
	}
}
