package works.trickle.codec.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import works.trickle.exceptions.JsonEscapeException;
import works.trickle.exceptions.JsonNumberFormatException;
import works.trickle.exceptions.JsonParseException;
import works.trickle.exceptions.JsonSourceException;
import works.trickle.exceptions.JsonSyntaxException;
import works.trickle.exceptions.UnexpectedEndOfInputException;

/**
 * Reads bytes one at a time from a {@link ChunkFiller}, with one byte of push-back,
 * keeping track of where we are for diagnostics.
 * <p>
 * {@link #line()} and {@link #position()} always describe the last byte consumed:
 * the line is 1-based, and the position counts the bytes consumed so far on that line,
 * so it is 0 before anything is read and right after a newline.
 * <p>
 * Calling {@link #close()} will close the underlying filler.
 */
public final class ByteCursor implements AutoCloseable {
	public static final int END = -1;

	private final ChunkFiller filler;
	private final boolean extendedWhitespace;

	/**
	 * Null before the first chunk is requested and after the input is exhausted.
	 */
	private ByteChunk currentChunk;

	/**
	 * Always between currentChunk.start() and currentChunk.stop(), inclusive.
	 * If equal to currentChunk.stop(), then the next byte
	 * to be read is in the next chunk (which may not exist).
	 */
	private int currentChunkPos;

	private boolean exhausted = false;
	private IOException sourceFailure;

	private long offset = 0;
	private int line = 1;
	private int position = 0;

	// Push-back state
	private boolean canPushBack = false;
	private boolean lastAdvanceCrossedNewline = false;
	private int previousLinePosition;

	public ByteCursor(ChunkFiller filler, boolean extendedWhitespace) {
		this.filler = filler;
		this.extendedWhitespace = extendedWhitespace;
	}

	/**
	 * @return the next byte as a value from 0 to 255, or {@link #END}
	 * if the input is exhausted or the source has failed.
	 */
	public int advance() {
		if (!ensureAvailable()) {
			canPushBack = false;
			return END;
		}

		int b = currentChunk.bytes()[currentChunkPos++] & 0xFF;
		offset++;
		canPushBack = true;
		if (b == '\n') {
			previousLinePosition = position;
			line++;
			position = 0;
			lastAdvanceCrossedNewline = true;
		} else {
			position++;
			lastAdvanceCrossedNewline = false;
		}
		return b;
	}

	/**
	 * Un-consumes the byte returned by the last {@link #advance()},
	 * restoring {@link #line()} and {@link #position()} to what they were before it.
	 *
	 * @throws IllegalStateException unless the last operation was an {@link #advance()}
	 * that returned a byte
	 */
	public void pushBack() {
		if (!canPushBack) {
			throw new IllegalStateException("Can only push back a single byte that was just read");
		}
		canPushBack = false;

		// The byte just read is always in the current chunk,
		// because we only move to the next chunk when we need its first byte.
		assert currentChunkPos > currentChunk.start();
		currentChunkPos--;
		offset--;
		if (lastAdvanceCrossedNewline) {
			line--;
			position = previousLinePosition;
		} else {
			position--;
		}
	}

	/**
	 * @return the first byte that isn't whitespace, or {@link #END}
	 */
	public int skipWhitespace() {
		int b = advance();
		while (Util.isWhitespace(b, extendedWhitespace)) {
			b = advance();
		}
		return b;
	}

	/**
	 * Starts counting lines and positions over, as though we were at the start of the input.
	 * {@link #offset()} is unaffected.
	 */
	public void resetCoordinates() {
		line = 1;
		position = 0;
		canPushBack = false;
		lastAdvanceCrossedNewline = false;
	}

	public int line() {
		return line;
	}

	public int position() {
		return position;
	}

	/**
	 * @return number of bytes consumed since the start of the input
	 */
	public long offset() {
		return offset;
	}

	/**
	 * @return the failure that ended the input, or null if it ended normally or hasn't ended
	 */
	public IOException sourceFailure() {
		return sourceFailure;
	}

	/**
	 * The appropriate exception when the input runs out while we still need more:
	 * usually {@link UnexpectedEndOfInputException}, but if the input ran out
	 * because the source failed, that failure is reported instead.
	 */
	public JsonParseException unexpectedEnd() {
		if (sourceFailure != null) {
			return new JsonSourceException(sourceFailure, line, position, offset);
		}
		return new UnexpectedEndOfInputException(line, position, offset);
	}

	public JsonSyntaxException syntaxError(String detail, int offendingByte) {
		return new JsonSyntaxException(detail, offendingByte, line, position, offset);
	}

	JsonEscapeException escapeError(Throwable cause) {
		return new JsonEscapeException(cause, line, position, offset);
	}

	JsonNumberFormatException numberError(NumberFormatException cause) {
		return new JsonNumberFormatException(cause, line, position, offset);
	}

	/**
	 * @return true if {@link #currentChunk} has at least one byte left to read
	 */
	private boolean ensureAvailable() {
		while (currentChunk == null || currentChunkPos >= currentChunk.stop()) {
			if (exhausted) {
				return false;
			}
			if (currentChunk != null) {
				filler.recycleChunk(currentChunk);
				currentChunk = null;
			}

			ByteChunk next;
			try {
				next = filler.nextChunk();
			} catch (UncheckedIOException e) {
				sourceFailure = e.getCause();
				exhausted = true;
				return false;
			}

			if (next == null) {
				exhausted = true;
				return false;
			}
			currentChunk = next;
			currentChunkPos = next.start();
		}
		return true;
	}

	@Override
	public void close() {
		filler.close();
	}
}
