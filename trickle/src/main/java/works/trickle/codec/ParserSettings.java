package works.trickle.codec;

import java.time.Duration;
import works.trickle.codec.io.SynchronousChunkFiller;

import static java.util.Objects.requireNonNull;

public final class ParserSettings {
	private final int maxDepth;
	private final CoordinateMode coordinateMode;
	private final boolean extendedWhitespace;
	private final int chunkSize;
	private final boolean prefetch;
	private final Duration cancellationPollInterval;

	/**
	 * How {@link works.trickle.exceptions.JsonParseException#line() line}
	 * and {@link works.trickle.exceptions.JsonParseException#position() position}
	 * are counted when the input contains more than one top-level value.
	 */
	public enum CoordinateMode {
		/**
		 * Each top-level value starts again at line 1, position 0.
		 */
		PER_DOCUMENT,

		/**
		 * Lines and positions count from the start of the input.
		 */
		STREAM_ABSOLUTE,
	}

	private ParserSettings(Builder b) {
		this.maxDepth = b.maxDepth;
		this.coordinateMode = b.coordinateMode;
		this.extendedWhitespace = b.extendedWhitespace;
		this.chunkSize = b.chunkSize;
		this.prefetch = b.prefetch;
		this.cancellationPollInterval = b.cancellationPollInterval;
	}

	public static ParserSettings defaults() {
		return DEFAULTS;
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder()
			.maxDepth(maxDepth)
			.coordinateMode(coordinateMode)
			.extendedWhitespace(extendedWhitespace)
			.chunkSize(chunkSize)
			.prefetch(prefetch)
			.cancellationPollInterval(cancellationPollInterval);
	}

	/**
	 * @return the deepest nesting of objects and arrays that will be parsed.
	 * Anything deeper is a syntax error.
	 */
	public int maxDepth() {
		return maxDepth;
	}

	public CoordinateMode coordinateMode() {
		return coordinateMode;
	}

	/**
	 * @return whether the bytes 0x85 and 0xA0 are skipped as whitespace.
	 * They aren't whitespace in standard JSON.
	 */
	public boolean extendedWhitespace() {
		return extendedWhitespace;
	}

	/**
	 * @return number of bytes requested from an {@link java.io.InputStream} at a time
	 */
	public int chunkSize() {
		return chunkSize;
	}

	/**
	 * @return whether an {@link java.io.InputStream} is read by a background thread
	 * while parsing proceeds
	 */
	public boolean prefetch() {
		return prefetch;
	}

	/**
	 * @return how long a blocked parser waits between checks for cancellation
	 */
	public Duration cancellationPollInterval() {
		return cancellationPollInterval;
	}

	@Override
	public String toString() {
		return "ParserSettings(maxDepth=" + maxDepth
			+ ", coordinateMode=" + coordinateMode
			+ ", extendedWhitespace=" + extendedWhitespace
			+ ", chunkSize=" + chunkSize
			+ ", prefetch=" + prefetch
			+ ", cancellationPollInterval=" + cancellationPollInterval + ")";
	}

	public static class Builder {
		private int maxDepth = 1000;
		private CoordinateMode coordinateMode = CoordinateMode.PER_DOCUMENT;
		private boolean extendedWhitespace = true;
		private int chunkSize = SynchronousChunkFiller.DEFAULT_CHUNK_SIZE;
		private boolean prefetch = false;
		private Duration cancellationPollInterval = Duration.ofMillis(100);

		Builder() { }

		public Builder maxDepth(int maxDepth) {
			if (maxDepth < 1) {
				throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
			}
			this.maxDepth = maxDepth;
			return this;
		}

		public Builder coordinateMode(CoordinateMode coordinateMode) {
			this.coordinateMode = requireNonNull(coordinateMode);
			return this;
		}

		public Builder extendedWhitespace(boolean extendedWhitespace) {
			this.extendedWhitespace = extendedWhitespace;
			return this;
		}

		public Builder chunkSize(int chunkSize) {
			if (chunkSize < 1) {
				throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
			}
			this.chunkSize = chunkSize;
			return this;
		}

		public Builder prefetch(boolean prefetch) {
			this.prefetch = prefetch;
			return this;
		}

		public Builder cancellationPollInterval(Duration cancellationPollInterval) {
			if (cancellationPollInterval.isNegative() || cancellationPollInterval.isZero()) {
				throw new IllegalArgumentException("cancellationPollInterval must be positive: " + cancellationPollInterval);
			}
			this.cancellationPollInterval = cancellationPollInterval;
			return this;
		}

		public ParserSettings build() {
			return new ParserSettings(this);
		}
	}

	private static final ParserSettings DEFAULTS = new Builder().build();
}
