/**
 * The byte-level layer of the parser.
 * {@link works.trickle.codec.io.ChunkFiller ChunkFiller} implementations supply the input in chunks,
 * {@link works.trickle.codec.io.ByteCursor ByteCursor} reads it a byte at a time with line and position tracking,
 * and {@link works.trickle.codec.io.ScalarLexer ScalarLexer} turns it into scalar values.
 * None of this is meant to be used directly;
 * instead, use {@link works.trickle.codec.EventParser},
 * which calls this layer to do the IO but provides a much more useful API.
 */
package works.trickle.codec.io;
