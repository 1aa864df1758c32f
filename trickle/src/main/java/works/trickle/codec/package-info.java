/**
 * Event-driven JSON parsing.
 * <p>
 * {@link works.trickle.codec.EventParser} reads JSON text and produces a flat sequence of
 * {@link works.trickle.codec.JsonEvent}s describing its structure,
 * delivering them to an {@link works.trickle.codec.EventSink} as it goes.
 * Use {@link works.trickle.codec.EventStream} to run the parser on its own thread
 * and pull events from it like an iterator.
 */
package works.trickle.codec;
