/**
 * Events are identified by a text or a {@link alpha.emitter.Symbol Symbol},
 * emitted by an {@link alpha.emitter.EventEmitter EventEmitter} and observed
 * by a {@link alpha.emitter.Listener Listener}. An {@link
 * alpha.emitter.EventHub EventHub} can be used to programmatically emit
 * events from application code.<p>
 *
 * Listeners are grouped by event key, which makes the default implementation
 * able to use a simple {@code Map} as a backing store of listeners. The lookup
 * operation is on average constant time, and an emission does not copy the
 * listeners it is about to invoke.
 */
package alpha.emitter;
