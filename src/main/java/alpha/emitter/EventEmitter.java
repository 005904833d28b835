package alpha.emitter;

import java.util.List;

/**
 * Emits events as they happen, to which, event listeners may come and go.<p>
 *
 * An event is identified by a key, which is either a text or a {@link Symbol}.
 * Any {@code CharSequence} is accepted as a text key and converted to a
 * {@code String}; "greet" and {@code new StringBuilder("greet")} are the same
 * event. A symbol is only equal to itself. Other types of keys are not
 * accepted. The emission may carry with it any number of arguments, which are
 * arbitrary objects passed as-is to the {@link Listener}.
 *
 * <pre>
 *   class ShoppingCart extends {@link AbstractEventEmitter} {
 *       static final Symbol ITEM_ADDED = Symbol.of("item added");
 *       public void addItem(Item thing) {
 *           this.doStuff();
 *           super.emit(ITEM_ADDED, thing);
 *       }
 *   }
 *   // somewhere else
 *   Inventory inv = ...
 *   someCart.on(ShoppingCart.ITEM_ADDED, (cart, args) -{@literal >} inv.reserve((Item) args[0]));
 * </pre>
 *
 * Events can be used to decouple components and to simplify the architecture,
 * e.g. as an alternative to callback arguments. But, events can also make code
 * traceability harder. Events should never be a replacement of what would
 * otherwise have been a simple method call.<p>
 *
 * The {@code EventEmitter} interface does not declare a public "emit()"
 * method. How exactly the implementation emits events is an implementation
 * detail, and, in general, it really shouldn't be done by other components
 * than the class itself. Implementations can extend {@link AbstractEventEmitter}
 * and application code that wish to utilize a centralized distribution source
 * can emit and observe events through an {@link EventHub}.<p>
 *
 * <strong>The remaining JavaDoc</strong> describes the emitters provided by
 * this library. A custom implementation is free to behave differently.<p>
 *
 * Events are not saved. A new listener does not receive past events.<p>
 *
 * The thread emitting the event is also the thread that invokes the listeners
 * of the event, one after the other, in the order they were registered.<p>
 *
 * The emitter is not thread-safe. If more than one thread use the same
 * emitter, then access must be serialized by the application.<p>
 *
 * Duplicates are allowed. Registering the same listener twice creates two
 * registrations, and the listener is invoked twice per emission.<p>
 *
 * Each registration has a context, which is given to the listener when
 * invoked. If no context is given at the time of registration, then the
 * context is the emitter itself.<p>
 *
 * A listener registered using one of the {@code once} methods is removed right
 * before it is invoked by an emission, and so it will be invoked at most one
 * time, even if the listener itself emits the same event again.<p>
 *
 * An emission iterates over the listeners registered at the time the emission
 * began. A listener registered during the emission is not invoked by it. A
 * listener removed during the emission is still invoked by it, unless it was a
 * once-listener.<p>
 *
 * There is no special handling/logic concerning exceptions. If a listener
 * throws an exception, then that exception will propagate up the call stack and
 * remaining listeners in the call chain will miss out on the event.<p>
 *
 * References are kept using strong references (not weak, soft or whatever
 * else).
 *
 * @see Listener
 */
public interface EventEmitter
{
    /**
     * Registers a listener.<p>
     *
     * This is the method all other registering methods delegate to.
     *
     * @param event key
     * @param listener receiver of events
     * @param context given to the listener (if {@code null}, the emitter)
     * @param once if {@code true}, remove the listener on first emission
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code listener} is {@code null}, or
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}, or
     *             if {@code event} is known to never be emitted
     */
    EventEmitter addListener(Object event, Listener listener, Object context, boolean once);

    /**
     * Registers a listener.<p>
     *
     * Equivalent to {@link #on(Object, Listener)}.
     *
     * @param event key
     * @param listener receiver of events
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code listener} is {@code null}, or
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}, or
     *             if {@code event} is known to never be emitted
     */
    default EventEmitter addListener(Object event, Listener listener) {
        return addListener(event, listener, null, false);
    }

    /**
     * Registers a listener.
     *
     * @param event key
     * @param listener receiver of events
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code listener} is {@code null}, or
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}, or
     *             if {@code event} is known to never be emitted
     */
    default EventEmitter on(Object event, Listener listener) {
        return addListener(event, listener, null, false);
    }

    /**
     * Registers a listener with a context.
     *
     * @param event key
     * @param listener receiver of events
     * @param context given to the listener (if {@code null}, the emitter)
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code listener} is {@code null}, or
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}, or
     *             if {@code event} is known to never be emitted
     */
    default EventEmitter on(Object event, Listener listener, Object context) {
        return addListener(event, listener, context, false);
    }

    /**
     * Registers a listener that is removed on first emission.
     *
     * @param event key
     * @param listener receiver of the event
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code listener} is {@code null}, or
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}, or
     *             if {@code event} is known to never be emitted
     */
    default EventEmitter once(Object event, Listener listener) {
        return addListener(event, listener, null, true);
    }

    /**
     * Registers a listener with a context, that is removed on first emission.
     *
     * @param event key
     * @param listener receiver of the event
     * @param context given to the listener (if {@code null}, the emitter)
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code listener} is {@code null}, or
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}, or
     *             if {@code event} is known to never be emitted
     */
    default EventEmitter once(Object event, Listener listener, Object context) {
        return addListener(event, listener, context, true);
    }

    /**
     * Removes all listeners of an event.<p>
     *
     * Equivalent to {@link #removeAllListeners(Object)}.
     *
     * @param event key
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}
     */
    default EventEmitter removeListener(Object event) {
        return removeAllListeners(event);
    }

    /**
     * Removes all registrations of a listener.
     *
     * @param event key
     * @param listener to remove (same reference as registered)
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}
     */
    default EventEmitter removeListener(Object event, Listener listener) {
        return removeListener(event, listener, null, false);
    }

    /**
     * Removes all registrations of a listener with a given context.
     *
     * @param event key
     * @param listener to remove (same reference as registered)
     * @param context of registration (same reference as registered),
     *        or {@code null} for any context
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}
     */
    default EventEmitter removeListener(Object event, Listener listener, Object context) {
        return removeListener(event, listener, context, false);
    }

    /**
     * Removes all registrations matching the given criteria.<p>
     *
     * A registration is removed if the listener is the same reference as the
     * one given, and, if a context is given, the context is the same reference
     * as the one given, and, if {@code onceOnly} is {@code true}, the
     * registration was made using one of the {@code once} methods.<p>
     *
     * The order of the remaining registrations is not changed.<p>
     *
     * If {@code listener} is {@code null}, then all listeners of the event are
     * removed and the other arguments have no effect.<p>
     *
     * It is not an error if there is nothing to remove.
     *
     * @param event key
     * @param listener to remove (same reference as registered)
     * @param context of registration (same reference as registered),
     *        or {@code null} for any context
     * @param onceOnly if {@code true}, only remove once-registrations
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}
     */
    EventEmitter removeListener(Object event, Listener listener, Object context, boolean onceOnly);

    /**
     * Equivalent to {@link #removeListener(Object)}.
     *
     * @param event key
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}
     */
    default EventEmitter off(Object event) {
        return removeListener(event);
    }

    /**
     * Equivalent to {@link #removeListener(Object, Listener)}.
     *
     * @param event key
     * @param listener to remove (same reference as registered)
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}
     */
    default EventEmitter off(Object event, Listener listener) {
        return removeListener(event, listener);
    }

    /**
     * Equivalent to {@link #removeListener(Object, Listener, Object)}.
     *
     * @param event key
     * @param listener to remove (same reference as registered)
     * @param context of registration, or {@code null} for any context
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}
     */
    default EventEmitter off(Object event, Listener listener, Object context) {
        return removeListener(event, listener, context);
    }

    /**
     * Equivalent to {@link #removeListener(Object, Listener, Object, boolean)}.
     *
     * @param event key
     * @param listener to remove (same reference as registered)
     * @param context of registration, or {@code null} for any context
     * @param onceOnly if {@code true}, only remove once-registrations
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}
     */
    default EventEmitter off(Object event, Listener listener, Object context, boolean onceOnly) {
        return removeListener(event, listener, context, onceOnly);
    }

    /**
     * Removes all listeners of an event.<p>
     *
     * It is not an error if the event has no listeners.
     *
     * @param event key
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}
     */
    EventEmitter removeAllListeners(Object event);

    /**
     * Removes all listeners of all events.
     *
     * @return this for chaining/fluency
     */
    EventEmitter removeAllListeners();

    /**
     * Returns the keys of all events that have at least one listener.<p>
     *
     * Text keys come first, then symbols. Within each group, the keys are
     * ordered by the time their first listener was registered.<p>
     *
     * The returned list is a snapshot.
     *
     * @return keys of all events that have at least one listener
     *         (never {@code null}, unmodifiable)
     */
    List<Object> eventNames();

    /**
     * Returns the listeners of an event, in the order they will be invoked.<p>
     *
     * A listener registered twice occurs twice.<p>
     *
     * The returned list is a snapshot.
     *
     * @param event key
     *
     * @return the listeners of an event (never {@code null}, unmodifiable)
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}
     */
    List<Listener> listeners(Object event);

    /**
     * Returns the number of listeners of an event.<p>
     *
     * The returned count is always equal to the size of the list returned from
     * {@link #listeners(Object)}.
     *
     * @param event key
     *
     * @return the number of listeners of an event
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}
     */
    int listenerCount(Object event);
}
