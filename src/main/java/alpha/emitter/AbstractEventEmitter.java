package alpha.emitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.TRACE;
import static java.util.Objects.requireNonNull;

/**
 * A synchronous implementation of {@link EventEmitter} servicing the subclass
 * with a protected {@link #emit(Object, Object...)} method.<p>
 *
 * The implementation is backed by a {@code Map} of event keys to an ordered
 * bucket of listener registrations. An event without listeners has no entry
 * in the map.<p>
 *
 * Implementations that know in advance what events will be emitted ought to
 * override {@link #supports(Object)}.<p>
 *
 * This class is not thread-safe.
 */
public abstract class AbstractEventEmitter implements EventEmitter
{
    private static final System.Logger LOG
            = System.getLogger(AbstractEventEmitter.class.getPackageName());

    // Insertion order is the order of eventNames()
    private final Map<Object, Bucket> listeners;

    /**
     * Constructs an emitter without listeners.
     */
    protected AbstractEventEmitter() {
        listeners = new LinkedHashMap<>();
    }

    /**
     * Synchronously emit an event to registered listeners.<p>
     *
     * Listeners are invoked in the order they were registered. The set of
     * listeners invoked is fixed when this method is called, except that a
     * once-listener no longer registered by the time its turn comes is
     * skipped.<p>
     *
     * An exception thrown by a listener propagates to the caller of this
     * method and the remaining listeners are not invoked.
     *
     * @param event key
     * @param args to give the listeners (elements may be {@code null},
     *        a {@code null} array is one {@code null} argument)
     *
     * @return {@code true} if the event had listeners, otherwise {@code false}
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}
     */
    protected boolean emit(Object event, Object... args) {
        if (args == null) {
            // emit(event, null)
            args = new Object[]{null};
        }
        final Object key = toKey(event);
        final Bucket snapshot = listeners.get(key);
        if (snapshot == null) {
            return false;
        }
        for (Registration r : snapshot.asList()) {
            if (r.once()) {
                if (!consume(key, r)) {
                    // Already consumed by a re-entrant emission, or removed
                    continue;
                }
                LOG.log(TRACE, () -> "Consumed once-listener of " + key + ": " + r.listener());
            }
            r.invoke(args);
        }
        return true;
    }

    /**
     * Returns {@code true} if the event type is known to be emitted, otherwise
     * {@code false}, in which case an {@code IllegalArgumentException} will be
     * thrown by the registering methods.<p>
     *
     * The implementation in this class always returns true.
     *
     * @param event key (never {@code null}, a {@code String} or a {@code Symbol})
     *
     * @return {@code true} if the event is known to be emitted,
     *         otherwise {@code false}
     */
    protected boolean supports(Object event) {
        return true;
    }

    @Override
    public EventEmitter addListener(Object event, Listener listener, Object context, boolean once) {
        final Object key = toKey(event);
        if (listener == null) {
            throw new IllegalArgumentException("The listener must be a function.");
        }
        if (!supports(key)) {
            throw new IllegalArgumentException("Event is not supported: " + key);
        }
        var r = new Registration(listener, context == null ? this : context, once);
        listeners.merge(key, Bucket.of(r), (old, ignored) -> old.add(r));
        LOG.log(TRACE, () -> "Added listener of " + key + ": " + r);
        return this;
    }

    @Override
    public EventEmitter removeListener(Object event, Listener listener, Object context, boolean onceOnly) {
        final Object key = toKey(event);
        if (listener == null) {
            return removeAllListeners(key);
        }
        final Bucket old = listeners.get(key);
        if (old == null) {
            return this;
        }
        final Bucket now = old.removeIf(r -> r.matches(listener, context, onceOnly));
        if (now != old) {
            replace(key, now);
            LOG.log(DEBUG, () -> "Removed " + (old.size() - (now == null ? 0 : now.size())) +
                    " listener(s) of " + key);
        }
        return this;
    }

    @Override
    public EventEmitter removeAllListeners(Object event) {
        final Object key = toKey(event);
        final Bucket old = listeners.remove(key);
        if (old != null) {
            LOG.log(DEBUG, () -> "Removed all " + old.size() + " listener(s) of " + key);
        }
        return this;
    }

    @Override
    public EventEmitter removeAllListeners() {
        if (!listeners.isEmpty()) {
            final int n = listeners.size();
            listeners.clear();
            LOG.log(DEBUG, () -> "Removed all listeners of " + n + " event(s)");
        }
        return this;
    }

    @Override
    public List<Object> eventNames() {
        if (listeners.isEmpty()) {
            return List.of();
        }
        var texts = new ArrayList<Object>(listeners.size());
        var symbols = new ArrayList<Object>();
        for (Object k : listeners.keySet()) {
            (k instanceof Symbol ? symbols : texts).add(k);
        }
        texts.addAll(symbols);
        return Collections.unmodifiableList(texts);
    }

    @Override
    public List<Listener> listeners(Object event) {
        final Bucket b = listeners.get(toKey(event));
        if (b == null) {
            return List.of();
        }
        var l = new ArrayList<Listener>(b.size());
        for (Registration r : b.asList()) {
            l.add(r.listener());
        }
        return Collections.unmodifiableList(l);
    }

    @Override
    public int listenerCount(Object event) {
        final Bucket b = listeners.get(toKey(event));
        return b == null ? 0 : b.size();
    }

    /**
     * Removes a once-registration from the live bucket.
     *
     * @param key of event
     * @param r registration to remove (reference identity)
     *
     * @return {@code true} if removed,
     *         {@code false} if the registration was not found
     */
    private boolean consume(Object key, Registration r) {
        final Bucket old = listeners.get(key);
        if (old == null) {
            return false;
        }
        final Bucket now = old.remove(r);
        if (now == old) {
            return false;
        }
        replace(key, now);
        return true;
    }

    private void replace(Object key, Bucket bucket) {
        if (bucket == null) {
            listeners.remove(key);
        } else {
            listeners.put(key, bucket);
        }
    }

    /**
     * Returns the map key of the given event.
     *
     * @param event key as given by the application
     *
     * @return a {@code String} or a {@code Symbol}
     *
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code event} is not a {@code CharSequence} nor a {@code Symbol}
     */
    private static Object toKey(Object event) {
        requireNonNull(event, "event");
        if (event instanceof Symbol) {
            return event;
        }
        if (event instanceof CharSequence) {
            return event.toString();
        }
        throw new IllegalArgumentException(
                "Event must be a CharSequence or a Symbol, was: " + event.getClass().getName());
    }
}
