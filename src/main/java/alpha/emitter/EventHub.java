package alpha.emitter;

/**
 * An event emitter that can be used to programmatically emit events. Also
 * commonly referred to on the internet as an "event bus".<p>
 *
 * An event hub can be used as a middleman to decouple the producer of events
 * from the consumer. Neither needs to know about the other, only about the
 * hub and the event keys.
 *
 * <pre>
 *   EventHub hub = new {@link DefaultEventHub}();
 *   hub.on("greet", (ctx, args) -{@literal >} System.out.println("Hello " + args[0]));
 *   hub.emit("greet", "Alice");
 * </pre>
 *
 * @see EventEmitter
 */
public interface EventHub extends EventEmitter
{
    /**
     * Synchronously emits an event to registered listeners.<p>
     *
     * The listeners are invoked in the order they were registered, with the
     * given arguments. A once-listener is removed right before it is invoked.
     * If a listener throws an exception, it propagates to the caller of this
     * method, and the remaining listeners are not invoked.
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
     *
     * @see EventEmitter
     */
    boolean emit(Object event, Object... args);
}
