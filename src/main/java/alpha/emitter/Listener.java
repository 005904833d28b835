package alpha.emitter;

/**
 * A receiver of events.<p>
 *
 * The listener is invoked synchronously by the thread emitting the event, with
 * the context that was bound at the time of registration and the arguments
 * given to the emit method.
 *
 * <pre>
 *   Listener greeter = (ctx, args) -{@literal >}
 *           System.out.println("Hello " + args[0]);
 *   emitter.on("greet", greeter);
 * </pre>
 *
 * The listener is stored by reference, and removal of a listener is based on
 * reference identity. Two lambdas with the same body are two different
 * listeners. To be able to remove a listener, keep the reference:
 *
 * <pre>
 *   // Registered, but can never be removed
 *   emitter.on("greet", (ctx, args) -{@literal >} {});
 *
 *   // Removable
 *   Listener l = (ctx, args) -{@literal >} {};
 *   emitter.on("greet", l);
 *   emitter.off("greet", l);
 * </pre>
 *
 * @see EventEmitter
 */
@FunctionalInterface
public interface Listener
{
    /**
     * Receive an event.<p>
     *
     * The arguments array is shared by all listeners of the same emission and
     * must not be modified.
     *
     * @param context bound at registration, or the emitter itself if none was
     *        given (never {@code null})
     * @param args emitted with the event (never {@code null}, may be empty,
     *        elements may be {@code null})
     */
    void onEvent(Object context, Object... args);
}
