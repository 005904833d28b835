package alpha.emitter;

/**
 * A listener registered with an emitter.<p>
 *
 * Each call to a registering method creates a new registration, even if the
 * listener is already registered. The class does not override {@code equals}
 * and so two registrations are equal only if they are the same object.
 */
final class Registration
{
    private final Listener listener;
    private final Object context;
    private final boolean once;

    Registration(Listener listener, Object context, boolean once) {
        assert listener != null;
        assert context != null;
        this.listener = listener;
        this.context  = context;
        this.once     = once;
    }

    Listener listener() {
        return listener;
    }

    Object context() {
        return context;
    }

    boolean once() {
        return once;
    }

    /**
     * Returns {@code true} if this registration is selected by the given
     * removal criteria.
     *
     * @param listener must be the same reference
     * @param context must be the same reference, unless {@code null}
     * @param onceOnly if {@code true}, this must be a once-registration
     *
     * @return {@code true} if this registration matches
     */
    boolean matches(Listener listener, Object context, boolean onceOnly) {
        return this.listener == listener &&
               (context == null || this.context == context) &&
               (!onceOnly || once);
    }

    void invoke(Object[] args) {
        listener.onEvent(context, args);
    }

    @Override
    public String toString() {
        return Registration.class.getSimpleName() + "{" +
                "listener=" + listener +
                ", context=" + context() +
                ", once=" + once + "}";
    }
}
