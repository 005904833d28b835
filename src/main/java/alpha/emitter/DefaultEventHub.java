package alpha.emitter;

/**
 * Default implementation of {@link EventHub}.<p>
 *
 * The behavior of this class is documented in {@link EventEmitter}.
 */
public class DefaultEventHub extends AbstractEventEmitter implements EventHub
{
    /**
     * Constructs an event hub without listeners.
     */
    public DefaultEventHub() {
        // Empty
    }

    @Override
    public boolean emit(Object event, Object... args) {
        return super.emit(event, args);
    }
}
