package alpha.emitter;

import alpha.emitter.testutil.LogRecorder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.TRACE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Small tests of {@link AbstractEventEmitter}.
 */
final class AbstractEventEmitterTest
{
    private static final Symbol OPENED = Symbol.of("opened");

    /** Emits only {@code OPENED}. */
    private static final class Door extends AbstractEventEmitter {
        void open() {
            emit(OPENED, this);
        }

        @Override
        protected boolean supports(Object event) {
            return event == OPENED;
        }
    }

    LogRecorder log;

    @BeforeEach
    void startRecording() {
        log = LogRecorder.startRecording();
    }

    @AfterEach
    void stopRecording() {
        log.stopRecording();
    }

    @Test
    void supported() {
        var door = new Door();
        Listener l = mock(Listener.class);
        door.on(OPENED, l);
        door.open();
        verify(l).onEvent(door, door);
    }

    @Test
    void unsupported() {
        var door = new Door();
        assertThatThrownBy(() -> door.on("closed", mock(Listener.class)))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Event is not supported: closed");
        assertThat(door.eventNames()).isEmpty();
    }

    @Test
    void unsupported_removalIsNoop() {
        var door = new Door();
        door.off("closed");
        door.off(Symbol.of("closed"), mock(Listener.class));
        assertThat(door.listenerCount("closed")).isZero();
    }

    @Test
    void log_addAndConsume() {
        var hub = new DefaultEventHub();
        hub.once("k", (ctx, args) -> {});
        hub.emit("k");
        assertThat(log.messages(TRACE))
                .hasSize(2)
                .satisfiesExactly(
                    m -> assertThat(m).startsWith("Added listener of k: Registration{"),
                    m -> assertThat(m).startsWith("Consumed once-listener of k: "));
        log.assertNoProblem();
    }

    @Test
    void log_removed() {
        var hub = new DefaultEventHub();
        Listener l = (ctx, args) -> {};
        hub.on("k", l).on("k", l).on("k", (ctx, args) -> {});
        hub.off("k", l);
        hub.off("k", l);
        log.assertContainsOnlyOnce(DEBUG, "Removed 2 listener(s) of k");
        hub.removeAllListeners("k");
        log.assertRemove(DEBUG, "Removed all 1 listener(s) of k");
        hub.on("a", l).on(Symbol.of("b"), l);
        hub.removeAllListeners();
        hub.removeAllListeners();
        log.assertContainsOnlyOnce(DEBUG, "Removed all listeners of 2 event(s)")
           .assertNoProblem();
    }
}
