package alpha.emitter.testutil;

import alpha.emitter.DefaultEventHub;
import alpha.emitter.EventEmitter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static java.lang.System.Logger.Level.TRACE;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests of {@link LogRecorder}.
 */
final class LogRecorderTest
{
    @AfterEach
    void inherit() {
        Logging.restoreLevel(EventEmitter.class, null);
    }

    @Test
    void stopRecording_restoresLevel() {
        Logging.restoreLevel(EventEmitter.class, java.util.logging.Level.INFO);
        var rec = LogRecorder.startRecording();
        assertThat(Logging.getLevel(EventEmitter.class))
                .isEqualTo(java.util.logging.Level.ALL);
        rec.stopRecording();
        assertThat(Logging.getLevel(EventEmitter.class))
                .isEqualTo(java.util.logging.Level.INFO);
    }

    @Test
    void stopRecording_restoresInheritedLevel() {
        var rec = LogRecorder.startRecording();
        rec.stopRecording();
        assertThat(Logging.getLevel(EventEmitter.class)).isNull();

        // Not recorded anymore
        var again = LogRecorder.startRecording();
        again.stopRecording();
        new DefaultEventHub().on("k", (ctx, args) -> {});
        assertThat(again.messages(TRACE)).isEmpty();
    }
}
