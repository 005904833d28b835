package alpha.emitter;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Small tests of {@link Bucket}.
 */
final class BucketTest
{
    private static final Listener NOOP = (ctx, args) -> {};

    private final Registration
            r1 = new Registration(NOOP, "ctx", false),
            r2 = new Registration(NOOP, "ctx", true),
            r3 = new Registration(NOOP, "ctx", false);

    @Test
    void single() {
        var b = Bucket.of(r1);
        assertThat(b.size()).isOne();
        assertThat(b.asList()).containsExactly(r1);
        assertSame(b, b.remove(r2));
        assertNull(b.remove(r1));
    }

    @Test
    void growAndShrink() {
        var one   = Bucket.of(r1);
        var two   = one.add(r2);
        var three = two.add(r3);
        assertThat(three.size()).isEqualTo(3);
        assertThat(three.asList()).containsExactly(r1, r2, r3);

        var back = three.remove(r2);
        assertThat(back.asList()).containsExactly(r1, r3);
        assertThat(back.remove(r3).asList()).containsExactly(r1);
        assertNull(back.removeIf(r -> true));
    }

    @Test
    void immutable() {
        var one = Bucket.of(r1);
        var two = one.add(r2);
        two.add(r3);
        two.remove(r1);
        assertThat(one.asList()).containsExactly(r1);
        assertThat(two.asList()).containsExactly(r1, r2);
        assertThatThrownBy(() -> two.asList().set(0, r3))
                .isExactlyInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void removeIf_nothingRemoved_returnsSame() {
        var b = Bucket.of(r1).add(r3);
        assertSame(b, b.removeIf(Registration::once));
    }

    @Test
    void removeIf_identityOfRegistration() {
        // Same listener, context and flag, still two different registrations
        var twin = new Registration(NOOP, "ctx", false);
        var b = Bucket.of(r1).add(twin).add(r1);
        assertThat(b.remove(r1).asList()).containsExactly(twin);
    }

    @Test
    void add_null() {
        assertThatThrownBy(() -> Bucket.of(null))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Bucket.of(r1).add(null))
                .isExactlyInstanceOf(NullPointerException.class);
    }

    @Test
    void registration_matches() {
        Listener other = (ctx, args) -> {};
        assertThat(r1.matches(NOOP, null, false)).isTrue();
        assertThat(r1.matches(other, null, false)).isFalse();
        assertThat(r1.matches(NOOP, "ctx", false)).isTrue();
        assertThat(r1.matches(NOOP, new String("ctx"), false)).isFalse();
        assertThat(r1.matches(NOOP, null, true)).isFalse();
        assertThat(r2.matches(NOOP, null, true)).isTrue();
    }

    @Test
    void registration_toString() {
        assertThat(r2.toString())
                .startsWith("Registration{listener=")
                .endsWith(", context=ctx, once=true}");
    }
}
