package alpha.emitter;

import java.util.Optional;

/**
 * An opaque event key.<p>
 *
 * Text keys are equal if they contain the same characters. A symbol on the
 * other hand is only equal to itself, so two components may both use a symbol
 * described as "close" without the risk of observing each other's events.
 *
 * <pre>
 *   static final Symbol CLOSED = Symbol.of("closed");
 *   ...
 *   emitter.on(CLOSED, listener);
 * </pre>
 *
 * The description has no effect on equality. It is only used by
 * {@link #toString()}.
 */
public final class Symbol
{
    /**
     * Creates a new symbol without a description.
     *
     * @return a new symbol
     */
    public static Symbol of() {
        return new Symbol(null);
    }

    /**
     * Creates a new symbol.
     *
     * @param description of symbol (may be {@code null})
     *
     * @return a new symbol
     */
    public static Symbol of(String description) {
        return new Symbol(description);
    }

    private final String description;

    private Symbol(String description) {
        this.description = description;
    }

    /**
     * Returns the description.
     *
     * @return the description (never {@code null})
     */
    public Optional<String> description() {
        return Optional.ofNullable(description);
    }

    /**
     * Returns a string of the form "Symbol(description)".
     *
     * @return a string of the form "Symbol(description)"
     */
    @Override
    public String toString() {
        return "Symbol(" + (description == null ? "" : description) + ")";
    }
}
