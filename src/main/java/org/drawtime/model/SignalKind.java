package org.drawtime.model;

/**
 * The three kinds of signal blocks.
 */
public enum SignalKind {
    /** A single wire carrying 0, 1, Z or ?. */
    LINE("line"),
    /** A multi-bit bus carrying quoted words, Z or ?. */
    BUS("bus"),
    /** A periodic line generated from length, duty cycle and offset. */
    CLOCK("clock");

    private final String keyword;

    SignalKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return The header keyword introducing a block of this kind.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Checks whether a value may be held by a signal of this kind.
     * Bus words are bus-only; logic levels are reserved for lines and clocks.
     *
     * @param value The value to check.
     * @return {@code true} if the value is legal for this kind.
     */
    public boolean accepts(Value value) {
        if (value instanceof Value.Data) {
            return this == BUS;
        }
        if (value instanceof Value.Zero || value instanceof Value.One) {
            return this != BUS;
        }
        return true;
    }
}
