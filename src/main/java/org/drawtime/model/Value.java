package org.drawtime.model;

import java.util.Objects;

/**
 * The state a signal can be in at a given instant.
 * <p>
 * {@link Data} only occurs on bus signals, {@link Zero} and {@link One} only on line and clock
 * signals. {@link SignalKind#accepts(Value)} is the single place where this rule lives.
 */
public sealed interface Value permits Value.Zero, Value.One, Value.Unknown, Value.Floating, Value.Data {

    /** Logic low. */
    Value ZERO = new Zero();
    /** Logic high. */
    Value ONE = new One();
    /** Value is not known (written as {@code ?}). */
    Value UNKNOWN = new Unknown();
    /** High impedance (written as {@code Z}). */
    Value FLOATING = new Floating();

    /**
     * Logic low.
     */
    record Zero() implements Value {
        @Override
        public String toString() {
            return "0";
        }
    }

    /**
     * Logic high.
     */
    record One() implements Value {
        @Override
        public String toString() {
            return "1";
        }
    }

    /**
     * Unknown state.
     */
    record Unknown() implements Value {
        @Override
        public String toString() {
            return "?";
        }
    }

    /**
     * Floating (high impedance) state.
     */
    record Floating() implements Value {
        @Override
        public String toString() {
            return "Z";
        }
    }

    /**
     * A bus word, displayed verbatim inside the bus band.
     *
     * @param text The text shown for this value.
     */
    record Data(String text) implements Value {
        public Data {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String toString() {
            return '"' + text + '"';
        }
    }

    /**
     * Creates a bus data value.
     *
     * @param text The displayed text.
     * @return A new {@link Data} value.
     */
    static Value data(String text) {
        return new Data(text);
    }
}
