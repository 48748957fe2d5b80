package org.drawtime.model;

/**
 * A periodic signal. Cycle {@code n} begins at {@code offset + n * length}; the clock is high for
 * the first part of each cycle as given by {@code duty}.
 *
 * @param name The raw label.
 * @param label The segmented label.
 * @param length The cycle length, strictly positive.
 * @param duty The fraction of the cycle spent high, in (0, 1) exclusive.
 * @param offset The start of cycle zero.
 */
public record ClockSignal(String name, LabelSegments label, int length, double duty, int offset) implements Signal {

    /** The duty cycle used when a clock block does not declare one. */
    public static final double DEFAULT_DUTY = 0.5;

    // absorbs binary representation error, e.g. 0.3 * 10
    private static final double DUTY_EPSILON = 1e-9;

    public ClockSignal {
        if (length <= 0) {
            throw new IllegalArgumentException("Clock length must be positive: " + length);
        }
        if (!(duty > 0 && duty < 1)) {
            throw new IllegalArgumentException("Clock duty must be in (0, 1): " + duty);
        }
    }

    @Override
    public SignalKind kind() {
        return SignalKind.CLOCK;
    }

    /**
     * Number of time units the clock stays high in each cycle. Fractional boundaries are rounded
     * up, so an integer instant {@code t} is high exactly when
     * {@code floorMod(t - offset, length) < duty * length}.
     * A clock whose high phase covers the whole cycle never falls.
     *
     * @return The high phase length, between 1 and {@code length}.
     */
    public int highLength() {
        int high = (int) Math.ceil(duty * length - DUTY_EPSILON);
        return Math.max(1, Math.min(length, high));
    }
}
