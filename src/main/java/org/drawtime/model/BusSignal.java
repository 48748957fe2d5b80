package org.drawtime.model;

import java.util.List;

/**
 * A bus signal with a start value and a list of changes in declaration order.
 *
 * @param name The raw label.
 * @param label The segmented label.
 * @param startValue The value before the first change.
 * @param changes The declared changes, in the order they were written.
 */
public record BusSignal(String name, LabelSegments label, Value startValue, List<SignalChange> changes) implements Signal {

    public BusSignal {
        if (!SignalKind.BUS.accepts(startValue)) {
            throw new IllegalArgumentException("Illegal bus value: " + startValue);
        }
        changes = List.copyOf(changes);
    }

    @Override
    public SignalKind kind() {
        return SignalKind.BUS;
    }
}
