package org.drawtime.model;

import java.util.List;

/**
 * A single-wire signal with a start value and a list of changes in declaration order.
 *
 * @param name The raw label.
 * @param label The segmented label.
 * @param startValue The value before the first change.
 * @param changes The declared changes, in the order they were written.
 */
public record LineSignal(String name, LabelSegments label, Value startValue, List<SignalChange> changes) implements Signal {

    public LineSignal {
        if (!SignalKind.LINE.accepts(startValue)) {
            throw new IllegalArgumentException("Illegal line value: " + startValue);
        }
        changes = List.copyOf(changes);
    }

    @Override
    public SignalKind kind() {
        return SignalKind.LINE;
    }
}
