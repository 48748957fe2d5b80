package org.drawtime.model;

import java.util.List;

/**
 * A complete timing diagram: one time block, one style block and the signals in file order.
 * Instances are immutable and are rebuilt from source text for every render.
 *
 * @param time The time window.
 * @param style The canvas style.
 * @param signals The signals, in declaration (and render) order.
 */
public record Diagram(TimeSettings time, StyleSettings style, List<Signal> signals) {

    public Diagram {
        signals = List.copyOf(signals);
    }
}
