package org.drawtime.render.layout;

import org.drawtime.model.Signal;

/**
 * The horizontal band occupied by one signal.
 *
 * @param signal The signal drawn in this row.
 * @param labelCell The part of the row inside the label column.
 * @param waveformCell The part of the row inside the plot area.
 */
public record SignalRow(Signal signal, Rect labelCell, Rect waveformCell) {
}
