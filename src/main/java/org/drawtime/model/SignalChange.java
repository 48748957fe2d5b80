package org.drawtime.model;

/**
 * A declared change of a line or bus signal.
 *
 * @param time The instant at which the signal takes the new value.
 * @param value The new value.
 */
public record SignalChange(int time, Value value) {
}
