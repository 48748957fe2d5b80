package org.drawtime.timeline;

import org.drawtime.model.Value;

/**
 * The signal takes {@code value} at {@code time} and holds it until the next event.
 *
 * @param time The instant of the event.
 * @param value The value from that instant on.
 */
public record TimelineEvent(int time, Value value) {
}
