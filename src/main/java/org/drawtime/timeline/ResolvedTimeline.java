package org.drawtime.timeline;

import org.drawtime.model.Value;

import java.util.List;

/**
 * The chronological states of one signal within a time window.
 * <p>
 * The first event is always at {@code start} and carries the state in force there. Event times are
 * strictly increasing and lie within {@code [start, end]}. Each value holds until the next event,
 * and the last one until {@code end}.
 *
 * @param start The window start.
 * @param end The window end.
 * @param events The events, never empty.
 */
public record ResolvedTimeline(int start, int end, List<TimelineEvent> events) {

    public ResolvedTimeline {
        events = List.copyOf(events);
        if (events.isEmpty() || events.get(0).time() != start) {
            throw new IllegalArgumentException("A timeline starts with an event at the window start");
        }
        for (int i = 1; i < events.size(); i++) {
            if (events.get(i).time() <= events.get(i - 1).time()) {
                throw new IllegalArgumentException("Timeline events must be strictly increasing in time");
            }
        }
        if (events.get(events.size() - 1).time() > end) {
            throw new IllegalArgumentException("Timeline events must not lie after the window end");
        }
    }

    /**
     * Looks up the state at an instant within the window.
     *
     * @param time An instant in {@code [start, end]}.
     * @return The value of the last event at or before {@code time}.
     */
    public Value valueAt(int time) {
        if (time < start || time > end) {
            throw new IllegalArgumentException("Time " + time + " is outside [" + start + ", " + end + "]");
        }
        Value value = events.get(0).value();
        for (TimelineEvent event : events) {
            if (event.time() > time) {
                break;
            }
            value = event.value();
        }
        return value;
    }

    /**
     * @param index An event index.
     * @return The instant the event's value stops holding: the next event's time, or {@code end}.
     */
    public int segmentEnd(int index) {
        return index + 1 < events.size() ? events.get(index + 1).time() : end;
    }
}
