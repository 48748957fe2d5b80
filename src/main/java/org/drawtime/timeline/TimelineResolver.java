package org.drawtime.timeline;

import org.drawtime.model.BusSignal;
import org.drawtime.model.ClockSignal;
import org.drawtime.model.LineSignal;
import org.drawtime.model.Signal;
import org.drawtime.model.SignalChange;
import org.drawtime.model.TimeSettings;
import org.drawtime.model.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Produces the {@link ResolvedTimeline} of a signal for a diagram's time window.
 * <p>
 * Declared changes are ordered by time; when two changes share a time the one declared last wins.
 * Clock transitions are generated from the clock's length, duty cycle and offset. The transition
 * delay plays no part here; it only affects drawing.
 */
public final class TimelineResolver {

    private TimelineResolver() {}

    /**
     * Resolves the timeline of a signal.
     *
     * @param signal The signal.
     * @param time The time window.
     * @return The signal's states within the window.
     */
    public static ResolvedTimeline resolve(Signal signal, TimeSettings time) {
        if (signal instanceof ClockSignal clock) {
            return resolveClock(clock, time.start(), time.end());
        }
        if (signal instanceof LineSignal line) {
            return resolveChanges(line.startValue(), line.changes(), time.start(), time.end());
        }
        if (signal instanceof BusSignal bus) {
            return resolveChanges(bus.startValue(), bus.changes(), time.start(), time.end());
        }
        throw new IllegalArgumentException("Unsupported signal: " + signal);
    }

    static ResolvedTimeline resolveChanges(Value startValue, List<SignalChange> changes, int start, int end) {
        // TreeMap orders by time; put() keeps the last declaration for a repeated time.
        TreeMap<Integer, Value> byTime = new TreeMap<>();
        for (SignalChange change : changes) {
            byTime.put(change.time(), change.value());
        }

        Map.Entry<Integer, Value> atStart = byTime.floorEntry(start);
        Value initial = atStart != null ? atStart.getValue() : startValue;

        List<TimelineEvent> events = new ArrayList<>();
        events.add(new TimelineEvent(start, initial));
        for (Map.Entry<Integer, Value> change : byTime.subMap(start, false, end, true).entrySet()) {
            events.add(new TimelineEvent(change.getKey(), change.getValue()));
        }
        return new ResolvedTimeline(start, end, events);
    }

    static ResolvedTimeline resolveClock(ClockSignal clock, int start, int end) {
        long length = clock.length();
        long high = clock.highLength();
        long offset = clock.offset();

        long phase = Math.floorMod(start - offset, length);
        List<TimelineEvent> events = new ArrayList<>();
        events.add(new TimelineEvent(start, phase < high ? Value.ONE : Value.ZERO));

        long cycleStart = start - phase;
        while (cycleStart <= end) {
            long fall = cycleStart + high;
            if (cycleStart > start) {
                events.add(new TimelineEvent((int) cycleStart, Value.ONE));
            }
            if (high < length && fall > start && fall <= end) {
                events.add(new TimelineEvent((int) fall, Value.ZERO));
            }
            cycleStart += length;
        }
        return new ResolvedTimeline(start, end, events);
    }
}
