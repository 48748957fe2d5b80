package org.drawtime.timeline;

import org.drawtime.model.BusSignal;
import org.drawtime.model.ClockSignal;
import org.drawtime.model.LabelSegment;
import org.drawtime.model.LabelSegments;
import org.drawtime.model.LineSignal;
import org.drawtime.model.SignalChange;
import org.drawtime.model.TimeSettings;
import org.drawtime.model.Value;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link TimelineResolver}.
 */
@Tag("unit")
public class TimelineResolverTest {

    private static final LabelSegments LABEL = new LabelSegments(List.of(new LabelSegment("S", false)));

    private static TimeSettings window(int start, int end) {
        return new TimeSettings(start, end, null, 10);
    }

    private static LineSignal line(Value start, SignalChange... changes) {
        return new LineSignal("S", LABEL, start, List.of(changes));
    }

    private static SignalChange change(int time, Value value) {
        return new SignalChange(time, value);
    }

    @Test
    void testLineScenario() {
        ResolvedTimeline timeline = TimelineResolver.resolve(
                line(Value.ZERO, change(100, Value.ONE), change(150, Value.FLOATING)), window(0, 200));

        assertThat(timeline.events()).containsExactly(
                new TimelineEvent(0, Value.ZERO),
                new TimelineEvent(100, Value.ONE),
                new TimelineEvent(150, Value.FLOATING));
    }

    /**
     * Verifies ordering of unsorted changes and that a repeated time keeps the value declared last.
     */
    @Test
    void testUnsortedAndDuplicateChanges() {
        ResolvedTimeline timeline = TimelineResolver.resolve(
                line(Value.UNKNOWN, change(30, Value.ONE), change(10, Value.ZERO), change(30, Value.FLOATING)),
                window(0, 100));

        assertThat(timeline.events()).containsExactly(
                new TimelineEvent(0, Value.UNKNOWN),
                new TimelineEvent(10, Value.ZERO),
                new TimelineEvent(30, Value.FLOATING));
    }

    /**
     * Verifies clipping: the state at the window start comes from the last change before it, and
     * changes after the end are dropped.
     */
    @Test
    void testClippingToWindow() {
        ResolvedTimeline timeline = TimelineResolver.resolve(
                line(Value.ZERO, change(-5, Value.ONE), change(20, Value.ZERO), change(50, Value.ONE), change(80, Value.ZERO)),
                window(10, 50));

        assertThat(timeline.events()).containsExactly(
                new TimelineEvent(10, Value.ONE),
                new TimelineEvent(20, Value.ZERO),
                new TimelineEvent(50, Value.ONE));
    }

    @Test
    void testChangeAtWindowStartDefinesInitialState() {
        ResolvedTimeline timeline = TimelineResolver.resolve(line(Value.ZERO, change(0, Value.ONE)), window(0, 10));

        assertThat(timeline.events()).containsExactly(new TimelineEvent(0, Value.ONE));
    }

    /**
     * Checks, for every instant of the window, that the resolved state equals the last declared
     * change at or before it, or the start value if there is none.
     */
    @Test
    void testLineStateMatchesLastDeclaredChange() {
        List<SignalChange> changes = List.of(change(70, Value.ONE), change(15, Value.FLOATING),
                change(40, Value.ZERO), change(15, Value.ONE), change(95, Value.UNKNOWN));
        LineSignal signal = new LineSignal("S", LABEL, Value.ZERO, changes);
        ResolvedTimeline timeline = TimelineResolver.resolve(signal, window(-20, 120));

        for (int t = -20; t <= 120; t++) {
            Value expected = Value.ZERO;
            int latest = Integer.MIN_VALUE;
            for (SignalChange c : changes) {
                if (c.time() <= t && c.time() >= latest) {
                    latest = c.time();
                    expected = c.value();
                }
            }
            assertThat(timeline.valueAt(t)).as("t=%d", t).isEqualTo(expected);
        }
    }

    @Test
    void testBusKeepsDataValues() {
        BusSignal bus = new BusSignal("B", LABEL, Value.FLOATING,
                List.of(new SignalChange(5, Value.data("A")), new SignalChange(9, Value.data("B"))));

        ResolvedTimeline timeline = TimelineResolver.resolve(bus, window(0, 10));

        assertThat(timeline.events()).extracting(TimelineEvent::value)
                .containsExactly(Value.FLOATING, Value.data("A"), Value.data("B"));
    }

    @Test
    void testClockEvents() {
        ClockSignal clock = new ClockSignal("C", LABEL, 10, 0.5, 0);

        ResolvedTimeline timeline = TimelineResolver.resolve(clock, window(0, 30));

        assertThat(timeline.events()).containsExactly(
                new TimelineEvent(0, Value.ONE),
                new TimelineEvent(5, Value.ZERO),
                new TimelineEvent(10, Value.ONE),
                new TimelineEvent(15, Value.ZERO),
                new TimelineEvent(20, Value.ONE),
                new TimelineEvent(25, Value.ZERO),
                new TimelineEvent(30, Value.ONE));
    }

    /**
     * Verifies that the state at the window start follows from the clock phase.
     */
    @Test
    void testClockPhaseAtWindowStart() {
        ClockSignal clock = new ClockSignal("C", LABEL, 8, 0.25, 3);

        ResolvedTimeline timeline = TimelineResolver.resolve(clock, window(0, 12));

        assertThat(timeline.events()).containsExactly(
                new TimelineEvent(0, Value.ZERO),
                new TimelineEvent(3, Value.ONE),
                new TimelineEvent(5, Value.ZERO),
                new TimelineEvent(11, Value.ONE));
    }

    /**
     * Checks that the clock is high at {@code t} exactly when {@code (t - offset) mod length} lies in
     * {@code [0, duty * length)}, for several shapes including negative offsets and windows.
     */
    @Test
    void testClockStateMatchesPhase() {
        int[][] shapes = {{10, 0}, {7, 3}, {12, -5}, {3, 100}, {1, 0}};
        double[] duties = {0.5, 0.3, 0.01, 0.99, 0.75};
        for (int[] shape : shapes) {
            for (double duty : duties) {
                int length = shape[0];
                int offset = shape[1];
                ClockSignal clock = new ClockSignal("C", LABEL, length, duty, offset);
                ResolvedTimeline timeline = TimelineResolver.resolve(clock, window(-37, 64));

                for (int t = -37; t <= 64; t++) {
                    long phase = Math.floorMod(t - offset, length);
                    boolean high = phase < duty * length;
                    assertThat(timeline.valueAt(t))
                            .as("length=%d duty=%s offset=%d t=%d", length, duty, offset, t)
                            .isEqualTo(high ? Value.ONE : Value.ZERO);
                }
            }
        }
    }

    @Test
    void testEventsAreStrictlyIncreasing() {
        ClockSignal clock = new ClockSignal("C", LABEL, 4, 0.5, 1);

        ResolvedTimeline timeline = TimelineResolver.resolve(clock, window(-9, 9));

        List<TimelineEvent> events = timeline.events();
        assertThat(events.get(0).time()).isEqualTo(-9);
        for (int i = 1; i < events.size(); i++) {
            assertThat(events.get(i).time()).isGreaterThan(events.get(i - 1).time());
            assertThat(events.get(i).time()).isLessThanOrEqualTo(9);
        }
    }
}
