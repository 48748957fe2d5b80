package org.drawtime.render.draw;

import org.drawtime.model.Value;
import org.drawtime.timeline.ResolvedTimeline;
import org.drawtime.timeline.TimelineEvent;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the segment merging and transition widths used by {@link WaveformPainter}.
 */
@Tag("unit")
class WaveformPainterTest {

    @Test
    void equalConsecutiveValuesAreMerged() {
        ResolvedTimeline timeline = new ResolvedTimeline(0, 100, List.of(
                new TimelineEvent(0, Value.ONE),
                new TimelineEvent(20, Value.ONE),
                new TimelineEvent(40, Value.data("A")),
                new TimelineEvent(60, Value.data("A")),
                new TimelineEvent(80, Value.data("B"))));

        List<WaveformPainter.Segment> segments = WaveformPainter.merge(timeline);

        assertThat(segments).containsExactly(
                new WaveformPainter.Segment(Value.ONE, 0, 40),
                new WaveformPainter.Segment(Value.data("A"), 40, 80),
                new WaveformPainter.Segment(Value.data("B"), 80, 100));
    }

    /**
     * A transition spans half the delay on each side of the change unless a neighbouring change is
     * closer than that; the window edges do not shorten it.
     */
    @Test
    void transitionsShrinkBetweenCloseChanges() {
        List<WaveformPainter.Segment> segments = List.of(
                new WaveformPainter.Segment(Value.ZERO, 0, 2),
                new WaveformPainter.Segment(Value.ONE, 2, 50),
                new WaveformPainter.Segment(Value.ZERO, 50, 54),
                new WaveformPainter.Segment(Value.ONE, 54, 100));

        double[] half = WaveformPainter.halfWidths(segments, 10);

        assertThat(half[1]).isEqualTo(5.0);
        assertThat(half[2]).isEqualTo(2.0);
        assertThat(half[3]).isEqualTo(2.0);
    }

    @Test
    void zeroDelayGivesVerticalEdges() {
        List<WaveformPainter.Segment> segments = List.of(
                new WaveformPainter.Segment(Value.ZERO, 0, 30),
                new WaveformPainter.Segment(Value.ONE, 30, 100));

        assertThat(WaveformPainter.halfWidths(segments, 0)[1]).isZero();
    }
}
