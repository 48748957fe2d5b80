package org.drawtime.render.draw;

import org.drawtime.model.RgbColor;
import org.drawtime.model.SignalKind;
import org.drawtime.model.StyleSettings;
import org.drawtime.model.Value;
import org.drawtime.render.RenderOptions;
import org.drawtime.render.layout.LayoutResult;
import org.drawtime.render.layout.Rect;
import org.drawtime.render.layout.SignalRow;
import org.drawtime.render.layout.TextMetrics;
import org.drawtime.timeline.ResolvedTimeline;
import org.drawtime.timeline.TimelineEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Draws the waveform of one signal row.
 * <p>
 * Shapes are built in (time, y) coordinates, clipped to the time window and only then mapped to
 * pixel columns. A change at time {@code c} is drawn as a slope over {@code [c - h, c + h]}, where
 * {@code h} is half the transition delay, shortened to half the distance to a neighbouring change.
 * Line and clock signals are polylines at the logic levels; bus signals are hexagonal bands whose
 * pointed ends cross at every change.
 */
final class WaveformPainter {

    /**
     * A maximal run of one value.
     */
    record Segment(Value value, int from, int to) {
    }

    private final LayoutResult layout;
    private final RenderOptions options;
    private final StyleSettings style;
    private final TimeClipper clipper;

    WaveformPainter(LayoutResult layout, RenderOptions options, StyleSettings style) {
        this.layout = layout;
        this.options = options;
        this.style = style;
        this.clipper = new TimeClipper(layout.time().start(), layout.time().end());
    }

    void paint(SignalRow row, ResolvedTimeline timeline, List<DrawOp> ops) {
        List<Segment> segments = merge(timeline);
        double[] halfWidths = halfWidths(segments, layout.time().delay());
        if (row.signal().kind() == SignalKind.BUS) {
            paintBus(row.waveformCell(), segments, halfWidths, ops);
        } else {
            paintLine(row.waveformCell(), segments, halfWidths, ops);
        }
    }

    /**
     * Joins consecutive events carrying equal values, so no transition is drawn between them.
     */
    static List<Segment> merge(ResolvedTimeline timeline) {
        List<Segment> segments = new ArrayList<>();
        List<TimelineEvent> events = timeline.events();
        for (int i = 0; i < events.size(); i++) {
            TimelineEvent event = events.get(i);
            int to = timeline.segmentEnd(i);
            int last = segments.size() - 1;
            if (last >= 0 && segments.get(last).value().equals(event.value())) {
                segments.set(last, new Segment(event.value(), segments.get(last).from(), to));
            } else {
                segments.add(new Segment(event.value(), event.time(), to));
            }
        }
        return segments;
    }

    /**
     * @return For every segment after the first, the half width of the transition at its start.
     */
    static double[] halfWidths(List<Segment> segments, int delay) {
        double[] half = new double[segments.size()];
        for (int i = 1; i < segments.size(); i++) {
            double h = delay / 2.0;
            int change = segments.get(i).from();
            if (i > 1) {
                h = Math.min(h, (change - segments.get(i - 1).from()) / 2.0);
            }
            if (i < segments.size() - 1) {
                h = Math.min(h, (segments.get(i + 1).from() - change) / 2.0);
            }
            half[i] = h;
        }
        return half;
    }

    private void paintLine(Rect cell, List<Segment> segments, double[] half, List<DrawOp> ops) {
        for (int i = 0; i < segments.size(); i++) {
            Segment segment = segments.get(i);
            double y = levelOf(segment.value(), cell);
            double flatFrom = flatStart(segments, half, i);
            double flatTo = flatEnd(segments, half, i);
            if (i > 0) {
                double previousY = levelOf(segments.get(i - 1).value(), cell);
                addLine(new Point(segment.from() - half[i], previousY), new Point(segment.from() + half[i], y), 0, ops);
            }
            if (flatTo > flatFrom) {
                double dash = segment.value() instanceof Value.Unknown ? options.dashLength() : 0;
                addLine(new Point(flatFrom, y), new Point(flatTo, y), dash, ops);
            }
        }
    }

    private void paintBus(Rect cell, List<Segment> segments, double[] half, List<DrawOp> ops) {
        double high = cell.top() + options.highLevel() * cell.height();
        double low = cell.top() + options.lowLevel() * cell.height();
        double middle = cell.centerY();
        int last = segments.size() - 1;
        List<DrawOp> texts = new ArrayList<>();

        for (int i = 0; i <= last; i++) {
            Segment segment = segments.get(i);
            if (segment.value() instanceof Value.Floating) {
                addLine(new Point(segment.from(), middle), new Point(segment.to(), middle), 0, ops);
                continue;
            }

            List<Point> band = new ArrayList<>();
            if (i == 0) {
                band.add(new Point(segment.from(), low));
                band.add(new Point(segment.from(), high));
            } else {
                band.add(new Point(segment.from(), middle));
                band.add(new Point(segment.from() + half[i], high));
            }
            if (i == last) {
                band.add(new Point(segment.to(), high));
                band.add(new Point(segment.to(), low));
            } else {
                band.add(new Point(segment.to() - half[i + 1], high));
                band.add(new Point(segment.to(), middle));
                band.add(new Point(segment.to() - half[i + 1], low));
            }
            if (i > 0) {
                band.add(new Point(segment.from() + half[i], low));
            }

            List<Point> visible = clipper.clipPolygon(band);
            if (visible.size() < 3) {
                continue;
            }
            RgbColor fill = segment.value() instanceof Value.Data ? style.background() : options.unknownFill();
            ops.add(new DrawOp.PolygonOp(toPixels(visible), fill, style.foreground(), options.lineWidth()));

            if (segment.value() instanceof Value.Data data && !data.text().isEmpty()) {
                addBusText(data.text(), flatStart(segments, half, i), flatEnd(segments, half, i), middle, texts);
            }
        }
        ops.addAll(texts);
    }

    private void addBusText(String text, double flatFrom, double flatTo, double middle, List<DrawOp> texts) {
        double from = Math.max(flatFrom, layout.time().start());
        double to = Math.min(flatTo, layout.time().end());
        if (to <= from) {
            return;
        }
        TextMetrics metrics = layout.metrics();
        double centerX = layout.x((from + to) / 2.0);
        double baseline = middle + (metrics.ascent() - metrics.descent()) / 2.0;
        texts.add(new DrawOp.TextOp(centerX - metrics.width(text) / 2.0, baseline, text,
                style.fontFamily(), style.fontSize(), style.foreground()));
    }

    private static double flatStart(List<Segment> segments, double[] half, int i) {
        return i == 0 ? segments.get(i).from() : segments.get(i).from() + half[i];
    }

    private static double flatEnd(List<Segment> segments, double[] half, int i) {
        return i == segments.size() - 1 ? segments.get(i).to() : segments.get(i).to() - half[i + 1];
    }

    private double levelOf(Value value, Rect cell) {
        if (value instanceof Value.One) {
            return cell.top() + options.highLevel() * cell.height();
        }
        if (value instanceof Value.Zero) {
            return cell.top() + options.lowLevel() * cell.height();
        }
        return cell.centerY();
    }

    private void addLine(Point from, Point to, double dashLength, List<DrawOp> ops) {
        List<Point> visible = clipper.clipLine(from, to);
        if (visible.isEmpty()) {
            return;
        }
        List<Point> pixels = toPixels(visible);
        ops.add(new DrawOp.LineOp(pixels.get(0), pixels.get(1), options.lineWidth(), style.foreground(), dashLength));
    }

    private List<Point> toPixels(List<Point> timePoints) {
        List<Point> pixels = new ArrayList<>(timePoints.size());
        for (Point p : timePoints) {
            pixels.add(new Point(layout.x(p.x()), p.y()));
        }
        return pixels;
    }
}
