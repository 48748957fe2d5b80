package org.drawtime.render.draw;

import org.drawtime.model.Diagram;
import org.drawtime.model.StyleSettings;
import org.drawtime.model.TimeSettings;
import org.drawtime.render.RenderOptions;
import org.drawtime.render.layout.GridLine;
import org.drawtime.render.layout.LayoutResult;
import org.drawtime.render.layout.Rect;
import org.drawtime.render.layout.SignalRow;
import org.drawtime.render.layout.TextMetrics;
import org.drawtime.timeline.TimelineResolver;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a laid-out diagram into drawing operations.
 * <p>
 * Painting order: outer frame, plot frame, time axis labels, step grid, then label and waveform of
 * every signal from top to bottom.
 */
public final class DrawingEngine {

    private final RenderOptions options;

    /**
     * @param options The drawing parameters.
     */
    public DrawingEngine(RenderOptions options) {
        this.options = options;
    }

    /**
     * Draws a diagram.
     *
     * @param diagram The diagram.
     * @param layout The layout computed for it.
     * @return The canvas and its drawing operations.
     */
    public RenderedDiagram draw(Diagram diagram, LayoutResult layout) {
        StyleSettings style = diagram.style();
        List<DrawOp> ops = new ArrayList<>();

        ops.add(frame(layout.outer(), style));
        ops.add(frame(layout.plot(), style));
        drawAxis(layout, style, ops);
        drawGrid(layout, style, ops);

        LabelPainter labels = new LabelPainter(layout.metrics(), options, style);
        WaveformPainter waveforms = new WaveformPainter(layout, options, style);
        for (SignalRow row : layout.rows()) {
            labels.paint(row.signal().label(), row.labelCell(), ops);
            waveforms.paint(row, TimelineResolver.resolve(row.signal(), diagram.time()), ops);
        }
        return new RenderedDiagram(layout.canvasWidth(), layout.canvasHeight(), style.background(), ops);
    }

    private DrawOp frame(Rect rect, StyleSettings style) {
        List<Point> corners = List.of(
                new Point(rect.left(), rect.top()),
                new Point(rect.right(), rect.top()),
                new Point(rect.right(), rect.bottom()),
                new Point(rect.left(), rect.bottom()));
        return new DrawOp.PolygonOp(corners, null, style.foreground(), options.frameLineWidth());
    }

    private void drawAxis(LayoutResult layout, StyleSettings style, List<DrawOp> ops) {
        TimeSettings time = layout.time();
        TextMetrics metrics = layout.metrics();
        double baseline = baselineOfHeaderRow(layout, 0);
        String startText = Integer.toString(time.start());
        String endText = Integer.toString(time.end());
        ops.add(new DrawOp.TextOp(layout.plot().left(), baseline, startText,
                style.fontFamily(), style.fontSize(), style.foreground()));
        ops.add(new DrawOp.TextOp(layout.plot().right() - metrics.width(endText), baseline, endText,
                style.fontFamily(), style.fontSize(), style.foreground()));
    }

    private void drawGrid(LayoutResult layout, StyleSettings style, List<DrawOp> ops) {
        if (layout.gridLines().isEmpty()) {
            return;
        }
        TextMetrics metrics = layout.metrics();
        Rect header = layout.header();
        Rect plot = layout.plot();
        double baseline = baselineOfHeaderRow(layout, 1);
        for (GridLine line : layout.gridLines()) {
            ops.add(new DrawOp.LineOp(new Point(line.x(), plot.top()), new Point(line.x(), plot.bottom()),
                    options.frameLineWidth(), style.foreground(), options.dashLength()));

            // Centred on the line, kept inside the header.
            double width = metrics.width(line.label());
            double left = Math.max(header.left(), Math.min(header.right() - width, line.x() - width / 2.0));
            ops.add(new DrawOp.TextOp(left, baseline, line.label(),
                    style.fontFamily(), style.fontSize(), style.foreground()));
        }
    }

    private static double baselineOfHeaderRow(LayoutResult layout, int row) {
        Rect header = layout.header();
        int rows = layout.time().hasStep() ? 2 : 1;
        double rowHeight = header.height() / rows;
        double center = header.top() + rowHeight * (row + 0.5);
        return center + (layout.metrics().ascent() - layout.metrics().descent()) / 2.0;
    }
}
