package org.drawtime.render.draw;

import org.drawtime.model.LabelSegment;
import org.drawtime.model.LabelSegments;
import org.drawtime.model.StyleSettings;
import org.drawtime.render.RenderOptions;
import org.drawtime.render.layout.Rect;
import org.drawtime.render.layout.TextMetrics;

import java.util.List;

/**
 * Draws signal labels centred in their cell, with a stroke above every overlined segment.
 */
final class LabelPainter {

    private final TextMetrics metrics;
    private final RenderOptions options;
    private final StyleSettings style;

    LabelPainter(TextMetrics metrics, RenderOptions options, StyleSettings style) {
        this.metrics = metrics;
        this.options = options;
        this.style = style;
    }

    void paint(LabelSegments label, Rect cell, List<DrawOp> ops) {
        String text = label.displayText();
        double left = cell.centerX() - metrics.width(text) / 2.0;
        double baseline = cell.centerY() + (metrics.ascent() - metrics.descent()) / 2.0;
        ops.add(new DrawOp.TextOp(left, baseline, text, style.fontFamily(), style.fontSize(), style.foreground()));

        double overlineY = baseline - metrics.ascent();
        StringBuilder preceding = new StringBuilder();
        for (LabelSegment segment : label.segments()) {
            if (segment.overlined() && !segment.text().isEmpty()) {
                double from = left + metrics.width(preceding.toString());
                double to = from + metrics.width(segment.text());
                ops.add(DrawOp.LineOp.solid(new Point(from, overlineY), new Point(to, overlineY),
                        options.frameLineWidth(), style.foreground()));
            }
            preceding.append(segment.text()).append(LabelSegments.SEPARATOR);
        }
    }
}
