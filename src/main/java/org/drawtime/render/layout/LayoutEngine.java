package org.drawtime.render.layout;

import org.drawtime.compiler.api.DiagramException;
import org.drawtime.compiler.api.ErrorKind;
import org.drawtime.model.Diagram;
import org.drawtime.model.Signal;
import org.drawtime.model.StyleSettings;
import org.drawtime.model.TimeSettings;
import org.drawtime.render.RenderOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the canvas geometry of a diagram.
 * <p>
 * The canvas is inset by the margin. A label column as wide as the widest signal label (plus two
 * spaces) is reserved on the left, and a header holding the time axis labels on top. The rest is the
 * plot, divided into rows of equal height, one per signal.
 */
public final class LayoutEngine {

    /** Padding appended to every label when sizing the label column. */
    static final String LABEL_PADDING = "  ";

    private final RenderOptions options;
    private final TextMeasurer measurer;

    /**
     * @param options The drawing parameters.
     * @param measurer The source of font metrics.
     */
    public LayoutEngine(RenderOptions options, TextMeasurer measurer) {
        this.options = options;
        this.measurer = measurer;
    }

    /**
     * Lays out a diagram.
     *
     * @param diagram The diagram.
     * @return The geometry of the canvas.
     * @throws DiagramException with {@link ErrorKind#INVALID_RANGE} if the canvas leaves no room for the plot.
     */
    public LayoutResult layout(Diagram diagram) throws DiagramException {
        StyleSettings style = diagram.style();
        TimeSettings time = diagram.time();
        TextMetrics metrics = measurer.forFont(style.fontFamily(), style.fontSize());

        Rect outer = new Rect(0, 0, style.width(), style.height()).inset(style.margin());

        double labelColumnWidth = 0;
        for (Signal signal : diagram.signals()) {
            labelColumnWidth = Math.max(labelColumnWidth, metrics.width(signal.label().displayText() + LABEL_PADDING));
        }

        double headerRowHeight = metrics.height() * options.textHeightFactor();
        double headerHeight = time.hasStep() ? 2 * headerRowHeight : headerRowHeight;

        Rect header = new Rect(outer.left() + labelColumnWidth, outer.top(),
                outer.width() - labelColumnWidth, headerHeight);
        Rect plot = new Rect(header.left(), header.bottom(), header.width(), outer.height() - headerHeight);
        if (plot.width() <= 0 || plot.height() <= 0) {
            throw new DiagramException(ErrorKind.INVALID_RANGE, String.format(
                    "Canvas %dx%d with margin %d leaves no room for the plot",
                    style.width(), style.height(), style.margin()));
        }

        List<SignalRow> rows = new ArrayList<>();
        int count = diagram.signals().size();
        double rowHeight = count == 0 ? 0 : plot.height() / count;
        for (int i = 0; i < count; i++) {
            double top = plot.top() + i * rowHeight;
            rows.add(new SignalRow(diagram.signals().get(i),
                    new Rect(outer.left(), top, labelColumnWidth, rowHeight),
                    new Rect(plot.left(), top, plot.width(), rowHeight)));
        }

        LayoutResult withoutGrid = new LayoutResult(style.width(), style.height(), outer, header, plot,
                rows, List.of(), time, metrics);
        if (!time.hasStep()) {
            return withoutGrid;
        }

        List<GridLine> gridLines = new ArrayList<>();
        long step = time.step();
        // multiples of step inside [start, end], numbered by the steps elapsed since start
        long first = -Math.floorDiv(-(long) time.start(), step) * step;
        for (long t = first; t <= time.end(); t += step) {
            int index = (int) -Math.floorDiv(-(t - time.start()), step);
            gridLines.add(new GridLine(index, (int) t, withoutGrid.x(t)));
        }
        return new LayoutResult(style.width(), style.height(), outer, header, plot, rows, gridLines, time, metrics);
    }
}
