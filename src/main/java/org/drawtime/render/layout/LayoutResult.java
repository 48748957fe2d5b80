package org.drawtime.render.layout;

import org.drawtime.model.TimeSettings;

import java.util.List;

/**
 * Canvas geometry of a diagram.
 *
 * @param canvasWidth The canvas width in pixels.
 * @param canvasHeight The canvas height in pixels.
 * @param outer The canvas inset by the margin; framed when drawn.
 * @param header The time axis header above the plot, one row high, two when a step grid is set.
 * @param plot The area the waveforms are drawn in; framed when drawn.
 * @param rows One row per signal, top to bottom in declaration order.
 * @param gridLines The step grid, empty when no step is set.
 * @param time The time window mapped onto the plot.
 * @param metrics The metrics of the diagram font.
 */
public record LayoutResult(
        int canvasWidth,
        int canvasHeight,
        Rect outer,
        Rect header,
        Rect plot,
        List<SignalRow> rows,
        List<GridLine> gridLines,
        TimeSettings time,
        TextMetrics metrics
) {

    public LayoutResult {
        rows = List.copyOf(rows);
        gridLines = List.copyOf(gridLines);
    }

    /**
     * Maps an instant to a pixel column. The mapping is affine and strictly increasing; the window
     * start maps to the left edge of the plot and the window end to its right edge.
     *
     * @param t The instant, may be fractional.
     * @return The pixel column.
     */
    public double x(double t) {
        return plot.left() + (t - time.start()) / (double) time.duration() * plot.width();
    }
}
