package org.drawtime.render.draw;

import org.drawtime.model.RgbColor;

import java.util.List;

/**
 * One drawing operation in pixel space. A {@link RenderedDiagram} is an ordered list of these;
 * later operations paint over earlier ones.
 */
public sealed interface DrawOp permits DrawOp.LineOp, DrawOp.PolygonOp, DrawOp.TextOp {

    /**
     * A stroked line segment.
     *
     * @param from The start point.
     * @param to The end point.
     * @param width The stroke width.
     * @param color The stroke colour.
     * @param dashLength The dash and gap length, or {@code 0} for a solid line.
     */
    record LineOp(Point from, Point to, double width, RgbColor color, double dashLength) implements DrawOp {

        public static LineOp solid(Point from, Point to, double width, RgbColor color) {
            return new LineOp(from, to, width, color, 0);
        }

        public boolean isDashed() {
            return dashLength > 0;
        }
    }

    /**
     * A closed polygon, filled first and then stroked.
     *
     * @param points The vertices in order; the polygon closes back to the first.
     * @param fill The fill colour, or {@code null} for no fill.
     * @param stroke The outline colour, or {@code null} for no outline.
     * @param width The outline width.
     */
    record PolygonOp(List<Point> points, RgbColor fill, RgbColor stroke, double width) implements DrawOp {

        public PolygonOp {
            points = List.copyOf(points);
        }

        public boolean isFilled() {
            return fill != null;
        }

        public boolean isStroked() {
            return stroke != null;
        }
    }

    /**
     * A line of text.
     *
     * @param x The left end of the baseline.
     * @param baseline The y coordinate of the baseline.
     * @param text The text, drawn verbatim.
     * @param fontFamily The font family.
     * @param fontSize The font size in points.
     * @param color The text colour.
     */
    record TextOp(double x, double baseline, String text, String fontFamily, int fontSize, RgbColor color)
            implements DrawOp {
    }
}
