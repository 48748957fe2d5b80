package org.drawtime.render.draw;

import java.util.ArrayList;
import java.util.List;

/**
 * Clips shapes given in (time, y) coordinates to a time window, interpolating y linearly where an
 * edge crosses the window boundary.
 */
final class TimeClipper {

    private final double start;
    private final double end;

    TimeClipper(double start, double end) {
        this.start = start;
        this.end = end;
    }

    /**
     * @return The visible part of the segment as two points, or an empty list if none of it is visible.
     */
    List<Point> clipLine(Point a, Point b) {
        if (a.x() > b.x()) {
            Point swap = a;
            a = b;
            b = swap;
        }
        if (b.x() < start || a.x() > end) {
            return List.of();
        }
        Point from = a.x() < start ? interpolate(a, b, start) : a;
        Point to = b.x() > end ? interpolate(a, b, end) : b;
        return List.of(from, to);
    }

    /**
     * Sutherland-Hodgman clipping against the two vertical window edges.
     *
     * @return The visible part of the polygon; fewer than three points if none of it is visible.
     */
    List<Point> clipPolygon(List<Point> polygon) {
        return clipAgainst(clipAgainst(polygon, start, true), end, false);
    }

    private static List<Point> clipAgainst(List<Point> polygon, double edge, boolean keepAbove) {
        List<Point> result = new ArrayList<>();
        int n = polygon.size();
        for (int i = 0; i < n; i++) {
            Point current = polygon.get(i);
            Point previous = polygon.get((i + n - 1) % n);
            boolean currentInside = inside(current, edge, keepAbove);
            boolean previousInside = inside(previous, edge, keepAbove);
            if (currentInside) {
                if (!previousInside) {
                    result.add(interpolate(previous, current, edge));
                }
                result.add(current);
            } else if (previousInside) {
                result.add(interpolate(previous, current, edge));
            }
        }
        return result;
    }

    private static boolean inside(Point p, double edge, boolean keepAbove) {
        return keepAbove ? p.x() >= edge : p.x() <= edge;
    }

    private static Point interpolate(Point a, Point b, double x) {
        if (b.x() == a.x()) {
            return new Point(x, a.y());
        }
        double f = (x - a.x()) / (b.x() - a.x());
        return new Point(x, a.y() + f * (b.y() - a.y()));
    }
}
