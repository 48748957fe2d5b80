package org.drawtime.render.draw;

/**
 * A point. In pixel space y grows downwards; {@link TimeClipper} also uses points whose x is a time.
 */
public record Point(double x, double y) {
}
