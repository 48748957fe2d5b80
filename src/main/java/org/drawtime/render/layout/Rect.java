package org.drawtime.render.layout;

/**
 * An axis-aligned rectangle in pixel space; y grows downwards.
 */
public record Rect(double left, double top, double width, double height) {

    public double right() {
        return left + width;
    }

    public double bottom() {
        return top + height;
    }

    public double centerX() {
        return left + width / 2.0;
    }

    public double centerY() {
        return top + height / 2.0;
    }

    /**
     * @param amount The inset on every side.
     * @return This rectangle shrunk by {@code amount} on all four sides.
     */
    public Rect inset(double amount) {
        return new Rect(left + amount, top + amount, width - 2 * amount, height - 2 * amount);
    }
}
