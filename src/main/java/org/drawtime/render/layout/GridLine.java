package org.drawtime.render.layout;

/**
 * A vertical step-grid line.
 *
 * @param index The number of steps from the window start to this line, rounded up.
 * @param time The instant the line marks.
 * @param x The pixel column of the line.
 */
public record GridLine(int index, int time, double x) {

    /**
     * @return The header label of this line, {@code T<index>}.
     */
    public String label() {
        return "T" + index;
    }
}
