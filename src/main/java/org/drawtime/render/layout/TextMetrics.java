package org.drawtime.render.layout;

/**
 * Measurements of text set in one font.
 */
public interface TextMetrics {

    /**
     * @param text The text to measure.
     * @return The advance width of the text in pixels.
     */
    double width(String text);

    /**
     * @return The distance from the baseline to the top of the tallest glyphs.
     */
    double ascent();

    /**
     * @return The distance from the baseline to the bottom of the lowest glyphs.
     */
    double descent();

    /**
     * @return The line height without leading.
     */
    default double height() {
        return ascent() + descent();
    }
}
