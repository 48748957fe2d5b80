package org.drawtime.render.layout;

/**
 * Provides font metrics to the layout and drawing engines.
 */
public interface TextMeasurer {

    /**
     * @param fontFamily The font family name.
     * @param fontSize The font size in points.
     * @return The metrics of that font.
     */
    TextMetrics forFont(String fontFamily, int fontSize);
}
