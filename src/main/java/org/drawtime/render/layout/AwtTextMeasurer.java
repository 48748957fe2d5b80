package org.drawtime.render.layout;

import java.awt.Font;
import java.awt.font.FontRenderContext;
import java.awt.font.LineMetrics;

/**
 * Measures text with Java2D fonts. Works in headless mode; unknown families fall back to the
 * logical {@code Dialog} font as Java2D does.
 */
public final class AwtTextMeasurer implements TextMeasurer {

    private static final String METRICS_SAMPLE = "Xgjy";

    private final FontRenderContext renderContext;

    /**
     * @param antialiasing Whether text is measured as it is drawn with antialiasing.
     */
    public AwtTextMeasurer(boolean antialiasing) {
        this.renderContext = new FontRenderContext(null, antialiasing, antialiasing);
    }

    @Override
    public TextMetrics forFont(String fontFamily, int fontSize) {
        Font font = new Font(fontFamily, Font.PLAIN, fontSize);
        LineMetrics lineMetrics = font.getLineMetrics(METRICS_SAMPLE, renderContext);
        double ascent = lineMetrics.getAscent();
        double descent = lineMetrics.getDescent();
        return new TextMetrics() {
            @Override
            public double width(String text) {
                return font.getStringBounds(text, renderContext).getWidth();
            }

            @Override
            public double ascent() {
                return ascent;
            }

            @Override
            public double descent() {
                return descent;
            }
        };
    }
}
