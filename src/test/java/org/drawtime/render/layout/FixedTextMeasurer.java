package org.drawtime.render.layout;

/**
 * Font-independent metrics for tests: every character is half the font size wide, the ascent is
 * 0.8 and the descent 0.2 of the font size.
 */
public class FixedTextMeasurer implements TextMeasurer {

    @Override
    public TextMetrics forFont(String fontFamily, int fontSize) {
        return new TextMetrics() {
            @Override
            public double width(String text) {
                return text.length() * fontSize * 0.5;
            }

            @Override
            public double ascent() {
                return fontSize * 0.8;
            }

            @Override
            public double descent() {
                return fontSize * 0.2;
            }
        };
    }
}
