package org.drawtime.model;

/**
 * Canvas geometry, font and colours of a diagram.
 */
public record StyleSettings(
        int width,
        int height,
        int margin,
        int fontSize,
        String fontFamily,
        RgbColor background,
        RgbColor foreground
) {

    public static final StyleSettings DEFAULTS = new StyleSettings(
            800, 600, 10, 12, "Times New Roman", RgbColor.WHITE, RgbColor.BLACK);
}
