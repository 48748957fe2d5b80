package org.drawtime.model;

import java.util.Locale;

/**
 * A 24-bit RGB colour.
 *
 * @param rgb The colour packed as {@code 0xRRGGBB}.
 */
public record RgbColor(int rgb) {

    public static final RgbColor WHITE = new RgbColor(0xFFFFFF);
    public static final RgbColor BLACK = new RgbColor(0x000000);

    public RgbColor {
        if ((rgb & ~0xFFFFFF) != 0) {
            throw new IllegalArgumentException("Not a 24-bit colour: " + Integer.toHexString(rgb));
        }
    }

    /**
     * Parses a colour in the {@code RRGGBB} notation (case-insensitive, no prefix).
     *
     * @param hex Exactly six hexadecimal digits.
     * @return The parsed colour.
     * @throws IllegalArgumentException if the text is not six hex digits.
     */
    public static RgbColor parseHex(String hex) {
        if (hex == null || !hex.matches("[0-9a-fA-F]{6}")) {
            throw new IllegalArgumentException("Colours must be in the RRGGBB format: " + hex);
        }
        return new RgbColor(Integer.parseInt(hex, 16));
    }

    public int red() {
        return (rgb >> 16) & 0xFF;
    }

    public int green() {
        return (rgb >> 8) & 0xFF;
    }

    public int blue() {
        return rgb & 0xFF;
    }

    /**
     * @return The colour as six upper-case hex digits.
     */
    public String toHex() {
        return String.format(Locale.ROOT, "%06X", rgb);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
