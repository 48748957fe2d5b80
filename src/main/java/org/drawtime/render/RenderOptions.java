package org.drawtime.render;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.drawtime.model.RgbColor;

/**
 * Drawing parameters that are not part of the diagram source: stroke widths, the vertical position
 * of the logic levels within a row and the fill of unknown bus values.
 *
 * @param lineWidth The stroke width of waveforms.
 * @param frameLineWidth The stroke width of frames, grid lines and overlines.
 * @param textHeightFactor The height of a header row relative to the font's line height.
 * @param highLevel The position of logic high within a row, as a fraction of the row height from its top.
 * @param lowLevel The position of logic low within a row, as a fraction of the row height from its top.
 * @param unknownFill The fill colour of bus segments in the unknown state.
 * @param dashLength The dash and gap length of dashed lines.
 * @param antialiasing Whether raster output is antialiased.
 */
public record RenderOptions(
        double lineWidth,
        double frameLineWidth,
        double textHeightFactor,
        double highLevel,
        double lowLevel,
        RgbColor unknownFill,
        double dashLength,
        boolean antialiasing
) {

    /** The configuration path holding the render options. */
    public static final String CONFIG_PATH = "drawtime.render";

    public RenderOptions {
        if (lineWidth <= 0 || frameLineWidth <= 0 || dashLength <= 0) {
            throw new IllegalArgumentException("Line widths and dash length must be positive");
        }
        if (textHeightFactor < 1.0) {
            throw new IllegalArgumentException("text-height-factor must be at least 1.0");
        }
        if (highLevel < 0 || lowLevel > 1 || highLevel >= lowLevel) {
            throw new IllegalArgumentException("Expected 0 <= high-level < low-level <= 1, got "
                    + highLevel + " and " + lowLevel);
        }
    }

    /**
     * Reads the options from the {@value #CONFIG_PATH} block of a configuration.
     *
     * @param config The application configuration.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a setting is missing or has the wrong type.
     * @throws IllegalArgumentException if a setting is out of range.
     */
    public static RenderOptions fromConfig(Config config) {
        Config render = config.getConfig(CONFIG_PATH);
        return new RenderOptions(
                render.getDouble("line-width"),
                render.getDouble("frame-line-width"),
                render.getDouble("text-height-factor"),
                render.getDouble("high-level"),
                render.getDouble("low-level"),
                RgbColor.parseHex(render.getString("unknown-fill")),
                render.getDouble("dash-length"),
                render.getBoolean("antialiasing"));
    }

    /**
     * @return The options defined by the classpath {@code reference.conf}.
     */
    public static RenderOptions defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }
}
