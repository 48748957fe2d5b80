package org.drawtime.compiler.frontend.builder;

import org.drawtime.compiler.api.DiagramException;
import org.drawtime.compiler.frontend.lexer.SourceBlock;
import org.drawtime.compiler.frontend.parser.ParsedLine.PropertyAssignment;
import org.drawtime.compiler.frontend.parser.ValueParser;
import org.drawtime.model.RgbColor;
import org.drawtime.model.StyleSettings;

import java.util.Optional;
import java.util.Set;

/**
 * Handles the {@code style:} block: canvas size, margin, font and colours.
 */
public class StyleBlockHandler extends AbstractBlockHandler {

    static final Set<String> PROPERTIES = Set.of(
            "width", "height", "margin", "font_size", "font_family", "background", "foreground");

    @Override
    public void handle(SourceBlock block, BuildContext context) throws DiagramException {
        BlockBody body = BlockBody.parse(block, PROPERTIES, false, context);
        StyleSettings defaults = StyleSettings.DEFAULTS;

        int width = intProperty(body, "width", defaults.width());
        int height = intProperty(body, "height", defaults.height());
        int margin = intProperty(body, "margin", defaults.margin());
        int fontSize = intProperty(body, "font_size", defaults.fontSize());
        String fontFamily = defaults.fontFamily();
        Optional<PropertyAssignment> family = body.property("font_family");
        if (family.isPresent()) {
            fontFamily = ValueParser.parseText(family.get().rawValue(), family.get().line());
        }
        RgbColor background = colorProperty(body, "background", defaults.background());
        RgbColor foreground = colorProperty(body, "foreground", defaults.foreground());

        if (width <= 0) {
            throw rangeError(body, "width", "The width must be positive");
        }
        if (height <= 0) {
            throw rangeError(body, "height", "The height must be positive");
        }
        if (fontSize <= 0) {
            throw rangeError(body, "font_size", "The font size must be positive");
        }
        if (margin < 0) {
            throw rangeError(body, "margin", "The margin must not be negative");
        }
        if (2L * margin >= width || 2L * margin >= height) {
            throw rangeError(body, "margin",
                    "The margin must be less than half the width and half the height of the diagram");
        }
        context.setStyle(new StyleSettings(width, height, margin, fontSize, fontFamily, background, foreground));
    }

    private static RgbColor colorProperty(BlockBody body, String key, RgbColor defaultValue) throws DiagramException {
        Optional<PropertyAssignment> assignment = body.property(key);
        if (assignment.isEmpty()) {
            return defaultValue;
        }
        return ValueParser.parseColor(assignment.get().rawValue(), assignment.get().line());
    }
}
