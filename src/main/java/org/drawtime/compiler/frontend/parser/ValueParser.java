package org.drawtime.compiler.frontend.parser;

import org.drawtime.compiler.api.DiagramException;
import org.drawtime.compiler.api.ErrorKind;
import org.drawtime.compiler.frontend.lexer.SourceLine;
import org.drawtime.model.RgbColor;
import org.drawtime.model.SignalKind;
import org.drawtime.model.Value;

import java.util.regex.Pattern;

/**
 * Parses raw property and signal values. The accepted grammar depends on the property or on the
 * kind of the enclosing signal.
 */
public final class ValueParser {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern COLOR = Pattern.compile("[0-9a-fA-F]{6}");

    private ValueParser() {}

    /**
     * Parses an integer property value.
     *
     * @param raw The raw value.
     * @param line The line, for error reporting.
     * @return The integer.
     * @throws DiagramException with {@link ErrorKind#INVALID_PROPERTY_VALUE} if not an integer.
     */
    public static int parseInt(String raw, SourceLine line) throws DiagramException {
        if (INTEGER.matcher(raw).matches()) {
            try {
                return Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                throw new DiagramException(ErrorKind.INVALID_PROPERTY_VALUE,
                        "'" + raw + "' is out of the integer range", line.sourceInfo());
            }
        }
        throw new DiagramException(ErrorKind.INVALID_PROPERTY_VALUE,
                "'" + raw + "' is not a valid integer", line.sourceInfo());
    }

    /**
     * Parses a decimal property value such as a duty cycle.
     *
     * @param raw The raw value.
     * @param line The line, for error reporting.
     * @return The number.
     * @throws DiagramException with {@link ErrorKind#INVALID_PROPERTY_VALUE} if not a finite decimal.
     */
    public static double parseDecimal(String raw, SourceLine line) throws DiagramException {
        if (!DECIMAL.matcher(raw).matches()) {
            throw new DiagramException(ErrorKind.INVALID_PROPERTY_VALUE,
                    "'" + raw + "' is not a valid number", line.sourceInfo());
        }
        return Double.parseDouble(raw);
    }

    /**
     * Parses a colour in the {@code RRGGBB} notation.
     *
     * @param raw The raw value.
     * @param line The line, for error reporting.
     * @return The colour.
     * @throws DiagramException with {@link ErrorKind#INVALID_COLOR} unless exactly six hex digits.
     */
    public static RgbColor parseColor(String raw, SourceLine line) throws DiagramException {
        if (!COLOR.matcher(raw).matches()) {
            throw new DiagramException(ErrorKind.INVALID_COLOR,
                    "'" + raw + "' is not a valid color. Colors must be in the RRGGBB format", line.sourceInfo());
        }
        return RgbColor.parseHex(raw);
    }

    /**
     * Parses a non-empty free text property value such as a font family.
     *
     * @param raw The raw value.
     * @param line The line, for error reporting.
     * @return The text.
     * @throws DiagramException with {@link ErrorKind#INVALID_PROPERTY_VALUE} if empty.
     */
    public static String parseText(String raw, SourceLine line) throws DiagramException {
        if (raw.isEmpty()) {
            throw new DiagramException(ErrorKind.INVALID_PROPERTY_VALUE, "Empty property value", line.sourceInfo());
        }
        return raw;
    }

    /**
     * Parses a signal start or change value for a signal of the given kind.
     * <ul>
     *   <li>line: exactly {@code 0}, {@code 1}, {@code ?} or {@code Z}</li>
     *   <li>bus: {@code ?}, {@code Z} or a double-quoted string</li>
     * </ul>
     * Tokens legal only for the other kind are rejected as a kind mismatch.
     *
     * @param raw The raw value.
     * @param kind The kind of the enclosing signal; clocks have no declared values.
     * @param line The line, for error reporting.
     * @return The value.
     * @throws DiagramException with {@link ErrorKind#VALUE_KIND_MISMATCH} or
     *         {@link ErrorKind#INVALID_SIGNAL_VALUE}.
     */
    public static Value parseSignalValue(String raw, SignalKind kind, SourceLine line) throws DiagramException {
        Value value = parseAnySignalValue(raw, line);
        if (!kind.accepts(value)) {
            throw new DiagramException(ErrorKind.VALUE_KIND_MISMATCH,
                    "Value " + raw + " is not allowed on a " + kind.keyword() + " signal", line.sourceInfo());
        }
        return value;
    }

    private static Value parseAnySignalValue(String raw, SourceLine line) throws DiagramException {
        switch (raw) {
            case "0":
                return Value.ZERO;
            case "1":
                return Value.ONE;
            case "?":
                return Value.UNKNOWN;
            case "Z":
                return Value.FLOATING;
            default:
                if (raw.startsWith("\"")) {
                    return Value.data(unquote(raw, line));
                }
                throw new DiagramException(ErrorKind.INVALID_SIGNAL_VALUE,
                        "Invalid signal value '" + raw + "'. Accepted values are 0, 1, Z, ? or a quoted string",
                        line.sourceInfo());
        }
    }

    /**
     * Decodes a double-quoted string. Only {@code \"} and {@code \\} escapes are recognized.
     */
    static String unquote(String raw, SourceLine line) throws DiagramException {
        StringBuilder text = new StringBuilder();
        int i = 1;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == '"') {
                if (i != raw.length() - 1) {
                    throw invalidString("Unexpected characters after closing quote", line);
                }
                return text.toString();
            }
            if (c == '\\') {
                if (i + 1 >= raw.length()) {
                    break;
                }
                char escaped = raw.charAt(i + 1);
                if (escaped != '"' && escaped != '\\') {
                    throw invalidString("Unsupported escape sequence \\" + escaped, line);
                }
                text.append(escaped);
                i += 2;
            } else {
                text.append(c);
                i++;
            }
        }
        throw invalidString("Unterminated string", line);
    }

    private static DiagramException invalidString(String message, SourceLine line) {
        return new DiagramException(ErrorKind.INVALID_SIGNAL_VALUE, message, line.sourceInfo());
    }
}
