package org.drawtime.compiler.frontend.parser;

import org.drawtime.compiler.api.DiagramException;
import org.drawtime.compiler.api.ErrorKind;
import org.drawtime.compiler.frontend.lexer.SourceLine;

import java.util.regex.Pattern;

/**
 * Splits a block body line into a property or change assignment.
 * <p>
 * A line is a change line when the text before its first {@code ->} contains no {@code =};
 * otherwise it is a property line split at its first {@code =}. Whitespace around either
 * operator is insignificant.
 */
public final class LineParser {

    private static final String CHANGE_OPERATOR = "->";
    private static final char ASSIGN_OPERATOR = '=';
    private static final Pattern SIGNED_INTEGER = Pattern.compile("[+-]?\\d+");

    private LineParser() {}

    /**
     * Parses one body line.
     *
     * @param line The line to parse.
     * @return The property or change assignment.
     * @throws DiagramException with {@link ErrorKind#MALFORMED_CHANGE_LINE} if the time of a change
     *         line is not an integer, or {@link ErrorKind#MALFORMED_PROPERTY_LINE} if the line is
     *         neither form.
     */
    public static ParsedLine parse(SourceLine line) throws DiagramException {
        String content = line.content();
        int arrow = content.indexOf(CHANGE_OPERATOR);
        int assign = content.indexOf(ASSIGN_OPERATOR);

        if (arrow >= 0 && (assign < 0 || assign > arrow)) {
            return parseChange(line, content, arrow);
        }
        if (assign >= 0) {
            return parseProperty(line, content, assign);
        }
        throw new DiagramException(ErrorKind.MALFORMED_PROPERTY_LINE,
                "Expected 'key = value' or 'time -> value'", line.sourceInfo());
    }

    private static ParsedLine parseChange(SourceLine line, String content, int arrow) throws DiagramException {
        String time = content.substring(0, arrow).strip();
        String value = content.substring(arrow + CHANGE_OPERATOR.length()).strip();
        if (!SIGNED_INTEGER.matcher(time).matches()) {
            throw new DiagramException(ErrorKind.MALFORMED_CHANGE_LINE,
                    "Change time '" + time + "' is not an integer", line.sourceInfo());
        }
        try {
            return new ParsedLine.ChangeAssignment(Integer.parseInt(time), value, line);
        } catch (NumberFormatException e) {
            throw new DiagramException(ErrorKind.MALFORMED_CHANGE_LINE,
                    "Change time '" + time + "' is out of range", line.sourceInfo());
        }
    }

    private static ParsedLine parseProperty(SourceLine line, String content, int assign) throws DiagramException {
        String key = content.substring(0, assign).strip();
        String value = content.substring(assign + 1).strip();
        if (key.isEmpty() || key.chars().anyMatch(Character::isWhitespace)) {
            throw new DiagramException(ErrorKind.MALFORMED_PROPERTY_LINE,
                    "Malformed property key '" + key + "'", line.sourceInfo());
        }
        return new ParsedLine.PropertyAssignment(key, value, line);
    }
}
