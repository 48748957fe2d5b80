package org.drawtime.compiler.frontend.builder;

import org.drawtime.compiler.api.DiagramException;
import org.drawtime.compiler.api.ErrorKind;
import org.drawtime.compiler.frontend.lexer.SourceLine;
import org.drawtime.compiler.frontend.parser.ParsedLine.PropertyAssignment;
import org.drawtime.compiler.frontend.parser.ValueParser;

import java.util.Optional;

/**
 * Shared property helpers for block handlers.
 */
abstract class AbstractBlockHandler implements IBlockHandler {

    /**
     * Reads an integer property, falling back to a default when it is not assigned.
     */
    protected static int intProperty(BlockBody body, String key, int defaultValue) throws DiagramException {
        Optional<PropertyAssignment> assignment = body.property(key);
        if (assignment.isEmpty()) {
            return defaultValue;
        }
        return ValueParser.parseInt(assignment.get().rawValue(), assignment.get().line());
    }

    /**
     * Creates a range error pointing at the line that assigns {@code key}, or at the block header.
     */
    protected static DiagramException rangeError(BlockBody body, String key, String message) {
        SourceLine line = body.lineOf(key);
        return new DiagramException(ErrorKind.INVALID_RANGE, message, line.sourceInfo());
    }
}
