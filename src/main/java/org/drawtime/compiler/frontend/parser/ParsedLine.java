package org.drawtime.compiler.frontend.parser;

import org.drawtime.compiler.frontend.lexer.SourceLine;

/**
 * A body line split into its syntactic parts. Values stay raw here; their grammar depends on the
 * enclosing block and is applied by {@link ValueParser}.
 */
public sealed interface ParsedLine permits ParsedLine.PropertyAssignment, ParsedLine.ChangeAssignment {

    /**
     * @return The line this was parsed from.
     */
    SourceLine line();

    /**
     * {@code <key> = <value>}.
     *
     * @param key The property key, without whitespace.
     * @param rawValue The value text, trimmed.
     * @param line The source line.
     */
    record PropertyAssignment(String key, String rawValue, SourceLine line) implements ParsedLine {}

    /**
     * {@code <time> -> <value>}.
     *
     * @param time The change time.
     * @param rawValue The value text, trimmed.
     * @param line The source line.
     */
    record ChangeAssignment(int time, String rawValue, SourceLine line) implements ParsedLine {}
}
