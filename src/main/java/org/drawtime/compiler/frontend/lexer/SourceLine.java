package org.drawtime.compiler.frontend.lexer;

import org.drawtime.compiler.api.SourceInfo;

/**
 * A significant (non-blank, non-comment) line of diagram source.
 *
 * @param fileName The logical source name.
 * @param number The 1-based line number.
 * @param text The line exactly as written, without the line terminator.
 */
public record SourceLine(String fileName, int number, String text) {

    /**
     * @return The line without leading and trailing whitespace.
     */
    public String content() {
        return text.strip();
    }

    /**
     * @return The position of this line for error reporting.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(fileName, number, text);
    }
}
