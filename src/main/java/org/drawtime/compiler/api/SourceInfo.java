package org.drawtime.compiler.api;

/**
 * A position in diagram source text.
 *
 * @param fileName The logical name of the source.
 * @param lineNumber The 1-based line number.
 * @param lineContent The text of the line as written.
 */
public record SourceInfo(String fileName, int lineNumber, String lineContent) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ": " + lineContent.strip();
    }
}
