package org.drawtime.compiler.frontend.lexer;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily splits source text into numbered lines, skipping blank lines and whole-line comments.
 * A line is a comment if its first non-whitespace character is {@code #}.
 */
public final class SourceReader implements Iterable<SourceLine> {

    private final String source;
    private final String fileName;

    /**
     * @param source The complete source text; {@code \n}, {@code \r\n} and {@code \r} end lines.
     * @param fileName The logical source name attached to every line.
     */
    public SourceReader(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    @Override
    public Iterator<SourceLine> iterator() {
        return new LineIterator();
    }

    private final class LineIterator implements Iterator<SourceLine> {
        private int current = 0;
        private int lineNumber = 0;
        private SourceLine next;

        @Override
        public boolean hasNext() {
            while (next == null && current < source.length()) {
                String text = readRawLine();
                String stripped = text.strip();
                if (!stripped.isEmpty() && !stripped.startsWith("#")) {
                    next = new SourceLine(fileName, lineNumber, text);
                }
            }
            return next != null;
        }

        @Override
        public SourceLine next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            SourceLine line = next;
            next = null;
            return line;
        }

        private String readRawLine() {
            int start = current;
            while (current < source.length() && source.charAt(current) != '\n' && source.charAt(current) != '\r') {
                current++;
            }
            String text = source.substring(start, current);
            if (current < source.length()) {
                if (source.charAt(current) == '\r' && current + 1 < source.length() && source.charAt(current + 1) == '\n') {
                    current++;
                }
                current++;
            }
            lineNumber++;
            return text;
        }
    }
}
