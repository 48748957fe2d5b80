package org.drawtime.compiler.diagnostics;

/**
 * A non-fatal observation made while building a diagram.
 *
 * @param type The severity.
 * @param message The message.
 * @param fileName The source name.
 * @param lineNumber The line the observation refers to.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The severity of a diagnostic.
     */
    public enum Type {
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
    }
}
