package org.drawtime.compiler.api;

import java.util.Optional;

/**
 * Thrown when diagram source cannot be turned into a rendered diagram.
 * <p>
 * Carries a machine-readable {@link ErrorKind} and, for errors found in the source text,
 * the position of the offending line.
 */
public class DiagramException extends Exception {

    private final ErrorKind kind;
    private final SourceInfo sourceInfo;

    /**
     * Constructs an exception without a source position.
     * @param kind The kind of error.
     * @param message The detail message.
     */
    public DiagramException(ErrorKind kind, String message) {
        this(kind, message, (SourceInfo) null);
    }

    /**
     * Constructs an exception annotated with the offending source line.
     * @param kind The kind of error.
     * @param message The detail message.
     * @param sourceInfo The offending line, may be {@code null}.
     */
    public DiagramException(ErrorKind kind, String message, SourceInfo sourceInfo) {
        super(sourceInfo == null ? message : String.format("%s at %s", message, sourceInfo));
        this.kind = kind;
        this.sourceInfo = sourceInfo;
    }

    /**
     * Constructs an exception caused by another, typically an {@link java.io.IOException}.
     * @param kind The kind of error.
     * @param message The detail message.
     * @param cause The cause.
     */
    public DiagramException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.sourceInfo = null;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Optional<SourceInfo> getSourceInfo() {
        return Optional.ofNullable(sourceInfo);
    }
}
