package org.drawtime.compiler.frontend.lexer;

/**
 * A parsed header line.
 *
 * @param kind The block kind.
 * @param label The signal label, or {@code null} for basic blocks.
 * @param line The header line itself.
 */
public record BlockHeader(BlockKind kind, String label, SourceLine line) {
}
