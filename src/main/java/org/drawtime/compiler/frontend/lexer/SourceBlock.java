package org.drawtime.compiler.frontend.lexer;

import java.util.List;

/**
 * A header together with the property and change lines that follow it.
 *
 * @param header The block header.
 * @param lines The body lines in file order.
 */
public record SourceBlock(BlockHeader header, List<SourceLine> lines) {

    public SourceBlock {
        lines = List.copyOf(lines);
    }

    public BlockKind kind() {
        return header.kind();
    }
}
