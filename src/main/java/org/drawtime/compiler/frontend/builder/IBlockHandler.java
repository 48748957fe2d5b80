package org.drawtime.compiler.frontend.builder;

import org.drawtime.compiler.api.DiagramException;
import org.drawtime.compiler.frontend.lexer.SourceBlock;

/**
 * Applies one kind of block to the diagram under construction.
 */
public interface IBlockHandler {

    /**
     * Parses the lines of a block and records the result in the build context.
     *
     * @param block The block to apply.
     * @param context The diagram under construction.
     * @throws DiagramException on the first invalid line of the block.
     */
    void handle(SourceBlock block, BuildContext context) throws DiagramException;
}
