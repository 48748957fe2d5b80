package org.drawtime.compiler.frontend.builder;

import org.drawtime.compiler.api.DiagramException;
import org.drawtime.compiler.api.ErrorKind;
import org.drawtime.compiler.diagnostics.DiagnosticsEngine;
import org.drawtime.compiler.frontend.lexer.BlockKind;
import org.drawtime.compiler.frontend.lexer.SourceBlock;
import org.drawtime.compiler.frontend.parser.ParsedLine.ChangeAssignment;
import org.drawtime.model.Diagram;
import org.drawtime.model.TimeSettings;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles blocks into a {@link Diagram}.
 * <p>
 * Blocks are applied in file order. The time and style blocks may each appear at most once; when
 * absent their documented defaults apply. Signal blocks are appended in the order they are met.
 */
public class DiagramBuilder {

    private final BlockHandlerRegistry registry;
    private final DiagnosticsEngine diagnostics;

    /**
     * @param registry The handlers for each block kind.
     * @param diagnostics Receives warnings.
     */
    public DiagramBuilder(BlockHandlerRegistry registry, DiagnosticsEngine diagnostics) {
        this.registry = registry;
        this.diagnostics = diagnostics;
    }

    /**
     * Builds a diagram from blocks.
     *
     * @param blocks The blocks in file order.
     * @return The diagram.
     * @throws DiagramException on the first invalid block or line.
     */
    public Diagram build(List<SourceBlock> blocks) throws DiagramException {
        BuildContext context = new BuildContext(diagnostics);
        Map<BlockKind, SourceBlock> basicBlocks = new EnumMap<>(BlockKind.class);

        for (SourceBlock block : blocks) {
            BlockKind kind = block.kind();
            if (!kind.isSignal()) {
                SourceBlock previous = basicBlocks.putIfAbsent(kind, block);
                if (previous != null) {
                    throw new DiagramException(ErrorKind.DUPLICATE_BASIC_BLOCK,
                            "Only one " + kind.keyword() + " block is allowed; the first is on line "
                                    + previous.header().line().number(),
                            block.header().line().sourceInfo());
                }
            }
            IBlockHandler handler = registry.get(kind)
                    .orElseThrow(() -> new IllegalStateException("No handler registered for " + kind));
            handler.handle(block, context);
        }

        warnAboutHiddenChanges(context);
        return context.toDiagram();
    }

    private void warnAboutHiddenChanges(BuildContext context) {
        TimeSettings time = context.getTime();
        for (ChangeAssignment change : context.getChanges()) {
            if (change.time() > time.end()) {
                context.warn("Change at time " + change.time() + " is after the end of the diagram ("
                        + time.end() + ") and will not be shown", change.line());
            }
        }
    }
}
