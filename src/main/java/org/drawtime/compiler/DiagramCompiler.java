package org.drawtime.compiler;

import org.drawtime.compiler.api.DiagramException;
import org.drawtime.compiler.api.IDiagramCompiler;
import org.drawtime.compiler.diagnostics.Diagnostic;
import org.drawtime.compiler.diagnostics.DiagnosticsEngine;
import org.drawtime.compiler.frontend.builder.BlockHandlerRegistry;
import org.drawtime.compiler.frontend.builder.DiagramBuilder;
import org.drawtime.compiler.frontend.lexer.BlockSplitter;
import org.drawtime.compiler.frontend.lexer.SourceBlock;
import org.drawtime.model.Diagram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the front end: source text is split into blocks, each block's lines are parsed, and the
 * blocks are assembled into a {@link Diagram}. The first error aborts the run.
 * <p>
 * Warnings of the last run are available from {@link #getDiagnostics()}. Not thread-safe; use one
 * instance per thread.
 */
public class DiagramCompiler implements IDiagramCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(DiagramCompiler.class);

    private final BlockHandlerRegistry registry;
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    public DiagramCompiler() {
        this(BlockHandlerRegistry.initialize());
    }

    /**
     * @param registry The block handlers to use.
     */
    public DiagramCompiler(BlockHandlerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Diagram compile(String source, String sourceName) throws DiagramException {
        diagnostics = new DiagnosticsEngine();

        // Phase 1: block splitting
        List<SourceBlock> blocks = new BlockSplitter().split(source, sourceName);
        LOG.debug("{}: {} blocks", sourceName, blocks.size());

        // Phase 2: line parsing and model building
        Diagram diagram = new DiagramBuilder(registry, diagnostics).build(blocks);
        LOG.debug("{}: {} signals, time window [{}, {}]", sourceName, diagram.signals().size(),
                diagram.time().start(), diagram.time().end());

        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            LOG.warn("{}", diagnostic);
        }
        return diagram;
    }

    /**
     * @return The warnings collected by the most recent {@link #compile} call.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics.getDiagnostics();
    }
}
