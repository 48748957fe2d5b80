package org.drawtime.render;

import org.drawtime.compiler.api.DiagramException;
import org.drawtime.model.Diagram;
import org.drawtime.render.draw.DrawingEngine;
import org.drawtime.render.draw.RenderedDiagram;
import org.drawtime.render.layout.AwtTextMeasurer;
import org.drawtime.render.layout.LayoutEngine;
import org.drawtime.render.layout.LayoutResult;
import org.drawtime.render.layout.TextMeasurer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lays out and draws a diagram. The result is independent of any image format.
 */
public class DiagramRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(DiagramRenderer.class);

    private final LayoutEngine layoutEngine;
    private final DrawingEngine drawingEngine;

    /**
     * Creates a renderer that measures text with Java2D fonts.
     *
     * @param options The drawing parameters.
     */
    public DiagramRenderer(RenderOptions options) {
        this(options, new AwtTextMeasurer(options.antialiasing()));
    }

    /**
     * @param options The drawing parameters.
     * @param measurer The source of font metrics.
     */
    public DiagramRenderer(RenderOptions options, TextMeasurer measurer) {
        this.layoutEngine = new LayoutEngine(options, measurer);
        this.drawingEngine = new DrawingEngine(options);
    }

    /**
     * Renders a diagram.
     *
     * @param diagram The diagram.
     * @return The canvas and its drawing operations.
     * @throws DiagramException if the canvas is too small for the diagram.
     */
    public RenderedDiagram render(Diagram diagram) throws DiagramException {
        LayoutResult layout = layoutEngine.layout(diagram);
        LOG.debug("Layout: plot {}x{} at ({}, {}), {} rows, {} grid lines",
                layout.plot().width(), layout.plot().height(), layout.plot().left(), layout.plot().top(),
                layout.rows().size(), layout.gridLines().size());
        RenderedDiagram rendered = drawingEngine.draw(diagram, layout);
        LOG.debug("Drew {} operations", rendered.operations().size());
        return rendered;
    }
}
