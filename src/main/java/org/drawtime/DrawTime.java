package org.drawtime;

import org.drawtime.compiler.DiagramCompiler;
import org.drawtime.compiler.api.DiagramException;
import org.drawtime.compiler.api.ErrorKind;
import org.drawtime.compiler.api.IDiagramCompiler;
import org.drawtime.model.Diagram;
import org.drawtime.render.DiagramRenderer;
import org.drawtime.render.RenderOptions;
import org.drawtime.render.draw.RenderedDiagram;
import org.drawtime.render.surface.SurfaceWriter;
import org.drawtime.render.surface.SurfaceWriters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Entry point for embedding DrawTime: reads a diagram source file, renders it and hands the result
 * to a {@link SurfaceWriter}.
 * <p>
 * Reading the source and writing the image are the only I/O; failures of either are reported as
 * {@link ErrorKind#IO_FAILURE}. Every call recompiles from the source file.
 */
public class DrawTime {

    private static final Logger LOG = LoggerFactory.getLogger(DrawTime.class);
    private static final String DEFAULT_EXTENSION = ".png";

    private final IDiagramCompiler compiler;
    private final DiagramRenderer renderer;
    private final RenderOptions options;

    /**
     * @param options The drawing parameters.
     */
    public DrawTime(RenderOptions options) {
        this(new DiagramCompiler(), new DiagramRenderer(options), options);
    }

    /**
     * @param compiler The front end.
     * @param renderer The layout and drawing engine.
     * @param options The drawing parameters, used to configure surface writers.
     */
    public DrawTime(IDiagramCompiler compiler, DiagramRenderer renderer, RenderOptions options) {
        this.compiler = compiler;
        this.renderer = renderer;
        this.options = options;
    }

    /**
     * @param source The diagram source file.
     * @return The diagram model.
     * @throws DiagramException on the first parse error, or if the file cannot be read.
     */
    public Diagram parse(Path source) throws DiagramException {
        return compiler.compile(source);
    }

    /**
     * @param source The diagram source file.
     * @return The canvas and its drawing operations.
     * @throws DiagramException on the first error.
     */
    public RenderedDiagram render(Path source) throws DiagramException {
        return renderer.render(parse(source));
    }

    /**
     * Renders a source file into an image whose format follows from the output file's extension.
     *
     * @param source The diagram source file.
     * @param output The image file to write.
     * @throws DiagramException on the first error; {@link ErrorKind#IO_FAILURE} for an unsupported
     *         extension or an unwritable destination.
     */
    public void render(Path source, Path output) throws DiagramException {
        final SurfaceWriter writer;
        try {
            writer = SurfaceWriters.forPath(output, options.antialiasing());
        } catch (IOException e) {
            throw new DiagramException(ErrorKind.IO_FAILURE, e.getMessage(), e);
        }
        render(source, output, writer);
    }

    /**
     * Renders a source file with the given surface writer.
     *
     * @param source The diagram source file.
     * @param output The image file to write.
     * @param writer The encoder for the output format.
     * @throws DiagramException on the first error; {@link ErrorKind#IO_FAILURE} if writing fails.
     */
    public void render(Path source, Path output, SurfaceWriter writer) throws DiagramException {
        RenderedDiagram rendered = render(source);
        try {
            writer.write(rendered, output);
        } catch (IOException e) {
            throw new DiagramException(ErrorKind.IO_FAILURE, "Cannot write image " + output + ": " + e.getMessage(), e);
        }
        LOG.debug("{} -> {} ({}x{}, {} operations)", source, output,
                rendered.width(), rendered.height(), rendered.operations().size());
    }

    /**
     * @param source A diagram source file.
     * @return The source path with its extension replaced by {@code .png}.
     */
    public static Path defaultOutput(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return source.resolveSibling(base + DEFAULT_EXTENSION);
    }
}
