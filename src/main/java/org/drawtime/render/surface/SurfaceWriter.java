package org.drawtime.render.surface;

import org.drawtime.render.draw.RenderedDiagram;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Encodes a rendered diagram into an image file.
 */
public interface SurfaceWriter {

    /**
     * Writes the image, replacing an existing file.
     *
     * @param diagram The rendered diagram.
     * @param output The destination file.
     * @throws IOException if the file cannot be written.
     */
    void write(RenderedDiagram diagram, Path output) throws IOException;
}
