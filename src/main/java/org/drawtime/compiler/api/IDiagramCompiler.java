package org.drawtime.compiler.api;

import org.drawtime.model.Diagram;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Turns diagram source text into a {@link Diagram} model.
 */
public interface IDiagramCompiler {

    /**
     * Parses and builds a diagram.
     *
     * @param source The complete source text.
     * @param sourceName A name for the source, used in error positions.
     * @return The diagram described by the source.
     * @throws DiagramException on the first error found; no partial diagram is returned.
     */
    Diagram compile(String source, String sourceName) throws DiagramException;

    /**
     * Reads a UTF-8 source file and compiles it.
     *
     * @param sourcePath The file to read.
     * @return The diagram described by the file.
     * @throws DiagramException with {@link ErrorKind#IO_FAILURE} if the file cannot be read,
     *         or any parse error.
     */
    default Diagram compile(Path sourcePath) throws DiagramException {
        final String source;
        try {
            source = Files.readString(sourcePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DiagramException(ErrorKind.IO_FAILURE, "Cannot read diagram source " + sourcePath, e);
        }
        return compile(source, sourcePath.toString());
    }
}
