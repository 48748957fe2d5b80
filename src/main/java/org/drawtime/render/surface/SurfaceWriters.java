package org.drawtime.render.surface;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Chooses a {@link SurfaceWriter} from the extension of the output file.
 */
public final class SurfaceWriters {

    private SurfaceWriters() {}

    /**
     * @param output The output file; its extension selects the format.
     * @param antialiasing Whether raster output is antialiased.
     * @return The writer for that format.
     * @throws IOException if the extension names no supported format.
     */
    public static SurfaceWriter forPath(Path output, boolean antialiasing) throws IOException {
        String extension = extensionOf(output);
        switch (extension) {
            case "png":
                return new RasterSurfaceWriter("png", antialiasing);
            case "jpg":
            case "jpeg":
                return new RasterSurfaceWriter("jpeg", antialiasing);
            case "bmp":
                return new RasterSurfaceWriter("bmp", antialiasing);
            case "gif":
                return new RasterSurfaceWriter("gif", antialiasing);
            case "svg":
                return new SvgSurfaceWriter();
            default:
                throw new IOException("Unsupported image format '" + extension + "' for " + output
                        + " (expected png, jpg, jpeg, bmp, gif or svg)");
        }
    }

    static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
