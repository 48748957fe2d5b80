package org.drawtime.render.surface;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SurfaceWritersTest {

    @Test
    void choosesWriterByExtension() throws IOException {
        assertThat(SurfaceWriters.forPath(Path.of("a.svg"), true)).isInstanceOf(SvgSurfaceWriter.class);
        assertThat(((RasterSurfaceWriter) SurfaceWriters.forPath(Path.of("a.PNG"), true)).getFormatName()).isEqualTo("png");
        assertThat(((RasterSurfaceWriter) SurfaceWriters.forPath(Path.of("a.jpg"), true)).getFormatName()).isEqualTo("jpeg");
        assertThat(((RasterSurfaceWriter) SurfaceWriters.forPath(Path.of("dir.v2/a.jpeg"), true)).getFormatName()).isEqualTo("jpeg");
        assertThat(((RasterSurfaceWriter) SurfaceWriters.forPath(Path.of("a.bmp"), true)).getFormatName()).isEqualTo("bmp");
        assertThat(((RasterSurfaceWriter) SurfaceWriters.forPath(Path.of("a.gif"), true)).getFormatName()).isEqualTo("gif");
    }

    @Test
    void rejectsUnknownExtensions() {
        assertThatThrownBy(() -> SurfaceWriters.forPath(Path.of("a.tiff"), true))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("tiff");
        assertThatThrownBy(() -> SurfaceWriters.forPath(Path.of("noextension"), true))
                .isInstanceOf(IOException.class);
    }
}
