package org.drawtime.render.surface;

import org.drawtime.model.RgbColor;
import org.drawtime.render.draw.DrawOp;
import org.drawtime.render.draw.Point;
import org.drawtime.render.draw.RenderedDiagram;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RasterSurfaceWriter}. Runs headless; text is not checked pixel by pixel.
 */
@Tag("integration")
class RasterSurfaceWriterTest {

    private static final RenderedDiagram DIAGRAM = new RenderedDiagram(40, 30, new RgbColor(0x00FF00), List.of(
            new DrawOp.PolygonOp(List.of(new Point(10, 10), new Point(30, 10), new Point(30, 20), new Point(10, 20)),
                    new RgbColor(0xFF0000), null, 1.0),
            DrawOp.LineOp.solid(new Point(0, 25), new Point(40, 25), 3.0, new RgbColor(0x0000FF)),
            new DrawOp.TextOp(1, 8, "x", "Dialog", 6, RgbColor.BLACK)));

    @Test
    void paintsBackgroundAndShapes() {
        BufferedImage image = new RasterSurfaceWriter("png", false).paint(DIAGRAM);

        assertThat(image.getWidth()).isEqualTo(40);
        assertThat(image.getHeight()).isEqualTo(30);
        assertThat(image.getRGB(35, 5) & 0xFFFFFF).isEqualTo(0x00FF00);
        assertThat(image.getRGB(20, 15) & 0xFFFFFF).isEqualTo(0xFF0000);
        assertThat(image.getRGB(20, 25) & 0xFFFFFF).isEqualTo(0x0000FF);
    }

    @Test
    void writesReadableImage(@TempDir Path dir) throws Exception {
        Path output = dir.resolve("out.png");

        new RasterSurfaceWriter("png", true).write(DIAGRAM, output);

        BufferedImage read = ImageIO.read(output.toFile());
        assertThat(read).isNotNull();
        assertThat(read.getWidth()).isEqualTo(40);
        assertThat(read.getRGB(20, 15) & 0xFFFFFF).isEqualTo(0xFF0000);
    }
}
