package org.drawtime.render.surface;

import org.drawtime.model.RgbColor;
import org.drawtime.render.draw.DrawOp;
import org.drawtime.render.draw.Point;
import org.drawtime.render.draw.RenderedDiagram;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SvgSurfaceWriterTest {

    private static final RenderedDiagram DIAGRAM = new RenderedDiagram(200, 100, new RgbColor(0xFAFAFA), List.of(
            DrawOp.LineOp.solid(new Point(0, 0), new Point(10.5, 20.25), 2.0, RgbColor.BLACK),
            new DrawOp.LineOp(new Point(5, 0), new Point(5, 100), 1.0, RgbColor.BLACK, 4.0),
            new DrawOp.PolygonOp(List.of(new Point(1, 1), new Point(9, 1), new Point(5, 8)),
                    new RgbColor(0xA0A0A4), RgbColor.BLACK, 2.0),
            new DrawOp.PolygonOp(List.of(new Point(0, 0), new Point(1, 0), new Point(1, 1)), null, RgbColor.BLACK, 1.0),
            new DrawOp.TextOp(12, 30, "a<b & \"c\"", "Times New Roman", 12, new RgbColor(0x102030))));

    @Test
    void writesEveryOperation(@TempDir Path dir) throws Exception {
        Path output = dir.resolve("out.svg");

        new SvgSurfaceWriter().write(DIAGRAM, output);

        String svg = Files.readString(output, StandardCharsets.UTF_8);
        assertThat(svg).startsWith("<?xml").endsWith("</svg>\n");
        assertThat(svg).contains("width=\"200\" height=\"100\"");
        assertThat(svg).contains("fill=\"#FAFAFA\"");
        assertThat(svg).contains("<line x1=\"0\" y1=\"0\" x2=\"10.50\" y2=\"20.25\" stroke=\"#000000\" stroke-width=\"2\"/>");
        assertThat(svg).contains("stroke-dasharray=\"4\"");
        assertThat(svg).contains("<polygon points=\"1,1 9,1 5,8\" fill=\"#A0A0A4\"");
        assertThat(svg).contains("<polygon points=\"0,0 1,0 1,1\" fill=\"none\"");
        assertThat(svg).contains(">a&lt;b &amp; &quot;c&quot;</text>");
        assertThat(svg).contains("font-family=\"Times New Roman\" font-size=\"12\" fill=\"#102030\"");
    }

    @Test
    void escapesMarkup() {
        assertThat(SvgSurfaceWriter.escape("<'&'>")).isEqualTo("&lt;&apos;&amp;&apos;&gt;");
    }
}
