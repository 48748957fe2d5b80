package org.drawtime.render.surface;

import org.drawtime.model.RgbColor;
import org.drawtime.render.draw.DrawOp;
import org.drawtime.render.draw.Point;
import org.drawtime.render.draw.RenderedDiagram;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Writes a rendered diagram as an SVG 1.1 document.
 */
public class SvgSurfaceWriter implements SurfaceWriter {

    @Override
    public void write(RenderedDiagram diagram, Path output) throws IOException {
        Files.writeString(output, toSvg(diagram), StandardCharsets.UTF_8);
    }

    /**
     * @param diagram The rendered diagram.
     * @return The SVG document.
     */
    public String toSvg(RenderedDiagram diagram) {
        StringBuilder svg = new StringBuilder();
        svg.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        svg.append(String.format(Locale.ROOT,
                "<svg xmlns=\"http://www.w3.org/2000/svg\" version=\"1.1\" width=\"%d\" height=\"%d\" viewBox=\"0 0 %d %d\">\n",
                diagram.width(), diagram.height(), diagram.width(), diagram.height()));
        svg.append(String.format(Locale.ROOT, "  <rect x=\"0\" y=\"0\" width=\"%d\" height=\"%d\" fill=\"%s\"/>\n",
                diagram.width(), diagram.height(), color(diagram.background())));

        for (DrawOp op : diagram.operations()) {
            if (op instanceof DrawOp.LineOp line) {
                svg.append(String.format(Locale.ROOT,
                        "  <line x1=\"%s\" y1=\"%s\" x2=\"%s\" y2=\"%s\" stroke=\"%s\" stroke-width=\"%s\"%s/>\n",
                        num(line.from().x()), num(line.from().y()), num(line.to().x()), num(line.to().y()),
                        color(line.color()), num(line.width()),
                        line.isDashed() ? " stroke-dasharray=\"" + num(line.dashLength()) + "\"" : ""));
            } else if (op instanceof DrawOp.PolygonOp polygon) {
                String points = polygon.points().stream()
                        .map(SvgSurfaceWriter::point)
                        .collect(Collectors.joining(" "));
                svg.append(String.format(Locale.ROOT,
                        "  <polygon points=\"%s\" fill=\"%s\" stroke=\"%s\" stroke-width=\"%s\"/>\n",
                        points,
                        polygon.isFilled() ? color(polygon.fill()) : "none",
                        polygon.isStroked() ? color(polygon.stroke()) : "none",
                        num(polygon.width())));
            } else if (op instanceof DrawOp.TextOp text) {
                svg.append(String.format(Locale.ROOT,
                        "  <text x=\"%s\" y=\"%s\" font-family=\"%s\" font-size=\"%d\" fill=\"%s\" xml:space=\"preserve\">%s</text>\n",
                        num(text.x()), num(text.baseline()), escape(text.fontFamily()), text.fontSize(),
                        color(text.color()), escape(text.text())));
            }
        }
        svg.append("</svg>\n");
        return svg.toString();
    }

    private static String point(Point p) {
        return num(p.x()) + "," + num(p.y());
    }

    private static String num(double value) {
        String text = String.format(Locale.ROOT, "%.2f", value);
        if (text.endsWith(".00")) {
            text = text.substring(0, text.length() - 3);
        }
        return "-0".equals(text) ? "0" : text;
    }

    private static String color(RgbColor color) {
        return "#" + color.toHex();
    }

    static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '&' -> out.append("&amp;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&apos;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
