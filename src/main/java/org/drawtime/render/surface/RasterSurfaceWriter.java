package org.drawtime.render.surface;

import org.drawtime.model.RgbColor;
import org.drawtime.render.draw.DrawOp;
import org.drawtime.render.draw.Point;
import org.drawtime.render.draw.RenderedDiagram;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Line2D;
import java.awt.geom.Path2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Paints a rendered diagram with Java2D and encodes it with {@link ImageIO}.
 */
public class RasterSurfaceWriter implements SurfaceWriter {

    private final String formatName;
    private final boolean antialiasing;

    /**
     * @param formatName An ImageIO format name such as {@code png}, {@code jpeg}, {@code bmp} or {@code gif}.
     * @param antialiasing Whether shapes and text are antialiased.
     */
    public RasterSurfaceWriter(String formatName, boolean antialiasing) {
        this.formatName = formatName;
        this.antialiasing = antialiasing;
    }

    public String getFormatName() {
        return formatName;
    }

    @Override
    public void write(RenderedDiagram diagram, Path output) throws IOException {
        BufferedImage image = paint(diagram);
        if (!ImageIO.write(image, formatName, output.toFile())) {
            throw new IOException("No ImageIO writer for format '" + formatName + "'");
        }
    }

    /**
     * Paints a diagram onto a new RGB image.
     *
     * @param diagram The rendered diagram.
     * @return The painted image.
     */
    public BufferedImage paint(RenderedDiagram diagram) {
        BufferedImage image = new BufferedImage(diagram.width(), diagram.height(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            if (antialiasing) {
                g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
                g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            }
            g.setColor(toAwt(diagram.background()));
            g.fillRect(0, 0, diagram.width(), diagram.height());

            for (DrawOp op : diagram.operations()) {
                if (op instanceof DrawOp.LineOp line) {
                    drawLine(g, line);
                } else if (op instanceof DrawOp.PolygonOp polygon) {
                    drawPolygon(g, polygon);
                } else if (op instanceof DrawOp.TextOp text) {
                    drawText(g, text);
                }
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    private void drawLine(Graphics2D g, DrawOp.LineOp line) {
        g.setColor(toAwt(line.color()));
        g.setStroke(stroke(line.width(), line.isDashed() ? line.dashLength() : 0));
        g.draw(new Line2D.Double(line.from().x(), line.from().y(), line.to().x(), line.to().y()));
    }

    private void drawPolygon(Graphics2D g, DrawOp.PolygonOp polygon) {
        List<Point> points = polygon.points();
        if (points.isEmpty()) {
            return;
        }
        Path2D.Double path = new Path2D.Double();
        path.moveTo(points.get(0).x(), points.get(0).y());
        for (int i = 1; i < points.size(); i++) {
            path.lineTo(points.get(i).x(), points.get(i).y());
        }
        path.closePath();

        if (polygon.isFilled()) {
            g.setColor(toAwt(polygon.fill()));
            g.fill(path);
        }
        if (polygon.isStroked()) {
            g.setColor(toAwt(polygon.stroke()));
            g.setStroke(stroke(polygon.width(), 0));
            g.draw(path);
        }
    }

    private void drawText(Graphics2D g, DrawOp.TextOp text) {
        g.setColor(toAwt(text.color()));
        g.setFont(new Font(text.fontFamily(), Font.PLAIN, text.fontSize()));
        g.drawString(text.text(), (float) text.x(), (float) text.baseline());
    }

    private static BasicStroke stroke(double width, double dashLength) {
        if (dashLength <= 0) {
            return new BasicStroke((float) width);
        }
        float[] dash = {(float) dashLength, (float) dashLength};
        return new BasicStroke((float) width, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER, 10.0f, dash, 0.0f);
    }

    private static Color toAwt(RgbColor color) {
        return new Color(color.red(), color.green(), color.blue());
    }
}
