package org.drawtime.render.draw;

import org.drawtime.model.RgbColor;

import java.util.List;

/**
 * Everything a surface writer needs to produce an image: the canvas size, the background and the
 * drawing operations in painting order.
 *
 * @param width The canvas width in pixels.
 * @param height The canvas height in pixels.
 * @param background The colour the canvas is cleared to.
 * @param operations The drawing operations.
 */
public record RenderedDiagram(int width, int height, RgbColor background, List<DrawOp> operations) {

    public RenderedDiagram {
        operations = List.copyOf(operations);
    }
}
