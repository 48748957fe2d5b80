package org.drawtime.model;

/**
 * One slash-separated part of a signal label.
 *
 * @param text The text to display, without any overline marker.
 * @param overlined Whether a stroke is drawn above the text.
 */
public record LabelSegment(String text, boolean overlined) {
}
