package org.drawtime.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A signal label split into display segments. Segments are displayed joined by {@code /}.
 *
 * @param segments The segments in display order, never empty.
 */
public record LabelSegments(List<LabelSegment> segments) {

    /** The character separating label segments. */
    public static final String SEPARATOR = "/";

    public LabelSegments {
        segments = List.copyOf(segments);
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("A label has at least one segment");
        }
    }

    /**
     * @return The label as displayed: segment texts joined by the separator.
     */
    public String displayText() {
        return segments.stream().map(LabelSegment::text).collect(Collectors.joining(SEPARATOR));
    }
}
