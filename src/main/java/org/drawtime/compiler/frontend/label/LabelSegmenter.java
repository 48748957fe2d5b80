package org.drawtime.compiler.frontend.label;

import org.drawtime.model.LabelSegment;
import org.drawtime.model.LabelSegments;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a raw signal label into display segments with overline flags.
 * <p>
 * The label is split on {@code /}. Only the first two segments may carry an overline: when such a
 * segment starts with {@code !} (nothing, not even whitespace, before it) the marker is dropped and
 * the segment is overlined. The third and later segments are always displayed verbatim, including
 * a leading {@code !}. This limit is part of the label language as documented and is kept as is:
 * {@code !AB/!CD/!EF} displays as {@code AB/CD/!EF} with AB and CD overlined.
 */
public final class LabelSegmenter {

    private static final Pattern SEPARATOR = Pattern.compile(Pattern.quote(LabelSegments.SEPARATOR));
    private static final char OVERLINE_MARKER = '!';

    private LabelSegmenter() {}

    /**
     * Segments a raw label.
     *
     * @param rawLabel The label as written in the block header.
     * @return The display segments.
     */
    public static LabelSegments segment(String rawLabel) {
        String[] parts = SEPARATOR.split(rawLabel, -1);
        List<LabelSegment> segments = new ArrayList<>(parts.length);
        segments.add(markup(parts[0]));
        if (parts.length > 1) {
            segments.add(markup(parts[1]));
        }
        for (int i = 2; i < parts.length; i++) {
            segments.add(verbatim(parts[i]));
        }
        return new LabelSegments(segments);
    }

    private static LabelSegment markup(String part) {
        if (!part.isEmpty() && part.charAt(0) == OVERLINE_MARKER) {
            return new LabelSegment(part.substring(1), true);
        }
        return verbatim(part);
    }

    private static LabelSegment verbatim(String part) {
        return new LabelSegment(part, false);
    }
}
