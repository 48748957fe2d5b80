package org.drawtime.compiler;

import org.drawtime.model.BusSignal;
import org.drawtime.model.ClockSignal;
import org.drawtime.model.Diagram;
import org.drawtime.model.LineSignal;
import org.drawtime.model.Signal;
import org.drawtime.model.SignalChange;
import org.drawtime.model.StyleSettings;
import org.drawtime.model.TimeSettings;
import org.drawtime.model.Value;

import java.util.List;

/**
 * Writes a {@link Diagram} back in the block language. Every time and style property is written
 * explicitly, so the output does not depend on defaults; compiling it yields an equal diagram.
 */
public final class DiagramWriter {

    private static final String NEWLINE = "\n";

    private DiagramWriter() {}

    /**
     * @param diagram The diagram to write.
     * @return The canonical source text.
     */
    public static String write(Diagram diagram) {
        StringBuilder out = new StringBuilder();
        writeTime(diagram.time(), out);
        out.append(NEWLINE);
        writeStyle(diagram.style(), out);
        for (Signal signal : diagram.signals()) {
            out.append(NEWLINE);
            writeSignal(signal, out);
        }
        return out.toString();
    }

    private static void writeTime(TimeSettings time, StringBuilder out) {
        out.append("time:").append(NEWLINE);
        property(out, "start", time.start());
        property(out, "end", time.end());
        if (time.hasStep()) {
            property(out, "step", time.step());
        }
        property(out, "delay", time.delay());
    }

    private static void writeStyle(StyleSettings style, StringBuilder out) {
        out.append("style:").append(NEWLINE);
        property(out, "width", style.width());
        property(out, "height", style.height());
        property(out, "margin", style.margin());
        property(out, "font_size", style.fontSize());
        property(out, "font_family", style.fontFamily());
        property(out, "background", style.background().toHex());
        property(out, "foreground", style.foreground().toHex());
    }

    private static void writeSignal(Signal signal, StringBuilder out) {
        out.append(signal.kind().keyword()).append(' ').append(signal.name()).append(':').append(NEWLINE);
        if (signal instanceof ClockSignal clock) {
            property(out, "length", clock.length());
            property(out, "duty", clock.duty());
            property(out, "offset", clock.offset());
        } else if (signal instanceof LineSignal line) {
            writeValues(line.startValue(), line.changes(), out);
        } else if (signal instanceof BusSignal bus) {
            writeValues(bus.startValue(), bus.changes(), out);
        }
    }

    private static void writeValues(Value start, List<SignalChange> changes, StringBuilder out) {
        property(out, "start", format(start));
        for (SignalChange change : changes) {
            out.append(change.time()).append(" -> ").append(format(change.value())).append(NEWLINE);
        }
    }

    /**
     * Formats a value in source notation, quoting and escaping bus words.
     *
     * @param value The value.
     * @return The source token.
     */
    public static String format(Value value) {
        if (value instanceof Value.Data data) {
            return '"' + data.text().replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
        return value.toString();
    }

    private static void property(StringBuilder out, String key, Object value) {
        out.append(key).append(" = ").append(value).append(NEWLINE);
    }
}
