package org.drawtime.compiler.frontend.builder;

import org.drawtime.compiler.diagnostics.DiagnosticsEngine;
import org.drawtime.compiler.frontend.lexer.SourceLine;
import org.drawtime.compiler.frontend.parser.ParsedLine.ChangeAssignment;
import org.drawtime.model.Diagram;
import org.drawtime.model.Signal;
import org.drawtime.model.StyleSettings;
import org.drawtime.model.TimeSettings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The mutable state of one diagram build. Created per build and discarded afterwards.
 */
public class BuildContext {

    private final DiagnosticsEngine diagnostics;
    private TimeSettings time = TimeSettings.DEFAULTS;
    private StyleSettings style = StyleSettings.DEFAULTS;
    private final List<Signal> signals = new ArrayList<>();
    private final List<ChangeAssignment> changes = new ArrayList<>();

    /**
     * @param diagnostics Receives the warnings raised during the build.
     */
    public BuildContext(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    public void setTime(TimeSettings time) {
        this.time = time;
    }

    public void setStyle(StyleSettings style) {
        this.style = style;
    }

    public void addSignal(Signal signal) {
        signals.add(signal);
    }

    /**
     * Remembers a change line so it can be checked against the time window once all blocks are read.
     * @param change The change line.
     */
    public void recordChange(ChangeAssignment change) {
        changes.add(change);
    }

    public List<ChangeAssignment> getChanges() {
        return Collections.unmodifiableList(changes);
    }

    /**
     * Reports a non-fatal observation about a line.
     * @param message The message.
     * @param line The line concerned.
     */
    public void warn(String message, SourceLine line) {
        diagnostics.reportWarning(message, line.fileName(), line.number());
    }

    public TimeSettings getTime() {
        return time;
    }

    /**
     * @return The diagram assembled so far.
     */
    public Diagram toDiagram() {
        return new Diagram(time, style, signals);
    }
}
