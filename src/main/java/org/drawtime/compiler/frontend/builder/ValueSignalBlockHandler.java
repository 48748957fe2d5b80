package org.drawtime.compiler.frontend.builder;

import org.drawtime.compiler.api.DiagramException;
import org.drawtime.compiler.frontend.label.LabelSegmenter;
import org.drawtime.compiler.frontend.lexer.SourceBlock;
import org.drawtime.compiler.frontend.parser.ParsedLine.ChangeAssignment;
import org.drawtime.compiler.frontend.parser.ParsedLine.PropertyAssignment;
import org.drawtime.compiler.frontend.parser.ValueParser;
import org.drawtime.model.BusSignal;
import org.drawtime.model.LabelSegments;
import org.drawtime.model.LineSignal;
import org.drawtime.model.SignalChange;
import org.drawtime.model.SignalKind;
import org.drawtime.model.Value;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Handles {@code line} and {@code bus} blocks: an optional {@code start} value followed by
 * {@code time -> value} change lines.
 */
public class ValueSignalBlockHandler extends AbstractBlockHandler {

    static final Set<String> PROPERTIES = Set.of("start");

    @Override
    public void handle(SourceBlock block, BuildContext context) throws DiagramException {
        SignalKind kind = block.kind().signalKind();
        BlockBody body = BlockBody.parse(block, PROPERTIES, true, context);

        Value startValue = Value.UNKNOWN;
        Optional<PropertyAssignment> start = body.property("start");
        if (start.isPresent()) {
            startValue = ValueParser.parseSignalValue(start.get().rawValue(), kind, start.get().line());
        }

        List<SignalChange> changes = new ArrayList<>(body.changes().size());
        Map<Integer, ChangeAssignment> byTime = new HashMap<>();
        for (ChangeAssignment change : body.changes()) {
            Value value = ValueParser.parseSignalValue(change.rawValue(), kind, change.line());
            ChangeAssignment previous = byTime.put(change.time(), change);
            if (previous != null) {
                context.warn("Change at time " + change.time() + " replaces the one on line "
                        + previous.line().number(), change.line());
            }
            context.recordChange(change);
            changes.add(new SignalChange(change.time(), value));
        }

        String name = block.header().label();
        LabelSegments label = LabelSegmenter.segment(name);
        if (kind == SignalKind.BUS) {
            context.addSignal(new BusSignal(name, label, startValue, changes));
        } else {
            context.addSignal(new LineSignal(name, label, startValue, changes));
        }
    }
}
