package org.drawtime.compiler.frontend.builder;

import org.drawtime.compiler.api.DiagramException;
import org.drawtime.compiler.api.ErrorKind;
import org.drawtime.compiler.frontend.label.LabelSegmenter;
import org.drawtime.compiler.frontend.lexer.SourceBlock;
import org.drawtime.compiler.frontend.parser.ParsedLine.PropertyAssignment;
import org.drawtime.compiler.frontend.parser.ValueParser;
import org.drawtime.model.ClockSignal;

import java.util.Optional;
import java.util.Set;

/**
 * Handles {@code clock} blocks: {@code length} (required), {@code duty} and {@code offset}.
 * Clock blocks take no change lines.
 */
public class ClockBlockHandler extends AbstractBlockHandler {

    static final Set<String> PROPERTIES = Set.of("length", "duty", "offset");

    @Override
    public void handle(SourceBlock block, BuildContext context) throws DiagramException {
        BlockBody body = BlockBody.parse(block, PROPERTIES, false, context);

        if (body.property("length").isEmpty()) {
            throw new DiagramException(ErrorKind.MISSING_PROPERTY,
                    "A clock signal must have a length", block.header().line().sourceInfo());
        }
        int length = intProperty(body, "length", 0);
        int offset = intProperty(body, "offset", 0);
        double duty = ClockSignal.DEFAULT_DUTY;
        Optional<PropertyAssignment> dutyAssignment = body.property("duty");
        if (dutyAssignment.isPresent()) {
            duty = ValueParser.parseDecimal(dutyAssignment.get().rawValue(), dutyAssignment.get().line());
        }

        if (length <= 0) {
            throw rangeError(body, "length", "The clock length must be positive");
        }
        if (!(duty > 0 && duty < 1)) {
            throw rangeError(body, "duty", "The clock duty cycle must be within (0, 1) exclusive");
        }

        String name = block.header().label();
        context.addSignal(new ClockSignal(name, LabelSegmenter.segment(name), length, duty, offset));
    }
}
