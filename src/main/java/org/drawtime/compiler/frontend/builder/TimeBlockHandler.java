package org.drawtime.compiler.frontend.builder;

import org.drawtime.compiler.api.DiagramException;
import org.drawtime.compiler.frontend.lexer.SourceBlock;
import org.drawtime.model.TimeSettings;

import java.util.Set;

/**
 * Handles the {@code time:} block: {@code start}, {@code end}, {@code step} and {@code delay}.
 */
public class TimeBlockHandler extends AbstractBlockHandler {

    static final Set<String> PROPERTIES = Set.of("start", "end", "step", "delay");

    @Override
    public void handle(SourceBlock block, BuildContext context) throws DiagramException {
        BlockBody body = BlockBody.parse(block, PROPERTIES, false, context);
        TimeSettings defaults = TimeSettings.DEFAULTS;

        int start = intProperty(body, "start", defaults.start());
        int end = intProperty(body, "end", defaults.end());
        int delay = intProperty(body, "delay", defaults.delay());
        Integer step = defaults.step();
        if (body.property("step").isPresent()) {
            step = intProperty(body, "step", 0);
        }

        if (end <= start) {
            throw rangeError(body, "end", "The end time (" + end + ") must be greater than the start time (" + start + ")");
        }
        if (step != null && step <= 0) {
            throw rangeError(body, "step", "The step must be positive");
        }
        if (delay < 0) {
            throw rangeError(body, "delay", "The delay must not be negative");
        }
        context.setTime(new TimeSettings(start, end, step, delay));
    }
}
