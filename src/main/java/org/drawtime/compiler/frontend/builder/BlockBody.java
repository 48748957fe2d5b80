package org.drawtime.compiler.frontend.builder;

import org.drawtime.compiler.api.DiagramException;
import org.drawtime.compiler.api.ErrorKind;
import org.drawtime.compiler.frontend.lexer.SourceBlock;
import org.drawtime.compiler.frontend.lexer.SourceLine;
import org.drawtime.compiler.frontend.parser.LineParser;
import org.drawtime.compiler.frontend.parser.ParsedLine;
import org.drawtime.compiler.frontend.parser.ParsedLine.ChangeAssignment;
import org.drawtime.compiler.frontend.parser.ParsedLine.PropertyAssignment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The parsed lines of one block: its effective properties (last assignment wins) and its change
 * lines in declaration order.
 */
final class BlockBody {

    private final SourceBlock block;
    private final Map<String, PropertyAssignment> properties = new LinkedHashMap<>();
    private final List<ChangeAssignment> changes = new ArrayList<>();

    private BlockBody(SourceBlock block) {
        this.block = block;
    }

    /**
     * Parses every line of a block.
     *
     * @param block The block.
     * @param allowedKeys The property keys the block accepts.
     * @param allowChanges Whether change lines are accepted.
     * @param context Receives warnings for overridden properties.
     * @return The parsed body.
     * @throws DiagramException on a malformed line, an unknown key or a change line where none is allowed.
     */
    static BlockBody parse(SourceBlock block, Set<String> allowedKeys, boolean allowChanges, BuildContext context)
            throws DiagramException {
        BlockBody body = new BlockBody(block);
        String blockName = block.kind().keyword();
        for (SourceLine line : block.lines()) {
            ParsedLine parsed = LineParser.parse(line);
            if (parsed instanceof PropertyAssignment property) {
                if (!allowedKeys.contains(property.key())) {
                    throw new DiagramException(ErrorKind.UNKNOWN_PROPERTY,
                            "Unknown " + blockName + " property '" + property.key() + "'", line.sourceInfo());
                }
                PropertyAssignment previous = body.properties.remove(property.key());
                if (previous != null) {
                    context.warn("Property '" + property.key() + "' overrides the value set on line "
                            + previous.line().number(), line);
                }
                body.properties.put(property.key(), property);
            } else if (parsed instanceof ChangeAssignment change) {
                if (!allowChanges) {
                    throw new DiagramException(ErrorKind.MALFORMED_CHANGE_LINE,
                            "A " + blockName + " block does not support change lines", line.sourceInfo());
                }
                body.changes.add(change);
            }
        }
        return body;
    }

    Optional<PropertyAssignment> property(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    List<ChangeAssignment> changes() {
        return changes;
    }

    /**
     * @param key A property key.
     * @return The line assigning the key, or the block header if the key is not assigned.
     */
    SourceLine lineOf(String key) {
        PropertyAssignment assignment = properties.get(key);
        return assignment != null ? assignment.line() : block.header().line();
    }

    SourceBlock block() {
        return block;
    }
}
