package org.drawtime.compiler.frontend.lexer;

import org.drawtime.compiler.api.DiagramException;
import org.drawtime.compiler.api.ErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Groups significant source lines into blocks.
 * <p>
 * A header line has the form {@code <keyword>[ <label>]:}. The header ends at the last colon on
 * the line, so labels may themselves contain colons. Every other line belongs to the most
 * recently opened block.
 */
public class BlockSplitter {

    private static final char HEADER_TERMINATOR = ':';

    /**
     * Splits source text into blocks.
     *
     * @param source The complete source text.
     * @param fileName The logical source name, used in error positions.
     * @return The blocks in file order.
     * @throws DiagramException on an unknown block keyword, a malformed header or a line before
     *         the first header.
     */
    public List<SourceBlock> split(String source, String fileName) throws DiagramException {
        List<SourceBlock> blocks = new ArrayList<>();
        BlockHeader currentHeader = null;
        List<SourceLine> currentLines = new ArrayList<>();

        for (SourceLine line : new SourceReader(source, fileName)) {
            Optional<BlockHeader> header = parseHeader(line);
            if (header.isPresent()) {
                if (currentHeader != null) {
                    blocks.add(new SourceBlock(currentHeader, currentLines));
                }
                currentHeader = header.get();
                currentLines = new ArrayList<>();
            } else {
                if (currentHeader == null) {
                    throw new DiagramException(ErrorKind.ORPHAN_LINE,
                            "A property or change line encountered outside of a block", line.sourceInfo());
                }
                currentLines.add(line);
            }
        }
        if (currentHeader != null) {
            blocks.add(new SourceBlock(currentHeader, currentLines));
        }
        return blocks;
    }

    /**
     * Recognizes a header line.
     *
     * @param line The line to inspect.
     * @return The parsed header, or empty if the line is not a header.
     * @throws DiagramException if the line ends with a colon but is not a valid header.
     */
    Optional<BlockHeader> parseHeader(SourceLine line) throws DiagramException {
        String content = line.content();
        if (content.isEmpty() || content.charAt(content.length() - 1) != HEADER_TERMINATOR) {
            return Optional.empty();
        }

        String body = content.substring(0, content.length() - 1).strip();
        if (body.isEmpty()) {
            throw new DiagramException(ErrorKind.MALFORMED_HEADER,
                    "A colon encountered without a block keyword", line.sourceInfo());
        }

        int split = indexOfWhitespace(body);
        String keyword = split < 0 ? body : body.substring(0, split);
        String label = split < 0 ? null : body.substring(split).strip();

        BlockKind kind = BlockKind.fromKeyword(keyword).orElseThrow(() -> new DiagramException(
                ErrorKind.UNKNOWN_BLOCK_KIND,
                "Unknown block type '" + keyword + "'. Valid types are time, style, line, bus and clock",
                line.sourceInfo()));

        if (kind.isSignal() && label == null) {
            throw new DiagramException(ErrorKind.MALFORMED_HEADER,
                    "A " + keyword + " block must have a label", line.sourceInfo());
        }
        if (!kind.isSignal() && label != null) {
            throw new DiagramException(ErrorKind.MALFORMED_HEADER,
                    "A " + keyword + " block must not have a label", line.sourceInfo());
        }
        return Optional.of(new BlockHeader(kind, label, line));
    }

    private static int indexOfWhitespace(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
