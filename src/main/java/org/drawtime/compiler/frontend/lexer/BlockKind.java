package org.drawtime.compiler.frontend.lexer;

import org.drawtime.model.SignalKind;

import java.util.Arrays;
import java.util.Optional;

/**
 * The block types a header line can open.
 */
public enum BlockKind {
    TIME("time", null),
    STYLE("style", null),
    LINE("line", SignalKind.LINE),
    BUS("bus", SignalKind.BUS),
    CLOCK("clock", SignalKind.CLOCK);

    private final String keyword;
    private final SignalKind signalKind;

    BlockKind(String keyword, SignalKind signalKind) {
        this.keyword = keyword;
        this.signalKind = signalKind;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * @return {@code true} for line, bus and clock blocks, which require a label.
     */
    public boolean isSignal() {
        return signalKind != null;
    }

    /**
     * @return The signal kind of a signal block.
     * @throws IllegalStateException for the basic time and style blocks.
     */
    public SignalKind signalKind() {
        if (signalKind == null) {
            throw new IllegalStateException(keyword + " is not a signal block");
        }
        return signalKind;
    }

    /**
     * Looks up a block kind by its header keyword. Keywords are case-sensitive.
     *
     * @param keyword The keyword from a header line.
     * @return The block kind, or empty if the keyword is unknown.
     */
    public static Optional<BlockKind> fromKeyword(String keyword) {
        return Arrays.stream(values()).filter(k -> k.keyword.equals(keyword)).findFirst();
    }
}
