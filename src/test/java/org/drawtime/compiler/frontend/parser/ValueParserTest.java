package org.drawtime.compiler.frontend.parser;

import org.drawtime.compiler.api.DiagramException;
import org.drawtime.compiler.api.ErrorKind;
import org.drawtime.compiler.frontend.lexer.SourceLine;
import org.drawtime.model.RgbColor;
import org.drawtime.model.SignalKind;
import org.drawtime.model.Value;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the {@link ValueParser}, in particular the kind-dependent signal value
 * grammar.
 */
@Tag("unit")
public class ValueParserTest {

    private static final SourceLine LINE = new SourceLine("test.dt", 1, "x");

    private static ErrorKind errorOf(ThrowingParse parse) {
        return catchThrowableOfType(parse::run, DiagramException.class).getKind();
    }

    @FunctionalInterface
    private interface ThrowingParse {
        void run() throws DiagramException;
    }

    @Test
    void testIntegers() throws DiagramException {
        assertThat(ValueParser.parseInt("-15", LINE)).isEqualTo(-15);
        assertThat(ValueParser.parseInt("+7", LINE)).isEqualTo(7);
        assertThat(errorOf(() -> ValueParser.parseInt("1.0", LINE))).isEqualTo(ErrorKind.INVALID_PROPERTY_VALUE);
        assertThat(errorOf(() -> ValueParser.parseInt("ten", LINE))).isEqualTo(ErrorKind.INVALID_PROPERTY_VALUE);
        assertThat(errorOf(() -> ValueParser.parseInt("3000000000", LINE))).isEqualTo(ErrorKind.INVALID_PROPERTY_VALUE);
    }

    @Test
    void testDecimals() throws DiagramException {
        assertThat(ValueParser.parseDecimal("0.25", LINE)).isEqualTo(0.25);
        assertThat(ValueParser.parseDecimal(".5", LINE)).isEqualTo(0.5);
        assertThat(ValueParser.parseDecimal("1e-1", LINE)).isEqualTo(0.1);
        assertThat(errorOf(() -> ValueParser.parseDecimal("NaN", LINE))).isEqualTo(ErrorKind.INVALID_PROPERTY_VALUE);
    }

    @Test
    void testColors() throws DiagramException {
        assertThat(ValueParser.parseColor("00ff80", LINE)).isEqualTo(new RgbColor(0x00FF80));
        assertThat(errorOf(() -> ValueParser.parseColor("#00FF80", LINE))).isEqualTo(ErrorKind.INVALID_COLOR);
        assertThat(errorOf(() -> ValueParser.parseColor("0F0", LINE))).isEqualTo(ErrorKind.INVALID_COLOR);
        assertThat(errorOf(() -> ValueParser.parseColor("GGGGGG", LINE))).isEqualTo(ErrorKind.INVALID_COLOR);
    }

    @Test
    void testLineValues() throws DiagramException {
        assertThat(ValueParser.parseSignalValue("0", SignalKind.LINE, LINE)).isEqualTo(Value.ZERO);
        assertThat(ValueParser.parseSignalValue("1", SignalKind.LINE, LINE)).isEqualTo(Value.ONE);
        assertThat(ValueParser.parseSignalValue("?", SignalKind.LINE, LINE)).isEqualTo(Value.UNKNOWN);
        assertThat(ValueParser.parseSignalValue("Z", SignalKind.LINE, LINE)).isEqualTo(Value.FLOATING);
        assertThat(errorOf(() -> ValueParser.parseSignalValue("z", SignalKind.LINE, LINE)))
                .isEqualTo(ErrorKind.INVALID_SIGNAL_VALUE);
        assertThat(errorOf(() -> ValueParser.parseSignalValue("\"1\"", SignalKind.LINE, LINE)))
                .isEqualTo(ErrorKind.VALUE_KIND_MISMATCH);
    }

    @Test
    void testBusValues() throws DiagramException {
        assertThat(ValueParser.parseSignalValue("?", SignalKind.BUS, LINE)).isEqualTo(Value.UNKNOWN);
        assertThat(ValueParser.parseSignalValue("Z", SignalKind.BUS, LINE)).isEqualTo(Value.FLOATING);
        assertThat(ValueParser.parseSignalValue("\"0x1F\"", SignalKind.BUS, LINE)).isEqualTo(Value.data("0x1F"));
        assertThat(ValueParser.parseSignalValue("\"\"", SignalKind.BUS, LINE)).isEqualTo(Value.data(""));
        assertThat(errorOf(() -> ValueParser.parseSignalValue("1", SignalKind.BUS, LINE)))
                .isEqualTo(ErrorKind.VALUE_KIND_MISMATCH);
        assertThat(errorOf(() -> ValueParser.parseSignalValue("0", SignalKind.BUS, LINE)))
                .isEqualTo(ErrorKind.VALUE_KIND_MISMATCH);
        assertThat(errorOf(() -> ValueParser.parseSignalValue("word", SignalKind.BUS, LINE)))
                .isEqualTo(ErrorKind.INVALID_SIGNAL_VALUE);
    }

    /**
     * Verifies the accepted escapes: only backslash-quote and backslash-backslash.
     */
    @Test
    void testBusStringEscapes() throws DiagramException {
        assertThat(ValueParser.unquote("\"say \\\"hi\\\" \\\\ bye\"", LINE)).isEqualTo("say \"hi\" \\ bye");
        assertThat(errorOf(() -> ValueParser.unquote("\"tab\\t\"", LINE))).isEqualTo(ErrorKind.INVALID_SIGNAL_VALUE);
        assertThat(errorOf(() -> ValueParser.unquote("\"open", LINE))).isEqualTo(ErrorKind.INVALID_SIGNAL_VALUE);
        assertThat(errorOf(() -> ValueParser.unquote("\"ends with\\\"", LINE))).isEqualTo(ErrorKind.INVALID_SIGNAL_VALUE);
        assertThat(errorOf(() -> ValueParser.unquote("\"a\" b", LINE))).isEqualTo(ErrorKind.INVALID_SIGNAL_VALUE);
    }
}
