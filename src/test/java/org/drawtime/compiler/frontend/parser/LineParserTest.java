package org.drawtime.compiler.frontend.parser;

import org.drawtime.compiler.api.DiagramException;
import org.drawtime.compiler.api.ErrorKind;
import org.drawtime.compiler.frontend.lexer.SourceLine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the {@link LineParser}.
 */
public class LineParserTest {

    private static SourceLine line(String text) {
        return new SourceLine("test.dt", 3, text);
    }

    @Test
    @Tag("unit")
    void testPropertyLine() throws DiagramException {
        ParsedLine parsed = LineParser.parse(line("  font_family =   Courier New "));

        assertThat(parsed).isInstanceOf(ParsedLine.PropertyAssignment.class);
        ParsedLine.PropertyAssignment property = (ParsedLine.PropertyAssignment) parsed;
        assertThat(property.key()).isEqualTo("font_family");
        assertThat(property.rawValue()).isEqualTo("Courier New");
    }

    @Test
    @Tag("unit")
    void testChangeLineWithNegativeTime() throws DiagramException {
        ParsedLine parsed = LineParser.parse(line("-20->Z"));

        assertThat(parsed).isEqualTo(new ParsedLine.ChangeAssignment(-20, "Z", line("-20->Z")));
    }

    /**
     * Verifies that a bus word may contain both operators: the line is a change line because no
     * {@code =} precedes the first {@code ->}.
     */
    @Test
    @Tag("unit")
    void testChangeValueMayContainOperators() throws DiagramException {
        ParsedLine parsed = LineParser.parse(line("40 -> \"a=b -> c\""));

        assertThat(parsed).isInstanceOf(ParsedLine.ChangeAssignment.class);
        assertThat(((ParsedLine.ChangeAssignment) parsed).rawValue()).isEqualTo("\"a=b -> c\"");
    }

    @Test
    @Tag("unit")
    void testPropertyValueMayContainArrow() throws DiagramException {
        ParsedLine parsed = LineParser.parse(line("start = \"x->y\""));

        assertThat(parsed).isInstanceOf(ParsedLine.PropertyAssignment.class);
        assertThat(((ParsedLine.PropertyAssignment) parsed).rawValue()).isEqualTo("\"x->y\"");
    }

    @Test
    @Tag("unit")
    void testNonIntegerChangeTime() {
        DiagramException e = catchThrowableOfType(() -> LineParser.parse(line("1.5 -> 1")), DiagramException.class);

        assertThat(e.getKind()).isEqualTo(ErrorKind.MALFORMED_CHANGE_LINE);
        assertThat(e.getSourceInfo().orElseThrow().lineNumber()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void testOverflowingChangeTime() {
        DiagramException e = catchThrowableOfType(() -> LineParser.parse(line("99999999999 -> 1")), DiagramException.class);

        assertThat(e.getKind()).isEqualTo(ErrorKind.MALFORMED_CHANGE_LINE);
    }

    @Test
    @Tag("unit")
    void testMalformedPropertyLines() {
        assertThat(catchThrowableOfType(() -> LineParser.parse(line("just words")), DiagramException.class).getKind())
                .isEqualTo(ErrorKind.MALFORMED_PROPERTY_LINE);
        assertThat(catchThrowableOfType(() -> LineParser.parse(line("font size = 3")), DiagramException.class).getKind())
                .isEqualTo(ErrorKind.MALFORMED_PROPERTY_LINE);
        assertThat(catchThrowableOfType(() -> LineParser.parse(line("= 3")), DiagramException.class).getKind())
                .isEqualTo(ErrorKind.MALFORMED_PROPERTY_LINE);
    }
}
