package org.drawtime.compiler.api;

/**
 * Defines the kinds of errors that can abort building or rendering a diagram.
 * Tests match on these instead of on message text.
 */
public enum ErrorKind {
    // region Block structure
    /** A header names a block type other than time, style, line, bus or clock. */
    UNKNOWN_BLOCK_KIND,
    /** A property or change line appears before the first header. */
    ORPHAN_LINE,
    /** A second time or style block. */
    DUPLICATE_BASIC_BLOCK,
    /** A header with a missing or superfluous label, or a lone colon. */
    MALFORMED_HEADER,
    // endregion

    // region Lines and values
    /** A property key that the enclosing block does not know. */
    UNKNOWN_PROPERTY,
    /** A numeric or text property value that cannot be parsed. */
    INVALID_PROPERTY_VALUE,
    /** A colour that is not exactly six hex digits. */
    INVALID_COLOR,
    /** A signal value token that no signal kind accepts. */
    INVALID_SIGNAL_VALUE,
    /** A legal signal value used on the wrong kind of signal. */
    VALUE_KIND_MISMATCH,
    /** A change line with a non-integer time, or a change line where none is allowed. */
    MALFORMED_CHANGE_LINE,
    /** A line that is neither {@code key = value} nor {@code time -> value}. */
    MALFORMED_PROPERTY_LINE,
    /** A clock block without a length. */
    MISSING_PROPERTY,
    // endregion

    // region Semantic checks
    /** A value outside its permitted range, e.g. {@code end <= start} or a duty cycle outside (0, 1). */
    INVALID_RANGE,
    // endregion

    // region Boundary
    /** The source could not be read or the output could not be written. */
    IO_FAILURE
    // endregion
}
