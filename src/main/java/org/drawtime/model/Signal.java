package org.drawtime.model;

/**
 * A named signal row of a timing diagram.
 */
public sealed interface Signal permits LineSignal, BusSignal, ClockSignal {

    /**
     * @return The kind of this signal.
     */
    SignalKind kind();

    /**
     * @return The label exactly as written in the block header.
     */
    String name();

    /**
     * @return The label split into display segments.
     */
    LabelSegments label();
}
