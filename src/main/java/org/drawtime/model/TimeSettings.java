package org.drawtime.model;

/**
 * The visible time window and transition delay of a diagram.
 *
 * @param start The first visible instant (may be negative).
 * @param end The last visible instant, greater than {@code start}.
 * @param step The column width of the optional grid, or {@code null} for no grid.
 * @param delay The time a signal takes to complete a change; purely visual.
 */
public record TimeSettings(int start, int end, Integer step, int delay) {

    public static final TimeSettings DEFAULTS = new TimeSettings(0, 100, null, 10);

    /**
     * @return {@code true} if a step grid is drawn.
     */
    public boolean hasStep() {
        return step != null;
    }

    /**
     * @return The length of the visible window; wider than {@code int} for windows spanning most of its range.
     */
    public long duration() {
        return (long) end - start;
    }
}
