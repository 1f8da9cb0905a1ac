package org.treesim.runtime.model;

/**
 * Lifecycle state of a {@link Lineage}.
 * <p>
 * A lineage starts {@link #ALIVE} (or {@link #NOTIFIED_ALIVE} when created by a notification)
 * and reaches exactly one terminal state.
 */
public enum LineageState {
    /** Racing for its next birth or removal event. */
    ALIVE,
    /** Alive after being notified: removed at rate φ, always sampled, never notifies. */
    NOTIFIED_ALIVE,
    /** The edge ended in a transmission; the individual continues in a child lineage. */
    TRANSMITTED,
    /** Removed and observed: a tip of the output tree. */
    SAMPLED,
    /** Removed without being observed. */
    REMOVED_UNSAMPLED,
    /** Still alive when the simulation stopped (time horizon or tip target reached). */
    PRUNED_AT_TIME_LIMIT;

    public boolean isAlive() {
        return this == ALIVE || this == NOTIFIED_ALIVE;
    }

    public boolean isTerminal() {
        return !isAlive();
    }
}
