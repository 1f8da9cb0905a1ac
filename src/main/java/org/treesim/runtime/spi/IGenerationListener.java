package org.treesim.runtime.spi;

import org.treesim.runtime.ForestSummary;
import org.treesim.runtime.model.Tree;

/**
 * Receives progress events from the simulation core.
 * <p>
 * The core never logs progress through global state; callers inject a listener instead
 * (a logging one for the command line, a silent or recording one in tests).
 * All callbacks run on the simulating thread.
 */
public interface IGenerationListener {

    /**
     * Called before an attempt starts.
     *
     * @param attempt 1-based attempt number.
     */
    void onAttemptStarted(long attempt);

    /**
     * Called whenever every alive lineage of a tree crosses into a new skyline interval.
     *
     * @param intervalIndex  index of the interval just entered.
     * @param time           the boundary time.
     * @param aliveLineages  number of lineages whose race was restarted.
     */
    void onIntervalEntered(int intervalIndex, double time, int aliveLineages);

    /**
     * Called after each completed tree.
     *
     * @param attempt current attempt number.
     * @param tree    the completed tree.
     */
    void onTreeSimulated(long attempt, Tree tree);

    /**
     * Called when an attempt is discarded and the generation restarts.
     *
     * @param attempt the rejected attempt number.
     * @param reason  human-readable reason.
     */
    void onAttemptRejected(long attempt, String reason);

    /**
     * Called once, when a forest satisfying all bounds has been produced.
     *
     * @param attempt the accepted attempt number.
     * @param summary totals of the accepted forest.
     */
    void onForestAccepted(long attempt, ForestSummary summary);
}
