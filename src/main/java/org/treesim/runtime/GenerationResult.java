package org.treesim.runtime;

import org.treesim.runtime.ltt.LttTrajectory;
import org.treesim.runtime.model.Forest;

/**
 * Output of {@link ForestGenerator#generate(SimulationParameters)}.
 *
 * @param forest  the accepted forest.
 * @param summary its totals.
 * @param ltt     number of alive lineages over time, all simulated trees combined.
 */
public record GenerationResult(Forest forest, ForestSummary summary, LttTrajectory ltt) {
}
