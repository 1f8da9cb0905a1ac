package org.treesim.runtime;

/**
 * Totals of an accepted forest, as written to the simulation log.
 *
 * @param totalTips      number of sampled tips over all trees.
 * @param unsampledCount number of unobserved removals over all trees, hidden ones included.
 * @param realizedTime   simulated time: T for forests, the stop time for a single tree.
 * @param hiddenTrees    number of simulated trees without any sampled tip.
 */
public record ForestSummary(int totalTips, int unsampledCount, double realizedTime, int hiddenTrees) {
}
