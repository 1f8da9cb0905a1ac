package org.treesim.runtime.ltt;

import java.util.Map;
import java.util.TreeMap;

import org.treesim.runtime.model.Forest;
import org.treesim.runtime.model.Lineage;
import org.treesim.runtime.model.LineageState;
import org.treesim.runtime.model.ObservedTree;
import org.treesim.runtime.model.Tree;
import org.treesim.runtime.model.TreeNode;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Derives lineages-through-time trajectories by replaying creation and termination times.
 * <p>
 * Lineages pruned at the stop time are still alive at that time, so they never decrease the count.
 */
public final class LttCalculator {

    private LttCalculator() {
    }

    /**
     * @param forest an accepted forest.
     * @return alive lineages over time, summed over observed and hidden trees.
     */
    public static LttTrajectory simulated(Forest forest) {
        TreeMap<Double, Integer> deltas = new TreeMap<>();
        for (Tree tree : forest.allTrees()) {
            addSimulated(tree, deltas);
        }
        return accumulate(deltas, Double.NaN);
    }

    /**
     * @param tree a completed tree.
     * @return alive lineages over time in that tree.
     */
    public static LttTrajectory simulated(Tree tree) {
        TreeMap<Double, Integer> deltas = new TreeMap<>();
        addSimulated(tree, deltas);
        return accumulate(deltas, Double.NaN);
    }

    /**
     * Lineages of the reconstructed trees over time, i.e. those with at least one sampled descendant.
     *
     * @param forest  an accepted forest.
     * @param horizon if finite and after the last change, a closing point is added there.
     * @return the observed trajectory.
     */
    public static LttTrajectory observed(Forest forest, double horizon) {
        TreeMap<Double, Integer> deltas = new TreeMap<>();
        for (Tree tree : forest.trees()) {
            tree.observed().ifPresent(observed -> addObserved(observed, deltas));
        }
        return accumulate(deltas, horizon);
    }

    private static void addSimulated(Tree tree, Map<Double, Integer> deltas) {
        for (Lineage lineage : tree.lineages()) {
            deltas.merge(lineage.getStartTime(), 1, Integer::sum);
            if (lineage.getState() != LineageState.PRUNED_AT_TIME_LIMIT) {
                deltas.merge(lineage.getEndTime(), -1, Integer::sum);
            }
        }
    }

    private static void addObserved(ObservedTree tree, Map<Double, Integer> deltas) {
        deltas.merge(tree.getStartTime(), 1, Integer::sum);
        for (TreeNode node : tree.nodes()) {
            deltas.merge(node.time(), node.children().size() - 1, Integer::sum);
        }
    }

    private static LttTrajectory accumulate(TreeMap<Double, Integer> deltas, double horizon) {
        DoubleArrayList times = new DoubleArrayList(deltas.size() + 1);
        IntArrayList counts = new IntArrayList(deltas.size() + 1);
        int count = 0;
        for (Map.Entry<Double, Integer> entry : deltas.entrySet()) {
            count += entry.getValue();
            // Changes at one time that cancel out leave no point.
            if (entry.getValue() == 0 && !counts.isEmpty()) {
                continue;
            }
            times.add(entry.getKey().doubleValue());
            counts.add(count);
        }
        if (Double.isFinite(horizon) && (times.isEmpty() || times.getDouble(times.size() - 1) < horizon)) {
            times.add(horizon);
            counts.add(count);
        }
        return new LttTrajectory(times, counts);
    }
}
