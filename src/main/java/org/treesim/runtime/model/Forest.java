package org.treesim.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.treesim.runtime.ForestSummary;

/**
 * Trees produced by one generation attempt, plus aggregate counters.
 * <p>
 * A forest only grows by appending completed trees. Trees without any sampled tip are kept apart
 * as hidden trees: they count toward the unsampled terminations but not toward the observed forest.
 * Once {@link #close(double) closed} by the generator the forest is read-only.
 */
public final class Forest {

    private final List<Tree> trees = new ArrayList<>();
    private final List<Tree> hiddenTrees = new ArrayList<>();
    private int totalTips;
    private int unsampledCount;
    private double realizedTime = Double.NaN;

    /**
     * @param tree a completed tree.
     * @throws IllegalStateException if the forest was closed.
     */
    public void append(Tree tree) {
        if (isClosed()) {
            throw new IllegalStateException("forest is closed");
        }
        if (tree.isObserved()) {
            trees.add(tree);
        } else {
            hiddenTrees.add(tree);
        }
        totalTips += tree.sampledTips();
        unsampledCount += tree.unsampledRemovals();
    }

    /**
     * Seals the forest.
     *
     * @param time realized simulated time (T, or the stop time of a single tree).
     */
    public void close(double time) {
        if (isClosed()) {
            throw new IllegalStateException("forest is already closed");
        }
        this.realizedTime = time;
    }

    public boolean isClosed() {
        return !Double.isNaN(realizedTime);
    }

    /**
     * @return trees with at least one sampled tip, in simulation order.
     */
    public List<Tree> trees() {
        return Collections.unmodifiableList(trees);
    }

    /**
     * @return trees that produced no sampled tip.
     */
    public List<Tree> hiddenTrees() {
        return Collections.unmodifiableList(hiddenTrees);
    }

    /**
     * @return observed and hidden trees in no particular order.
     */
    public List<Tree> allTrees() {
        List<Tree> all = new ArrayList<>(trees.size() + hiddenTrees.size());
        all.addAll(trees);
        all.addAll(hiddenTrees);
        return all;
    }

    public int size() {
        return trees.size();
    }

    public int totalTips() {
        return totalTips;
    }

    public int unsampledCount() {
        return unsampledCount;
    }

    /**
     * @return realized time, {@code NaN} until closed.
     */
    public double realizedTime() {
        return realizedTime;
    }

    public ForestSummary summary() {
        return new ForestSummary(totalTips, unsampledCount, realizedTime, hiddenTrees.size());
    }
}
