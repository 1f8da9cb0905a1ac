package org.treesim.runtime.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * A completed simulated tree: a root lineage and every lineage descending from it.
 * <p>
 * Counters are computed once at construction; the tree is treated as immutable afterwards.
 * Traversals are iterative since a lineage that transmits many times yields a deep chain.
 */
public final class Tree {

    private final Lineage root;
    private final double endTime;
    private final List<Lineage> lineages;
    private final int sampledTips;
    private final int unsampledRemovals;
    private final int prunedLineages;
    private final int notifiedLineages;

    /**
     * @param root    the root lineage.
     * @param endTime the time the simulation of this tree stopped.
     * @throws IllegalStateException if a lineage has not terminated.
     */
    public Tree(Lineage root, double endTime) {
        this.root = root;
        this.endTime = endTime;

        List<Lineage> order = new ArrayList<>();
        int sampled = 0;
        int unsampled = 0;
        int pruned = 0;
        int notified = 0;
        Deque<Lineage> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Lineage lineage = stack.pop();
            order.add(lineage);
            switch (lineage.getState()) {
                case SAMPLED -> sampled++;
                case REMOVED_UNSAMPLED -> unsampled++;
                case PRUNED_AT_TIME_LIMIT -> pruned++;
                case ALIVE, NOTIFIED_ALIVE -> throw new IllegalStateException(
                        "tree contains a lineage that is still alive: " + lineage);
                default -> { }
            }
            if (lineage.isNotified()) {
                notified++;
            }
            List<Lineage> children = lineage.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        this.lineages = Collections.unmodifiableList(order);
        this.sampledTips = sampled;
        this.unsampledRemovals = unsampled;
        this.prunedLineages = pruned;
        this.notifiedLineages = notified;
    }

    public Lineage getRoot() {
        return root;
    }

    public double getStartTime() {
        return root.getStartTime();
    }

    public double getEndTime() {
        return endTime;
    }

    /**
     * @return all lineages in pre-order, parents before children.
     */
    public List<Lineage> lineages() {
        return lineages;
    }

    /**
     * @return lineages without children.
     */
    public List<Lineage> tips() {
        List<Lineage> tips = new ArrayList<>();
        for (Lineage lineage : lineages) {
            if (lineage.isTip()) {
                tips.add(lineage);
            }
        }
        return tips;
    }

    public int sampledTips() {
        return sampledTips;
    }

    public int unsampledRemovals() {
        return unsampledRemovals;
    }

    public int prunedLineages() {
        return prunedLineages;
    }

    public int notifiedLineages() {
        return notifiedLineages;
    }

    public int size() {
        return lineages.size();
    }

    /**
     * @return {@code true} if at least one tip was sampled.
     */
    public boolean isObserved() {
        return sampledTips > 0;
    }

    /**
     * @return the tree reconstructed from its sampled tips, empty if nothing was sampled.
     */
    public Optional<ObservedTree> observed() {
        return ObservedTree.reconstruct(this, false);
    }

    /**
     * @param keepPruned whether lineages alive at the stop time stay as tips.
     * @return the reconstructed tree.
     */
    public Optional<ObservedTree> observed(boolean keepPruned) {
        return ObservedTree.reconstruct(this, keepPruned);
    }
}
