package org.treesim.runtime.model;

import java.util.List;

/**
 * Node of an {@link ObservedTree}. Immutable.
 *
 * @param lineageId id of the lineage whose end event this node represents.
 * @param time      absolute time of the event.
 * @param state     terminal state of that lineage.
 * @param children  child nodes, empty for tips.
 */
public record TreeNode(int lineageId, double time, LineageState state, List<TreeNode> children) {

    public TreeNode {
        children = List.copyOf(children);
    }

    static TreeNode tip(Lineage lineage) {
        return new TreeNode(lineage.getId(), lineage.getEndTime(), lineage.getState(), List.of());
    }

    public boolean isTip() {
        return children.isEmpty();
    }
}
