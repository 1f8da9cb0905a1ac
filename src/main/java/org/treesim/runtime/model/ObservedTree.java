package org.treesim.runtime.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The reconstructed tree: what can be seen of a simulated {@link Tree} from its sampled tips.
 * <p>
 * Unsampled removals are dropped and nodes left with a single child are merged into their
 * descendant edge, so branch lengths add up along every root-to-tip path. A sampled lineage that
 * still has observed descendants (the source of a notification) becomes an internal node with a
 * zero-length tip for the sample itself.
 */
public final class ObservedTree {

    private final double startTime;
    private final TreeNode root;
    private final int tipCount;

    private ObservedTree(double startTime, TreeNode root, int tipCount) {
        this.startTime = startTime;
        this.root = root;
        this.tipCount = tipCount;
    }

    /**
     * @param tree      a completed tree.
     * @param keepPruned whether lineages alive at the stop time stay as tips.
     * @return the reconstruction, empty if no tip is kept.
     */
    public static Optional<ObservedTree> reconstruct(Tree tree, boolean keepPruned) {
        List<Lineage> preOrder = tree.lineages();
        Map<Lineage, TreeNode> built = new IdentityHashMap<>();
        int tips = 0;
        for (int i = preOrder.size() - 1; i >= 0; i--) {
            Lineage lineage = preOrder.get(i);
            List<TreeNode> kids = new ArrayList<>(lineage.childCount() + 1);
            for (Lineage child : lineage.getChildren()) {
                TreeNode node = built.remove(child);
                if (node != null) {
                    kids.add(node);
                }
            }
            LineageState state = lineage.getState();
            boolean keepSelf = state == LineageState.SAMPLED
                    || (keepPruned && state == LineageState.PRUNED_AT_TIME_LIMIT);
            TreeNode node;
            if (kids.isEmpty()) {
                node = keepSelf ? TreeNode.tip(lineage) : null;
            } else if (keepSelf) {
                kids.add(TreeNode.tip(lineage));
                node = new TreeNode(lineage.getId(), lineage.getEndTime(), state, kids);
            } else if (kids.size() == 1) {
                node = kids.get(0);
            } else {
                node = new TreeNode(lineage.getId(), lineage.getEndTime(), state, kids);
            }
            if (keepSelf) {
                tips++;
            }
            if (node != null) {
                built.put(lineage, node);
            }
        }
        TreeNode root = built.get(tree.getRoot());
        return root == null ? Optional.empty() : Optional.of(new ObservedTree(tree.getStartTime(), root, tips));
    }

    public double getStartTime() {
        return startTime;
    }

    public TreeNode getRoot() {
        return root;
    }

    public int tipCount() {
        return tipCount;
    }

    /**
     * @param node   a node of this tree.
     * @param parent its parent, or {@code null} for the root.
     * @return length of the edge above {@code node}; the root edge starts at the tree start time.
     */
    public double branchLength(TreeNode node, TreeNode parent) {
        return node.time() - (parent == null ? startTime : parent.time());
    }

    /**
     * @return all nodes in pre-order.
     */
    public List<TreeNode> nodes() {
        List<TreeNode> result = new ArrayList<>();
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();
            result.add(node);
            List<TreeNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    public List<TreeNode> tips() {
        List<TreeNode> result = new ArrayList<>(tipCount);
        for (TreeNode node : nodes()) {
            if (node.isTip()) {
                result.add(node);
            }
        }
        return result;
    }
}
