package org.treesim.cli.output;

import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.treesim.runtime.model.Forest;
import org.treesim.runtime.model.ObservedTree;
import org.treesim.runtime.model.Tree;
import org.treesim.runtime.model.TreeNode;

/**
 * Writes the reconstructed trees of a forest in Newick format, one {@code ;}-terminated tree per line.
 * <p>
 * Tips are named {@code t1, t2, ...} and internal nodes {@code n1, n2, ...}, numbered across the
 * whole forest in output order. The root edge (from the tree start to the first observed node) is
 * written as the root's branch length. An empty forest produces an empty file.
 */
public final class NewickWriter {

    private int tipCounter;
    private int internalCounter;

    /**
     * @param forest the forest to write.
     * @param file   target file, overwritten.
     * @throws IOException if the file cannot be written.
     */
    public static void write(Forest forest, Path file) throws IOException {
        NewickWriter writer = new NewickWriter();
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (Tree tree : forest.trees()) {
                var observed = tree.observed();
                if (observed.isPresent()) {
                    out.write(writer.format(observed.get()));
                    out.newLine();
                }
            }
        }
    }

    /**
     * @param tree a reconstructed tree.
     * @return its Newick string, names numbered from 1.
     */
    public static String toNewick(ObservedTree tree) {
        return new NewickWriter().format(tree);
    }

    private static final class Frame {
        final TreeNode node;
        final TreeNode parent;
        int nextChild;

        Frame(TreeNode node, TreeNode parent) {
            this.node = node;
            this.parent = parent;
        }
    }

    String format(ObservedTree tree) {
        StringBuilder sb = new StringBuilder();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(tree.getRoot(), null));
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            TreeNode node = frame.node;
            if (node.isTip()) {
                sb.append('t').append(++tipCounter);
                appendLength(sb, tree.branchLength(node, frame.parent));
                stack.pop();
                continue;
            }
            List<TreeNode> children = node.children();
            if (frame.nextChild == 0) {
                sb.append('(');
            }
            if (frame.nextChild < children.size()) {
                if (frame.nextChild > 0) {
                    sb.append(',');
                }
                stack.push(new Frame(children.get(frame.nextChild++), node));
            } else {
                sb.append(')').append('n').append(++internalCounter);
                appendLength(sb, tree.branchLength(node, frame.parent));
                stack.pop();
            }
        }
        return sb.append(';').toString();
    }

    private static void appendLength(StringBuilder sb, double length) {
        sb.append(':').append(BigDecimal.valueOf(length).toPlainString());
    }
}
