package com.spintax.engine.edit;

import com.spintax.engine.edit.NodePath.Step;
import com.spintax.engine.tree.SpintaxTree.Branch;
import com.spintax.engine.tree.SpintaxTree.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Path-based tree utilities. Replacements are copy-on-write: only the nodes on the path from the
 * root to the target are rebuilt, every other subtree is shared with the input tree.
 */
public final class TreeOps {

    private TreeOps() {}

    /**
     * Follows {@code path} from {@code root}. Every hop must name the {@code children} field of a
     * branch node and an index inside it; otherwise the path does not resolve.
     */
    public static Optional<Node> resolve(Node root, NodePath path) {
        Node current = root;
        for (Step step : path.steps()) {
            if (!(current instanceof Branch branch) || !NodePath.CHILDREN.equals(step.field())) {
                return Optional.empty();
            }
            List<? extends Node> children = branch.children();
            if (step.index() < 0 || step.index() >= children.size()) {
                return Optional.empty();
            }
            current = children.get(step.index());
        }
        return Optional.ofNullable(current);
    }

    /** Replaces the node at {@code path}, which must resolve, with {@code replacement}. */
    public static Node replace(Node root, NodePath path, Node replacement) {
        return rebuild(root, path.steps(), 0, current -> replacement);
    }

    /**
     * Rewrites the children list of the branch at {@code path}, which must resolve to a branch. The
     * edit receives a mutable copy of the list.
     */
    public static Node editChildren(
            Node root, NodePath path, UnaryOperator<List<Node>> edit) {
        return rebuild(
                root,
                path.steps(),
                0,
                current -> {
                    Branch branch = (Branch) current;
                    return branch.withChildren(edit.apply(new ArrayList<>(branch.children())));
                });
    }

    private static Node rebuild(
            Node current, List<Step> steps, int depth, UnaryOperator<Node> leaf) {
        if (depth == steps.size()) {
            return leaf.apply(current);
        }
        Branch branch = (Branch) current;
        int index = steps.get(depth).index();
        List<Node> children = new ArrayList<>(branch.children());
        children.set(index, rebuild(children.get(index), steps, depth + 1, leaf));
        return branch.withChildren(children);
    }
}
