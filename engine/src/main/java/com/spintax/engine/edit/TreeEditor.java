package com.spintax.engine.edit;

import com.spintax.engine.edit.EditResult.Rejection;
import com.spintax.engine.edit.NodePath.Step;
import com.spintax.engine.tree.SpintaxTree;
import com.spintax.engine.tree.SpintaxTree.Branch;
import com.spintax.engine.tree.SpintaxTree.Choice;
import com.spintax.engine.tree.SpintaxTree.Node;
import com.spintax.engine.tree.SpintaxTree.Root;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural edits on a spintax tree. Every operation is pure: it returns a new root built by
 * copying only the ancestors of the edited position, or the untouched input together with the
 * reason the edit was refused. No edit throws.
 *
 * <p>Child kinds are checked, never coerced: a choice only ever holds options, and roots and
 * options only ever hold text and choices.
 */
public final class TreeEditor {

    private static final Logger log = LoggerFactory.getLogger(TreeEditor.class);

    private TreeEditor() {}

    /** Replaces the node at {@code path} with {@code replacement}. */
    public static EditResult update(Root root, NodePath path, Node replacement) {
        if (replacement == null) {
            return reject(root, Rejection.NULL_NODE, "replacement is null");
        }
        return update(root, path, current -> replacement);
    }

    /**
     * Replaces the node at {@code path} with the updater's result. The updater receives the current
     * node, or {@code null} if the path does not resolve, and may return {@code null} to abort.
     */
    public static EditResult update(Root root, NodePath path, UnaryOperator<Node> updater) {
        Objects.requireNonNull(root, "root");
        Optional<Node> current = TreeOps.resolve(root, path);
        Node replacement;
        try {
            replacement = updater.apply(current.orElse(null));
        } catch (RuntimeException e) {
            log.warn("Updater failed at {}", path, e);
            return reject(root, Rejection.UPDATER_FAILED, String.valueOf(e.getMessage()));
        }
        if (replacement == null) {
            return reject(root, Rejection.UPDATER_ABORTED, "updater returned null at " + path);
        }
        if (current.isEmpty()) {
            return diagnose(root, path);
        }
        if (path.isRoot()) {
            if (replacement instanceof Root newRoot) {
                if (SpintaxTree.choiceDepth(newRoot) > SpintaxTree.MAX_CHOICE_DEPTH) {
                    return tooDeep(root);
                }
                return EditResult.applied(newRoot);
            }
            return reject(
                    root,
                    Rejection.ROOT_REPLACEMENT_NOT_ROOT,
                    "cannot replace root with " + replacement.kind());
        }
        Branch parent = (Branch) TreeOps.resolve(root, path.parent()).orElseThrow();
        if (!parent.accepts(replacement)) {
            return illegalChild(root, parent, replacement);
        }
        if (exceedsDepth(root, path.parent(), replacement)) {
            return tooDeep(root);
        }
        return EditResult.applied((Root) TreeOps.replace(root, path, replacement));
    }

    /** Removes the node at {@code path} from its parent's children list. */
    public static EditResult delete(Root root, NodePath path) {
        Objects.requireNonNull(root, "root");
        if (path.isRoot()) {
            return reject(root, Rejection.ROOT_NOT_DELETABLE, "cannot delete the root");
        }
        Optional<EditResult> invalid = checkSlot(root, path, false);
        if (invalid.isPresent()) {
            return invalid.get();
        }
        int index = path.lastStep().index();
        return EditResult.applied(
                (Root) TreeOps.editChildren(root, path.parent(), children -> {
                    children.remove(index);
                    return children;
                }));
    }

    /**
     * Inserts {@code node} into the children list of {@code path}'s parent. The last index of the
     * path is clamped into {@code [0, size]}.
     */
    public static EditResult insert(Root root, NodePath path, Node node) {
        Objects.requireNonNull(root, "root");
        if (node == null) {
            return reject(root, Rejection.NULL_NODE, "node is null");
        }
        if (path.isRoot()) {
            return reject(root, Rejection.PATH_NOT_FOUND, "insert needs a parent and an index");
        }
        Optional<EditResult> invalid = checkSlot(root, path, true);
        if (invalid.isPresent()) {
            return invalid.get();
        }
        Branch parent = (Branch) TreeOps.resolve(root, path.parent()).orElseThrow();
        if (!parent.accepts(node)) {
            return illegalChild(root, parent, node);
        }
        if (exceedsDepth(root, path.parent(), node)) {
            return tooDeep(root);
        }
        int index = Math.max(0, Math.min(path.lastStep().index(), parent.children().size()));
        return EditResult.applied(
                (Root) TreeOps.editChildren(root, path.parent(), children -> {
                    children.add(index, node);
                    return children;
                }));
    }

    public static EditResult moveUp(Root root, NodePath path) {
        return move(root, path, -1);
    }

    public static EditResult moveDown(Root root, NodePath path) {
        return move(root, path, 1);
    }

    /**
     * Moves the node at {@code path} by {@code offset} positions among its siblings, as a delete
     * followed by an insert. Moving by zero or past either end leaves the tree unchanged.
     */
    public static EditResult move(Root root, NodePath path, int offset) {
        Objects.requireNonNull(root, "root");
        if (path.isRoot()) {
            return reject(root, Rejection.PATH_NOT_FOUND, "the root has no siblings");
        }
        Optional<EditResult> invalid = checkSlot(root, path, false);
        if (invalid.isPresent()) {
            return invalid.get();
        }
        if (offset == 0) {
            return reject(root, Rejection.NO_MOVE, path + " moved by 0");
        }
        Branch parent = (Branch) TreeOps.resolve(root, path.parent()).orElseThrow();
        int index = path.lastStep().index();
        int target = index + offset;
        if (target < 0 || target >= parent.children().size()) {
            return reject(root, Rejection.AT_BOUNDARY, path + " cannot move by " + offset);
        }
        Node node = parent.children().get(index);
        EditResult removed = delete(root, path);
        return insert(removed.tree(), path.withLastIndex(target), node);
    }

    /**
     * Validates that {@code path}'s parent is a branch reached through {@code children}, and,
     * unless inserting, that the last index addresses an existing child.
     */
    private static Optional<EditResult> checkSlot(Root root, NodePath path, boolean inserting) {
        NodePath parentPath = path.parent();
        Optional<Node> parent = TreeOps.resolve(root, parentPath);
        if (parent.isEmpty()) {
            return Optional.of(reject(root, Rejection.PATH_NOT_FOUND, "no node at " + parentPath));
        }
        if (!(parent.get() instanceof Branch branch)) {
            return Optional.of(
                    reject(
                            root,
                            Rejection.NOT_A_CONTAINER,
                            parent.get().kind() + " at " + parentPath + " has no children"));
        }
        if (!NodePath.CHILDREN.equals(path.lastStep().field())) {
            return Optional.of(
                    reject(root, Rejection.PATH_NOT_FOUND, "unknown field " + path.lastStep().field()));
        }
        List<? extends Node> children = branch.children();
        int index = path.lastStep().index();
        if (!inserting && (index < 0 || index >= children.size())) {
            return Optional.of(
                    reject(
                            root,
                            Rejection.INDEX_OUT_OF_BOUNDS,
                            "index " + index + " outside " + children.size() + " children"));
        }
        return Optional.empty();
    }

    private static EditResult diagnose(Root root, NodePath path) {
        return checkSlot(root, path, false)
                .orElseGet(() -> reject(root, Rejection.PATH_NOT_FOUND, "no node at " + path));
    }

    /** Whether placing {@code node} under the branch at {@code parentPath} nests too many choices. */
    private static boolean exceedsDepth(Root root, NodePath parentPath, Node node) {
        int depth = 0;
        Node current = root;
        for (Step step : parentPath.steps()) {
            if (current instanceof Choice) {
                depth++;
            }
            current = ((Branch) current).children().get(step.index());
        }
        if (current instanceof Choice) {
            depth++;
        }
        return depth + SpintaxTree.choiceDepth(node) > SpintaxTree.MAX_CHOICE_DEPTH;
    }

    private static EditResult tooDeep(Root root) {
        return reject(
                root,
                Rejection.NESTING_TOO_DEEP,
                "choices may nest at most " + SpintaxTree.MAX_CHOICE_DEPTH + " levels");
    }

    private static EditResult illegalChild(Root root, Branch parent, Node child) {
        return reject(
                root,
                Rejection.ILLEGAL_CHILD_TYPE,
                parent.kind() + " cannot hold " + child.kind());
    }

    private static EditResult reject(Root root, Rejection rejection, String detail) {
        log.debug("Edit rejected: {} ({})", rejection, detail);
        return EditResult.rejected(root, rejection, detail);
    }
}
