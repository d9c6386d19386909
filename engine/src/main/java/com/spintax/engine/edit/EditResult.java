package com.spintax.engine.edit;

import com.spintax.engine.tree.SpintaxTree;
import com.spintax.engine.tree.SpintaxTree.Root;
import java.util.Objects;

/**
 * Outcome of a tree edit. When the edit was rejected, {@code tree} is the unchanged input and
 * {@code rejection}/{@code detail} say why.
 */
public record EditResult(Root tree, Rejection rejection, String detail) {

    public enum Rejection {
        PATH_NOT_FOUND,
        NOT_A_CONTAINER,
        INDEX_OUT_OF_BOUNDS,
        ILLEGAL_CHILD_TYPE,
        ROOT_NOT_DELETABLE,
        ROOT_REPLACEMENT_NOT_ROOT,
        UPDATER_ABORTED,
        UPDATER_FAILED,
        /** A move that would leave the parent's children list; the tree is unchanged. */
        AT_BOUNDARY,
        /** A move by zero positions; the tree is unchanged. */
        NO_MOVE,
        NULL_NODE,
        /** The edit would nest choices deeper than {@link SpintaxTree#MAX_CHOICE_DEPTH}. */
        NESTING_TOO_DEEP
    }

    public EditResult {
        Objects.requireNonNull(tree, "tree");
    }

    static EditResult applied(Root tree) {
        return new EditResult(tree, null, null);
    }

    static EditResult rejected(Root tree, Rejection rejection, String detail) {
        return new EditResult(tree, Objects.requireNonNull(rejection, "rejection"), detail);
    }

    public boolean isApplied() {
        return rejection == null;
    }

    /** True for a move that had nowhere to go. Such a result is not an error. */
    public boolean isNoOp() {
        return rejection == Rejection.AT_BOUNDARY || rejection == Rejection.NO_MOVE;
    }

    /** Human readable reason, or {@code null} for an applied edit. */
    public String reason() {
        return isApplied() ? null : rejection + ": " + detail;
    }
}
