package com.spintax.engine.history;

import com.spintax.engine.tree.SpintaxTree.Root;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Linear undo/redo over whole-tree snapshots. Both stacks are bounded by the same capacity; when
 * the undo stack is full the oldest snapshot is evicted. Recording a new snapshot discards the redo
 * line.
 *
 * <p>Snapshots are immutable trees, so keeping them costs only the nodes each edit rebuilt.
 */
public final class EditHistory {

    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;
    private final Deque<Root> undoStack = new ArrayDeque<>();
    private final Deque<Root> redoStack = new ArrayDeque<>();

    public EditHistory() {
        this(DEFAULT_CAPACITY);
    }

    public EditHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1: " + capacity);
        }
        this.capacity = capacity;
    }

    /** Records the tree as it was before a successful mutation. */
    public void record(Root before) {
        push(undoStack, Objects.requireNonNull(before, "before"));
        redoStack.clear();
    }

    /** Returns the tree to restore, or empty if there is nothing to undo. */
    public Optional<Root> undo(Root current) {
        return swap(undoStack, redoStack, current);
    }

    /** Returns the tree to restore, or empty if there is nothing to redo. */
    public Optional<Root> redo(Root current) {
        return swap(redoStack, undoStack, current);
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int undoDepth() {
        return undoStack.size();
    }

    public int redoDepth() {
        return redoStack.size();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        undoStack.clear();
        redoStack.clear();
    }

    private Optional<Root> swap(Deque<Root> from, Deque<Root> to, Root current) {
        Objects.requireNonNull(current, "current");
        Root restored = from.pollFirst();
        if (restored == null) {
            return Optional.empty();
        }
        push(to, current);
        return Optional.of(restored);
    }

    private void push(Deque<Root> stack, Root tree) {
        stack.addFirst(tree);
        while (stack.size() > capacity) {
            stack.removeLast();
        }
    }
}
