package com.spintax.engine.edit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Address of a node as a sequence of hops from the root, each hop naming a children field and an
 * index into it: {@code [children, 0, children, 2]}. The empty path is the root itself.
 *
 * <p>Paths are plain values, not references into a tree, so the same path can be resolved against
 * any snapshot. Whether a path actually exists is only known when it is resolved (see {@link
 * TreeOps#resolve}).
 */
public final class NodePath {

    public static final String CHILDREN = "children";

    public static final NodePath ROOT = new NodePath(List.of());

    public record Step(String field, int index) {
        public Step {
            Objects.requireNonNull(field, "field");
        }
    }

    private final List<Step> steps;

    private NodePath(List<Step> steps) {
        this.steps = List.copyOf(steps);
    }

    /** Builds a path from alternating field names and integer indices. */
    public static NodePath of(Object... segments) {
        return of(Arrays.asList(segments));
    }

    public static NodePath of(List<?> segments) {
        Objects.requireNonNull(segments, "segments");
        if (segments.size() % 2 != 0) {
            throw new IllegalArgumentException(
                    "path must alternate field and index, got " + segments);
        }
        List<Step> steps = new ArrayList<>(segments.size() / 2);
        for (int i = 0; i < segments.size(); i += 2) {
            Object field = segments.get(i);
            Object index = segments.get(i + 1);
            if (!(field instanceof String name)) {
                throw new IllegalArgumentException("segment " + i + " must be a field name: " + field);
            }
            steps.add(new Step(name, toIndex(index, i + 1)));
        }
        return new NodePath(steps);
    }

    /** Path that descends through {@code children} at each of the given indices. */
    public static NodePath children(int... indices) {
        List<Step> steps = new ArrayList<>(indices.length);
        for (int index : indices) {
            steps.add(new Step(CHILDREN, index));
        }
        return new NodePath(steps);
    }

    private static int toIndex(Object segment, int position) {
        if (segment instanceof Integer || segment instanceof Long
                || segment instanceof Short || segment instanceof Byte) {
            long value = ((Number) segment).longValue();
            if (value == (int) value) {
                return (int) value;
            }
        }
        throw new IllegalArgumentException(
                "segment " + position + " must be an integer index: " + segment);
    }

    public List<Step> steps() {
        return steps;
    }

    public int depth() {
        return steps.size();
    }

    public boolean isRoot() {
        return steps.isEmpty();
    }

    public NodePath parent() {
        if (isRoot()) {
            throw new IllegalStateException("root path has no parent");
        }
        return new NodePath(steps.subList(0, steps.size() - 1));
    }

    public Step lastStep() {
        if (isRoot()) {
            throw new IllegalStateException("root path has no last step");
        }
        return steps.get(steps.size() - 1);
    }

    public NodePath child(int index) {
        List<Step> next = new ArrayList<>(steps);
        next.add(new Step(CHILDREN, index));
        return new NodePath(next);
    }

    public NodePath withLastIndex(int index) {
        List<Step> next = new ArrayList<>(steps);
        next.set(next.size() - 1, new Step(lastStep().field(), index));
        return new NodePath(next);
    }

    /** The flat alternating form, e.g. {@code [children, 0, children, 2]}. */
    public List<Object> segments() {
        List<Object> segments = new ArrayList<>(steps.size() * 2);
        for (Step step : steps) {
            segments.add(step.field());
            segments.add(step.index());
        }
        return segments;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NodePath other && other.steps.equals(steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        return segments().toString();
    }
}
