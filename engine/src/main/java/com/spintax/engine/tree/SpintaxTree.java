package com.spintax.engine.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;

/**
 * Immutable representation of a spintax tree. A tree is a {@link Root} whose children are text runs
 * and choice blocks; a choice holds options, and an option holds a literal prefix followed by more
 * text runs and nested choices.
 *
 * <p>Nodes are records, so equality is structural and a tree can be shared freely between history
 * snapshots. Edits never touch an existing node; they build new ancestors around the untouched
 * subtrees (see {@code com.spintax.engine.edit.TreeOps}).
 */
public final class SpintaxTree {

    /**
     * Deepest nesting of choices a tree may have. The parser keeps deeper braces as literal text and
     * the editor refuses edits that would go past it, so recursive traversals stay shallow.
     */
    public static final int MAX_CHOICE_DEPTH = 128;

    private SpintaxTree() {}

    public enum Kind {
        TEXT,
        OPTION,
        CHOICE,
        ROOT
    }

    /** Traversal over the closed set of node kinds. */
    public interface Visitor<R> {
        R visitText(Text text);

        R visitOption(Option option);

        R visitChoice(Choice choice);

        R visitRoot(Root root);
    }

    public sealed interface Node permits Text, Branch {
        Kind kind();

        <R> R accept(Visitor<R> visitor);
    }

    /** A node that owns an ordered children list addressable by a path. */
    public sealed interface Branch extends Node permits Option, Choice, Root {
        List<? extends Node> children();

        /** Whether {@code child} may legally appear in this node's children list. */
        boolean accepts(Node child);

        /**
         * Returns a copy of this node with its children replaced. Throws {@link
         * IllegalArgumentException} if any child is not {@link #accepts(Node) accepted}.
         */
        Branch withChildren(List<? extends Node> children);
    }

    public record Text(String content) implements Node {
        public Text {
            Objects.requireNonNull(content, "content");
        }

        @Override
        public Kind kind() {
            return Kind.TEXT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitText(this);
        }
    }

    public record Option(String content, List<Node> children) implements Branch {
        public Option {
            Objects.requireNonNull(content, "content");
            children = copySequence(children, Kind.OPTION);
        }

        public static Option of(String content) {
            return new Option(content, List.of());
        }

        @Override
        public Kind kind() {
            return Kind.OPTION;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOption(this);
        }

        @Override
        public boolean accepts(Node child) {
            return isSequenceChild(child);
        }

        @Override
        public Option withChildren(List<? extends Node> children) {
            return new Option(content, List.copyOf(children));
        }

        public Option withContent(String content) {
            return new Option(content, children);
        }
    }

    public record Choice(List<Option> children) implements Branch {
        public Choice {
            children = List.copyOf(Objects.requireNonNull(children, "children"));
        }

        public static Choice of(String... options) {
            return ofOptions(Arrays.asList(options));
        }

        public static Choice ofOptions(List<String> options) {
            List<Option> nodes = new ArrayList<>(options.size());
            for (String option : options) {
                nodes.add(Option.of(option));
            }
            return new Choice(nodes);
        }

        @Override
        public Kind kind() {
            return Kind.CHOICE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitChoice(this);
        }

        @Override
        public boolean accepts(Node child) {
            return child instanceof Option;
        }

        @Override
        public Choice withChildren(List<? extends Node> children) {
            List<Option> options = new ArrayList<>(children.size());
            for (Node child : children) {
                if (!(child instanceof Option option)) {
                    throw new IllegalArgumentException(
                            "choice children must be options, got " + kindOf(child));
                }
                options.add(option);
            }
            return new Choice(options);
        }
    }

    public record Root(List<Node> children) implements Branch {
        private static final Root EMPTY = new Root(List.of());

        public Root {
            children = copySequence(children, Kind.ROOT);
        }

        public static Root empty() {
            return EMPTY;
        }

        public static Root of(Node... children) {
            return new Root(Arrays.asList(children));
        }

        @Override
        public Kind kind() {
            return Kind.ROOT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRoot(this);
        }

        @Override
        public boolean accepts(Node child) {
            return isSequenceChild(child);
        }

        @Override
        public Root withChildren(List<? extends Node> children) {
            return new Root(List.copyOf(children));
        }
    }

    /** Pre-order listing of {@code node} and all of its descendants. */
    public static List<Node> preOrder(Node node) {
        List<Node> result = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            Node current = stack.pop();
            result.add(current);
            if (current instanceof Branch branch) {
                List<? extends Node> children = branch.children();
                ListIterator<? extends Node> iterator = children.listIterator(children.size());
                while (iterator.hasPrevious()) {
                    stack.push(iterator.previous());
                }
            }
        }
        return result;
    }

    /** Number of choices on the deepest root-to-leaf path of {@code node}, counted without recursion. */
    public static int choiceDepth(Node node) {
        int deepest = 0;
        Deque<Node> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(node);
        depths.push(0);
        while (!nodes.isEmpty()) {
            Node current = nodes.pop();
            int depth = depths.pop() + (current instanceof Choice ? 1 : 0);
            deepest = Math.max(deepest, depth);
            if (current instanceof Branch branch) {
                for (Node child : branch.children()) {
                    nodes.push(child);
                    depths.push(depth);
                }
            }
        }
        return deepest;
    }

    // Roots and options hold a sequence of text runs and choices.
    private static boolean isSequenceChild(Node child) {
        return child instanceof Text || child instanceof Choice;
    }

    private static List<Node> copySequence(List<Node> children, Kind owner) {
        List<Node> copy = List.copyOf(Objects.requireNonNull(children, "children"));
        for (Node child : copy) {
            if (!isSequenceChild(child)) {
                throw new IllegalArgumentException(
                        owner + " children must be text or choice, got " + kindOf(child));
            }
        }
        return copy;
    }

    private static Kind kindOf(Node node) {
        return node == null ? null : node.kind();
    }
}
