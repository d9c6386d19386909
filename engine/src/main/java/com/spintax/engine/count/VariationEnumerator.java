package com.spintax.engine.count;

import com.spintax.engine.tree.SpintaxTree.Choice;
import com.spintax.engine.tree.SpintaxTree.Node;
import com.spintax.engine.tree.SpintaxTree.Option;
import com.spintax.engine.tree.SpintaxTree.Root;
import com.spintax.engine.tree.SpintaxTree.Text;
import com.spintax.engine.tree.SpintaxTree.Visitor;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists every rendering of a tree, one entry per variation in option order. Two variations that
 * happen to render the same text both appear, so the list size always equals the variation count.
 */
public final class VariationEnumerator {

    private static final Visitor<List<String>> VISITOR = new ExpandingVisitor();

    private VariationEnumerator() {}

    /**
     * Enumerates {@code node}. Throws {@link IllegalArgumentException} if the tree has more than
     * {@code limit} variations.
     */
    public static List<String> enumerate(Node node, int limit) {
        VariationCount count = new VariationCounter(limit).count(node);
        if (count.isOverflow()) {
            throw new IllegalArgumentException("tree has more than " + limit + " variations");
        }
        if (node == null) {
            return List.of("");
        }
        return List.copyOf(node.accept(VISITOR));
    }

    private static List<String> concat(List<String> prefixes, List<String> suffixes) {
        List<String> result = new ArrayList<>(prefixes.size() * suffixes.size());
        for (String prefix : prefixes) {
            for (String suffix : suffixes) {
                result.add(prefix + suffix);
            }
        }
        return result;
    }

    private static final class ExpandingVisitor implements Visitor<List<String>> {
        @Override
        public List<String> visitText(Text text) {
            return List.of(text.content());
        }

        @Override
        public List<String> visitOption(Option option) {
            List<String> result = List.of(option.content());
            for (Node child : option.children()) {
                result = concat(result, child.accept(this));
            }
            return result;
        }

        @Override
        public List<String> visitChoice(Choice choice) {
            if (choice.children().isEmpty()) {
                return List.of("");
            }
            List<String> result = new ArrayList<>();
            for (Option option : choice.children()) {
                result.addAll(option.accept(this));
            }
            return result;
        }

        @Override
        public List<String> visitRoot(Root root) {
            List<String> result = List.of("");
            for (Node child : root.children()) {
                result = concat(result, child.accept(this));
            }
            return result;
        }
    }
}
