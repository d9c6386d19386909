package com.spintax.engine.count;

import com.spintax.engine.tree.SpintaxTree.Choice;
import com.spintax.engine.tree.SpintaxTree.Node;
import com.spintax.engine.tree.SpintaxTree.Option;
import com.spintax.engine.tree.SpintaxTree.Root;
import com.spintax.engine.tree.SpintaxTree.Text;
import com.spintax.engine.tree.SpintaxTree.Visitor;
import java.util.List;

/**
 * Counts the renderings of a tree. Sequences (roots and options) multiply the counts of their
 * children; a choice adds up the counts of its options. A choice without options still renders one
 * way (as empty text).
 *
 * <p>Counting stops as soon as any partial product or sum exceeds the ceiling; the overflow then
 * propagates to every ancestor without visiting the remaining siblings.
 */
public final class VariationCounter {

    public static final long DEFAULT_CEILING = 1_000_000L;

    private static final long OVERFLOW = -1;

    private final long ceiling;
    private final Visitor<Long> visitor = new CountingVisitor();

    public VariationCounter() {
        this(DEFAULT_CEILING);
    }

    public VariationCounter(long ceiling) {
        if (ceiling < 1) {
            throw new IllegalArgumentException("ceiling must be positive: " + ceiling);
        }
        this.ceiling = ceiling;
    }

    public long ceiling() {
        return ceiling;
    }

    /** Counts {@code node}; an absent node renders one way (as empty text). */
    public VariationCount count(Node node) {
        if (node == null) {
            return VariationCount.of(1);
        }
        long count = node.accept(visitor);
        return count == OVERFLOW ? VariationCount.OVERFLOW : VariationCount.of(count);
    }

    private long product(List<? extends Node> children) {
        long total = 1;
        for (Node child : children) {
            long count = child.accept(visitor);
            if (count == OVERFLOW || total > ceiling / count) {
                return OVERFLOW;
            }
            total *= count;
        }
        return total;
    }

    private final class CountingVisitor implements Visitor<Long> {
        @Override
        public Long visitText(Text text) {
            return 1L;
        }

        @Override
        public Long visitOption(Option option) {
            return product(option.children());
        }

        @Override
        public Long visitChoice(Choice choice) {
            if (choice.children().isEmpty()) {
                return 1L;
            }
            long total = 0;
            for (Option option : choice.children()) {
                long count = option.accept(this);
                if (count == OVERFLOW || total > ceiling - count) {
                    return OVERFLOW;
                }
                total += count;
            }
            return total;
        }

        @Override
        public Long visitRoot(Root root) {
            return product(root.children());
        }
    }
}
