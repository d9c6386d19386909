package com.spintax.engine.gen;

import com.spintax.engine.tree.SpintaxTree.Choice;
import com.spintax.engine.tree.SpintaxTree.Node;
import com.spintax.engine.tree.SpintaxTree.Option;
import com.spintax.engine.tree.SpintaxTree.Root;
import com.spintax.engine.tree.SpintaxTree.Text;
import com.spintax.engine.tree.SpintaxTree.Visitor;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Renders one variation of a tree by picking an option uniformly at random at every choice. Each
 * call is an independent sample; seeding the {@link Random} makes the sequence reproducible.
 */
public final class RandomRenderer {

    private final Random random;

    public RandomRenderer(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public String render(Node node) {
        if (node == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        node.accept(new Sampler(sb));
        return sb.toString();
    }

    private final class Sampler implements Visitor<Void> {
        private final StringBuilder sb;

        Sampler(StringBuilder sb) {
            this.sb = sb;
        }

        @Override
        public Void visitText(Text text) {
            sb.append(text.content());
            return null;
        }

        @Override
        public Void visitOption(Option option) {
            sb.append(option.content());
            for (Node child : option.children()) {
                child.accept(this);
            }
            return null;
        }

        @Override
        public Void visitChoice(Choice choice) {
            List<Option> options = choice.children();
            if (!options.isEmpty()) {
                options.get(random.nextInt(options.size())).accept(this);
            }
            return null;
        }

        @Override
        public Void visitRoot(Root root) {
            for (Node child : root.children()) {
                child.accept(this);
            }
            return null;
        }
    }
}
