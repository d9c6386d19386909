package com.spintax.engine.grammar;

import com.spintax.engine.tree.SpintaxTree.Choice;
import com.spintax.engine.tree.SpintaxTree.Node;
import com.spintax.engine.tree.SpintaxTree.Option;
import com.spintax.engine.tree.SpintaxTree.Root;
import com.spintax.engine.tree.SpintaxTree.Text;
import com.spintax.engine.tree.SpintaxTree.Visitor;

/**
 * Converts a tree back to canonical spintax text. Literal text is emitted verbatim: braces and
 * pipes inside text are not escaped, so such text does not survive a parse/serialize round trip.
 */
public final class SpintaxSerializer {

    /** Canonical form of a choice without options. The parser drops it again on the way back. */
    public static final String EMPTY_CHOICE = "{}";

    private SpintaxSerializer() {}

    public static String serialize(Node node) {
        if (node == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        node.accept(new Writer(sb));
        return sb.toString();
    }

    private static final class Writer implements Visitor<Void> {
        private final StringBuilder sb;

        Writer(StringBuilder sb) {
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
            if (choice.children().isEmpty()) {
                sb.append(EMPTY_CHOICE);
                return null;
            }
            sb.append('{');
            for (int i = 0; i < choice.children().size(); i++) {
                if (i > 0) {
                    sb.append('|');
                }
                choice.children().get(i).accept(this);
            }
            sb.append('}');
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
