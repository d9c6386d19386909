package com.spintax.demo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.spintax.engine.tree.SpintaxTree.Choice;
import com.spintax.engine.tree.SpintaxTree.Kind;
import com.spintax.engine.tree.SpintaxTree.Node;
import com.spintax.engine.tree.SpintaxTree.Option;
import com.spintax.engine.tree.SpintaxTree.Root;
import com.spintax.engine.tree.SpintaxTree.Text;
import com.spintax.engine.tree.SpintaxTree.Visitor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * JSON shape of a tree node: {@code {"type":"option","content":"a ","children":[...]}}. Text nodes
 * carry no children; choices and roots carry no content.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
record NodeJson(String type, String content, List<NodeJson> children) {

    private static final Visitor<NodeJson> TO_JSON = new Visitor<>() {
        @Override
        public NodeJson visitText(Text text) {
            return new NodeJson(name(Kind.TEXT), text.content(), null);
        }

        @Override
        public NodeJson visitOption(Option option) {
            return new NodeJson(name(Kind.OPTION), option.content(), fromAll(option.children()));
        }

        @Override
        public NodeJson visitChoice(Choice choice) {
            return new NodeJson(name(Kind.CHOICE), null, fromAll(choice.children()));
        }

        @Override
        public NodeJson visitRoot(Root root) {
            return new NodeJson(name(Kind.ROOT), null, fromAll(root.children()));
        }
    };

    static NodeJson from(Node node) {
        return node.accept(TO_JSON);
    }

    /** Builds the engine node. Throws {@link IllegalArgumentException} for unknown or misplaced kinds. */
    Node toNode() {
        if (type == null) {
            throw new IllegalArgumentException("node type is missing");
        }
        Kind kind;
        try {
            kind = Kind.valueOf(type.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown node type: " + type, e);
        }
        return switch (kind) {
            case TEXT -> new Text(content == null ? "" : content);
            case OPTION -> new Option(content == null ? "" : content, childNodes());
            case CHOICE -> new Choice(List.of()).withChildren(childNodes());
            case ROOT -> new Root(childNodes());
        };
    }

    private List<Node> childNodes() {
        List<Node> nodes = new ArrayList<>();
        if (children != null) {
            for (NodeJson child : children) {
                if (child == null) {
                    throw new IllegalArgumentException(type + " has a null child");
                }
                nodes.add(child.toNode());
            }
        }
        return nodes;
    }

    private static List<NodeJson> fromAll(List<? extends Node> nodes) {
        List<NodeJson> result = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            result.add(from(node));
        }
        return result;
    }

    private static String name(Kind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
