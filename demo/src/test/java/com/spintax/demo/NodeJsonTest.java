package com.spintax.demo;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spintax.engine.grammar.SpintaxParser;
import com.spintax.engine.tree.SpintaxTree.Choice;
import com.spintax.engine.tree.SpintaxTree.Node;
import com.spintax.engine.tree.SpintaxTree.Option;
import com.spintax.engine.tree.SpintaxTree.Root;
import com.spintax.engine.tree.SpintaxTree.Text;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

final class NodeJsonTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void mapsParsedTreeBothWays() {
        Root root = SpintaxParser.parse("Hi {a {x|y}|b} there{!|?}");
        NodeJson json = NodeJson.from(root);
        assertEquals("root", json.type());
        assertNull(json.content());
        assertEquals(root, json.toNode());
    }

    @Test
    void textHasNoChildrenInJson() throws Exception {
        String json = MAPPER.writeValueAsString(NodeJson.from(new Text("a")));
        assertEquals(MAPPER.readTree("{\"type\":\"text\",\"content\":\"a\"}"), MAPPER.readTree(json));
    }

    @Test
    void readsNodeFromJson() throws Exception {
        NodeJson json =
                MAPPER.readValue(
                        "{\"type\":\"choice\",\"children\":[{\"type\":\"option\",\"content\":\"a\"},"
                                + "{\"type\":\"option\",\"content\":\"b\",\"children\":[]}]}",
                        NodeJson.class);
        Node node = json.toNode();
        assertEquals(
                new Choice(
                        List.of(new Option("a", List.of()), new Option("b", List.of()))),
                node);
    }

    @Test
    void typeIsCaseInsensitiveAndContentDefaultsToEmpty() {
        assertEquals(new Text(""), new NodeJson("TEXT", null, null).toNode());
    }

    @Test
    void rejectsUnknownOrMisplacedKinds() {
        assertThrows(IllegalArgumentException.class, () -> new NodeJson("paragraph", "x", null).toNode());
        assertThrows(IllegalArgumentException.class, () -> new NodeJson(null, "x", null).toNode());
        assertThrows(
                IllegalArgumentException.class,
                () -> new NodeJson("choice", null, List.of(new NodeJson("text", "x", null))).toNode());
        assertThrows(
                IllegalArgumentException.class,
                () -> new NodeJson("root", null, List.of(new NodeJson("option", "x", null))).toNode());
        assertThrows(
                IllegalArgumentException.class,
                () -> new NodeJson("root", null, Arrays.asList((NodeJson) null)).toNode());
    }
}
