package com.spintax.engine.edit;

import static org.junit.jupiter.api.Assertions.*;

import com.spintax.engine.edit.EditResult.Rejection;
import com.spintax.engine.grammar.SpintaxParser;
import com.spintax.engine.grammar.SpintaxSerializer;
import com.spintax.engine.tree.SpintaxTree;
import com.spintax.engine.tree.SpintaxTree.Choice;
import com.spintax.engine.tree.SpintaxTree.Option;
import com.spintax.engine.tree.SpintaxTree.Root;
import com.spintax.engine.tree.SpintaxTree.Text;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

final class TreeEditorTest {

    private static final String SOURCE = "Hello {world|there}!";

    private final Root tree = SpintaxParser.parse(SOURCE);

    @Test
    void updateReplacesNodeAndLeavesInputIntact() {
        EditResult result = TreeEditor.update(tree, NodePath.children(0), new Text("Hi "));

        assertTrue(result.isApplied());
        assertEquals("Hi {world|there}!", text(result));
        assertEquals(SOURCE, SpintaxSerializer.serialize(tree), "input tree must not change");
        assertSame(tree.children().get(1), result.tree().children().get(1));
    }

    @Test
    void updaterSeesCurrentNode() {
        EditResult result =
                TreeEditor.update(tree, NodePath.children(1, 0), node -> ((Option) node).withContent("earth"));
        assertEquals("Hello {earth|there}!", text(result));
    }

    @Test
    void updaterSeesNullForMissingNode() {
        AtomicReference<Object> seen = new AtomicReference<>("unset");
        EditResult aborted =
                TreeEditor.update(tree, NodePath.children(9), node -> {
                    seen.set(node);
                    return null;
                });
        assertNull(seen.get());
        assertEquals(Rejection.UPDATER_ABORTED, aborted.rejection());
        assertSame(tree, aborted.tree());

        EditResult missing = TreeEditor.update(tree, NodePath.children(9), node -> new Text("x"));
        assertEquals(Rejection.INDEX_OUT_OF_BOUNDS, missing.rejection());
    }

    @Test
    void failingUpdaterIsReportedNotThrown() {
        EditResult result =
                TreeEditor.update(tree, NodePath.children(0), node -> {
                    throw new IllegalStateException("boom");
                });
        assertEquals(Rejection.UPDATER_FAILED, result.rejection());
        assertSame(tree, result.tree());
        assertEquals("UPDATER_FAILED: boom", result.reason());
    }

    @Test
    void rootCanOnlyBeReplacedByRoot() {
        Root other = SpintaxParser.parse("{a|b}");
        EditResult replaced = TreeEditor.update(tree, NodePath.ROOT, other);
        assertSame(other, replaced.tree());

        EditResult refused = TreeEditor.update(tree, NodePath.ROOT, new Text("x"));
        assertEquals(Rejection.ROOT_REPLACEMENT_NOT_ROOT, refused.rejection());
        assertSame(tree, refused.tree());
    }

    @Test
    void updateEnforcesChildKinds() {
        EditResult result = TreeEditor.update(tree, NodePath.children(1, 0), new Text("x"));
        assertEquals(Rejection.ILLEGAL_CHILD_TYPE, result.rejection());
        assertEquals(Rejection.NULL_NODE, TreeEditor.update(tree, NodePath.children(0), (Text) null).rejection());
    }

    @Test
    void deleteRemovesFromParent() {
        assertEquals("Hello {world}!", text(TreeEditor.delete(tree, NodePath.children(1, 1))));
        assertEquals("{world|there}!", text(TreeEditor.delete(tree, NodePath.children(0))));
    }

    @Test
    void deletingLastOptionLeavesEmptyChoice() {
        Root once = TreeEditor.delete(tree, NodePath.children(1, 1)).tree();
        Root twice = TreeEditor.delete(once, NodePath.children(1, 0)).tree();
        assertEquals(Root.of(new Text("Hello "), Choice.of(), new Text("!")), twice);
        assertEquals("Hello {}!", SpintaxSerializer.serialize(twice));
    }

    @Test
    void deleteRejectsInvalidTargets() {
        assertEquals(Rejection.ROOT_NOT_DELETABLE, TreeEditor.delete(tree, NodePath.ROOT).rejection());
        assertEquals(Rejection.INDEX_OUT_OF_BOUNDS, TreeEditor.delete(tree, NodePath.children(5)).rejection());
        assertEquals(Rejection.NOT_A_CONTAINER, TreeEditor.delete(tree, NodePath.children(0, 0)).rejection());
        assertEquals(Rejection.PATH_NOT_FOUND, TreeEditor.delete(tree, NodePath.children(7, 0)).rejection());
        assertEquals(Rejection.PATH_NOT_FOUND, TreeEditor.delete(tree, NodePath.of("options", 0)).rejection());
    }

    @Test
    void insertClampsIndex() {
        assertEquals("Hello {world|there}!?", text(TreeEditor.insert(tree, NodePath.children(99), new Text("?"))));
        assertEquals(">Hello {world|there}!", text(TreeEditor.insert(tree, NodePath.children(-5), new Text(">"))));
    }

    @Test
    void insertIntoChoiceAndOption() {
        EditResult option = TreeEditor.insert(tree, NodePath.children(1, 1), Option.of("friend"));
        assertEquals("Hello {world|friend|there}!", text(option));

        EditResult nested = TreeEditor.insert(tree, NodePath.children(1, 0, 0), Choice.of("x", "y"));
        assertEquals("Hello {world{x|y}|there}!", text(nested));
    }

    @Test
    void insertEnforcesChildKinds() {
        assertEquals(
                Rejection.ILLEGAL_CHILD_TYPE,
                TreeEditor.insert(tree, NodePath.children(1, 0), new Text("x")).rejection());
        assertEquals(
                Rejection.ILLEGAL_CHILD_TYPE,
                TreeEditor.insert(tree, NodePath.children(0), Option.of("x")).rejection());
        assertEquals(
                Rejection.NOT_A_CONTAINER,
                TreeEditor.insert(tree, NodePath.children(0, 0), new Text("x")).rejection());
        assertEquals(Rejection.PATH_NOT_FOUND, TreeEditor.insert(tree, NodePath.ROOT, new Text("x")).rejection());
    }

    @Test
    void moveSwapsWithNeighbour() {
        assertEquals("Hello {there|world}!", text(TreeEditor.moveUp(tree, NodePath.children(1, 1))));
        assertEquals("Hello {there|world}!", text(TreeEditor.moveDown(tree, NodePath.children(1, 0))));
        assertEquals("{world|there}Hello !", text(TreeEditor.moveDown(tree, NodePath.children(0))));
    }

    @Test
    void moveAtBoundaryIsNoOp() {
        EditResult first = TreeEditor.moveUp(tree, NodePath.children(1, 0));
        assertEquals(Rejection.AT_BOUNDARY, first.rejection());
        assertSame(tree, first.tree());

        EditResult last = TreeEditor.moveDown(tree, NodePath.children(2));
        assertEquals(Rejection.AT_BOUNDARY, last.rejection());
        assertEquals(Rejection.INDEX_OUT_OF_BOUNDS, TreeEditor.moveUp(tree, NodePath.children(3)).rejection());
    }

    @Test
    void moveByZeroIsNoOp() {
        EditResult result = TreeEditor.move(tree, NodePath.children(1, 0), 0);
        assertEquals(Rejection.NO_MOVE, result.rejection());
        assertTrue(result.isNoOp());
        assertSame(tree, result.tree());
    }

    @Test
    void editsMayNotNestChoicesPastTheLimit() {
        NodePath insideWorld = NodePath.children(1, 0, 0);
        EditResult tooDeep = TreeEditor.insert(tree, insideWorld, nested(SpintaxTree.MAX_CHOICE_DEPTH));
        assertEquals(Rejection.NESTING_TOO_DEEP, tooDeep.rejection());
        assertSame(tree, tooDeep.tree());

        EditResult fits = TreeEditor.insert(tree, insideWorld, nested(SpintaxTree.MAX_CHOICE_DEPTH - 1));
        assertTrue(fits.isApplied(), () -> "edit rejected: " + fits.reason());
        assertEquals(SpintaxTree.MAX_CHOICE_DEPTH, SpintaxTree.choiceDepth(fits.tree()));

        assertEquals(
                Rejection.NESTING_TOO_DEEP,
                TreeEditor.update(tree, NodePath.children(1), nested(SpintaxTree.MAX_CHOICE_DEPTH + 1))
                        .rejection());
        assertEquals(
                Rejection.NESTING_TOO_DEEP,
                TreeEditor.update(tree, NodePath.ROOT, Root.of(nested(SpintaxTree.MAX_CHOICE_DEPTH + 1)))
                        .rejection());
    }

    private static Choice nested(int levels) {
        Choice choice = Choice.of("x");
        for (int i = 1; i < levels; i++) {
            choice = new Choice(List.of(new Option("", List.of(choice))));
        }
        return choice;
    }

    private static String text(EditResult result) {
        assertTrue(result.isApplied(), () -> "edit rejected: " + result.reason());
        return SpintaxSerializer.serialize(result.tree());
    }
}
