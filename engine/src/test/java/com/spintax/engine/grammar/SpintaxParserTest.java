package com.spintax.engine.grammar;

import static org.junit.jupiter.api.Assertions.*;

import com.spintax.engine.grammar.ParseDiagnostic.Code;
import com.spintax.engine.tree.SpintaxTree;
import com.spintax.engine.tree.SpintaxTree.Choice;
import com.spintax.engine.tree.SpintaxTree.Option;
import com.spintax.engine.tree.SpintaxTree.Root;
import com.spintax.engine.tree.SpintaxTree.Text;
import java.util.List;
import org.junit.jupiter.api.Test;

final class SpintaxParserTest {

    @Test
    void parsesTextAroundChoice() {
        Root root = SpintaxParser.parse("Hello {world|there}!");
        assertEquals(
                Root.of(new Text("Hello "), Choice.of("world", "there"), new Text("!")), root);
    }

    @Test
    void nestedChoiceBecomesChildOfOption() {
        Root root = SpintaxParser.parse("{a {x|y}|b}");
        Option nested = new Option("a ", List.of(Choice.of("x", "y")));
        assertEquals(Root.of(new Choice(List.of(nested, Option.of("b")))), root);
    }

    @Test
    void textAfterNestedChoiceBecomesTextChild() {
        Root root = SpintaxParser.parse("{a {x|y} b|c}");
        Option first = new Option("a ", List.of(Choice.of("x", "y"), new Text(" b")));
        assertEquals(Root.of(new Choice(List.of(first, Option.of("c")))), root);
    }

    @Test
    void optionEdgesAreTrimmed() {
        assertEquals(Root.of(Choice.of("a", "b")), SpintaxParser.parse("{ a | b }"));
    }

    @Test
    void blankTextBetweenNestedChoicesIsDropped() {
        Root root = SpintaxParser.parse("{{x|y} {p|q}|z}");
        Option first = new Option("", List.of(Choice.of("x", "y"), Choice.of("p", "q")));
        assertEquals(Root.of(new Choice(List.of(first, Option.of("z")))), root);
    }

    @Test
    void textBetweenNestedChoicesKeepsItsSpaces() {
        Root root = SpintaxParser.parse("{a {x|y} and {p|q}|z}");
        Option first =
                new Option("a ", List.of(Choice.of("x", "y"), new Text(" and "), Choice.of("p", "q")));
        assertEquals(Root.of(new Choice(List.of(first, Option.of("z")))), root);
    }

    @Test
    void deepNestingBecomesLiteralText() {
        int levels = 2000;
        String text = "{a".repeat(levels) + "}".repeat(levels);
        ParseResult result = assertDoesNotThrow(() -> SpintaxParser.parseWithDiagnostics(text));
        assertEquals(SpintaxTree.MAX_CHOICE_DEPTH, SpintaxTree.choiceDepth(result.root()));
        assertEquals(
                List.of(Code.NESTING_TOO_DEEP),
                result.diagnostics().stream().map(ParseDiagnostic::code).toList());
        assertEquals(text, SpintaxSerializer.serialize(result.root()), "deep braces survive as text");
    }

    @Test
    void longRunOfOpenBracesTerminates() {
        ParseResult result =
                assertDoesNotThrow(() -> SpintaxParser.parseWithDiagnostics("{".repeat(50_000)));
        assertEquals(SpintaxTree.MAX_CHOICE_DEPTH, SpintaxTree.choiceDepth(result.root()));
        assertTrue(
                result.diagnostics().stream().anyMatch(d -> d.code() == Code.NESTING_TOO_DEEP));
    }

    @Test
    void nestingAtTheLimitIsParsed() {
        int levels = SpintaxTree.MAX_CHOICE_DEPTH;
        ParseResult result =
                SpintaxParser.parseWithDiagnostics("{a".repeat(levels) + "}".repeat(levels));
        assertTrue(result.isClean(), () -> "diagnostics: " + result.diagnostics());
        assertEquals(levels, SpintaxTree.choiceDepth(result.root()));
    }

    @Test
    void emptyAndNullInputGiveEmptyRoot() {
        assertEquals(Root.empty(), SpintaxParser.parse(""));
        assertEquals(Root.empty(), SpintaxParser.parse(null));
        assertTrue(SpintaxParser.parseWithDiagnostics("").isClean());
    }

    @Test
    void lineBreaksBecomeSpaces() {
        Root root = SpintaxParser.parse("  line one\nline {a|b}\r\nend\r  ");
        assertEquals(
                Root.of(new Text("line one line "), Choice.of("a", "b"), new Text(" end")), root);
    }

    @Test
    void unterminatedChoiceKeepsCapturedOptions() {
        ParseResult result = SpintaxParser.parseWithDiagnostics("{a|b");
        assertEquals(Root.of(Choice.of("a", "b")), result.root());
        assertEquals(1, result.diagnostics().size());
        assertEquals(Code.UNTERMINATED_CHOICE, result.diagnostics().get(0).code());
        assertEquals(0, result.diagnostics().get(0).index());
    }

    @Test
    void trailingSeparatorOfUnterminatedChoiceAddsNoOption() {
        assertEquals(Root.of(Choice.of("a")), SpintaxParser.parse("{a|"));
    }

    @Test
    void unterminatedNestedChoiceStaysInsideItsOption() {
        ParseResult result = SpintaxParser.parseWithDiagnostics("{a {x");
        Option option = new Option("a ", List.of(Choice.of("x")));
        assertEquals(Root.of(new Choice(List.of(option))), result.root());
        assertEquals(2, result.diagnostics().size());
        assertTrue(
                result.diagnostics().stream().allMatch(d -> d.code() == Code.UNTERMINATED_CHOICE));
    }

    @Test
    void braceAtEndIsLiteralText() {
        ParseResult result = SpintaxParser.parseWithDiagnostics("abc {");
        assertEquals(Root.of(new Text("abc {")), result.root());
        assertEquals(Code.STRAY_OPEN_BRACE, result.diagnostics().get(0).code());
    }

    @Test
    void emptyChoiceIsDropped() {
        ParseResult result = SpintaxParser.parseWithDiagnostics("a {} b");
        assertEquals(Root.of(new Text("a  b")), result.root());
        assertEquals(Code.EMPTY_CHOICE, result.diagnostics().get(0).code());
    }

    @Test
    void emptyOptionsAreKept() {
        Root root = SpintaxParser.parse("{|b}");
        assertEquals(Root.of(new Choice(List.of(Option.of(""), Option.of("b")))), root);
    }

    @Test
    void strayClosingBracesAreText() {
        assertEquals(Root.of(new Text("a } b |")), SpintaxParser.parse("a } b |"));
    }

    @Test
    void pathologicalBracesTerminate() {
        ParseResult opening = SpintaxParser.parseWithDiagnostics("{{{{{{{{");
        assertFalse(opening.isClean());
        assertEquals(1, opening.root().children().size());

        ParseResult mixed = SpintaxParser.parseWithDiagnostics("}{|}{{|}|{");
        assertNotNull(mixed.root());
    }
}
