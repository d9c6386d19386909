package com.spintax.engine.grammar;

import com.spintax.engine.grammar.ParseDiagnostic.Code;
import com.spintax.engine.tree.SpintaxTree;
import com.spintax.engine.tree.SpintaxTree.Choice;
import com.spintax.engine.tree.SpintaxTree.Node;
import com.spintax.engine.tree.SpintaxTree.Option;
import com.spintax.engine.tree.SpintaxTree.Root;
import com.spintax.engine.tree.SpintaxTree.Text;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses spintax text ({@code literal {option|option{nested|choice}} literal}) into a {@link Root}.
 *
 * <p>The parser never throws. Malformed input is repaired as it is scanned:
 *
 * <ul>
 *   <li>a choice that runs off the end of its region keeps the options captured so far;
 *   <li>a choice with a blank body ({@code {}}) is dropped;
 *   <li>an opening brace with nothing after it is kept as a literal {@code {}.
 *   <li>braces nested deeper than {@link SpintaxTree#MAX_CHOICE_DEPTH} choices are kept as
 *       literal text.
 * </ul>
 *
 * Each repair is reported as a {@link ParseDiagnostic}. Every choice level rescans its own region,
 * so a character is read at most once per enclosing choice and parsing takes
 * {@code O(length * MAX_CHOICE_DEPTH)} time.
 */
public final class SpintaxParser {

    private static final Logger log = LoggerFactory.getLogger(SpintaxParser.class);

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    private SpintaxParser() {}

    public static Root parse(String text) {
        return parseWithDiagnostics(text).root();
    }

    public static ParseResult parseWithDiagnostics(String text) {
        if (text == null || text.isEmpty()) {
            return new ParseResult(Root.empty(), List.of());
        }
        String source = LINE_BREAK.matcher(text.trim()).replaceAll(" ");
        Scan scan = new Scan(source);
        Root root = new Root(scan.sequence(0, source.length()));
        return new ParseResult(root, scan.diagnostics);
    }

    private record ChoiceResult(Choice choice, int end) {}

    /** State of one parse: the normalized source and the diagnostics collected so far. */
    private static final class Scan {
        private final String source;
        private final List<ParseDiagnostic> diagnostics = new ArrayList<>();

        Scan(String source) {
            this.source = source;
        }

        /** Top-level sequence: text runs are kept verbatim, including surrounding spaces. */
        List<Node> sequence(int start, int end) {
            List<Node> children = new ArrayList<>();
            int index = start;
            while (index < end) {
                int brace = source.indexOf('{', index);
                if (brace == -1 || brace >= end) {
                    appendText(children, source.substring(index, end));
                    break;
                }
                appendText(children, source.substring(index, brace));
                ChoiceResult result = choice(brace, end, 1);
                if (result == null) {
                    appendText(children, "{");
                    index = brace + 1;
                } else {
                    if (result.choice() != null) {
                        children.add(result.choice());
                    }
                    index = result.end();
                }
            }
            return children;
        }

        /**
         * Parses the choice opening at {@code start}. Returns {@code null} when the brace cannot start
         * a choice, and a result with a {@code null} choice when the block was dropped as empty.
         * {@code level} is the nesting level of this choice, 1 for a top-level choice.
         */
        ChoiceResult choice(int start, int limit, int level) {
            if (start >= limit - 1) {
                report(Code.STRAY_OPEN_BRACE, start, "'{' at end of input kept as literal text");
                return null;
            }
            List<Option> options = new ArrayList<>();
            int depth = 1;
            int optionStart = start + 1;
            for (int i = start + 1; i < limit; i++) {
                char c = source.charAt(i);
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth <= 0) {
                        options.add(option(optionStart, i, level));
                        return new ChoiceResult(finish(options, start, i), i + 1);
                    }
                } else if (c == '|' && depth == 1) {
                    options.add(option(optionStart, i, level));
                    optionStart = i + 1;
                }
            }
            report(Code.UNTERMINATED_CHOICE, start, "choice is missing its closing '}'");
            if (limit > optionStart) {
                options.add(option(optionStart, limit, level));
            }
            return new ChoiceResult(finish(options, start, limit), limit);
        }

        private Choice finish(List<Option> options, int start, int bodyEnd) {
            if (source.substring(start + 1, bodyEnd).isBlank()) {
                report(Code.EMPTY_CHOICE, start, "empty choice dropped");
                return null;
            }
            return new Choice(options);
        }

        /**
         * Parses one option body. The first literal becomes the option's own content; later literals
         * and nested choices become children. Nested choices are confined to {@code [start, end)}.
         */
        Option option(int start, int end, int level) {
            StringBuilder content = new StringBuilder();
            List<Node> children = new ArrayList<>();
            int index = start;
            boolean tooDeep = false;
            while (index < end) {
                int brace = source.indexOf('{', index);
                if (brace == -1 || brace >= end) {
                    appendLiteral(content, children, source.substring(index, end));
                    break;
                }
                appendLiteral(content, children, source.substring(index, brace));
                if (level >= SpintaxTree.MAX_CHOICE_DEPTH) {
                    if (!tooDeep) {
                        report(
                                Code.NESTING_TOO_DEEP,
                                brace,
                                "choices nested deeper than "
                                        + SpintaxTree.MAX_CHOICE_DEPTH
                                        + " levels kept as literal text");
                        tooDeep = true;
                    }
                    appendLiteral(content, children, "{");
                    index = brace + 1;
                    continue;
                }
                ChoiceResult result = choice(brace, end, level + 1);
                if (result == null) {
                    appendLiteral(content, children, "{");
                    index = brace + 1;
                } else {
                    if (result.choice() != null) {
                        children.add(result.choice());
                    }
                    index = result.end();
                }
            }
            return normalize(content.toString(), children);
        }

        private void report(Code code, int index, String message) {
            log.debug("Recovered from malformed spintax at {}: {}", index, message);
            diagnostics.add(new ParseDiagnostic(code, index, message));
        }
    }

    private static void appendText(List<Node> children, String text) {
        if (text.isEmpty()) {
            return;
        }
        int last = children.size() - 1;
        if (last >= 0 && children.get(last) instanceof Text previous) {
            children.set(last, new Text(previous.content() + text));
        } else {
            children.add(new Text(text));
        }
    }

    private static void appendLiteral(StringBuilder content, List<Node> children, String text) {
        if (children.isEmpty()) {
            content.append(text);
        } else {
            appendText(children, text);
        }
    }

    /**
     * Trims the option's outer edges, drops text runs that are blank and folds a lone text child
     * into the content. Text runs with visible characters keep their inner whitespace, and so does
     * the option's own content ({@code "a "} before a nested choice).
     */
    private static Option normalize(String rawContent, List<Node> children) {
        String content = rawContent.stripLeading();
        if (children.isEmpty()) {
            content = content.stripTrailing();
        } else {
            if (content.isEmpty() && children.get(0) instanceof Text first) {
                children.set(0, new Text(first.content().stripLeading()));
            }
            int last = children.size() - 1;
            if (children.get(last) instanceof Text tail) {
                children.set(last, new Text(tail.content().stripTrailing()));
            }
            children.removeIf(child -> child instanceof Text text && text.content().isBlank());
        }
        if (content.isEmpty() && children.size() == 1 && children.get(0) instanceof Text only) {
            return Option.of(only.content());
        }
        return new Option(content, children);
    }
}
