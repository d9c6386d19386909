package com.spintax.engine.core;

import com.spintax.engine.count.VariationCount;
import com.spintax.engine.count.VariationCounter;
import com.spintax.engine.edit.EditResult;
import com.spintax.engine.edit.NodePath;
import com.spintax.engine.edit.TreeEditor;
import com.spintax.engine.gen.RandomRenderer;
import com.spintax.engine.grammar.ParseDiagnostic;
import com.spintax.engine.grammar.ParseResult;
import com.spintax.engine.grammar.SpintaxParser;
import com.spintax.engine.grammar.SpintaxSerializer;
import com.spintax.engine.history.EditHistory;
import com.spintax.engine.tree.SpintaxTree.Choice;
import com.spintax.engine.tree.SpintaxTree.Node;
import com.spintax.engine.tree.SpintaxTree.Root;
import com.spintax.engine.tree.SpintaxTree.Text;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One editing session over a spintax tree: the current tree, its derived text and variation count,
 * and bounded undo/redo. Every successful mutation records the previous tree first; rejected edits
 * and no-op moves leave both the tree and the history untouched.
 *
 * <p>A session is meant for a single actor and is not thread-safe.
 */
public final class SpintaxSession {

    private static final Logger log = LoggerFactory.getLogger(SpintaxSession.class);

    static final String DEFAULT_TEXT = "new text";
    static final List<String> DEFAULT_OPTIONS = List.of("A", "B");

    public static final class Config {
        public int historyCapacity = EditHistory.DEFAULT_CAPACITY;
        public long variationCeiling = VariationCounter.DEFAULT_CEILING;
        public Random random = new Random();
    }

    private final EditHistory history;
    private final VariationCounter counter;
    private final RandomRenderer renderer;

    private Root tree;
    private String text;
    private VariationCount variations;
    private String lastVariant = "";
    private String lastError;
    private List<ParseDiagnostic> lastDiagnostics = List.of();

    public SpintaxSession(Config config) {
        this(config, Root.empty());
    }

    public SpintaxSession(Config config, Root initial) {
        Objects.requireNonNull(config, "config");
        this.history = new EditHistory(config.historyCapacity);
        this.counter = new VariationCounter(config.variationCeiling);
        this.renderer = new RandomRenderer(config.random);
        show(Objects.requireNonNull(initial, "initial"));
    }

    /** Starts a session from text; the initial parse is not part of the undo history. */
    public static SpintaxSession fromText(String text, Config config) {
        ParseResult result = SpintaxParser.parseWithDiagnostics(text);
        SpintaxSession session = new SpintaxSession(config, result.root());
        session.lastDiagnostics = result.diagnostics();
        return session;
    }

    public static SpintaxSession withExample(Config config) {
        return fromText(SpintaxPresets.EXAMPLE, config);
    }

    public Root tree() {
        return tree;
    }

    public String text() {
        return text;
    }

    public VariationCount variations() {
        return variations;
    }

    public String lastVariant() {
        return lastVariant;
    }

    /** Reason the last edit was refused, cleared by the next successful change. */
    public Optional<String> lastError() {
        return Optional.ofNullable(lastError);
    }

    /** Recoveries performed by the most recent parse. */
    public List<ParseDiagnostic> lastDiagnostics() {
        return lastDiagnostics;
    }

    public boolean canUndo() {
        return history.canUndo();
    }

    public boolean canRedo() {
        return history.canRedo();
    }

    public int undoDepth() {
        return history.undoDepth();
    }

    public int redoDepth() {
        return history.redoDepth();
    }

    /** Replaces the whole tree with the parse of {@code spintax}. */
    public ParseResult setText(String spintax) {
        ParseResult result = SpintaxParser.parseWithDiagnostics(spintax);
        commit(result.root());
        lastDiagnostics = result.diagnostics();
        if (!result.isClean()) {
            log.debug("Parsed with {} recoveries: {}", result.diagnostics().size(), result.diagnostics());
        }
        return result;
    }

    public EditResult update(NodePath path, Node replacement) {
        return apply(TreeEditor.update(tree, path, replacement));
    }

    public EditResult update(NodePath path, UnaryOperator<Node> updater) {
        return apply(TreeEditor.update(tree, path, updater));
    }

    public EditResult delete(NodePath path) {
        return apply(TreeEditor.delete(tree, path));
    }

    public EditResult insert(NodePath path, Node node) {
        return apply(TreeEditor.insert(tree, path, node));
    }

    public EditResult moveUp(NodePath path) {
        return apply(TreeEditor.moveUp(tree, path));
    }

    public EditResult moveDown(NodePath path) {
        return apply(TreeEditor.moveDown(tree, path));
    }

    public EditResult move(NodePath path, int offset) {
        return apply(TreeEditor.move(tree, path, offset));
    }

    public EditResult addTextToRoot() {
        return addTextToRoot(DEFAULT_TEXT);
    }

    /** Appends a text run to the root. */
    public EditResult addTextToRoot(String content) {
        return insert(NodePath.children(tree.children().size()), new Text(content));
    }

    public EditResult addChoiceToRoot() {
        return addChoiceToRoot(DEFAULT_OPTIONS);
    }

    /** Appends a choice with one plain option per entry to the root. */
    public EditResult addChoiceToRoot(List<String> options) {
        return insert(NodePath.children(tree.children().size()), Choice.ofOptions(options));
    }

    /** Renders a fresh random variation and remembers it as {@link #lastVariant()}. */
    public String generateVariant() {
        lastVariant = renderer.render(tree);
        return lastVariant;
    }

    public boolean undo() {
        Optional<Root> previous = history.undo(tree);
        previous.ifPresent(this::restore);
        return previous.isPresent();
    }

    public boolean redo() {
        Optional<Root> next = history.redo(tree);
        next.ifPresent(this::restore);
        return next.isPresent();
    }

    /** Empties the tree. Undoable like any other change. */
    public void clearAll() {
        commit(Root.empty());
    }

    private EditResult apply(EditResult result) {
        if (result.isApplied()) {
            commit(result.tree());
        } else if (!result.isNoOp()) {
            lastError = result.reason();
        }
        return result;
    }

    private void commit(Root next) {
        history.record(tree);
        show(next);
    }

    private void restore(Root snapshot) {
        show(snapshot);
        lastDiagnostics = List.of();
    }

    private void show(Root next) {
        tree = next;
        text = SpintaxSerializer.serialize(next);
        variations = counter.count(next);
        lastError = null;
    }
}
