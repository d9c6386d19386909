package com.spintax.demo;

import com.spintax.engine.core.SpintaxSession;
import com.spintax.engine.count.VariationEnumerator;
import com.spintax.engine.edit.EditResult;
import com.spintax.engine.edit.NodePath;
import com.spintax.engine.grammar.ParseDiagnostic;
import com.spintax.engine.tree.SpintaxTree;
import com.spintax.engine.tree.SpintaxTree.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.hateoas.EntityModel;
import org.springframework.hateoas.server.mvc.WebMvcLinkBuilder;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/editor")
class EditorController {

    private static final Logger log = LoggerFactory.getLogger(EditorController.class);

    static final int DEFAULT_VARIANT_LIMIT = 1000;
    static final int MAX_VARIANT_LIMIT = 10_000;

    private final SpintaxSession session;

    EditorController(SpintaxSession session) {
        this.session = session;
    }

    @GetMapping
    EntityModel<EditorState> state() {
        synchronized (session) {
            return model();
        }
    }

    @PutMapping(value = "/text", consumes = MediaType.ALL_VALUE)
    EntityModel<EditorState> setText(@RequestBody(required = false) String body) {
        synchronized (session) {
            session.setText(body == null ? "" : body);
            log.info("Text replaced, {} variations", session.variations());
            return model();
        }
    }

    @PostMapping("/nodes")
    EntityModel<EditorState> insert(@RequestBody NodeEdit edit) {
        NodePath path = toPath(edit.path());
        Node node = toNode(edit.node());
        return edit("insert", current -> current.insert(path, node));
    }

    @PutMapping("/nodes")
    EntityModel<EditorState> update(@RequestBody NodeEdit edit) {
        NodePath path = toPath(edit.path());
        Node node = toNode(edit.node());
        return edit("update", current -> current.update(path, node));
    }

    @DeleteMapping("/nodes")
    EntityModel<EditorState> delete(@RequestBody NodeEdit edit) {
        NodePath path = toPath(edit.path());
        return edit("delete", current -> current.delete(path));
    }

    @PostMapping("/nodes/move")
    EntityModel<EditorState> move(@RequestBody MoveRequest request) {
        NodePath path = toPath(request.path());
        return edit("move", current -> current.move(path, request.offset()));
    }

    @PostMapping("/undo")
    EntityModel<EditorState> undo() {
        synchronized (session) {
            session.undo();
            return model();
        }
    }

    @PostMapping("/redo")
    EntityModel<EditorState> redo() {
        synchronized (session) {
            session.redo();
            return model();
        }
    }

    @PostMapping("/clear")
    EntityModel<EditorState> clear() {
        synchronized (session) {
            session.clearAll();
            return model();
        }
    }

    @PostMapping("/random")
    EntityModel<EditorState> random() {
        synchronized (session) {
            session.generateVariant();
            return model();
        }
    }

    @GetMapping("/variants")
    List<String> variants(
            @RequestParam(name = "limit", defaultValue = "" + DEFAULT_VARIANT_LIMIT) int limit) {
        if (limit < 1 || limit > MAX_VARIANT_LIMIT) {
            throw new ResponseStatusException(
                    HttpStatus.BAD_REQUEST, "limit must be between 1 and " + MAX_VARIANT_LIMIT);
        }
        synchronized (session) {
            try {
                return VariationEnumerator.enumerate(session.tree(), limit);
            } catch (IllegalArgumentException e) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
            }
        }
    }

    private EntityModel<EditorState> edit(
            String operation, Function<SpintaxSession, EditResult> action) {
        synchronized (session) {
            EditResult result = action.apply(session);
            if (!result.isApplied() && !result.isNoOp()) {
                log.info("Rejected {}: {}", operation, result.reason());
                throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, result.reason());
            }
            return model();
        }
    }

    private EntityModel<EditorState> model() {
        return EntityModel.of(
                EditorState.of(session),
                WebMvcLinkBuilder.linkTo(EditorController.class).withSelfRel());
    }

    private static NodePath toPath(List<Object> segments) {
        try {
            return NodePath.of(segments == null ? List.of() : segments);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid path: " + e.getMessage(), e);
        }
    }

    private static Node toNode(NodeJson json) {
        if (json == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Missing node");
        }
        try {
            return json.toNode();
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid node: " + e.getMessage(), e);
        }
    }

    record NodeEdit(List<Object> path, NodeJson node) {}

    record MoveRequest(List<Object> path, int offset) {}

    record EditorState(
            String text,
            String variations,
            NodeJson tree,
            int nodeCount,
            boolean canUndo,
            boolean canRedo,
            String lastVariant,
            String error,
            List<String> diagnostics) {

        static EditorState of(SpintaxSession session) {
            List<String> diagnostics = new ArrayList<>();
            for (ParseDiagnostic diagnostic : session.lastDiagnostics()) {
                diagnostics.add(diagnostic.code() + " at " + diagnostic.index() + ": " + diagnostic.message());
            }
            return new EditorState(
                    session.text(),
                    session.variations().toString(),
                    NodeJson.from(session.tree()),
                    SpintaxTree.preOrder(session.tree()).size(),
                    session.canUndo(),
                    session.canRedo(),
                    session.lastVariant(),
                    session.lastError().orElse(null),
                    diagnostics);
        }
    }
}
