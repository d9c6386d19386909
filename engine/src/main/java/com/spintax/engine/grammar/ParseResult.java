package com.spintax.engine.grammar;

import com.spintax.engine.tree.SpintaxTree.Root;
import java.util.List;
import java.util.Objects;

/** Outcome of parsing: always a usable tree, plus whatever recoveries were needed to build it. */
public record ParseResult(Root root, List<ParseDiagnostic> diagnostics) {

    public ParseResult {
        Objects.requireNonNull(root, "root");
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isClean() {
        return diagnostics.isEmpty();
    }
}
