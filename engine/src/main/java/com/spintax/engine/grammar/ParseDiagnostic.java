package com.spintax.engine.grammar;

import java.util.Objects;

/**
 * A recovery the parser performed on malformed input. {@code index} is an offset into the
 * normalized text (trimmed, line breaks folded to spaces).
 */
public record ParseDiagnostic(Code code, int index, String message) {

    public enum Code {
        /** End of input reached before the closing brace; captured options were kept. */
        UNTERMINATED_CHOICE,
        /** A choice with a blank body was dropped. */
        EMPTY_CHOICE,
        /** An opening brace with nothing after it was kept as literal text. */
        STRAY_OPEN_BRACE,
        /** Braces nested past the depth limit were kept as literal text. */
        NESTING_TOO_DEEP
    }

    public ParseDiagnostic {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return code + "@" + index + ": " + message;
    }
}
