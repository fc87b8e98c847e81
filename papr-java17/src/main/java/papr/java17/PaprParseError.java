package papr.java17;

import java.util.Objects;

/// Why a Papr document could not be parsed: a token found no open anchor to attach to.
///
/// A text token needs an open `:` (or the document root) at a smaller column; a colon
/// needs an open text token at a smaller column.
///
/// @param found the kind of the token that could not be attached
/// @param text the token's text, empty for a colon
/// @param line the 1-based line of the token
/// @param column the 1-based column of the token
/// @param expected the kind of anchor the token needed
public record PaprParseError(PaprTokenKind found, String text, int line, int column, PaprTokenKind expected) {

    public PaprParseError {
        Objects.requireNonNull(found, "found must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(expected, "expected must not be null");
    }

    static PaprParseError unattached(PaprToken token) {
        final var expected = token.kind() == PaprTokenKind.TEXT ? PaprTokenKind.COLON : PaprTokenKind.TEXT;
        return new PaprParseError(token.kind(), token.text(), token.line(), token.column(), expected);
    }

    /// {@return a human-readable description with the position of the failing token}
    public String message() {
        final var what = found == PaprTokenKind.COLON ? "':'" : "text \"" + text.replace("\n", "\\n") + "\"";
        final var needs = expected == PaprTokenKind.COLON ? "open ':' or document root" : "open text token";
        return "Cannot attach " + what + " at line " + line + ", column " + column
            + ": no " + needs + " at a smaller column";
    }

    @Override
    public String toString() {
        return message();
    }
}
