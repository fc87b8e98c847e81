package papr.java17;

import java.util.Objects;

/// A token with the 1-based line and column of its first character.
/// `text` is trimmed and dequoted for [PaprTokenKind#TEXT] and empty for [PaprTokenKind#COLON].
record PaprToken(PaprTokenKind kind, String text, int line, int column) {

    PaprToken {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    static PaprToken text(String text, int line, int column) {
        return new PaprToken(PaprTokenKind.TEXT, text, line, column);
    }

    static PaprToken colon(int line, int column) {
        return new PaprToken(PaprTokenKind.COLON, "", line, column);
    }

    @Override
    public String toString() {
        final var where = line + ":" + column;
        return kind == PaprTokenKind.COLON
            ? "COLON@" + where
            : "TEXT@" + where + "[" + text.replace("\n", "\\n") + "]";
    }
}
