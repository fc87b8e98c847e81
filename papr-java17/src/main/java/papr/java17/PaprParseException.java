package papr.java17;

import java.util.Objects;

/// Thrown by [Papr#parseOrThrow(String)] when a document cannot be parsed.
/// [Papr#parse(String)] and [Papr#tryParse(String)] report the same failure without throwing.
public class PaprParseException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final transient PaprParseError error;

    /// Creates a new parse exception for the given error.
    /// @param error the structured parse error
    public PaprParseException(PaprParseError error) {
        super(Objects.requireNonNull(error, "error must not be null").message());
        this.error = error;
    }

    /// {@return the structured error, with the failing token's kind and position}
    public PaprParseError error() {
        return error;
    }

    /// {@return the 1-based line of the failing token}
    public int line() {
        return error.line();
    }

    /// {@return the 1-based column of the failing token}
    public int column() {
        return error.column();
    }
}
