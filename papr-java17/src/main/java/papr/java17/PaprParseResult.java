package papr.java17;

import java.util.Objects;
import java.util.Optional;

/// Outcome of [Papr#tryParse(String)].
///
/// On success `root` is the canonical tree and `error` is null.
/// On failure `root` is the [invalid sentinel][PaprNode#invalid()] and `error` says which
/// token could not be attached; no partial tree is kept.
public record PaprParseResult(PaprNode root, PaprParseError error) {

    public PaprParseResult {
        Objects.requireNonNull(root, "root must not be null");
    }

    static PaprParseResult success(PaprNode root) {
        return new PaprParseResult(root, null);
    }

    static PaprParseResult failure(PaprParseError error) {
        Objects.requireNonNull(error, "error must not be null");
        return new PaprParseResult(PaprNode.invalid(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /// {@return the parse error, or empty on success}
    public Optional<PaprParseError> errorOrAbsent() {
        return Optional.ofNullable(error);
    }

    /// {@return the canonical tree}
    /// @throws PaprParseException if parsing failed
    public PaprNode orElseThrow() {
        if (error != null) {
            throw new PaprParseException(error);
        }
        return root;
    }
}
