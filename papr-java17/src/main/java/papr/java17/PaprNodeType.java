package papr.java17;

/// The discriminant of a [PaprNode].
public enum PaprNodeType {

    /// Untyped container: the root of a parsed document, or the invalid sentinel.
    NONE,

    /// Structural node created by a colon continuation. Simplification splices
    /// it away wherever a key holds a single group.
    GROUP,

    /// Named node whose children hold its value or nested keys.
    KEY,

    /// Scalar leaf. Never has children.
    VALUE
}
