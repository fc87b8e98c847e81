package papr.java17;

/// Kinds of token produced when Papr text is tokenized.
/// Reported back to callers through [PaprParseError].
public enum PaprTokenKind {

    /// A run of text, possibly quoted. Becomes a key when attached.
    TEXT,

    /// A bare `:` outside quotes and comments.
    COLON
}
