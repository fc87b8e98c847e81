package papr.java17;

import java.util.Objects;
import java.util.logging.Logger;

/// Static entry points for reading and writing Papr documents.
///
/// Papr is a key-value text format where hierarchy comes from `:` and column
/// positions rather than a fixed indent width:
/// ```
/// server: host: example.org
///         port: 8080
/// motd: "Welcome: please
///        behave"   # quoted text may span lines
/// ```
///
/// Usage:
/// ```java
/// PaprNode root = Papr.parse(text);
/// String port = root.get("server").get("port").value();
/// root.get("server").get("port").updateValue("9090");
/// String updated = Papr.serialize(root);
/// ```
///
/// [#parse(String)] reports failure through the [invalid sentinel][PaprNode#invalid()]
/// and a warning on this class's logger; [#tryParse(String)] returns the structured
/// error instead and [#parseOrThrow(String)] throws it.
public final class Papr {

    private static final Logger LOG = Logger.getLogger(Papr.class.getName());

    private Papr() {
    }

    /// Parses a document into its canonical tree.
    /// @param text the document
    /// @return the untyped root of the canonical tree, or the invalid sentinel if a
    ///         token could not be attached
    /// @throws NullPointerException if text is null
    public static PaprNode parse(String text) {
        final PaprParseResult result = tryParse(text);
        if (!result.isSuccess()) {
            LOG.warning(() -> "Failed to parse Papr document: " + result.error().message());
        }
        return result.root();
    }

    /// Parses a document, returning either the canonical tree or the reason it failed.
    /// @param text the document
    /// @return the parse outcome
    /// @throws NullPointerException if text is null
    public static PaprParseResult tryParse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        LOG.fine(() -> "Parsing Papr document of " + text.length() + " chars");
        return PaprParser.parse(text);
    }

    /// Parses a document into its canonical tree.
    /// @param text the document
    /// @return the untyped root of the canonical tree
    /// @throws NullPointerException if text is null
    /// @throws PaprParseException if a token could not be attached
    public static PaprNode parseOrThrow(String text) {
        return tryParse(text).orElseThrow();
    }

    /// Serializes a tree as canonical Papr text.
    ///
    /// The tree is not modified; a simplified copy is written. Serializing the
    /// output of [#parse(String)] and parsing it again yields an equal tree.
    ///
    /// @param node the tree, usually an untyped root
    /// @return the canonical text, empty for the invalid sentinel
    /// @throws NullPointerException if node is null
    public static String serialize(PaprNode node) {
        Objects.requireNonNull(node, "node must not be null");
        if (node.isInvalid()) {
            LOG.fine(() -> "Serializing the invalid sentinel as empty text");
            return "";
        }
        return PaprSerializer.serialize(node.simplifyCopy());
    }

    /// Renders the structure of a tree for debugging: one node per line with its
    /// type and text, children indented below their parent.
    /// ```
    /// Root
    ///   Key "a"
    ///     Group
    ///       Key "1"
    /// ```
    ///
    /// @param node the tree
    /// @param indent the number of spaces per nesting level. Zero or positive.
    /// @return the display text, without a trailing newline
    /// @throws NullPointerException if node is null
    /// @throws IllegalArgumentException if indent is negative
    public static String toDisplayString(PaprNode node, int indent) {
        Objects.requireNonNull(node, "node must not be null");
        if (indent < 0) {
            throw new IllegalArgumentException("indent is negative");
        }
        final var sb = new StringBuilder();
        toDisplayString(node, 0, indent, sb);
        sb.setLength(sb.length() - 1); // trim final newline
        return sb.toString();
    }

    private static void toDisplayString(PaprNode node, int col, int indent, StringBuilder sb) {
        sb.append(" ".repeat(col));
        if (node.isInvalid()) {
            sb.append("Invalid\n");
            return;
        }
        switch (node.type()) {
            case NONE -> sb.append("Root");
            case GROUP -> sb.append("Group");
            case KEY -> sb.append("Key \"").append(escape(node.text())).append('"');
            case VALUE -> sb.append("Value \"").append(escape(node.text())).append('"');
        }
        sb.append('\n');
        for (final PaprNode child : node) {
            toDisplayString(child, col + indent, indent, sb);
        }
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
