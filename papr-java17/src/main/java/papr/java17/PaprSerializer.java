package papr.java17;

import java.util.logging.Logger;

/// Writes a simplified tree back out as canonical Papr text.
///
/// `depth` is the number of spaces in front of continuation lines, not a nesting
/// level: the children of a key line up under the first character of its value,
/// so they sit `len(key) + 2` columns to the right of the key itself.
final class PaprSerializer {

    private static final Logger LOG = Logger.getLogger(PaprSerializer.class.getName());

    /// Read as end of input by the tokenizer outside quotes.
    private static final char END = '\0';

    private final StringBuilder out = new StringBuilder();

    private PaprSerializer() {
    }

    /// Serializes an already simplified tree.
    static String serialize(PaprNode simplified) {
        final var serializer = new PaprSerializer();
        serializer.write(0, simplified);
        LOG.fine(() -> "Serialized " + simplified.size() + " top-level nodes into "
            + serializer.out.length() + " chars");
        return serializer.out.toString();
    }

    private void write(int depth, PaprNode node) {
        int count = 0;
        for (final PaprNode child : node) {
            switch (child.type()) {
                case KEY -> {
                    final String key = sanitize(child.text(), depth + 1);
                    if (count != 0) {
                        pad(depth);
                    }
                    out.append(key).append(": ");
                    final int lastLine = key.lastIndexOf('\n');
                    final int childDepth = lastLine < 0
                        ? depth + key.length() + 2
                        : key.length() - lastLine - 1 + 2;
                    write(childDepth, child);
                }
                case VALUE -> {
                    if (count != 0) {
                        pad(depth);
                    }
                    out.append(sanitize(child.text(), depth + 1)).append('\n');
                }
                case GROUP -> {
                    if (count != 0) {
                        pad(Math.max(0, depth - 2));
                        out.append(": ");
                    }
                    write(depth, child);
                }
                case NONE -> LOG.finer(() -> "Skipping untyped child of " + node);
            }
            count++;
        }
    }

    private void pad(int count) {
        out.append(" ".repeat(count));
    }

    /// Quotes text that would otherwise not read back as a single token.
    ///
    /// Reserved characters are `:`, `#`, newline and NUL anywhere, `"` or a space at the
    /// start, and a space at the end; empty text is quoted as well. Inside quotes
    /// `"` and `\` are escaped, and every newline is followed by `col` spaces so the
    /// tokenizer's dedent restores the original lines.
    ///
    /// @param text the raw text
    /// @param col the column the opening quote will occupy
    static String sanitize(String text, int col) {
        if (!needsQuotes(text)) {
            return text;
        }
        final var sb = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append('\n').append(" ".repeat(col));
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private static boolean needsQuotes(String text) {
        return text.isEmpty()
            || text.indexOf(':') >= 0
            || text.indexOf('#') >= 0
            || text.indexOf('\n') >= 0
            || text.indexOf(END) >= 0
            || text.startsWith("\"")
            || text.startsWith(" ")
            || text.endsWith(" ");
    }
}
