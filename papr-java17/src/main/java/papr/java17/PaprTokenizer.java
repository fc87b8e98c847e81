package papr.java17;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Splits Papr text into [PaprToken]s.
///
/// Outside quotes the delimiters are `:`, newline, `#` and end of input.
/// A token is quoted only when its first non-space character is `"`; inside it
/// delimiters are literal and `\` escapes the next character. An unquoted `#`
/// starts a comment running to the end of the line.
///
/// Columns are 1-based and count characters, the newline itself being column 0
/// of the line it starts.
final class PaprTokenizer {

    private static final Logger LOG = Logger.getLogger(PaprTokenizer.class.getName());

    /// Stands in for the character after the last one.
    private static final char END = '\0';

    private final String text;
    private final List<PaprToken> tokens = new ArrayList<>();
    private final StringBuilder partial = new StringBuilder();

    private int line = 1;
    private int column;
    private int tokenLine;
    private int tokenColumn;
    private boolean hasContent;
    private boolean inQuotes;
    private boolean escaped;
    private boolean inComment;

    private PaprTokenizer(String text) {
        this.text = text;
    }

    /// Tokenizes a whole document.
    /// @param text the document
    /// @return the tokens in document order, empty for blank or comment-only text
    /// @throws NullPointerException if text is null
    static List<PaprToken> tokenize(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return new PaprTokenizer(text).run();
    }

    private List<PaprToken> run() {
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            final char next = i + 1 < text.length() ? text.charAt(i + 1) : END;
            accept(c, next);
        }
        if (inQuotes) {
            LOG.fine(() -> "Discarding unterminated quoted text starting at "
                + tokenLine + ":" + tokenColumn);
        }
        LOG.finer(() -> "Tokenized " + text.length() + " chars into " + tokens.size() + " tokens");
        return List.copyOf(tokens);
    }

    private void accept(char c, char next) {
        column++;
        if (c == '\n') {
            line++;
            column = 0;
        }

        // a NUL outside quotes is skipped without starting a token
        final boolean first = !hasContent && c != ' ' && c != '\n' && c != END;
        if (first) {
            hasContent = true;
            tokenLine = line;
            tokenColumn = column;
        }

        if (first && c == '"') {
            inQuotes = true;
        } else if (inQuotes) {
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"') {
                inQuotes = false;
            }
        }

        if (!inQuotes && c == '#') {
            inComment = true;
        }
        if (inComment && c == '\n') {
            inComment = false;
            reset();
        }
        if (inComment) {
            return;
        }

        if (inQuotes || !isDelimiter(c)) {
            partial.append(c);
            if (!inQuotes && hasContent && isDelimiter(next)) {
                emit(PaprToken.text(trim(partial.toString(), tokenColumn), tokenLine, tokenColumn));
            }
        } else if (c == ':') {
            emit(PaprToken.colon(line, column));
        }
    }

    private void emit(PaprToken token) {
        LOG.finer(() -> "Token " + token);
        tokens.add(token);
        reset();
    }

    private void reset() {
        partial.setLength(0);
        hasContent = false;
    }

    static boolean isDelimiter(char c) {
        return c == ':' || c == '\n' || c == '#' || c == END;
    }

    /// Trims a captured token.
    ///
    /// Leading and trailing spaces go first. A result starting with `"` loses
    /// its wrapping quotes, then every line after the first loses up to
    /// `startColumn` leading characters so wrapped values line up under the
    /// opening quote, and finally `\"` and `\\` are unescaped.
    ///
    /// @param raw the captured characters
    /// @param startColumn the column of the token's first non-space character
    /// @return the token text
    static String trim(String raw, int startColumn) {
        int start = 0;
        int end = raw.length() - 1;
        boolean found = false;
        for (int i = 0; i < raw.length(); i++) {
            if (raw.charAt(i) != ' ') {
                if (!found) {
                    start = i;
                    found = true;
                }
                end = i;
            }
        }

        final String result = raw.substring(start, end + 1);
        if (!result.startsWith("\"")) {
            return result;
        }

        final int close = result.length() > 1 && result.endsWith("\"") ? result.length() - 1 : result.length();
        final var unwrapped = new StringBuilder(result.substring(Math.min(1, close), close));

        int newline = unwrapped.indexOf("\n");
        while (newline >= 0) {
            final int from = newline + 1;
            if (from >= unwrapped.length()) {
                break;
            }
            final int nextNewline = unwrapped.indexOf("\n", from);
            final int length = (nextNewline < 0 ? unwrapped.length() : nextNewline) - from;
            unwrapped.delete(from, from + Math.min(startColumn, length));
            newline = unwrapped.indexOf("\n", from);
        }
        return unescape(unwrapped);
    }

    private static String unescape(CharSequence quoted) {
        final var out = new StringBuilder(quoted.length());
        for (int i = 0; i < quoted.length(); i++) {
            final char c = quoted.charAt(i);
            if (c == '\\' && i + 1 < quoted.length()) {
                final char n = quoted.charAt(i + 1);
                if (n == '"' || n == '\\') {
                    out.append(n);
                    i++;
                    continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }
}
