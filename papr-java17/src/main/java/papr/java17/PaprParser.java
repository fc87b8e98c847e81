package papr.java17;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Builds a Papr tree from tokens by comparing columns against a stack of open anchors.
///
/// Nesting is not measured in indent units. A token attaches to the nearest open
/// anchor of the right kind whose column is strictly smaller than its own:
/// - a text token attaches to an open `:` or to the document root and becomes a key;
/// - a `:` attaches to an open text token and opens a group under it.
///
/// Anchors passed over on the way down the stack are finished siblings and are
/// popped for good. A token that exhausts the stack fails the whole parse.
final class PaprParser {

    private static final Logger LOG = Logger.getLogger(PaprParser.class.getName());

    /// What an open stack frame was created by.
    enum Anchor {
        /// The bottom frame, bound to the document root.
        SEED,
        TEXT,
        COLON
    }

    /// An open attachment point.
    record Frame(Anchor anchor, int column, PaprNode node) {
        @Override
        public String toString() {
            return anchor + "@" + column;
        }
    }

    private final List<PaprToken> tokens;
    private final Deque<Frame> stack = new ArrayDeque<>();
    private final PaprNode root = PaprNode.root();

    private PaprParser(List<PaprToken> tokens) {
        this.tokens = tokens;
        stack.push(new Frame(Anchor.SEED, Integer.MIN_VALUE, root));
    }

    /// Tokenizes, parses and simplifies a document.
    /// @param text the document
    /// @return the canonical tree, or the error for the first token that could not be attached
    /// @throws NullPointerException if text is null
    static PaprParseResult parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        final var tokens = PaprTokenizer.tokenize(text);
        LOG.fine(() -> "Parsing " + tokens.size() + " tokens");
        return new PaprParser(tokens).run();
    }

    private PaprParseResult run() {
        for (final PaprToken token : tokens) {
            final Frame frame = switch (token.kind()) {
                case TEXT -> seek(token.column(), Anchor.TEXT);
                case COLON -> seek(token.column(), Anchor.COLON);
            };
            if (frame == null) {
                final var error = PaprParseError.unattached(token);
                LOG.fine(() -> "Parse failed: " + error.message());
                return PaprParseResult.failure(error);
            }
            final PaprNode attached = token.kind() == PaprTokenKind.TEXT
                ? frame.node().adopt(PaprNode.key(token.text()))
                : frame.node().adopt(PaprNode.group());
            LOG.finer(() -> "Attached " + token + " under " + frame);
            stack.push(new Frame(token.kind() == PaprTokenKind.TEXT ? Anchor.TEXT : Anchor.COLON,
                token.column(), attached));
        }

        if (LOG.isLoggable(Level.FINER)) {
            LOG.finer("Raw tree:\n" + Papr.toDisplayString(root, 2));
        }
        root.simplify();
        return PaprParseResult.success(root);
    }

    /// Pops frames until the top one can take a token of the given kind at the given column.
    /// @return the frame to attach to, or null when the stack runs out
    private Frame seek(int column, Anchor incoming) {
        while (!stack.isEmpty()) {
            final Frame top = stack.peek();
            if (top.column() < column && accepts(top.anchor(), incoming)) {
                return top;
            }
            stack.pop();
        }
        return null;
    }

    private static boolean accepts(Anchor open, Anchor incoming) {
        return incoming == Anchor.TEXT
            ? open == Anchor.COLON || open == Anchor.SEED
            : open == Anchor.TEXT;
    }
}
