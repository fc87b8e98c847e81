package papr.java17;

import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Rewrites a parsed tree into canonical form, bottom-up and in place.
///
/// Children are simplified before their parent, then three rules run at the parent:
/// 1. **Flatten**: a key whose only child is a group takes over the group's children.
///    Repeats while the key is left holding a single group.
/// 2. **Merge**: a key or group whose two or more children are all values gets a single
///    value holding their texts joined by one space, in order.
/// 3. **Leafify**: a key with no children becomes a value with the same text.
///
/// Applying the rewrite to an already canonical tree changes nothing.
final class PaprSimplifier {

    private static final Logger LOG = Logger.getLogger(PaprSimplifier.class.getName());

    private PaprSimplifier() {
    }

    /// Simplifies the subtree rooted at the given node.
    static void simplify(PaprNode node) {
        for (final PaprNode child : node.mutableChildren()) {
            simplify(child);
        }
        flatten(node);
        merge(node);
        leafify(node);
    }

    private static void flatten(PaprNode node) {
        if (node.type() != PaprNodeType.KEY) {
            return;
        }
        while (node.size() == 1 && node.get(0).type() == PaprNodeType.GROUP) {
            final PaprNode group = node.get(0);
            LOG.finer(() -> "Splicing group of " + group.size() + " children into key " + node.text());
            node.replaceChildren(group.mutableChildren());
        }
    }

    private static void merge(PaprNode node) {
        if (node.type() != PaprNodeType.KEY && node.type() != PaprNodeType.GROUP) {
            return;
        }
        final List<PaprNode> children = node.mutableChildren();
        if (children.size() < 2 || !children.stream().allMatch(c -> c.type() == PaprNodeType.VALUE)) {
            return;
        }
        final String merged = children.stream().map(PaprNode::text).collect(Collectors.joining(" "));
        LOG.finer(() -> "Merging " + children.size() + " values into \"" + merged + "\"");
        node.replaceChildren(List.of(PaprNode.value(merged)));
    }

    private static void leafify(PaprNode node) {
        if (node.type() == PaprNodeType.KEY && node.size() == 0) {
            node.convertToValue();
        }
    }
}
