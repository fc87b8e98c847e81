package papr.java17;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// A node of a Papr document tree.
///
/// A node is a [PaprNodeType#GROUP], [PaprNodeType#KEY] or [PaprNodeType#VALUE],
/// or an untyped [PaprNodeType#NONE] container such as the root returned by
/// [Papr#parse(String)]. Keys and values carry text; every node exclusively owns
/// its children, so the tree has no shared or back references. [#addNode(PaprNode)]
/// stores a deep copy of its argument and [#copy()] clones the whole subtree.
///
/// Lookups never fail. An index out of range, a missing key or a failed parse
/// yields the [invalid sentinel][#invalid()], whose accessors return empty text
/// and which ignores every mutation, so lookups can be chained:
/// ```java
/// PaprNode root = Papr.parse("server:\n  port: 8080\n");
/// String port = root.get("server").get("port").value();   // "8080"
/// String none = root.get("client").get("port").value();   // ""
/// ```
///
/// Nodes are mutable and not thread safe.
public final class PaprNode implements Iterable<PaprNode> {

    private static final PaprNode INVALID = new PaprNode(PaprNodeType.NONE, "", true);

    private PaprNodeType type;
    private String text;
    private final List<PaprNode> children = new ArrayList<>();
    private final boolean invalid;

    private PaprNode(PaprNodeType type, String text, boolean invalid) {
        this.type = type;
        this.text = text;
        this.invalid = invalid;
    }

    private PaprNode(PaprNode other) {
        this(other.type, other.text, false);
        for (final PaprNode child : other.children) {
            children.add(new PaprNode(child));
        }
    }

    /// {@return a new empty document root}
    public static PaprNode root() {
        return new PaprNode(PaprNodeType.NONE, "", false);
    }

    /// {@return a new childless group}
    public static PaprNode group() {
        return new PaprNode(PaprNodeType.GROUP, "", false);
    }

    /// {@return a new childless key}
    /// @param key the key name
    /// @throws NullPointerException if key is null
    public static PaprNode key(String key) {
        Objects.requireNonNull(key, "key must not be null");
        return new PaprNode(PaprNodeType.KEY, key, false);
    }

    /// {@return a new value}
    /// @param value the scalar text
    /// @throws NullPointerException if value is null
    public static PaprNode value(String value) {
        Objects.requireNonNull(value, "value must not be null");
        return new PaprNode(PaprNodeType.VALUE, value, false);
    }

    /// {@return the invalid sentinel}
    public static PaprNode invalid() {
        return INVALID;
    }

    public PaprNodeType type() {
        return type;
    }

    /// {@return true for the sentinel returned by failed lookups and failed parses}
    public boolean isInvalid() {
        return invalid;
    }

    /// {@return the key name or scalar text, empty for groups and untyped nodes}
    public String text() {
        return text;
    }

    /// {@return the number of direct children}
    public int size() {
        return children.size();
    }

    /// {@return a read-only view of the direct children in insertion order}
    public List<PaprNode> children() {
        return Collections.unmodifiableList(children);
    }

    /// Iterates the direct children in insertion order. The iterator does not
    /// support removal and fails if the children change while iterating.
    @Override
    public Iterator<PaprNode> iterator() {
        return children().iterator();
    }

    /// {@return the child at the given position, or the sentinel when out of range}
    /// @param index the child position
    public PaprNode get(int index) {
        return index >= 0 && index < children.size() ? children.get(index) : INVALID;
    }

    /// {@return the first direct child that is a key with the given name, or the sentinel}
    /// @param key the key name
    /// @throws NullPointerException if key is null
    public PaprNode get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        for (final PaprNode child : children) {
            if (child.type == PaprNodeType.KEY && child.text.equals(key)) {
                return child;
            }
        }
        return INVALID;
    }

    /// {@return the child at the given position, or empty when out of range}
    /// @param index the child position
    public Optional<PaprNode> getOrAbsent(int index) {
        return present(get(index));
    }

    /// {@return the first direct child key with the given name, or empty}
    /// @param key the key name
    /// @throws NullPointerException if key is null
    public Optional<PaprNode> getOrAbsent(String key) {
        return present(get(key));
    }

    private static Optional<PaprNode> present(PaprNode node) {
        return node.invalid ? Optional.empty() : Optional.of(node);
    }

    /// {@return true if this node is a key}
    public boolean hasKey() {
        return type == PaprNodeType.KEY;
    }

    /// {@return the name of this key, or empty text if this node is not a key}
    public String key() {
        return hasKey() ? text : "";
    }

    /// Renames this key. Ignored if this node is not a key.
    /// @param key the new name
    /// @throws NullPointerException if key is null
    public void updateKey(String key) {
        Objects.requireNonNull(key, "key must not be null");
        if (hasKey()) {
            text = key;
        }
    }

    /// {@return true if this key or group holds exactly one child and that child is a value}
    public boolean hasValue() {
        return (type == PaprNodeType.KEY || type == PaprNodeType.GROUP)
            && children.size() == 1
            && children.get(0).type == PaprNodeType.VALUE;
    }

    /// {@return the text of the single value child, or empty text when [#hasValue()] is false}
    public String value() {
        return hasValue() ? children.get(0).text : "";
    }

    /// Replaces the text of the single value child. Ignored when [#hasValue()] is false.
    /// @param value the new text
    /// @throws NullPointerException if value is null
    public void updateValue(String value) {
        Objects.requireNonNull(value, "value must not be null");
        if (hasValue()) {
            children.get(0).text = value;
        }
    }

    /// Appends a deep copy of the given node.
    /// @param node the node to copy in
    /// @return the stored child, or the sentinel if either node is the sentinel
    /// @throws NullPointerException if node is null
    /// @throws IllegalStateException if this node is a value
    public PaprNode addNode(PaprNode node) {
        Objects.requireNonNull(node, "node must not be null");
        if (invalid || node.invalid) {
            return INVALID;
        }
        return adopt(node.copy());
    }

    /// Appends a new key. Shorthand for `addNode(PaprNode.key(key))`.
    /// @return the stored key
    public PaprNode addKey(String key) {
        return addNode(PaprNode.key(key));
    }

    /// Appends a new value. Shorthand for `addNode(PaprNode.value(value))`.
    /// @return the stored value
    public PaprNode addValue(String value) {
        return addNode(PaprNode.value(value));
    }

    /// Appends a new group. Shorthand for `addNode(PaprNode.group())`.
    /// @return the stored group
    public PaprNode addGroup() {
        return addNode(group());
    }

    /// Removes the child at the given position. Later children shift down by one.
    /// Ignored by the sentinel.
    /// @param index the child position
    /// @throws IndexOutOfBoundsException if index is out of range
    public void removeNodeAtIndex(int index) {
        if (invalid) {
            return;
        }
        children.remove(Objects.checkIndex(index, children.size()));
    }

    /// Rewrites this subtree in place into canonical form. See [PaprSimplifier].
    public void simplify() {
        if (!invalid) {
            PaprSimplifier.simplify(this);
        }
    }

    /// {@return a simplified deep copy, leaving this node untouched}
    public PaprNode simplifyCopy() {
        final PaprNode copy = copy();
        copy.simplify();
        return copy;
    }

    /// {@return a deep copy of this subtree; the sentinel copies to itself}
    public PaprNode copy() {
        return invalid ? INVALID : new PaprNode(this);
    }

    /// Appends the given node itself, transferring it into this tree without copying.
    PaprNode adopt(PaprNode node) {
        if (type == PaprNodeType.VALUE) {
            throw new IllegalStateException("A value node cannot have children: " + this);
        }
        children.add(node);
        return node;
    }

    /// Replaces all children with the given nodes, transferring them without copying.
    void replaceChildren(List<PaprNode> replacement) {
        final var moved = new ArrayList<>(replacement);
        children.clear();
        children.addAll(moved);
    }

    /// Turns a childless key into a value with the same text.
    void convertToValue() {
        assert children.isEmpty() : "only childless nodes become values";
        type = PaprNodeType.VALUE;
    }

    List<PaprNode> mutableChildren() {
        return children;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof PaprNode other
            && invalid == other.invalid
            && type == other.type
            && text.equals(other.text)
            && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(invalid, type, text, children);
    }

    /// {@return a compact single-line rendering such as `Key("a")[Value("1")]`, for debugging}
    @Override
    public String toString() {
        if (invalid) {
            return "Invalid";
        }
        final var sb = new StringBuilder();
        sb.append(switch (type) {
            case NONE -> "Root";
            case GROUP -> "Group";
            case KEY -> "Key";
            case VALUE -> "Value";
        });
        if (type == PaprNodeType.KEY || type == PaprNodeType.VALUE) {
            sb.append("(\"").append(text.replace("\n", "\\n")).append("\")");
        }
        if (!children.isEmpty()) {
            sb.append('[');
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(children.get(i));
            }
            sb.append(']');
        }
        return sb.toString();
    }
}
