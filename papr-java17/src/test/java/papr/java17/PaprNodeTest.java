package papr.java17;

import org.junit.jupiter.api.Test;

import java.util.Iterator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Tests for the tree model: builders, lookups, mutation and the invalid sentinel.
class PaprNodeTest extends PaprTestBase {

    // ========== Builders ==========

    @Test
    void testBuilders() {
        assertThat(PaprNode.root().type()).isEqualTo(PaprNodeType.NONE);
        assertThat(PaprNode.root().isInvalid()).isFalse();
        assertThat(PaprNode.group().type()).isEqualTo(PaprNodeType.GROUP);
        assertThat(PaprNode.key("k").type()).isEqualTo(PaprNodeType.KEY);
        assertThat(PaprNode.key("k").text()).isEqualTo("k");
        assertThat(PaprNode.value("v").type()).isEqualTo(PaprNodeType.VALUE);
        assertThat(PaprNode.value("v").text()).isEqualTo("v");
        assertThatThrownBy(() -> PaprNode.key(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> PaprNode.value(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void testAddReturnsStoredChild() {
        final PaprNode root = PaprNode.root();
        final PaprNode server = root.addKey("server");
        server.addNode(keyValue("port", "8080"));

        assertThat(root.get("server")).isSameAs(server);
        assertThat(root.get("server").get("port").value()).isEqualTo("8080");
    }

    @Test
    void testAddNodeStoresACopy() {
        final PaprNode original = keyValue("a", "1");
        final PaprNode root = PaprNode.root();
        final PaprNode stored = root.addNode(original);

        original.updateKey("changed");
        original.get(0).updateKey("ignored");
        original.updateValue("2");

        assertThat(stored).isNotSameAs(original);
        assertThat(root.get("a").value()).isEqualTo("1");
    }

    @Test
    void testAddingToValueFails() {
        final PaprNode value = PaprNode.value("v");
        assertThatThrownBy(() -> value.addValue("w"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("value node");
    }

    // ========== Sentinel ==========

    @Test
    void testSentinelAnswersEverythingEmpty() {
        final PaprNode invalid = PaprNode.invalid();
        assertThat(invalid.isInvalid()).isTrue();
        assertThat(invalid.type()).isEqualTo(PaprNodeType.NONE);
        assertThat(invalid.text()).isEmpty();
        assertThat(invalid.size()).isZero();
        assertThat(invalid.hasKey()).isFalse();
        assertThat(invalid.key()).isEmpty();
        assertThat(invalid.hasValue()).isFalse();
        assertThat(invalid.value()).isEmpty();
        assertThat(invalid.get(0)).isSameAs(invalid);
        assertThat(invalid.get("x")).isSameAs(invalid);
        assertThat(invalid.toString()).isEqualTo("Invalid");
    }

    @Test
    void testSentinelAbsorbsMutation() {
        final PaprNode invalid = PaprNode.invalid();
        assertThat(invalid.addKey("k")).isSameAs(invalid);
        assertThat(invalid.addValue("v")).isSameAs(invalid);
        invalid.removeNodeAtIndex(3);
        invalid.updateKey("k");
        invalid.updateValue("v");

        assertThat(invalid.size()).isZero();
        assertThat(invalid.copy()).isSameAs(invalid);
    }

    @Test
    void testAddingSentinelStoresNothing() {
        final PaprNode root = PaprNode.root();
        assertThat(root.addNode(PaprNode.invalid())).isSameAs(PaprNode.invalid());
        assertThat(root.size()).isZero();
    }

    @Test
    void testChainedLookupsThroughMissingKeys() {
        final PaprNode root = Papr.parse("server:\n  port: 8080\n");
        assertThat(root.get("server").get("port").value()).isEqualTo("8080");
        assertThat(root.get("client").get("port").value()).isEmpty();
        assertThat(root.get(5).get(0).get("x").isInvalid()).isTrue();
        assertThat(root.get(-1).isInvalid()).isTrue();
    }

    @Test
    void testOptionalLookups() {
        final PaprNode root = rootOf(keyValue("a", "1"));
        assertThat(root.getOrAbsent("a")).contains(root.get(0));
        assertThat(root.getOrAbsent("b")).isEmpty();
        assertThat(root.getOrAbsent(0)).isPresent();
        assertThat(root.getOrAbsent(1)).isEmpty();
    }

    // ========== Lookups ==========

    @Test
    void testKeyLookupReturnsFirstMatch() {
        final PaprNode root = rootOf(keyValue("a", "first"), keyValue("a", "second"));
        assertThat(root.get("a").value()).isEqualTo("first");
        assertThat(root.get(1).value()).isEqualTo("second");
    }

    @Test
    void testKeyLookupSkipsValuesWithSameText() {
        final PaprNode root = rootOf(PaprNode.value("a"), keyValue("a", "1"));
        assertThat(root.get("a")).isSameAs(root.get(1));
    }

    @Test
    void testHasValueNeedsExactlyOneValueChild() {
        final PaprNode a = PaprNode.key("a");
        assertThat(a.hasValue()).isFalse();
        a.addValue("1");
        assertThat(a.hasValue()).isTrue();
        a.addValue("2");
        assertThat(a.hasValue()).isFalse();
        assertThat(a.value()).isEmpty();

        final PaprNode b = PaprNode.key("b");
        b.addKey("c");
        assertThat(b.hasValue()).isFalse();
    }

    @Test
    void testKeyAccessorsOnlyForKeys() {
        final PaprNode value = PaprNode.value("v");
        assertThat(value.hasKey()).isFalse();
        assertThat(value.key()).isEmpty();
        value.updateKey("k");
        assertThat(value.text()).isEqualTo("v");

        final PaprNode key = PaprNode.key("k");
        key.updateKey("renamed");
        assertThat(key.key()).isEqualTo("renamed");
    }

    @Test
    void testUpdateValue() {
        final PaprNode a = keyValue("a", "1");
        a.updateValue("2");
        assertThat(a.value()).isEqualTo("2");

        final PaprNode empty = PaprNode.key("e");
        empty.updateValue("ignored");
        assertThat(empty.size()).isZero();
    }

    // ========== Removal and iteration ==========

    @Test
    void testRemoveShiftsLaterChildren() {
        final PaprNode root = rootOf(keyValue("a", "1"), keyValue("b", "2"), keyValue("c", "3"));

        root.removeNodeAtIndex(1);

        assertThat(root.size()).isEqualTo(2);
        assertThat(root.get(1).key()).isEqualTo("c");
        assertThat(root.get("b").isInvalid()).isTrue();
    }

    @Test
    void testRemoveOutOfRangeThrows() {
        final PaprNode root = rootOf(keyValue("a", "1"));
        assertThatThrownBy(() -> root.removeNodeAtIndex(1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> root.removeNodeAtIndex(-1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThat(root.size()).isEqualTo(1);
    }

    @Test
    void testIterationInInsertionOrder() {
        final PaprNode root = rootOf(PaprNode.value("x"), PaprNode.value("y"));
        assertThat(root).extracting(PaprNode::text).containsExactly("x", "y");

        final Iterator<PaprNode> it = root.iterator();
        it.next();
        assertThatThrownBy(it::remove).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> root.children().add(PaprNode.value("z")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    // ========== Copy, equality, rendering ==========

    @Test
    void testCopyIsDeep() {
        final PaprNode root = rootOf(keyValue("a", "1"));
        final PaprNode copy = root.copy();

        copy.get("a").updateValue("2");

        assertThat(root.get("a").value()).isEqualTo("1");
        assertThat(copy).isNotEqualTo(root);
    }

    @Test
    void testStructuralEquality() {
        final PaprNode left = rootOf(keyValue("a", "1"));
        final PaprNode right = rootOf(keyValue("a", "1"));
        assertThat(left).isEqualTo(right).hasSameHashCodeAs(right);
        assertThat(PaprNode.root()).isNotEqualTo(PaprNode.invalid());
        assertThat(PaprNode.key("a")).isNotEqualTo(PaprNode.value("a"));
    }

    @Test
    void testToString() {
        final PaprNode root = rootOf(keyValue("a", "1"), PaprNode.group(), PaprNode.value("x\ny"));
        assertThat(root.toString()).isEqualTo("Root[Key(\"a\")[Value(\"1\")], Group, Value(\"x\\ny\")]");
    }
}
