// file: core/src/test/java/io/semtree/core/match/HashMatcherTest.java
package io.semtree.core.match;

import io.semtree.core.AttributeOrder;
import io.semtree.core.Matching;
import io.semtree.core.TreeNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HashMatcherTest {

    private static TreeNode doc() {
        return TreeNode.builder("root")
                .child(TreeNode.builder("section")
                        .attribute("id", "s1")
                        .child(TreeNode.text("para", "one"))
                        .child(TreeNode.text("para", "two"))
                        .build())
                .child(TreeNode.text("footer", "end"))
                .build();
    }

    @Test
    void identical_trees_are_fully_matched() {
        TreeNode t1 = doc();
        TreeNode t2 = doc();
        var m = new Matching();

        int added = new HashMatcher(AttributeOrder.IGNORE).match(t1, t2, m);

        assertEquals(t1.size(), added);
        assertTrue(m.isValid());
        var n1 = t1.preOrder();
        var n2 = t2.preOrder();
        for (int i = 0; i < n1.size(); i++) {
            assertSame(n2.get(i), m.matchFor1(n1.get(i)).orElseThrow());
        }
    }

    @Test
    void unchanged_subtree_is_matched_and_parents_follow_when_shallow_equal() {
        TreeNode t1 = TreeNode.builder("root").child(TreeNode.text("child1", "A")).build();
        TreeNode t2 = TreeNode.builder("root")
                .child(TreeNode.text("child1", "A"))
                .child(TreeNode.text("child2", "B"))
                .build();
        var m = new Matching();

        new HashMatcher(AttributeOrder.IGNORE).match(t1, t2, m);

        assertSame(t2, m.matchFor1(t1).orElseThrow());
        assertSame(t2.children().get(0), m.matchFor1(t1.children().get(0)).orElseThrow());
        assertFalse(m.isMatched2(t2.children().get(1)));
    }

    @Test
    void changed_value_is_not_an_exact_match() {
        TreeNode t1 = TreeNode.builder("root").child(TreeNode.text("child", "A")).build();
        TreeNode t2 = TreeNode.builder("root").child(TreeNode.text("child", "B")).build();
        var m = new Matching();

        assertEquals(0, new HashMatcher(AttributeOrder.IGNORE).match(t1, t2, m));
    }

    @Test
    void attribute_order_counts_only_when_strict() {
        TreeNode t1 = TreeNode.builder("e").attribute("a", "1").attribute("b", "2").build();
        TreeNode t2 = TreeNode.builder("e").attribute("b", "2").attribute("a", "1").build();

        assertEquals(1, new HashMatcher(AttributeOrder.IGNORE).match(t1, t2, new Matching()));
        assertEquals(0, new HashMatcher(AttributeOrder.STRICT).match(t1, t2, new Matching()));
    }

    @Test
    void swapped_children_are_each_matched_to_their_twin() {
        TreeNode a1 = TreeNode.text("child1", "A");
        TreeNode b1 = TreeNode.text("child2", "B");
        TreeNode t1 = TreeNode.builder("root").child(a1).child(b1).build();
        TreeNode b2 = TreeNode.text("child2", "B");
        TreeNode a2 = TreeNode.text("child1", "A");
        TreeNode t2 = TreeNode.builder("root").child(b2).child(a2).build();
        var m = new Matching();

        new HashMatcher(AttributeOrder.IGNORE).match(t1, t2, m);

        assertSame(a2, m.matchFor1(a1).orElseThrow());
        assertSame(b2, m.matchFor1(b1).orElseThrow());
        assertSame(t2, m.matchFor1(t1).orElseThrow());
    }

    @Test
    void heavier_subtree_claims_the_shared_parent_first() {
        TreeNode t1Leaf = TreeNode.text("t", "x");
        TreeNode light = TreeNode.builder("s").child(t1Leaf).build();
        TreeNode heavyBody = TreeNode.builder("h")
                .child(TreeNode.text("a", "a fairly long paragraph of text"))
                .child(TreeNode.text("b", "and another one"))
                .build();
        TreeNode heavy = TreeNode.builder("s").child(heavyBody).build();
        TreeNode t1 = TreeNode.builder("root").child(light).child(heavy).build();

        TreeNode t2Leaf = TreeNode.text("t", "x");
        TreeNode t2Body = TreeNode.builder("h")
                .child(TreeNode.text("a", "a fairly long paragraph of text"))
                .child(TreeNode.text("b", "and another one"))
                .build();
        TreeNode merged = TreeNode.builder("s").child(t2Leaf).child(t2Body).build();
        TreeNode t2 = TreeNode.builder("root").child(merged).build();
        var m = new Matching();

        new HashMatcher(AttributeOrder.IGNORE).match(t1, t2, m);

        // pre-order would have let the light leaf pull its parent in first
        assertSame(merged, m.matchFor1(heavy).orElseThrow());
        assertFalse(m.isMatched1(light));
        assertSame(t2Body, m.matchFor1(heavyBody).orElseThrow());
        assertSame(t2Leaf, m.matchFor1(t1Leaf).orElseThrow());
        assertTrue(m.isValid());
    }

    @Test
    void visit_order_is_by_descending_weight_then_pre_order() {
        TreeNode small1 = TreeNode.text("a", "x");
        TreeNode big = TreeNode.text("b", "a much longer value");
        TreeNode small2 = TreeNode.text("c", "y");
        TreeNode root = TreeNode.builder("root").child(small1).child(big).child(small2).build();

        assertEquals(List.of(root, big, small1, small2), HashMatcher.heaviestFirst(root));
    }
}
