// file: core/src/test/java/io/semtree/core/match/StructuralPropagatorTest.java
package io.semtree.core.match;

import io.semtree.core.Matching;
import io.semtree.core.TreeNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StructuralPropagatorTest {

    @Test
    void roots_with_the_same_label_are_paired() {
        TreeNode t1 = TreeNode.of("doc");
        TreeNode t2 = TreeNode.of("doc");
        var m = new Matching();

        assertEquals(1, new StructuralPropagator().propagate(t1, t2, m));
        assertSame(t2, m.matchFor1(t1).orElseThrow());
    }

    @Test
    void sole_remaining_children_are_paired_top_down() {
        TreeNode c1 = TreeNode.text("child", "A");
        TreeNode t1 = TreeNode.builder("root").child(c1).build();
        TreeNode c2 = TreeNode.text("child", "B");
        TreeNode t2 = TreeNode.builder("root").child(c2).build();
        var m = new Matching();

        new StructuralPropagator().propagate(t1, t2, m);

        assertSame(c2, m.matchFor1(c1).orElseThrow());
    }

    @Test
    void repeated_labels_are_left_alone() {
        TreeNode t1 = TreeNode.builder("root")
                .child(TreeNode.text("p", "a"))
                .child(TreeNode.text("p", "b"))
                .build();
        TreeNode t2 = TreeNode.builder("root")
                .child(TreeNode.text("p", "c"))
                .child(TreeNode.text("p", "d"))
                .build();
        var m = new Matching();

        new StructuralPropagator().propagate(t1, t2, m);

        assertEquals(1, m.size());
        assertSame(t2, m.matchFor1(t1).orElseThrow());
    }

    @Test
    void parents_of_matched_children_are_paired_bottom_up() {
        TreeNode leaf1 = TreeNode.text("t", "same");
        TreeNode sec1 = TreeNode.builder("section").attribute("id", "a").child(leaf1).build();
        TreeNode t1 = TreeNode.builder("doc").child(sec1).child(TreeNode.of("x")).build();
        TreeNode leaf2 = TreeNode.text("t", "same");
        TreeNode sec2 = TreeNode.builder("section").attribute("id", "a").child(leaf2).build();
        TreeNode t2 = TreeNode.builder("other").child(sec2).build();
        var m = new Matching();
        m.add(leaf1, leaf2);

        new StructuralPropagator().propagate(t1, t2, m);

        assertSame(sec2, m.matchFor1(sec1).orElseThrow());
        assertFalse(m.isMatched1(t1));
        assertTrue(m.isValid());
    }

    @Test
    void disagreeing_attributes_block_bottom_up_pairing() {
        TreeNode leaf1 = TreeNode.text("t", "same");
        TreeNode sec1 = TreeNode.builder("section").attribute("id", "a").child(leaf1).build();
        TreeNode t1 = TreeNode.builder("doc").child(sec1).build();
        TreeNode leaf2 = TreeNode.text("t", "same");
        TreeNode sec2 = TreeNode.builder("section").attribute("id", "b").child(leaf2).build();
        TreeNode t2 = TreeNode.builder("other").child(sec2).build();
        var m = new Matching();
        m.add(leaf1, leaf2);

        new StructuralPropagator().propagate(t1, t2, m);

        assertFalse(m.isMatched1(sec1));
    }
}
