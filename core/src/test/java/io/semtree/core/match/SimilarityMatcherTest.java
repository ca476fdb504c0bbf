// file: core/src/test/java/io/semtree/core/match/SimilarityMatcherTest.java
package io.semtree.core.match;

import io.semtree.core.AttributeOrder;
import io.semtree.core.Matching;
import io.semtree.core.TreeNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityMatcherTest {

    @Test
    void threshold_must_be_in_range() {
        assertThrows(IllegalArgumentException.class, () -> new SimilarityMatcher(0.0, AttributeOrder.IGNORE));
        assertThrows(IllegalArgumentException.class, () -> new SimilarityMatcher(1.5, AttributeOrder.IGNORE));
        assertEquals(0.5, new SimilarityMatcher(0.5, AttributeOrder.IGNORE).threshold());
    }

    @Test
    void pairs_above_threshold_only() {
        TreeNode t1 = TreeNode.builder("root").child(TreeNode.text("child", "A")).build();
        TreeNode t2 = TreeNode.builder("root").child(TreeNode.text("child", "B")).build();
        var m = new Matching();

        int added = new SimilarityMatcher(0.95, AttributeOrder.IGNORE).match(t1, t2, m);

        // roots share label and child labels; the leaves only share their label
        assertEquals(1, added);
        assertSame(t2, m.matchFor1(t1).orElseThrow());
        assertFalse(m.isMatched1(t1.children().get(0)));
    }

    @Test
    void lower_threshold_admits_partial_similarity() {
        TreeNode t1 = TreeNode.builder("root").child(TreeNode.text("child", "A")).build();
        TreeNode t2 = TreeNode.builder("root").child(TreeNode.text("child", "B")).build();
        var m = new Matching();

        new SimilarityMatcher(0.3, AttributeOrder.IGNORE).match(t1, t2, m);

        assertEquals(2, m.size());
        assertTrue(m.isValid());
    }

    @Test
    void best_scoring_candidate_wins() {
        TreeNode x1 = TreeNode.builder("item").attribute("k", "1").attribute("n", "x").build();
        TreeNode t1 = TreeNode.builder("list").child(x1).build();
        TreeNode near = TreeNode.builder("item").attribute("k", "1").attribute("n", "x").attribute("z", "0").build();
        TreeNode exact = TreeNode.builder("item").attribute("k", "1").attribute("n", "x").build();
        TreeNode t2 = TreeNode.builder("list").child(near).child(exact).build();
        var m = new Matching();

        new SimilarityMatcher(0.5, AttributeOrder.IGNORE).match(t1, t2, m);

        assertSame(exact, m.matchFor1(x1).orElseThrow());
    }

    @Test
    void text_leaves_of_the_same_shape_are_candidates_across_labels() {
        TreeNode n1 = TreeNode.text("price", "12");
        TreeNode t1 = TreeNode.builder("root").child(n1).build();
        TreeNode n2 = TreeNode.text("cost", "12");
        TreeNode t2 = TreeNode.builder("root").child(n2).build();
        var m = new Matching();

        // {label:price, value:12} vs {label:cost, value:12}
        new SimilarityMatcher(0.3, AttributeOrder.IGNORE).match(t1, t2, m);

        assertSame(n2, m.matchFor1(n1).orElseThrow());
    }

    @Test
    void equal_similarity_prefers_the_candidate_at_the_same_depth() {
        TreeNode item1 = TreeNode.builder("item").attribute("a", "1").build();
        TreeNode t1 = TreeNode.builder("root").child(item1).build();
        TreeNode deep = TreeNode.builder("item").attribute("a", "1").build();
        TreeNode shallow = TreeNode.builder("item").attribute("a", "1").build();
        TreeNode t2 = TreeNode.builder("root")
                .child(TreeNode.builder("group").child(deep).build())
                .child(shallow)
                .build();
        var m = new Matching();

        new SimilarityMatcher(0.9, AttributeOrder.IGNORE).match(t1, t2, m);

        // the deeper twin comes first in document order but is 0.3 further away
        assertSame(shallow, m.matchFor1(item1).orElseThrow());
        assertFalse(m.isMatched2(deep));
    }

    @Test
    void equal_similarity_and_distance_prefers_the_smaller_subtree() {
        TreeNode big = TreeNode.builder("sec")
                .child(TreeNode.builder("p").child(TreeNode.text("t", "a")).build())
                .build();
        TreeNode small = TreeNode.builder("sec").child(TreeNode.of("p")).build();
        TreeNode t1 = TreeNode.builder("root").child(big).child(small).build();
        TreeNode target = TreeNode.builder("sec").child(TreeNode.of("p")).build();
        TreeNode t2 = TreeNode.builder("root").child(target).build();
        var m = new Matching();

        new SimilarityMatcher(0.9, AttributeOrder.IGNORE).match(t1, t2, m);

        // both sections score 1.0 at depth 1; the bigger one is earlier in document order
        assertSame(target, m.matchFor1(small).orElseThrow());
        assertFalse(m.isMatched1(big));
        assertTrue(m.isValid());
    }
}
