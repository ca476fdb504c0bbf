// file: engine/src/test/java/io/semtree/engine/TreeSizeGuardTest.java
package io.semtree.engine;

import io.semtree.core.TreeNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TreeSizeGuardTest {

    private static TreeNode tree(int children) {
        TreeNode root = TreeNode.of("r");
        for (int i = 0; i < children; i++) root.addChild(TreeNode.of("c"));
        return root;
    }

    @Test
    void returns_size_within_limit() {
        assertEquals(3, new TreeSizeGuard(3).check("tree1", tree(2)));
    }

    @Test
    void throws_above_limit_with_details() {
        var ex = assertThrows(SizeLimitExceededException.class, () -> new TreeSizeGuard(3).check("tree1", tree(5)));

        assertEquals(6, ex.observed());
        assertEquals(3, ex.limit());
        assertEquals("tree1 has 6 nodes, limit is 3", ex.getMessage());
    }

    @Test
    void zero_disables_and_negative_is_invalid() {
        var guard = new TreeSizeGuard(0);
        assertFalse(guard.enabled());
        assertEquals(101, guard.check("tree1", tree(100)));
        assertThrows(IllegalArgumentException.class, () -> new TreeSizeGuard(-1));
    }
}
