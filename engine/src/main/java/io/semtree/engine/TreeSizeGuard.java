// file: engine/src/main/java/io/semtree/engine/TreeSizeGuard.java
package io.semtree.engine;

import io.semtree.core.TreeNode;

import java.util.Objects;

/**
 * Rejects oversized inputs before any matching work starts.
 * A limit of 0 disables the check.
 */
public final class TreeSizeGuard {

    private final int maxNodeCount;

    public TreeSizeGuard(int maxNodeCount) {
        if (maxNodeCount < 0) throw new IllegalArgumentException("maxNodeCount must be >= 0");
        this.maxNodeCount = maxNodeCount;
    }

    public int maxNodeCount() { return maxNodeCount; }

    public boolean enabled() { return maxNodeCount > 0; }

    /**
     * @param side label used in the exception message ("tree1" / "tree2")
     * @return the node count of {@code tree}
     * @throws SizeLimitExceededException if the limit is enabled and exceeded
     */
    public int check(String side, TreeNode tree) {
        Objects.requireNonNull(tree, side);
        int size = tree.size();
        if (enabled() && size > maxNodeCount) {
            DiffLogger.logSizeLimit(side, size, maxNodeCount);
            throw new SizeLimitExceededException(side, size, maxNodeCount);
        }
        return size;
    }
}
