// file: engine/src/main/java/io/semtree/engine/TreeDiffer.java
package io.semtree.engine;

import io.semtree.core.Matching;
import io.semtree.core.TreeNode;
import io.semtree.core.match.UniversalMatcher;
import io.semtree.core.ops.Operation;
import io.semtree.core.ops.OperationDetector;

import java.util.List;
import java.util.Objects;

/**
 * Facade over the whole pipeline: size guard, matching, operation detection.
 * <p>
 * Stateless apart from its config, so one instance may serve many threads as long
 * as no two concurrent calls share a tree (matching fills per-node caches).
 */
public final class TreeDiffer {

    private final DiffConfig config;
    private final TreeSizeGuard guard;

    public TreeDiffer() {
        this(DiffConfig.defaults());
    }

    public TreeDiffer(DiffConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.guard = new TreeSizeGuard(config.maxNodeCount());
    }

    public DiffConfig config() { return config; }

    /**
     * @throws SizeLimitExceededException if either tree exceeds {@link DiffConfig#maxNodeCount()}
     */
    public DiffResult diff(TreeNode tree1, TreeNode tree2) {
        guard.check("tree1", tree1);
        guard.check("tree2", tree2);

        long t0 = System.nanoTime();
        var matcher = new UniversalMatcher(config.matcher());
        Matching matching = matcher.match(tree1, tree2);
        long t1 = System.nanoTime();

        List<Operation> ops = new OperationDetector(tree1, tree2, matching).detect();
        long t2 = System.nanoTime();

        DiffLogger.logDiff(matcher.statistics(), ops.size(), (t1 - t0) / 1_000_000, (t2 - t0) / 1_000_000);
        return new DiffResult(ops, matching, matcher.statistics());
    }

    /** True when the diff finds no operation at all. */
    public boolean equivalent(TreeNode tree1, TreeNode tree2) {
        return diff(tree1, tree2).identical();
    }
}
