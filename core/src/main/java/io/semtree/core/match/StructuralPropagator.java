// file: core/src/main/java/io/semtree/core/match/StructuralPropagator.java
package io.semtree.core.match;

import io.semtree.core.Matching;
import io.semtree.core.TreeNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Phase 3: extends the matching from surrounding context, below any similarity threshold.
 * <p>
 * Rules, repeated until a full round adds nothing:
 *  - Roots: two unmatched roots with the same label are the same document root.
 *  - Bottom-up: the parents of a matched pair are paired when they share a label,
 *    agree on at least half of their attributes, and every matched child of the
 *    tree1 parent has its partner under the tree2 parent.
 *  - Top-down: under a matched pair, an unmatched child whose label occurs exactly
 *    once among the unmatched children on both sides is paired with its
 *    counterpart. The sole remaining child on each side is the simplest case.
 * <p>
 * All additions still go through {@link Matching#add}, so no rule can break the
 * matching invariants.
 */
public final class StructuralPropagator {

    /** Minimum share of agreeing attributes for bottom-up parent pairing. */
    static final double MIN_ATTRIBUTE_AGREEMENT = 0.5;

    /**
     * Add context-implied pairs to {@code matching}.
     *
     * @return number of pairs this phase added
     */
    public int propagate(TreeNode tree1, TreeNode tree2, Matching matching) {
        Objects.requireNonNull(tree1, "tree1");
        Objects.requireNonNull(tree2, "tree2");
        Objects.requireNonNull(matching, "matching");

        int before = matching.size();
        int added;
        do {
            added = matchRoots(tree1, tree2, matching)
                    + propagateBottomUp(matching)
                    + propagateTopDown(matching);
        } while (added > 0);
        return matching.size() - before;
    }

    private static int matchRoots(TreeNode tree1, TreeNode tree2, Matching matching) {
        if (matching.isMatched1(tree1) || matching.isMatched2(tree2)) return 0;
        if (!tree1.label().equals(tree2.label())) return 0;
        return matching.add(tree1, tree2) ? 1 : 0;
    }

    private static int propagateBottomUp(Matching matching) {
        int added = 0;
        var snapshot = new ArrayList<>(matching.pairs());
        // Latest pairs first: deeper nodes tend to be added after their context.
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            TreeNode p1 = snapshot.get(i).node1().parent();
            TreeNode p2 = snapshot.get(i).node2().parent();
            if (p1 == null || p2 == null) continue;
            if (matching.isMatched1(p1) || matching.isMatched2(p2)) continue;
            if (!parentsCompatible(p1, p2, matching)) continue;
            if (matching.add(p1, p2)) added++;
        }
        return added;
    }

    private static boolean parentsCompatible(TreeNode p1, TreeNode p2, Matching matching) {
        if (!p1.label().equals(p2.label())) return false;
        if (1.0 - p1.attributeDifference(p2) < MIN_ATTRIBUTE_AGREEMENT) return false;

        boolean anyMatched = false;
        for (TreeNode c1 : p1.children()) {
            var c2 = matching.matchFor1(c1);
            if (c2.isEmpty()) continue;
            anyMatched = true;
            if (c2.get().parent() != p2) return false;
        }
        return anyMatched;
    }

    private static int propagateTopDown(Matching matching) {
        int added = 0;
        var snapshot = new ArrayList<>(matching.pairs());
        for (Matching.Pair pair : snapshot) {
            List<TreeNode> open1 = matching.unmatched1(pair.node1().children());
            List<TreeNode> open2 = matching.unmatched2(pair.node2().children());
            if (open1.isEmpty() || open2.isEmpty()) continue;

            Map<String, List<TreeNode>> byLabel1 = groupByLabel(open1);
            Map<String, List<TreeNode>> byLabel2 = groupByLabel(open2);
            for (var e : byLabel1.entrySet()) {
                List<TreeNode> nodes2 = byLabel2.get(e.getKey());
                if (e.getValue().size() != 1 || nodes2 == null || nodes2.size() != 1) continue;
                if (matching.add(e.getValue().get(0), nodes2.get(0))) added++;
            }
        }
        return added;
    }

    private static Map<String, List<TreeNode>> groupByLabel(List<TreeNode> nodes) {
        Map<String, List<TreeNode>> out = new LinkedHashMap<>();
        for (TreeNode n : nodes) out.computeIfAbsent(n.label(), k -> new ArrayList<>()).add(n);
        return out;
    }
}
