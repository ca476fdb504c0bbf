// file: core/src/main/java/io/semtree/core/match/HashMatcher.java
package io.semtree.core.match;

import io.semtree.core.AttributeComparator;
import io.semtree.core.AttributeOrder;
import io.semtree.core.Matching;
import io.semtree.core.NodeSignature;
import io.semtree.core.NodeWeight;
import io.semtree.core.TreeNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Phase 1: exact pairing of structurally unmoved, unchanged subtrees.
 * <p>
 * Algorithm:
 *  - Index every tree2 node by its {@link NodeSignature}.
 *  - Walk tree1 heaviest first ({@link NodeWeight}), pre-order among equal
 *    weights. For each unmatched node, try the unmatched tree2
 *    nodes with the same signature and the same {@link SubtreeDigest}, in
 *    document order. If the Matching rejects a candidate, try the next one.
 *  - An accepted pair pairs the two subtrees node by node, then climbs to the
 *    parents while they share a signature and shallow content.
 * <p>
 * Cost: O(n + m) to build digests and the index, O(n log n) for the visit
 * order; candidate lists are only
 * scanned for nodes whose exact signature repeats.
 */
public final class HashMatcher {

    private final AttributeComparator attributes;

    public HashMatcher(AttributeOrder attributeOrder) {
        this.attributes = new AttributeComparator(Objects.requireNonNull(attributeOrder, "attributeOrder"));
    }

    /**
     * Add exact pairs to {@code matching}.
     *
     * @return number of pairs this phase added
     */
    public int match(TreeNode tree1, TreeNode tree2, Matching matching) {
        Objects.requireNonNull(tree1, "tree1");
        Objects.requireNonNull(tree2, "tree2");
        Objects.requireNonNull(matching, "matching");

        int before = matching.size();
        var digests = new SubtreeDigest(attributes);
        Map<NodeSignature, List<TreeNode>> index = new HashMap<>();
        for (TreeNode n2 : tree2.preOrder()) {
            index.computeIfAbsent(NodeSignature.of(n2), k -> new ArrayList<>()).add(n2);
        }

        for (TreeNode n1 : heaviestFirst(tree1)) {
            if (matching.isMatched1(n1)) continue;
            List<TreeNode> candidates = index.get(NodeSignature.of(n1));
            if (candidates == null) continue;

            byte[] d1 = digests.of(n1);
            for (TreeNode n2 : candidates) {
                if (matching.isMatched2(n2)) continue;
                if (!Arrays.equals(d1, digests.of(n2))) continue;
                if (pairSubtrees(n1, n2, matching)) {
                    propagateToAncestors(n1, n2, matching);
                    break;
                }
            }
        }
        return matching.size() - before;
    }

    /** Descending weight. List.sort is stable, so equal weights keep pre-order. */
    static List<TreeNode> heaviestFirst(TreeNode tree) {
        List<TreeNode> order = new ArrayList<>(tree.preOrder());
        order.sort(Comparator.<TreeNode, NodeWeight>comparing(NodeWeight::of).reversed());
        return order;
    }

    /**
     * Pair two identical subtrees. The roots must be accepted; inner pairs are best
     * effort since a descendant may already be taken by an earlier pair.
     */
    private static boolean pairSubtrees(TreeNode n1, TreeNode n2, Matching matching) {
        if (!matching.add(n1, n2)) return false;
        var c1 = n1.children();
        var c2 = n2.children();
        for (int i = 0; i < c1.size(); i++) {
            pairSubtrees(c1.get(i), c2.get(i), matching);
        }
        return true;
    }

    private void propagateToAncestors(TreeNode n1, TreeNode n2, Matching matching) {
        TreeNode p1 = n1.parent();
        TreeNode p2 = n2.parent();
        while (p1 != null && p2 != null) {
            if (matching.isMatched1(p1) || matching.isMatched2(p2)) return;
            if (!NodeSignature.of(p1).equals(NodeSignature.of(p2))) return;
            if (!shallowEqual(p1, p2)) return;
            if (!matching.add(p1, p2)) return;
            p1 = p1.parent();
            p2 = p2.parent();
        }
    }

    private boolean shallowEqual(TreeNode a, TreeNode b) {
        return a.label().equals(b.label())
                && Objects.equals(a.value(), b.value())
                && attributes.equal(a.attributes(), b.attributes());
    }
}
