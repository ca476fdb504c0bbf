// file: core/src/main/java/io/semtree/core/match/SimilarityMatcher.java
package io.semtree.core.match;

import io.semtree.core.AttributeOrder;
import io.semtree.core.Matching;
import io.semtree.core.TreeNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Phase 2: threshold-based fuzzy pairing of the nodes phase 1 left over.
 * <p>
 * Candidates for a tree1 node are the unmatched tree2 nodes with the same label,
 * plus (for text leaves) the unmatched text leaves of the same {@link ValueShape}.
 * Every candidate pair scoring at least the threshold is kept, then pairs are
 * accepted greedily in this order:
 *  1. higher {@link TreeNode#similarityTo} first,
 *  2. then smaller {@link TreeNode#semanticDistanceTo},
 *  3. then smaller combined {@code size()} (simpler nodes resolved first),
 *  4. then document order, so the result is deterministic.
 * <p>
 * Similarity is a property of the two nodes alone, so one sorted pass gives the
 * same result as re-scoring the shrinking frontier after each acceptance.
 * Worst case O(n * m) scoring; callers bound tree size before matching.
 */
public final class SimilarityMatcher {

    private record Candidate(
            TreeNode node1,
            TreeNode node2,
            double similarity,
            double distance,
            int size,
            int order1,
            int order2
    ) {}

    private static final Comparator<Candidate> ACCEPTANCE_ORDER =
            Comparator.comparingDouble(Candidate::similarity).reversed()
                    .thenComparingDouble(Candidate::distance)
                    .thenComparingInt(Candidate::size)
                    .thenComparingInt(Candidate::order1)
                    .thenComparingInt(Candidate::order2);

    private final double threshold;
    private final AttributeOrder attributeOrder;

    public SimilarityMatcher(double threshold, AttributeOrder attributeOrder) {
        if (!(threshold > 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("threshold must be in (0, 1]: " + threshold);
        }
        this.threshold = threshold;
        this.attributeOrder = Objects.requireNonNull(attributeOrder, "attributeOrder");
    }

    public double threshold() { return threshold; }

    /**
     * Add fuzzy pairs to {@code matching}.
     *
     * @return number of pairs this phase added
     */
    public int match(TreeNode tree1, TreeNode tree2, Matching matching) {
        Objects.requireNonNull(matching, "matching");
        int before = matching.size();

        List<TreeNode> frontier1 = matching.unmatched1(tree1.preOrder());
        List<TreeNode> frontier2 = matching.unmatched2(tree2.preOrder());
        if (frontier1.isEmpty() || frontier2.isEmpty()) return 0;

        Map<String, List<Integer>> byLabel = new LinkedHashMap<>();
        Map<ValueShape, List<Integer>> byShape = new EnumMap<>(ValueShape.class);
        for (int j = 0; j < frontier2.size(); j++) {
            TreeNode n2 = frontier2.get(j);
            byLabel.computeIfAbsent(n2.label(), k -> new ArrayList<>()).add(j);
            if (n2.isText()) byShape.computeIfAbsent(ValueShape.of(n2.value()), k -> new ArrayList<>()).add(j);
        }

        var candidates = new ArrayList<Candidate>();
        for (int i = 0; i < frontier1.size(); i++) {
            TreeNode n1 = frontier1.get(i);
            Set<Integer> seen = new HashSet<>();
            score(i, n1, byLabel.getOrDefault(n1.label(), List.of()), frontier2, seen, candidates);
            if (n1.isText()) {
                score(i, n1, byShape.getOrDefault(ValueShape.of(n1.value()), List.of()), frontier2, seen, candidates);
            }
        }

        candidates.sort(ACCEPTANCE_ORDER);
        for (Candidate c : candidates) {
            if (matching.isMatched1(c.node1()) || matching.isMatched2(c.node2())) continue;
            matching.add(c.node1(), c.node2());
        }
        return matching.size() - before;
    }

    private void score(
            int i,
            TreeNode n1,
            List<Integer> indexes,
            List<TreeNode> frontier2,
            Set<Integer> seen,
            List<Candidate> out
    ) {
        for (Integer j : indexes) {
            if (!seen.add(j)) continue;
            TreeNode n2 = frontier2.get(j);
            double sim = n1.similarityTo(n2, attributeOrder);
            if (sim < threshold) continue;
            out.add(new Candidate(
                    n1,
                    n2,
                    sim,
                    n1.semanticDistanceTo(n2, attributeOrder),
                    n1.size() + n2.size(),
                    i,
                    j
            ));
        }
    }
}
