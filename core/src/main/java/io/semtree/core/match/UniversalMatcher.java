// file: core/src/main/java/io/semtree/core/match/UniversalMatcher.java
package io.semtree.core.match;

import io.semtree.core.Matching;
import io.semtree.core.TreeNode;

import java.util.ArrayList;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for tree matching: runs the enabled phases in order
 * hash → similarity → propagation over one shared {@link Matching}.
 * <p>
 * Usage:
 * <pre>{@code
 *   var matcher = new UniversalMatcher(MatcherConfig.defaults());
 *   Matching m = matcher.match(tree1, tree2);
 *   MatchStatistics stats = matcher.statistics();
 * }</pre>
 * <p>
 * Deterministic: identical trees and config give an identical Matching with pairs
 * in the same order. Not thread safe: {@link #statistics()} describes the last run,
 * and matching writes the signature/weight caches of the nodes it reads.
 */
public final class UniversalMatcher {
    private static final Logger log = Logger.getLogger(UniversalMatcher.class.getName());

    private final MatcherConfig config;
    private MatchStatistics statistics = MatchStatistics.empty();

    public UniversalMatcher() {
        this(MatcherConfig.defaults());
    }

    public UniversalMatcher(MatcherConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public MatcherConfig config() { return config; }

    /** Statistics of the most recent {@link #match} call. */
    public MatchStatistics statistics() { return statistics; }

    public Matching match(TreeNode tree1, TreeNode tree2) {
        Objects.requireNonNull(tree1, "tree1");
        Objects.requireNonNull(tree2, "tree2");

        int nodes1 = tree1.size();
        int nodes2 = tree2.size();
        var phases = new ArrayList<MatchPhase>(3);
        var matching = new Matching();
        int hash = 0, similarity = 0, propagation = 0;

        if (config.hashMatching()) {
            phases.add(MatchPhase.HASH);
            hash = new HashMatcher(config.attributeOrder()).match(tree1, tree2, matching);
            log.log(Level.FINE, "hash phase matched {0} pairs", hash);
        }
        if (config.similarityMatching()) {
            phases.add(MatchPhase.SIMILARITY);
            similarity = new SimilarityMatcher(config.similarityThreshold(), config.attributeOrder())
                    .match(tree1, tree2, matching);
            log.log(Level.FINE, "similarity phase matched {0} pairs", similarity);
        }
        if (config.propagation()) {
            phases.add(MatchPhase.PROPAGATION);
            propagation = new StructuralPropagator().propagate(tree1, tree2, matching);
            log.log(Level.FINE, "propagation phase matched {0} pairs", propagation);
        }

        int total = matching.size();
        statistics = new MatchStatistics(
                nodes1,
                nodes2,
                hash,
                similarity,
                propagation,
                total,
                MatchStatistics.ratio(total, nodes1),
                MatchStatistics.ratio(total, nodes2),
                phases
        );
        return matching;
    }
}
