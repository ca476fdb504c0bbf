// file: core/src/main/java/io/semtree/core/match/MatchStatistics.java
package io.semtree.core.match;

import java.util.List;

/**
 * Counters from one {@link UniversalMatcher#match} run.
 * <p>
 * Ratios are matches divided by the node count of each tree (0.0 for an empty count).
 */
public record MatchStatistics(
        int tree1Nodes,
        int tree2Nodes,
        int hashMatches,
        int similarityMatches,
        int propagationMatches,
        int totalMatches,
        double matchRatioTree1,
        double matchRatioTree2,
        List<MatchPhase> phasesExecuted
) {
    public MatchStatistics {
        phasesExecuted = List.copyOf(phasesExecuted);
    }

    /** Statistics before any run. */
    public static MatchStatistics empty() {
        return new MatchStatistics(0, 0, 0, 0, 0, 0, 0.0, 0.0, List.of());
    }

    static double ratio(int matches, int nodes) {
        return nodes > 0 ? matches / (double) nodes : 0.0;
    }
}
