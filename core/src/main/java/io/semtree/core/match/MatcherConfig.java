// file: core/src/main/java/io/semtree/core/match/MatcherConfig.java
package io.semtree.core.match;

import io.semtree.core.AttributeOrder;

import java.util.Objects;

/**
 * Configuration accepted by {@link UniversalMatcher}.
 *
 * @param similarityThreshold minimum similarity in (0, 1] for phase 2 pairing (default 0.95)
 * @param hashMatching        run phase 1, exact signature + digest pairing (default true)
 * @param similarityMatching  run phase 2, threshold-based fuzzy pairing (default true)
 * @param propagation         run phase 3, structural propagation (default true)
 * @param attributeOrder      whether attribute order counts in comparisons (default IGNORE)
 */
public record MatcherConfig(
        double similarityThreshold,
        boolean hashMatching,
        boolean similarityMatching,
        boolean propagation,
        AttributeOrder attributeOrder
) {
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.95;

    public MatcherConfig {
        if (!(similarityThreshold > 0.0 && similarityThreshold <= 1.0)) {
            throw new IllegalArgumentException("similarityThreshold must be in (0, 1]: " + similarityThreshold);
        }
        Objects.requireNonNull(attributeOrder, "attributeOrder");
    }

    public static MatcherConfig defaults() {
        return new MatcherConfig(DEFAULT_SIMILARITY_THRESHOLD, true, true, true, AttributeOrder.IGNORE);
    }

    public MatcherConfig withSimilarityThreshold(double threshold) {
        return new MatcherConfig(threshold, hashMatching, similarityMatching, propagation, attributeOrder);
    }

    public MatcherConfig withHashMatching(boolean enabled) {
        return new MatcherConfig(similarityThreshold, enabled, similarityMatching, propagation, attributeOrder);
    }

    public MatcherConfig withSimilarityMatching(boolean enabled) {
        return new MatcherConfig(similarityThreshold, hashMatching, enabled, propagation, attributeOrder);
    }

    public MatcherConfig withPropagation(boolean enabled) {
        return new MatcherConfig(similarityThreshold, hashMatching, similarityMatching, enabled, attributeOrder);
    }

    public MatcherConfig withAttributeOrder(AttributeOrder order) {
        return new MatcherConfig(similarityThreshold, hashMatching, similarityMatching, propagation, order);
    }
}
