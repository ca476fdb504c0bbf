// file: engine/src/main/java/io/semtree/engine/DiffConfig.java
package io.semtree.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.semtree.core.AttributeOrder;
import io.semtree.core.match.MatcherConfig;
import io.semtree.engine.dto.JsonDiffConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings for one {@link TreeDiffer}: the matcher knobs plus the node-count limit.
 * <p>
 * JSON form (every key optional):
 * <pre>{@code
 * {
 *   "similarityThreshold": 0.95,
 *   "hashMatching": true,
 *   "similarityMatching": true,
 *   "propagation": true,
 *   "attributeOrder": "ignore",
 *   "maxNodeCount": 10000
 * }
 * }</pre>
 */
public record DiffConfig(MatcherConfig matcher, int maxNodeCount) {

    public static final int DEFAULT_MAX_NODE_COUNT = 10_000;

    public DiffConfig {
        Objects.requireNonNull(matcher, "matcher");
        if (maxNodeCount < 0) throw new IllegalArgumentException("maxNodeCount must be >= 0 (0 disables the limit)");
    }

    public static DiffConfig defaults() {
        return new DiffConfig(MatcherConfig.defaults(), DEFAULT_MAX_NODE_COUNT);
    }

    public DiffConfig withMatcher(MatcherConfig matcher) {
        return new DiffConfig(matcher, maxNodeCount);
    }

    public DiffConfig withMaxNodeCount(int maxNodeCount) {
        return new DiffConfig(matcher, maxNodeCount);
    }

    public static DiffConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonDiffConfig cfg = mapper.readValue(path.toFile(), JsonDiffConfig.class);
            return fromJson(cfg);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load DiffConfig from " + path, e);
        }
    }

    static DiffConfig fromJson(JsonDiffConfig cfg) {
        MatcherConfig d = MatcherConfig.defaults();
        var matcher = new MatcherConfig(
                cfg.similarityThreshold != null ? cfg.similarityThreshold : d.similarityThreshold(),
                cfg.hashMatching != null ? cfg.hashMatching : d.hashMatching(),
                cfg.similarityMatching != null ? cfg.similarityMatching : d.similarityMatching(),
                cfg.propagation != null ? cfg.propagation : d.propagation(),
                cfg.attributeOrder != null ? AttributeOrder.parse(cfg.attributeOrder) : d.attributeOrder()
        );
        int limit = cfg.maxNodeCount != null ? cfg.maxNodeCount : DEFAULT_MAX_NODE_COUNT;
        return new DiffConfig(matcher, limit);
    }
}
