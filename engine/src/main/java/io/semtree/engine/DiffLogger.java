// file: engine/src/main/java/io/semtree/engine/DiffLogger.java
package io.semtree.engine;

import io.semtree.core.match.MatchStatistics;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place for diff-level logging.
 *
 * Responsibilities:
 *  - One summary line per completed diff.
 *  - A warning when an input is rejected by the size guard.
 */
public final class DiffLogger {
    private static final Logger log = Logger.getLogger(DiffLogger.class.getName());

    private DiffLogger() {
        // utility
    }

    /**
     * Log a completed diff.
     *
     * @param stats       matcher statistics of the run
     * @param operations  number of detected operations
     * @param matchMillis time spent matching
     * @param totalMillis wall-clock time for the whole diff
     */
    public static void logDiff(MatchStatistics stats, int operations, long matchMillis, long totalMillis) {
        if (!log.isLoggable(Level.INFO)) return;
        String msg = String.format(
                "diff %d->%d nodes: matched=%d (hash=%d, similarity=%d, propagation=%d), ops=%d (total=%dms, match=%dms)",
                stats.tree1Nodes(),
                stats.tree2Nodes(),
                stats.totalMatches(),
                stats.hashMatches(),
                stats.similarityMatches(),
                stats.propagationMatches(),
                operations,
                totalMillis,
                matchMillis
        );
        log.log(Level.INFO, msg);
    }

    public static void logSizeLimit(String side, int observed, int limit) {
        log.log(Level.WARNING, "rejecting diff: {0} has {1} nodes (limit {2})", new Object[]{side, observed, limit});
    }
}
