// file: bench/src/main/java/io/semtree/bench/TreeDiffBench.java
package io.semtree.bench;

import io.semtree.core.TreeNode;
import io.semtree.engine.DiffConfig;
import io.semtree.engine.DiffResult;
import io.semtree.engine.TreeDiffer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Latency driver for {@link TreeDiffer} over synthetic documents.
 *
 * Usage:
 *   java -cp bench.jar io.semtree.bench.TreeDiffBench \
 *     --runs 50 \
 *     --sections 20 \
 *     --paragraphs 10 \
 *     --edits 5 \
 *     --seed 42 \
 *     --config diff.json
 *
 * Output:
 *   - Summary line to stderr.
 *   - CSV to stdout, one row per run:
 *       run,nodes,ops,match_ratio,latency_ms
 */
public final class TreeDiffBench {

    record Sample(int run, int nodes, int ops, double matchRatio, double latencyMs) {}

    public static void main(String[] args) {
        Map<String, String> cfg = parseArgs(args);

        int runs = Integer.parseInt(cfg.getOrDefault("runs", "20"));
        int sections = Integer.parseInt(cfg.getOrDefault("sections", "10"));
        int paragraphs = Integer.parseInt(cfg.getOrDefault("paragraphs", "10"));
        int edits = Integer.parseInt(cfg.getOrDefault("edits", "5"));
        long seed = Long.parseLong(cfg.getOrDefault("seed", "42"));
        DiffConfig diffConfig = cfg.containsKey("config")
                ? DiffConfig.fromJsonFile(Path.of(cfg.get("config")))
                : DiffConfig.defaults();

        List<Sample> samples = run(new TreeDiffer(diffConfig), runs, sections, paragraphs, edits, seed);
        summarizeAndPrint(samples);
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        return out;
    }

    static List<Sample> run(TreeDiffer differ, int runs, int sections, int paragraphs, int edits, long seed) {
        var gen = new RandomDocumentGenerator(seed);
        List<Sample> out = new ArrayList<>(runs);
        for (int r = 0; r < runs; r++) {
            TreeNode before = gen.document(sections, paragraphs);
            TreeNode after = gen.mutate(before, edits);

            long start = System.nanoTime();
            DiffResult result = differ.diff(before, after);
            double latencyMs = (System.nanoTime() - start) / 1_000_000.0;

            out.add(new Sample(
                    r,
                    result.statistics().tree1Nodes(),
                    result.operations().size(),
                    result.statistics().matchRatioTree1(),
                    latencyMs
            ));
        }
        return out;
    }

    private static void summarizeAndPrint(List<Sample> all) {
        if (all.isEmpty()) {
            System.err.println("no samples collected");
            return;
        }

        List<Double> latencies = new ArrayList<>(all.size());
        double ratioSum = 0.0;
        for (Sample s : all) {
            latencies.add(s.latencyMs());
            ratioSum += s.matchRatio();
        }
        Collections.sort(latencies);

        System.err.printf(
                "runs=%d, avg_match_ratio=%.3f, p50=%.2fms, p95=%.2fms, p99=%.2fms%n",
                all.size(), ratioSum / all.size(),
                percentile(latencies, 0.50), percentile(latencies, 0.95), percentile(latencies, 0.99)
        );

        System.out.println("run,nodes,ops,match_ratio,latency_ms");
        for (Sample s : all) {
            System.out.printf("%d,%d,%d,%.3f,%.3f%n", s.run(), s.nodes(), s.ops(), s.matchRatio(), s.latencyMs());
        }
    }

    static double percentile(List<Double> sorted, double q) {
        if (sorted.isEmpty()) return Double.NaN;
        double idx = q * (sorted.size() - 1);
        int lo = (int) Math.floor(idx);
        int hi = (int) Math.ceil(idx);
        if (lo == hi) return sorted.get(lo);
        double w = idx - lo;
        return sorted.get(lo) * (1 - w) + sorted.get(hi) * w;
    }
}
