// file: core/src/main/java/io/semtree/core/ops/TextOverlap.java
package io.semtree.core.ops;

import io.semtree.core.TreeNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalized word-overlap score used by merge/split/hierarchy recognition.
 * <p>
 * Texts are case-folded and split on whitespace; the score is the Jaccard index
 * of the two word sets. Word order and repetition do not count:
 * "First Second Third" and "third first second" score 1.0.
 */
public final class TextOverlap {

    private TextOverlap() {}

    /** Score in [0, 1]; 0.0 when either text has no words. */
    public static double score(String a, String b) {
        Set<String> wa = words(a);
        Set<String> wb = words(b);
        if (wa.isEmpty() || wb.isEmpty()) return 0.0;

        int intersection = 0;
        for (String w : wa) {
            if (wb.contains(w)) intersection++;
        }
        return intersection / (double) (wa.size() + wb.size() - intersection);
    }

    /** Every value in the subtree, pre-order, joined by single spaces. */
    public static String textOf(TreeNode node) {
        var parts = new ArrayList<String>();
        for (TreeNode n : node.preOrder()) {
            if (n.hasValue() && !n.value().isBlank()) parts.add(n.value().strip());
        }
        return String.join(" ", parts);
    }

    public static String textOf(List<TreeNode> nodes) {
        var parts = new ArrayList<String>(nodes.size());
        for (TreeNode n : nodes) {
            String t = textOf(n);
            if (!t.isEmpty()) parts.add(t);
        }
        return String.join(" ", parts);
    }

    private static Set<String> words(String s) {
        if (s == null || s.isBlank()) return Set.of();
        return new HashSet<>(Arrays.asList(s.strip().toLowerCase(Locale.ROOT).split("\\s+")));
    }
}
