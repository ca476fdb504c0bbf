// file: core/src/main/java/io/semtree/core/NodeWeight.java
package io.semtree.core;

import java.util.Objects;

/**
 * Subtree "mass" used to bias and order matching decisions.
 * <p>
 * Formula:
 *  - text leaf:     1 + ln(length + 1), or 1.0 for empty text
 *  - other leaf:    1.0
 *  - branch:        1 + sum of child weights
 * <p>
 * The logarithm keeps long text from dominating: doubling a text's length
 * never doubles its weight. Not a correctness signal.
 */
public final class NodeWeight implements Comparable<NodeWeight> {

    private final double value;

    private NodeWeight(double value) {
        this.value = value;
    }

    /** Memoized weight, cached on the node (and reused for children) until a mutator clears it. */
    public static NodeWeight of(TreeNode node) {
        Objects.requireNonNull(node, "node");
        NodeWeight w = node.weight;
        if (w == null) {
            w = new NodeWeight(weigh(node, true));
            node.weight = w;
        }
        return w;
    }

    /** Recompute the whole subtree without reading or writing any cache. */
    public static NodeWeight compute(TreeNode node) {
        Objects.requireNonNull(node, "node");
        return new NodeWeight(weigh(node, false));
    }

    private static double weigh(TreeNode node, boolean cached) {
        if (node.isText()) {
            String text = node.value();
            if (text.isEmpty()) return 1.0;
            return 1.0 + Math.log(text.length() + 1);
        }
        double sum = 1.0;
        for (TreeNode c : node.children()) {
            sum += cached ? of(c).value : weigh(c, false);
        }
        return sum;
    }

    public double value() { return value; }

    @Override public int compareTo(NodeWeight o) { return Double.compare(value, o.value); }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeWeight other)) return false;
        return Double.compare(value, other.value) == 0;
    }

    @Override public int hashCode() { return Double.hashCode(value); }

    @Override public String toString() { return Double.toString(value); }
}
