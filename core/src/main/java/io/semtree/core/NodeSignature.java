// file: core/src/main/java/io/semtree/core/NodeSignature.java
package io.semtree.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Structural fingerprint of a node: the label path from the root down to the node.
 * <p>
 * Format: {@code /root/section/para/#text}. A text leaf contributes the constant
 * {@link #TEXT_MARKER} instead of its label, so every text leaf under the same
 * element path shares one signature whatever its label or content.
 * <p>
 * Equal signatures mean "same shape at the same structural path". The value is
 * used as a hash key for exact matching, so equals/hashCode depend on the string only.
 */
public final class NodeSignature {

    public static final String TEXT_MARKER = "#text";

    private final List<String> path;
    private final String signature;

    private NodeSignature(List<String> path) {
        this.path = List.copyOf(path);
        this.signature = "/" + String.join("/", path);
    }

    /** Memoized signature, cached on the node until one of its mutators clears it. */
    public static NodeSignature of(TreeNode node) {
        Objects.requireNonNull(node, "node");
        NodeSignature s = node.signature;
        if (s == null) {
            s = compute(node);
            node.signature = s;
        }
        return s;
    }

    /** Recompute from scratch, ignoring and not touching the cache. */
    public static NodeSignature compute(TreeNode node) {
        Objects.requireNonNull(node, "node");
        var components = new ArrayList<String>();
        components.add(component(node));
        for (TreeNode n = node.parent(); n != null; n = n.parent()) components.add(component(n));
        Collections.reverse(components);
        return new NodeSignature(components);
    }

    private static String component(TreeNode n) {
        return n.isText() ? TEXT_MARKER : n.label();
    }

    /** Path components from the root to the node. */
    public List<String> path() { return path; }

    public String value() { return signature; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeSignature other)) return false;
        return signature.equals(other.signature);
    }

    @Override public int hashCode() { return signature.hashCode(); }

    @Override public String toString() { return signature; }
}
