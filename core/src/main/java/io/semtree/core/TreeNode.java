// file: core/src/main/java/io/semtree/core/TreeNode.java
package io.semtree.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Node of the neutral tree that every document format is normalized into.
 * <p>
 * Fields:
 *  - label:      role or name ("p", "text", "object", "array", "value", ...).
 *  - value:      optional scalar payload, null when absent.
 *  - attributes: ordered key/value metadata (insertion order is the document order).
 *  - children:   ordered list, exclusively owned by this node.
 *  - parent:     non-owning back-reference, null at the root.
 *  - xid:        optional external identity, opaque to the diff.
 *  - sourceRef:  optional handle to the adapter's original node.
 * <p>
 * Invariants:
 *  - A node has at most one parent and appears exactly once in that parent's children.
 *  - No cycles: a node can never be added below itself.
 *  - Cached signature/weight are only cleared by this class's own mutators.
 * <p>
 * Identity: equals/hashCode are the Object defaults. Two distinct nodes with the
 * same content are different nodes for matching purposes.
 */
public final class TreeNode {

    private final String label;
    private final String value;
    private final Map<String, String> attributes;
    private final List<TreeNode> children = new ArrayList<>();
    private final String xid;
    private final SourceRef sourceRef;
    private TreeNode parent;

    // Memoized derived values, owned by NodeSignature.of / NodeWeight.of.
    NodeSignature signature;
    NodeWeight weight;

    private TreeNode(
            String label,
            String value,
            Map<String, String> attributes,
            String xid,
            SourceRef sourceRef
    ) {
        this.label = Objects.requireNonNull(label, "label");
        this.value = value;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.xid = xid;
        this.sourceRef = sourceRef;
    }

    /** Leaf or branch without a value and without attributes. */
    public static TreeNode of(String label) {
        return builder(label).build();
    }

    /** Text leaf: a node carrying a scalar value. */
    public static TreeNode text(String label, String value) {
        return builder(label).value(Objects.requireNonNull(value, "value")).build();
    }

    public static Builder builder(String label) {
        return new Builder(label);
    }

    // ---------------- accessors ----------------

    public String label() { return label; }

    /** Scalar payload, or null when the node carries none. */
    public String value() { return value; }

    public boolean hasValue() { return value != null; }

    /** Read-only view in document order. */
    public Map<String, String> attributes() { return attributes; }

    /** Read-only view. Use {@link #addChild}, {@link #removeChild}, {@link #replaceChild} to mutate. */
    public List<TreeNode> children() { return Collections.unmodifiableList(children); }

    public TreeNode parent() { return parent; }

    public Optional<String> xid() { return Optional.ofNullable(xid); }

    public Optional<SourceRef> sourceRef() { return Optional.ofNullable(sourceRef); }

    // ---------------- shape queries ----------------

    public boolean isLeaf() { return children.isEmpty(); }

    /** Leaf that carries a value. */
    public boolean isText() { return isLeaf() && value != null; }

    /** Has children or non-empty attributes. */
    public boolean isElement() { return !isLeaf() || !attributes.isEmpty(); }

    public boolean isRoot() { return parent == null; }

    public TreeNode root() {
        TreeNode n = this;
        while (n.parent != null) n = n.parent;
        return n;
    }

    /** Ancestors from the parent up to the root. */
    public List<TreeNode> ancestors() {
        var out = new ArrayList<TreeNode>();
        for (TreeNode n = parent; n != null; n = n.parent) out.add(n);
        return out;
    }

    /** Descendants in depth-first pre-order, excluding this node. */
    public List<TreeNode> descendants() {
        var out = new ArrayList<TreeNode>();
        collectDescendants(this, out);
        return out;
    }

    /** This node followed by its descendants in pre-order. */
    public List<TreeNode> preOrder() {
        var out = new ArrayList<TreeNode>();
        out.add(this);
        collectDescendants(this, out);
        return out;
    }

    private static void collectDescendants(TreeNode node, List<TreeNode> out) {
        // Explicit stack keeps deep documents off the call stack.
        var stack = new ArrayList<TreeNode>();
        for (int i = node.children.size() - 1; i >= 0; i--) stack.add(node.children.get(i));
        while (!stack.isEmpty()) {
            TreeNode n = stack.remove(stack.size() - 1);
            out.add(n);
            for (int i = n.children.size() - 1; i >= 0; i--) stack.add(n.children.get(i));
        }
    }

    public List<TreeNode> siblings() {
        if (parent == null) return List.of();
        var out = new ArrayList<TreeNode>(parent.children.size());
        for (TreeNode c : parent.children) {
            if (c != this) out.add(c);
        }
        return out;
    }

    public List<TreeNode> leftSiblings() {
        int pos = position();
        if (pos < 0) return List.of();
        return List.copyOf(parent.children.subList(0, pos));
    }

    public List<TreeNode> rightSiblings() {
        int pos = position();
        if (pos < 0) return List.of();
        return List.copyOf(parent.children.subList(pos + 1, parent.children.size()));
    }

    /** Index within the parent's children, or -1 at the root. */
    public int position() {
        if (parent == null) return -1;
        return indexOfIdentity(parent.children, this);
    }

    /** Number of edges to the root (0 at the root). */
    public int depth() {
        int d = 0;
        for (TreeNode n = parent; n != null; n = n.parent) d++;
        return d;
    }

    /** Longest edge count down to a leaf (0 for a leaf). */
    public int height() {
        int max = -1;
        for (TreeNode c : children) max = Math.max(max, c.height());
        return max + 1;
    }

    /** Number of nodes in the subtree rooted here, this node included. */
    public int size() {
        int n = 1;
        for (TreeNode c : children) n += c.size();
        return n;
    }

    /**
     * Positional path such as {@code /root/para[1]/text}. The index is only
     * written when the parent has several children with the same label.
     */
    public String path() {
        var segments = new ArrayList<String>();
        for (TreeNode n = this; n != null; n = n.parent) {
            if (n.parent == null) {
                segments.add(n.label);
                continue;
            }
            int sameLabel = 0;
            int index = 0;
            for (TreeNode sib : n.parent.children) {
                if (!sib.label.equals(n.label)) continue;
                if (sib == n) index = sameLabel;
                sameLabel++;
            }
            segments.add(sameLabel > 1 ? n.label + "[" + index + "]" : n.label);
        }
        Collections.reverse(segments);
        return "/" + String.join("/", segments);
    }

    // ---------------- mutators ----------------

    /** Append a child. */
    public TreeNode addChild(TreeNode child) {
        return addChild(child, children.size());
    }

    /**
     * Insert a child at the given position.
     *
     * @throws IllegalArgumentException if the child already has a parent, is this node
     *                                  or one of its ancestors, or the position is out of range.
     */
    public TreeNode addChild(TreeNode child, int position) {
        Objects.requireNonNull(child, "child");
        if (child.parent != null) throw new IllegalArgumentException("child already has a parent");
        if (child == this || ancestors().contains(child)) {
            throw new IllegalArgumentException("adding an ancestor would create a cycle");
        }
        if (position < 0 || position > children.size()) {
            throw new IllegalArgumentException("position out of range: " + position);
        }
        child.parent = this;
        children.add(position, child);
        child.clearSignatures();
        invalidateCache();
        return child;
    }

    /** Detach a child. Returns the removed node, or empty if it is not a child of this node. */
    public Optional<TreeNode> removeChild(TreeNode child) {
        int idx = indexOfIdentity(children, child);
        if (idx < 0) return Optional.empty();
        children.remove(idx);
        child.parent = null;
        child.clearSignatures();
        invalidateCache();
        return Optional.of(child);
    }

    /**
     * Replace {@code oldChild} with {@code newChild} at the same position.
     * Returns the replaced node, or empty if {@code oldChild} is not a child of this node.
     */
    public Optional<TreeNode> replaceChild(TreeNode oldChild, TreeNode newChild) {
        Objects.requireNonNull(newChild, "newChild");
        int idx = indexOfIdentity(children, oldChild);
        if (idx < 0) return Optional.empty();
        if (newChild.parent != null) throw new IllegalArgumentException("newChild already has a parent");
        if (newChild == this || ancestors().contains(newChild)) {
            throw new IllegalArgumentException("adding an ancestor would create a cycle");
        }
        children.set(idx, newChild);
        oldChild.parent = null;
        newChild.parent = this;
        oldChild.clearSignatures();
        newChild.clearSignatures();
        invalidateCache();
        return Optional.of(oldChild);
    }

    /** Weight changes for this node and every ancestor. */
    private void invalidateCache() {
        for (TreeNode n = this; n != null; n = n.parent) {
            n.signature = null;
            n.weight = null;
        }
    }

    /** Signatures encode the root path, so a re-parented subtree loses all of them. */
    private void clearSignatures() {
        for (TreeNode n : preOrder()) n.signature = null;
    }

    // ---------------- comparison ----------------

    /**
     * Shallow structural equality: label, value, attributes, and the count and labels
     * of the children. Children are not compared deeply.
     */
    public boolean matches(TreeNode other) {
        if (other == null) return false;
        if (!label.equals(other.label)) return false;
        if (!Objects.equals(value, other.value)) return false;
        if (!attributes.equals(other.attributes)) return false;
        if (children.size() != other.children.size()) return false;
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).label.equals(other.children.get(i).label)) return false;
        }
        return true;
    }

    /** Jaccard similarity of the two content sets, attribute order ignored. */
    public double similarityTo(TreeNode other) {
        return similarityTo(other, AttributeOrder.IGNORE);
    }

    /**
     * Jaccard index |A ∩ B| / |A ∪ B| over content sets made of the label, the value,
     * each attribute pair and each child label. Under {@link AttributeOrder#STRICT}
     * the attribute key order joins the set.
     */
    public double similarityTo(TreeNode other, AttributeOrder attributeOrder) {
        if (other == null) return 0.0;
        Set<String> a = contentSet(attributeOrder);
        Set<String> b = other.contentSet(attributeOrder);
        if (a.isEmpty() && b.isEmpty()) return 0.0;

        int intersection = 0;
        for (String s : a) {
            if (b.contains(s)) intersection++;
        }
        int union = a.size() + b.size() - intersection;
        return intersection / (double) union;
    }

    Set<String> contentSet(AttributeOrder attributeOrder) {
        var out = new HashSet<String>();
        out.add("label:" + label);
        if (value != null) out.add("value:" + value);
        attributes.forEach((k, v) -> out.add("attr:" + k + "=" + v));
        if (attributeOrder == AttributeOrder.STRICT && attributes.size() > 1) {
            out.add("attr-order:" + String.join(",", attributes.keySet()));
        }
        for (TreeNode c : children) out.add("child:" + c.label);
        return out;
    }

    /** Fraction of attribute keys (over the union of keys) whose values differ. */
    public double attributeDifference(TreeNode other) {
        var keys = new HashSet<String>(attributes.keySet());
        keys.addAll(other.attributes.keySet());
        if (keys.isEmpty()) return 0.0;

        int diff = 0;
        for (String k : keys) {
            if (!Objects.equals(attributes.get(k), other.attributes.get(k))) diff++;
        }
        return diff / (double) keys.size();
    }

    /**
     * Tie-breaking distance (0 = identical): 0.3 * depth difference
     * + 0.5 * (1 - similarity) + 0.2 * attribute difference.
     */
    public double semanticDistanceTo(TreeNode other) {
        return semanticDistanceTo(other, AttributeOrder.IGNORE);
    }

    public double semanticDistanceTo(TreeNode other, AttributeOrder attributeOrder) {
        if (other == null) return Double.POSITIVE_INFINITY;
        double depthDiff = Math.abs(depth() - other.depth());
        double contentDiff = 1.0 - similarityTo(other, attributeOrder);
        double attrDiff = attributeDifference(other);
        return depthDiff * 0.3 + contentDiff * 0.5 + attrDiff * 0.2;
    }

    // ---------------- copying ----------------

    /** Independent structural copy with no parent. Source references are shared. */
    public TreeNode deepClone() {
        var copy = new TreeNode(label, value, attributes, xid, sourceRef);
        for (TreeNode c : children) {
            TreeNode cc = c.deepClone();
            cc.parent = copy;
            copy.children.add(cc);
        }
        return copy;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("TreeNode{label=").append(label);
        if (value != null) sb.append(", value=").append(value);
        if (xid != null) sb.append(", xid=").append(xid);
        if (!children.isEmpty()) sb.append(", children=").append(children.size());
        if (!attributes.isEmpty()) sb.append(", attributes=").append(attributes.size());
        return sb.append('}').toString();
    }

    private static int indexOfIdentity(List<TreeNode> list, TreeNode node) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == node) return i;
        }
        return -1;
    }

    /**
     * Fluent construction used by adapters and tests.
     * Children passed here get their parent wired on {@link #build()}.
     */
    public static final class Builder {
        private final String label;
        private String value;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<TreeNode> children = new ArrayList<>();
        private String xid;
        private SourceRef sourceRef;

        private Builder(String label) {
            this.label = Objects.requireNonNull(label, "label");
        }

        public Builder value(String value) {
            this.value = value;
            return this;
        }

        public Builder attribute(String key, String value) {
            attributes.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder attributes(Map<String, String> attrs) {
            attrs.forEach(this::attribute);
            return this;
        }

        public Builder child(TreeNode child) {
            children.add(Objects.requireNonNull(child, "child"));
            return this;
        }

        public Builder children(List<TreeNode> nodes) {
            nodes.forEach(this::child);
            return this;
        }

        public Builder xid(String xid) {
            this.xid = xid;
            return this;
        }

        public Builder sourceRef(SourceRef sourceRef) {
            this.sourceRef = sourceRef;
            return this;
        }

        public TreeNode build() {
            var node = new TreeNode(label, value, attributes, xid, sourceRef);
            for (TreeNode c : children) node.addChild(c);
            return node;
        }
    }
}
