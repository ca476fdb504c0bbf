// file: core/src/main/java/io/semtree/core/Matching.java
package io.semtree.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated one-to-one correspondence between the nodes of tree1 and tree2.
 * <p>
 * Every matcher phase routes its additions through {@link #add}, which enforces:
 *  - one-to-one:     a node appears in at most one pair;
 *  - prefix closure: when both nodes of a pair have matched parents, those
 *                    parents are paired with each other.
 * <p>
 * A violating addition is rejected by returning false. Rejection is normal
 * control flow for the matchers, not an error.
 * <p>
 * Nodes are keyed by identity: two equal-looking nodes are still different nodes.
 * Not thread safe; each diff owns its own Matching.
 */
public final class Matching {

    /** A matched pair: {@code node1} from tree1, {@code node2} from tree2. */
    public record Pair(TreeNode node1, TreeNode node2) {
        public Pair {
            Objects.requireNonNull(node1, "node1");
            Objects.requireNonNull(node2, "node2");
        }
    }

    private final List<Pair> pairs = new ArrayList<>();
    private final Map<TreeNode, TreeNode> tree1Map = new IdentityHashMap<>();
    private final Map<TreeNode, TreeNode> tree2Map = new IdentityHashMap<>();

    /**
     * Add a pair if it keeps both invariants.
     *
     * @return true if added, false if either node is already matched or the
     *         pair would break prefix closure
     */
    public boolean add(TreeNode node1, TreeNode node2) {
        Objects.requireNonNull(node1, "node1");
        Objects.requireNonNull(node2, "node2");
        if (!canAdd(node1, node2)) return false;

        pairs.add(new Pair(node1, node2));
        tree1Map.put(node1, node2);
        tree2Map.put(node2, node1);
        return true;
    }

    /** Remove a pair. Returns false if the exact pair is not present. */
    public boolean remove(TreeNode node1, TreeNode node2) {
        if (tree1Map.get(node1) != node2) return false;
        for (int i = 0; i < pairs.size(); i++) {
            Pair p = pairs.get(i);
            if (p.node1() == node1 && p.node2() == node2) {
                pairs.remove(i);
                break;
            }
        }
        tree1Map.remove(node1);
        tree2Map.remove(node2);
        return true;
    }

    /**
     * Check a candidate pair against the current state.
     * <p>
     * Upward: if both parents are matched they must be matched to each other.
     * Downward: a matched child of node1 whose partner's parent is matched must
     * have node2 as that parent, and symmetrically for node2's children. Partners
     * under an unmatched parent stay allowed (that is a move into new context).
     */
    public boolean canAdd(TreeNode node1, TreeNode node2) {
        if (tree1Map.containsKey(node1) || tree2Map.containsKey(node2)) return false;

        TreeNode p1 = node1.parent();
        TreeNode p2 = node2.parent();
        if (p1 != null && p2 != null) {
            TreeNode p1Match = tree1Map.get(p1);
            TreeNode p2Match = tree2Map.get(p2);
            if (p1Match != null && p2Match != null && p1Match != p2) return false;
        }

        for (TreeNode c1 : node1.children()) {
            TreeNode c2 = tree1Map.get(c1);
            if (c2 == null) continue;
            TreeNode c2Parent = c2.parent();
            if (c2Parent == null) continue;
            if (c2Parent != node2 && tree2Map.containsKey(c2Parent)) return false;
        }
        for (TreeNode c2 : node2.children()) {
            TreeNode c1 = tree2Map.get(c2);
            if (c1 == null) continue;
            TreeNode c1Parent = c1.parent();
            if (c1Parent == null) continue;
            if (c1Parent != node1 && tree1Map.containsKey(c1Parent)) return false;
        }
        return true;
    }

    public boolean isMatched1(TreeNode node) { return tree1Map.containsKey(node); }

    public boolean isMatched2(TreeNode node) { return tree2Map.containsKey(node); }

    /** Partner in tree2 of a tree1 node. */
    public Optional<TreeNode> matchFor1(TreeNode node) { return Optional.ofNullable(tree1Map.get(node)); }

    /** Partner in tree1 of a tree2 node. */
    public Optional<TreeNode> matchFor2(TreeNode node) { return Optional.ofNullable(tree2Map.get(node)); }

    /** Filter tree1 nodes down to the still-unpaired ones, keeping their order. */
    public List<TreeNode> unmatched1(Collection<TreeNode> nodes) {
        var out = new ArrayList<TreeNode>();
        for (TreeNode n : nodes) {
            if (!tree1Map.containsKey(n)) out.add(n);
        }
        return out;
    }

    /** Filter tree2 nodes down to the still-unpaired ones, keeping their order. */
    public List<TreeNode> unmatched2(Collection<TreeNode> nodes) {
        var out = new ArrayList<TreeNode>();
        for (TreeNode n : nodes) {
            if (!tree2Map.containsKey(n)) out.add(n);
        }
        return out;
    }

    public int size() { return pairs.size(); }

    public boolean isEmpty() { return pairs.isEmpty(); }

    /** Pairs in insertion order (read-only view). */
    public List<Pair> pairs() { return Collections.unmodifiableList(pairs); }

    /** Both invariants, re-derived from scratch. */
    public boolean isValid() {
        return isOneToOne() && isPrefixClosed();
    }

    public boolean isOneToOne() {
        if (tree1Map.size() != pairs.size() || tree2Map.size() != pairs.size()) return false;
        for (Pair p : pairs) {
            if (tree1Map.get(p.node1()) != p.node2()) return false;
            if (tree2Map.get(p.node2()) != p.node1()) return false;
        }
        return true;
    }

    public boolean isPrefixClosed() {
        for (Pair p : pairs) {
            TreeNode p1 = p.node1().parent();
            TreeNode p2 = p.node2().parent();
            if (p1 == null || p2 == null) continue;
            TreeNode p1Match = tree1Map.get(p1);
            if (p1Match != null && tree2Map.containsKey(p2) && p1Match != p2) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("Matching[");
        for (int i = 0; i < pairs.size(); i++) {
            if (i > 0) sb.append(", ");
            Pair p = pairs.get(i);
            sb.append(p.node1().label()).append("<->").append(p.node2().label());
        }
        return sb.append(']').toString();
    }
}
