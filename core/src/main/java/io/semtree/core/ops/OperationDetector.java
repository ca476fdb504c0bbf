// file: core/src/main/java/io/semtree/core/ops/OperationDetector.java
package io.semtree.core.ops;

import io.semtree.core.AttributeComparator;
import io.semtree.core.Matching;
import io.semtree.core.TreeNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a {@link Matching} into the list of {@link Operation}s that takes tree1 to tree2.
 * <p>
 * Pass 1 (basic), in this order:
 *  - for each matched pair in tree1 pre-order: an UPDATE listing only the changed
 *    fields, then a MOVE if the parent correspondence or the order among matched
 *    siblings changed;
 *  - a DELETE for each unmatched tree1 node, pre-order;
 *  - an INSERT for each unmatched tree2 node, pre-order.
 * <p>
 * Pass 2 (semantic) collapses patterns of basic operations:
 *  - MERGE: two or more deleted siblings (optionally with a matched sibling) whose
 *    combined text reappears in one tree2 node;
 *  - SPLIT: the inverse;
 *  - UPGRADE / DOWNGRADE: a node that changed depth with similar content, either a
 *    matched pair that moved to another level or a delete + insert pair. In both
 *    cases an UPDATE for changed fields precedes it.
 * A recognized pattern takes the place of the first basic operation it explains;
 * every basic operation touching the explained subtrees is dropped, so callers see
 * one operation per real change.
 * <p>
 * Deterministic: same trees and matching give the same list in the same order.
 */
public final class OperationDetector {

    /** Minimum {@link TextOverlap} between the parts and the whole of a merge or split. */
    public static final double MERGE_SPLIT_THRESHOLD = 0.8;

    /** Minimum {@link TextOverlap} for a node that changed depth to count as the same node. */
    public static final double HIERARCHY_THRESHOLD = 0.9;

    private final TreeNode tree1;
    private final TreeNode tree2;
    private final Matching matching;

    public OperationDetector(TreeNode tree1, TreeNode tree2, Matching matching) {
        this.tree1 = Objects.requireNonNull(tree1, "tree1");
        this.tree2 = Objects.requireNonNull(tree2, "tree2");
        this.matching = Objects.requireNonNull(matching, "matching");
    }

    /** Both passes. */
    public List<Operation> detect() {
        List<Operation> ops = detectBasic();
        new SemanticPass(ops).run();
        return List.copyOf(ops);
    }

    /** Pass 1 only: updates, moves, deletes and inserts. */
    public List<Operation> detectBasic() {
        var ops = new ArrayList<Operation>();
        var ranks = new SiblingRanks();

        for (TreeNode n1 : tree1.preOrder()) {
            TreeNode n2 = matching.matchFor1(n1).orElse(null);
            if (n2 == null) continue;

            Map<UpdateField, FieldChange> changes = changes(n1, n2);
            if (!changes.isEmpty()) ops.add(new Operation.Update(n1, n2, changes));

            if (moved(n1, n2, ranks)) {
                ops.add(new Operation.Move(n1, n2, n1.parent(), n2.parent(), n1.position(), n2.position()));
            }
        }
        for (TreeNode n1 : tree1.preOrder()) {
            if (!matching.isMatched1(n1)) ops.add(new Operation.Delete(n1, n1.parent(), n1.position()));
        }
        for (TreeNode n2 : tree2.preOrder()) {
            if (!matching.isMatched2(n2)) ops.add(new Operation.Insert(n2, n2.parent(), n2.position()));
        }
        return ops;
    }

    // ---------------- pass 1 helpers ----------------

    static Map<UpdateField, FieldChange> changes(TreeNode n1, TreeNode n2) {
        var out = new EnumMap<UpdateField, FieldChange>(UpdateField.class);

        // A text leaf turned into a branch (or back) has no field-level description.
        boolean kindChanged = (n1.isText() && !n2.isLeaf()) || (n2.isText() && !n1.isLeaf());
        if (kindChanged) {
            out.put(UpdateField.CONTENT, new FieldChange(TextOverlap.textOf(n1), TextOverlap.textOf(n2)));
            return out;
        }

        if (!Objects.equals(n1.value(), n2.value())) {
            out.put(UpdateField.VALUE, new FieldChange(n1.value(), n2.value()));
        }
        if (!n1.attributes().equals(n2.attributes())) {
            out.put(UpdateField.ATTRIBUTES, new FieldChange(n1.attributes(), n2.attributes()));
        } else if (!AttributeComparator.sameKeyOrder(n1.attributes(), n2.attributes())) {
            out.put(UpdateField.ATTRIBUTE_ORDER, new FieldChange(
                    List.copyOf(n1.attributes().keySet()),
                    List.copyOf(n2.attributes().keySet())
            ));
        }
        if (!n1.label().equals(n2.label())) {
            out.put(UpdateField.LABEL, new FieldChange(n1.label(), n2.label()));
        }
        return out;
    }

    private boolean moved(TreeNode n1, TreeNode n2, SiblingRanks ranks) {
        TreeNode p1 = n1.parent();
        TreeNode p2 = n2.parent();
        if (p1 == null && p2 == null) return false;
        if (p1 == null || p2 == null) return true;
        if (matching.matchFor1(p1).orElse(null) != p2) return true;
        return ranks.rank1(n1) != ranks.rank2(n2);
    }

    /**
     * Rank of a node among the siblings that stayed under the corresponding parent.
     * Inserted, deleted and moved-away siblings do not count, so they never make an
     * unmoved node look moved.
     */
    private final class SiblingRanks {
        private final Map<TreeNode, Map<TreeNode, Integer>> ranks1 = new HashMap<>();
        private final Map<TreeNode, Map<TreeNode, Integer>> ranks2 = new HashMap<>();

        int rank1(TreeNode n1) {
            TreeNode p1 = n1.parent();
            return ranks1.computeIfAbsent(p1, p -> {
                TreeNode p2 = matching.matchFor1(p).orElse(null);
                var out = new HashMap<TreeNode, Integer>();
                for (TreeNode c : p.children()) {
                    TreeNode partner = matching.matchFor1(c).orElse(null);
                    if (partner != null && partner.parent() == p2) out.put(c, out.size());
                }
                return out;
            }).getOrDefault(n1, -1);
        }

        int rank2(TreeNode n2) {
            TreeNode p2 = n2.parent();
            return ranks2.computeIfAbsent(p2, p -> {
                TreeNode p1 = matching.matchFor2(p).orElse(null);
                var out = new HashMap<TreeNode, Integer>();
                for (TreeNode c : p.children()) {
                    TreeNode partner = matching.matchFor2(c).orElse(null);
                    if (partner != null && partner.parent() == p1) out.put(c, out.size());
                }
                return out;
            }).getOrDefault(n2, -1);
        }
    }

    // ---------------- pass 2 ----------------

    private final class SemanticPass {
        private final List<Operation> ops;
        private final Set<TreeNode> consumed1 = new HashSet<>();
        private final Set<TreeNode> consumed2 = new HashSet<>();

        SemanticPass(List<Operation> ops) {
            this.ops = ops;
        }

        void run() {
            detectMerges();
            detectSplits();
            detectMatchedHierarchyChanges();
            detectUnmatchedHierarchyChanges();
        }

        private void detectMerges() {
            for (var e : deletedChildrenByParent().entrySet()) {
                TreeNode parent1 = e.getKey();
                TreeNode parent2 = matching.matchFor1(parent1).orElseThrow();
                List<TreeNode> deleted = e.getValue();

                // Cluster of deleted siblings -> one inserted node.
                for (TreeNode target : parent2.children()) {
                    if (matching.isMatched2(target) || consumed2.contains(target)) continue;
                    List<TreeNode> cluster = open(deleted, target.label(), consumed1);
                    if (cluster.size() < 2) continue;
                    if (TextOverlap.score(TextOverlap.textOf(cluster), TextOverlap.textOf(target)) < MERGE_SPLIT_THRESHOLD) {
                        continue;
                    }
                    explain(cluster, List.of(target), new Operation.Merge(cluster, target));
                }

                // Matched sibling that absorbed deleted neighbours.
                for (TreeNode kept1 : parent1.children()) {
                    TreeNode kept2 = matching.matchFor1(kept1).orElse(null);
                    if (kept2 == null || kept2.parent() != parent2) continue;
                    if (consumed1.contains(kept1) || consumed2.contains(kept2)) continue;
                    List<TreeNode> cluster = open(deleted, kept2.label(), consumed1);
                    if (cluster.isEmpty()) continue;

                    var sources = new ArrayList<TreeNode>(cluster);
                    sources.add(kept1);
                    sources.sort(Comparator.comparingInt(TreeNode::position));

                    String targetText = TextOverlap.textOf(kept2);
                    double alone = TextOverlap.score(TextOverlap.textOf(kept1), targetText);
                    double combined = TextOverlap.score(TextOverlap.textOf(sources), targetText);
                    if (combined < MERGE_SPLIT_THRESHOLD || combined <= alone) continue;
                    explain(sources, List.of(kept2), new Operation.Merge(sources, kept2));
                }
            }
        }

        private void detectSplits() {
            for (var e : insertedChildrenByParent().entrySet()) {
                TreeNode parent2 = e.getKey();
                TreeNode parent1 = matching.matchFor2(parent2).orElseThrow();
                List<TreeNode> inserted = e.getValue();

                // One deleted node -> cluster of inserted siblings.
                for (TreeNode source : parent1.children()) {
                    if (matching.isMatched1(source) || consumed1.contains(source)) continue;
                    List<TreeNode> cluster = open(inserted, source.label(), consumed2);
                    if (cluster.size() < 2) continue;
                    if (TextOverlap.score(TextOverlap.textOf(source), TextOverlap.textOf(cluster)) < MERGE_SPLIT_THRESHOLD) {
                        continue;
                    }
                    explain(List.of(source), cluster, new Operation.Split(source, cluster));
                }

                // Matched node that handed part of its content to new siblings.
                for (TreeNode kept2 : parent2.children()) {
                    TreeNode kept1 = matching.matchFor2(kept2).orElse(null);
                    if (kept1 == null || kept1.parent() != parent1) continue;
                    if (consumed1.contains(kept1) || consumed2.contains(kept2)) continue;
                    List<TreeNode> cluster = open(inserted, kept2.label(), consumed2);
                    if (cluster.isEmpty()) continue;

                    var targets = new ArrayList<TreeNode>(cluster);
                    targets.add(kept2);
                    targets.sort(Comparator.comparingInt(TreeNode::position));

                    String sourceText = TextOverlap.textOf(kept1);
                    double alone = TextOverlap.score(sourceText, TextOverlap.textOf(kept2));
                    double combined = TextOverlap.score(sourceText, TextOverlap.textOf(targets));
                    if (combined < MERGE_SPLIT_THRESHOLD || combined <= alone) continue;
                    explain(List.of(kept1), targets, new Operation.Split(kept1, targets));
                }
            }
        }

        /** A matched pair that moved to another level: its MOVE becomes an UPGRADE/DOWNGRADE. */
        private void detectMatchedHierarchyChanges() {
            for (int i = 0; i < ops.size(); i++) {
                if (!(ops.get(i) instanceof Operation.Move move)) continue;
                int from = move.node1().depth();
                int to = move.node2().depth();
                if (from == to) continue;
                if (!similarForHierarchy(move.node1(), move.node2())) continue;
                ops.set(i, hierarchyChange(move.node1(), move.node2(), from, to));
            }
        }

        /** A deleted node reappearing as an inserted node at another depth. */
        private void detectUnmatchedHierarchyChanges() {
            var deletes = new ArrayList<TreeNode>();
            var inserts = new ArrayList<TreeNode>();
            for (Operation op : ops) {
                if (op instanceof Operation.Delete d) deletes.add(d.node());
                else if (op instanceof Operation.Insert ins) inserts.add(ins.node());
            }

            for (TreeNode n1 : deletes) {
                if (consumed1.contains(n1)) continue;
                for (TreeNode n2 : inserts) {
                    if (consumed2.contains(n2)) continue;
                    int from = n1.depth();
                    int to = n2.depth();
                    if (from == to || !similarForHierarchy(n1, n2)) continue;
                    // Same order as the matched route: the field edit, then the level change.
                    var replacement = new ArrayList<Operation>(2);
                    Map<UpdateField, FieldChange> edits = changes(n1, n2);
                    if (!edits.isEmpty()) replacement.add(new Operation.Update(n1, n2, edits));
                    replacement.add(hierarchyChange(n1, n2, from, to));
                    explain(List.of(n1), List.of(n2), replacement);
                    break;
                }
            }
        }

        private Operation hierarchyChange(TreeNode n1, TreeNode n2, int from, int to) {
            return to < from
                    ? new Operation.Upgrade(n1, n2, from, to)
                    : new Operation.Downgrade(n1, n2, from, to);
        }

        private boolean similarForHierarchy(TreeNode n1, TreeNode n2) {
            if (!n1.label().equals(n2.label())) return false;
            String t1 = TextOverlap.textOf(n1);
            String t2 = TextOverlap.textOf(n2);
            if (t1.isEmpty() && t2.isEmpty()) return n1.similarityTo(n2) >= HIERARCHY_THRESHOLD;
            if (t1.isEmpty() || t2.isEmpty()) return false;
            return TextOverlap.score(t1, t2) >= HIERARCHY_THRESHOLD;
        }

        private void explain(List<TreeNode> roots1, List<TreeNode> roots2, Operation semantic) {
            explain(roots1, roots2, List.of(semantic));
        }

        /**
         * Replace every basic operation touching the given subtrees with {@code replacement},
         * placed where the first of them was.
         */
        private void explain(List<TreeNode> roots1, List<TreeNode> roots2, List<Operation> replacement) {
            var ex1 = new HashSet<TreeNode>();
            var ex2 = new HashSet<TreeNode>();
            for (TreeNode r : roots1) ex1.addAll(r.preOrder());
            for (TreeNode r : roots2) ex2.addAll(r.preOrder());

            var kept = new ArrayList<Operation>(ops.size());
            boolean placed = false;
            for (Operation op : ops) {
                if (touches(op, ex1, ex2)) {
                    if (!placed) {
                        kept.addAll(replacement);
                        placed = true;
                    }
                    continue;
                }
                kept.add(op);
            }
            if (!placed) kept.addAll(replacement);
            ops.clear();
            ops.addAll(kept);
            consumed1.addAll(ex1);
            consumed2.addAll(ex2);
        }

        private boolean touches(Operation op, Set<TreeNode> ex1, Set<TreeNode> ex2) {
            if (op instanceof Operation.Insert ins) return ex2.contains(ins.node());
            if (op instanceof Operation.Delete del) return ex1.contains(del.node());
            if (op instanceof Operation.Update up) return ex1.contains(up.node1()) || ex2.contains(up.node2());
            if (op instanceof Operation.Move mv) return ex1.contains(mv.node1()) || ex2.contains(mv.node2());
            return false;
        }

        /** Deleted direct children, grouped under their matched tree1 parent, document order. */
        private Map<TreeNode, List<TreeNode>> deletedChildrenByParent() {
            Map<TreeNode, List<TreeNode>> out = new LinkedHashMap<>();
            for (Operation op : ops) {
                if (!(op instanceof Operation.Delete d) || d.parent() == null) continue;
                if (!matching.isMatched1(d.parent())) continue;
                out.computeIfAbsent(d.parent(), k -> new ArrayList<>()).add(d.node());
            }
            return out;
        }

        /** Inserted direct children, grouped under their matched tree2 parent, document order. */
        private Map<TreeNode, List<TreeNode>> insertedChildrenByParent() {
            Map<TreeNode, List<TreeNode>> out = new LinkedHashMap<>();
            for (Operation op : ops) {
                if (!(op instanceof Operation.Insert ins) || ins.parent() == null) continue;
                if (!matching.isMatched2(ins.parent())) continue;
                out.computeIfAbsent(ins.parent(), k -> new ArrayList<>()).add(ins.node());
            }
            return out;
        }

        private List<TreeNode> open(List<TreeNode> nodes, String label, Set<TreeNode> consumed) {
            var out = new ArrayList<TreeNode>();
            for (TreeNode n : nodes) {
                if (!consumed.contains(n) && n.label().equals(label)) out.add(n);
            }
            return out;
        }
    }
}
