// file: core/src/main/java/io/semtree/core/ops/Operation.java
package io.semtree.core.ops;

import io.semtree.core.TreeNode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One edit taking tree1 towards tree2. Neutral record: whether an operation
 * matters for equivalence is decided downstream, never here.
 * <p>
 * Node roles:
 *  - node / node1 / source nodes come from tree1,
 *  - node2 / target nodes come from tree2;
 *  - Insert.node comes from tree2.
 */
public sealed interface Operation
        permits Operation.Insert, Operation.Delete, Operation.Update, Operation.Move,
                Operation.Merge, Operation.Split, Operation.Upgrade, Operation.Downgrade {

    OperationType type();

    /** Unmatched tree2 node. {@code parent} is null and {@code position} -1 for a root. */
    record Insert(TreeNode node, TreeNode parent, int position) implements Operation {
        public Insert {
            Objects.requireNonNull(node, "node");
        }

        @Override public OperationType type() { return OperationType.INSERT; }
    }

    /** Unmatched tree1 node. {@code parent} is null and {@code position} -1 for a root. */
    record Delete(TreeNode node, TreeNode parent, int position) implements Operation {
        public Delete {
            Objects.requireNonNull(node, "node");
        }

        @Override public OperationType type() { return OperationType.DELETE; }
    }

    /** Matched pair whose own fields differ; {@code changes} holds only the changed fields. */
    record Update(TreeNode node1, TreeNode node2, Map<UpdateField, FieldChange> changes) implements Operation {
        public Update {
            Objects.requireNonNull(node1, "node1");
            Objects.requireNonNull(node2, "node2");
            if (changes == null || changes.isEmpty()) throw new IllegalArgumentException("changes must not be empty");
            changes = Collections.unmodifiableMap(new EnumMap<>(changes));
        }

        public boolean changed(UpdateField field) { return changes.containsKey(field); }

        @Override public OperationType type() { return OperationType.UPDATE; }
    }

    /** Matched pair whose parent correspondence or sibling order changed. */
    record Move(
            TreeNode node1,
            TreeNode node2,
            TreeNode oldParent,
            TreeNode newParent,
            int oldPosition,
            int newPosition
    ) implements Operation {
        public Move {
            Objects.requireNonNull(node1, "node1");
            Objects.requireNonNull(node2, "node2");
        }

        @Override public OperationType type() { return OperationType.MOVE; }
    }

    /** Several tree1 siblings combined into one tree2 node. Sources are in document order. */
    record Merge(List<TreeNode> sourceNodes, TreeNode targetNode) implements Operation {
        public Merge {
            sourceNodes = List.copyOf(sourceNodes);
            Objects.requireNonNull(targetNode, "targetNode");
        }

        /** Labels of the merged nodes, for presentation. */
        public List<String> mergedFrom() {
            return sourceNodes.stream().map(TreeNode::label).toList();
        }

        @Override public OperationType type() { return OperationType.MERGE; }
    }

    /** One tree1 node divided into several tree2 siblings. Targets are in document order. */
    record Split(TreeNode sourceNode, List<TreeNode> targetNodes) implements Operation {
        public Split {
            Objects.requireNonNull(sourceNode, "sourceNode");
            targetNodes = List.copyOf(targetNodes);
        }

        public List<String> splitInto() {
            return targetNodes.stream().map(TreeNode::label).toList();
        }

        @Override public OperationType type() { return OperationType.SPLIT; }
    }

    /**
     * Node promoted: {@code toDepth < fromDepth}. Field edits between the two nodes
     * are reported by a separate {@link Update} just before this operation.
     */
    record Upgrade(TreeNode node1, TreeNode node2, int fromDepth, int toDepth) implements Operation {
        public Upgrade {
            Objects.requireNonNull(node1, "node1");
            Objects.requireNonNull(node2, "node2");
            if (toDepth >= fromDepth) throw new IllegalArgumentException("upgrade must decrease depth");
        }

        public int promotedBy() { return fromDepth - toDepth; }

        @Override public OperationType type() { return OperationType.UPGRADE; }
    }

    /** Node demoted: {@code toDepth > fromDepth}. Field edits travel in a preceding {@link Update}. */
    record Downgrade(TreeNode node1, TreeNode node2, int fromDepth, int toDepth) implements Operation {
        public Downgrade {
            Objects.requireNonNull(node1, "node1");
            Objects.requireNonNull(node2, "node2");
            if (toDepth <= fromDepth) throw new IllegalArgumentException("downgrade must increase depth");
        }

        public int demotedBy() { return toDepth - fromDepth; }

        @Override public OperationType type() { return OperationType.DOWNGRADE; }
    }
}
