// file: core/src/main/java/io/semtree/core/ops/OperationType.java
package io.semtree.core.ops;

/**
 * Kinds of edit operation, from basic to semantic:
 *  - INSERT, DELETE, UPDATE: node-level content changes.
 *  - MOVE: a matched node changed parent or sibling order.
 *  - MERGE, SPLIT: several siblings combined into one node, or the inverse.
 *  - UPGRADE, DOWNGRADE: a node promoted to a shallower depth, or demoted to a deeper one.
 */
public enum OperationType {
    INSERT, DELETE, UPDATE, MOVE, MERGE, SPLIT, UPGRADE, DOWNGRADE;

    public boolean isSemantic() {
        return switch (this) {
            case MERGE, SPLIT, UPGRADE, DOWNGRADE -> true;
            default -> false;
        };
    }
}
