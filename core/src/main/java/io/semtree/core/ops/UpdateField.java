// file: core/src/main/java/io/semtree/core/ops/UpdateField.java
package io.semtree.core.ops;

/** Node fields an {@link Operation.Update} can report, in reporting order. */
public enum UpdateField {
    VALUE,
    ATTRIBUTES,
    /** Same attribute pairs, different key order. Old/new are key lists. */
    ATTRIBUTE_ORDER,
    LABEL,
    /** Generic "content differs", used when the change has no finer classification. */
    CONTENT
}
