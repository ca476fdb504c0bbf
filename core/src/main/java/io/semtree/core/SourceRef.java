// file: core/src/main/java/io/semtree/core/SourceRef.java
package io.semtree.core;

import java.util.Objects;

/**
 * Opaque link from a tree node back to the adapter's original node.
 * <p>
 * The diff never looks inside {@code handle}; adapters dispatch on {@link #format()}
 * when they serialize a node for presentation.
 *
 * @param format which adapter produced the node
 * @param handle the adapter's own node object (DOM node, JSON node, ...)
 */
public record SourceRef(SourceFormat format, Object handle) {
    public SourceRef {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(handle, "handle");
    }
}
