// file: core/src/main/java/io/semtree/core/ops/FieldChange.java
package io.semtree.core.ops;

/**
 * Old and new value of one changed field. Either side may be null
 * (for example a value that appeared or disappeared).
 */
public record FieldChange(Object oldValue, Object newValue) {}
