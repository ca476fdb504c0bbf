// file: core/src/main/java/io/semtree/core/SourceFormat.java
package io.semtree.core;

/** Closed set of document formats an adapter can build a tree from. */
public enum SourceFormat {
    XML, HTML, JSON, YAML;

    /** Markup formats carry element/text/attribute nodes; data formats carry object/array/value nodes. */
    public boolean isMarkup() {
        return switch (this) {
            case XML, HTML -> true;
            case JSON, YAML -> false;
        };
    }
}
