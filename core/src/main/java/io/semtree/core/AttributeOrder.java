// file: core/src/main/java/io/semtree/core/AttributeOrder.java
package io.semtree.core;

/**
 * How attribute order takes part in comparisons.
 *  - STRICT: {a=1, b=2} and {b=2, a=1} differ.
 *  - IGNORE: only the key/value pairs matter.
 */
public enum AttributeOrder {
    STRICT, IGNORE;

    /** Lenient parse used by config loaders: "strict" or "ignore", case-insensitive. */
    public static AttributeOrder parse(String s) {
        if (s == null || s.isBlank()) return IGNORE;
        return switch (s.trim().toLowerCase()) {
            case "strict" -> STRICT;
            case "ignore", "normalize" -> IGNORE;
            default -> throw new IllegalArgumentException("unknown attribute order: " + s);
        };
    }
}
