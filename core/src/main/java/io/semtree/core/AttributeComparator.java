// file: core/src/main/java/io/semtree/core/AttributeComparator.java
package io.semtree.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Attribute map comparison with configurable order sensitivity.
 * <p>
 * Maps are compared as ordered entry lists under {@link AttributeOrder#STRICT}
 * and as plain key/value sets under {@link AttributeOrder#IGNORE}.
 */
public final class AttributeComparator {

    private final AttributeOrder attributeOrder;

    public AttributeComparator(AttributeOrder attributeOrder) {
        this.attributeOrder = Objects.requireNonNull(attributeOrder, "attributeOrder");
    }

    public AttributeOrder attributeOrder() { return attributeOrder; }

    public boolean equal(Map<String, String> a, Map<String, String> b) {
        if (a == null || b == null) return a == b;
        if (!a.equals(b)) return false; // Map.equals ignores order
        return attributeOrder == AttributeOrder.IGNORE || sameKeyOrder(a, b);
    }

    /**
     * Canonical entry list: document order when strict, key-sorted otherwise.
     * Two maps are {@link #equal} iff their canonical forms are equal.
     */
    public List<Map.Entry<String, String>> canonical(Map<String, String> attrs) {
        if (attrs == null || attrs.isEmpty()) return List.of();
        Map<String, String> source = attributeOrder == AttributeOrder.STRICT ? attrs : new TreeMap<>(attrs);
        var out = new ArrayList<Map.Entry<String, String>>(source.size());
        source.forEach((k, v) -> out.add(Map.entry(k, v)));
        return out;
    }

    /** True when both maps list their keys in the same order. */
    public static boolean sameKeyOrder(Map<String, String> a, Map<String, String> b) {
        return new ArrayList<>(a.keySet()).equals(new ArrayList<>(b.keySet()));
    }
}
