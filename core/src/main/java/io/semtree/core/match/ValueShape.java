// file: core/src/main/java/io/semtree/core/match/ValueShape.java
package io.semtree.core.match;

import java.util.regex.Pattern;

/**
 * Coarse class of a scalar value. Two text leaves of the same shape are
 * plausible similarity candidates even when their labels differ.
 */
enum ValueShape {
    NONE, BLANK, NUMBER, BOOLEAN, TEXT;

    private static final Pattern NUMBER_PATTERN =
            Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    static ValueShape of(String value) {
        if (value == null) return NONE;
        String v = value.strip();
        if (v.isEmpty()) return BLANK;
        if (v.equals("true") || v.equals("false")) return BOOLEAN;
        if (NUMBER_PATTERN.matcher(v).matches()) return NUMBER;
        return TEXT;
    }
}
