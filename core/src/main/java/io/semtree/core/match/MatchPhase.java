// file: core/src/main/java/io/semtree/core/match/MatchPhase.java
package io.semtree.core.match;

/** The three matching phases, in execution order. */
public enum MatchPhase {
    HASH, SIMILARITY, PROPAGATION
}
