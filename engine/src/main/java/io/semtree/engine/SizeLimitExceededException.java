// file: engine/src/main/java/io/semtree/engine/SizeLimitExceededException.java
package io.semtree.engine;

/**
 * A tree was rejected before matching because it has more nodes than the
 * configured limit.
 */
public final class SizeLimitExceededException extends RuntimeException {

    private final String side;
    private final int observed;
    private final int limit;

    public SizeLimitExceededException(String side, int observed, int limit) {
        super("%s has %d nodes, limit is %d".formatted(side, observed, limit));
        this.side = side;
        this.observed = observed;
        this.limit = limit;
    }

    /** Which input was too large: "tree1" or "tree2". */
    public String side() { return side; }

    public int observed() { return observed; }

    public int limit() { return limit; }
}
