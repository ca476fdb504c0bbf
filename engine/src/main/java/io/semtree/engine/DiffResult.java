// file: engine/src/main/java/io/semtree/engine/DiffResult.java
package io.semtree.engine;

import io.semtree.core.Matching;
import io.semtree.core.match.MatchStatistics;
import io.semtree.core.ops.Operation;
import io.semtree.core.ops.OperationType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Outcome of one diff: the operations, the matching they were derived from, and phase statistics. */
public record DiffResult(List<Operation> operations, Matching matching, MatchStatistics statistics) {

    public DiffResult {
        operations = List.copyOf(Objects.requireNonNull(operations, "operations"));
        Objects.requireNonNull(matching, "matching");
        Objects.requireNonNull(statistics, "statistics");
    }

    /** True when no operation was detected. */
    public boolean identical() { return operations.isEmpty(); }

    public Map<OperationType, Integer> countsByType() {
        var out = new EnumMap<OperationType, Integer>(OperationType.class);
        for (Operation op : operations) out.merge(op.type(), 1, Integer::sum);
        return out;
    }

    public List<Operation> ofType(OperationType type) {
        return operations.stream().filter(op -> op.type() == type).toList();
    }
}
