// file: engine/src/test/java/io/semtree/engine/TreeDifferTest.java
package io.semtree.engine;

import io.semtree.core.TreeNode;
import io.semtree.core.match.MatchPhase;
import io.semtree.core.ops.Operation;
import io.semtree.core.ops.OperationType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TreeDifferTest {

    private static TreeNode doc(String... paras) {
        var b = TreeNode.builder("doc");
        for (String p : paras) b.child(TreeNode.text("para", p));
        return b.build();
    }

    @Test
    void identical_documents_are_equivalent() {
        var differ = new TreeDiffer();
        TreeNode t1 = doc("one", "two");

        assertTrue(differ.equivalent(t1, t1.deepClone()));
    }

    @Test
    void result_carries_operations_matching_and_statistics() {
        var differ = new TreeDiffer();
        TreeNode t1 = TreeNode.builder("doc").child(TreeNode.text("child", "A")).build();
        TreeNode t2 = TreeNode.builder("doc").child(TreeNode.text("child", "B")).build();

        DiffResult result = differ.diff(t1, t2);

        assertFalse(result.identical());
        assertEquals(Map.of(OperationType.UPDATE, 1), result.countsByType());
        assertEquals(1, result.ofType(OperationType.UPDATE).size());
        assertTrue(result.ofType(OperationType.MOVE).isEmpty());
        assertEquals(2, result.matching().size());
        assertEquals(2, result.statistics().tree1Nodes());
        assertEquals(List.of(MatchPhase.HASH, MatchPhase.SIMILARITY, MatchPhase.PROPAGATION),
                result.statistics().phasesExecuted());
    }

    @Test
    void merge_is_reported_through_the_facade() {
        DiffResult result = new TreeDiffer().diff(doc("First", "Second", "Third"), doc("First Second Third"));

        assertEquals(1, result.operations().size());
        assertInstanceOf(Operation.Merge.class, result.operations().get(0));
    }

    @Test
    void oversized_input_is_rejected_before_matching() {
        var differ = new TreeDiffer(DiffConfig.defaults().withMaxNodeCount(3));
        TreeNode small = doc("a");
        TreeNode large = doc("a", "b", "c");

        var ex = assertThrows(SizeLimitExceededException.class, () -> differ.diff(small, large));
        assertEquals("tree2", ex.side());
        assertEquals(4, ex.observed());
        assertEquals(3, ex.limit());
    }

    @Test
    void zero_limit_disables_the_size_check() {
        var differ = new TreeDiffer(DiffConfig.defaults().withMaxNodeCount(0));
        TreeNode big = doc("a", "b", "c", "d", "e");

        assertTrue(differ.equivalent(big, big.deepClone()));
    }

    @Test
    void independent_diffs_can_run_concurrently() throws Exception {
        var differ = new TreeDiffer();
        ExecutorService exec = Executors.newFixedThreadPool(4);
        try {
            List<Future<DiffResult>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                String v = "value " + i;
                futures.add(exec.submit(() -> differ.diff(doc("keep", v), doc("keep", v, "extra"))));
            }
            for (Future<DiffResult> f : futures) {
                DiffResult r = f.get(10, TimeUnit.SECONDS);
                assertEquals(Map.of(OperationType.INSERT, 1), r.countsByType());
            }
        } finally {
            exec.shutdownNow();
        }
    }
}
