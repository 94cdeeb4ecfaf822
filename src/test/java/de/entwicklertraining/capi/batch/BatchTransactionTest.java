package de.entwicklertraining.capi.batch;

import de.entwicklertraining.capi.ErrorKind;
import de.entwicklertraining.capi.cancellation.CancellationToken;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchTransactionTest {

    private InMemoryResourceClient apps;
    private InMemoryResourceClient spaces;
    private BatchExecutor executor;

    @BeforeEach
    void setUp() {
        apps = new InMemoryResourceClient(0);
        spaces = new InMemoryResourceClient(0);
        executor = new BatchExecutor(new ResourceRegistry()
                .register(ResourceRegistry.json("app", apps))
                .register(ResourceRegistry.json("space", spaces)));
    }

    private static JSONObject named(String name) {
        return new JSONObject().put("name", name);
    }

    @Test
    void testAllSucceed() {
        BatchTransaction tx = new BatchTransaction(executor)
                .add(BatchOperation.create("a", "app", named("one")))
                .add(BatchOperation.create("s", "space", named("dev")));

        List<BatchResult> results = tx.execute(CancellationToken.none());

        assertTrue(results.stream().allMatch(BatchResult::success));
        assertEquals(1, apps.store.size());
        assertEquals(1, spaces.store.size());
    }

    @Test
    void testFailureRollsBackCreates() {
        spaces.store.put("existing", named("old"));
        BatchTransaction tx = new BatchTransaction(executor)
                .add(BatchOperation.create("a1", "app", named("one")))
                .add(BatchOperation.create("a2", "app", named("two")))
                .add(BatchOperation.update("s-upd", "space", "existing", named("new")))
                .add(BatchOperation.get("s-get", "space", "existing"))
                .add(BatchOperation.create("a3", "app", named("fail-three")));

        TransactionFailedException e = assertThrows(TransactionFailedException.class,
                () -> tx.execute(CancellationToken.none()));

        assertEquals(ErrorKind.TRANSACTION_FAILED, e.getKind());
        assertEquals("transaction failed, 1 operations failed: [a3]", e.getMessage());
        assertEquals(List.of("a3"), e.getFailedIds());
        assertEquals(5, e.getResults().size());
        assertEquals(2, e.getRollbackResults().size());
        assertTrue(e.getRollbackResults().stream().allMatch(BatchResult::success));
        assertEquals(List.of("rollback_a1", "rollback_a2"),
                e.getRollbackResults().stream().map(BatchResult::id).toList());
        assertEquals(List.of("s-upd"), e.getUnreversedIds());
        assertTrue(apps.store.isEmpty());
        assertEquals("new", spaces.store.get("existing").getString("name"));
    }

    @Test
    void testRollbackDisabledReturnsResults() {
        BatchTransaction tx = new BatchTransaction(executor)
                .setRollback(false)
                .add(BatchOperation.create("a1", "app", named("one")))
                .add(BatchOperation.create("a2", "app", named("fail-two")));

        List<BatchResult> results = tx.execute(CancellationToken.none());

        assertFalse(tx.isRollback());
        assertTrue(results.get(0).success());
        assertFalse(results.get(1).success());
        assertEquals(1, apps.store.size());
    }
}
