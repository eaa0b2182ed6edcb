package io.shopsync.jdbc;

import io.shopsync.Identifier;
import io.shopsync.model.InventoryChanges;
import io.shopsync.model.SyncOperation;
import io.shopsync.model.SyncQueueEntry;
import io.shopsync.model.UserProfile;
import io.shopsync.model.UserRole;
import io.shopsync.queue.SyncPayload;
import io.shopsync.queue.SyncQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncQueueTest {

    private TestDatabase db;
    private SyncQueue queue;
    private final List<SyncQueueEntry> notified = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        queue = new SyncQueue(db.transactions, db.queueStore, null, 3);
        queue.setEnqueueHook(notified::add);
    }

    @Test
    void operationKeyJoinsTableOperationAndRecord() {
        assertEquals("inventory:UPDATE:inv-1", SyncQueue.operationKey("inventory", SyncOperation.UPDATE, "inv-1"));
    }

    @Test
    void rejectsInvalidAttemptBudget() {
        assertThrows(IllegalArgumentException.class, () -> new SyncQueue(db.transactions, db.queueStore, null, 0));
    }

    // ── Enqueue ────────────────────────────────────────────────────

    @Test
    void enqueueStoresEncodedPayload() {
        SyncPayload payload = new SyncPayload.InventoryUpdated(Identifier.parse("inv-1"), InventoryChanges.ofQuantity(4));

        SyncQueueEntry entry = db.transactions.inTransaction(conn -> queue.enqueue(conn, "inv-1", payload));

        assertEquals("inventory:UPDATE:inv-1", entry.operationKey());
        assertEquals("inventory", entry.tableName());
        assertEquals(3, entry.maxAttempts());
        assertEquals(payload, queue.decode(entry));
        assertEquals(1, queue.countPending());
    }

    @Test
    void hookRunsAfterCommit() {
        db.transactions.inTransaction(conn -> {
            queue.enqueue(conn, "user-1", profileUpsert("user-1"));
            assertTrue(notified.isEmpty());
            return null;
        });

        assertEquals(1, notified.size());
        assertEquals("user_profiles:UPDATE:user-1", notified.get(0).operationKey());
    }

    @Test
    void rolledBackEnqueueLeavesNothingBehind() {
        assertThrows(IllegalStateException.class, () -> db.transactions.inTransaction(conn -> {
            queue.enqueue(conn, "user-1", profileUpsert("user-1"));
            throw new IllegalStateException("abort");
        }));

        assertTrue(notified.isEmpty());
        assertEquals(0, queue.countPending());
    }

    @Test
    void failingHookDoesNotFailEnqueue() {
        queue.setEnqueueHook(entry -> {
            throw new IllegalStateException("listener broke");
        });

        db.transactions.inTransaction(conn -> queue.enqueue(conn, "user-1", profileUpsert("user-1")));

        assertEquals(1, queue.countPending());
    }

    @Test
    void reenqueueReturnsStoredEntryWithNewPayload() {
        SyncQueueEntry first = db.transactions.inTransaction(conn ->
                queue.enqueue(conn, "inv-1", new SyncPayload.InventoryUpdated(Identifier.parse("inv-1"),
                        InventoryChanges.ofQuantity(4))));
        SyncQueueEntry second = db.transactions.inTransaction(conn ->
                queue.enqueue(conn, "inv-1", new SyncPayload.InventoryUpdated(Identifier.parse("inv-1"),
                        InventoryChanges.ofQuantity(2))));

        assertEquals(first.id(), second.id());
        SyncPayload decoded = queue.decode(queue.pending(0).get(0));
        SyncPayload.InventoryUpdated updated = assertInstanceOf(SyncPayload.InventoryUpdated.class, decoded);
        assertEquals(2, updated.changes().quantity());
    }

    // ── Completion ─────────────────────────────────────────────────

    @Test
    void completeIfUnchangedCompletesUntouchedEntry() {
        SyncQueueEntry entry = db.transactions.inTransaction(conn -> queue.enqueue(conn, "user-1", profileUpsert("user-1")));

        assertTrue(db.transactions.<Boolean>inTransaction(conn -> queue.completeIfUnchanged(conn, entry)));
        assertEquals(0, queue.countPending());
    }

    @Test
    void completeIfUnchangedLeavesRewrittenEntryPending() {
        SyncQueueEntry read = db.transactions.inTransaction(conn -> queue.enqueue(conn, "inv-1",
                new SyncPayload.InventoryUpdated(Identifier.parse("inv-1"), InventoryChanges.ofQuantity(4))));
        db.transactions.inTransaction(conn -> queue.enqueue(conn, "inv-1",
                new SyncPayload.InventoryUpdated(Identifier.parse("inv-1"), InventoryChanges.ofQuantity(9))));

        assertFalse(db.transactions.<Boolean>inTransaction(conn -> queue.completeIfUnchanged(conn, read)));
        assertEquals(1, queue.countPending());
    }

    @Test
    void completeIfUnchangedIgnoresCancelledEntry() {
        SyncQueueEntry entry = db.transactions.inTransaction(conn -> queue.enqueue(conn, "user-1", profileUpsert("user-1")));
        assertTrue(db.transactions.<Boolean>inTransaction(conn -> queue.cancel(conn, entry.operationKey())));

        assertFalse(db.transactions.<Boolean>inTransaction(conn -> queue.completeIfUnchanged(conn, entry)));
    }

    @Test
    void failuresExhaustEntryAndClearExhaustedCompletesIt() {
        SyncQueueEntry entry = db.transactions.inTransaction(conn -> queue.enqueue(conn, "user-1", profileUpsert("user-1")));
        queue.recordFailure(entry.id(), "down");
        queue.recordFailure(entry.id(), "down");
        assertEquals(1, queue.dequeueBatch(10).size());

        queue.recordFailure(entry.id(), "down");

        assertTrue(queue.dequeueBatch(10).isEmpty());
        assertEquals(1, queue.countExhausted());
        assertEquals(1, queue.pending(0).size());
        assertEquals(1, queue.clearExhausted());
        assertTrue(queue.pending(0).isEmpty());
    }

    @Test
    void hasPendingChecksAnyOfTheIds() {
        db.transactions.inTransaction(conn -> queue.enqueue(conn, "temp_1_abc", profileUpsert("user-1")));

        assertTrue(db.transactions.<Boolean>inTransaction(conn ->
                queue.hasPending(conn, "user_profiles", List.of("srv-1", "temp_1_abc"))));
        assertFalse(db.transactions.<Boolean>inTransaction(conn ->
                queue.hasPending(conn, "user_profiles", List.of("srv-1"))));
    }

    private static SyncPayload profileUpsert(String userId) {
        return new SyncPayload.ProfileUpserted(UserProfile.of(userId, UserRole.OWNER, "store-1"));
    }
}
