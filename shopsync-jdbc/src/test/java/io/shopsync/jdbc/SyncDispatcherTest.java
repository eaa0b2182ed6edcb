package io.shopsync.jdbc;

import io.shopsync.Identifier;
import io.shopsync.SyncConfig;
import io.shopsync.dispatch.BackoffScheduleRetryPolicy;
import io.shopsync.dispatch.DrainResult;
import io.shopsync.dispatch.SyncDispatcher;
import io.shopsync.dispatch.SyncHandler;
import io.shopsync.dispatch.SyncOutcome;
import io.shopsync.dispatch.SyncStats;
import io.shopsync.dispatch.handler.SyncHandlers;
import io.shopsync.model.IdResolution;
import io.shopsync.model.InventoryChanges;
import io.shopsync.model.InventoryDraft;
import io.shopsync.model.InventoryItem;
import io.shopsync.model.SaleDraft;
import io.shopsync.model.SaleLine;
import io.shopsync.model.SaleReceipt;
import io.shopsync.model.SyncOperation;
import io.shopsync.model.SyncQueueEntry;
import io.shopsync.queue.SyncPayload;
import io.shopsync.queue.SyncQueue;
import io.shopsync.registry.DefaultHandlerRegistry;
import io.shopsync.registry.HandlerRegistry;
import io.shopsync.repository.RecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncDispatcherTest {

    private TestDatabase db;
    private RecordRepository records;
    private SyncQueue queue;
    private InMemoryRemoteBackend remote;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        records = new RecordRepository(db.localStore, db.transactions, new SyncConfig(), null);
        queue = new SyncQueue(db.transactions, db.queueStore, null, 3);
        remote = new InMemoryRemoteBackend();
    }

    // ── Replay ─────────────────────────────────────────────────────

    @Test
    void offlineItemIsCreatedRemotelyAndResolved() {
        InventoryItem item = addItem("Rice", 10);

        DrainResult result = dispatcher().drain();

        assertEquals(1, result.processed());
        assertEquals(1, result.succeeded());
        assertFalse(result.hasErrors());
        assertEquals(1, remote.insertCount("inventory"));
        InventoryItem local = findItem(item.id());
        assertTrue(local.id() instanceof Identifier.Persistent);
        assertTrue(local.synced());
        assertFalse(local.offline());
        assertEquals(item.id().value(), remote.row("inventory", local.id().value()).get("client_ref"));
        assertEquals(0, queue.countPending());
    }

    @Test
    void replayAfterLostCompletionDoesNotCreateTwice() {
        InventoryItem item = addItem("Rice", 10);
        remote.put("inventory", "srv-1", Map.of("client_ref", item.id().value(), "name", "Rice", "quantity", 10));

        DrainResult result = dispatcher().drain();

        assertEquals(1, result.succeeded());
        assertEquals(0, remote.insertCount("inventory"));
        assertEquals("srv-1", findItem(item.id()).id().value());
    }

    @Test
    void persistentIdIsUpsertedInPlace() {
        InventoryItem cached = new InventoryItem(Identifier.parse("srv-5"), null, "user-1", "store-1", "Oil", null,
                null, 2, null, null, true, false, Instant.now(), Instant.now());
        remote.put("inventory", "srv-5", Map.of("name", "Oil", "quantity", 2));
        db.transactions.inTransaction(conn -> {
            records.inventory().upsert(conn, cached);
            return queue.enqueue(conn, "srv-5", new SyncPayload.InventoryCreated(cached));
        });

        dispatcher().drain();

        assertEquals(1, remote.rows("inventory").size());
        assertEquals(0, remote.insertCount("inventory"));
    }

    @Test
    void saleWaitsForItsInventoryAndDecrementsRemoteStock() {
        InventoryItem rice = addItem("Rice", 10);
        processSale(rice, 3);
        remote.failAlways("inventory");
        SyncDispatcher dispatcher = dispatcher();

        DrainResult first = dispatcher.drain();

        assertEquals(2, first.processed());
        assertEquals(2, first.failed());
        assertTrue(remote.rows("sales").isEmpty());

        remote.recover("inventory");
        DrainResult second = dispatcher.drain();

        assertEquals(2, second.succeeded());
        String remoteId = findItem(rice.id()).id().value();
        assertEquals(7, remote.row("inventory", remoteId).get("quantity"));
        assertEquals(1, remote.rows("sales").size());
        assertEquals(1, remote.rows("sale_items").size());
        assertEquals(remoteId, remote.rows("sale_items").get(0).get("inventory_id"));
        assertEquals(0, queue.countPending());
    }

    @Test
    void replayedSaleDoesNotDecrementTwice() {
        InventoryItem rice = addItem("Rice", 10);
        SaleReceipt receipt = processSale(rice, 3);
        SyncDispatcher dispatcher = dispatcher();
        dispatcher.drain();
        String remoteId = findItem(rice.id()).id().value();

        // same payload again, as if the first completion had been lost
        db.transactions.inTransaction(conn -> queue.enqueue(conn, receipt.sale().id().value(),
                new SyncPayload.SaleCreated(receipt.sale(), receipt.lines())));
        DrainResult replay = dispatcher.drain();

        assertEquals(1, replay.succeeded());
        assertEquals(7, remote.row("inventory", remoteId).get("quantity"));
        assertEquals(1, remote.rows("sales").size());
        assertEquals(1, remote.rows("sale_items").size());
    }

    @Test
    void laterQueuedChangeKeepsRecordUnsynced() {
        InventoryItem item = addItem("Rice", 10);
        db.transactions.inTransaction(conn -> queue.enqueue(conn, item.id().value(),
                new SyncPayload.InventoryUpdated(item.id(), InventoryChanges.ofQuantity(12))));
        SyncDispatcher dispatcher = dispatcher(1);

        dispatcher.drain();

        assertFalse(findItem(item.id()).synced());

        dispatcher.drain();

        InventoryItem local = findItem(item.id());
        assertTrue(local.synced());
        assertEquals(12, remote.row("inventory", local.id().value()).get("quantity"));
    }

    // ── Failures ───────────────────────────────────────────────────

    @Test
    void entryIsAttemptedExactlyMaxAttemptsTimes() {
        addItem("Rice", 10);
        remote.failAlways("inventory");
        SyncDispatcher dispatcher = dispatcher();

        for (int i = 0; i < 3; i++) {
            assertEquals(1, dispatcher.drain().processed());
        }
        DrainResult afterExhaustion = dispatcher.drain();

        assertEquals(0, afterExhaustion.processed());
        SyncStats stats = dispatcher.stats();
        assertEquals(1, stats.failedOperations());
        assertEquals(0, stats.retryableOperations());
        assertEquals(1, stats.pendingOperations());
        assertNotNull(stats.lastProcessed());
        SyncQueueEntry entry = queue.pending(0).get(0);
        assertEquals(3, entry.attempts());
        assertTrue(entry.errorMessage().contains("simulated failure"));
    }

    @Test
    void failureReportsBackoffDelay() {
        addItem("Rice", 10);
        remote.failNext("inventory", 1);

        DrainResult result = dispatcher().drain();

        assertEquals(1, result.failed());
        assertEquals(Duration.ofMillis(1000), result.retryAfter());
        assertTrue(result.errors().get(0).operationKey().startsWith("inventory:INSERT:temp_"));
    }

    @Test
    void exhaustingFailureReportsNoRetryDelay() {
        SyncQueue oneShot = new SyncQueue(db.transactions, db.queueStore, null, 1);
        InventoryItem item = db.transactions.inTransaction(conn -> {
            InventoryItem created = records.inventory().insert(conn, draft("Rice", 10));
            oneShot.enqueue(conn, created.id().value(), new SyncPayload.InventoryCreated(created));
            return created;
        });
        remote.failAlways("inventory");

        DrainResult result = dispatcher().drain();

        assertEquals(1, result.failed());
        assertNull(result.retryAfter());
        assertEquals(1, queue.countExhausted());
        assertFalse(findItem(item.id()).synced());
    }

    @Test
    void malformedEntryIsExhaustedWithoutRetry() {
        db.transactions.inTransaction(conn -> {
            db.queueStore.upsert(conn, rawEntry("inventory:INSERT:temp_1_x", "inventory", SyncOperation.INSERT, "{not json"));
            return null;
        });
        SyncDispatcher dispatcher = dispatcher();

        DrainResult result = dispatcher.drain();

        assertEquals(1, result.failed());
        assertEquals(1, queue.countExhausted());
        assertEquals(0, dispatcher.drain().processed());
    }

    @Test
    void entryWithoutHandlerIsExhaustedWithoutRetry() {
        String data = queue.codec().encode(new SyncPayload.InventoryDeleted(Identifier.parse("srv-1")));
        db.transactions.inTransaction(conn -> {
            db.queueStore.upsert(conn, rawEntry("suppliers:DELETE:srv-1", "suppliers", SyncOperation.DELETE, data));
            return null;
        });

        DrainResult result = dispatcher().drain();

        assertEquals(1, result.failed());
        assertTrue(result.errors().get(0).message().contains("No handler"));
        assertEquals(1, queue.countExhausted());
    }

    @Test
    void clearFailedOperationsDropsExhaustedEntries() {
        addItem("Rice", 10);
        remote.failAlways("inventory");
        SyncDispatcher dispatcher = dispatcher();
        for (int i = 0; i < 3; i++) {
            dispatcher.drain();
        }

        assertEquals(1, dispatcher.clearFailedOperations());
        assertEquals(0, dispatcher.stats().pendingOperations());
    }

    @Test
    void oneFailingEntryDoesNotStopTheBatch() {
        addItem("Rice", 10);
        db.transactions.inTransaction(conn -> {
            db.queueStore.upsert(conn, rawEntry("inventory:INSERT:temp_1_x", "inventory", SyncOperation.INSERT, "{not json"));
            return null;
        });
        addItem("Salt", 4);

        DrainResult result = dispatcher().drain();

        assertEquals(3, result.processed());
        assertEquals(2, result.succeeded());
        assertEquals(2, remote.insertCount("inventory"));
    }

    // ── Concurrency ────────────────────────────────────────────────

    @Test
    void overlappingDrainIsSkipped() throws Exception {
        addItem("Rice", 10);
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        SyncHandler blocking = (entry, payload) -> {
            inside.countDown();
            release.await(5, TimeUnit.SECONDS);
            return SyncOutcome.none();
        };
        SyncDispatcher dispatcher = dispatcher(new DefaultHandlerRegistry().register("inventory", SyncOperation.INSERT, blocking), 50);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<DrainResult> first = executor.submit(dispatcher::drain);
            assertTrue(inside.await(5, TimeUnit.SECONDS));
            assertTrue(dispatcher.isProcessing());

            DrainResult second = dispatcher.drain();

            assertTrue(second.alreadyInProgress());
            assertEquals(0, second.processed());
            release.countDown();
            assertEquals(1, first.get(5, TimeUnit.SECONDS).succeeded());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
        assertFalse(dispatcher.isProcessing());
    }

    @Test
    void entryRewrittenDuringReplayStaysPending() {
        InventoryItem item = addItem("Rice", 10);
        db.transactions.inTransaction(conn -> {
            records.applyResolution(conn, new IdResolution("inventory",
                    (Identifier.Temporary) item.id(), new Identifier.Persistent("srv-1")));
            queue.cancel(conn, SyncQueue.operationKey("inventory", SyncOperation.INSERT, item.id().value()));
            return queue.enqueue(conn, "srv-1", new SyncPayload.InventoryUpdated(Identifier.parse("srv-1"),
                    InventoryChanges.ofQuantity(5)));
        });
        SyncHandler rewriting = (entry, payload) -> {
            db.transactions.inTransaction(conn -> queue.enqueue(conn, "srv-1",
                    new SyncPayload.InventoryUpdated(Identifier.parse("srv-1"), InventoryChanges.ofQuantity(4))));
            return SyncOutcome.none();
        };
        SyncDispatcher dispatcher = dispatcher(new DefaultHandlerRegistry().register("inventory", SyncOperation.UPDATE, rewriting), 50);

        DrainResult result = dispatcher.drain();

        assertEquals(1, result.succeeded());
        List<SyncQueueEntry> pending = queue.pending(0);
        assertEquals(1, pending.size());
        SyncPayload.InventoryUpdated latest = (SyncPayload.InventoryUpdated) queue.decode(pending.get(0));
        assertEquals(4, latest.changes().quantity());
    }

    @Test
    void editFoldedIntoInsertDuringReplayReachesRemote() {
        InventoryItem item = addItem("Rice", 10);
        DefaultHandlerRegistry defaults = SyncHandlers.registerDefaults(new DefaultHandlerRegistry(), remote,
                db.transactions, records);
        SyncHandler insert = defaults.handlerFor("inventory", SyncOperation.INSERT);
        AtomicBoolean edited = new AtomicBoolean();
        SyncHandler editing = (entry, payload) -> {
            SyncOutcome outcome = insert.handle(entry, payload);
            if (edited.compareAndSet(false, true)) {
                db.transactions.inTransaction(conn -> {
                    InventoryItem updated = records.inventory()
                            .update(conn, item.id(), InventoryChanges.ofQuantity(4)).orElseThrow();
                    return queue.enqueue(conn, item.id().value(), new SyncPayload.InventoryCreated(updated));
                });
            }
            return outcome;
        };
        SyncDispatcher dispatcher = dispatcher(
                new DefaultHandlerRegistry().register("inventory", SyncOperation.INSERT, editing), 50);

        dispatcher.drain();
        assertEquals(1, queue.countPending());
        assertFalse(findItem(item.id()).synced());

        DrainResult second = dispatcher.drain();

        assertEquals(1, second.succeeded());
        InventoryItem local = findItem(item.id());
        assertEquals(4, remote.row("inventory", local.id().value()).get("quantity"));
        assertEquals(1, remote.insertCount("inventory"));
        assertEquals(0, queue.countPending());
        assertTrue(local.synced());
    }

    @Test
    void builderRejectsMissingCollaboratorsAndBadBatchSize() {
        assertThrows(NullPointerException.class, () -> SyncDispatcher.builder().build());
        assertThrows(IllegalArgumentException.class, () -> SyncDispatcher.builder()
                .transactions(db.transactions)
                .syncQueue(queue)
                .records(records)
                .handlerRegistry(new DefaultHandlerRegistry())
                .batchSize(0)
                .build());
    }

    private SyncDispatcher dispatcher() {
        return dispatcher(50);
    }

    private SyncDispatcher dispatcher(int batchSize) {
        return dispatcher(SyncHandlers.registerDefaults(new DefaultHandlerRegistry(), remote, db.transactions, records),
                batchSize);
    }

    private SyncDispatcher dispatcher(HandlerRegistry registry, int batchSize) {
        return SyncDispatcher.builder()
                .transactions(db.transactions)
                .syncQueue(queue)
                .records(records)
                .handlerRegistry(registry)
                .retryPolicy(new BackoffScheduleRetryPolicy())
                .batchSize(batchSize)
                .build();
    }

    private InventoryItem addItem(String name, int quantity) {
        return db.transactions.inTransaction(conn -> {
            InventoryItem item = records.inventory().insert(conn, draft(name, quantity));
            queue.enqueue(conn, item.id().value(), new SyncPayload.InventoryCreated(item));
            return item;
        });
    }

    private SaleReceipt processSale(InventoryItem item, int quantity) {
        return records.sales().processSale(SaleDraft.of("user-1", "store-1"),
                List.of(new SaleLine(item.id(), item.name(), quantity, new BigDecimal("2.00"))),
                (conn, receipt) -> queue.enqueue(conn, receipt.sale().id().value(),
                        new SyncPayload.SaleCreated(receipt.sale(), receipt.lines())));
    }

    private InventoryItem findItem(Identifier id) {
        return db.transactions.inTransaction(conn -> records.inventory().find(conn, id)).orElseThrow();
    }

    private static InventoryDraft draft(String name, int quantity) {
        return new InventoryDraft("user-1", "store-1", name, null, "grocery", quantity,
                new BigDecimal("1.00"), new BigDecimal("2.00"));
    }

    private static SyncQueueEntry rawEntry(String key, String table, SyncOperation operation, String data) {
        Instant now = Instant.now();
        return new SyncQueueEntry(UUID.randomUUID().toString(), key, table, key.substring(key.lastIndexOf(':') + 1),
                operation, data, 0, 3, false, null, now, now);
    }
}
