package io.shopsync.jdbc;

import io.shopsync.Identifier;
import io.shopsync.InsufficientStockException;
import io.shopsync.ReferencedRecordException;
import io.shopsync.SyncConfig;
import io.shopsync.dispatch.DrainResult;
import io.shopsync.dispatch.SyncStats;
import io.shopsync.model.AccessScope;
import io.shopsync.model.ExpenseDraft;
import io.shopsync.model.ExpenseRecord;
import io.shopsync.model.InventoryChanges;
import io.shopsync.model.InventoryDraft;
import io.shopsync.model.InventoryItem;
import io.shopsync.model.SaleDraft;
import io.shopsync.model.SaleLine;
import io.shopsync.model.SaleReceipt;
import io.shopsync.model.SyncOperation;
import io.shopsync.model.SyncQueueEntry;
import io.shopsync.model.UserProfile;
import io.shopsync.model.UserRole;
import io.shopsync.queue.SyncPayload;
import io.shopsync.repository.TableStats;
import io.shopsync.storage.StorageFacade;
import io.shopsync.storage.StorageStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageFacadeTest {

    private TestDatabase db;
    private InMemoryRemoteBackend remote;
    private InMemoryCredentialStore credentials;
    private ManualConnectivityMonitor connectivity;
    private StorageFacade storage;

    @BeforeEach
    void setUp() {
        db = TestDatabase.empty();
        remote = new InMemoryRemoteBackend();
        credentials = new InMemoryCredentialStore();
        connectivity = new ManualConnectivityMonitor(true);
        storage = facade(new SyncConfig(), false);
        storage.init();
    }

    @AfterEach
    void tearDown() {
        storage.close();
    }

    // ── Lifecycle ──────────────────────────────────────────────────

    @Test
    void initIsIdempotent() {
        storage.init();

        assertTrue(storage.isReady());
        assertEquals(1, credentials.initializations());
    }

    @Test
    void firstOperationInitializesLazily() {
        StorageFacade lazy = facade(new SyncConfig(), false);
        try {
            assertTrue(lazy.getInventory(AccessScope.individual("user-1")).isEmpty());
            assertTrue(lazy.isReady());
        } finally {
            lazy.close();
        }
    }

    @Test
    void closedFacadeCannotBeReinitialized() {
        StorageFacade other = facade(new SyncConfig(), false);
        other.close();

        assertFalse(other.isReady());
        assertThrows(IllegalStateException.class, other::init);
    }

    @Test
    void builderRequiresCollaborators() {
        assertThrows(NullPointerException.class, () -> StorageFacade.builder()
                .transactions(db.transactions)
                .localStore(db.localStore)
                .syncQueueStore(db.queueStore)
                .credentialStore(credentials)
                .build());
    }

    // ── Example scenarios ──────────────────────────────────────────

    @Test
    void offlineItemSyncsAndKeepsItsTemporaryId() {
        InventoryItem item = storage.addInventoryItem(draft("Rice", 10));
        String tempId = item.id().value();
        assertTrue(tempId.startsWith("temp_"));

        DrainResult result = storage.syncNow();

        assertEquals(1, result.succeeded());
        InventoryItem synced = storage.findInventoryItemByTempId(tempId).orElseThrow();
        assertInstanceOf(Identifier.Persistent.class, synced.id());
        assertEquals(tempId, synced.tempId());
        assertTrue(synced.synced());
        assertEquals(10, remote.row("inventory", synced.id().value()).get("quantity"));
    }

    @Test
    void saleReferencingUnsyncedItemWaitsForIt() {
        InventoryItem item = storage.addInventoryItem(draft("Rice", 10));
        storage.processSale(SaleDraft.of("user-1", "store-1"), List.of(line(item, 3)));
        remote.failAlways("inventory");

        DrainResult first = storage.syncNow();

        assertEquals(2, first.failed());
        SyncQueueEntry saleEntry = pendingFor("sales");
        assertEquals(1, saleEntry.attempts());
        assertTrue(saleEntry.errorMessage().contains("Unresolvable reference"));

        remote.recover("inventory");
        DrainResult second = storage.syncNow();

        assertEquals(2, second.succeeded());
        InventoryItem synced = storage.getInventoryItem(item.id()).orElseThrow();
        assertEquals(7, remote.row("inventory", synced.id().value()).get("quantity"));
        assertTrue(storage.getPendingSyncOperations().isEmpty());
    }

    @Test
    void oversizedSaleChangesNothing() {
        InventoryItem item = storage.addInventoryItem(draft("Rice", 10));
        int queuedBefore = storage.getPendingSyncOperations().size();

        InsufficientStockException e = assertThrows(InsufficientStockException.class, () ->
                storage.processSale(SaleDraft.of("user-1", "store-1"), List.of(line(item, 15))));

        assertTrue(e.getMessage().startsWith("Insufficient stock"));
        assertTrue(storage.getSales(AccessScope.individual("user-1"), 0).isEmpty());
        assertEquals(10, storage.getInventoryItem(item.id()).orElseThrow().quantity());
        assertEquals(queuedBefore, storage.getPendingSyncOperations().size());
        assertEquals(0, rowCount("sale_items"));
    }

    @Test
    void alwaysFailingEntryEndsUpFailedAndCanBeCleared() {
        storage.addInventoryItem(draft("Rice", 10));
        remote.failAlways("inventory");
        for (int i = 0; i < 3; i++) {
            storage.syncNow();
        }

        SyncStats stats = storage.getSyncStats();
        assertEquals(1, stats.failedOperations());
        assertEquals(0, stats.retryableOperations());
        assertEquals(1, stats.pendingOperations());
        assertFalse(stats.isProcessing());

        assertEquals(1, storage.clearFailedOperations());
        assertEquals(0, storage.getSyncStats().pendingOperations());
        assertTrue(storage.getPendingSyncOperations().isEmpty());
    }

    @Test
    void concurrentSalesBothApply() throws Exception {
        StorageFacade patient = facade(new SyncConfig().setSaleLockTimeoutMs(5000), false);
        try {
            InventoryItem item = patient.addInventoryItem(draft("Rice", 10));
            CountDownLatch start = new CountDownLatch(1);
            Callable<SaleReceipt> sale = () -> {
                start.await();
                return patient.processSale(SaleDraft.of("user-1", "store-1"), List.of(line(item, 2)));
            };
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                Future<SaleReceipt> first = executor.submit(sale);
                Future<SaleReceipt> second = executor.submit(sale);
                start.countDown();

                assertFalse(first.get(5, TimeUnit.SECONDS).duplicate());
                assertFalse(second.get(5, TimeUnit.SECONDS).duplicate());
            } finally {
                executor.shutdownNow();
            }

            assertEquals(6, patient.getInventoryItem(item.id()).orElseThrow().quantity());
            assertEquals(2, patient.getSales(AccessScope.individual("user-1"), 0).size());
        } finally {
            patient.close();
        }
    }

    // ── Inventory queue folding ────────────────────────────────────

    @Test
    void editBeforeFirstSyncFoldsIntoTheInsert() {
        InventoryItem item = storage.addInventoryItem(draft("Rice", 10));

        storage.updateInventoryItem(item.id(), new InventoryChanges("Basmati", null, null, 12, null, null));

        List<SyncQueueEntry> pending = storage.getPendingSyncOperations();
        assertEquals(1, pending.size());
        assertEquals(SyncOperation.INSERT, pending.get(0).operation());
        SyncPayload.InventoryCreated created = assertInstanceOf(SyncPayload.InventoryCreated.class,
                storage.payloadCodec().decode(pending.get(0).data()));
        assertEquals("Basmati", created.item().name());
        assertEquals(12, created.item().quantity());

        storage.syncNow();

        assertEquals(1, remote.insertCount("inventory"));
        String remoteId = storage.getInventoryItem(item.id()).orElseThrow().id().value();
        assertEquals("Basmati", remote.row("inventory", remoteId).get("name"));
        assertEquals(12, remote.row("inventory", remoteId).get("quantity"));
    }

    @Test
    void editsAfterSyncMergeIntoOneUpdate() {
        InventoryItem item = storage.addInventoryItem(draft("Rice", 10));
        storage.syncNow();
        Identifier persistent = storage.getInventoryItem(item.id()).orElseThrow().id();

        storage.updateInventoryItem(persistent, InventoryChanges.ofQuantity(8));
        storage.updateInventoryItem(persistent, InventoryChanges.ofPrices(null, new BigDecimal("3.00")));

        List<SyncQueueEntry> pending = storage.getPendingSyncOperations();
        assertEquals(1, pending.size());
        SyncPayload.InventoryUpdated updated = assertInstanceOf(SyncPayload.InventoryUpdated.class,
                storage.payloadCodec().decode(pending.get(0).data()));
        assertEquals(8, updated.changes().quantity());
        assertEquals(0, new BigDecimal("3.00").compareTo(updated.changes().sellingPrice()));
        assertFalse(storage.getInventoryItem(persistent).orElseThrow().synced());

        storage.syncNow();

        assertEquals(8, remote.row("inventory", persistent.value()).get("quantity"));
        assertTrue(storage.getInventoryItem(persistent).orElseThrow().synced());
    }

    @Test
    void emptyChangesLeaveQueueAlone() {
        InventoryItem item = storage.addInventoryItem(draft("Rice", 10));
        storage.syncNow();

        storage.updateInventoryItem(item.id(), new InventoryChanges(null, null, null, null, null, null));

        assertTrue(storage.getPendingSyncOperations().isEmpty());
    }

    @Test
    void updateOfUnknownItemIsEmpty() {
        assertTrue(storage.updateInventoryItem(Identifier.parse("nope"), InventoryChanges.ofQuantity(3)).isEmpty());
        assertTrue(storage.getPendingSyncOperations().isEmpty());
    }

    @Test
    void deletingUnsyncedItemJustCancelsItsInsert() {
        InventoryItem item = storage.addInventoryItem(draft("Rice", 10));

        assertTrue(storage.deleteInventoryItem(item.id()));

        assertTrue(storage.getPendingSyncOperations().isEmpty());
        assertTrue(storage.getInventoryItem(item.id()).isEmpty());
        storage.syncNow();
        assertTrue(remote.rows("inventory").isEmpty());
    }

    @Test
    void deletingSyncedItemDeletesRemotely() {
        InventoryItem item = storage.addInventoryItem(draft("Rice", 10));
        storage.syncNow();
        Identifier persistent = storage.getInventoryItem(item.id()).orElseThrow().id();
        storage.updateInventoryItem(persistent, InventoryChanges.ofQuantity(4));

        assertTrue(storage.deleteInventoryItem(persistent));

        List<SyncQueueEntry> pending = storage.getPendingSyncOperations();
        assertEquals(1, pending.size());
        assertEquals(SyncOperation.DELETE, pending.get(0).operation());
        storage.syncNow();
        assertTrue(remote.rows("inventory").isEmpty());
    }

    @Test
    void itemWithUnsyncedSaleCannotBeDeleted() {
        InventoryItem item = storage.addInventoryItem(draft("Rice", 10));
        storage.processSale(SaleDraft.of("user-1", "store-1"), List.of(line(item, 1)));

        assertThrows(ReferencedRecordException.class, () -> storage.deleteInventoryItem(item.id()));
        assertTrue(storage.getInventoryItem(item.id()).isPresent());
    }

    @Test
    void cachedRemoteItemIsNotQueued() {
        InventoryItem fromRemote = new InventoryItem(Identifier.parse("srv-9"), null, "user-1", "store-1", "Oil",
                null, null, 4, null, null, true, false, null, null);

        storage.upsertInventoryItem(fromRemote);

        assertEquals("Oil", storage.getInventoryItem(Identifier.parse("srv-9")).orElseThrow().name());
        assertTrue(storage.getPendingSyncOperations().isEmpty());
    }

    @Test
    void stockValidationSeesCurrentQuantities() {
        InventoryItem item = storage.addInventoryItem(draft("Rice", 2));

        storage.validateStockAvailability(List.of(line(item, 2)));
        assertThrows(InsufficientStockException.class,
                () -> storage.validateStockAvailability(List.of(line(item, 1), line(item, 2))));
    }

    // ── Sales, expenses, profiles ──────────────────────────────────

    @Test
    void syncedSaleIsFoundUnderItsTemporaryId() {
        InventoryItem item = storage.addInventoryItem(draft("Rice", 10));
        SaleReceipt receipt = storage.processSale(SaleDraft.of("user-1", "store-1"), List.of(line(item, 2), line(item, 1)));

        storage.syncNow();

        SaleReceipt stored = storage.getSale(receipt.sale().id()).orElseThrow();
        assertInstanceOf(Identifier.Persistent.class, stored.sale().id());
        assertTrue(stored.sale().synced());
        assertEquals(2, stored.lines().size());
        assertTrue(stored.lines().get(0).id().startsWith(stored.sale().id().value() + "_item_"));
        assertEquals(2, remote.rows("sale_items").size());
    }

    @Test
    void expenseLifecycle() {
        ExpenseRecord expense = storage.addExpense(new ExpenseDraft(null, "user-1", "store-1", "utilities", "Power bill",
                new BigDecimal("45.10"), LocalDate.of(2024, 3, 5), "Grid Co", "cash"));
        assertInstanceOf(Identifier.Temporary.class, expense.id());

        storage.syncNow();

        List<ExpenseRecord> expenses = storage.getExpenses(AccessScope.individual("user-1"));
        assertEquals(1, expenses.size());
        Identifier persistent = expenses.get(0).id();
        assertInstanceOf(Identifier.Persistent.class, persistent);
        assertEquals(1, remote.rows("expenses").size());

        assertTrue(storage.deleteExpense(persistent));
        storage.syncNow();

        assertTrue(remote.rows("expenses").isEmpty());
        assertFalse(storage.deleteExpense(persistent));
    }

    @Test
    void deletingUnsyncedExpenseCancelsItsInsert() {
        ExpenseRecord expense = storage.addExpense(new ExpenseDraft(null, "user-1", null, null, null,
                new BigDecimal("5.00"), null, null, null));

        assertTrue(storage.deleteExpense(expense.id()));

        assertTrue(storage.getPendingSyncOperations().isEmpty());
    }

    @Test
    void profileSyncsByUserId() {
        storage.storeUserProfile(UserProfile.of("user-1", UserRole.OWNER, "store-1"));
        storage.storeUserProfile(UserProfile.of("user-1", UserRole.OWNER, "store-2"));

        assertEquals(1, storage.getPendingSyncOperations().size());
        storage.syncNow();

        List<Map<String, Object>> rows = remote.rows("profiles");
        assertEquals(1, rows.size());
        assertEquals("store-2", rows.get(0).get("store_id"));
        assertEquals("owner", rows.get(0).get("role"));
        assertTrue(storage.getUserProfile("user-1").orElseThrow().synced());
    }

    @Test
    void storeScopeSeesEveryMembersRecords() {
        storage.addInventoryItem(draft("Rice", 10));
        storage.addInventoryItem(new InventoryDraft("user-2", "store-1", "Salt", null, null, 3, null, null));
        storage.addInventoryItem(new InventoryDraft("user-3", "store-9", "Oil", null, null, 3, null, null));

        assertEquals(2, storage.getInventory(new AccessScope("user-1", UserRole.WORKER, "store-1")).size());
        assertEquals(1, storage.getInventory(AccessScope.individual("user-1")).size());
    }

    // ── Offline behavior ───────────────────────────────────────────

    @Test
    void syncNowWhileOfflineTouchesNothing() {
        storage.addInventoryItem(draft("Rice", 10));
        connectivity.setOnline(false);

        DrainResult result = storage.syncNow();

        assertEquals(0, result.processed());
        assertEquals("offline", result.errors().get(0).message());
        assertEquals(1, storage.getSyncStats().retryableOperations());
        assertTrue(remote.rows("inventory").isEmpty());
    }

    @Test
    void backgroundSyncDrainsAfterWrite() throws Exception {
        StorageFacade background = facade(new SyncConfig(), true);
        try {
            background.init();
            background.addInventoryItem(draft("Rice", 10));

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (remote.rows("inventory").isEmpty() && System.nanoTime() < deadline) {
                Thread.sleep(20);
            }

            assertEquals(1, remote.rows("inventory").size());
        } finally {
            background.close();
        }
    }

    // ── Secure storage and maintenance ─────────────────────────────

    @Test
    void secureItemsRoundTripAndAuthDataIsCleared() {
        storage.setSecureItem(StorageFacade.USER_SESSION_KEY, "session-token");
        storage.setSecureItem("theme", "dark");

        assertEquals("session-token", storage.getSecureItem(StorageFacade.USER_SESSION_KEY).orElseThrow());

        storage.clearAuthData();

        assertTrue(storage.getSecureItem(StorageFacade.USER_SESSION_KEY).isEmpty());
        assertEquals("dark", storage.getSecureItem("theme").orElseThrow());
        storage.removeSecureItem("theme");
        assertTrue(storage.getSecureItem("theme").isEmpty());
    }

    @Test
    void clearAllAppDataKeepsSession() {
        storage.addInventoryItem(draft("Rice", 10));
        storage.setSecureItem(StorageFacade.USER_TOKENS_KEY, "tokens");

        storage.clearAllAppData();

        assertTrue(storage.getInventory(AccessScope.individual("user-1")).isEmpty());
        assertTrue(storage.getPendingSyncOperations().isEmpty());
        assertEquals("tokens", storage.getSecureItem(StorageFacade.USER_TOKENS_KEY).orElseThrow());
    }

    @Test
    void clearAllDataAlsoDropsSession() {
        storage.addInventoryItem(draft("Rice", 10));
        storage.setSecureItem(StorageFacade.USER_TOKENS_KEY, "tokens");

        storage.clearAllData();

        assertTrue(storage.getInventory(AccessScope.individual("user-1")).isEmpty());
        assertTrue(storage.getSecureItem(StorageFacade.USER_TOKENS_KEY).isEmpty());
    }

    @Test
    void storageStatsCountRowsAndQueue() {
        InventoryItem item = storage.addInventoryItem(draft("Rice", 10));
        storage.processSale(SaleDraft.of("user-1", "store-1"), List.of(line(item, 1)));

        StorageStats stats = storage.getStorageStats();

        assertEquals(2, stats.pendingSyncOperations());
        assertEquals(0, stats.exhaustedSyncOperations());
        List<String> unsyncedTables = new ArrayList<>();
        for (TableStats table : stats.tables()) {
            if (table.unsynced() > 0) {
                unsyncedTables.add(table.table());
            }
        }
        assertEquals(List.of("sale_items", "sales", "inventory"), unsyncedTables);
    }

    @Test
    void arbitraryPayloadCanBeQueued() {
        SyncQueueEntry entry = storage.addToSyncQueue("exp-77",
                new SyncPayload.ExpenseDeleted(Identifier.parse("exp-77")));

        assertEquals("expenses:DELETE:exp-77", entry.operationKey());
        assertEquals(1, storage.getPendingSyncOperations().size());
    }

    private StorageFacade facade(SyncConfig config, boolean backgroundSync) {
        return StorageFacade.builder()
                .transactions(db.transactions)
                .localStore(db.localStore)
                .syncQueueStore(db.queueStore)
                .remoteBackend(remote)
                .credentialStore(credentials)
                .connectivity(connectivity)
                .config(config)
                .backgroundSync(backgroundSync)
                .build();
    }

    private SyncQueueEntry pendingFor(String table) {
        return storage.getPendingSyncOperations().stream()
                .filter(e -> e.tableName().equals(table))
                .findFirst()
                .orElseThrow();
    }

    private int rowCount(String table) {
        return db.transactions.inTransaction(conn -> db.localStore.count(conn, table, Map.of()));
    }

    private static InventoryDraft draft(String name, int quantity) {
        return new InventoryDraft("user-1", "store-1", name, "SKU-" + name, "grocery", quantity,
                new BigDecimal("1.00"), new BigDecimal("2.00"));
    }

    private static SaleLine line(InventoryItem item, int quantity) {
        return new SaleLine(item.id(), item.name(), quantity, new BigDecimal("2.00"));
    }
}
