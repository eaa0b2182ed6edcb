package io.shopsync.storage;

import io.shopsync.Identifier;
import io.shopsync.SyncConfig;
import io.shopsync.dispatch.BackoffScheduleRetryPolicy;
import io.shopsync.dispatch.DrainResult;
import io.shopsync.dispatch.SyncDispatcher;
import io.shopsync.dispatch.SyncError;
import io.shopsync.dispatch.SyncStats;
import io.shopsync.dispatch.handler.SyncHandlers;
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
import io.shopsync.queue.MalformedPayloadException;
import io.shopsync.queue.PayloadCodec;
import io.shopsync.queue.SyncPayload;
import io.shopsync.queue.SyncQueue;
import io.shopsync.registry.DefaultHandlerRegistry;
import io.shopsync.registry.HandlerRegistry;
import io.shopsync.repository.ExpenseRepository;
import io.shopsync.repository.RecordRepository;
import io.shopsync.repository.Tables;
import io.shopsync.scheduler.SyncScheduler;
import io.shopsync.spi.ConnectivityMonitor;
import io.shopsync.spi.CredentialStore;
import io.shopsync.spi.LocalStore;
import io.shopsync.spi.LocalTransactions;
import io.shopsync.spi.MetricsExporter;
import io.shopsync.spi.RemoteBackend;
import io.shopsync.spi.SyncQueueStore;

import java.sql.Connection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single entry point of the data layer, owned by the application's composition root.
 *
 * <p>Every local mutation and its sync queue entry are written in one local transaction.
 * Records created offline get temporary identifiers; the {@link SyncDispatcher} later
 * replays the queue against the remote backend and swaps them for persistent ones. With
 * background sync enabled a {@link SyncScheduler} drains the queue whenever the device is
 * online; otherwise callers drain explicitly with {@link #syncNow()}.
 *
 * <p>{@link #init()} is idempotent and runs lazily on first use: it creates the local schema,
 * then initializes the credential store, then starts the scheduler.
 *
 * <pre>{@code
 * StorageFacade storage = StorageFacade.builder()
 *     .transactions(txManager)
 *     .localStore(new JdbcLocalStore())
 *     .syncQueueStore(new JdbcSyncQueueStore())
 *     .remoteBackend(remote)
 *     .credentialStore(credentials)
 *     .connectivity(monitor)
 *     .build();
 *
 * InventoryItem item = storage.addInventoryItem(draft);
 * }</pre>
 *
 * @see StorageFacade.Builder
 */
public final class StorageFacade implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(StorageFacade.class.getName());

    public static final String USER_SESSION_KEY = "user_session";
    public static final String USER_TOKENS_KEY = "user_tokens";
    public static final String CACHED_USER_SESSION_KEY = "cached_user_session";

    /**
     * Credential keys removed by {@link #clearAuthData()}.
     */
    public static final List<String> AUTH_KEYS = List.of(USER_SESSION_KEY, USER_TOKENS_KEY, CACHED_USER_SESSION_KEY);

    private final LocalTransactions transactions;
    private final LocalStore localStore;
    private final CredentialStore credentialStore;
    private final ConnectivityMonitor connectivity;
    private final RecordRepository records;
    private final SyncQueue syncQueue;
    private final SyncDispatcher dispatcher;
    private final SyncScheduler scheduler;

    private volatile boolean ready;
    private volatile boolean closed;

    private StorageFacade(Builder builder) {
        this.transactions = Objects.requireNonNull(builder.transactions, "transactions");
        this.localStore = Objects.requireNonNull(builder.localStore, "localStore");
        SyncQueueStore syncQueueStore = Objects.requireNonNull(builder.syncQueueStore, "syncQueueStore");
        RemoteBackend remoteBackend = Objects.requireNonNull(builder.remoteBackend, "remoteBackend");
        this.credentialStore = Objects.requireNonNull(builder.credentialStore, "credentialStore");
        this.connectivity = builder.connectivity != null ? builder.connectivity : ConnectivityMonitor.ALWAYS_ONLINE;
        SyncConfig config = builder.config != null ? builder.config : new SyncConfig();
        MetricsExporter metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

        this.records = new RecordRepository(localStore, transactions, config, metrics);
        this.syncQueue = new SyncQueue(transactions, syncQueueStore, builder.codec, config.getMaxAttempts());
        HandlerRegistry registry = builder.handlerRegistry != null
                ? builder.handlerRegistry
                : SyncHandlers.registerDefaults(new DefaultHandlerRegistry(), remoteBackend, transactions, records);
        this.dispatcher = SyncDispatcher.builder()
                .transactions(transactions)
                .syncQueue(syncQueue)
                .records(records)
                .handlerRegistry(registry)
                .retryPolicy(new BackoffScheduleRetryPolicy(config.getRetryScheduleMs()))
                .batchSize(config.getBatchSize())
                .metrics(metrics)
                .build();
        if (builder.backgroundSync) {
            this.scheduler = SyncScheduler.builder()
                    .dispatcher(dispatcher)
                    .connectivity(connectivity)
                    .drainOnReconnect(config.isDrainOnReconnect())
                    .build();
            syncQueue.setEnqueueHook(entry -> scheduler.requestDrain());
        } else {
            this.scheduler = null;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Initializes local storage, then secure storage, then background sync. Subsequent calls
     * are no-ops.
     *
     * @throws IllegalStateException if the facade has been closed
     */
    public synchronized void init() {
        if (closed) {
            throw new IllegalStateException("StorageFacade has been closed");
        }
        if (ready) {
            return;
        }
        transactions.inTransaction(conn -> {
            localStore.initialize(conn);
            return null;
        });
        credentialStore.initialize();
        if (scheduler != null) {
            scheduler.start();
        }
        ready = true;
        logger.info("Local storage initialized");
    }

    public boolean isReady() {
        return ready && !closed;
    }

    private void ensureInitialized() {
        if (!ready) {
            init();
        }
    }

    /**
     * Stores a new inventory item under a temporary id and queues its remote insert.
     */
    public InventoryItem addInventoryItem(InventoryDraft draft) {
        Objects.requireNonNull(draft, "draft");
        ensureInitialized();
        return transactions.inTransaction(conn -> {
            InventoryItem item = records.inventory().insert(conn, draft);
            syncQueue.enqueue(conn, item.id().value(), new SyncPayload.InventoryCreated(item));
            return item;
        });
    }

    /**
     * Caches an item exactly as given, typically one fetched from the remote backend. Nothing
     * is queued.
     */
    public void upsertInventoryItem(InventoryItem item) {
        Objects.requireNonNull(item, "item");
        ensureInitialized();
        transactions.inTransaction(conn -> {
            records.inventory().upsert(conn, item);
            return null;
        });
    }

    public Optional<InventoryItem> getInventoryItem(Identifier id) {
        ensureInitialized();
        return transactions.inTransaction(conn -> records.inventory().find(conn, id));
    }

    /**
     * Finds the item created under {@code tempId}, whether or not it has been resolved since.
     */
    public Optional<InventoryItem> findInventoryItemByTempId(String tempId) {
        ensureInitialized();
        return transactions.inTransaction(conn -> records.inventory().findByTempId(conn, tempId));
    }

    public List<InventoryItem> getInventory(AccessScope scope) {
        Objects.requireNonNull(scope, "scope");
        ensureInitialized();
        return transactions.inTransaction(conn -> records.inventory().list(conn, scope));
    }

    /**
     * Applies {@code changes} locally and queues them for the remote backend.
     *
     * <p>While the item's own insert is still queued the changes are folded into that insert,
     * so the backend receives one create with the edited values.
     *
     * @return the updated item, or empty if no such item exists
     */
    public Optional<InventoryItem> updateInventoryItem(Identifier id, InventoryChanges changes) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(changes, "changes");
        if (!changes.hasChanges()) {
            return getInventoryItem(id);
        }
        ensureInitialized();
        return transactions.inTransaction(conn -> {
            Optional<InventoryItem> updated = records.inventory().update(conn, id, changes);
            updated.ifPresent(item -> enqueueInventoryUpdate(conn, item, changes));
            return updated;
        });
    }

    private void enqueueInventoryUpdate(Connection conn, InventoryItem item, InventoryChanges changes) {
        String recordId = item.id().value();
        if (item.id() instanceof Identifier.Temporary) {
            String insertKey = SyncQueue.operationKey(Tables.INVENTORY, SyncOperation.INSERT, recordId);
            Optional<SyncPayload> pendingInsert = pendingPayload(conn, insertKey);
            if (pendingInsert.isPresent() && pendingInsert.get() instanceof SyncPayload.InventoryCreated created) {
                InventoryItem merged = created.item().applying(changes, item.updatedAt());
                syncQueue.enqueue(conn, insertKey, recordId, new SyncPayload.InventoryCreated(merged));
                return;
            }
        }
        String updateKey = SyncQueue.operationKey(Tables.INVENTORY, SyncOperation.UPDATE, recordId);
        InventoryChanges merged = changes;
        Optional<SyncPayload> pendingUpdate = pendingPayload(conn, updateKey);
        if (pendingUpdate.isPresent() && pendingUpdate.get() instanceof SyncPayload.InventoryUpdated previous) {
            merged = previous.changes().mergedWith(changes);
        }
        syncQueue.enqueue(conn, updateKey, recordId, new SyncPayload.InventoryUpdated(item.id(), merged));
    }

    private Optional<SyncPayload> pendingPayload(Connection conn, String operationKey) {
        Optional<SyncQueueEntry> pending = syncQueue.findPending(conn, operationKey);
        if (pending.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(syncQueue.decode(pending.get()));
        } catch (MalformedPayloadException e) {
            logger.log(Level.WARNING, "Ignoring undecodable pending operation " + operationKey, e);
            return Optional.empty();
        }
    }

    /**
     * Deletes an item locally and queues the remote delete. An item whose insert has not synced
     * yet only has that insert cancelled.
     *
     * @return {@code false} if no such item exists
     * @throws io.shopsync.ReferencedRecordException if unsynced sale line items reference it
     */
    public boolean deleteInventoryItem(Identifier id) {
        Objects.requireNonNull(id, "id");
        ensureInitialized();
        return transactions.inTransaction(conn -> {
            Optional<InventoryItem> deleted = records.inventory().delete(conn, id);
            if (deleted.isEmpty()) {
                return false;
            }
            Identifier itemId = deleted.get().id();
            syncQueue.cancel(conn, SyncQueue.operationKey(Tables.INVENTORY, SyncOperation.UPDATE, itemId.value()));
            if (itemId instanceof Identifier.Temporary
                    && syncQueue.cancel(conn, SyncQueue.operationKey(Tables.INVENTORY, SyncOperation.INSERT, itemId.value()))) {
                return true;
            }
            syncQueue.enqueue(conn, itemId.value(), new SyncPayload.InventoryDeleted(itemId));
            return true;
        });
    }

    /**
     * Checks that the lines can be sold from current stock.
     *
     * @throws io.shopsync.StockValidationException if an item is missing or short
     */
    public void validateStockAvailability(List<SaleLine> lines) {
        Objects.requireNonNull(lines, "lines");
        ensureInitialized();
        transactions.inTransaction(conn -> records.inventory().validateStock(conn, lines));
    }

    /**
     * Records a sale with its line items and stock decrements, and queues it for sync, all in
     * one local transaction.
     *
     * @throws io.shopsync.SaleBusyException        if another sale holds the sale lock too long
     * @throws io.shopsync.StockValidationException if stock validation fails
     */
    public SaleReceipt processSale(SaleDraft draft, List<SaleLine> lines) {
        ensureInitialized();
        return records.sales().processSale(draft, lines, (conn, receipt) ->
                syncQueue.enqueue(conn, receipt.sale().id().value(),
                        new SyncPayload.SaleCreated(receipt.sale(), receipt.lines())));
    }

    public Optional<SaleReceipt> getSale(Identifier id) {
        ensureInitialized();
        return transactions.inTransaction(conn -> records.sales().find(conn, id)
                .map(sale -> new SaleReceipt(sale, records.sales().lines(conn, sale.id().value()), false)));
    }

    /**
     * @param limit max sales, or {@code 0} for all
     */
    public List<SaleReceipt> getSales(AccessScope scope, int limit) {
        Objects.requireNonNull(scope, "scope");
        ensureInitialized();
        return transactions.inTransaction(conn -> records.sales().list(conn, scope, limit));
    }

    /**
     * Stores an expense and queues its remote insert. If the draft carries the id of an
     * existing expense, that expense is returned and nothing is queued.
     */
    public ExpenseRecord addExpense(ExpenseDraft draft) {
        Objects.requireNonNull(draft, "draft");
        ensureInitialized();
        return transactions.inTransaction(conn -> {
            ExpenseRepository.AddResult result = records.expenses().add(conn, draft);
            if (result.created()) {
                syncQueue.enqueue(conn, result.expense().id().value(), new SyncPayload.ExpenseCreated(result.expense()));
            }
            return result.expense();
        });
    }

    public List<ExpenseRecord> getExpenses(AccessScope scope) {
        Objects.requireNonNull(scope, "scope");
        ensureInitialized();
        return transactions.inTransaction(conn -> records.expenses().list(conn, scope));
    }

    /**
     * @return {@code false} if no such expense exists
     */
    public boolean deleteExpense(Identifier id) {
        Objects.requireNonNull(id, "id");
        ensureInitialized();
        return transactions.inTransaction(conn -> {
            Optional<ExpenseRecord> deleted = records.expenses().delete(conn, id);
            if (deleted.isEmpty()) {
                return false;
            }
            Identifier expenseId = deleted.get().id();
            if (expenseId instanceof Identifier.Temporary
                    && syncQueue.cancel(conn, SyncQueue.operationKey(Tables.EXPENSES, SyncOperation.INSERT, expenseId.value()))) {
                return true;
            }
            syncQueue.enqueue(conn, expenseId.value(), new SyncPayload.ExpenseDeleted(expenseId));
            return true;
        });
    }

    /**
     * Stores the profile, replacing any previous one for the same user, and queues the remote
     * upsert.
     */
    public UserProfile storeUserProfile(UserProfile profile) {
        Objects.requireNonNull(profile, "profile");
        ensureInitialized();
        return transactions.inTransaction(conn -> {
            UserProfile stored = records.profiles().upsert(conn, profile);
            syncQueue.enqueue(conn, stored.userId(), new SyncPayload.ProfileUpserted(stored));
            return stored;
        });
    }

    public Optional<UserProfile> getUserProfile(String userId) {
        Objects.requireNonNull(userId, "userId");
        ensureInitialized();
        return transactions.inTransaction(conn -> records.profiles().find(conn, userId));
    }

    public void setSecureItem(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        ensureInitialized();
        credentialStore.put(key, value);
    }

    public Optional<String> getSecureItem(String key) {
        Objects.requireNonNull(key, "key");
        ensureInitialized();
        return credentialStore.get(key);
    }

    public void removeSecureItem(String key) {
        Objects.requireNonNull(key, "key");
        ensureInitialized();
        credentialStore.remove(key);
    }

    /**
     * Removes the session and token entries listed in {@link #AUTH_KEYS}.
     */
    public void clearAuthData() {
        ensureInitialized();
        for (String key : AUTH_KEYS) {
            credentialStore.remove(key);
        }
    }

    /**
     * Queues an arbitrary payload under the key derived from its table, operation and
     * {@code recordId}.
     */
    public SyncQueueEntry addToSyncQueue(String recordId, SyncPayload payload) {
        Objects.requireNonNull(recordId, "recordId");
        Objects.requireNonNull(payload, "payload");
        ensureInitialized();
        return transactions.inTransaction(conn -> syncQueue.enqueue(conn, recordId, payload));
    }

    /**
     * Returns every uncompleted queue entry, exhausted ones included, oldest first.
     */
    public List<SyncQueueEntry> getPendingSyncOperations() {
        ensureInitialized();
        return syncQueue.pending(0);
    }

    /**
     * Drains one batch right away. Returns without touching the queue while offline.
     */
    public DrainResult syncNow() {
        ensureInitialized();
        if (!connectivity.isOnline()) {
            return new DrainResult(0, 0, 0, List.of(new SyncError("dispatcher", "offline")), false, null);
        }
        return dispatcher.drain();
    }

    public SyncStats getSyncStats() {
        ensureInitialized();
        return dispatcher.stats();
    }

    /**
     * Marks exhausted queue entries completed without replaying them.
     *
     * @return entries cleared
     */
    public int clearFailedOperations() {
        ensureInitialized();
        return dispatcher.clearFailedOperations();
    }

    public PayloadCodec payloadCodec() {
        return syncQueue.codec();
    }

    public StorageStats getStorageStats() {
        ensureInitialized();
        return transactions.inTransaction(conn -> new StorageStats(records.stats(conn),
                syncQueue.countPending(), syncQueue.countExhausted()));
    }

    /**
     * Deletes every local record and sync queue entry. Secure storage is kept.
     */
    public void clearAllAppData() {
        ensureInitialized();
        int removed = transactions.inTransaction(conn -> records.clearAll(conn) + syncQueue.clear(conn));
        logger.log(Level.INFO, "Cleared all application data ({0} rows)", removed);
    }

    /**
     * Deletes all application data and the stored session.
     */
    public void clearAllData() {
        clearAllAppData();
        clearAuthData();
    }

    /**
     * Stops background sync. Local data stays on disk.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        if (scheduler != null) {
            scheduler.close();
        }
    }

    /**
     * Builder for {@link StorageFacade}.
     */
    public static final class Builder {
        private LocalTransactions transactions;
        private LocalStore localStore;
        private SyncQueueStore syncQueueStore;
        private RemoteBackend remoteBackend;
        private CredentialStore credentialStore;
        private ConnectivityMonitor connectivity;
        private SyncConfig config;
        private MetricsExporter metrics;
        private PayloadCodec codec;
        private HandlerRegistry handlerRegistry;
        private boolean backgroundSync = true;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         *
         * @param transactions local transaction scope
         * @return this builder
         */
        public Builder transactions(LocalTransactions transactions) {
            this.transactions = transactions;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param localStore record table access
         * @return this builder
         */
        public Builder localStore(LocalStore localStore) {
            this.localStore = localStore;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param syncQueueStore sync queue persistence
         * @return this builder
         */
        public Builder syncQueueStore(SyncQueueStore syncQueueStore) {
            this.syncQueueStore = syncQueueStore;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param remoteBackend the authoritative remote store
         * @return this builder
         */
        public Builder remoteBackend(RemoteBackend remoteBackend) {
            this.remoteBackend = remoteBackend;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param credentialStore secure key/value storage
         * @return this builder
         */
        public Builder credentialStore(CredentialStore credentialStore) {
            this.credentialStore = credentialStore;
            return this;
        }

        /**
         * Optional. Defaults to {@link ConnectivityMonitor#ALWAYS_ONLINE}.
         *
         * @param connectivity the connectivity monitor
         * @return this builder
         */
        public Builder connectivity(ConnectivityMonitor connectivity) {
            this.connectivity = connectivity;
            return this;
        }

        /**
         * Optional. Defaults to {@code new SyncConfig()}.
         *
         * @param config sync settings
         * @return this builder
         */
        public Builder config(SyncConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Optional. Defaults to {@link PayloadCodec#getDefault()}.
         *
         * @param codec the payload codec
         * @return this builder
         */
        public Builder codec(PayloadCodec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Replaces the built-in handlers.
         *
         * <p>Optional. Defaults to {@link SyncHandlers#registerDefaults} over the remote backend.
         *
         * @param handlerRegistry the handler registry
         * @return this builder
         */
        public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
            this.handlerRegistry = handlerRegistry;
            return this;
        }

        /**
         * Sets whether a {@link SyncScheduler} drains the queue in the background.
         *
         * <p>Optional. Defaults to {@code true}. When disabled, call {@link StorageFacade#syncNow()}.
         *
         * @param backgroundSync run background drains
         * @return this builder
         */
        public Builder backgroundSync(boolean backgroundSync) {
            this.backgroundSync = backgroundSync;
            return this;
        }

        /**
         * @return a new {@link StorageFacade}; call {@link StorageFacade#init()} or just use it
         * @throws NullPointerException if a required collaborator is missing
         */
        public StorageFacade build() {
            return new StorageFacade(this);
        }
    }
}
