package io.shopsync.dispatch.handler;

import io.shopsync.model.SyncOperation;
import io.shopsync.registry.DefaultHandlerRegistry;
import io.shopsync.repository.RecordRepository;
import io.shopsync.repository.Tables;
import io.shopsync.spi.LocalTransactions;
import io.shopsync.spi.RemoteBackend;

/**
 * Factory for the built-in handlers.
 */
public final class SyncHandlers {

    /**
     * Registers the handlers for every table and operation the record repository enqueues:
     * {@code inventory} insert/update/delete, {@code sales} insert, {@code expenses}
     * insert/delete and {@code user_profiles} insert/update.
     *
     * @return {@code registry}, for chaining
     */
    public static DefaultHandlerRegistry registerDefaults(DefaultHandlerRegistry registry, RemoteBackend remote,
                                                          LocalTransactions transactions, RecordRepository records) {
        LocalIdentifiers identifiers = new LocalIdentifiers(transactions, records);
        InventorySyncHandler inventory = new InventorySyncHandler(remote, identifiers);
        ExpenseSyncHandler expenses = new ExpenseSyncHandler(remote, identifiers);
        ProfileSyncHandler profiles = new ProfileSyncHandler(remote, identifiers);
        return registry
                .register(Tables.INVENTORY, SyncOperation.INSERT, inventory)
                .register(Tables.INVENTORY, SyncOperation.UPDATE, inventory)
                .register(Tables.INVENTORY, SyncOperation.DELETE, inventory)
                .register(Tables.SALES, SyncOperation.INSERT, new SaleSyncHandler(remote, identifiers))
                .register(Tables.EXPENSES, SyncOperation.INSERT, expenses)
                .register(Tables.EXPENSES, SyncOperation.DELETE, expenses)
                .register(Tables.USER_PROFILES, SyncOperation.INSERT, profiles)
                .register(Tables.USER_PROFILES, SyncOperation.UPDATE, profiles);
    }

    private SyncHandlers() {}
}
