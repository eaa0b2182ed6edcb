package io.shopsync.repository;

import io.shopsync.Identifier;
import io.shopsync.SyncConfig;
import io.shopsync.model.IdResolution;
import io.shopsync.model.RecordRef;
import io.shopsync.spi.LocalStore;
import io.shopsync.spi.LocalTransactions;
import io.shopsync.spi.MetricsExporter;
import io.shopsync.spi.Row;

import java.sql.Connection;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point to all local record tables.
 *
 * <p>Groups the per-table repositories and adds the cross-table operations the sync
 * dispatcher needs: applying identifier resolutions, marking rows synced and resolving a
 * possibly temporary identifier to its persistent counterpart.
 */
public final class RecordRepository {
    private static final Logger logger = Logger.getLogger(RecordRepository.class.getName());

    private final LocalStore store;
    private final InventoryRepository inventory;
    private final SaleRepository sales;
    private final ExpenseRepository expenses;
    private final ProfileRepository profiles;

    public RecordRepository(LocalStore store, LocalTransactions transactions, SyncConfig config, MetricsExporter metrics) {
        this.store = Objects.requireNonNull(store, "store");
        Objects.requireNonNull(transactions, "transactions");
        SyncConfig settings = config == null ? new SyncConfig() : config;
        this.inventory = new InventoryRepository(store);
        this.sales = new SaleRepository(store, transactions, inventory,
                Duration.ofMillis(settings.getSaleLockTimeoutMs()), metrics);
        this.expenses = new ExpenseRepository(store);
        this.profiles = new ProfileRepository(store);
    }

    public InventoryRepository inventory() {
        return inventory;
    }

    public SaleRepository sales() {
        return sales;
    }

    public ExpenseRepository expenses() {
        return expenses;
    }

    public ProfileRepository profiles() {
        return profiles;
    }

    /**
     * Replaces a temporary identifier with its persistent counterpart in the given table.
     * Applying the same resolution twice is a no-op.
     */
    public void applyResolution(Connection conn, IdResolution resolution) {
        boolean applied = switch (resolution.table()) {
            case Tables.INVENTORY -> inventory.applyResolution(conn, resolution);
            case Tables.SALES -> sales.applyResolution(conn, resolution);
            case Tables.EXPENSES -> expenses.applyResolution(conn, resolution);
            default -> throw new IllegalArgumentException("Table has no temporary ids: " + resolution.table());
        };
        if (applied) {
            logger.log(Level.FINE, "Resolved {0} {1} -> {2}", new Object[] {
                    resolution.table(), resolution.temporary(), resolution.persistent()});
        }
    }

    /**
     * Marks a row synced. Marking a sale also marks its line items.
     *
     * @return {@code false} if the row does not exist
     */
    public boolean markSynced(Connection conn, RecordRef ref) {
        return switch (ref.table()) {
            case Tables.INVENTORY -> inventory.markSynced(conn, ref.id());
            case Tables.SALES -> sales.markSynced(conn, ref.id());
            case Tables.EXPENSES -> expenses.markSynced(conn, ref.id());
            case Tables.USER_PROFILES -> profiles.markSynced(conn, ref.id());
            default -> throw new IllegalArgumentException("Unknown table: " + ref.table());
        };
    }

    /**
     * Returns every id the referenced row is known under: its current id and, when it was
     * created offline, its temporary id. Empty if the row does not exist.
     */
    public Set<String> knownIds(Connection conn, RecordRef ref) {
        Set<String> ids = new LinkedHashSet<>();
        store.findById(conn, ref.table(), ref.id()).ifPresent(row -> {
            ids.add(row.getString("id"));
            String tempId = row.has("temp_id") ? row.getString("temp_id") : null;
            if (tempId != null && !tempId.isEmpty()) {
                ids.add(tempId);
            }
        });
        return ids;
    }

    /**
     * Looks up the row {@code id} refers to, directly or through its temporary id, and returns
     * its persistent id if it already has one.
     */
    public Optional<Identifier.Persistent> resolvePersistent(Connection conn, String table, Identifier id) {
        if (id instanceof Identifier.Persistent persistent) {
            return Optional.of(persistent);
        }
        Optional<Row> row = store.findById(conn, table, id.value());
        if (row.isEmpty()) {
            row = store.findOne(conn, table, Map.of("temp_id", id.value()));
        }
        return row.map(r -> r.getIdentifier("id"))
                .filter(Identifier.Persistent.class::isInstance)
                .map(Identifier.Persistent.class::cast);
    }

    /**
     * Returns total and unsynced row counts for every record table.
     */
    public List<TableStats> stats(Connection conn) {
        List<TableStats> stats = new ArrayList<>();
        for (String table : Tables.DATA_TABLES) {
            int total = store.count(conn, table, Map.of());
            int unsynced = store.count(conn, table, Map.of("synced", false));
            stats.add(new TableStats(table, total, unsynced));
        }
        return stats;
    }

    /**
     * Deletes every record row. The sync queue is left alone.
     */
    public int clearAll(Connection conn) {
        int removed = 0;
        for (String table : Tables.DATA_TABLES) {
            removed += store.clearTable(conn, table);
        }
        return removed;
    }
}
