package io.shopsync.repository;

import io.shopsync.Identifier;
import io.shopsync.InsufficientStockException;
import io.shopsync.InventoryItemNotFoundException;
import io.shopsync.ReferencedRecordException;
import io.shopsync.model.AccessScope;
import io.shopsync.model.IdResolution;
import io.shopsync.model.InventoryChanges;
import io.shopsync.model.InventoryDraft;
import io.shopsync.model.InventoryItem;
import io.shopsync.model.SaleLine;
import io.shopsync.spi.LocalStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Local persistence of inventory items.
 *
 * <p>Lookups by {@link Identifier} accept either the current id or, for items already
 * resolved, the temporary id the item was created with.
 */
public final class InventoryRepository {
    private final LocalStore store;

    public InventoryRepository(LocalStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Inserts a new item under a freshly minted temporary id, flagged offline and unsynced.
     */
    public InventoryItem insert(Connection conn, InventoryDraft draft) {
        Identifier.Temporary id = Identifier.mintTemporary();
        Instant now = Instant.now();
        InventoryItem item = new InventoryItem(id, id.value(), draft.userId(), draft.storeId(),
                draft.name(), draft.sku(), draft.category(), draft.quantity(),
                draft.costPrice(), draft.sellingPrice(), false, true, now, now);
        store.insert(conn, Tables.INVENTORY, RecordMappers.inventoryColumns(item));
        return item;
    }

    /**
     * Inserts or replaces an item keyed by its id, as is. Used to cache records that came
     * from the remote backend.
     */
    public void upsert(Connection conn, InventoryItem item) {
        store.upsert(conn, Tables.INVENTORY, "id", RecordMappers.inventoryColumns(item));
    }

    public Optional<InventoryItem> findById(Connection conn, String id) {
        return store.findById(conn, Tables.INVENTORY, id).map(RecordMappers::inventory);
    }

    /**
     * Finds the item created with {@code tempId}. A {@code null} or empty id matches nothing.
     */
    public Optional<InventoryItem> findByTempId(Connection conn, String tempId) {
        if (tempId == null || tempId.isEmpty()) {
            return Optional.empty();
        }
        return store.findOne(conn, Tables.INVENTORY, Map.of("temp_id", tempId)).map(RecordMappers::inventory);
    }

    public Optional<InventoryItem> find(Connection conn, Identifier id) {
        Optional<InventoryItem> direct = findById(conn, id.value());
        if (direct.isPresent() || !(id instanceof Identifier.Temporary)) {
            return direct;
        }
        return findByTempId(conn, id.value());
    }

    /**
     * Lists the items visible to {@code scope}, newest first.
     */
    public List<InventoryItem> list(Connection conn, AccessScope scope) {
        Map<String, Object> where = new LinkedHashMap<>();
        where.put(scope.filterColumn(), scope.filterValue());
        return store.find(conn, Tables.INVENTORY, where, "created_at DESC, id ASC", 0).stream()
                .map(RecordMappers::inventory)
                .toList();
    }

    /**
     * Applies {@code changes} to the item and marks it unsynced.
     *
     * @return the updated item, or empty if no such item exists
     */
    public Optional<InventoryItem> update(Connection conn, Identifier id, InventoryChanges changes) {
        Optional<InventoryItem> existing = find(conn, id);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        InventoryItem updated = existing.get().applying(changes, Instant.now());
        Map<String, Object> columns = changes.toColumns();
        columns.put("synced", false);
        columns.put("updated_at", updated.updatedAt());
        store.update(conn, Tables.INVENTORY, updated.id().value(), columns);
        return Optional.of(updated);
    }

    /**
     * Deletes the item.
     *
     * @return the deleted item, or empty if no such item exists
     * @throws ReferencedRecordException if unsynced sale line items still reference the item
     */
    public Optional<InventoryItem> delete(Connection conn, Identifier id) {
        Optional<InventoryItem> existing = find(conn, id);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        InventoryItem item = existing.get();
        int references = unsyncedLineReferences(conn, item.id().value());
        if (item.tempId() != null && !item.tempId().equals(item.id().value())) {
            references += unsyncedLineReferences(conn, item.tempId());
        }
        if (references > 0) {
            throw new ReferencedRecordException(Tables.INVENTORY, item.id().value(), references);
        }
        store.delete(conn, Tables.INVENTORY, item.id().value());
        return existing;
    }

    private int unsyncedLineReferences(Connection conn, String inventoryId) {
        Map<String, Object> where = new LinkedHashMap<>();
        where.put("inventory_id", inventoryId);
        where.put("synced", false);
        return store.count(conn, Tables.SALE_ITEMS, where);
    }

    /**
     * Checks that every referenced item exists and holds enough units for the total quantity
     * requested across all lines.
     *
     * @return the referenced items keyed by the identifier used in the lines
     * @throws InventoryItemNotFoundException if a line references a missing item
     * @throws InsufficientStockException     if an item holds fewer units than requested
     */
    public Map<Identifier, InventoryItem> validateStock(Connection conn, List<SaleLine> lines) {
        Map<Identifier, InventoryItem> items = new LinkedHashMap<>();
        Map<String, Integer> requested = new LinkedHashMap<>();
        for (SaleLine line : lines) {
            InventoryItem item = items.get(line.inventoryId());
            if (item == null) {
                item = find(conn, line.inventoryId())
                        .orElseThrow(() -> new InventoryItemNotFoundException(line.inventoryId().value(), line.itemName()));
                items.put(line.inventoryId(), item);
            }
            int total = requested.merge(item.id().value(), line.quantity(), Integer::sum);
            if (item.quantity() < total) {
                throw new InsufficientStockException(item.id().value(), item.name(), item.quantity(), total);
            }
        }
        return items;
    }

    /**
     * Subtracts {@code units} from the item and marks it unsynced.
     *
     * @return the quantity left
     */
    public int decrement(Connection conn, String id, int units) {
        InventoryItem item = findById(conn, id)
                .orElseThrow(() -> new InventoryItemNotFoundException(id, id));
        int remaining = item.quantity() - units;
        if (remaining < 0) {
            throw new InsufficientStockException(id, item.name(), item.quantity(), units);
        }
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("quantity", remaining);
        changes.put("synced", false);
        changes.put("updated_at", Instant.now());
        store.update(conn, Tables.INVENTORY, id, changes);
        return remaining;
    }

    /**
     * Re-keys the item from its temporary id to its persistent id, and repoints line items
     * that still reference the temporary id.
     *
     * @return {@code false} if no row carries the temporary id any more
     */
    public boolean applyResolution(Connection conn, IdResolution resolution) {
        String tempId = resolution.temporary().value();
        String persistentId = resolution.persistent().value();
        if (!store.exists(conn, Tables.INVENTORY, tempId)) {
            return false;
        }
        if (store.exists(conn, Tables.INVENTORY, persistentId)) {
            // the remote row was cached locally first; it takes over the temporary id
            store.delete(conn, Tables.INVENTORY, tempId);
            Map<String, Object> changes = new LinkedHashMap<>();
            changes.put("temp_id", tempId);
            changes.put("is_offline", false);
            changes.put("updated_at", Instant.now());
            store.update(conn, Tables.INVENTORY, persistentId, changes);
        } else {
            Map<String, Object> changes = new LinkedHashMap<>();
            changes.put("id", persistentId);
            changes.put("temp_id", tempId);
            changes.put("is_offline", false);
            changes.put("updated_at", Instant.now());
            store.update(conn, Tables.INVENTORY, tempId, changes);
        }
        store.updateWhere(conn, Tables.SALE_ITEMS, Map.of("inventory_id", tempId), Map.of("inventory_id", persistentId));
        return true;
    }

    public boolean markSynced(Connection conn, String id) {
        return store.update(conn, Tables.INVENTORY, id, Map.of("synced", true, "is_offline", false)) > 0;
    }
}
