package io.shopsync.model;

import io.shopsync.Identifier;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Stock item as persisted locally.
 *
 * @param id           current identifier; temporary until the first successful sync
 * @param tempId       the temporary identifier the item was created with, if any
 * @param quantity     units on hand, never negative
 * @param synced       whether the remote backend has the latest local state
 * @param offline      whether the item was created while offline and never confirmed remotely
 */
public record InventoryItem(
        Identifier id,
        String tempId,
        String userId,
        String storeId,
        String name,
        String sku,
        String category,
        int quantity,
        BigDecimal costPrice,
        BigDecimal sellingPrice,
        boolean synced,
        boolean offline,
        Instant createdAt,
        Instant updatedAt) {

    public InventoryItem {
        Objects.requireNonNull(id, "id");
        if (quantity < 0) {
            throw new IllegalArgumentException("quantity must be >= 0 for " + id);
        }
    }

    /**
     * Returns a copy with {@code changes} applied, marked unsynced and stamped with {@code now}.
     */
    public InventoryItem applying(InventoryChanges changes, Instant now) {
        return new InventoryItem(id, tempId, userId, storeId,
                changes.name() != null ? changes.name() : name,
                changes.sku() != null ? changes.sku() : sku,
                changes.category() != null ? changes.category() : category,
                changes.quantity() != null ? changes.quantity() : quantity,
                changes.costPrice() != null ? changes.costPrice() : costPrice,
                changes.sellingPrice() != null ? changes.sellingPrice() : sellingPrice,
                false, offline, createdAt, now);
    }
}
