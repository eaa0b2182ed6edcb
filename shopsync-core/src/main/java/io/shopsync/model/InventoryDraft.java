package io.shopsync.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Caller-supplied fields for a new inventory item. Identifier and sync flags are assigned
 * by the repository.
 */
public record InventoryDraft(
        String userId,
        String storeId,
        String name,
        String sku,
        String category,
        int quantity,
        BigDecimal costPrice,
        BigDecimal sellingPrice) {

    public InventoryDraft {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (quantity < 0) {
            throw new IllegalArgumentException("quantity must be >= 0");
        }
    }
}
