package io.shopsync.model;

import io.shopsync.Identifier;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Line item owned by a sale. The id is derived from the sale id and the line position.
 */
public record SaleLineItem(
        String id,
        Identifier saleId,
        Identifier inventoryId,
        String userId,
        String itemName,
        int quantity,
        BigDecimal unitPrice,
        BigDecimal lineTotal,
        boolean synced,
        Instant createdAt,
        Instant updatedAt) {

    /**
     * Returns the deterministic line item id {@code <saleId>_item_<index>}.
     */
    public static String lineItemId(String saleId, int index) {
        return saleId + "_item_" + index;
    }
}
