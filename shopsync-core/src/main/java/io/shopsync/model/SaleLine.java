package io.shopsync.model;

import io.shopsync.Identifier;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One requested line of a sale: which inventory item, how many, at what price.
 */
public record SaleLine(Identifier inventoryId, String itemName, int quantity, BigDecimal unitPrice) {

    public SaleLine {
        Objects.requireNonNull(inventoryId, "inventoryId");
        Objects.requireNonNull(unitPrice, "unitPrice");
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be > 0");
        }
        itemName = itemName == null ? inventoryId.value() : itemName;
    }

    public BigDecimal lineTotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
