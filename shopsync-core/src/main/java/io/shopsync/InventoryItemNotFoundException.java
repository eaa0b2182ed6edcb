package io.shopsync;

/**
 * A sale line references an inventory row that does not exist locally.
 */
public final class InventoryItemNotFoundException extends StockValidationException {
    public InventoryItemNotFoundException(String inventoryId, String itemName) {
        super(inventoryId, "Item " + itemName + " not found in inventory (id=" + inventoryId + ")");
    }
}
