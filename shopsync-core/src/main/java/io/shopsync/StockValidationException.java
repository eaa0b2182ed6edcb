package io.shopsync;

/**
 * Base type for stock checks that reject a sale before anything is written locally.
 * These failures are never enqueued for sync.
 *
 * @see InsufficientStockException
 * @see InventoryItemNotFoundException
 */
public abstract class StockValidationException extends RuntimeException {
    private final String inventoryId;

    protected StockValidationException(String inventoryId, String message) {
        super(message);
        this.inventoryId = inventoryId;
    }

    /**
     * Returns the inventory id the failing line referenced.
     *
     * @return the inventory id
     */
    public String inventoryId() {
        return inventoryId;
    }
}
