package io.shopsync;

/**
 * A sale line asks for more units than the inventory row holds.
 */
public final class InsufficientStockException extends StockValidationException {
    private final int available;
    private final int requested;

    public InsufficientStockException(String inventoryId, String itemName, int available, int requested) {
        super(inventoryId, "Insufficient stock for " + itemName
                + ". Available: " + available + ", Requested: " + requested);
        this.available = available;
        this.requested = requested;
    }

    public int available() {
        return available;
    }

    public int requested() {
        return requested;
    }
}
