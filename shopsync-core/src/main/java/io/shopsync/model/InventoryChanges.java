package io.shopsync.model;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial update of an inventory item. {@code null} components are left unchanged.
 */
public record InventoryChanges(
        String name,
        String sku,
        String category,
        Integer quantity,
        BigDecimal costPrice,
        BigDecimal sellingPrice) {

    public InventoryChanges {
        if (quantity != null && quantity < 0) {
            throw new IllegalArgumentException("quantity must be >= 0");
        }
    }

    public static InventoryChanges ofQuantity(int quantity) {
        return new InventoryChanges(null, null, null, quantity, null, null);
    }

    public static InventoryChanges ofPrices(BigDecimal costPrice, BigDecimal sellingPrice) {
        return new InventoryChanges(null, null, null, null, costPrice, sellingPrice);
    }

    /**
     * Returns {@code true} if at least one component is set.
     */
    public boolean hasChanges() {
        return name != null || sku != null || category != null
                || quantity != null || costPrice != null || sellingPrice != null;
    }

    /**
     * Overlays {@code newer} on top of this change set; components set in {@code newer} win.
     */
    public InventoryChanges mergedWith(InventoryChanges newer) {
        return new InventoryChanges(
                newer.name != null ? newer.name : name,
                newer.sku != null ? newer.sku : sku,
                newer.category != null ? newer.category : category,
                newer.quantity != null ? newer.quantity : quantity,
                newer.costPrice != null ? newer.costPrice : costPrice,
                newer.sellingPrice != null ? newer.sellingPrice : sellingPrice);
    }

    /**
     * Returns the set components keyed by column name.
     */
    public Map<String, Object> toColumns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        if (name != null) columns.put("name", name);
        if (sku != null) columns.put("sku", sku);
        if (category != null) columns.put("category", category);
        if (quantity != null) columns.put("quantity", quantity);
        if (costPrice != null) columns.put("cost_price", costPrice);
        if (sellingPrice != null) columns.put("selling_price", sellingPrice);
        return columns;
    }
}
