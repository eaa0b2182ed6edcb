package io.shopsync.dispatch.handler;

import io.shopsync.Identifier;
import io.shopsync.model.ExpenseRecord;
import io.shopsync.model.InventoryChanges;
import io.shopsync.model.InventoryItem;
import io.shopsync.model.SaleLineItem;
import io.shopsync.model.SaleRecord;
import io.shopsync.model.UserProfile;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Column maps sent to the remote backend. Records created offline carry their temporary id
 * as {@code client_ref} so a replayed insert can find the row it already created.
 */
final class RemoteRows {
    static final String CLIENT_REF = "client_ref";

    static Map<String, Object> inventory(InventoryItem item) {
        Map<String, Object> row = new LinkedHashMap<>();
        putClientRef(row, item.id());
        row.put("user_id", item.userId());
        row.put("store_id", item.storeId());
        row.put("name", item.name());
        row.put("sku", item.sku());
        row.put("category", item.category());
        row.put("quantity", item.quantity());
        row.put("cost_price", item.costPrice());
        row.put("selling_price", item.sellingPrice());
        row.put("created_at", item.createdAt());
        row.put("updated_at", item.updatedAt());
        return row;
    }

    static Map<String, Object> inventoryChanges(InventoryChanges changes) {
        return new LinkedHashMap<>(changes.toColumns());
    }

    static Map<String, Object> sale(SaleRecord sale) {
        Map<String, Object> row = new LinkedHashMap<>();
        putClientRef(row, sale.id());
        row.put("user_id", sale.userId());
        row.put("store_id", sale.storeId());
        row.put("subtotal", sale.subtotal());
        row.put("tax_amount", sale.taxAmount());
        row.put("discount_amount", sale.discountAmount());
        row.put("total_amount", sale.totalAmount());
        row.put("payment_method", sale.paymentMethod());
        row.put("payment_status", sale.paymentStatus());
        row.put("customer_name", sale.customerName());
        row.put("notes", sale.notes());
        row.put("sale_date", sale.saleDate());
        row.put("created_at", sale.createdAt());
        return row;
    }

    static Map<String, Object> lineItem(String id, String saleId, String inventoryId, SaleLineItem line) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("sale_id", saleId);
        row.put("inventory_id", inventoryId);
        row.put("user_id", line.userId());
        row.put("item_name", line.itemName());
        row.put("quantity", line.quantity());
        row.put("unit_price", line.unitPrice());
        row.put("line_total", line.lineTotal());
        return row;
    }

    static Map<String, Object> expense(ExpenseRecord expense) {
        Map<String, Object> row = new LinkedHashMap<>();
        putClientRef(row, expense.id());
        row.put("user_id", expense.userId());
        row.put("store_id", expense.storeId());
        row.put("category", expense.category());
        row.put("description", expense.description());
        row.put("amount", expense.amount());
        row.put("expense_date", expense.expenseDate());
        row.put("vendor", expense.vendor());
        row.put("payment_method", expense.paymentMethod());
        row.put("created_at", expense.createdAt());
        return row;
    }

    static Map<String, Object> profile(UserProfile profile) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("user_id", profile.userId());
        row.put("role", profile.role().code());
        row.put("store_id", profile.storeId());
        row.put("business_name", profile.businessName());
        row.put("email", profile.email());
        row.put("first_name", profile.firstName());
        row.put("last_name", profile.lastName());
        row.put("phone", profile.phone());
        row.put("updated_at", profile.updatedAt());
        return row;
    }

    private static void putClientRef(Map<String, Object> row, Identifier id) {
        if (id instanceof Identifier.Temporary) {
            row.put(CLIENT_REF, id.value());
        } else {
            row.put("id", id.value());
        }
    }

    private RemoteRows() {}
}
