package io.shopsync.repository;

import io.shopsync.Identifier;
import io.shopsync.model.ExpenseRecord;
import io.shopsync.model.InventoryItem;
import io.shopsync.model.SaleLineItem;
import io.shopsync.model.SaleRecord;
import io.shopsync.model.UserProfile;
import io.shopsync.model.UserRole;
import io.shopsync.spi.Row;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts records to column maps and {@link Row}s back to records.
 */
final class RecordMappers {

    static Map<String, Object> inventoryColumns(InventoryItem item) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("id", item.id().value());
        columns.put("temp_id", item.tempId());
        columns.put("user_id", item.userId());
        columns.put("store_id", item.storeId());
        columns.put("name", item.name());
        columns.put("sku", item.sku());
        columns.put("category", item.category());
        columns.put("quantity", item.quantity());
        columns.put("cost_price", item.costPrice());
        columns.put("selling_price", item.sellingPrice());
        columns.put("synced", item.synced());
        columns.put("is_offline", item.offline());
        columns.put("created_at", item.createdAt());
        columns.put("updated_at", item.updatedAt());
        return columns;
    }

    static InventoryItem inventory(Row row) {
        return new InventoryItem(
                row.getIdentifier("id"),
                row.getString("temp_id"),
                row.getString("user_id"),
                row.getString("store_id"),
                row.getString("name"),
                row.getString("sku"),
                row.getString("category"),
                row.getInt("quantity"),
                row.getDecimal("cost_price"),
                row.getDecimal("selling_price"),
                row.getBoolean("synced"),
                row.getBoolean("is_offline"),
                row.getInstant("created_at"),
                row.getInstant("updated_at"));
    }

    static Map<String, Object> saleColumns(SaleRecord sale) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("id", sale.id().value());
        columns.put("temp_id", sale.tempId());
        columns.put("user_id", sale.userId());
        columns.put("store_id", sale.storeId());
        columns.put("subtotal", sale.subtotal());
        columns.put("tax_amount", sale.taxAmount());
        columns.put("discount_amount", sale.discountAmount());
        columns.put("total_amount", sale.totalAmount());
        columns.put("payment_method", sale.paymentMethod());
        columns.put("payment_status", sale.paymentStatus());
        columns.put("customer_name", sale.customerName());
        columns.put("notes", sale.notes());
        columns.put("sale_date", sale.saleDate());
        columns.put("synced", sale.synced());
        columns.put("created_at", sale.createdAt());
        columns.put("updated_at", sale.updatedAt());
        return columns;
    }

    static SaleRecord sale(Row row) {
        return new SaleRecord(
                row.getIdentifier("id"),
                row.getString("temp_id"),
                row.getString("user_id"),
                row.getString("store_id"),
                row.getDecimal("subtotal"),
                row.getDecimal("tax_amount"),
                row.getDecimal("discount_amount"),
                row.getDecimal("total_amount"),
                row.getString("payment_method"),
                row.getString("payment_status"),
                row.getString("customer_name"),
                row.getString("notes"),
                row.getInstant("sale_date"),
                row.getBoolean("synced"),
                row.getInstant("created_at"),
                row.getInstant("updated_at"));
    }

    static Map<String, Object> lineItemColumns(SaleLineItem line) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("id", line.id());
        columns.put("sale_id", line.saleId().value());
        columns.put("inventory_id", line.inventoryId().value());
        columns.put("user_id", line.userId());
        columns.put("item_name", line.itemName());
        columns.put("quantity", line.quantity());
        columns.put("unit_price", line.unitPrice());
        columns.put("line_total", line.lineTotal());
        columns.put("synced", line.synced());
        columns.put("created_at", line.createdAt());
        columns.put("updated_at", line.updatedAt());
        return columns;
    }

    static SaleLineItem lineItem(Row row) {
        return new SaleLineItem(
                row.getString("id"),
                row.getIdentifier("sale_id"),
                row.getIdentifier("inventory_id"),
                row.getString("user_id"),
                row.getString("item_name"),
                row.getInt("quantity"),
                row.getDecimal("unit_price"),
                row.getDecimal("line_total"),
                row.getBoolean("synced"),
                row.getInstant("created_at"),
                row.getInstant("updated_at"));
    }

    static Map<String, Object> expenseColumns(ExpenseRecord expense) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("id", expense.id().value());
        columns.put("temp_id", expense.tempId());
        columns.put("user_id", expense.userId());
        columns.put("store_id", expense.storeId());
        columns.put("category", expense.category());
        columns.put("description", expense.description());
        columns.put("amount", expense.amount());
        columns.put("expense_date", expense.expenseDate());
        columns.put("vendor", expense.vendor());
        columns.put("payment_method", expense.paymentMethod());
        columns.put("synced", expense.synced());
        columns.put("created_at", expense.createdAt());
        columns.put("updated_at", expense.updatedAt());
        return columns;
    }

    static ExpenseRecord expense(Row row) {
        return new ExpenseRecord(
                row.getIdentifier("id"),
                row.getString("temp_id"),
                row.getString("user_id"),
                row.getString("store_id"),
                row.getString("category"),
                row.getString("description"),
                row.getDecimal("amount"),
                row.getLocalDate("expense_date"),
                row.getString("vendor"),
                row.getString("payment_method"),
                row.getBoolean("synced"),
                row.getInstant("created_at"),
                row.getInstant("updated_at"));
    }

    static Map<String, Object> profileColumns(UserProfile profile) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("id", profile.id());
        columns.put("user_id", profile.userId());
        columns.put("role", profile.role().code());
        columns.put("store_id", profile.storeId());
        columns.put("business_name", profile.businessName());
        columns.put("email", profile.email());
        columns.put("first_name", profile.firstName());
        columns.put("last_name", profile.lastName());
        columns.put("phone", profile.phone());
        columns.put("synced", profile.synced());
        columns.put("created_at", profile.createdAt());
        columns.put("updated_at", profile.updatedAt());
        return columns;
    }

    static UserProfile profile(Row row) {
        return new UserProfile(
                row.getString("id"),
                row.getString("user_id"),
                UserRole.fromCode(row.getString("role")),
                row.getString("store_id"),
                row.getString("business_name"),
                row.getString("email"),
                row.getString("first_name"),
                row.getString("last_name"),
                row.getString("phone"),
                row.getBoolean("synced"),
                row.getInstant("created_at"),
                row.getInstant("updated_at"));
    }

    static String tempIdOf(Identifier id) {
        return id instanceof Identifier.Temporary ? id.value() : null;
    }

    private RecordMappers() {}
}
