package io.shopsync.repository;

import io.shopsync.Identifier;
import io.shopsync.SaleBusyException;
import io.shopsync.model.AccessScope;
import io.shopsync.model.IdResolution;
import io.shopsync.model.InventoryItem;
import io.shopsync.model.SaleDraft;
import io.shopsync.model.SaleLine;
import io.shopsync.model.SaleLineItem;
import io.shopsync.model.SaleReceipt;
import io.shopsync.model.SaleRecord;
import io.shopsync.spi.LocalStore;
import io.shopsync.spi.LocalTransactions;
import io.shopsync.spi.MetricsExporter;
import io.shopsync.spi.Row;

import java.math.BigDecimal;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Local persistence of sales and their line items.
 *
 * <p>{@link #processSale} is the only multi-entity write: the sale header, every line item
 * and every inventory decrement commit in one local transaction, or none of them do. Sales
 * are serialized by a fair lock; a caller that cannot get it within the configured wait
 * gets a {@link SaleBusyException}.
 */
public final class SaleRepository {
    private static final Logger logger = Logger.getLogger(SaleRepository.class.getName());

    private static final Comparator<SaleLineItem> BY_POSITION =
            Comparator.comparingInt(line -> position(line.id()));

    private final LocalStore store;
    private final LocalTransactions transactions;
    private final InventoryRepository inventory;
    private final Duration lockTimeout;
    private final MetricsExporter metrics;
    private final Semaphore saleLock = new Semaphore(1, true);

    public SaleRepository(LocalStore store, LocalTransactions transactions, InventoryRepository inventory,
                          Duration lockTimeout, MetricsExporter metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.transactions = Objects.requireNonNull(transactions, "transactions");
        this.inventory = Objects.requireNonNull(inventory, "inventory");
        this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
        if (lockTimeout.isNegative()) {
            throw new IllegalArgumentException("lockTimeout must be >= 0");
        }
        this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    }

    /**
     * Records a sale.
     *
     * <p>If {@code draft} carries the id of a sale that already exists, the stored sale is
     * returned as a duplicate and nothing is written. Otherwise stock is validated, the sale
     * and its line items are inserted, each referenced item is decremented and marked
     * unsynced, and {@code hook} runs, all in one transaction.
     *
     * @throws SaleBusyException                        if another sale holds the lock too long
     * @throws io.shopsync.StockValidationException     if stock validation fails
     */
    public SaleReceipt processSale(SaleDraft draft, List<SaleLine> lines, SaleWriteHook hook) {
        Objects.requireNonNull(draft, "draft");
        Objects.requireNonNull(lines, "lines");
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("A sale needs at least one line");
        }
        SaleWriteHook writeHook = hook == null ? SaleWriteHook.NOOP : hook;
        acquire();
        try {
            SaleReceipt receipt = transactions.inTransaction(conn -> writeSale(conn, draft, lines, writeHook));
            if (!receipt.duplicate()) {
                metrics.incrementSaleProcessed();
            }
            return receipt;
        } finally {
            saleLock.release();
        }
    }

    private void acquire() {
        boolean acquired;
        try {
            acquired = saleLock.tryAcquire(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            acquired = false;
        }
        if (!acquired) {
            metrics.incrementSaleBusy();
            throw new SaleBusyException(lockTimeout);
        }
    }

    private SaleReceipt writeSale(Connection conn, SaleDraft draft, List<SaleLine> lines, SaleWriteHook hook) {
        if (draft.id() != null) {
            Optional<SaleRecord> existing = find(conn, draft.id());
            if (existing.isPresent()) {
                logger.log(Level.FINE, "Sale {0} already recorded, returning it", draft.id());
                return new SaleReceipt(existing.get(), lines(conn, existing.get().id().value()), true);
            }
        }

        Map<Identifier, InventoryItem> items = inventory.validateStock(conn, lines);

        Identifier saleId = draft.id() != null ? draft.id() : Identifier.mintTemporary();
        Instant now = Instant.now();
        BigDecimal subtotal = BigDecimal.ZERO;
        for (SaleLine line : lines) {
            subtotal = subtotal.add(line.lineTotal());
        }
        BigDecimal total = subtotal.add(draft.taxAmount()).subtract(draft.discountAmount());
        SaleRecord sale = new SaleRecord(saleId, RecordMappers.tempIdOf(saleId), draft.userId(), draft.storeId(),
                subtotal, draft.taxAmount(), draft.discountAmount(), total,
                draft.paymentMethod(), draft.paymentStatus(), draft.customerName(), draft.notes(),
                draft.saleDate() != null ? draft.saleDate() : now, false, now, now);
        store.insert(conn, Tables.SALES, RecordMappers.saleColumns(sale));

        List<SaleLineItem> lineItems = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            SaleLine line = lines.get(i);
            InventoryItem item = items.get(line.inventoryId());
            SaleLineItem lineItem = new SaleLineItem(
                    SaleLineItem.lineItemId(saleId.value(), i), saleId, item.id(), draft.userId(),
                    line.itemName(), line.quantity(), line.unitPrice(), line.lineTotal(), false, now, now);
            if (!store.exists(conn, Tables.SALE_ITEMS, lineItem.id())) {
                store.insert(conn, Tables.SALE_ITEMS, RecordMappers.lineItemColumns(lineItem));
            }
            lineItems.add(lineItem);
            inventory.decrement(conn, item.id().value(), line.quantity());
        }

        SaleReceipt receipt = new SaleReceipt(sale, lineItems, false);
        hook.afterWrite(conn, receipt);
        return receipt;
    }

    public boolean exists(Connection conn, Identifier id) {
        return find(conn, id).isPresent();
    }

    public Optional<SaleRecord> find(Connection conn, Identifier id) {
        Optional<Row> row = store.findById(conn, Tables.SALES, id.value());
        if (row.isEmpty() && id instanceof Identifier.Temporary) {
            row = store.findOne(conn, Tables.SALES, Map.of("temp_id", id.value()));
        }
        return row.map(RecordMappers::sale);
    }

    /**
     * Returns the line items of a sale in line order.
     */
    public List<SaleLineItem> lines(Connection conn, String saleId) {
        List<SaleLineItem> lines = new ArrayList<>();
        for (Row row : store.find(conn, Tables.SALE_ITEMS, Map.of("sale_id", saleId), null, 0)) {
            lines.add(RecordMappers.lineItem(row));
        }
        lines.sort(BY_POSITION);
        return lines;
    }

    /**
     * Lists sales visible to {@code scope}, newest first, with their line items.
     *
     * @param limit max sales, or {@code 0} for all
     */
    public List<SaleReceipt> list(Connection conn, AccessScope scope, int limit) {
        Map<String, Object> where = new LinkedHashMap<>();
        where.put(scope.filterColumn(), scope.filterValue());
        List<SaleReceipt> receipts = new ArrayList<>();
        for (Row row : store.find(conn, Tables.SALES, where, "sale_date DESC, id ASC", limit)) {
            SaleRecord sale = RecordMappers.sale(row);
            receipts.add(new SaleReceipt(sale, lines(conn, sale.id().value()), false));
        }
        return receipts;
    }

    /**
     * Re-keys the sale to its persistent id and its line items to
     * {@code <persistentId>_item_<n>}.
     *
     * @return {@code false} if no sale carries the temporary id any more
     */
    public boolean applyResolution(Connection conn, IdResolution resolution) {
        String tempId = resolution.temporary().value();
        String persistentId = resolution.persistent().value();
        if (!store.exists(conn, Tables.SALES, tempId)) {
            return false;
        }
        Instant now = Instant.now();
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("id", persistentId);
        changes.put("temp_id", tempId);
        changes.put("updated_at", now);
        store.update(conn, Tables.SALES, tempId, changes);

        for (SaleLineItem line : lines(conn, tempId)) {
            Map<String, Object> lineChanges = new LinkedHashMap<>();
            lineChanges.put("id", SaleLineItem.lineItemId(persistentId, position(line.id())));
            lineChanges.put("sale_id", persistentId);
            lineChanges.put("updated_at", now);
            store.update(conn, Tables.SALE_ITEMS, line.id(), lineChanges);
        }
        return true;
    }

    /**
     * Marks the sale and all of its line items synced.
     */
    public boolean markSynced(Connection conn, String id) {
        int updated = store.update(conn, Tables.SALES, id, Map.of("synced", true));
        store.updateWhere(conn, Tables.SALE_ITEMS, Map.of("sale_id", id), Map.of("synced", true));
        return updated > 0;
    }

    private static int position(String lineItemId) {
        int marker = lineItemId.lastIndexOf("_item_");
        if (marker < 0) {
            return Integer.MAX_VALUE;
        }
        try {
            return Integer.parseInt(lineItemId.substring(marker + "_item_".length()));
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }
}
