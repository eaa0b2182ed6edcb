package io.shopsync.dispatch.handler;

import io.shopsync.Identifier;
import io.shopsync.dispatch.SyncOutcome;
import io.shopsync.dispatch.UnroutableOperationException;
import io.shopsync.model.IdResolution;
import io.shopsync.model.RecordRef;
import io.shopsync.model.SaleLineItem;
import io.shopsync.model.SaleRecord;
import io.shopsync.model.SyncQueueEntry;
import io.shopsync.queue.SyncPayload;
import io.shopsync.repository.Tables;
import io.shopsync.spi.RemoteBackend;
import io.shopsync.spi.RemoteRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Replays a sale: the sale header, its line items and the remote stock decrements.
 *
 * <ol>
 *   <li>Every line's inventory reference is resolved to a persistent id first, so nothing is
 *       written remotely while a referenced item has not synced yet.</li>
 *   <li>The remote sale is found by {@code client_ref} or created.</li>
 *   <li>Line items are upserted under {@code <remoteSaleId>_item_<n>}.</li>
 *   <li>If the line items were not there before, each referenced remote item is decremented.
 *       A failing decrement is logged and skipped; the sale itself still completes.</li>
 * </ol>
 */
final class SaleSyncHandler extends RemoteSyncHandler {
    private static final Logger logger = Logger.getLogger(SaleSyncHandler.class.getName());

    SaleSyncHandler(RemoteBackend remote, LocalIdentifiers identifiers) {
        super(remote, identifiers);
    }

    @Override
    public SyncOutcome handle(SyncQueueEntry entry, SyncPayload payload) {
        if (!(payload instanceof SyncPayload.SaleCreated created)) {
            throw new UnroutableOperationException("Unexpected payload for sales: " + payload.getClass().getSimpleName());
        }
        SaleRecord sale = created.sale();
        List<SaleLineItem> lines = created.lines();

        Map<String, Identifier.Persistent> inventoryIds = new LinkedHashMap<>();
        for (SaleLineItem line : lines) {
            Identifier ref = line.inventoryId();
            if (!inventoryIds.containsKey(ref.value())) {
                inventoryIds.put(ref.value(), identifiers.require(Tables.INVENTORY, ref));
            }
        }

        Identifier.Persistent saleId = createOnce(Tables.SALES, Tables.SALES, sale.id(), RemoteRows.sale(sale));
        String firstLineId = SaleLineItem.lineItemId(saleId.value(), 0);
        boolean linesPresent = !lines.isEmpty() && remote.findById(Tables.SALE_ITEMS, firstLineId).isPresent();

        List<Map<String, Object>> rows = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            SaleLineItem line = lines.get(i);
            rows.add(RemoteRows.lineItem(SaleLineItem.lineItemId(saleId.value(), i), saleId.value(),
                    inventoryIds.get(line.inventoryId().value()).value(), line));
        }
        if (!rows.isEmpty()) {
            remote.upsertAll(Tables.SALE_ITEMS, "id", rows);
        }

        if (linesPresent) {
            logger.log(Level.FINE, "Line items of sale {0} already present remotely, not decrementing stock", saleId);
        } else {
            for (SaleLineItem line : lines) {
                decrementRemoteStock(inventoryIds.get(line.inventoryId().value()), line.quantity(), saleId);
            }
        }

        SyncOutcome outcome = SyncOutcome.synced(new RecordRef(Tables.SALES, saleId.value()));
        if (sale.id() instanceof Identifier.Temporary temp) {
            outcome = outcome.withResolution(new IdResolution(Tables.SALES, temp, saleId));
        }
        for (Identifier.Persistent inventoryId : inventoryIds.values()) {
            outcome = outcome.withSynced(new RecordRef(Tables.INVENTORY, inventoryId.value()));
        }
        return outcome;
    }

    private void decrementRemoteStock(Identifier.Persistent inventoryId, int units, Identifier.Persistent saleId) {
        try {
            RemoteRecord item = remote.findById(Tables.INVENTORY, inventoryId.value()).orElse(null);
            if (item == null) {
                logger.log(Level.WARNING, "Remote inventory {0} missing, stock not decremented for sale {1}",
                        new Object[] {inventoryId, saleId});
                return;
            }
            int remaining = Math.max(0, item.getInt("quantity") - units);
            remote.update(Tables.INVENTORY, inventoryId.value(), Map.of("quantity", remaining));
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to decrement remote stock of " + inventoryId + " for sale " + saleId, e);
        }
    }
}
