package io.shopsync.dispatch.handler;

import io.shopsync.Identifier;
import io.shopsync.dispatch.SyncOutcome;
import io.shopsync.dispatch.UnroutableOperationException;
import io.shopsync.model.IdResolution;
import io.shopsync.model.InventoryItem;
import io.shopsync.model.RecordRef;
import io.shopsync.model.SyncQueueEntry;
import io.shopsync.queue.SyncPayload;
import io.shopsync.repository.Tables;
import io.shopsync.spi.RemoteBackend;

/**
 * Replays inventory creates, updates and deletes.
 */
final class InventorySyncHandler extends RemoteSyncHandler {

    InventorySyncHandler(RemoteBackend remote, LocalIdentifiers identifiers) {
        super(remote, identifiers);
    }

    @Override
    public SyncOutcome handle(SyncQueueEntry entry, SyncPayload payload) {
        if (payload instanceof SyncPayload.InventoryCreated created) {
            return create(created.item());
        }
        if (payload instanceof SyncPayload.InventoryUpdated updated) {
            Identifier.Persistent id = identifiers.require(Tables.INVENTORY, updated.itemId());
            remote.update(Tables.INVENTORY, id.value(), RemoteRows.inventoryChanges(updated.changes()));
            return SyncOutcome.synced(new RecordRef(Tables.INVENTORY, id.value()));
        }
        if (payload instanceof SyncPayload.InventoryDeleted deleted) {
            Identifier.Persistent id = identifiers.require(Tables.INVENTORY, deleted.itemId());
            remote.delete(Tables.INVENTORY, id.value());
            return SyncOutcome.none();
        }
        throw new UnroutableOperationException("Unexpected payload for inventory: " + payload.getClass().getSimpleName());
    }

    private SyncOutcome create(InventoryItem item) {
        Identifier.Persistent id = createOnce(Tables.INVENTORY, Tables.INVENTORY, item.id(), RemoteRows.inventory(item));
        SyncOutcome outcome = SyncOutcome.synced(new RecordRef(Tables.INVENTORY, id.value()));
        if (item.id() instanceof Identifier.Temporary temp) {
            outcome = outcome.withResolution(new IdResolution(Tables.INVENTORY, temp, id));
        }
        return outcome;
    }
}
