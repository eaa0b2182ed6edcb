package io.shopsync.dispatch.handler;

import io.shopsync.Identifier;
import io.shopsync.dispatch.SyncOutcome;
import io.shopsync.dispatch.UnroutableOperationException;
import io.shopsync.model.ExpenseRecord;
import io.shopsync.model.IdResolution;
import io.shopsync.model.RecordRef;
import io.shopsync.model.SyncQueueEntry;
import io.shopsync.queue.SyncPayload;
import io.shopsync.repository.Tables;
import io.shopsync.spi.RemoteBackend;

/**
 * Replays expense creates and deletes.
 */
final class ExpenseSyncHandler extends RemoteSyncHandler {

    ExpenseSyncHandler(RemoteBackend remote, LocalIdentifiers identifiers) {
        super(remote, identifiers);
    }

    @Override
    public SyncOutcome handle(SyncQueueEntry entry, SyncPayload payload) {
        if (payload instanceof SyncPayload.ExpenseCreated created) {
            ExpenseRecord expense = created.expense();
            Identifier.Persistent id = createOnce(Tables.EXPENSES, Tables.EXPENSES, expense.id(), RemoteRows.expense(expense));
            SyncOutcome outcome = SyncOutcome.synced(new RecordRef(Tables.EXPENSES, id.value()));
            if (expense.id() instanceof Identifier.Temporary temp) {
                outcome = outcome.withResolution(new IdResolution(Tables.EXPENSES, temp, id));
            }
            return outcome;
        }
        if (payload instanceof SyncPayload.ExpenseDeleted deleted) {
            Identifier.Persistent id = identifiers.require(Tables.EXPENSES, deleted.expenseId());
            remote.delete(Tables.EXPENSES, id.value());
            return SyncOutcome.none();
        }
        throw new UnroutableOperationException("Unexpected payload for expenses: " + payload.getClass().getSimpleName());
    }
}
