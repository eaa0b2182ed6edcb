package io.shopsync.storage;

import io.shopsync.repository.TableStats;

import java.util.List;

/**
 * Row counts of every local table plus the state of the sync queue.
 *
 * @param pendingSyncOperations   queue entries that will still be drained
 * @param exhaustedSyncOperations queue entries that ran out of attempts
 */
public record StorageStats(List<TableStats> tables, int pendingSyncOperations, int exhaustedSyncOperations) {

    public StorageStats {
        tables = List.copyOf(tables);
    }
}
