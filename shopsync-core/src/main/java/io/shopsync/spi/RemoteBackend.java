package io.shopsync.spi;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative remote store, reached over the network.
 *
 * <p>Implementations throw {@link io.shopsync.RemoteBackendException} (or any other runtime
 * exception) on failure; the sync dispatcher treats such failures as retryable.
 */
public interface RemoteBackend {

    /**
     * Inserts a row and returns it with its backend-assigned id.
     */
    RemoteRecord insert(String table, Map<String, ?> values);

    RemoteRecord update(String table, String id, Map<String, ?> changes);

    /**
     * Deletes the row. Deleting a missing row is not an error.
     */
    void delete(String table, String id);

    /**
     * Inserts or updates the row whose {@code conflictColumn} matches.
     */
    RemoteRecord upsert(String table, String conflictColumn, Map<String, ?> values);

    default List<RemoteRecord> upsertAll(String table, String conflictColumn, List<? extends Map<String, ?>> rows) {
        List<RemoteRecord> results = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            results.add(upsert(table, conflictColumn, row));
        }
        return results;
    }

    Optional<RemoteRecord> findById(String table, String id);

    /**
     * Returns the first row whose {@code column} equals {@code value}.
     */
    Optional<RemoteRecord> findOne(String table, String column, Object value);
}
