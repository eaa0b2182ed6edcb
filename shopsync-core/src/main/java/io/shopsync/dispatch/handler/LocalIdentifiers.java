package io.shopsync.dispatch.handler;

import io.shopsync.Identifier;
import io.shopsync.dispatch.UnresolvableReferenceException;
import io.shopsync.repository.RecordRepository;
import io.shopsync.spi.LocalTransactions;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves identifiers found in payloads against the local store.
 */
final class LocalIdentifiers {
    private final LocalTransactions transactions;
    private final RecordRepository records;

    LocalIdentifiers(LocalTransactions transactions, RecordRepository records) {
        this.transactions = Objects.requireNonNull(transactions, "transactions");
        this.records = Objects.requireNonNull(records, "records");
    }

    /**
     * Returns the persistent id for {@code id}: itself if already persistent, otherwise the
     * id of the local row created under it, if that row has been resolved.
     */
    Optional<Identifier.Persistent> resolve(String table, Identifier id) {
        if (id instanceof Identifier.Persistent persistent) {
            return Optional.of(persistent);
        }
        return transactions.inTransaction(conn -> records.resolvePersistent(conn, table, id));
    }

    /**
     * Like {@link #resolve} but fails when there is no persistent id yet.
     *
     * @throws UnresolvableReferenceException if {@code id} is temporary and unresolved
     */
    Identifier.Persistent require(String table, Identifier id) {
        return resolve(table, id).orElseThrow(() -> new UnresolvableReferenceException(table, id));
    }
}
