package io.shopsync.dispatch.handler;

import io.shopsync.Identifier;
import io.shopsync.dispatch.SyncHandler;
import io.shopsync.spi.RemoteBackend;
import io.shopsync.spi.RemoteRecord;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class for handlers that replay entries against a {@link RemoteBackend}.
 */
abstract class RemoteSyncHandler implements SyncHandler {
    private static final Logger logger = Logger.getLogger(RemoteSyncHandler.class.getName());

    protected final RemoteBackend remote;
    protected final LocalIdentifiers identifiers;

    protected RemoteSyncHandler(RemoteBackend remote, LocalIdentifiers identifiers) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.identifiers = Objects.requireNonNull(identifiers, "identifiers");
    }

    /**
     * Creates the remote row for a record at most once and returns its persistent id.
     *
     * <p>A record created under a temporary id is looked up first locally (already resolved)
     * and then remotely by {@code client_ref} (created by an earlier attempt whose local
     * completion was lost); only if both miss is a new row inserted. When the row already
     * exists it is overwritten with {@code row}, since the entry may have been rewritten after
     * the earlier attempt. A record that already has a persistent id is upserted under it.
     */
    protected Identifier.Persistent createOnce(String localTable, String remoteTable, Identifier id,
                                               Map<String, Object> row) {
        if (id instanceof Identifier.Persistent persistent) {
            remote.upsert(remoteTable, "id", row);
            return persistent;
        }
        Optional<Identifier.Persistent> resolved = identifiers.resolve(localTable, id);
        if (resolved.isPresent()) {
            logger.log(Level.FINE, "{0} {1} already resolved to {2}", new Object[] {localTable, id, resolved.get()});
            return overwrite(remoteTable, resolved.get(), row);
        }
        Optional<RemoteRecord> existing = remote.findOne(remoteTable, RemoteRows.CLIENT_REF, id.value());
        if (existing.isPresent()) {
            logger.log(Level.FINE, "{0} {1} already exists remotely as {2}",
                    new Object[] {remoteTable, id, existing.get().id()});
            return overwrite(remoteTable, new Identifier.Persistent(existing.get().id()), row);
        }
        return new Identifier.Persistent(remote.insert(remoteTable, row).id());
    }

    private Identifier.Persistent overwrite(String remoteTable, Identifier.Persistent id, Map<String, Object> row) {
        Map<String, Object> keyed = new LinkedHashMap<>(row);
        keyed.put("id", id.value());
        remote.upsert(remoteTable, "id", keyed);
        return id;
    }
}
