package io.shopsync.dispatch.handler;

import io.shopsync.dispatch.SyncOutcome;
import io.shopsync.dispatch.UnroutableOperationException;
import io.shopsync.model.RecordRef;
import io.shopsync.model.SyncQueueEntry;
import io.shopsync.model.UserProfile;
import io.shopsync.queue.SyncPayload;
import io.shopsync.repository.Tables;
import io.shopsync.spi.RemoteBackend;

/**
 * Upserts user profiles into the remote {@code profiles} table, keyed by user id.
 */
final class ProfileSyncHandler extends RemoteSyncHandler {

    ProfileSyncHandler(RemoteBackend remote, LocalIdentifiers identifiers) {
        super(remote, identifiers);
    }

    @Override
    public SyncOutcome handle(SyncQueueEntry entry, SyncPayload payload) {
        if (!(payload instanceof SyncPayload.ProfileUpserted upserted)) {
            throw new UnroutableOperationException("Unexpected payload for user_profiles: "
                    + payload.getClass().getSimpleName());
        }
        UserProfile profile = upserted.profile();
        remote.upsert(Tables.REMOTE_PROFILES, "user_id", RemoteRows.profile(profile));
        return SyncOutcome.synced(new RecordRef(Tables.USER_PROFILES, profile.id()));
    }
}
