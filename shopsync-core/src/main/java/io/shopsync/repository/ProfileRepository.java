package io.shopsync.repository;

import io.shopsync.model.UserProfile;
import io.shopsync.spi.LocalStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Local cache of user profiles, one row per user.
 */
public final class ProfileRepository {
    private final LocalStore store;

    public ProfileRepository(LocalStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Inserts or replaces the profile for its user, marked unsynced.
     *
     * @return the profile as stored
     */
    public UserProfile upsert(Connection conn, UserProfile profile) {
        Instant now = Instant.now();
        Optional<UserProfile> existing = find(conn, profile.userId());
        UserProfile stored = new UserProfile(
                existing.map(UserProfile::id).orElse(profile.id()),
                profile.userId(), profile.role(), profile.storeId(), profile.businessName(),
                profile.email(), profile.firstName(), profile.lastName(), profile.phone(), false,
                existing.map(UserProfile::createdAt).orElse(now), now);
        store.upsert(conn, Tables.USER_PROFILES, "user_id", RecordMappers.profileColumns(stored));
        return stored;
    }

    public Optional<UserProfile> find(Connection conn, String userId) {
        return store.findOne(conn, Tables.USER_PROFILES, Map.of("user_id", userId)).map(RecordMappers::profile);
    }

    public boolean markSynced(Connection conn, String id) {
        return store.update(conn, Tables.USER_PROFILES, id, Map.of("synced", true)) > 0;
    }
}
