package io.shopsync.model;

import java.util.Objects;

/**
 * Which rows a user may list. Individuals see their own records; owners and workers
 * attached to a store see the whole store; everyone else falls back to their own records.
 */
public record AccessScope(String userId, UserRole role, String storeId) {

    public AccessScope {
        Objects.requireNonNull(userId, "userId");
        role = role == null ? UserRole.INDIVIDUAL : role;
    }

    public static AccessScope of(UserProfile profile) {
        return new AccessScope(profile.userId(), profile.role(), profile.storeId());
    }

    public static AccessScope individual(String userId) {
        return new AccessScope(userId, UserRole.INDIVIDUAL, null);
    }

    public String filterColumn() {
        return storeScoped() ? "store_id" : "user_id";
    }

    public String filterValue() {
        return storeScoped() ? storeId : userId;
    }

    private boolean storeScoped() {
        return role != UserRole.INDIVIDUAL && storeId != null && !storeId.isBlank();
    }
}
