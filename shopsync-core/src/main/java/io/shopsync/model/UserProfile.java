package io.shopsync.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Locally cached profile of the signed-in user. Keyed by {@code userId}.
 */
public record UserProfile(
        String id,
        String userId,
        UserRole role,
        String storeId,
        String businessName,
        String email,
        String firstName,
        String lastName,
        String phone,
        boolean synced,
        Instant createdAt,
        Instant updatedAt) {

    public UserProfile {
        Objects.requireNonNull(userId, "userId");
        id = id == null ? userId : id;
        role = role == null ? UserRole.INDIVIDUAL : role;
    }

    public static UserProfile of(String userId, UserRole role, String storeId) {
        return new UserProfile(null, userId, role, storeId, null, null, null, null, null, false, null, null);
    }
}
