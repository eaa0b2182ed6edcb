package io.shopsync.model;

import java.util.Locale;

/**
 * Role of a user within the business. Determines which records the user can see.
 */
public enum UserRole {
    INDIVIDUAL,
    OWNER,
    WORKER;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a stored role code. Unknown or missing codes fall back to {@link #INDIVIDUAL}.
     */
    public static UserRole fromCode(String code) {
        if (code == null) {
            return INDIVIDUAL;
        }
        for (UserRole role : values()) {
            if (role.code().equalsIgnoreCase(code.trim())) {
                return role;
            }
        }
        return INDIVIDUAL;
    }
}
