package io.shopsync.spi;

import java.util.Optional;

/**
 * Platform secure key/value storage for session material.
 */
public interface CredentialStore {

    /**
     * Prepares the store for use. Called once by the storage facade after the local schema
     * is ready.
     */
    default void initialize() {
    }

    void put(String key, String value);

    Optional<String> get(String key);

    void remove(String key);
}
