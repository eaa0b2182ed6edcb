package io.shopsync.model;

import io.shopsync.Identifier;

import java.util.Objects;

/**
 * The remote backend confirmed {@code temporary} under the persistent id {@code persistent}.
 */
public record IdResolution(String table, Identifier.Temporary temporary, Identifier.Persistent persistent) {

    public IdResolution {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(temporary, "temporary");
        Objects.requireNonNull(persistent, "persistent");
    }
}
