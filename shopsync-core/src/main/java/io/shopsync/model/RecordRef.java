package io.shopsync.model;

import java.util.Objects;

/**
 * Points at one local row by table and id.
 */
public record RecordRef(String table, String id) {

    public RecordRef {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(id, "id");
    }
}
