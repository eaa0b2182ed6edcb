package io.shopsync.dispatch;

import io.shopsync.Identifier;

/**
 * A payload refers to a record by a temporary identifier that has no persistent counterpart
 * yet, usually because the record's own insert has not synced. Retried like any failure.
 */
public final class UnresolvableReferenceException extends RuntimeException {
    private final String table;
    private final Identifier reference;

    public UnresolvableReferenceException(String table, Identifier reference) {
        super("Unresolvable reference to " + table + " " + reference.value()
                + ": no persistent id yet");
        this.table = table;
        this.reference = reference;
    }

    public String table() {
        return table;
    }

    public Identifier reference() {
        return reference;
    }
}
