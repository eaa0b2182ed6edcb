package io.shopsync;

/**
 * A record cannot be removed because unsynced records still reference it.
 */
public final class ReferencedRecordException extends RuntimeException {
    public ReferencedRecordException(String table, String id, int references) {
        super("Cannot delete " + table + " record " + id + ": referenced by "
                + references + " unsynced record(s)");
    }
}
