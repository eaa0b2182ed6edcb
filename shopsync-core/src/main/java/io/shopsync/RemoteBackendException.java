package io.shopsync;

/**
 * Failure reported by the remote backend, or while talking to it. Treated as transient:
 * the sync dispatcher retries the operation until its attempt budget is spent.
 */
public class RemoteBackendException extends RuntimeException {
    private final String table;

    public RemoteBackendException(String table, String message) {
        super(message);
        this.table = table;
    }

    public RemoteBackendException(String table, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
    }

    /**
     * Returns the remote table the failing call targeted.
     *
     * @return the remote table name
     */
    public String table() {
        return table;
    }
}
