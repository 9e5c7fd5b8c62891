package org.foxesworld.zimbridge.core;

/**
 * Out-of-band error channel filled by a dispatch into guest code and checked by the caller
 * right after the dispatch returns.
 *
 * <p>Not thread-safe: one record belongs to one call.</p>
 */
public final class ErrorRecord {

    private ErrorKind kind;
    private String message;

    /** Stores the first failure; later writes are ignored so the root cause survives. */
    public void set(ErrorKind kind, String message) {
        if (this.kind != null) return;
        this.kind = kind;
        this.message = message == null ? "" : message;
    }

    public boolean isSet() {
        return kind != null;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String message() {
        return message;
    }

    public void clear() {
        kind = null;
        message = null;
    }

    /**
     * Converts a recorded failure into a {@link BridgeException}. Does nothing when the record
     * is clear.
     */
    public void raiseIfSet() {
        if (kind == null) return;
        ErrorKind k = kind;
        String m = message;
        clear();
        throw new BridgeException(k, m);
    }

    @Override
    public String toString() {
        return kind == null ? "ErrorRecord{clear}" : "ErrorRecord{" + kind + ": " + message + '}';
    }
}
