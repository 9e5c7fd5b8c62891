package org.foxesworld.zimbridge.core;

/**
 * Failure kinds raised at the script/engine boundary.
 *
 * <p>Every kind except {@link #BUFFER_STILL_VIEWED} is recoverable: the caller may abandon
 * the current archive session and carry on.</p>
 */
public enum ErrorKind {
    HANDLE_NOT_SET("Guest object not set"),
    METHOD_MISSING("Required method not implemented"),
    FOREIGN_RAISED("Guest method failed"),
    EMPTY_RESULT("Method returned an empty value"),
    TYPE_MISMATCH("Method returned a value of the wrong type"),
    SESSION_NOT_STARTED("Creator not started"),
    SESSION_ALREADY_STARTED("Creator already started"),
    SESSION_ALREADY_FINALIZED("Creator already finalized"),
    BUFFER_STILL_VIEWED("Buffer released while views are active"),
    RUNTIME_UNAVAILABLE("Script runtime is closed"),
    NOT_INITIALIZED("Wrapper is empty");

    private final String summary;

    ErrorKind(String summary) {
        this.summary = summary;
    }

    public String summary() {
        return summary;
    }

    /** Lifetime violations that may already have exposed freed memory. */
    public boolean isFatal() {
        return this == BUFFER_STILL_VIEWED;
    }
}
