package org.foxesworld.zimbridge.core;

import java.util.Objects;

/**
 * The single host-side failure type for everything that goes wrong while crossing the
 * script/engine boundary. The original guest diagnostic is kept verbatim in {@link #detail()}.
 */
public class BridgeException extends RuntimeException {

    private final ErrorKind kind;
    private final String detail;

    public BridgeException(ErrorKind kind, String detail) {
        super(formatMessage(kind, detail));
        this.kind = Objects.requireNonNull(kind, "kind");
        this.detail = detail;
    }

    public BridgeException(ErrorKind kind, String detail, Throwable cause) {
        super(formatMessage(kind, detail), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.detail = detail;
    }

    public ErrorKind kind() {
        return kind;
    }

    /** Raw diagnostic text, or null when the failure carried none. */
    public String detail() {
        return detail;
    }

    private static String formatMessage(ErrorKind kind, String detail) {
        if (detail == null || detail.isEmpty()) return kind.summary();
        return kind.summary() + ": " + detail;
    }
}
