package org.foxesworld.zimbridge.script.dispatch;

import org.graalvm.polyglot.PolyglotException;

import java.io.PrintWriter;
import java.io.StringWriter;

/** Turns an exception raised by guest code into the text carried by an error record. */
public final class GuestErrors {

    private GuestErrors() {}

    /**
     * The guest message followed by the guest frames. With {@code fullStackTrace} the whole
     * host stack trace is appended as well.
     */
    public static String format(String method, PolyglotException e, boolean fullStackTrace) {
        StringBuilder sb = new StringBuilder();
        sb.append(method).append("(): ").append(message(e));
        for (PolyglotException.StackFrame f : e.getPolyglotStackTrace()) {
            if (f.isGuestFrame()) sb.append("\n    at ").append(f);
        }
        if (fullStackTrace) {
            StringWriter sw = new StringWriter();
            e.printStackTrace(new PrintWriter(sw));
            sb.append('\n').append(sw);
        }
        return sb.toString();
    }

    public static String message(Throwable t) {
        String msg = t.getMessage();
        return msg != null ? msg : t.getClass().getName();
    }
}
