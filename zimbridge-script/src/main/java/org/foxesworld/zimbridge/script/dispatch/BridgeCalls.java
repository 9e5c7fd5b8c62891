package org.foxesworld.zimbridge.script.dispatch;

import org.foxesworld.zimbridge.core.BridgeException;
import org.foxesworld.zimbridge.core.ErrorRecord;
import org.foxesworld.zimbridge.script.ForeignHandle;

/** Dispatch plus the error check every adapter performs right after it. */
public final class BridgeCalls {

    private BridgeCalls() {}

    /**
     * @throws BridgeException carrying the dispatcher's error kind and message verbatim
     */
    public static <R> R invoke(TypedDispatcher dispatcher, ForeignHandle handle, String method, ResultType<R> type) {
        ErrorRecord err = new ErrorRecord();
        R result = dispatcher.call(handle, method, type, err);
        err.raiseIfSet();
        return result;
    }
}
