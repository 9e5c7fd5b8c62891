package org.foxesworld.zimbridge.script.dispatch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.zimbridge.core.BridgeException;
import org.foxesworld.zimbridge.core.ErrorKind;
import org.foxesworld.zimbridge.core.ErrorRecord;
import org.foxesworld.zimbridge.script.ExecutionLock;
import org.foxesworld.zimbridge.script.ForeignHandle;
import org.foxesworld.zimbridge.script.ScriptRuntime;
import org.foxesworld.zimbridge.script.profiler.DispatchProfiler;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Value;

import java.util.Objects;

/**
 * Calls a zero-argument method on a guest object by name and converts the result to a host
 * type. Safe to use from any thread: the call and the conversion run under the runtime's
 * execution lock.
 *
 * <p>Guest-side failures never escape as exceptions. They are written to the caller's
 * {@link ErrorRecord} and the type's zero value is returned; the caller checks the record right
 * after (see {@link BridgeCalls}). Only a null or moved-from handle throws, since that is a
 * host bug.</p>
 */
public final class TypedDispatcher {

    private static final Logger log = LogManager.getLogger(TypedDispatcher.class);

    private final ScriptRuntime runtime;

    public TypedDispatcher(ScriptRuntime runtime) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
    }

    public ScriptRuntime runtime() {
        return runtime;
    }

    public <R> R call(ForeignHandle handle, String method, ResultType<R> type, ErrorRecord err) {
        if (handle == null || !handle.isSet()) {
            throw new BridgeException(ErrorKind.HANDLE_NOT_SET, "cannot call " + method + "() on an unset handle");
        }

        DispatchProfiler profiler = runtime.profiler();
        long t0 = profiler.begin();
        try (ExecutionLock.Scope s = runtime.lock().enter()) {
            return dispatch(handle, method, type, err);
        } finally {
            profiler.end(method, t0, !err.isSet());
        }
    }

    /** Whether the guest object has an executable member {@code method}. */
    public boolean hasMethod(ForeignHandle handle, String method) {
        if (handle == null || !handle.isSet()) {
            throw new BridgeException(ErrorKind.HANDLE_NOT_SET, "cannot look up " + method + "() on an unset handle");
        }
        try (ExecutionLock.Scope s = runtime.lock().enter()) {
            if (runtime.isClosed()) return false;
            Value target = handle.value();
            return target.hasMember(method) && target.getMember(method).canExecute();
        } catch (PolyglotException e) {
            log.debug("[dispatch] lookup of {}() raised: {}", method, e.getMessage());
            return false;
        }
    }

    private <R> R dispatch(ForeignHandle handle, String method, ResultType<R> type, ErrorRecord err) {
        if (runtime.isClosed()) {
            err.set(ErrorKind.RUNTIME_UNAVAILABLE, "script runtime closed before " + method + "()");
            return type.zero();
        }

        Value target = handle.value();
        Value result;
        try {
            if (!target.hasMember(method) || !target.getMember(method).canExecute()) {
                err.set(ErrorKind.METHOD_MISSING, "object has no method " + method + "()");
                return type.zero();
            }
            result = target.invokeMember(method);
        } catch (PolyglotException e) {
            err.set(ErrorKind.FOREIGN_RAISED, GuestErrors.format(method, e, runtime.fullStackTrace()));
            return type.zero();
        }

        try {
            R r = type.convert(this, result, err);
            return err.isSet() ? type.zero() : r;
        } catch (GuestValues.Mismatch e) {
            err.set(ErrorKind.TYPE_MISMATCH, method + "() must return " + type.name() + ": " + e.getMessage());
        } catch (PolyglotException e) {
            err.set(ErrorKind.FOREIGN_RAISED, GuestErrors.format(method, e, runtime.fullStackTrace()));
        } catch (ClassCastException | IllegalStateException e) {
            err.set(ErrorKind.TYPE_MISMATCH, method + "() must return " + type.name() + ": " + GuestErrors.message(e));
        }
        return type.zero();
    }
}
