package org.foxesworld.zimbridge.script.dispatch;

import org.foxesworld.zimbridge.core.ErrorKind;
import org.foxesworld.zimbridge.engine.writer.GeoPosition;
import org.foxesworld.zimbridge.engine.writer.Hint;
import org.foxesworld.zimbridge.script.host.ScriptBlob;
import org.graalvm.polyglot.Value;

import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Conversions from guest values to host types. Callers hold the execution lock. Failures are
 * reported as {@link Mismatch} and turned into {@link ErrorKind#TYPE_MISMATCH} by the dispatcher.
 */
public final class GuestValues {

    private GuestValues() {}

    public static boolean isNull(Value v) {
        return v == null || v.isNull();
    }

    public static Value member(Value v, String key) {
        return (v != null && v.hasMember(key)) ? v.getMember(key) : null;
    }

    public static String str(Value v, String key, String def) {
        Value m = member(v, key);
        if (isNull(m)) return def;
        return m.isString() ? m.asString() : m.toString();
    }

    /** JS-style kind name for error messages. */
    public static String describe(Value v) {
        if (isNull(v)) return "null";
        if (v.isString()) return "string";
        if (v.isBoolean()) return "boolean";
        if (v.isNumber()) return "number";
        if (v.isHostObject()) return "host " + v.asHostObject().getClass().getSimpleName();
        if (v.hasArrayElements()) return "array";
        if (v.canExecute()) return "function";
        if (v.hasMembers()) return "object";
        return v.toString();
    }

    // ---- scalars ----

    public static String toText(Value v) {
        if (isNull(v)) return "";
        if (v.isString()) return v.asString();
        throw new Mismatch("expected string, got " + describe(v));
    }

    /** JS truthiness. */
    public static boolean toBool(Value v) {
        if (isNull(v)) return false;
        if (v.isBoolean()) return v.asBoolean();
        if (v.isNumber()) {
            double d = v.asDouble();
            return d != 0.0 && !Double.isNaN(d);
        }
        if (v.isString()) return !v.asString().isEmpty();
        return true;
    }

    /** Integral numbers pass through; fractional ones are truncated toward zero. */
    public static long toLong(Value v) {
        if (isNull(v) || !v.isNumber()) throw new Mismatch("expected number, got " + describe(v));
        if (v.fitsInLong()) return v.asLong();
        double d = v.asDouble();
        if (Double.isNaN(d) || Double.isInfinite(d)) throw new Mismatch("expected finite number, got " + d);
        return (long) d;
    }

    /** Narrows like {@link #toLong}, then keeps the low 32 bits. */
    public static int toInt(Value v) {
        return (int) toLong(v);
    }

    // ---- bytes ----

    /**
     * Copies a guest payload out of the context: a string (UTF-8), an ArrayBuffer or typed array,
     * an array of numbers, or a host {@code ScriptBlob}.
     *
     * @return the bytes, or null when {@code v} is null or undefined
     */
    public static byte[] toBytes(Value v) {
        if (isNull(v)) return null;
        if (v.isString()) return v.asString().getBytes(StandardCharsets.UTF_8);
        if (v.isHostObject() && v.asHostObject() instanceof ScriptBlob b) return b.blob().toByteArray();
        if (v.hasBufferElements()) {
            long n = v.getBufferSize();
            if (n > Integer.MAX_VALUE) throw new Mismatch("buffer too large: " + n);
            byte[] out = new byte[(int) n];
            for (int i = 0; i < out.length; i++) out[i] = v.readBufferByte(i);
            return out;
        }
        if (v.hasArrayElements()) {
            long n = v.getArraySize();
            if (n > Integer.MAX_VALUE) throw new Mismatch("array too large: " + n);
            byte[] out = new byte[(int) n];
            for (int i = 0; i < out.length; i++) {
                Value e = v.getArrayElement(i);
                if (!e.isNumber()) throw new Mismatch("byte array element " + i + " is " + describe(e));
                out[i] = (byte) e.asInt();
            }
            return out;
        }
        throw new Mismatch("expected string or bytes, got " + describe(v));
    }

    // ---- structured ----

    /**
     * Reads a hint mapping from a plain object, a JS {@code Map} or a host map. Keys are hint
     * names; unknown keys are skipped. Values are numbers, booleans count as 1 or 0.
     */
    public static Map<Hint, Long> toHints(Value v) {
        Map<Hint, Long> out = new EnumMap<>(Hint.class);
        if (isNull(v)) return out;

        if (v.hasHashEntries()) {
            Value it = v.getHashEntriesIterator();
            while (it.hasIteratorNextElement()) {
                Value entry = it.getIteratorNextElement();
                putHint(out, entry.getArrayElement(0), entry.getArrayElement(1));
            }
            return out;
        }
        if (v.hasMembers() && !v.isHostObject()) {
            for (String key : v.getMemberKeys()) {
                putHint(out, key, v.getMember(key));
            }
            return out;
        }
        throw new Mismatch("expected hints object, got " + describe(v));
    }

    private static void putHint(Map<Hint, Long> out, Value key, Value value) {
        String name;
        if (key.isString()) {
            name = key.asString();
        } else if (key.isHostObject() && key.asHostObject() instanceof Hint h) {
            name = h.name();
        } else {
            return;
        }
        putHint(out, name, value);
    }

    private static void putHint(Map<Hint, Long> out, String name, Value value) {
        Hint hint = Hint.fromName(name);
        if (hint == null) return;
        long n = value.isBoolean() ? (value.asBoolean() ? 1L : 0L) : toLong(value);
        out.put(hint, n);
    }

    /** {@code [lat, lon]} or {@code {lat, lon}} (also {@code latitude}/{@code longitude}). */
    public static Optional<GeoPosition> toGeoPosition(Value v) {
        if (isNull(v)) return Optional.empty();
        double lat;
        double lon;
        if (v.hasArrayElements()) {
            if (v.getArraySize() < 2) throw new Mismatch("geo position needs two elements");
            lat = toDouble(v.getArrayElement(0));
            lon = toDouble(v.getArrayElement(1));
        } else if (v.hasMembers()) {
            Value la = v.hasMember("lat") ? v.getMember("lat") : member(v, "latitude");
            Value lo = v.hasMember("lon") ? v.getMember("lon") : member(v, "longitude");
            lat = toDouble(la);
            lon = toDouble(lo);
        } else {
            throw new Mismatch("expected [lat, lon], got " + describe(v));
        }
        try {
            return Optional.of(new GeoPosition(lat, lon));
        } catch (IllegalArgumentException e) {
            throw new Mismatch(e.getMessage());
        }
    }

    private static double toDouble(Value v) {
        if (isNull(v) || !v.isNumber()) throw new Mismatch("expected number, got " + describe(v));
        return v.asDouble();
    }

    /** A guest value that does not have the kind the caller asked for. */
    public static final class Mismatch extends RuntimeException {
        public Mismatch(String message) {
            super(message);
        }
    }
}
