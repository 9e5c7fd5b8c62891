package org.foxesworld.zimbridge.script.dispatch;

import org.foxesworld.zimbridge.core.ErrorKind;
import org.foxesworld.zimbridge.core.ErrorRecord;
import org.foxesworld.zimbridge.engine.writer.Blob;
import org.foxesworld.zimbridge.engine.writer.ContentProvider;
import org.foxesworld.zimbridge.engine.writer.GeoPosition;
import org.foxesworld.zimbridge.engine.writer.Hint;
import org.foxesworld.zimbridge.engine.writer.IndexData;
import org.foxesworld.zimbridge.script.ForeignHandle;
import org.foxesworld.zimbridge.script.adapter.ScriptContentProvider;
import org.foxesworld.zimbridge.script.adapter.ScriptIndexData;
import org.foxesworld.zimbridge.script.host.HostContentProvider;
import org.foxesworld.zimbridge.script.host.ScriptBlob;
import org.graalvm.polyglot.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Host type a dispatch result is converted to. Each type has a zero value returned alongside an
 * error, and a conversion run under the execution lock.
 */
public final class ResultType<R> {

    @FunctionalInterface
    interface Converter<R> {
        R convert(TypedDispatcher dispatcher, Value result, ErrorRecord err);
    }

    public static final ResultType<String> TEXT =
            new ResultType<>("text", "", (d, v, err) -> GuestValues.toText(v));

    public static final ResultType<Boolean> BOOL =
            new ResultType<>("bool", Boolean.FALSE, (d, v, err) -> GuestValues.toBool(v));

    public static final ResultType<Long> INT64 =
            new ResultType<>("int64", 0L, (d, v, err) -> GuestValues.toLong(v));

    public static final ResultType<Integer> INT32 =
            new ResultType<>("int32", 0, (d, v, err) -> GuestValues.toInt(v));

    public static final ResultType<Blob> BLOB =
            new ResultType<>("blob", Blob.empty(), ResultType::toBlob);

    public static final ResultType<ContentProvider> CONTENT_PROVIDER =
            new ResultType<>("content provider", null, ResultType::toContentProvider);

    public static final ResultType<IndexData> INDEX_DATA =
            new ResultType<>("index data", null, ResultType::toIndexData);

    public static final ResultType<Map<Hint, Long>> HINTS =
            new ResultType<>("hints", Map.of(), (d, v, err) -> GuestValues.toHints(v));

    public static final ResultType<Optional<GeoPosition>> GEO_POSITION =
            new ResultType<>("geo position", Optional.empty(), (d, v, err) -> GuestValues.toGeoPosition(v));

    private final String name;
    private final R zero;
    private final Converter<R> converter;

    private ResultType(String name, R zero, Converter<R> converter) {
        this.name = name;
        this.zero = zero;
        this.converter = converter;
    }

    public String name() {
        return name;
    }

    public R zero() {
        return zero;
    }

    R convert(TypedDispatcher dispatcher, Value result, ErrorRecord err) {
        return converter.convert(dispatcher, result, err);
    }

    @Override
    public String toString() {
        return "ResultType{" + name + '}';
    }

    // ---- conversions that need more than a value ----

    private static Blob toBlob(TypedDispatcher d, Value v, ErrorRecord err) {
        if (GuestValues.isNull(v)) {
            err.set(ErrorKind.EMPTY_RESULT, "feed() returned null; return an empty blob to end the stream");
            return Blob.empty();
        }
        if (v.isHostObject() && v.asHostObject() instanceof ScriptBlob b) return b.blob();
        return Blob.of(GuestValues.toBytes(v));
    }

    private static ContentProvider toContentProvider(TypedDispatcher d, Value v, ErrorRecord err) {
        if (GuestValues.isNull(v)) {
            err.set(ErrorKind.EMPTY_RESULT, "no content provider returned");
            return null;
        }
        if (v.isHostObject()) {
            if (v.asHostObject() instanceof HostContentProvider p) return p.provider();
            throw new GuestValues.Mismatch("expected content provider, got " + GuestValues.describe(v));
        }
        if (!v.hasMembers() || v.isString()) {
            err.set(ErrorKind.EMPTY_RESULT, "content provider is not an object: " + GuestValues.describe(v));
            return null;
        }
        return new ScriptContentProvider(ForeignHandle.acquire(d.runtime(), v), d);
    }

    private static IndexData toIndexData(TypedDispatcher d, Value v, ErrorRecord err) {
        if (GuestValues.isNull(v)) return null;
        if (!v.hasMembers() || v.isString() || v.isHostObject()) {
            throw new GuestValues.Mismatch("expected index data object, got " + GuestValues.describe(v));
        }
        return new ScriptIndexData(ForeignHandle.acquire(d.runtime(), v), d);
    }
}
