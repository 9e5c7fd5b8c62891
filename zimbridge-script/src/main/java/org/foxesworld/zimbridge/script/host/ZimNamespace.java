package org.foxesworld.zimbridge.script.host;

import org.foxesworld.zimbridge.engine.writer.Blob;
import org.foxesworld.zimbridge.engine.writer.Compression;
import org.foxesworld.zimbridge.engine.writer.FileProvider;
import org.foxesworld.zimbridge.engine.writer.Hint;
import org.foxesworld.zimbridge.engine.writer.StringProvider;
import org.foxesworld.zimbridge.script.dispatch.GuestValues;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.graalvm.polyglot.proxy.ProxyObject;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The global {@code zim} object:
 * <pre>
 * zim.Blob(stringOrBytes)           host blob, copied once
 * zim.StringProvider(stringOrBytes) host content provider
 * zim.FileProvider(path)            host content provider reading a file
 * zim.Hint.FRONT_ARTICLE            hint names, usable as object keys
 * zim.Compression.ZSTD              compression names
 * </pre>
 */
public final class ZimNamespace {

    private ZimNamespace() {}

    public static ProxyObject create() {
        Map<String, Object> ns = new LinkedHashMap<>();
        ns.put("Blob", (ProxyExecutable) args -> new ScriptBlob(Blob.of(bytesArg(args, "Blob"))));
        ns.put("StringProvider", (ProxyExecutable) args ->
                new HostContentProvider(new StringProvider(bytesArg(args, "StringProvider"))));
        ns.put("FileProvider", (ProxyExecutable) args -> {
            if (args.length == 0 || !args[0].isString()) throw new IllegalArgumentException("FileProvider(path) needs a path string");
            return new HostContentProvider(new FileProvider(Path.of(args[0].asString())));
        });
        ns.put("Hint", names(Hint.values()));
        ns.put("Compression", names(Compression.values()));
        return ProxyObject.fromMap(ns);
    }

    private static byte[] bytesArg(Value[] args, String fn) {
        byte[] b = args.length > 0 ? GuestValues.toBytes(args[0]) : null;
        if (b == null) throw new IllegalArgumentException(fn + "() needs a string or bytes argument");
        return b;
    }

    private static ProxyObject names(Enum<?>[] values) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (Enum<?> e : values) m.put(e.name(), e.name());
        return ProxyObject.fromMap(m);
    }
}
