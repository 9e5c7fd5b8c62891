package org.foxesworld.zimbridge.script;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.zimbridge.core.BridgeException;
import org.foxesworld.zimbridge.core.ErrorKind;
import org.foxesworld.zimbridge.core.ZimbridgePlatform;
import org.foxesworld.zimbridge.script.cache.ScriptCaches;
import org.foxesworld.zimbridge.script.host.ZimNamespace;
import org.foxesworld.zimbridge.script.profiler.DispatchProfiler;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Hosts one GraalVM JavaScript {@link Context} and everything that enters it.
 *
 * <p>The context is entered from the host thread and from engine worker threads. Every
 * entry goes through {@link #lock()}; only one thread is inside the context at a time. The
 * runtime also keeps the pin table: how many host handles currently hold each guest object.</p>
 *
 * <p>Security: host class lookup is disabled; host access is restricted to members annotated
 * with {@link HostAccess.Export}, plus buffer, array and map access so host byte buffers and
 * collections read naturally from JS.</p>
 */
public final class ScriptRuntime implements Closeable {

    private static final Logger log = LogManager.getLogger(ScriptRuntime.class);

    public static final String PROFILER_PROPERTY = "zimbridge.profiler";
    public static final String FULL_STACK_TRACE_PROPERTY = "zimbridge.fullStackTrace";

    /** Must return a fresh stream per call, or null when the module does not exist. */
    @FunctionalInterface
    public interface ModuleStreamProvider {
        InputStream openStream(String moduleId) throws Exception;
    }

    private final Context ctx;
    private final ExecutionLock lock = new ExecutionLock();
    private final ScriptCaches caches;
    private final DispatchProfiler profiler;
    private final boolean fullStackTrace;

    // guarded by lock
    private final Map<Value, Integer> pins = new HashMap<>();
    private final Map<String, Value> modules = new HashMap<>();

    private volatile ModuleStreamProvider streamLoader;
    private volatile boolean closed;

    public ScriptRuntime() {
        this(ScriptCaches.defaults());
    }

    public ScriptRuntime(ScriptCaches caches) {
        this.caches = Objects.requireNonNull(caches, "caches");
        this.profiler = new DispatchProfiler().setEnabled(Boolean.getBoolean(PROFILER_PROPERTY));
        this.fullStackTrace = Boolean.getBoolean(FULL_STACK_TRACE_PROPERTY);

        this.ctx = Context.newBuilder("js")
                .allowExperimentalOptions(true)
                .option("engine.WarnInterpreterOnly", "false")
                .allowHostAccess(HostAccess.newBuilder(HostAccess.NONE)
                        .allowAccessAnnotatedBy(HostAccess.Export.class)
                        .allowBufferAccess(true)
                        .allowArrayAccess(true)
                        .allowMapAccess(true)
                        .build())
                .allowHostClassLookup(className -> false)
                .allowAllAccess(false)
                .build();

        try (ExecutionLock.Scope s = lock.enter()) {
            Value bindings = ctx.getBindings("js");
            ProxyExecutable req = args -> requireFrom("", args.length > 0 ? args[0].asString() : "");
            bindings.putMember("require", req);
            bindings.putMember("zim", ZimNamespace.create());
        }

        log.info("[script] runtime ready java={} os={} cpus={} profiler={}",
                ZimbridgePlatform.java(), ZimbridgePlatform.os(), ZimbridgePlatform.cpus(), profiler.isEnabled());
    }

    public ExecutionLock lock() {
        return lock;
    }

    public DispatchProfiler profiler() {
        return profiler;
    }

    /** Whether guest error reports carry the full host stack trace instead of just the guest one. */
    public boolean fullStackTrace() {
        return fullStackTrace;
    }

    public ScriptRuntime setModuleStreamProvider(ModuleStreamProvider loader) {
        this.streamLoader = loader;
        return this;
    }

    /** Serves module ids from the classpath under {@code root}. */
    public static ModuleStreamProvider classpath(String root) {
        String base = normalizeId(root);
        ClassLoader cl = ScriptRuntime.class.getClassLoader();
        return moduleId -> cl.getResourceAsStream(base.isEmpty() ? moduleId : base + "/" + moduleId);
    }

    // ---------------------------------------------------------------------
    // Entering the context
    // ---------------------------------------------------------------------

    /** Runs {@code body} under the execution lock. */
    public <T> T withLock(Supplier<T> body) {
        try (ExecutionLock.Scope s = lock.enter()) {
            ensureOpen();
            return body.get();
        }
    }

    public Value eval(String code) {
        return eval("inline.js", code);
    }

    public Value eval(String name, String code) {
        Objects.requireNonNull(code, "code");
        return withLock(() -> ctx.eval(source(name, code)));
    }

    /** Executes a guest function with host arguments. */
    public Value invoke(Value fn, Object... args) {
        return withLock(() -> fn.execute(args));
    }

    public Value asValue(Object host) {
        return withLock(() -> ctx.asValue(host));
    }

    /** Loads a CommonJS module through the configured {@link ModuleStreamProvider}. */
    public Value load(String moduleId) {
        return withLock(() -> requireFrom("", moduleId));
    }

    // ---------------------------------------------------------------------
    // Pin table
    // ---------------------------------------------------------------------

    void pin(Value value) {
        try (ExecutionLock.Scope s = lock.enter()) {
            if (closed) throw new BridgeException(ErrorKind.RUNTIME_UNAVAILABLE, "script runtime is closed");
            pins.merge(value, 1, Integer::sum);
        }
    }

    /** Unpins one reference. Unpinning after close is a no-op; the context already let go. */
    void unpin(Value value) {
        try (ExecutionLock.Scope s = lock.enter()) {
            if (closed) return;
            if (!pins.containsKey(value)) {
                log.warn("[script] unpin of a guest object that is not pinned");
                return;
            }
            pins.computeIfPresent(value, (k, n) -> n > 1 ? n - 1 : null);
        }
    }

    /** Host handles currently holding {@code value}. */
    public int pinCount(Value value) {
        try (ExecutionLock.Scope s = lock.enter()) {
            if (closed) return 0;
            return pins.getOrDefault(value, 0);
        }
    }

    /** Sum of all pins. */
    public int pinnedTotal() {
        try (ExecutionLock.Scope s = lock.enter()) {
            int total = 0;
            for (int n : pins.values()) total += n;
            return total;
        }
    }

    // ---------------------------------------------------------------------
    // CommonJS loader
    // ---------------------------------------------------------------------

    private Value requireFrom(String parentId, String request) {
        String base = resolveRequest(parentId, request);
        String[] candidates = hasExtension(base)
                ? new String[]{base}
                : new String[]{base + ".js", base + "/index.js"};

        for (String id : candidates) {
            Value cached = modules.get(id);
            if (cached != null) return cached;
        }

        ModuleStreamProvider l = streamLoader;
        if (l == null) {
            throw new IllegalStateException("require('" + request + "') called but no ModuleStreamProvider is set");
        }

        String moduleId = null;
        String code = null;
        for (String id : candidates) {
            String text = caches.moduleText().get(id, key -> readModule(l, key));
            if (text != null) {
                moduleId = id;
                code = text;
                break;
            }
        }
        if (code == null) {
            String msg = "Module not found: request='" + request + "' parent='" + parentId + "' tried=" + String.join(", ", candidates);
            log.error("[script] {}", msg);
            throw new IllegalStateException(msg);
        }

        Value module = ctx.eval("js", "({ exports: {} })");
        modules.put(moduleId, module.getMember("exports"));
        try {
            String wrapped = "(function(module, exports, require, __filename, __dirname) {\n'use strict';\n"
                    + code + "\n})";
            Value fn = ctx.eval(source(moduleId, wrapped));

            final String self = moduleId;
            ProxyExecutable localRequire = args -> requireFrom(self, args.length > 0 ? args[0].asString() : "");
            fn.execute(module, module.getMember("exports"), localRequire, moduleId, dirnameOf(moduleId));

            Value exports = module.getMember("exports");
            modules.put(moduleId, exports);
            log.debug("[script] loaded module {}", moduleId);
            return exports;
        } catch (RuntimeException e) {
            modules.remove(moduleId);
            caches.invalidateModule(moduleId);
            log.error("[script] failed to evaluate module {}", moduleId, e);
            throw e;
        }
    }

    private Source source(String name, String code) {
        return caches.sources().get(ScriptCaches.SourceKey.of(name, code),
                k -> Source.newBuilder("js", code, name).buildLiteral());
    }

    private static String readModule(ModuleStreamProvider l, String id) {
        try (InputStream in = l.openStream(id)) {
            if (in == null) return null;
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read module " + id, e);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to open module " + id, e);
        }
    }

    /** Resolves "./" and "../" against the parent's directory. */
    private static String resolveRequest(String parentId, String request) {
        String req = request == null ? "" : request.trim().replace('\\', '/');
        if (!req.startsWith("./") && !req.startsWith("../")) return normalizeId(req);

        Deque<String> parts = new ArrayDeque<>();
        for (String p : dirnameOf(parentId).split("/")) {
            if (!p.isEmpty()) parts.addLast(p);
        }
        for (String p : req.split("/")) {
            if (p.isEmpty() || ".".equals(p)) continue;
            if ("..".equals(p)) {
                if (!parts.isEmpty()) parts.removeLast();
            } else {
                parts.addLast(p);
            }
        }
        return String.join("/", parts);
    }

    private static String normalizeId(String id) {
        if (id == null) return "";
        String s = id.trim().replace('\\', '/');
        while (s.startsWith("./")) s = s.substring(2);
        while (s.startsWith("/")) s = s.substring(1);
        while (s.contains("//")) s = s.replace("//", "/");
        while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        return s;
    }

    private static String dirnameOf(String id) {
        if (id == null) return "";
        int idx = id.lastIndexOf('/');
        return idx < 0 ? "" : id.substring(0, idx);
    }

    private static boolean hasExtension(String id) {
        return id.lastIndexOf('.') > id.lastIndexOf('/');
    }

    // ---------------------------------------------------------------------
    // Close
    // ---------------------------------------------------------------------

    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen() {
        if (closed) throw new BridgeException(ErrorKind.RUNTIME_UNAVAILABLE, "script runtime is closed");
    }

    @Override
    public void close() {
        try (ExecutionLock.Scope s = lock.enter()) {
            if (closed) return;
            closed = true;
            if (!pins.isEmpty()) log.warn("[script] closing with {} pinned guest object(s)", pins.size());
            pins.clear();
            modules.clear();
            caches.invalidateAll();
        }
        if (profiler.isEnabled()) profiler.report();
        log.info("[script] closing runtime");
        try {
            ctx.close(true);
        } catch (Exception e) {
            log.warn("[script] error closing Graal context", e);
        }
    }
}
