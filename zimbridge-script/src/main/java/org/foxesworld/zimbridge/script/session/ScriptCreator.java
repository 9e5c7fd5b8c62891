package org.foxesworld.zimbridge.script.session;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.zimbridge.core.BridgeException;
import org.foxesworld.zimbridge.core.ErrorKind;
import org.foxesworld.zimbridge.engine.writer.Compression;
import org.foxesworld.zimbridge.engine.writer.ContentProvider;
import org.foxesworld.zimbridge.engine.writer.Creator;
import org.foxesworld.zimbridge.engine.writer.Hint;
import org.foxesworld.zimbridge.engine.writer.StringProvider;
import org.foxesworld.zimbridge.script.ForeignHandle;
import org.foxesworld.zimbridge.script.ScriptRuntime;
import org.foxesworld.zimbridge.script.adapter.ScriptContentProvider;
import org.foxesworld.zimbridge.script.adapter.ScriptItem;
import org.foxesworld.zimbridge.script.dispatch.GuestValues;
import org.foxesworld.zimbridge.script.dispatch.TypedDispatcher;
import org.foxesworld.zimbridge.script.host.HostContentProvider;
import org.graalvm.polyglot.Value;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * An archive creation session fed from script objects.
 *
 * <pre>
 * UNCONFIGURED --start--> STARTED --finalizeArchive--> FINALIZED
 * </pre>
 * Configuration is only accepted before {@link #start(Path)}; submissions only while started.
 * A call in the wrong state fails without touching the engine.
 *
 * <p>Sessions are driven from host code. The engine's workers call back into the script
 * context while content drains, so {@link #finalizeArchive()} must not be called from inside a
 * script call. A worker failure aborts the session: the next call rethrows it and the partial
 * file is removed.</p>
 */
public final class ScriptCreator implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(ScriptCreator.class);

    private static final String TEXT_MIMETYPE = "text/plain;charset=UTF-8";

    private final ScriptRuntime runtime;
    private final TypedDispatcher dispatcher;
    private final Creator creator;

    private volatile SessionState state = SessionState.UNCONFIGURED;
    private Path path;

    public ScriptCreator(ScriptRuntime runtime) {
        this(runtime, new Creator());
    }

    public ScriptCreator(ScriptRuntime runtime, Creator creator) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.creator = Objects.requireNonNull(creator, "creator");
        this.dispatcher = new TypedDispatcher(runtime);
    }

    public SessionState state() {
        return state;
    }

    public Path path() {
        return path;
    }

    public boolean isAborted() {
        return creator.hasFailed();
    }

    // ----------------------------
    // Config
    // ----------------------------

    public ScriptCreator configVerbose(boolean verbose) {
        requireUnconfigured();
        creator.configVerbose(verbose);
        return this;
    }

    public ScriptCreator configCompression(Compression compression) {
        requireUnconfigured();
        creator.configCompression(compression);
        return this;
    }

    public ScriptCreator configCompression(String name) {
        requireUnconfigured();
        creator.configCompression(Compression.fromName(name));
        return this;
    }

    /** Unknown ordinals select no compression. */
    public ScriptCreator configCompression(int ordinal) {
        requireUnconfigured();
        creator.configCompression(Compression.fromOrdinal(ordinal));
        return this;
    }

    public ScriptCreator configClusterSize(long bytes) {
        requireUnconfigured();
        creator.configClusterSize(bytes);
        return this;
    }

    public ScriptCreator configIndexing(boolean indexing, String language) {
        requireUnconfigured();
        creator.configIndexing(indexing, language);
        return this;
    }

    public ScriptCreator configNbWorkers(int count) {
        requireUnconfigured();
        creator.configNbWorkers(count);
        return this;
    }

    public ScriptCreator setMainPath(String mainPath) {
        requireUnconfigured();
        creator.setMainPath(mainPath);
        return this;
    }

    // ----------------------------
    // Lifecycle
    // ----------------------------

    public ScriptCreator start(Path file) {
        requireUnconfigured();
        try {
            creator.startCreation(file);
        } catch (IOException e) {
            log.error("[session] cannot open {}: {}", file, e.getMessage());
            throw new UncheckedIOException("Cannot create archive " + file, e);
        }
        this.path = file;
        this.state = SessionState.STARTED;
        log.debug("[session] started {}", file);
        return this;
    }

    /** Hands a script item to the engine. The item is read through its methods, never copied. */
    public void submitItem(Value item) {
        requireStarted();
        ScriptItem adapter = new ScriptItem(ForeignHandle.acquire(runtime, item), dispatcher);
        try {
            engine(() -> creator.addItem(adapter));
        } catch (RuntimeException e) {
            adapter.close();
            throw e;
        }
    }

    public void submitMetadata(String name, String content) {
        submitMetadata(name, content, TEXT_MIMETYPE);
    }

    public void submitMetadata(String name, String content, String mimetype) {
        requireStarted();
        engine(() -> creator.addMetadata(name, new StringProvider(content), mimetype));
    }

    /**
     * @param content a string, bytes, a {@code zim.*Provider}, or a script object with
     *                {@code get_size()} and {@code feed()}
     */
    public void submitMetadata(String name, Value content, String mimetype) {
        requireStarted();
        ContentProvider provider = runtime.withLock(() -> metadataProvider(content));
        try {
            engine(() -> creator.addMetadata(name, provider, mimetype));
        } catch (RuntimeException e) {
            provider.close();
            throw e;
        }
    }

    public void submitRedirect(String path, String title, String targetPath, Map<Hint, Long> hints) {
        requireStarted();
        engine(() -> creator.addRedirection(path, title, targetPath, hints));
    }

    public void submitRedirect(String path, String title, String targetPath, Value hints) {
        requireStarted();
        submitRedirect(path, title, targetPath, hints(hints));
    }

    public void submitAlias(String path, String title, String targetPath, Map<Hint, Long> hints) {
        requireStarted();
        engine(() -> creator.addAlias(path, title, targetPath, hints));
    }

    public void submitAlias(String path, String title, String targetPath, Value hints) {
        requireStarted();
        submitAlias(path, title, targetPath, hints(hints));
    }

    public void submitIllustration(int size, byte[] png) {
        requireStarted();
        engine(() -> creator.addIllustration(size, png));
    }

    public void submitIllustration(int size, Value png) {
        requireStarted();
        byte[] bytes = runtime.withLock(() -> GuestValues.toBytes(png));
        if (bytes == null) throw new BridgeException(ErrorKind.EMPTY_RESULT, "illustration data is null");
        submitIllustration(size, bytes);
    }

    /** Waits for every provider to drain and writes the archive. Runs at most once. */
    public void finalizeArchive() {
        if (runtime.lock().isHeldByCurrentThread()) {
            throw new IllegalStateException("finalizeArchive() called from inside a script call; "
                    + "engine workers need the execution lock to drain content");
        }
        requireStarted();
        state = SessionState.FINALIZED;
        try {
            creator.finishCreation();
            log.debug("[session] finalized {}", path);
        } catch (RuntimeException e) {
            log.error("[session] finalize of {} failed: {}", path, e.getMessage());
            throw e;
        }
    }

    /** Finalizes a started session; otherwise does nothing. */
    @Override
    public void close() {
        if (state == SessionState.STARTED) finalizeArchive();
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private void engine(Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            if (creator.hasFailed() && state == SessionState.STARTED) {
                state = SessionState.FINALIZED;
                creator.abort();
                log.error("[session] aborted {} after engine failure: {}", path, e.getMessage());
            }
            throw e;
        }
    }

    private ContentProvider metadataProvider(Value content) {
        if (GuestValues.isNull(content)) throw new BridgeException(ErrorKind.EMPTY_RESULT, "metadata content is null");
        if (content.isHostObject() && content.asHostObject() instanceof HostContentProvider p) return p.provider();
        if (!content.isString() && !content.hasBufferElements() && !content.hasArrayElements()
                && !content.isHostObject() && content.hasMember("feed")) {
            return new ScriptContentProvider(ForeignHandle.acquire(runtime, content), dispatcher);
        }
        try {
            return new StringProvider(GuestValues.toBytes(content));
        } catch (GuestValues.Mismatch e) {
            throw new BridgeException(ErrorKind.TYPE_MISMATCH, "metadata content: " + e.getMessage());
        }
    }

    private Map<Hint, Long> hints(Value hints) {
        try {
            return runtime.withLock(() -> GuestValues.toHints(hints));
        } catch (GuestValues.Mismatch e) {
            throw new BridgeException(ErrorKind.TYPE_MISMATCH, "hints: " + e.getMessage());
        }
    }

    private void requireUnconfigured() {
        if (state != SessionState.UNCONFIGURED) {
            throw new BridgeException(ErrorKind.SESSION_ALREADY_STARTED, "session is " + state);
        }
    }

    private void requireStarted() {
        if (state == SessionState.UNCONFIGURED) throw new BridgeException(ErrorKind.SESSION_NOT_STARTED, null);
        if (state == SessionState.FINALIZED) throw new BridgeException(ErrorKind.SESSION_ALREADY_FINALIZED, String.valueOf(path));
    }
}
