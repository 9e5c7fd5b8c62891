package org.foxesworld.zimbridge.engine.writer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.zimbridge.core.ZimbridgePlatform;
import org.foxesworld.zimbridge.engine.ArchiveException;
import org.foxesworld.zimbridge.engine.format.ContainerWriter;
import org.foxesworld.zimbridge.engine.format.EntryKind;
import org.foxesworld.zimbridge.engine.format.IndexRecord;
import org.foxesworld.zimbridge.engine.format.WriteEntry;
import org.foxesworld.zimbridge.engine.format.ContainerFormat;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Writes an archive. Configure, {@link #startCreation(Path)}, add entries, then
 * {@link #finishCreation()}.
 *
 * <p>Item metadata is read on the calling thread. Content providers and index data are drained
 * on a pool of worker threads, so providers may be called from any of them. The first worker
 * failure aborts creation; later calls rethrow it.</p>
 */
public final class Creator {

    private static final Logger log = LogManager.getLogger(Creator.class);

    public static final String WORKERS_PROPERTY = "zimbridge.workers";
    public static final long DEFAULT_CLUSTER_SIZE = 2L * 1024 * 1024;

    private static final int PROGRESS_EVERY = 1000;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private enum Phase { CONFIG, OPEN, DONE }

    // ----------------------------
    // Config
    // ----------------------------

    private boolean verbose;
    private Compression compression = Compression.ZSTD;
    private long clusterSize = DEFAULT_CLUSTER_SIZE;
    private boolean indexing;
    private String language = "";
    private int nbWorkers = Math.max(1, ZimbridgePlatform.intProperty(WORKERS_PROPERTY, 4));
    private String mainPath;

    // ----------------------------
    // Session state
    // ----------------------------

    private volatile Phase phase = Phase.CONFIG;
    private Path target;
    private FileChannel channel;
    private ExecutorService workers;

    private final ConcurrentMap<String, Slot> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Slot> metadata = new ConcurrentHashMap<>();
    private final List<CompletableFuture<Void>> tasks = new CopyOnWriteArrayList<>();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final AtomicInteger added = new AtomicInteger();
    private final AtomicLong bytesFed = new AtomicLong();

    public Creator configVerbose(boolean verbose) {
        ensureConfig();
        this.verbose = verbose;
        return this;
    }

    public Creator configCompression(Compression compression) {
        ensureConfig();
        this.compression = Objects.requireNonNull(compression, "compression");
        return this;
    }

    public Creator configClusterSize(long bytes) {
        ensureConfig();
        if (bytes <= 0) throw new IllegalArgumentException("cluster size must be > 0");
        this.clusterSize = bytes;
        return this;
    }

    public Creator configIndexing(boolean indexing, String language) {
        ensureConfig();
        this.indexing = indexing;
        this.language = language == null ? "" : language;
        return this;
    }

    public Creator configNbWorkers(int count) {
        ensureConfig();
        if (count <= 0) throw new IllegalArgumentException("worker count must be > 0");
        this.nbWorkers = count;
        return this;
    }

    /** The main path can be set at any time before {@link #finishCreation()}. */
    public Creator setMainPath(String path) {
        if (phase == Phase.DONE) throw new IllegalStateException("Creation already finished");
        this.mainPath = path;
        return this;
    }

    public Compression compression() { return compression; }
    public long clusterSize() { return clusterSize; }
    public boolean indexing() { return indexing; }
    public int nbWorkers() { return nbWorkers; }
    public boolean isStarted() { return phase != Phase.CONFIG; }
    public boolean isFinished() { return phase == Phase.DONE; }
    public boolean hasFailed() { return failure.get() != null; }

    // ----------------------------
    // Lifecycle
    // ----------------------------

    public void startCreation(Path file) throws IOException {
        ensureConfig();
        Objects.requireNonNull(file, "file");
        FileChannel ch = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);

        AtomicInteger n = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(nbWorkers, r -> {
            Thread t = new Thread(r, "zim-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.channel = ch;
        this.target = file;
        this.phase = Phase.OPEN;

        if (verbose) {
            log.info("[zim] creation started file={} workers={} compression={} clusterSize={} indexing={}",
                    file, nbWorkers, compression, clusterSize, indexing);
        }
    }

    public void addItem(Item item) {
        Objects.requireNonNull(item, "item");
        ensureOpen();

        Slot slot;
        try {
            String path = requirePath(item.getPath());
            slot = new Slot(EntryKind.ITEM, path, nullToEmpty(item.getTitle()), nullToEmpty(item.getMimeType()),
                    ContainerFormat.hintFlags(item.getHints()));
            reserve(entries, slot);
        } catch (RuntimeException e) {
            item.close();
            throw e;
        }

        submit(slot, item, () -> {
            try {
                if (indexing) slot.index = captureIndex(item);
                try (ContentProvider provider = item.getContentProvider()) {
                    if (provider == null) throw new ArchiveException("No content provider for '" + slot.path + "'");
                    slot.content = drain(provider, slot.path);
                }
            } finally {
                item.close();
            }
        });
        progress();
    }

    public void addMetadata(String name, String content) {
        addMetadata(name, new StringProvider(content), "text/plain;charset=UTF-8");
    }

    public void addMetadata(String name, byte[] content, String mimetype) {
        addMetadata(name, new StringProvider(content), mimetype);
    }

    public void addMetadata(String name, ContentProvider provider, String mimetype) {
        Objects.requireNonNull(provider, "provider");
        ensureOpen();

        Slot slot;
        try {
            slot = new Slot(EntryKind.METADATA, requirePath(name), "", nullToEmpty(mimetype), 0);
            reserve(metadata, slot);
        } catch (RuntimeException e) {
            provider.close();
            throw e;
        }

        submit(slot, provider, () -> {
            try (provider) {
                slot.content = drain(provider, slot.path);
            }
        });
    }

    public void addIllustration(int size, byte[] png) {
        if (size <= 0) throw new IllegalArgumentException("illustration size must be > 0");
        addMetadata(illustrationName(size), Objects.requireNonNull(png, "png"), "image/png");
    }

    public void addRedirection(String path, String title, String targetPath, Map<Hint, Long> hints) {
        ensureOpen();
        Slot slot = new Slot(EntryKind.REDIRECT, requirePath(path), nullToEmpty(title), "",
                ContainerFormat.hintFlags(hints));
        slot.targetPath = requirePath(targetPath);
        reserve(entries, slot);
        progress();
    }

    /** Adds {@code path} as a second name for the content of the item at {@code targetPath}. */
    public void addAlias(String path, String title, String targetPath, Map<Hint, Long> hints) {
        ensureOpen();
        Slot aliased = entries.get(requirePath(targetPath));
        if (aliased == null || aliased.kind != EntryKind.ITEM) {
            throw new ArchiveException("Impossible to alias '" + path + "': no item at '" + targetPath + "'");
        }
        Slot slot = new Slot(EntryKind.ITEM, requirePath(path), nullToEmpty(title), aliased.mimetype,
                ContainerFormat.hintFlags(hints));
        slot.aliasOf = aliased;
        reserve(entries, slot);
        progress();
    }

    public void finishCreation() {
        ensureOpen();
        try {
            awaitTasks();
            rethrowFailure();

            List<WriteEntry> out = new ArrayList<>(entries.size() + metadata.size());
            for (Slot s : entries.values()) out.add(s.toWriteEntry());
            for (Slot s : metadata.values()) out.add(s.toWriteEntry());

            ContainerWriter writer = new ContainerWriter(UUID.randomUUID(), compression, indexing, language, mainPath);
            OutputStream os = new BufferedOutputStream(Channels.newOutputStream(channel), 64 * 1024);
            int written = writer.write(os, out);
            os.flush();
            channel.force(true);

            if (verbose) {
                log.info("[zim] creation finished file={} entries={} bytesFed={}", target, written, bytesFed.get());
            }
        } catch (IOException e) {
            fail(e);
            abort();
            throw new ArchiveException("Failed to write " + target, e);
        } catch (RuntimeException e) {
            abort();
            throw e;
        }
        shutdown();
        phase = Phase.DONE;
    }

    /**
     * Stops creation and deletes the partial file. Queued entries are released without being
     * drained; a provider already being drained finishes its current call. Safe to call more
     * than once. Must not be called while holding a lock that providers need.
     */
    public void abort() {
        if (phase == Phase.DONE) return;
        boolean wasOpen = phase == Phase.OPEN;
        phase = Phase.DONE;
        if (!wasOpen) return;

        shutdown();
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            log.warn("[zim] could not delete partial archive {}", target, e);
        }
        log.warn("[zim] creation aborted file={}", target);
    }

    public static String illustrationName(int size) {
        return "Illustration_" + size + "x" + size + "@1";
    }

    // ----------------------------
    // Internals
    // ----------------------------

    /** Runs {@code task} on a worker. Once creation has failed, only {@code owned} is closed. */
    private void submit(Slot slot, AutoCloseable owned, ThrowingTask task) {
        CompletableFuture<Void> f = CompletableFuture.runAsync(() -> {
            if (failure.get() != null || phase == Phase.DONE) {
                closeQuietly(owned);
                return;
            }
            try {
                task.run();
            } catch (Throwable t) {
                fail(new ArchiveException("Content task failed for '" + slot.path + "': " + t.getMessage(), t));
            }
        }, workers);
        tasks.add(f);
    }

    private static void closeQuietly(AutoCloseable c) {
        try {
            c.close();
        } catch (Exception e) {
            log.warn("[zim] failed to release {}", c, e);
        }
    }

    private byte[] drain(ContentProvider provider, String path) {
        long expected = provider.getSize();
        if (expected < 0) throw new ArchiveException("Negative size for '" + path + "'");
        if (expected > Integer.MAX_VALUE - 8) throw new ArchiveException("Content too large for '" + path + "'");

        ByteArrayOutputStream buf = new ByteArrayOutputStream((int) expected);
        long total = 0;
        while (true) {
            Blob chunk = provider.feed();
            if (chunk == null) throw new ArchiveException("Provider for '" + path + "' returned no blob");
            if (chunk.isEmpty()) break;
            total += chunk.size();
            if (total > expected) break;
            byte[] b = chunk.toByteArray();
            buf.write(b, 0, b.length);
        }
        if (total != expected) {
            throw new ArchiveException("Incoherent size for '" + path + "': declared " + expected + ", fed at least " + total);
        }
        bytesFed.addAndGet(total);
        return buf.toByteArray();
    }

    private static IndexRecord captureIndex(Item item) {
        try (IndexData data = item.getIndexData()) {
            if (data == null || !data.hasIndexData()) return null;
            return IndexRecord.capture(data);
        }
    }

    private void reserve(ConcurrentMap<String, Slot> map, Slot slot) {
        if (map.putIfAbsent(slot.path, slot) != null) {
            throw new ArchiveException("Impossible to add '" + slot.path + "': dirent's path already exists");
        }
    }

    private void fail(Throwable t) {
        if (failure.compareAndSet(null, t)) {
            log.error("[zim] worker failure, aborting: {}", t.getMessage(), t);
        }
    }

    private void rethrowFailure() {
        Throwable t = failure.get();
        if (t == null) return;
        if (t instanceof RuntimeException re) throw re;
        throw new ArchiveException(t.getMessage(), t);
    }

    private void awaitTasks() {
        for (CompletableFuture<Void> f : tasks) {
            try {
                f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ArchiveException("Interrupted while waiting for workers", e);
            } catch (ExecutionException e) {
                fail(e.getCause());
            }
        }
    }

    private void shutdown() {
        if (workers != null) {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("[zim] workers still busy after {}s, interrupting", SHUTDOWN_TIMEOUT_SECONDS);
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workers.shutdownNow();
            }
        }
        if (channel == null) return;
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("[zim] failed to close {}", target, e);
        }
    }

    private void progress() {
        int n = added.incrementAndGet();
        if (verbose && n % PROGRESS_EVERY == 0) log.info("[zim] {} entries added", n);
    }

    private void ensureConfig() {
        if (phase != Phase.CONFIG) throw new IllegalStateException("Creator already started");
    }

    private void ensureOpen() {
        if (phase != Phase.OPEN) {
            throw new IllegalStateException(phase == Phase.CONFIG ? "Creator not started" : "Creator already finished");
        }
        rethrowFailure();
    }

    private static String requirePath(String path) {
        if (path == null || path.isEmpty()) throw new ArchiveException("Entry path must not be empty");
        return path;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    @FunctionalInterface
    private interface ThrowingTask {
        void run() throws Exception;
    }

    private static final class Slot {
        final EntryKind kind;
        final String path;
        final String title;
        final String mimetype;
        final int hintFlags;

        volatile byte[] content;
        volatile IndexRecord index;
        String targetPath;
        Slot aliasOf;

        Slot(EntryKind kind, String path, String title, String mimetype, int hintFlags) {
            this.kind = kind;
            this.path = path;
            this.title = title;
            this.mimetype = mimetype;
            this.hintFlags = hintFlags;
        }

        WriteEntry toWriteEntry() {
            byte[] data = aliasOf != null ? aliasOf.content : content;
            IndexRecord idx = aliasOf != null ? null : index;
            if (kind != EntryKind.REDIRECT && data == null) data = new byte[0];
            return new WriteEntry(kind, path, title, mimetype, data, hintFlags, targetPath, idx);
        }
    }
}
