package org.foxesworld.zimbridge.script.session;

import org.foxesworld.zimbridge.core.BridgeException;
import org.foxesworld.zimbridge.core.ErrorKind;
import org.foxesworld.zimbridge.engine.ArchiveException;
import org.foxesworld.zimbridge.engine.format.IndexRecord;
import org.foxesworld.zimbridge.engine.reader.Archive;
import org.foxesworld.zimbridge.engine.reader.Entry;
import org.foxesworld.zimbridge.engine.writer.Compression;
import org.foxesworld.zimbridge.engine.writer.Hint;
import org.foxesworld.zimbridge.script.ScriptRuntime;
import org.graalvm.polyglot.Value;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ScriptCreatorTest {

    @TempDir
    Path dir;

    ScriptRuntime runtime;
    Value items;

    @BeforeEach
    void setUp() {
        runtime = new ScriptRuntime().setModuleStreamProvider(ScriptRuntime.classpath("scripts"));
        items = runtime.load("items");
    }

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    private List<Value> pages(int count) {
        return runtime.withLock(() -> {
            Value arr = items.getMember("pages").execute(count);
            List<Value> out = new ArrayList<>();
            for (int i = 0; i < arr.getArraySize(); i++) out.add(arr.getArrayElement(i));
            return out;
        });
    }

    private long filesIn(Path d) throws IOException {
        try (Stream<Path> s = Files.list(d)) {
            return s.count();
        }
    }

    @Test
    void configIsRejectedOnceStarted() {
        ScriptCreator session = new ScriptCreator(runtime).configNbWorkers(2).configCompression("zstd");
        session.start(dir.resolve("a.zim"));

        BridgeException e = assertThrows(BridgeException.class, () -> session.configNbWorkers(3));
        assertEquals(ErrorKind.SESSION_ALREADY_STARTED, e.kind());
        BridgeException compression = assertThrows(BridgeException.class, () -> session.configCompression(Compression.LZMA));
        assertEquals(ErrorKind.SESSION_ALREADY_STARTED, compression.kind());
        assertThrows(BridgeException.class, () -> session.setMainPath("x"));
        assertThrows(BridgeException.class, () -> session.start(dir.resolve("b.zim")));

        session.finalizeArchive();
        assertEquals(SessionState.FINALIZED, session.state());
    }

    @Test
    void submissionsBeforeStartDoNotReachTheEngine() throws IOException {
        ScriptCreator session = new ScriptCreator(runtime);
        Value page = pages(1).get(0);

        BridgeException e = assertThrows(BridgeException.class, () -> session.submitItem(page));
        assertEquals(ErrorKind.SESSION_NOT_STARTED, e.kind());
        assertThrows(BridgeException.class, () -> session.submitMetadata("Title", "t"));
        assertThrows(BridgeException.class, () -> session.submitRedirect("a", "", "b", Map.of()));
        assertThrows(BridgeException.class, () -> session.submitIllustration(48, new byte[]{1}));

        BridgeException fin = assertThrows(BridgeException.class, session::finalizeArchive);
        assertEquals(ErrorKind.SESSION_NOT_STARTED, fin.kind());

        assertEquals(SessionState.UNCONFIGURED, session.state());
        assertEquals(0, filesIn(dir));
        assertEquals(0, runtime.pinnedTotal());
    }

    @Test
    void stateIsCheckedBeforeScriptHintsAreRead() {
        ScriptCreator session = new ScriptCreator(runtime);
        Value hints = runtime.eval("({ get FRONT_ARTICLE() { globalThis.hintsRead = true; return 1; } })");

        BridgeException redirect = assertThrows(BridgeException.class,
                () -> session.submitRedirect("r", "R", "page/0", hints));
        assertEquals(ErrorKind.SESSION_NOT_STARTED, redirect.kind());
        BridgeException alias = assertThrows(BridgeException.class,
                () -> session.submitAlias("a", "A", "page/0", runtime.eval("42")));
        assertEquals(ErrorKind.SESSION_NOT_STARTED, alias.kind());

        assertTrue(runtime.withLock(() -> runtime.eval("globalThis.hintsRead === undefined").asBoolean()));
    }

    @Test
    void finalizeRunsOnce() {
        ScriptCreator session = new ScriptCreator(runtime).start(dir.resolve("once.zim"));
        session.finalizeArchive();

        BridgeException e = assertThrows(BridgeException.class, session::finalizeArchive);
        assertEquals(ErrorKind.SESSION_ALREADY_FINALIZED, e.kind());
        BridgeException submit = assertThrows(BridgeException.class, () -> session.submitMetadata("a", "b"));
        assertEquals(ErrorKind.SESSION_ALREADY_FINALIZED, submit.kind());
        assertDoesNotThrow(session::close);
    }

    @Test
    void unopenableDestinationLeavesSessionUnconfigured() {
        ScriptCreator session = new ScriptCreator(runtime);
        assertThrows(UncheckedIOException.class, () -> session.start(dir.resolve("missing/dir/x.zim")));
        assertEquals(SessionState.UNCONFIGURED, session.state());

        session.configVerbose(true).start(dir.resolve("x.zim"));
        assertEquals(SessionState.STARTED, session.state());
        session.close();
        assertEquals(SessionState.FINALIZED, session.state());
    }

    @Test
    void buildsAnArchiveFromScriptObjects() throws IOException {
        Path file = dir.resolve("full.zim");
        ScriptCreator session = new ScriptCreator(runtime)
                .configNbWorkers(4)
                .configCompression(Compression.LZMA)
                .configIndexing(true, "eng")
                .setMainPath("page/0");
        session.start(file);

        for (Value page : pages(100)) session.submitItem(page);

        Value indexed = runtime.withLock(() -> items.getMember("IndexedPage").newInstance("paris", "Paris", "city"));
        session.submitItem(indexed);

        Value description = runtime.withLock(() -> items.getMember("ChunkedProvider").newInstance("A test archive", 5));
        session.submitMetadata("Description", description, "text/plain");
        session.submitMetadata("Title", "Script archive");
        session.submitRedirect("home", "Home", "page/0", runtime.eval("({ FRONT_ARTICLE: 1 })"));
        session.submitAlias("page/zero", "Zero", "page/0", Map.of());
        session.submitIllustration(48, runtime.eval("[137, 80, 78, 71]"));

        session.finalizeArchive();
        assertEquals(0, runtime.pinnedTotal());
        assertFalse(session.isAborted());

        try (Archive archive = Archive.open(file)) {
            assertEquals(103, archive.getEntryCount());
            assertEquals(100, archive.getArticleCount());
            assertEquals(Compression.LZMA, archive.getCompression());
            assertTrue(archive.hasFulltextIndex());

            assertEquals("<p>content of page 42</p>", archive.getEntryByPath("page/42").getItem().getData().text());
            assertEquals("Page 42", archive.getEntryByPath("page/42").getTitle());

            Entry home = archive.getEntryByPath("home");
            assertTrue(home.isRedirect());
            assertEquals("page/0", home.getItem().getPath());
            assertEquals("<p>content of page 0</p>", archive.getEntryByPath("page/zero").getItem().getData().text());
            assertEquals("page/0", archive.getMainEntry().getItem().getPath());

            assertEquals("A test archive", new String(archive.getMetadata("Description"), StandardCharsets.UTF_8));
            assertEquals(Set.of(48), archive.getIllustrationSizes());
            assertArrayEquals(new byte[]{(byte) 137, 80, 78, 71}, archive.getIllustrationItem(48).getData().toByteArray());

            IndexRecord record = archive.getEntryByPath("paris").getItem().getIndexRecord().orElseThrow();
            assertEquals("Paris", record.title());
            assertEquals(2, record.wordCount());
            assertEquals(48.85, record.position().latitude(), 1e-9);
        }
    }

    @Test
    void guestFailureInWorkerAbortsTheSession() throws IOException {
        Path file = dir.resolve("broken.zim");
        ScriptCreator session = new ScriptCreator(runtime).configNbWorkers(2).start(file);

        for (Value page : pages(5)) session.submitItem(page);
        Value broken = runtime.withLock(() ->
                runtime.load("failing").getMember("BrokenPage").newInstance("bad", "Bad", "x"));
        session.submitItem(broken);

        ArchiveException e = assertThrows(ArchiveException.class, session::finalizeArchive);
        BridgeException cause = assertInstanceOf(BridgeException.class, e.getCause());
        assertEquals(ErrorKind.FOREIGN_RAISED, cause.kind());
        assertTrue(cause.detail().contains("disk on fire"), cause.detail());

        assertEquals(SessionState.FINALIZED, session.state());
        assertTrue(session.isAborted());
        assertFalse(Files.exists(file));
        assertEquals(0, runtime.pinnedTotal());
    }

    @Test
    void workerFailureSurfacesOnNextSubmission() throws Exception {
        Path file = dir.resolve("broken2.zim");
        ScriptCreator session = new ScriptCreator(runtime).configNbWorkers(1).start(file);
        Value broken = runtime.withLock(() ->
                runtime.load("failing").getMember("BrokenPage").newInstance("bad", "Bad", "x"));
        session.submitItem(broken);

        long deadline = System.currentTimeMillis() + 10_000;
        while (!session.isAborted() && System.currentTimeMillis() < deadline) Thread.sleep(10);
        assertTrue(session.isAborted());

        assertThrows(ArchiveException.class, () -> session.submitMetadata("Title", "late"));
        assertEquals(SessionState.FINALIZED, session.state());
        assertFalse(Files.exists(file));

        BridgeException again = assertThrows(BridgeException.class, session::finalizeArchive);
        assertEquals(ErrorKind.SESSION_ALREADY_FINALIZED, again.kind());
    }

    @Test
    void duplicatePathDoesNotAbort() {
        ScriptCreator session = new ScriptCreator(runtime).start(dir.resolve("dup.zim"));
        Value page = pages(1).get(0);
        session.submitItem(page);

        ArchiveException e = assertThrows(ArchiveException.class, () -> session.submitItem(page));
        assertTrue(e.getMessage().contains("Impossible to add"));
        assertEquals(SessionState.STARTED, session.state());

        session.finalizeArchive();
        assertEquals(0, runtime.pinnedTotal());
    }

    @Test
    void finalizeFromInsideAScriptCallIsRefused() {
        ScriptCreator session = new ScriptCreator(runtime).start(dir.resolve("locked.zim"));

        runtime.withLock(() -> assertThrows(IllegalStateException.class, session::finalizeArchive));

        assertEquals(SessionState.STARTED, session.state());
        session.finalizeArchive();
    }

    @Test
    void hostProvidersSkipTheScript() throws IOException {
        Path file = dir.resolve("host.zim");
        Value page = runtime.eval("({"
                + " get_path() { return 'readme'; },"
                + " get_title() { return 'Readme'; },"
                + " get_mimetype() { return 'text/plain'; },"
                + " get_contentprovider() { return zim.StringProvider('host bytes'); } })");

        try (ScriptCreator session = new ScriptCreator(runtime).start(file)) {
            session.submitItem(page);
            session.submitMetadata("Counter", runtime.eval("zim.StringProvider('7')"), "text/plain");
        }

        try (Archive archive = Archive.open(file)) {
            assertEquals("host bytes", archive.getEntryByPath("readme").getItem().getData().text());
            assertEquals("7", new String(archive.getMetadata("Counter"), StandardCharsets.UTF_8));
            assertFalse(archive.getEntryByPath("readme").getItem().isFrontArticle());
        }
    }

    @Test
    void hintsAcceptHostMaps() {
        ScriptCreator session = new ScriptCreator(runtime).start(dir.resolve("hints.zim"));
        session.submitItem(pages(1).get(0));
        session.submitRedirect("r", "R", "page/0", Map.of(Hint.COMPRESS, 1L));
        BridgeException e = assertThrows(BridgeException.class,
                () -> session.submitAlias("x", "X", "page/0", runtime.eval("42")));
        assertEquals(ErrorKind.TYPE_MISMATCH, e.kind());
        session.finalizeArchive();
    }
}
