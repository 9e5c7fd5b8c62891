package org.foxesworld.zimbridge.script.dispatch;

import org.foxesworld.zimbridge.core.BridgeException;
import org.foxesworld.zimbridge.core.ErrorKind;
import org.foxesworld.zimbridge.core.ErrorRecord;
import org.foxesworld.zimbridge.engine.writer.Blob;
import org.foxesworld.zimbridge.engine.writer.ContentProvider;
import org.foxesworld.zimbridge.engine.writer.GeoPosition;
import org.foxesworld.zimbridge.engine.writer.Hint;
import org.foxesworld.zimbridge.engine.writer.StringProvider;
import org.foxesworld.zimbridge.script.ForeignHandle;
import org.foxesworld.zimbridge.script.ScriptRuntime;
import org.foxesworld.zimbridge.script.adapter.ScriptContentProvider;
import org.foxesworld.zimbridge.script.profiler.DispatchProfiler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TypedDispatcherTest {

    ScriptRuntime runtime;
    TypedDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        runtime = new ScriptRuntime();
        dispatcher = new TypedDispatcher(runtime);
    }

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    private ForeignHandle handle(String js) {
        return ForeignHandle.acquire(runtime, runtime.eval("(" + js + ")"));
    }

    @Test
    void returnsTextFromNamedMethod() {
        try (ForeignHandle h = handle("{ get_path() { return 'A/home'; } }")) {
            ErrorRecord err = new ErrorRecord();
            assertEquals("A/home", dispatcher.call(h, "get_path", ResultType.TEXT, err));
            assertFalse(err.isSet());
        }
    }

    @Test
    void missingOrNonCallableMemberIsMethodMissing() {
        try (ForeignHandle h = handle("{ get_title: 5 }")) {
            ErrorRecord err = new ErrorRecord();
            assertEquals("", dispatcher.call(h, "get_path", ResultType.TEXT, err));
            assertEquals(ErrorKind.METHOD_MISSING, err.kind());

            ErrorRecord err2 = new ErrorRecord();
            dispatcher.call(h, "get_title", ResultType.TEXT, err2);
            assertEquals(ErrorKind.METHOD_MISSING, err2.kind());

            assertFalse(dispatcher.hasMethod(h, "get_title"));
        }
    }

    @Test
    void guestExceptionIsRecordedAndHandleStaysUsable() {
        try (ForeignHandle h = handle("{ get_size() { throw new Error('boom'); }, get_path() { return 'ok'; } }")) {
            ErrorRecord err = new ErrorRecord();
            assertEquals(0L, dispatcher.call(h, "get_size", ResultType.INT64, err));
            assertEquals(ErrorKind.FOREIGN_RAISED, err.kind());
            assertTrue(err.message().contains("boom"), err.message());
            assertTrue(err.message().startsWith("get_size()"), err.message());

            assertEquals("ok", BridgeCalls.invoke(dispatcher, h, "get_path", ResultType.TEXT));
            assertEquals(1, runtime.pinCount(h.value()));
        }
    }

    @Test
    void invokeRaisesTheRecordedKindVerbatim() {
        try (ForeignHandle h = handle("{ get_size() { throw new Error('no size today'); } }")) {
            BridgeException e = assertThrows(BridgeException.class,
                    () -> BridgeCalls.invoke(dispatcher, h, "get_size", ResultType.INT64));
            assertEquals(ErrorKind.FOREIGN_RAISED, e.kind());
            assertTrue(e.detail().contains("no size today"));
        }
    }

    @Test
    void numbersAreTruncated() {
        try (ForeignHandle h = handle("{ get_size() { return 3.9; }, get_wordcount() { return -2.5; } }")) {
            assertEquals(3L, BridgeCalls.invoke(dispatcher, h, "get_size", ResultType.INT64));
            assertEquals(-2, BridgeCalls.invoke(dispatcher, h, "get_wordcount", ResultType.INT32));
        }
    }

    @Test
    void wrongKindIsTypeMismatch() {
        try (ForeignHandle h = handle("{ get_size() { return 'ten'; }, get_wordcount() { return '12'; }, get_path() { return 42; } }")) {
            ErrorRecord err = new ErrorRecord();
            dispatcher.call(h, "get_size", ResultType.INT64, err);
            assertEquals(ErrorKind.TYPE_MISMATCH, err.kind());

            ErrorRecord err2 = new ErrorRecord();
            dispatcher.call(h, "get_wordcount", ResultType.INT32, err2);
            assertEquals(ErrorKind.TYPE_MISMATCH, err2.kind());

            ErrorRecord err3 = new ErrorRecord();
            dispatcher.call(h, "get_path", ResultType.TEXT, err3);
            assertEquals(ErrorKind.TYPE_MISMATCH, err3.kind());
        }
    }

    @Test
    void int32KeepsLowBitsOfWideNumbers() {
        try (ForeignHandle h = handle("{ get_wordcount() { return 4294967296 + 5; }, big() { return 1e12; }, neg() { return -2.7; } }")) {
            ErrorRecord err = new ErrorRecord();
            assertEquals(5, dispatcher.call(h, "get_wordcount", ResultType.INT32, err));
            assertFalse(err.isSet());

            assertEquals((int) 1_000_000_000_000L, BridgeCalls.invoke(dispatcher, h, "big", ResultType.INT32));
            assertEquals(-2, BridgeCalls.invoke(dispatcher, h, "neg", ResultType.INT32));
        }
    }

    @Test
    void truthiness() {
        try (ForeignHandle h = handle("{ a() { return 1; }, b() { return ''; }, c() { return {}; }, d() { return undefined; } }")) {
            assertTrue(BridgeCalls.invoke(dispatcher, h, "a", ResultType.BOOL));
            assertFalse(BridgeCalls.invoke(dispatcher, h, "b", ResultType.BOOL));
            assertTrue(BridgeCalls.invoke(dispatcher, h, "c", ResultType.BOOL));
            assertFalse(BridgeCalls.invoke(dispatcher, h, "d", ResultType.BOOL));
        }
    }

    @Test
    void blobConversions() {
        try (ForeignHandle h = handle("{"
                + " text() { return 'héllo'; },"
                + " array() { return [1, 2, 255]; },"
                + " host() { return zim.Blob('abc'); },"
                + " none() { return null; } }")) {
            assertArrayEquals("héllo".getBytes(java.nio.charset.StandardCharsets.UTF_8),
                    BridgeCalls.invoke(dispatcher, h, "text", ResultType.BLOB).toByteArray());
            assertArrayEquals(new byte[]{1, 2, (byte) 255},
                    BridgeCalls.invoke(dispatcher, h, "array", ResultType.BLOB).toByteArray());
            assertEquals("abc", BridgeCalls.invoke(dispatcher, h, "host", ResultType.BLOB).text());

            ErrorRecord err = new ErrorRecord();
            Blob b = dispatcher.call(h, "none", ResultType.BLOB, err);
            assertEquals(ErrorKind.EMPTY_RESULT, err.kind());
            assertTrue(b.isEmpty());
        }
    }

    @Test
    void contentProviderConversions() {
        try (ForeignHandle h = handle("{"
                + " script() { return { get_size() { return 1; }, feed() { return 'x'; } }; },"
                + " host() { return zim.StringProvider('abc'); },"
                + " none() { return null; } }")) {
            ContentProvider script = BridgeCalls.invoke(dispatcher, h, "script", ResultType.CONTENT_PROVIDER);
            assertInstanceOf(ScriptContentProvider.class, script);
            assertEquals(2, runtime.pinnedTotal());
            script.close();
            assertEquals(1, runtime.pinnedTotal());

            ContentProvider host = BridgeCalls.invoke(dispatcher, h, "host", ResultType.CONTENT_PROVIDER);
            assertInstanceOf(StringProvider.class, host);
            assertEquals(3, host.getSize());

            BridgeException e = assertThrows(BridgeException.class,
                    () -> BridgeCalls.invoke(dispatcher, h, "none", ResultType.CONTENT_PROVIDER));
            assertEquals(ErrorKind.EMPTY_RESULT, e.kind());
        }
    }

    @Test
    void hintsFromObjectsAndMaps() {
        try (ForeignHandle h = handle("{"
                + " plain() { return { FRONT_ARTICLE: 1, COMPRESS: false, BOGUS: 7 }; },"
                + " map() { return new Map([[zim.Hint.FRONT_ARTICLE, 2.7]]); },"
                + " bad() { return { FRONT_ARTICLE: 'yes' }; } }")) {
            Map<Hint, Long> plain = BridgeCalls.invoke(dispatcher, h, "plain", ResultType.HINTS);
            assertEquals(Map.of(Hint.FRONT_ARTICLE, 1L, Hint.COMPRESS, 0L), plain);

            assertEquals(Map.of(Hint.FRONT_ARTICLE, 2L), BridgeCalls.invoke(dispatcher, h, "map", ResultType.HINTS));

            BridgeException e = assertThrows(BridgeException.class,
                    () -> BridgeCalls.invoke(dispatcher, h, "bad", ResultType.HINTS));
            assertEquals(ErrorKind.TYPE_MISMATCH, e.kind());
        }
    }

    @Test
    void geoPositionShapes() {
        try (ForeignHandle h = handle("{"
                + " pair() { return [10.5, -20]; },"
                + " obj() { return { lat: 1, lon: 2 }; },"
                + " none() { return null; },"
                + " off() { return [200, 0]; } }")) {
            assertEquals(Optional.of(new GeoPosition(10.5, -20)), BridgeCalls.invoke(dispatcher, h, "pair", ResultType.GEO_POSITION));
            assertEquals(Optional.of(new GeoPosition(1, 2)), BridgeCalls.invoke(dispatcher, h, "obj", ResultType.GEO_POSITION));
            assertEquals(Optional.empty(), BridgeCalls.invoke(dispatcher, h, "none", ResultType.GEO_POSITION));

            BridgeException e = assertThrows(BridgeException.class,
                    () -> BridgeCalls.invoke(dispatcher, h, "off", ResultType.GEO_POSITION));
            assertEquals(ErrorKind.TYPE_MISMATCH, e.kind());
        }
    }

    @Test
    void unsetHandleIsAHostBug() {
        ForeignHandle h = handle("{ get_path() { return 'x'; } }");
        ForeignHandle moved = h.moveTo();

        BridgeException e = assertThrows(BridgeException.class,
                () -> dispatcher.call(h, "get_path", ResultType.TEXT, new ErrorRecord()));
        assertEquals(ErrorKind.HANDLE_NOT_SET, e.kind());
        assertThrows(BridgeException.class, () -> dispatcher.call(null, "get_path", ResultType.TEXT, new ErrorRecord()));

        moved.close();
    }

    @Test
    void dispatchesAreProfiled() {
        DispatchProfiler profiler = runtime.profiler().setEnabled(true);
        try (ForeignHandle h = handle("{ get_path() { return 'x'; }, feed() { throw new Error('x'); } }")) {
            BridgeCalls.invoke(dispatcher, h, "get_path", ResultType.TEXT);
            BridgeCalls.invoke(dispatcher, h, "get_path", ResultType.TEXT);
            dispatcher.call(h, "feed", ResultType.BLOB, new ErrorRecord());
        }

        assertEquals(2, profiler.stats("get_path").calls.get());
        assertEquals(0, profiler.stats("get_path").errors.get());
        assertEquals(1, profiler.stats("feed").errors.get());
    }

    @Test
    void closedRuntimeIsReportedNotThrown() {
        ForeignHandle h = handle("{ get_path() { return 'x'; } }");
        runtime.close();

        ErrorRecord err = new ErrorRecord();
        assertEquals("", dispatcher.call(h, "get_path", ResultType.TEXT, err));
        assertEquals(ErrorKind.RUNTIME_UNAVAILABLE, err.kind());
        h.close();
    }
}
