package org.foxesworld.zimbridge.script;

import org.foxesworld.zimbridge.core.BridgeException;
import org.foxesworld.zimbridge.core.ErrorKind;
import org.graalvm.polyglot.Value;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ForeignHandleTest {

    ScriptRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = new ScriptRuntime();
    }

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    @Test
    void eachHandleOwnsOnePin() {
        Value obj = runtime.eval("({ name: 'a' })");
        assertEquals(0, runtime.pinCount(obj));

        ForeignHandle first = ForeignHandle.acquire(runtime, obj);
        ForeignHandle second = ForeignHandle.acquire(runtime, obj);
        assertEquals(2, runtime.pinCount(obj));

        first.close();
        assertEquals(1, runtime.pinCount(obj));
        first.close();
        assertEquals(1, runtime.pinCount(obj));

        second.close();
        assertEquals(0, runtime.pinCount(obj));
        assertEquals(0, runtime.pinnedTotal());
    }

    @Test
    void sequentialAcquireReleaseIsBalanced() {
        Value obj = runtime.eval("({ name: 'loop' })");
        ForeignHandle held = ForeignHandle.acquire(runtime, obj);
        int before = runtime.pinCount(obj);

        for (int i = 0; i < 1_000; i++) {
            try (ForeignHandle h = ForeignHandle.acquire(runtime, obj)) {
                assertEquals(before + 1, runtime.pinCount(obj));
            }
        }

        assertEquals(before, runtime.pinCount(obj));
        held.close();
        assertEquals(0, runtime.pinnedTotal());
    }

    @Test
    void moveTransfersWithoutTouchingThePin() {
        Value obj = runtime.eval("({})");
        ForeignHandle source = ForeignHandle.acquire(runtime, obj);

        ForeignHandle target = source.moveTo();

        assertFalse(source.isSet());
        assertTrue(target.isSet());
        assertEquals(1, runtime.pinCount(obj));

        source.close();
        assertEquals(1, runtime.pinCount(obj));

        BridgeException e = assertThrows(BridgeException.class, source::value);
        assertEquals(ErrorKind.HANDLE_NOT_SET, e.kind());
        assertThrows(BridgeException.class, source::moveTo);

        target.close();
        assertEquals(0, runtime.pinCount(obj));
    }

    @Test
    void releaseFromAnotherThread() throws Exception {
        Value obj = runtime.eval("({})");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            ForeignHandle[] handles = new ForeignHandle[64];
            for (int i = 0; i < handles.length; i++) handles[i] = ForeignHandle.acquire(runtime, obj);
            assertEquals(64, runtime.pinCount(obj));

            for (ForeignHandle h : handles) pool.submit(h::close);
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(0, runtime.pinCount(obj));
    }

    @Test
    void acquireFailsOnClosedRuntime() {
        Value obj = runtime.eval("({})");
        runtime.close();

        BridgeException e = assertThrows(BridgeException.class, () -> ForeignHandle.acquire(runtime, obj));
        assertEquals(ErrorKind.RUNTIME_UNAVAILABLE, e.kind());
    }

    @Test
    void closeAfterRuntimeCloseIsHarmless() {
        ForeignHandle h = ForeignHandle.acquire(runtime, runtime.eval("({})"));
        runtime.close();

        assertDoesNotThrow(h::close);
        assertFalse(h.isSet());
    }

    @Test
    void nullCannotBeAcquired() {
        BridgeException e = assertThrows(BridgeException.class, () -> ForeignHandle.acquire(runtime, null));
        assertEquals(ErrorKind.HANDLE_NOT_SET, e.kind());
    }
}
