package org.foxesworld.zimbridge.script.profiler;

import org.foxesworld.zimbridge.core.ErrorRecord;
import org.foxesworld.zimbridge.script.ForeignHandle;
import org.foxesworld.zimbridge.script.ScriptRuntime;
import org.foxesworld.zimbridge.script.dispatch.ResultType;
import org.foxesworld.zimbridge.script.dispatch.TypedDispatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DispatchProfilerTest {

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
    void countsCallsAndErrorsPerMethod() {
        runtime.profiler().setEnabled(true).setReportEveryNanos(Long.MAX_VALUE);
        TypedDispatcher dispatcher = new TypedDispatcher(runtime);

        try (ForeignHandle h = ForeignHandle.acquire(runtime, runtime.eval(
                "({ get_size() { return 3; }, get_path() { throw new Error('no'); } })"))) {
            for (int i = 0; i < 3; i++) {
                assertEquals(3L, dispatcher.call(h, "get_size", ResultType.INT64, new ErrorRecord()));
            }
            ErrorRecord err = new ErrorRecord();
            dispatcher.call(h, "get_path", ResultType.TEXT, err);
            assertTrue(err.isSet());
        }

        DispatchProfiler.MethodStats size = runtime.profiler().stats("get_size");
        assertEquals(3, size.calls.get());
        assertEquals(0, size.errors.get());
        assertEquals(1, runtime.profiler().stats("get_path").errors.get());

        runtime.profiler().report();
        runtime.profiler().reset();
        assertNull(runtime.profiler().stats("get_size"));
    }

    @Test
    void disabledProfilerRecordsNothing() {
        DispatchProfiler profiler = new DispatchProfiler();
        assertFalse(profiler.isEnabled());
        profiler.end("feed", profiler.begin(), true);
        assertNull(profiler.stats("feed"));
    }
}
