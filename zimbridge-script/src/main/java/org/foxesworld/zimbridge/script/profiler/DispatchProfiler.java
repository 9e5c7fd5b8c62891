package org.foxesworld.zimbridge.script.profiler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rolling profiler for dispatches into guest code, keyed by method name.
 *
 * <p>Dispatches come from engine worker threads, so every counter is atomic and the periodic
 * report is claimed by a single thread via CAS. Logs the top N methods of each window.</p>
 */
public final class DispatchProfiler {

    private static final Logger log = LogManager.getLogger(DispatchProfiler.class);

    public static final class MethodStats {
        public final String method;

        public final AtomicLong calls = new AtomicLong();
        public final AtomicLong timeNanos = new AtomicLong();
        public final AtomicLong errors = new AtomicLong();

        final AtomicLong wCalls = new AtomicLong();
        final AtomicLong wTimeNanos = new AtomicLong();
        final AtomicLong wErrors = new AtomicLong();

        MethodStats(String method) {
            this.method = method;
        }
    }

    private final Map<String, MethodStats> methods = new ConcurrentHashMap<>();

    private volatile long reportEveryNanos = 2_000_000_000L;
    private volatile int topN = 8;
    private volatile boolean enabled = true;

    private final AtomicLong lastReportNanos = new AtomicLong(System.nanoTime());

    public DispatchProfiler setEnabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    public DispatchProfiler setReportEveryNanos(long nanos) {
        this.reportEveryNanos = Math.max(250_000_000L, nanos);
        return this;
    }

    public DispatchProfiler setTopN(int topN) {
        this.topN = Math.max(1, Math.min(32, topN));
        return this;
    }

    public boolean isEnabled() {
        return enabled;
    }

    // ---- record API ----

    public long begin() {
        return enabled ? System.nanoTime() : 0L;
    }

    public void end(String method, long t0Nanos, boolean ok) {
        if (!enabled || method == null) return;
        long dt = Math.max(0L, System.nanoTime() - t0Nanos);

        MethodStats s = methods.computeIfAbsent(method, MethodStats::new);
        s.calls.incrementAndGet();
        s.timeNanos.addAndGet(dt);
        s.wCalls.incrementAndGet();
        s.wTimeNanos.addAndGet(dt);
        if (!ok) {
            s.errors.incrementAndGet();
            s.wErrors.incrementAndGet();
        }

        tick();
    }

    /** Totals for one method, or null if it was never dispatched while enabled. */
    public MethodStats stats(String method) {
        return methods.get(method);
    }

    public void reset() {
        methods.clear();
    }

    private void tick() {
        long now = System.nanoTime();
        long last = lastReportNanos.get();
        if (now - last < reportEveryNanos) return;
        if (!lastReportNanos.compareAndSet(last, now)) return;
        report();
    }

    /** Logs and resets the current window. */
    public void report() {
        List<Row> rows = new ArrayList<>(methods.size());
        for (MethodStats s : methods.values()) {
            long c = s.wCalls.getAndSet(0);
            long t = s.wTimeNanos.getAndSet(0);
            long e = s.wErrors.getAndSet(0);
            if (c == 0 && e == 0) continue;
            rows.add(new Row(s.method, c, t, e));
        }
        if (rows.isEmpty()) return;

        rows.sort(Comparator.comparingLong(Row::timeNanos).reversed());

        StringBuilder sb = new StringBuilder(256);
        sb.append("[DispatchProfiler] window=")
                .append(reportEveryNanos / 1_000_000_000.0).append("s")
                .append(" methods=").append(rows.size());

        int n = Math.min(topN, rows.size());
        for (int i = 0; i < n; i++) {
            Row r = rows.get(i);
            sb.append("\n  #").append(i + 1).append(' ').append(r.method)
                    .append(" calls=").append(r.calls).append(" (").append(ms(r.timeNanos)).append("ms)")
                    .append(" err=").append(r.errors);
        }

        log.info(sb.toString());
    }

    private static double ms(long nanos) {
        return nanos / 1_000_000.0;
    }

    private record Row(String method, long calls, long timeNanos, long errors) {
    }
}
