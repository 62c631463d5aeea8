package com.trading.pipeline.util;

import com.trading.pipeline.api.EvaluationListener;
import com.trading.pipeline.engine.RunState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/** Aggregates load and compute timings per term name across runs, to find bottlenecks. */
public class TermProfileListener implements EvaluationListener {

    public static class TermStats {
        public final String name;
        public long count;
        public long loads;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;
        public long errors;

        public TermStats(String name) {
            this.name = name;
        }

        synchronized void update(long duration, boolean loaded) {
            count++;
            if (loaded)
                loads++;
            totalDurationNanos += duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        public synchronized double avgMicros() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1000.0;
        }
    }

    private final Map<String, TermStats> stats = new ConcurrentHashMap<>();
    private final LongAdder runs = new LongAdder();
    private final LongAdder failedRuns = new LongAdder();

    public TermStats stats(String termName) {
        return stats.get(termName);
    }

    public long runs() {
        return runs.sum();
    }

    public long failedRuns() {
        return failedRuns.sum();
    }

    @Override
    public void onRunStart(long runId, int nodeCount, int sessions) {
        // counted on completion
    }

    @Override
    public void onNodeLoaded(long runId, int topoIndex, String termName, int rows, long durationNanos) {
        stats.computeIfAbsent(termName, TermStats::new).update(durationNanos, true);
    }

    @Override
    public void onNodeComputed(long runId, int topoIndex, String termName, long durationNanos) {
        stats.computeIfAbsent(termName, TermStats::new).update(durationNanos, false);
    }

    @Override
    public void onNodeError(long runId, int topoIndex, String termName, Throwable error) {
        TermStats s = stats.computeIfAbsent(termName, TermStats::new);
        synchronized (s) {
            s.errors++;
        }
    }

    @Override
    public void onRunEnd(long runId, RunState finalState, int nodesEvaluated) {
        runs.increment();
        if (finalState == RunState.FAILED)
            failedRuns.increment();
    }

    public void reset() {
        stats.clear();
    }

    /** Formatted table, slowest terms first. */
    public String dump() {
        List<TermStats> rows = new ArrayList<>(stats.values());
        rows.sort((a, b) -> Long.compare(b.totalDurationNanos, a.totalDurationNanos));
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-40s | %8s | %8s | %10s | %10s | %10s%n", "Term", "Count", "Loads", "Avg (us)",
                "Min (us)", "Max (us)"));
        sb.append("-".repeat(100)).append('\n');
        for (TermStats s : rows) {
            synchronized (s) {
                sb.append(String.format("%-40s | %8d | %8d | %10.2f | %10.2f | %10.2f%n", truncate(s.name, 40),
                        s.count, s.loads, s.avgMicros(), s.minDurationNanos / 1000.0,
                        s.maxDurationNanos / 1000.0));
            }
        }
        return sb.toString();
    }

    private String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return s.substring(0, len - 3) + "...";
    }
}
