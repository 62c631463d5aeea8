package com.trading.pipeline.engine;

import com.trading.pipeline.data.Matrix;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Run-scoped storage of term outputs, indexed by plan position.
 *
 * <p>
 * Each slot starts with one pending read per distinct consumer. When the last
 * consumer has read it, the slot is dropped unless the term is an output or the
 * screen, or release is disabled. Safe for concurrent use by worker threads.
 */
final class TermCache {
    private final ExecutionPlan plan;
    private final boolean release;
    private final AtomicReferenceArray<Matrix> slots;
    private final AtomicIntegerArray pending;
    private final AtomicInteger live = new AtomicInteger();
    private final AtomicInteger peakLive = new AtomicInteger();

    TermCache(ExecutionPlan plan, boolean release) {
        this.plan = plan;
        this.release = release;
        int n = plan.nodeCount();
        this.slots = new AtomicReferenceArray<>(n);
        this.pending = new AtomicIntegerArray(n);
        for (int i = 0; i < n; i++)
            pending.set(i, plan.consumerCount(i));
    }

    void put(int ti, Matrix value) {
        if (!slots.compareAndSet(ti, null, value))
            throw new IllegalStateException("Term already cached: " + plan.term(ti).name());
        int now = live.incrementAndGet();
        peakLive.accumulateAndGet(now, Math::max);
    }

    Matrix get(int ti) {
        Matrix m = slots.get(ti);
        if (m == null)
            throw new IllegalStateException("Term not available (not computed or already released): "
                    + plan.term(ti).name());
        return m;
    }

    /**
     * Records that one consumer has finished reading {@code ti}.
     *
     * @return true if the slot was released as a result.
     */
    boolean consumed(int ti) {
        int left = pending.decrementAndGet(ti);
        if (left == 0 && release && !plan.isRoot(ti)) {
            if (slots.getAndSet(ti, null) != null) {
                live.decrementAndGet();
                return true;
            }
        }
        return false;
    }

    int liveCount() {
        return live.get();
    }

    int peakLiveCount() {
        return peakLive.get();
    }
}
