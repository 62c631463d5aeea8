package com.trading.pipeline.api;

import com.trading.pipeline.engine.RunState;

/**
 * Observability hooks for pipeline runs.
 *
 * <p>
 * Used for profiling (per-node durations), tracing which nodes were loaded or
 * computed, and watching cache behaviour.
 *
 * <p>
 * With parallelism above one, node callbacks arrive from worker threads and may
 * interleave; implementations must be thread-safe. Callbacks run inline with
 * evaluation, so keep them cheap.
 */
public interface EvaluationListener {

    /**
     * @param runId     Identifier of the run, unique per engine.
     * @param nodeCount Number of distinct terms in the plan.
     * @param sessions  Number of output sessions requested.
     */
    void onRunStart(long runId, int nodeCount, int sessions);

    /** A leaf term's window arrived from the loader. */
    void onNodeLoaded(long runId, int topoIndex, String termName, int rows, long durationNanos);

    /** A computed term finished every row of its output. */
    void onNodeComputed(long runId, int topoIndex, String termName, long durationNanos);

    /** A term's cached output was dropped after its last consumer read it. */
    default void onNodeReleased(long runId, int topoIndex, String termName) {
    }

    void onNodeError(long runId, int topoIndex, String termName, Throwable error);

    /**
     * @param finalState {@link RunState#DONE} or {@link RunState#FAILED}.
     * @param nodesEvaluated Number of terms that were loaded or computed.
     */
    void onRunEnd(long runId, RunState finalState, int nodesEvaluated);
}
