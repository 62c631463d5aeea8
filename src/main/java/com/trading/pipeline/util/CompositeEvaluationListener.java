package com.trading.pipeline.util;

import com.trading.pipeline.api.EvaluationListener;
import com.trading.pipeline.engine.RunState;

import java.util.Arrays;

/**
 * Fans callbacks out to several {@link EvaluationListener}s in registration
 * order. Registration copies the array, so callbacks never see a half-updated
 * list.
 */
public class CompositeEvaluationListener implements EvaluationListener {
    private volatile EvaluationListener[] listeners = new EvaluationListener[0];

    public synchronized CompositeEvaluationListener add(EvaluationListener listener) {
        EvaluationListener[] old = listeners;
        EvaluationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    @Override
    public void onRunStart(long runId, int nodeCount, int sessions) {
        for (EvaluationListener l : listeners)
            l.onRunStart(runId, nodeCount, sessions);
    }

    @Override
    public void onNodeLoaded(long runId, int topoIndex, String termName, int rows, long durationNanos) {
        for (EvaluationListener l : listeners)
            l.onNodeLoaded(runId, topoIndex, termName, rows, durationNanos);
    }

    @Override
    public void onNodeComputed(long runId, int topoIndex, String termName, long durationNanos) {
        for (EvaluationListener l : listeners)
            l.onNodeComputed(runId, topoIndex, termName, durationNanos);
    }

    @Override
    public void onNodeReleased(long runId, int topoIndex, String termName) {
        for (EvaluationListener l : listeners)
            l.onNodeReleased(runId, topoIndex, termName);
    }

    @Override
    public void onNodeError(long runId, int topoIndex, String termName, Throwable error) {
        for (EvaluationListener l : listeners)
            l.onNodeError(runId, topoIndex, termName, error);
    }

    @Override
    public void onRunEnd(long runId, RunState finalState, int nodesEvaluated) {
        for (EvaluationListener l : listeners)
            l.onRunEnd(runId, finalState, nodesEvaluated);
    }
}
