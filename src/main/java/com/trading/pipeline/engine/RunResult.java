package com.trading.pipeline.engine;

import com.trading.pipeline.data.AssetUniverse;
import com.trading.pipeline.data.BooleanMatrix;
import com.trading.pipeline.data.Matrix;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Raw per-term output of a run, before assembly into a table.
 *
 * @param sessions Output sessions, ascending.
 * @param outputs  Output name to a sessions x assets array, in declaration order.
 * @param screen   Screen values over the output sessions, or null if the pipeline has none.
 */
public record RunResult(long runId, List<LocalDate> sessions, AssetUniverse assets, Map<String, Matrix> outputs,
        BooleanMatrix screen, int nodesEvaluated) {
}
