package com.trading.pipeline.fn.finance;

import com.trading.pipeline.data.Window;
import com.trading.pipeline.fn.FactorFn;
import com.trading.pipeline.term.ComputeDefinition;
import com.trading.pipeline.term.TermKind;
import com.trading.pipeline.term.TermParams;

import java.time.LocalDate;
import java.util.List;

/**
 * Largest peak-to-trough decline in the window, relative to the trough.
 *
 * The trough is the day with the largest absolute gap below the running maximum
 * (first such day on ties); the result is {@code (peak - trough) / trough}.
 */
public final class MaxDrawdown implements FactorFn {
    public static final ComputeDefinition DEFINITION = ComputeDefinition.factor(
            "MaxDrawdown", List.of(TermKind.FACTOR), List.of(), 1, new MaxDrawdown());

    @Override
    public void compute(LocalDate today, Window[] inputs, TermParams params, double[] out) {
        Window data = inputs[0];
        for (int a = 0; a < out.length; a++) {
            double runningMax = Double.NaN;
            double worstGap = Double.NEGATIVE_INFINITY;
            double peak = Double.NaN, trough = Double.NaN;
            for (int d = 0; d < data.length(); d++) {
                double v = data.getDouble(d, a);
                if (Double.isNaN(v))
                    continue;
                if (Double.isNaN(runningMax) || v > runningMax)
                    runningMax = v;
                double gap = runningMax - v;
                if (gap > worstGap) {
                    worstGap = gap;
                    peak = runningMax;
                    trough = v;
                }
            }
            if (Double.isNaN(trough) || trough == 0.0)
                continue;
            out[a] = (peak - trough) / trough;
        }
    }
}
