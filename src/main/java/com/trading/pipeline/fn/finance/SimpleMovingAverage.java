package com.trading.pipeline.fn.finance;

import com.trading.pipeline.data.Window;
import com.trading.pipeline.fn.FactorFn;
import com.trading.pipeline.term.ComputeDefinition;
import com.trading.pipeline.term.TermKind;
import com.trading.pipeline.term.TermParams;

import java.time.LocalDate;
import java.util.List;

/**
 * Mean of the non-missing observations in the window. Missing when the window
 * holds no observation for the asset.
 */
public final class SimpleMovingAverage implements FactorFn {
    public static final ComputeDefinition DEFINITION = ComputeDefinition.factor(
            "SimpleMovingAverage", List.of(TermKind.FACTOR), List.of(), 1, new SimpleMovingAverage());

    @Override
    public void compute(LocalDate today, Window[] inputs, TermParams params, double[] out) {
        Window data = inputs[0];
        for (int a = 0; a < out.length; a++) {
            double sum = 0;
            int count = 0;
            for (int d = 0; d < data.length(); d++) {
                double v = data.getDouble(d, a);
                if (!Double.isNaN(v)) {
                    sum += v;
                    count++;
                }
            }
            if (count > 0)
                out[a] = sum / count;
        }
    }
}
