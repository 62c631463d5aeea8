package com.trading.pipeline.fn.finance;

import com.trading.pipeline.data.Window;
import com.trading.pipeline.fn.FactorFn;
import com.trading.pipeline.term.ComputeDefinition;
import com.trading.pipeline.term.TermKind;
import com.trading.pipeline.term.TermParams;

import java.time.LocalDate;
import java.util.List;

/**
 * Weighted average of the first input, weighted by the second.
 * VWAP is this step over (close, volume).
 *
 * Formula: {@code sum(base * weight) / sum(weight)} over days where both are
 * present. Missing when the weights sum to zero.
 */
public final class WeightedAverageValue implements FactorFn {
    public static final ComputeDefinition DEFINITION = ComputeDefinition.factor(
            "WeightedAverageValue", List.of(TermKind.FACTOR, TermKind.FACTOR), List.of(), 1,
            new WeightedAverageValue());

    @Override
    public void compute(LocalDate today, Window[] inputs, TermParams params, double[] out) {
        Window base = inputs[0];
        Window weight = inputs[1];
        for (int a = 0; a < out.length; a++) {
            double num = 0, den = 0;
            for (int d = 0; d < base.length(); d++) {
                double b = base.getDouble(d, a);
                double w = weight.getDouble(d, a);
                if (Double.isNaN(b) || Double.isNaN(w))
                    continue;
                num += b * w;
                den += w;
            }
            if (den != 0.0)
                out[a] = num / den;
        }
    }
}
