package com.trading.pipeline.fn.finance;

import com.trading.pipeline.data.Window;
import com.trading.pipeline.fn.FactorFn;
import com.trading.pipeline.term.ComputeDefinition;
import com.trading.pipeline.term.TermKind;
import com.trading.pipeline.term.TermParams;

import java.time.LocalDate;
import java.util.List;

/**
 * Exponentially weighted moving average (EWMA).
 *
 * Formula: {@code sum(w[i] * x[i]) / sum(w[i])} over the non-missing rows, with
 * weights from {@link ExponentialWeighted#weights}. Missing rows drop out of both
 * sums instead of counting as zero.
 */
public final class ExponentialWeightedMovingAverage implements FactorFn {
    public static final String DECAY_RATE = ExponentialWeighted.DECAY_RATE;

    public static final ComputeDefinition DEFINITION = ComputeDefinition.factor(
            "ExponentialWeightedMovingAverage", List.of(TermKind.FACTOR),
            List.of(ExponentialWeighted.DECAY_RATE), 1, new ExponentialWeightedMovingAverage());

    @Override
    public void compute(LocalDate today, Window[] inputs, TermParams params, double[] out) {
        Window data = inputs[0];
        double decay = params.getDouble(ExponentialWeighted.DECAY_RATE);
        ExponentialWeighted.checkDecayRate(decay);
        double[] w = ExponentialWeighted.weights(data.length(), decay);
        for (int a = 0; a < out.length; a++) {
            double num = 0, den = 0;
            for (int d = 0; d < data.length(); d++) {
                double v = data.getDouble(d, a);
                if (Double.isNaN(v))
                    continue;
                num += w[d] * v;
                den += w[d];
            }
            if (den > 0.0)
                out[a] = num / den;
        }
    }
}
