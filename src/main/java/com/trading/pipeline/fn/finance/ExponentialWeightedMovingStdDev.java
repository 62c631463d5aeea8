package com.trading.pipeline.fn.finance;

import com.trading.pipeline.data.Window;
import com.trading.pipeline.fn.FactorFn;
import com.trading.pipeline.term.ComputeDefinition;
import com.trading.pipeline.term.TermKind;
import com.trading.pipeline.term.TermParams;

import java.time.LocalDate;
import java.util.List;

/**
 * Exponentially weighted moving standard deviation (EWMSTD), bias corrected.
 *
 * Formula:
 * <pre>
 * mean     = sum(w x) / sum(w)
 * variance = sum(w (x - mean)^2) / sum(w)
 * result   = sqrt(variance * sum(w)^2 / (sum(w)^2 - sum(w^2)))
 * </pre>
 * over non-missing rows. Missing with fewer than two observations.
 */
public final class ExponentialWeightedMovingStdDev implements FactorFn {
    public static final ComputeDefinition DEFINITION = ComputeDefinition.factor(
            "ExponentialWeightedMovingStdDev", List.of(TermKind.FACTOR),
            List.of(ExponentialWeighted.DECAY_RATE), 1, new ExponentialWeightedMovingStdDev());

    @Override
    public void compute(LocalDate today, Window[] inputs, TermParams params, double[] out) {
        Window data = inputs[0];
        double decay = params.getDouble(ExponentialWeighted.DECAY_RATE);
        ExponentialWeighted.checkDecayRate(decay);
        double[] w = ExponentialWeighted.weights(data.length(), decay);
        for (int a = 0; a < out.length; a++) {
            double sumW = 0, sumW2 = 0, sumWX = 0;
            for (int d = 0; d < data.length(); d++) {
                double v = data.getDouble(d, a);
                if (Double.isNaN(v))
                    continue;
                sumW += w[d];
                sumW2 += w[d] * w[d];
                sumWX += w[d] * v;
            }
            double squaredWeightSum = sumW * sumW;
            double correctionDenominator = squaredWeightSum - sumW2;
            if (sumW <= 0.0 || correctionDenominator <= 0.0)
                continue;
            double mean = sumWX / sumW;
            double sumWDev = 0;
            for (int d = 0; d < data.length(); d++) {
                double v = data.getDouble(d, a);
                if (!Double.isNaN(v))
                    sumWDev += w[d] * (v - mean) * (v - mean);
            }
            double variance = sumWDev / sumW;
            out[a] = Math.sqrt(variance * squaredWeightSum / correctionDenominator);
        }
    }
}
