package com.trading.pipeline.fn.finance;

import com.trading.pipeline.data.Window;
import com.trading.pipeline.fn.FactorFn;
import com.trading.pipeline.term.ComputeDefinition;
import com.trading.pipeline.term.TermKind;
import com.trading.pipeline.term.TermParams;

import java.time.LocalDate;
import java.util.List;

/**
 * Relative Strength Index.
 *
 * Formula:
 * {@code 100 - 100 / (1 + avgGain / avgLoss)} where the averages run over the
 * day-over-day differences of the window. Differences touching a missing value
 * are skipped.
 *
 * A window with no losses and some gains scores 100. A flat window is missing.
 */
public final class Rsi implements FactorFn {
    public static final int DEFAULT_WINDOW = 15;

    public static final ComputeDefinition DEFINITION = ComputeDefinition.factor(
            "RSI", List.of(TermKind.FACTOR), List.of(), 2, new Rsi());

    @Override
    public void compute(LocalDate today, Window[] inputs, TermParams params, double[] out) {
        Window closes = inputs[0];
        for (int a = 0; a < out.length; a++) {
            double gains = 0, losses = 0;
            int n = 0;
            for (int d = 1; d < closes.length(); d++) {
                double prev = closes.getDouble(d - 1, a);
                double curr = closes.getDouble(d, a);
                if (Double.isNaN(prev) || Double.isNaN(curr))
                    continue;
                double diff = curr - prev;
                if (diff > 0)
                    gains += diff;
                else
                    losses -= diff;
                n++;
            }
            if (n == 0)
                continue;
            double ups = gains / n;
            double downs = losses / n;
            if (downs == 0.0) {
                if (ups > 0.0)
                    out[a] = 100.0;
                continue;
            }
            out[a] = 100.0 - (100.0 / (1.0 + ups / downs));
        }
    }
}
