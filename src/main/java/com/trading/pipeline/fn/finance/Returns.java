package com.trading.pipeline.fn.finance;

import com.trading.pipeline.data.Window;
import com.trading.pipeline.fn.FactorFn;
import com.trading.pipeline.term.ComputeDefinition;
import com.trading.pipeline.term.TermKind;
import com.trading.pipeline.term.TermParams;

import java.time.LocalDate;
import java.util.List;

/**
 * Percent change over the window.
 *
 * Formula: {@code (x[last] - x[first]) / x[first]}
 *
 * Missing when either end of the window is missing or the first value is zero.
 */
public final class Returns implements FactorFn {
    public static final ComputeDefinition DEFINITION = ComputeDefinition.factor(
            "Returns", List.of(TermKind.FACTOR), List.of(), 2, new Returns());

    @Override
    public void compute(LocalDate today, Window[] inputs, TermParams params, double[] out) {
        Window prices = inputs[0];
        int last = prices.length() - 1;
        for (int a = 0; a < out.length; a++) {
            double first = prices.getDouble(0, a);
            double latest = prices.getDouble(last, a);
            if (Double.isNaN(first) || Double.isNaN(latest) || first == 0.0)
                continue;
            out[a] = (latest - first) / first;
        }
    }
}
