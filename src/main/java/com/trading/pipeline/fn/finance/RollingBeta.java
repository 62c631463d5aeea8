package com.trading.pipeline.fn.finance;

import com.trading.pipeline.data.Window;
import com.trading.pipeline.fn.FactorFn;
import com.trading.pipeline.term.ComputeDefinition;
import com.trading.pipeline.term.TermKind;
import com.trading.pipeline.term.TermParams;

import java.time.LocalDate;
import java.util.List;

/**
 * Rolling beta of the first input (asset) against the second (benchmark).
 *
 * Beta = Cov(asset, benchmark) / Var(benchmark)
 *
 * Missing with fewer than two paired observations or a flat benchmark.
 */
public final class RollingBeta implements FactorFn {
    public static final ComputeDefinition DEFINITION = ComputeDefinition.factor(
            "RollingBeta", List.of(TermKind.FACTOR, TermKind.FACTOR), List.of(), 2, new RollingBeta());

    @Override
    public void compute(LocalDate today, Window[] inputs, TermParams params, double[] out) {
        for (int a = 0; a < out.length; a++) {
            RollingCorrelation.PairStats s = RollingCorrelation.PairStats.of(inputs[0], inputs[1], a);
            if (s.count < 2 || s.varY <= 0.0)
                continue;
            out[a] = s.cov / s.varY;
        }
    }
}
