package com.trading.pipeline.fn.finance;

import com.trading.pipeline.data.Window;
import com.trading.pipeline.fn.FactorFn;
import com.trading.pipeline.term.ComputeDefinition;
import com.trading.pipeline.term.TermKind;
import com.trading.pipeline.term.TermParams;

import java.time.LocalDate;
import java.util.List;

/** Most recent value of the input. */
public final class Latest implements FactorFn {
    public static final ComputeDefinition DEFINITION = ComputeDefinition.factor(
            "Latest", List.of(TermKind.FACTOR), List.of(), 0, new Latest());

    @Override
    public void compute(LocalDate today, Window[] inputs, TermParams params, double[] out) {
        Window data = inputs[0];
        for (int a = 0; a < out.length; a++)
            out[a] = data.latestDouble(a);
    }
}
