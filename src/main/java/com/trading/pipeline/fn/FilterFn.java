package com.trading.pipeline.fn;

import com.trading.pipeline.data.Window;
import com.trading.pipeline.term.TermParams;

import java.time.LocalDate;

/**
 * Compute step of a FILTER term. {@code out} arrives filled with {@code false}.
 *
 * @see FactorFn
 */
@FunctionalInterface
public interface FilterFn {
    void compute(LocalDate today, Window[] inputs, TermParams params, boolean[] out);
}
