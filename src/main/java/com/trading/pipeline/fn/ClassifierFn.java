package com.trading.pipeline.fn;

import com.trading.pipeline.data.Window;
import com.trading.pipeline.term.TermParams;

import java.time.LocalDate;

/**
 * Compute step of a CLASSIFIER term. {@code out} arrives filled with
 * {@link com.trading.pipeline.data.LabelMatrix#MISSING}; labels written must be
 * non-negative.
 *
 * @see FactorFn
 */
@FunctionalInterface
public interface ClassifierFn {
    void compute(LocalDate today, Window[] inputs, TermParams params, int[] out);
}
