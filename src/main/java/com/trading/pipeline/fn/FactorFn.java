package com.trading.pipeline.fn;

import com.trading.pipeline.data.Window;
import com.trading.pipeline.term.TermParams;

import java.time.LocalDate;

/**
 * Compute step of a FACTOR term, called once per output day.
 *
 * <p>
 * {@code out} holds one slot per asset and arrives filled with {@code NaN}; a
 * step that cannot produce a value for an asset (too little history,
 * degenerate input) leaves the slot as is rather than throwing.
 *
 * <p>
 * The engine reuses {@code out} and the window objects between calls.
 * Implementations must not keep references to them.
 */
@FunctionalInterface
public interface FactorFn {

    /**
     * @param today  The day being computed (last row of every window).
     * @param inputs One trailing window per term input, in declared order.
     * @param params The term's bound parameters.
     * @param out    Output row, one slot per asset.
     */
    void compute(LocalDate today, Window[] inputs, TermParams params, double[] out);
}
