package com.trading.pipeline.api;

import com.trading.pipeline.data.AssetUniverse;
import com.trading.pipeline.data.Matrix;
import com.trading.pipeline.term.Term;

import java.time.LocalDate;

/**
 * Source of raw data for leaf terms.
 *
 * <p>
 * Contract:
 * <ul>
 * <li>The returned array has the term's {@link Term#kind() kind}, exactly one row
 * per trading session in {@code [start, end]} (oldest first) and one column per
 * asset of {@code assets}, in that order.</li>
 * <li>Row {@code r} holds data known as of that session; never later data.</li>
 * <li>Calls are deterministic for a given (term, range, assets).</li>
 * <li>Absent observations are the kind's missing value, not an error.</li>
 * <li>Failures (unknown column or asset, I/O, timeouts) are thrown as
 * {@link com.trading.pipeline.errors.LoaderFailureException} or any other
 * runtime exception, which the engine wraps.</li>
 * </ul>
 *
 * <p>
 * The engine treats returned arrays as read-only. Implementations must be safe
 * to call from several threads when the engine runs with parallelism above one.
 */
@FunctionalInterface
public interface Loader {

    Matrix getWindow(Term term, LocalDate start, LocalDate end, AssetUniverse assets);
}
