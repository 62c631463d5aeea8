package com.trading.pipeline.term;

import com.trading.pipeline.data.BooleanMatrix;
import com.trading.pipeline.data.DoubleMatrix;
import com.trading.pipeline.data.LabelMatrix;
import com.trading.pipeline.data.Matrix;

/**
 * The output type of a term.
 * <ul>
 * <li>FACTOR: one double per asset per day, missing is {@code NaN}.</li>
 * <li>FILTER: one boolean per asset per day, missing is {@code false}.</li>
 * <li>CLASSIFIER: one int label per asset per day, missing is {@code -1}.</li>
 * </ul>
 */
public enum TermKind {
    FACTOR,
    FILTER,
    CLASSIFIER;

    /** Allocates a rows x columns array of this kind, filled with the missing value. */
    public Matrix allocate(int rows, int columns) {
        return switch (this) {
            case FACTOR -> new DoubleMatrix(rows, columns);
            case FILTER -> new BooleanMatrix(rows, columns);
            case CLASSIFIER -> new LabelMatrix(rows, columns);
        };
    }
}
