package com.trading.pipeline.data;

import com.trading.pipeline.term.TermKind;

/**
 * A dense date x asset array: row {@code r} is a business day (oldest first),
 * column {@code c} is an asset in universe order.
 *
 * <p>
 * Each implementation carries its kind's missing value, see {@link TermKind}.
 * Arrays handed out by the engine and by loaders are treated as read-only once
 * published; masking always works on a {@link #copy()}.
 */
public interface Matrix {

    TermKind kind();

    int rows();

    int columns();

    boolean isMissing(int row, int column);

    void setMissing(int row, int column);

    Matrix copy();

    /** Copy of rows {@code [from, to)}. */
    Matrix rowSlice(int from, int to);

    /**
     * Marks every cell missing where {@code mask} is false. Row {@code r} of this
     * array lines up with row {@code r + maskRowOffset} of the mask.
     */
    default void applyMask(BooleanMatrix mask, int maskRowOffset) {
        if (mask.columns() != columns())
            throw new IllegalArgumentException("Mask has " + mask.columns() + " columns, expected " + columns());
        for (int r = 0; r < rows(); r++)
            for (int c = 0; c < columns(); c++)
                if (!mask.get(r + maskRowOffset, c))
                    setMissing(r, c);
    }
}
