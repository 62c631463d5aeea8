package com.trading.pipeline.data;

import com.trading.pipeline.term.TermKind;

/**
 * Read-only trailing window over one input of a compute step.
 *
 * <p>
 * Day {@code 0} is the oldest row of the window and day {@code length() - 1} is
 * the day being computed. The window is cut from the input so that it ends on
 * that day: rows after it are simply not addressable, which is how compute steps
 * are kept free of look-ahead.
 */
public final class Window {
    private final Matrix source;
    private final int firstRow;
    private final int length;

    public Window(Matrix source, int firstRow, int length) {
        if (firstRow < 0 || length < 1 || firstRow + length > source.rows())
            throw new IndexOutOfBoundsException("Window [" + firstRow + ", " + (firstRow + length)
                    + ") outside " + source.rows() + " rows");
        this.source = source;
        this.firstRow = firstRow;
        this.length = length;
    }

    public TermKind kind() {
        return source.kind();
    }

    /** Number of days in the window. */
    public int length() {
        return length;
    }

    public int assets() {
        return source.columns();
    }

    public double getDouble(int day, int asset) {
        return ((DoubleMatrix) source).get(row(day), asset);
    }

    public boolean getBoolean(int day, int asset) {
        return ((BooleanMatrix) source).get(row(day), asset);
    }

    public int getLabel(int day, int asset) {
        return ((LabelMatrix) source).get(row(day), asset);
    }

    public boolean isMissing(int day, int asset) {
        return source.isMissing(row(day), asset);
    }

    /** Value on the day being computed. */
    public double latestDouble(int asset) {
        return getDouble(length - 1, asset);
    }

    public boolean latestBoolean(int asset) {
        return getBoolean(length - 1, asset);
    }

    public int latestLabel(int asset) {
        return getLabel(length - 1, asset);
    }

    /** Copies one asset's values over the window, oldest first. */
    public double[] series(int asset) {
        double[] out = new double[length];
        for (int d = 0; d < length; d++)
            out[d] = getDouble(d, asset);
        return out;
    }

    private int row(int day) {
        if (day < 0 || day >= length)
            throw new IndexOutOfBoundsException("Day " + day + " outside window of " + length);
        return firstRow + day;
    }
}
