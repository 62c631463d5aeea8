package com.trading.pipeline.data;

import com.trading.pipeline.term.TermKind;

import java.util.Arrays;

/** CLASSIFIER array, row-major, missing is {@link #MISSING}. */
public final class LabelMatrix implements Matrix {
    public static final int MISSING = -1;

    private final int rows;
    private final int columns;
    final int[] data;

    public LabelMatrix(int rows, int columns) {
        this(rows, columns, new int[rows * columns]);
        Arrays.fill(data, MISSING);
    }

    private LabelMatrix(int rows, int columns, int[] data) {
        this.rows = rows;
        this.columns = columns;
        this.data = data;
    }

    public static LabelMatrix of(int[][] values) {
        int cols = values.length == 0 ? 0 : values[0].length;
        LabelMatrix m = new LabelMatrix(values.length, cols);
        for (int r = 0; r < values.length; r++)
            m.setRow(r, values[r]);
        return m;
    }

    @Override
    public TermKind kind() {
        return TermKind.CLASSIFIER;
    }

    @Override
    public int rows() {
        return rows;
    }

    @Override
    public int columns() {
        return columns;
    }

    public int get(int row, int column) {
        return data[index(row, column)];
    }

    public void set(int row, int column, int label) {
        if (label < MISSING)
            throw new IllegalArgumentException("Labels must be >= 0 (or MISSING), got " + label);
        data[index(row, column)] = label;
    }

    public void setRow(int row, int[] values) {
        if (values.length != columns)
            throw new IllegalArgumentException("Row has " + values.length + " values, expected " + columns);
        for (int c = 0; c < columns; c++)
            set(row, c, values[c]);
    }

    public int[] row(int row) {
        int base = index(row, 0);
        return Arrays.copyOfRange(data, base, base + columns);
    }

    @Override
    public boolean isMissing(int row, int column) {
        return get(row, column) == MISSING;
    }

    @Override
    public void setMissing(int row, int column) {
        data[index(row, column)] = MISSING;
    }

    @Override
    public LabelMatrix copy() {
        return new LabelMatrix(rows, columns, data.clone());
    }

    @Override
    public LabelMatrix rowSlice(int from, int to) {
        DoubleMatrix.checkSlice(from, to, rows);
        return new LabelMatrix(to - from, columns, Arrays.copyOfRange(data, from * columns, to * columns));
    }

    private int index(int row, int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns)
            throw new IndexOutOfBoundsException("(" + row + ", " + column + ") outside " + rows + "x" + columns);
        return row * columns + column;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LabelMatrix m && rows == m.rows && columns == m.columns && Arrays.equals(data, m.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + columns) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("LabelMatrix ").append(rows).append('x').append(columns).append('\n');
        for (int r = 0; r < rows; r++)
            sb.append("  ").append(Arrays.toString(row(r))).append('\n');
        return sb.toString();
    }
}
