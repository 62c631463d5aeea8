package com.trading.pipeline.data;

import com.trading.pipeline.term.TermKind;

import java.util.Arrays;

/** FILTER array, row-major, missing is {@code false}. */
public final class BooleanMatrix implements Matrix {
    private final int rows;
    private final int columns;
    final boolean[] data;

    public BooleanMatrix(int rows, int columns) {
        this(rows, columns, new boolean[rows * columns]);
    }

    private BooleanMatrix(int rows, int columns, boolean[] data) {
        this.rows = rows;
        this.columns = columns;
        this.data = data;
    }

    public static BooleanMatrix of(boolean[][] values) {
        int cols = values.length == 0 ? 0 : values[0].length;
        BooleanMatrix m = new BooleanMatrix(values.length, cols);
        for (int r = 0; r < values.length; r++)
            m.setRow(r, values[r]);
        return m;
    }

    @Override
    public TermKind kind() {
        return TermKind.FILTER;
    }

    @Override
    public int rows() {
        return rows;
    }

    @Override
    public int columns() {
        return columns;
    }

    public boolean get(int row, int column) {
        return data[index(row, column)];
    }

    public void set(int row, int column, boolean value) {
        data[index(row, column)] = value;
    }

    public void setRow(int row, boolean[] values) {
        if (values.length != columns)
            throw new IllegalArgumentException("Row has " + values.length + " values, expected " + columns);
        System.arraycopy(values, 0, data, index(row, 0), columns);
    }

    public boolean[] row(int row) {
        int base = index(row, 0);
        return Arrays.copyOfRange(data, base, base + columns);
    }

    @Override
    public boolean isMissing(int row, int column) {
        return !get(row, column);
    }

    @Override
    public void setMissing(int row, int column) {
        set(row, column, false);
    }

    @Override
    public BooleanMatrix copy() {
        return new BooleanMatrix(rows, columns, data.clone());
    }

    @Override
    public BooleanMatrix rowSlice(int from, int to) {
        DoubleMatrix.checkSlice(from, to, rows);
        return new BooleanMatrix(to - from, columns, Arrays.copyOfRange(data, from * columns, to * columns));
    }

    private int index(int row, int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns)
            throw new IndexOutOfBoundsException("(" + row + ", " + column + ") outside " + rows + "x" + columns);
        return row * columns + column;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BooleanMatrix m && rows == m.rows && columns == m.columns && Arrays.equals(data, m.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + columns) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("BooleanMatrix ").append(rows).append('x').append(columns).append('\n');
        for (int r = 0; r < rows; r++)
            sb.append("  ").append(Arrays.toString(row(r))).append('\n');
        return sb.toString();
    }
}
