package com.trading.pipeline.data;

import com.trading.pipeline.term.TermKind;

import java.util.Arrays;

/** FACTOR array, row-major, missing is {@code NaN}. */
public final class DoubleMatrix implements Matrix {
    private final int rows;
    private final int columns;
    final double[] data;

    public DoubleMatrix(int rows, int columns) {
        this(rows, columns, new double[rows * columns]);
        Arrays.fill(data, Double.NaN);
    }

    private DoubleMatrix(int rows, int columns, double[] data) {
        this.rows = rows;
        this.columns = columns;
        this.data = data;
    }

    /** Builds from {@code values[row][column]}; every row must have the same length. */
    public static DoubleMatrix of(double[][] values) {
        int cols = values.length == 0 ? 0 : values[0].length;
        DoubleMatrix m = new DoubleMatrix(values.length, cols);
        for (int r = 0; r < values.length; r++)
            m.setRow(r, values[r]);
        return m;
    }

    @Override
    public TermKind kind() {
        return TermKind.FACTOR;
    }

    @Override
    public int rows() {
        return rows;
    }

    @Override
    public int columns() {
        return columns;
    }

    public double get(int row, int column) {
        return data[index(row, column)];
    }

    public void set(int row, int column, double value) {
        data[index(row, column)] = value;
    }

    public void setRow(int row, double[] values) {
        if (values.length != columns)
            throw new IllegalArgumentException("Row has " + values.length + " values, expected " + columns);
        System.arraycopy(values, 0, data, index(row, 0), columns);
    }

    public double[] row(int row) {
        int base = index(row, 0);
        return Arrays.copyOfRange(data, base, base + columns);
    }

    @Override
    public boolean isMissing(int row, int column) {
        return Double.isNaN(get(row, column));
    }

    @Override
    public void setMissing(int row, int column) {
        set(row, column, Double.NaN);
    }

    @Override
    public DoubleMatrix copy() {
        return new DoubleMatrix(rows, columns, data.clone());
    }

    @Override
    public DoubleMatrix rowSlice(int from, int to) {
        checkSlice(from, to, rows);
        return new DoubleMatrix(to - from, columns, Arrays.copyOfRange(data, from * columns, to * columns));
    }

    private int index(int row, int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns)
            throw new IndexOutOfBoundsException("(" + row + ", " + column + ") outside " + rows + "x" + columns);
        return row * columns + column;
    }

    static void checkSlice(int from, int to, int rows) {
        if (from < 0 || to > rows || from > to)
            throw new IndexOutOfBoundsException("Slice [" + from + ", " + to + ") outside " + rows + " rows");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DoubleMatrix m && rows == m.rows && columns == m.columns && Arrays.equals(data, m.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + columns) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DoubleMatrix ").append(rows).append('x').append(columns).append('\n');
        for (int r = 0; r < rows; r++)
            sb.append("  ").append(Arrays.toString(row(r))).append('\n');
        return sb.toString();
    }
}
