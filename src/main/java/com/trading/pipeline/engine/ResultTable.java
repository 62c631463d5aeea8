package com.trading.pipeline.engine;

import com.trading.pipeline.term.TermKind;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tabular pipeline output: one row per (session, asset) that passed the screen,
 * ordered by session ascending, then asset in universe order; one column per
 * output name.
 *
 * <p>
 * Cells keep their kind's missing value ({@code NaN}, {@code false},
 * {@code -1}) for screened-in rows whose term had no data.
 */
public final class ResultTable {
    private final LocalDate[] dates;
    private final long[] sids;
    private final Map<String, TermKind> kinds;
    private final Map<String, Object> columns;

    ResultTable(LocalDate[] dates, long[] sids, LinkedHashMap<String, TermKind> kinds,
            Map<String, Object> columns) {
        this.dates = dates;
        this.sids = sids;
        this.kinds = kinds;
        this.columns = columns;
    }

    public int rowCount() {
        return dates.length;
    }

    public boolean isEmpty() {
        return dates.length == 0;
    }

    public LocalDate date(int row) {
        return dates[row];
    }

    public long sid(int row) {
        return sids[row];
    }

    /** Output names in declaration order. */
    public List<String> columnNames() {
        return List.copyOf(kinds.keySet());
    }

    public TermKind kind(String column) {
        TermKind k = kinds.get(column);
        if (k == null)
            throw new IllegalArgumentException("Unknown column: " + column);
        return k;
    }

    public double getDouble(String column, int row) {
        return ((double[]) values(column, TermKind.FACTOR))[row];
    }

    public boolean getBoolean(String column, int row) {
        return ((boolean[]) values(column, TermKind.FILTER))[row];
    }

    public int getLabel(String column, int row) {
        return ((int[]) values(column, TermKind.CLASSIFIER))[row];
    }

    public boolean isMissing(String column, int row) {
        return switch (kind(column)) {
            case FACTOR -> Double.isNaN(getDouble(column, row));
            case FILTER -> !getBoolean(column, row);
            case CLASSIFIER -> getLabel(column, row) == -1;
        };
    }

    /** Column values as a copy, for FACTOR columns. */
    public double[] doubles(String column) {
        return ((double[]) values(column, TermKind.FACTOR)).clone();
    }

    /** Row for (date, sid), or -1 if the pair was screened out or is outside the table. */
    public int rowIndex(LocalDate date, long sid) {
        int lo = 0, hi = dates.length - 1;
        // Rows are sorted by date; find the first row of that date, then scan it.
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (dates[mid].isBefore(date))
                lo = mid + 1;
            else
                hi = mid - 1;
        }
        for (int r = lo; r < dates.length && dates[r].equals(date); r++)
            if (sids[r] == sid)
                return r;
        return -1;
    }

    public boolean contains(LocalDate date, long sid) {
        return rowIndex(date, sid) >= 0;
    }

    private Object values(String column, TermKind expected) {
        TermKind k = kind(column);
        if (k != expected)
            throw new IllegalArgumentException("Column " + column + " is " + k + ", not " + expected);
        return columns.get(column);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-12s %8s", "date", "sid"));
        for (String c : kinds.keySet())
            sb.append(String.format(" %14s", c));
        sb.append('\n');
        int shown = Math.min(dates.length, 20);
        for (int r = 0; r < shown; r++) {
            sb.append(String.format("%-12s %8d", dates[r], sids[r]));
            for (String c : kinds.keySet()) {
                Object v = switch (kinds.get(c)) {
                    case FACTOR -> getDouble(c, r);
                    case FILTER -> getBoolean(c, r);
                    case CLASSIFIER -> getLabel(c, r);
                };
                sb.append(String.format(" %14s", v));
            }
            sb.append('\n');
        }
        if (dates.length > shown)
            sb.append("... ").append(dates.length - shown).append(" more rows\n");
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ResultTable t))
            return false;
        if (!Arrays.equals(dates, t.dates) || !Arrays.equals(sids, t.sids) || !kinds.equals(t.kinds))
            return false;
        for (var e : kinds.entrySet()) {
            Object a = columns.get(e.getKey()), b = t.columns.get(e.getKey());
            boolean same = switch (e.getValue()) {
                case FACTOR -> Arrays.equals((double[]) a, (double[]) b);
                case FILTER -> Arrays.equals((boolean[]) a, (boolean[]) b);
                case CLASSIFIER -> Arrays.equals((int[]) a, (int[]) b);
            };
            if (!same)
                return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(dates) + Arrays.hashCode(sids);
    }
}
