package com.trading.pipeline.fn.ops;

import com.trading.pipeline.data.LabelMatrix;
import com.trading.pipeline.data.Window;
import com.trading.pipeline.term.ComputeDefinition;
import com.trading.pipeline.term.TermKind;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Steps that compare assets against each other on the current day.
 *
 * Missing values (including masked-out assets) never take part in a statistic
 * and stay missing in the output.
 */
public final class CrossSectional {
    public static final String METHOD = "method";
    public static final String ASCENDING = "ascending";
    public static final String BINS = "bins";
    public static final String MIN_PERCENTILE = "min_percentile";
    public static final String MAX_PERCENTILE = "max_percentile";

    /** Tie handling for {@link #RANK}, following the usual statistical conventions. */
    public enum RankMethod {
        ORDINAL, AVERAGE, MIN, MAX, DENSE;

        public static RankMethod parse(String s) {
            return valueOf(s.trim().toUpperCase());
        }
    }

    public static final ComputeDefinition RANK = ComputeDefinition.factor("rank", List.of(TermKind.FACTOR),
            List.of(METHOD, ASCENDING), 0, (today, in, params, out) -> rank(values(in[0]),
                    RankMethod.parse(params.getString(METHOD)), params.getBoolean(ASCENDING), out));

    public static final ComputeDefinition ZSCORE = ComputeDefinition.factor("zscore", List.of(TermKind.FACTOR),
            List.of(), 0, (today, in, params, out) -> normalize(values(in[0]), null, true, out));

    public static final ComputeDefinition DEMEAN = ComputeDefinition.factor("demean", List.of(TermKind.FACTOR),
            List.of(), 0, (today, in, params, out) -> normalize(values(in[0]), null, false, out));

    public static final ComputeDefinition GROUPED_ZSCORE = ComputeDefinition.factor("grouped_zscore",
            List.of(TermKind.FACTOR, TermKind.CLASSIFIER), List.of(), 0,
            (today, in, params, out) -> normalize(values(in[0]), labels(in[1]), true, out));

    public static final ComputeDefinition GROUPED_DEMEAN = ComputeDefinition.factor("grouped_demean",
            List.of(TermKind.FACTOR, TermKind.CLASSIFIER), List.of(), 0,
            (today, in, params, out) -> normalize(values(in[0]), labels(in[1]), false, out));

    public static final ComputeDefinition QUANTILES = ComputeDefinition.classifier("quantiles",
            List.of(TermKind.FACTOR), List.of(BINS), 0,
            (today, in, params, out) -> quantiles(values(in[0]), params.getInt(BINS), out));

    public static final ComputeDefinition PERCENTILE_BETWEEN = ComputeDefinition.filter("percentile_between",
            List.of(TermKind.FACTOR), List.of(MIN_PERCENTILE, MAX_PERCENTILE), 0,
            (today, in, params, out) -> percentileBetween(values(in[0]), params.getDouble(MIN_PERCENTILE),
                    params.getDouble(MAX_PERCENTILE), out));

    private CrossSectional() {
    }

    static double[] values(Window w) {
        double[] v = new double[w.assets()];
        for (int a = 0; a < v.length; a++)
            v[a] = w.latestDouble(a);
        return v;
    }

    static int[] labels(Window w) {
        int[] v = new int[w.assets()];
        for (int a = 0; a < v.length; a++)
            v[a] = w.latestLabel(a);
        return v;
    }

    /** Indices of non-missing values, sorted by value; ties keep asset order. */
    static Integer[] sortedPresent(double[] values, boolean ascending) {
        return Arrays.stream(indicesPresent(values))
                .boxed()
                .sorted((i, j) -> ascending ? Double.compare(values[i], values[j])
                        : Double.compare(values[j], values[i]))
                .toArray(Integer[]::new);
    }

    private static int[] indicesPresent(double[] values) {
        int n = 0;
        for (double v : values)
            if (!Double.isNaN(v))
                n++;
        int[] idx = new int[n];
        int k = 0;
        for (int i = 0; i < values.length; i++)
            if (!Double.isNaN(values[i]))
                idx[k++] = i;
        return idx;
    }

    static void rank(double[] values, RankMethod method, boolean ascending, double[] out) {
        Integer[] order = sortedPresent(values, ascending);
        int dense = 0;
        int i = 0;
        while (i < order.length) {
            int j = i;
            while (j + 1 < order.length && values[order[j + 1]] == values[order[i]])
                j++;
            dense++;
            for (int k = i; k <= j; k++) {
                out[order[k]] = switch (method) {
                    case ORDINAL -> k + 1;
                    case AVERAGE -> (i + j) / 2.0 + 1;
                    case MIN -> i + 1;
                    case MAX -> j + 1;
                    case DENSE -> dense;
                };
            }
            i = j + 1;
        }
    }

    /**
     * Demeans (and optionally scales by the population standard deviation) within
     * each label group, or across all assets when {@code groups} is null.
     */
    static void normalize(double[] values, int[] groups, boolean scale, double[] out) {
        Map<Integer, double[]> sums = new HashMap<>(); // group -> {count, sum, sumSq}
        for (int a = 0; a < values.length; a++) {
            int g = groups == null ? 0 : groups[a];
            if (Double.isNaN(values[a]) || g == LabelMatrix.MISSING)
                continue;
            double[] s = sums.computeIfAbsent(g, k -> new double[3]);
            s[0]++;
            s[1] += values[a];
        }
        for (int a = 0; a < values.length; a++) {
            int g = groups == null ? 0 : groups[a];
            if (Double.isNaN(values[a]) || g == LabelMatrix.MISSING)
                continue;
            double[] s = sums.get(g);
            double dev = values[a] - s[1] / s[0];
            s[2] += dev * dev;
        }
        for (int a = 0; a < values.length; a++) {
            int g = groups == null ? 0 : groups[a];
            if (Double.isNaN(values[a]) || g == LabelMatrix.MISSING)
                continue;
            double[] s = sums.get(g);
            double dev = values[a] - s[1] / s[0];
            if (!scale) {
                out[a] = dev;
                continue;
            }
            double std = Math.sqrt(s[2] / s[0]);
            if (std > 0.0)
                out[a] = dev / std;
        }
    }

    /** Label {@code floor(rank * bins / count)}, rank 0-based ascending. */
    static void quantiles(double[] values, int bins, int[] out) {
        if (bins < 1)
            throw new IllegalArgumentException("bins must be >= 1, got " + bins);
        Integer[] order = sortedPresent(values, true);
        for (int r = 0; r < order.length; r++)
            out[order[r]] = (int) ((long) r * bins / order.length);
    }

    static void percentileBetween(double[] values, double minPercentile, double maxPercentile, boolean[] out) {
        Integer[] order = sortedPresent(values, true);
        if (order.length == 0)
            return;
        double lo = percentile(values, order, minPercentile);
        double hi = percentile(values, order, maxPercentile);
        for (Integer a : order)
            out[a] = values[a] >= lo && values[a] <= hi;
    }

    /** Linear-interpolated percentile of the present values. */
    static double percentile(double[] values, Integer[] order, double pct) {
        double pos = pct / 100.0 * (order.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        double lv = values[order[lower]];
        double uv = values[order[upper]];
        return lv + (uv - lv) * (pos - lower);
    }
}
