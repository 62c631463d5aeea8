package com.trading.pipeline.dsl;

import com.trading.pipeline.fn.ops.Comparisons;
import com.trading.pipeline.fn.ops.Comparisons.Cmp;
import com.trading.pipeline.fn.ops.CrossSectional;
import com.trading.pipeline.fn.ops.Logic;
import com.trading.pipeline.term.Term;
import com.trading.pipeline.term.TermParams;

import java.util.List;

/** Filter constructors. Comparisons against a missing value are false. */
public final class Filters {

    private Filters() {
    }

    public static Term gt(Term lhs, Term rhs) {
        return binary(Cmp.GT, lhs, rhs);
    }

    public static Term gt(Term lhs, double value) {
        return scalar(Cmp.GT, lhs, value);
    }

    public static Term ge(Term lhs, Term rhs) {
        return binary(Cmp.GE, lhs, rhs);
    }

    public static Term ge(Term lhs, double value) {
        return scalar(Cmp.GE, lhs, value);
    }

    public static Term lt(Term lhs, Term rhs) {
        return binary(Cmp.LT, lhs, rhs);
    }

    public static Term lt(Term lhs, double value) {
        return scalar(Cmp.LT, lhs, value);
    }

    public static Term le(Term lhs, Term rhs) {
        return binary(Cmp.LE, lhs, rhs);
    }

    public static Term le(Term lhs, double value) {
        return scalar(Cmp.LE, lhs, value);
    }

    public static Term eq(Term lhs, double value) {
        return scalar(Cmp.EQ, lhs, value);
    }

    public static Term ne(Term lhs, double value) {
        return scalar(Cmp.NE, lhs, value);
    }

    public static Term and(Term lhs, Term rhs) {
        return Term.of(Logic.AND, List.of(lhs, rhs), 0, null, TermParams.EMPTY);
    }

    public static Term or(Term lhs, Term rhs) {
        return Term.of(Logic.OR, List.of(lhs, rhs), 0, null, TermParams.EMPTY);
    }

    public static Term not(Term filter) {
        return Term.of(Logic.NOT, List.of(filter), 0, null, TermParams.EMPTY);
    }

    public static Term notMissing(Term factor) {
        return Term.of(Comparisons.NOT_MISSING, List.of(factor), 0, null, TermParams.EMPTY);
    }

    public static Term isMissing(Term factor) {
        return Term.of(Comparisons.IS_MISSING, List.of(factor), 0, null, TermParams.EMPTY);
    }

    /**
     * True where the factor lies between the {@code min} and {@code max}
     * percentiles (0 to 100, inclusive) of that day's non-missing values.
     */
    public static Term percentileBetween(Term factor, double min, double max) {
        return percentileBetween(factor, min, max, null);
    }

    public static Term percentileBetween(Term factor, double min, double max, Term mask) {
        if (!(min >= 0.0 && max <= 100.0 && min <= max))
            throw new IllegalArgumentException("Expected 0 <= min <= max <= 100, got min=" + min + " max=" + max);
        return Term.of(CrossSectional.PERCENTILE_BETWEEN, List.of(factor), 0, mask,
                TermParams.of(CrossSectional.MIN_PERCENTILE, min, CrossSectional.MAX_PERCENTILE, max));
    }

    private static Term binary(Cmp cmp, Term lhs, Term rhs) {
        return Term.of(Comparisons.binary(cmp), List.of(lhs, rhs), 0, null, TermParams.EMPTY);
    }

    private static Term scalar(Cmp cmp, Term lhs, double value) {
        return Term.of(Comparisons.scalar(cmp), List.of(lhs), 0, null, TermParams.of(Comparisons.VALUE, value));
    }
}
