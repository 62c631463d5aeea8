package com.trading.pipeline.dsl;

import com.trading.pipeline.fn.FactorFn;
import com.trading.pipeline.fn.finance.Latest;
import com.trading.pipeline.fn.ops.Arithmetic;
import com.trading.pipeline.fn.ops.Arithmetic.Op;
import com.trading.pipeline.fn.ops.CrossSectional;
import com.trading.pipeline.fn.ops.CrossSectional.RankMethod;
import com.trading.pipeline.fn.ops.MathFunctions;
import com.trading.pipeline.fn.ops.MathFunctions.MathFn;
import com.trading.pipeline.term.ComputeDefinition;
import com.trading.pipeline.term.Term;
import com.trading.pipeline.term.TermKind;
import com.trading.pipeline.term.TermParams;

import java.util.List;

/**
 * Factor constructors.
 *
 * <p>
 * Every method returns a plain {@link Term}; building the same expression twice
 * yields equal terms, which the engine evaluates once.
 */
public final class Factors {

    private Factors() {
    }

    public static Term latest(Term factor) {
        return Term.of(Latest.DEFINITION, List.of(factor), 0, null, TermParams.EMPTY);
    }

    // Arithmetic

    public static Term plus(Term lhs, Term rhs) {
        return binary(Op.ADD, lhs, rhs);
    }

    public static Term plus(Term lhs, double value) {
        return scalar(Op.ADD, lhs, value);
    }

    /** {@code value + rhs}, the same term as {@code rhs + value}. */
    public static Term plus(double value, Term rhs) {
        return reversed(Op.ADD, value, rhs);
    }

    public static Term minus(Term lhs, Term rhs) {
        return binary(Op.SUBTRACT, lhs, rhs);
    }

    public static Term minus(Term lhs, double value) {
        return scalar(Op.SUBTRACT, lhs, value);
    }

    /** {@code value - rhs}. */
    public static Term minus(double value, Term rhs) {
        return reversed(Op.SUBTRACT, value, rhs);
    }

    public static Term times(Term lhs, Term rhs) {
        return binary(Op.MULTIPLY, lhs, rhs);
    }

    public static Term times(Term lhs, double value) {
        return scalar(Op.MULTIPLY, lhs, value);
    }

    public static Term times(double value, Term rhs) {
        return reversed(Op.MULTIPLY, value, rhs);
    }

    public static Term div(Term lhs, Term rhs) {
        return binary(Op.DIVIDE, lhs, rhs);
    }

    public static Term div(Term lhs, double value) {
        return scalar(Op.DIVIDE, lhs, value);
    }

    /** {@code value / rhs}. */
    public static Term div(double value, Term rhs) {
        return reversed(Op.DIVIDE, value, rhs);
    }

    public static Term pow(Term base, Term exponent) {
        return binary(Op.POWER, base, exponent);
    }

    public static Term pow(Term base, double exponent) {
        return scalar(Op.POWER, base, exponent);
    }

    /** {@code base ^ exponent}. */
    public static Term pow(double base, Term exponent) {
        return reversed(Op.POWER, base, exponent);
    }

    public static Term negate(Term factor) {
        return Term.of(Arithmetic.NEGATE, List.of(factor), 0, null, TermParams.EMPTY);
    }

    // Unary math

    public static Term apply(MathFn fn, Term factor) {
        return Term.of(MathFunctions.definition(fn), List.of(factor), 0, null, TermParams.EMPTY);
    }

    public static Term log(Term factor) {
        return apply(MathFn.LOG, factor);
    }

    public static Term exp(Term factor) {
        return apply(MathFn.EXP, factor);
    }

    public static Term sqrt(Term factor) {
        return apply(MathFn.SQRT, factor);
    }

    public static Term abs(Term factor) {
        return apply(MathFn.ABS, factor);
    }

    private static Term binary(Op op, Term lhs, Term rhs) {
        return Term.of(Arithmetic.binary(op), List.of(lhs, rhs), 0, null, TermParams.EMPTY);
    }

    private static Term scalar(Op op, Term lhs, double value) {
        return Term.of(Arithmetic.scalar(op), List.of(lhs), 0, null, TermParams.of(Arithmetic.VALUE, value));
    }

    private static Term reversed(Op op, double value, Term rhs) {
        // 2 + x and x + 2 are the same node
        if (op.isCommutative())
            return scalar(op, rhs, value);
        return Term.of(Arithmetic.reversedScalar(op), List.of(rhs), 0, null,
                TermParams.of(Arithmetic.VALUE, value));
    }

    // Cross-sectional

    /** Ascending ordinal rank, 1 for the smallest value. */
    public static Term rank(Term factor) {
        return rank(factor, RankMethod.ORDINAL, true, null);
    }

    public static Term rank(Term factor, RankMethod method, boolean ascending, Term mask) {
        return Term.of(CrossSectional.RANK, List.of(factor), 0, mask,
                TermParams.of(CrossSectional.METHOD, method.name().toLowerCase(), CrossSectional.ASCENDING,
                        ascending));
    }

    public static Term zscore(Term factor) {
        return zscore(factor, null, null);
    }

    /**
     * @param groupBy optional classifier; statistics are taken within each label.
     * @param mask    optional filter restricting which assets take part.
     */
    public static Term zscore(Term factor, Term groupBy, Term mask) {
        if (groupBy == null)
            return Term.of(CrossSectional.ZSCORE, List.of(factor), 0, mask, TermParams.EMPTY);
        return Term.of(CrossSectional.GROUPED_ZSCORE, List.of(factor, groupBy), 0, mask, TermParams.EMPTY);
    }

    public static Term demean(Term factor) {
        return demean(factor, null, null);
    }

    public static Term demean(Term factor, Term groupBy, Term mask) {
        if (groupBy == null)
            return Term.of(CrossSectional.DEMEAN, List.of(factor), 0, mask, TermParams.EMPTY);
        return Term.of(CrossSectional.GROUPED_DEMEAN, List.of(factor, groupBy), 0, mask, TermParams.EMPTY);
    }

    /** Filter: the {@code n} largest values each day. */
    public static Term top(Term factor, int n) {
        return top(factor, n, null);
    }

    public static Term top(Term factor, int n, Term mask) {
        checkCount(n);
        return Filters.le(rank(factor, RankMethod.ORDINAL, false, mask), n);
    }

    /** Filter: the {@code n} smallest values each day. */
    public static Term bottom(Term factor, int n) {
        return bottom(factor, n, null);
    }

    public static Term bottom(Term factor, int n, Term mask) {
        checkCount(n);
        return Filters.le(rank(factor, RankMethod.ORDINAL, true, mask), n);
    }

    private static void checkCount(int n) {
        if (n < 1)
            throw new IllegalArgumentException("n must be >= 1, got " + n);
    }

    /**
     * A user-defined factor over {@code inputs}. Two custom factors are the same
     * node only when they share the name, inputs and window and were built from
     * the same {@code fn} instance; a name reused with another function gives a
     * distinct node.
     */
    public static Term custom(String name, List<Term> inputs, int windowLength, FactorFn fn) {
        List<TermKind> kinds = inputs.stream().map(Term::kind).toList();
        ComputeDefinition def = ComputeDefinition.factor(name, kinds, List.of(), 0, fn);
        return Term.of(def, inputs, windowLength, null, TermParams.EMPTY);
    }
}
