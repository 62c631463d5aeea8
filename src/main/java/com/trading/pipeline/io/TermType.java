package com.trading.pipeline.io;

import com.trading.pipeline.dsl.Classifiers;
import com.trading.pipeline.dsl.Factors;
import com.trading.pipeline.dsl.Filters;
import com.trading.pipeline.dsl.Technicals;
import com.trading.pipeline.fn.ops.CrossSectional.RankMethod;
import com.trading.pipeline.fn.ops.MathFunctions.MathFn;
import com.trading.pipeline.term.Columns;
import com.trading.pipeline.term.Term;
import com.trading.pipeline.term.TermKind;

import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Term types usable in a {@link PipelineDefinition}, each with the factory that
 * builds it from resolved inputs, window length, properties and mask.
 *
 * <p>
 * Arithmetic (including {@code power}) and comparison types take either two
 * inputs or one input and a {@code value} property. {@code math} applies the
 * unary function named by its {@code function} property ({@code log},
 * {@code sqrt}, {@code arctanh}, ...).
 */
public enum TermType {
    COLUMN(0, (s, in) -> {
        TermKind kind = TermKind.valueOf(s.string("kind", "FACTOR").toUpperCase());
        return masked(Columns.of(s.requireString("dataset"), s.requireString("column"), kind), s.mask);
    }),
    LATEST(1, (s, in) -> masked(Factors.latest(in.get(0)), s.mask)),

    ADD(-1, (s, in) -> masked(in.size() == 2 ? Factors.plus(in.get(0), in.get(1))
            : Factors.plus(in.get(0), s.requireDouble("value")), s.mask)),
    SUBTRACT(-1, (s, in) -> masked(in.size() == 2 ? Factors.minus(in.get(0), in.get(1))
            : Factors.minus(in.get(0), s.requireDouble("value")), s.mask)),
    MULTIPLY(-1, (s, in) -> masked(in.size() == 2 ? Factors.times(in.get(0), in.get(1))
            : Factors.times(in.get(0), s.requireDouble("value")), s.mask)),
    DIVIDE(-1, (s, in) -> masked(in.size() == 2 ? Factors.div(in.get(0), in.get(1))
            : Factors.div(in.get(0), s.requireDouble("value")), s.mask)),
    POWER(-1, (s, in) -> masked(in.size() == 2 ? Factors.pow(in.get(0), in.get(1))
            : Factors.pow(in.get(0), s.requireDouble("value")), s.mask)),
    NEGATE(1, (s, in) -> masked(Factors.negate(in.get(0)), s.mask)),
    MATH(1, (s, in) -> masked(Factors.apply(MathFn.parse(s.requireString("function")), in.get(0)), s.mask)),
    LOG(1, (s, in) -> masked(Factors.log(in.get(0)), s.mask)),
    EXP(1, (s, in) -> masked(Factors.exp(in.get(0)), s.mask)),
    SQRT(1, (s, in) -> masked(Factors.sqrt(in.get(0)), s.mask)),
    ABS(1, (s, in) -> masked(Factors.abs(in.get(0)), s.mask)),

    GT(-1, (s, in) -> masked(in.size() == 2 ? Filters.gt(in.get(0), in.get(1))
            : Filters.gt(in.get(0), s.requireDouble("value")), s.mask)),
    GE(-1, (s, in) -> masked(in.size() == 2 ? Filters.ge(in.get(0), in.get(1))
            : Filters.ge(in.get(0), s.requireDouble("value")), s.mask)),
    LT(-1, (s, in) -> masked(in.size() == 2 ? Filters.lt(in.get(0), in.get(1))
            : Filters.lt(in.get(0), s.requireDouble("value")), s.mask)),
    LE(-1, (s, in) -> masked(in.size() == 2 ? Filters.le(in.get(0), in.get(1))
            : Filters.le(in.get(0), s.requireDouble("value")), s.mask)),
    AND(2, (s, in) -> masked(Filters.and(in.get(0), in.get(1)), s.mask)),
    OR(2, (s, in) -> masked(Filters.or(in.get(0), in.get(1)), s.mask)),
    NOT(1, (s, in) -> masked(Filters.not(in.get(0)), s.mask)),
    NOT_MISSING(1, (s, in) -> masked(Filters.notMissing(in.get(0)), s.mask)),
    IS_MISSING(1, (s, in) -> masked(Filters.isMissing(in.get(0)), s.mask)),
    PERCENTILE_BETWEEN(1, (s, in) -> Filters.percentileBetween(in.get(0), s.requireDouble("min"),
            s.requireDouble("max"), s.mask)),

    RANK(1, (s, in) -> Factors.rank(in.get(0), RankMethod.parse(s.string("method", "ordinal")),
            s.bool("ascending", true), s.mask)),
    ZSCORE(-1, (s, in) -> Factors.zscore(in.get(0), in.size() > 1 ? in.get(1) : null, s.mask)),
    DEMEAN(-1, (s, in) -> Factors.demean(in.get(0), in.size() > 1 ? in.get(1) : null, s.mask)),
    TOP(1, (s, in) -> Factors.top(in.get(0), s.requireInt("n"), s.mask)),
    BOTTOM(1, (s, in) -> Factors.bottom(in.get(0), s.requireInt("n"), s.mask)),
    QUANTILES(1, (s, in) -> Classifiers.quantiles(in.get(0), s.requireInt("bins"), s.mask)),
    LABEL_EQ(1, (s, in) -> masked(Classifiers.eq(in.get(0), s.requireInt("label")), s.mask)),

    RETURNS(1, (s, in) -> Technicals.returns(in.get(0), s.window, s.mask)),
    RSI(1, (s, in) -> Technicals.rsi(in.get(0), s.window, s.mask)),
    SMA(1, (s, in) -> Technicals.sma(in.get(0), s.window, s.mask)),
    WEIGHTED_AVERAGE(2, (s, in) -> Technicals.weightedAverage(in.get(0), in.get(1), s.window, s.mask)),
    MAX_DRAWDOWN(1, (s, in) -> Technicals.maxDrawdown(in.get(0), s.window, s.mask)),
    EWMA(1, (s, in) -> Technicals.ewma(in.get(0), s.window, s.decayRate(), s.mask)),
    EWMSTD(1, (s, in) -> Technicals.ewmstd(in.get(0), s.window, s.decayRate(), s.mask)),
    CORRELATION(2, (s, in) -> Technicals.correlation(in.get(0), in.get(1), s.window, s.mask)),
    BETA(2, (s, in) -> Technicals.beta(in.get(0), in.get(1), s.window, s.mask));

    private final int arity;
    private final BiFunction<Args, List<Term>, Term> factory;

    /** @param arity Number of inputs, or -1 for one or two. */
    TermType(int arity, BiFunction<Args, List<Term>, Term> factory) {
        this.arity = arity;
        this.factory = factory;
    }

    public static TermType fromString(String s) {
        if (s == null)
            throw new IllegalArgumentException("Term type is missing");
        try {
            return valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown term type: " + s, e);
        }
    }

    /** Builds the term for {@code name}; inputs and mask are already resolved. */
    public Term create(String name, List<Term> inputs, int windowLength, Map<String, Object> properties,
            Term mask) {
        boolean arityOk = arity >= 0 ? inputs.size() == arity : inputs.size() == 1 || inputs.size() == 2;
        if (!arityOk)
            throw new IllegalArgumentException("Term '" + name + "' of type " + this + " expects "
                    + (arity >= 0 ? String.valueOf(arity) : "1 or 2") + " input(s), got " + inputs.size());
        return factory.apply(new Args(name, windowLength, properties == null ? Map.of() : properties, mask), inputs);
    }

    private static Term masked(Term term, Term mask) {
        return mask == null ? term : term.withMask(mask);
    }

    /** Property access for one term definition. */
    static final class Args {
        final String name;
        final int window;
        final Map<String, Object> props;
        final Term mask;

        Args(String name, int window, Map<String, Object> props, Term mask) {
            this.name = name;
            this.window = window;
            this.props = props;
            this.mask = mask;
        }

        String string(String key, String def) {
            Object v = props.get(key);
            return v == null ? def : v.toString();
        }

        String requireString(String key) {
            return require(key).toString();
        }

        boolean bool(String key, boolean def) {
            Object v = props.get(key);
            return v == null ? def : v instanceof Boolean b ? b : Boolean.parseBoolean(v.toString());
        }

        double requireDouble(String key) {
            Object v = require(key);
            if (v instanceof Number n)
                return n.doubleValue();
            try {
                return Double.parseDouble(v.toString());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Property '" + key + "' of term '" + name + "' is not a number: "
                        + v, e);
            }
        }

        int requireInt(String key) {
            double d = requireDouble(key);
            if (d != Math.rint(d))
                throw new IllegalArgumentException("Property '" + key + "' of term '" + name
                        + "' must be an integer, got " + d);
            return (int) d;
        }

        /** {@code decay_rate}, or one of {@code span}, {@code halflife}, {@code center_of_mass}. */
        double decayRate() {
            if (props.containsKey("decay_rate"))
                return requireDouble("decay_rate");
            if (props.containsKey("span"))
                return Technicals.decayFromSpan(requireDouble("span"));
            if (props.containsKey("halflife"))
                return Technicals.decayFromHalflife(requireDouble("halflife"));
            if (props.containsKey("center_of_mass"))
                return Technicals.decayFromCenterOfMass(requireDouble("center_of_mass"));
            throw new IllegalArgumentException("Term '" + name
                    + "' needs one of decay_rate, span, halflife or center_of_mass");
        }

        private Object require(String key) {
            Object v = props.get(key);
            if (v == null)
                throw new IllegalArgumentException("Term '" + name + "' is missing property '" + key + "'");
            return v;
        }
    }
}
