package com.trading.pipeline.fn.ops;

import com.trading.pipeline.term.ComputeDefinition;
import com.trading.pipeline.term.TermKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Elementwise unary math on a factor's current value. Missing stays missing,
 * and a result outside the function's domain (log of a negative, asin of 2)
 * is missing too.
 */
public final class MathFunctions {

    public enum MathFn {
        SIN("sin", Math::sin),
        COS("cos", Math::cos),
        TAN("tan", Math::tan),
        ARCSIN("arcsin", Math::asin),
        ARCCOS("arccos", Math::acos),
        ARCTAN("arctan", Math::atan),
        SINH("sinh", Math::sinh),
        COSH("cosh", Math::cosh),
        TANH("tanh", Math::tanh),
        ARCSINH("arcsinh", x -> Math.log(x + Math.sqrt(x * x + 1.0))),
        ARCCOSH("arccosh", x -> Math.log(x + Math.sqrt(x * x - 1.0))),
        ARCTANH("arctanh", x -> 0.5 * Math.log((1.0 + x) / (1.0 - x))),
        LOG("log", Math::log),
        LOG1P("log1p", Math::log1p),
        EXP("exp", Math::exp),
        EXPM1("expm1", Math::expm1),
        SQRT("sqrt", Math::sqrt),
        ABS("abs", Math::abs);

        private final String symbol;
        private final DoubleUnaryOperator op;

        MathFn(String symbol, DoubleUnaryOperator op) {
            this.symbol = symbol;
            this.op = op;
        }

        public String symbol() {
            return symbol;
        }

        public double apply(double x) {
            if (Double.isNaN(x))
                return Double.NaN;
            double r = op.applyAsDouble(x);
            return Double.isInfinite(r) ? Double.NaN : r;
        }

        public static MathFn parse(String s) {
            String key = s.trim().toLowerCase();
            for (MathFn fn : values())
                if (fn.symbol.equals(key))
                    return fn;
            throw new IllegalArgumentException("Unknown math function: " + s);
        }
    }

    private static final Map<MathFn, ComputeDefinition> DEFINITIONS = new EnumMap<>(MathFn.class);

    static {
        for (MathFn fn : MathFn.values())
            DEFINITIONS.put(fn, ComputeDefinition.factor(fn.symbol(), List.of(TermKind.FACTOR), List.of(), 0,
                    (today, in, params, out) -> {
                        for (int a = 0; a < out.length; a++)
                            out[a] = fn.apply(in[0].latestDouble(a));
                    }));
    }

    private MathFunctions() {
    }

    public static ComputeDefinition definition(MathFn fn) {
        return DEFINITIONS.get(fn);
    }
}
