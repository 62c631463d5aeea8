package com.trading.pipeline.fn.ops;

import com.trading.pipeline.data.Window;
import com.trading.pipeline.term.ComputeDefinition;
import com.trading.pipeline.term.TermKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Elementwise factor arithmetic on the current day.
 *
 * Every operation propagates missing values; division by zero and an infinite
 * power are missing.
 */
public final class Arithmetic {
    public static final String VALUE = "value";

    public enum Op {
        ADD("add") {
            @Override
            public double apply(double a, double b) {
                return a + b;
            }
        },
        SUBTRACT("subtract") {
            @Override
            public double apply(double a, double b) {
                return a - b;
            }
        },
        MULTIPLY("multiply") {
            @Override
            public double apply(double a, double b) {
                return a * b;
            }
        },
        DIVIDE("divide") {
            @Override
            public double apply(double a, double b) {
                return b == 0.0 ? Double.NaN : a / b;
            }
        },
        POWER("power") {
            @Override
            public double apply(double a, double b) {
                double r = Math.pow(a, b);
                return Double.isInfinite(r) ? Double.NaN : r;
            }
        };

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isCommutative() {
            return this == ADD || this == MULTIPLY;
        }

        public abstract double apply(double a, double b);
    }

    private static final Map<Op, ComputeDefinition> BINARY = new EnumMap<>(Op.class);
    private static final Map<Op, ComputeDefinition> SCALAR = new EnumMap<>(Op.class);
    private static final Map<Op, ComputeDefinition> REVERSED_SCALAR = new EnumMap<>(Op.class);

    static {
        for (Op op : Op.values()) {
            BINARY.put(op, ComputeDefinition.factor(op.symbol(), List.of(TermKind.FACTOR, TermKind.FACTOR),
                    List.of(), 0, (today, in, params, out) -> binary(op, in[0], in[1], out)));
            SCALAR.put(op, ComputeDefinition.factor(op.symbol() + "_scalar", List.of(TermKind.FACTOR),
                    List.of(VALUE), 0,
                    (today, in, params, out) -> scalar(op, in[0], params.getDouble(VALUE), false, out)));
            REVERSED_SCALAR.put(op, ComputeDefinition.factor("scalar_" + op.symbol(), List.of(TermKind.FACTOR),
                    List.of(VALUE), 0,
                    (today, in, params, out) -> scalar(op, in[0], params.getDouble(VALUE), true, out)));
        }
    }

    public static final ComputeDefinition NEGATE = ComputeDefinition.factor("negate", List.of(TermKind.FACTOR),
            List.of(), 0, (today, in, params, out) -> {
                for (int a = 0; a < out.length; a++)
                    out[a] = -in[0].latestDouble(a);
            });

    private Arithmetic() {
    }

    /** {@code lhs op rhs}, both factors. */
    public static ComputeDefinition binary(Op op) {
        return BINARY.get(op);
    }

    /** {@code factor op value}. */
    public static ComputeDefinition scalar(Op op) {
        return SCALAR.get(op);
    }

    /** {@code value op factor}. */
    public static ComputeDefinition reversedScalar(Op op) {
        return REVERSED_SCALAR.get(op);
    }

    private static void binary(Op op, Window lhs, Window rhs, double[] out) {
        for (int a = 0; a < out.length; a++)
            out[a] = op.apply(lhs.latestDouble(a), rhs.latestDouble(a));
    }

    private static void scalar(Op op, Window data, double value, boolean reversed, double[] out) {
        for (int a = 0; a < out.length; a++) {
            double x = data.latestDouble(a);
            out[a] = reversed ? op.apply(value, x) : op.apply(x, value);
        }
    }
}
