package com.trading.pipeline.fn.ops;

import com.trading.pipeline.term.ComputeDefinition;
import com.trading.pipeline.term.TermKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Filters derived from factors and classifiers on the current day.
 * A comparison involving a missing value is false.
 */
public final class Comparisons {
    public static final String VALUE = "value";
    public static final String LABEL = "label";

    public enum Cmp {
        GT("gt"), GE("ge"), LT("lt"), LE("le"), EQ("eq"), NE("ne");

        private final String symbol;

        Cmp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean test(double a, double b) {
            if (Double.isNaN(a) || Double.isNaN(b))
                return false;
            return switch (this) {
                case GT -> a > b;
                case GE -> a >= b;
                case LT -> a < b;
                case LE -> a <= b;
                case EQ -> a == b;
                case NE -> a != b;
            };
        }
    }

    private static final Map<Cmp, ComputeDefinition> BINARY = new EnumMap<>(Cmp.class);
    private static final Map<Cmp, ComputeDefinition> SCALAR = new EnumMap<>(Cmp.class);

    static {
        for (Cmp cmp : Cmp.values()) {
            BINARY.put(cmp, ComputeDefinition.filter(cmp.symbol(), List.of(TermKind.FACTOR, TermKind.FACTOR),
                    List.of(), 0, (today, in, params, out) -> {
                        for (int a = 0; a < out.length; a++)
                            out[a] = cmp.test(in[0].latestDouble(a), in[1].latestDouble(a));
                    }));
            SCALAR.put(cmp, ComputeDefinition.filter(cmp.symbol() + "_scalar", List.of(TermKind.FACTOR),
                    List.of(VALUE), 0, (today, in, params, out) -> {
                        double value = params.getDouble(VALUE);
                        for (int a = 0; a < out.length; a++)
                            out[a] = cmp.test(in[0].latestDouble(a), value);
                    }));
        }
    }

    public static final ComputeDefinition NOT_MISSING = ComputeDefinition.filter("not_missing",
            List.of(TermKind.FACTOR), List.of(), 0, (today, in, params, out) -> {
                for (int a = 0; a < out.length; a++)
                    out[a] = !Double.isNaN(in[0].latestDouble(a));
            });

    public static final ComputeDefinition IS_MISSING = ComputeDefinition.filter("is_missing",
            List.of(TermKind.FACTOR), List.of(), 0, (today, in, params, out) -> {
                for (int a = 0; a < out.length; a++)
                    out[a] = Double.isNaN(in[0].latestDouble(a));
            });

    public static final ComputeDefinition LABEL_EQ = ComputeDefinition.filter("label_eq",
            List.of(TermKind.CLASSIFIER), List.of(LABEL), 0, (today, in, params, out) -> {
                int label = params.getInt(LABEL);
                for (int a = 0; a < out.length; a++)
                    out[a] = in[0].latestLabel(a) == label;
            });

    private Comparisons() {
    }

    public static ComputeDefinition binary(Cmp cmp) {
        return BINARY.get(cmp);
    }

    public static ComputeDefinition scalar(Cmp cmp) {
        return SCALAR.get(cmp);
    }
}
