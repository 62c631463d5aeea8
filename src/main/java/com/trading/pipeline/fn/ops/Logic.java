package com.trading.pipeline.fn.ops;

import com.trading.pipeline.term.ComputeDefinition;
import com.trading.pipeline.term.TermKind;

import java.util.List;

/** Boolean combinations of filters on the current day. */
public final class Logic {

    public static final ComputeDefinition AND = ComputeDefinition.filter("and",
            List.of(TermKind.FILTER, TermKind.FILTER), List.of(), 0, (today, in, params, out) -> {
                for (int a = 0; a < out.length; a++)
                    out[a] = in[0].latestBoolean(a) && in[1].latestBoolean(a);
            });

    public static final ComputeDefinition OR = ComputeDefinition.filter("or",
            List.of(TermKind.FILTER, TermKind.FILTER), List.of(), 0, (today, in, params, out) -> {
                for (int a = 0; a < out.length; a++)
                    out[a] = in[0].latestBoolean(a) || in[1].latestBoolean(a);
            });

    public static final ComputeDefinition NOT = ComputeDefinition.filter("not",
            List.of(TermKind.FILTER), List.of(), 0, (today, in, params, out) -> {
                for (int a = 0; a < out.length; a++)
                    out[a] = !in[0].latestBoolean(a);
            });

    private Logic() {
    }
}
