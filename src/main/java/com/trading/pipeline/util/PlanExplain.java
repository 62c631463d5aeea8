package com.trading.pipeline.util;

import com.trading.pipeline.engine.ExecutionPlan;
import com.trading.pipeline.term.Term;

import java.util.Map;

/**
 * Text diagnostics for an {@link ExecutionPlan}.
 *
 * <p>
 * Intended for logging and debugging sessions, not for the evaluation path.
 */
public final class PlanExplain {

    private PlanExplain() {
    }

    /** One line per term in execution order: index, kind, window, extra rows, inputs and consumers. */
    public static String dump(ExecutionPlan plan) {
        StringBuilder sb = new StringBuilder(plan.nodeCount() * 96);
        for (int ti = 0; ti < plan.nodeCount(); ti++) {
            Term t = plan.term(ti);
            sb.append(String.format("#%-3d %-10s W=%-3d extra=%-3d ", ti, t.kind(), t.windowLength(),
                    plan.extraRows(ti)));
            sb.append(t.name());
            if (plan.inputCount(ti) > 0) {
                sb.append("  <- [");
                for (int i = 0; i < plan.inputCount(ti); i++) {
                    if (i > 0)
                        sb.append(", ");
                    sb.append('#').append(plan.input(ti, i));
                }
                sb.append(']');
            }
            if (plan.maskIndex(ti) >= 0)
                sb.append(" mask=#").append(plan.maskIndex(ti));
            if (plan.consumerCount(ti) > 0) {
                sb.append("  -> [");
                for (int i = 0; i < plan.consumerCount(ti); i++) {
                    if (i > 0)
                        sb.append(", ");
                    sb.append('#').append(plan.consumer(ti, i));
                }
                sb.append(']');
            }
            sb.append('\n');
        }
        for (Map.Entry<String, Integer> e : plan.outputs().entrySet())
            sb.append("output ").append(e.getKey()).append(" = #").append(e.getValue()).append('\n');
        if (plan.hasScreen())
            sb.append("screen = #").append(plan.screenIndex()).append('\n');
        return sb.toString();
    }

    /** Details of a single term. */
    public static String explainTerm(ExecutionPlan plan, Term term) {
        int ti = plan.indexOf(term);
        if (ti < 0)
            throw new IllegalArgumentException("Term not in plan: " + term.name());
        StringBuilder sb = new StringBuilder(256);
        sb.append("Term: ").append(term.name()).append('\n')
                .append("  Plan index: ").append(ti).append('\n')
                .append("  Kind: ").append(term.kind()).append('\n')
                .append("  Window length: ").append(term.windowLength()).append('\n')
                .append("  Extra rows: ").append(plan.extraRows(ti)).append('\n')
                .append("  Loaded: ").append(term.isLoadable()).append('\n')
                .append("  Kept to assembly: ").append(plan.isRoot(ti)).append('\n');
        int cc = plan.consumerCount(ti);
        sb.append("  Consumers (").append(cc).append("): ");
        for (int i = 0; i < cc; i++) {
            sb.append(plan.term(plan.consumer(ti, i)).name());
            if (i < cc - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }
}
