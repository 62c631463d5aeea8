package com.trading.pipeline.engine;

import com.trading.pipeline.term.Term;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, topologically ordered execution plan for one pipeline.
 *
 * <p>
 * Every distinct term appears exactly once. Edges are stored flattened
 * (CSR layout):
 * <ul>
 * <li><b>order:</b> terms, producers before consumers.</li>
 * <li><b>dependencyList / dependencyOffset:</b> plan indices of each term's
 * declared inputs in order.</li>
 * <li><b>consumerList / consumerOffset:</b> distinct plan indices of the terms
 * that read each term (inputs and masks).</li>
 * </ul>
 *
 * <p>
 * {@code extraRows[i]} is how many sessions before the first output date term
 * {@code i} must be materialised so that every consumer's trailing window is
 * full. Output and screen terms have 0.
 */
public final class ExecutionPlan {
    private final Term[] order;
    private final Map<Term, Integer> index;
    private final int[] extraRows;

    private final int[] dependencyOffset;
    private final int[] dependencyList;
    private final int[] maskIndex;

    private final int[] consumerOffset;
    private final int[] consumerList;

    private final boolean[] root;
    private final Map<String, Integer> outputs;
    private final int screenIndex;

    ExecutionPlan(Term[] order, Map<Term, Integer> index, int[] extraRows, int[] dependencyOffset,
            int[] dependencyList, int[] maskIndex, int[] consumerOffset, int[] consumerList, boolean[] root,
            LinkedHashMap<String, Integer> outputs, int screenIndex) {
        this.order = order;
        this.index = index;
        this.extraRows = extraRows;
        this.dependencyOffset = dependencyOffset;
        this.dependencyList = dependencyList;
        this.maskIndex = maskIndex;
        this.consumerOffset = consumerOffset;
        this.consumerList = consumerList;
        this.root = root;
        this.outputs = Collections.unmodifiableMap(outputs);
        this.screenIndex = screenIndex;
    }

    public int nodeCount() {
        return order.length;
    }

    public Term term(int ti) {
        return order[ti];
    }

    public List<Term> terms() {
        return List.of(order);
    }

    /** Plan index of {@code term}, or -1 if it is not part of this plan. */
    public int indexOf(Term term) {
        Integer idx = index.get(term);
        return idx == null ? -1 : idx;
    }

    public int extraRows(int ti) {
        return extraRows[ti];
    }

    public int maxExtraRows() {
        int max = 0;
        for (int e : extraRows)
            max = Math.max(max, e);
        return max;
    }

    public int inputCount(int ti) {
        return dependencyOffset[ti + 1] - dependencyOffset[ti];
    }

    public int input(int ti, int i) {
        return dependencyList[dependencyOffset[ti] + i];
    }

    /** Plan index of the term's mask, or -1 if it has none. */
    public int maskIndex(int ti) {
        return maskIndex[ti];
    }

    public int consumerCount(int ti) {
        return consumerOffset[ti + 1] - consumerOffset[ti];
    }

    public int consumer(int ti, int i) {
        return consumerList[consumerOffset[ti] + i];
    }

    /** Output and screen terms stay cached until assembly. */
    public boolean isRoot(int ti) {
        return root[ti];
    }

    /** Output name to plan index, in declaration order. */
    public Map<String, Integer> outputs() {
        return outputs;
    }

    public boolean hasScreen() {
        return screenIndex >= 0;
    }

    /** Plan index of the screen, or -1. */
    public int screenIndex() {
        return screenIndex;
    }

    /** Distinct plan indices this term reads: inputs in order, then the mask. */
    int[] distinctDependencies(int ti) {
        int count = inputCount(ti) + (maskIndex[ti] >= 0 ? 1 : 0);
        int[] tmp = new int[count];
        int n = 0;
        for (int i = 0; i < count; i++) {
            int dep = i < inputCount(ti) ? input(ti, i) : maskIndex[ti];
            boolean seen = false;
            for (int k = 0; k < n; k++)
                if (tmp[k] == dep) {
                    seen = true;
                    break;
                }
            if (!seen)
                tmp[n++] = dep;
        }
        return n == count ? tmp : Arrays.copyOf(tmp, n);
    }
}
