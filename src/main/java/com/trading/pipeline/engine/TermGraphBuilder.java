package com.trading.pipeline.engine;

import com.trading.pipeline.errors.DuplicateOutputNameException;
import com.trading.pipeline.errors.UnsupportedDTypeException;
import com.trading.pipeline.term.Term;
import com.trading.pipeline.term.TermKind;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles named output terms and an optional screen into an
 * {@link ExecutionPlan}.
 *
 * <p>
 * Steps:
 * <ol>
 * <li>Validate output names and the screen's kind.</li>
 * <li>Order the reachable terms with {@link DependencyOrder}, starting from the
 * outputs in declaration order and then the screen. Structurally equal terms
 * collapse into one node.</li>
 * <li>Flatten input, mask and consumer edges into CSR arrays.</li>
 * <li>Walk the order backwards to compute extra rows:
 * {@code extra[t] = max over consumers c of (extra[c] + lookback(c))}.</li>
 * </ol>
 */
@Log4j2
public final class TermGraphBuilder {

    public ExecutionPlan build(Map<String, Term> outputs, Term screen) {
        List<Map.Entry<String, Term>> entries = new ArrayList<>();
        if (outputs != null)
            for (var e : outputs.entrySet())
                entries.add(new AbstractMap.SimpleImmutableEntry<>(e.getKey(), e.getValue()));
        return build(entries, screen);
    }

    /**
     * Same as {@link #build(Map, Term)} but accepts outputs as a list, so that a
     * repeated name is reported instead of silently overwritten.
     */
    public ExecutionPlan build(List<Map.Entry<String, Term>> outputs, Term screen) {
        if (outputs == null || outputs.isEmpty())
            throw new IllegalArgumentException("A pipeline needs at least one output");

        LinkedHashMap<String, Term> named = new LinkedHashMap<>();
        for (var e : outputs) {
            String name = e.getKey();
            if (name == null || name.isBlank())
                throw new IllegalArgumentException("Output name must not be blank");
            if (e.getValue() == null)
                throw new IllegalArgumentException("Output '" + name + "' has no term");
            if (named.putIfAbsent(name, e.getValue()) != null)
                throw new DuplicateOutputNameException(name);
        }
        if (screen != null && screen.kind() != TermKind.FILTER)
            throw new UnsupportedDTypeException("Screen must be a FILTER, got " + screen.kind() + ": " + screen.name());

        List<Term> roots = new ArrayList<>(named.values());
        if (screen != null)
            roots.add(screen);

        List<Term> sorted = DependencyOrder.sort(roots, Term::dependencies, Term::name);
        int n = sorted.size();
        Term[] order = sorted.toArray(new Term[0]);
        Map<Term, Integer> index = new HashMap<>(n * 2);
        for (int i = 0; i < n; i++)
            index.put(order[i], i);

        // Dependencies (declared inputs) and masks
        int[] dependencyOffset = new int[n + 1];
        int[] maskIndex = new int[n];
        List<Integer> dependencyList = new ArrayList<>();
        List<Set<Integer>> consumers = new ArrayList<>(n);
        for (int i = 0; i < n; i++)
            consumers.add(new LinkedHashSet<>());

        for (int i = 0; i < n; i++) {
            Term t = order[i];
            dependencyOffset[i] = dependencyList.size();
            for (Term input : t.inputs()) {
                int j = index.get(input);
                dependencyList.add(j);
                consumers.get(j).add(i);
            }
            if (t.hasMask()) {
                int m = index.get(t.mask());
                maskIndex[i] = m;
                consumers.get(m).add(i);
            } else {
                maskIndex[i] = -1;
            }
        }
        dependencyOffset[n] = dependencyList.size();

        int[] consumerOffset = new int[n + 1];
        int total = 0;
        for (int i = 0; i < n; i++) {
            consumerOffset[i] = total;
            total += consumers.get(i).size();
        }
        consumerOffset[n] = total;
        int[] consumerList = new int[total];
        int k = 0;
        for (int i = 0; i < n; i++)
            for (int c : consumers.get(i))
                consumerList[k++] = c;

        // Consumers always sit later in the order, so one backward pass suffices.
        int[] extraRows = new int[n];
        for (int i = n - 1; i >= 0; i--) {
            int extra = 0;
            for (int c = consumerOffset[i]; c < consumerOffset[i + 1]; c++) {
                int consumer = consumerList[c];
                extra = Math.max(extra, extraRows[consumer] + order[consumer].lookback());
            }
            extraRows[i] = extra;
        }

        boolean[] root = new boolean[n];
        LinkedHashMap<String, Integer> outputIndex = new LinkedHashMap<>();
        for (var e : named.entrySet()) {
            int ti = index.get(e.getValue());
            outputIndex.put(e.getKey(), ti);
            root[ti] = true;
        }
        int screenIndex = -1;
        if (screen != null) {
            screenIndex = index.get(screen);
            root[screenIndex] = true;
        }

        ExecutionPlan plan = new ExecutionPlan(order, index, extraRows, dependencyOffset,
                dependencyList.stream().mapToInt(Integer::intValue).toArray(), maskIndex, consumerOffset,
                consumerList, root, outputIndex, screenIndex);
        log.debug("Built plan: {} terms, {} outputs, screen={}, maxExtraRows={}", n, outputIndex.size(),
                screen != null, plan.maxExtraRows());
        return plan;
    }
}
