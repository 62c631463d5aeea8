package com.trading.pipeline.engine;

import com.trading.pipeline.errors.CyclicDependencyException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Depth-first topological sort with cycle detection.
 *
 * <p>
 * Nodes are identified by {@code equals}/{@code hashCode}, so structurally equal
 * nodes reached along different paths collapse into one entry.
 *
 * <p>
 * Order: post-order of a depth-first walk that starts from each root in the
 * given order and visits each node's dependencies in the order returned by
 * {@code dependencies}. Producers therefore always precede consumers, and among
 * independent nodes the one discovered first comes first. The walk is iterative,
 * so very deep chains do not exhaust the stack.
 *
 * <p>
 * A dependency found while it is still on the active path is a cycle; the
 * exception names the path from that node back to itself.
 */
public final class DependencyOrder {

    private enum Mark {
        ON_PATH, DONE
    }

    private DependencyOrder() {
    }

    public static <N> List<N> sort(Collection<? extends N> roots, Function<N, List<N>> dependencies,
            Function<N, String> describe) {
        Map<N, Mark> marks = new HashMap<>();
        List<N> order = new ArrayList<>();
        Deque<Frame<N>> stack = new ArrayDeque<>();

        for (N root : roots) {
            if (marks.containsKey(root))
                continue;
            marks.put(root, Mark.ON_PATH);
            stack.push(new Frame<>(root, dependencies.apply(root)));

            while (!stack.isEmpty()) {
                Frame<N> top = stack.peek();
                if (top.next < top.deps.size()) {
                    N dep = top.deps.get(top.next++);
                    Mark mark = marks.get(dep);
                    if (mark == Mark.DONE)
                        continue;
                    if (mark == Mark.ON_PATH)
                        throw new CyclicDependencyException(chain(stack, dep, describe));
                    marks.put(dep, Mark.ON_PATH);
                    stack.push(new Frame<>(dep, dependencies.apply(dep)));
                } else {
                    stack.pop();
                    marks.put(top.node, Mark.DONE);
                    order.add(top.node);
                }
            }
        }
        return order;
    }

    /** Path from {@code repeated} down to the top of the stack, closed with {@code repeated}. */
    private static <N> List<String> chain(Deque<Frame<N>> stack, N repeated, Function<N, String> describe) {
        List<String> chain = new ArrayList<>();
        boolean inCycle = false;
        var it = stack.descendingIterator(); // bottom of the stack first
        while (it.hasNext()) {
            N node = it.next().node;
            if (!inCycle && node.equals(repeated))
                inCycle = true;
            if (inCycle)
                chain.add(describe.apply(node));
        }
        chain.add(describe.apply(repeated));
        return chain;
    }

    private static final class Frame<N> {
        final N node;
        final List<N> deps;
        int next;

        Frame(N node, List<N> deps) {
            this.node = node;
            this.deps = deps;
        }
    }
}
