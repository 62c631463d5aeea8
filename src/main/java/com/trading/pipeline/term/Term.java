package com.trading.pipeline.term;

import com.trading.pipeline.errors.InvalidParamsException;
import com.trading.pipeline.errors.InvalidWindowLengthException;
import com.trading.pipeline.errors.UnsupportedDTypeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A node of the computation graph.
 *
 * <p>
 * A term is an immutable value: its identity is the tuple
 * (definition, inputs, window length, mask, params), and {@link #equals} and
 * {@link #hashCode} are defined directly over those fields. Two structurally
 * identical descriptions are the same node, which is what lets the graph builder
 * collapse shared sub-expressions into a single evaluation.
 *
 * <p>
 * Construction validates the term against its {@link ComputeDefinition}:
 * <ul>
 * <li>window length is non-negative and at least the definition's minimum,</li>
 * <li>the number and kinds of inputs match the definition,</li>
 * <li>the mask, if any, is a FILTER,</li>
 * <li>the bound parameter names are exactly the declared ones.</li>
 * </ul>
 * Construction has no other side effect.
 *
 * <p>
 * Window length 0 and 1 both mean "current day only".
 */
public final class Term {
    private final ComputeDefinition definition;
    private final List<Term> inputs;
    private final int windowLength;
    private final Term mask;
    private final TermParams params;

    // Computed once; inputs already carry their own cached hashes.
    private final int hash;
    private volatile String displayName;

    private Term(ComputeDefinition definition, List<Term> inputs, int windowLength, Term mask, TermParams params) {
        this.definition = definition;
        this.inputs = inputs;
        this.windowLength = windowLength;
        this.mask = mask;
        this.params = params;
        this.hash = Objects.hash(definition, inputs, windowLength, mask, params);
    }

    /**
     * Creates a validated term.
     *
     * @param definition    What to compute.
     * @param inputs        Ordered inputs, matching {@link ComputeDefinition#inputKinds()}.
     * @param windowLength  Trailing business days of each input per output day.
     * @param mask          Optional FILTER; null for none.
     * @param params        Bound parameters, matching {@link ComputeDefinition#paramNames()}.
     */
    public static Term of(ComputeDefinition definition, List<Term> inputs, int windowLength, Term mask,
            TermParams params) {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(inputs, "inputs");
        Objects.requireNonNull(params, "params");
        List<Term> in = List.copyOf(inputs);
        String label = definition.name();

        if (windowLength < 0)
            throw new InvalidWindowLengthException(label + ": window_length must be >= 0, got " + windowLength);
        if (windowLength < definition.minWindowLength())
            throw new InvalidWindowLengthException(label + ": window_length must be >= "
                    + definition.minWindowLength() + ", got " + windowLength);
        if (definition.isLoadable() && windowLength != 0)
            throw new InvalidWindowLengthException(label + ": columns carry no window, got " + windowLength);

        if (in.size() != definition.arity())
            throw new UnsupportedDTypeException(label + " expects " + definition.arity() + " input(s), got "
                    + in.size());
        for (int i = 0; i < in.size(); i++) {
            TermKind expected = definition.inputKinds().get(i);
            TermKind actual = in.get(i).kind();
            if (expected != actual)
                throw new UnsupportedDTypeException(label + " input " + i + " must be a " + expected
                        + " but " + in.get(i).name() + " is a " + actual);
        }

        if (mask != null && mask.kind() != TermKind.FILTER)
            throw new UnsupportedDTypeException(label + " mask must be a FILTER but " + mask.name()
                    + " is a " + mask.kind());

        Set<String> declared = new HashSet<>(definition.paramNames());
        if (!declared.equals(params.names()))
            throw new InvalidParamsException(label + " declares params " + definition.paramNames()
                    + " but was given " + params.names());

        return new Term(definition, in, windowLength, mask, params);
    }

    /** Creates an unmasked, unwindowed, parameterless term over a column definition. */
    public static Term column(ComputeDefinition definition) {
        if (!definition.isLoadable())
            throw new IllegalArgumentException(definition.name() + " is not a column definition");
        return of(definition, List.of(), 0, null, TermParams.EMPTY);
    }

    public TermKind kind() {
        return definition.kind();
    }

    public ComputeDefinition definition() {
        return definition;
    }

    public List<Term> inputs() {
        return inputs;
    }

    public int windowLength() {
        return windowLength;
    }

    /** Extra trailing rows this term reads from each input beyond the current day. */
    public int lookback() {
        return Math.max(windowLength, 1) - 1;
    }

    /** The mask, or null when unmasked. */
    public Term mask() {
        return mask;
    }

    public boolean hasMask() {
        return mask != null;
    }

    public TermParams params() {
        return params;
    }

    /** True when the term has no term inputs and is supplied by the loader. */
    public boolean isLoadable() {
        return inputs.isEmpty();
    }

    /** Inputs in declared order followed by the mask, if present. */
    public List<Term> dependencies() {
        if (mask == null)
            return inputs;
        List<Term> deps = new ArrayList<>(inputs.size() + 1);
        deps.addAll(inputs);
        deps.add(mask);
        return Collections.unmodifiableList(deps);
    }

    /** Returns an equivalent term restricted by {@code newMask}. */
    public Term withMask(Term newMask) {
        return of(definition, inputs, windowLength, Objects.requireNonNull(newMask, "mask"), params);
    }

    public Term withoutMask() {
        return mask == null ? this : new Term(definition, inputs, windowLength, null, params);
    }

    /**
     * Human-readable description, e.g.
     * {@code SimpleMovingAverage(EquityPricing.close, window=10)}.
     */
    public String name() {
        String n = displayName;
        if (n == null) {
            n = describe();
            displayName = n;
        }
        return n;
    }

    private String describe() {
        if (isLoadable() && mask == null)
            return definition.name();
        List<String> parts = new ArrayList<>(inputs.size() + 3);
        for (Term input : inputs)
            parts.add(input.name());
        if (windowLength > 1)
            parts.add("window=" + windowLength);
        if (!params.isEmpty())
            parts.add(params.toString());
        if (mask != null)
            parts.add("mask=" + mask.name());
        StringBuilder sb = new StringBuilder(64).append(definition.name()).append('(');
        sb.append(String.join(", ", parts));
        return sb.append(')').toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Term t) || hash != t.hash)
            return false;
        return windowLength == t.windowLength
                && definition.equals(t.definition)
                && params.equals(t.params)
                && Objects.equals(mask, t.mask)
                && inputs.equals(t.inputs);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return name();
    }
}
