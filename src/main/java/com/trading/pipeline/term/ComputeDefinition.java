package com.trading.pipeline.term;

import com.trading.pipeline.errors.InvalidParamsException;
import com.trading.pipeline.fn.ClassifierFn;
import com.trading.pipeline.fn.FactorFn;
import com.trading.pipeline.fn.FilterFn;

import java.util.List;
import java.util.Objects;

/**
 * What a term computes: a named compute step together with the contract it
 * expects from the term that binds it.
 *
 * <p>
 * The contract consists of
 * <ul>
 * <li>the output {@link TermKind},</li>
 * <li>the positional kinds of its inputs,</li>
 * <li>the parameter names it reads from {@link TermParams},</li>
 * <li>the minimum window length it can produce a value with.</li>
 * </ul>
 *
 * <p>
 * A definition without a compute step is a <b>column</b>: a raw input supplied by
 * the {@link com.trading.pipeline.api.Loader}.
 *
 * <p>
 * Identity: definitions are compared by name, contract and compute step. The
 * step is compared by reference, so two definitions that share a name but carry
 * different function objects are different nodes. Built-in definitions are
 * held in static fields and therefore always collapse.
 */
public final class ComputeDefinition {
    private final String name;
    private final TermKind kind;
    private final List<TermKind> inputKinds;
    private final List<String> paramNames;
    private final int minWindowLength;

    // Exactly one of these is set for a computed definition; none for a column.
    private final FactorFn factorFn;
    private final FilterFn filterFn;
    private final ClassifierFn classifierFn;

    private ComputeDefinition(String name, TermKind kind, List<TermKind> inputKinds, List<String> paramNames,
            int minWindowLength, FactorFn factorFn, FilterFn filterFn, ClassifierFn classifierFn) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Definition name must be non-blank");
        this.name = name;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.inputKinds = List.copyOf(inputKinds);
        this.paramNames = paramNames.stream().sorted().toList();
        if (this.paramNames.stream().distinct().count() != this.paramNames.size())
            throw new InvalidParamsException("Duplicate parameter name in definition " + name);
        this.minWindowLength = minWindowLength;
        this.factorFn = factorFn;
        this.filterFn = filterFn;
        this.classifierFn = classifierFn;
        if (!isLoadable() && this.inputKinds.isEmpty())
            throw new IllegalArgumentException("Computed definition " + name + " must declare at least one input");
    }

    /** A raw dataset column, supplied by the loader. */
    public static ComputeDefinition column(String dataset, String column, TermKind kind) {
        return new ComputeDefinition(dataset + "." + column, kind, List.of(), List.of(), 0, null, null, null);
    }

    public static ComputeDefinition factor(String name, List<TermKind> inputKinds, List<String> paramNames,
            int minWindowLength, FactorFn fn) {
        return new ComputeDefinition(name, TermKind.FACTOR, inputKinds, paramNames, minWindowLength,
                Objects.requireNonNull(fn, "fn"), null, null);
    }

    public static ComputeDefinition filter(String name, List<TermKind> inputKinds, List<String> paramNames,
            int minWindowLength, FilterFn fn) {
        return new ComputeDefinition(name, TermKind.FILTER, inputKinds, paramNames, minWindowLength,
                null, Objects.requireNonNull(fn, "fn"), null);
    }

    public static ComputeDefinition classifier(String name, List<TermKind> inputKinds, List<String> paramNames,
            int minWindowLength, ClassifierFn fn) {
        return new ComputeDefinition(name, TermKind.CLASSIFIER, inputKinds, paramNames, minWindowLength,
                null, null, Objects.requireNonNull(fn, "fn"));
    }

    public String name() {
        return name;
    }

    public TermKind kind() {
        return kind;
    }

    public List<TermKind> inputKinds() {
        return inputKinds;
    }

    public int arity() {
        return inputKinds.size();
    }

    public List<String> paramNames() {
        return paramNames;
    }

    public int minWindowLength() {
        return minWindowLength;
    }

    public boolean isLoadable() {
        return factorFn == null && filterFn == null && classifierFn == null;
    }

    public FactorFn factorFn() {
        return factorFn;
    }

    public FilterFn filterFn() {
        return filterFn;
    }

    public ClassifierFn classifierFn() {
        return classifierFn;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ComputeDefinition d))
            return false;
        return name.equals(d.name) && kind == d.kind && minWindowLength == d.minWindowLength
                && isLoadable() == d.isLoadable() && inputKinds.equals(d.inputKinds)
                && paramNames.equals(d.paramNames) && factorFn == d.factorFn && filterFn == d.filterFn
                && classifierFn == d.classifierFn;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, inputKinds, paramNames, minWindowLength, isLoadable(),
                System.identityHashCode(step()));
    }

    private Object step() {
        return factorFn != null ? factorFn : filterFn != null ? filterFn : classifierFn;
    }

    @Override
    public String toString() {
        return name;
    }
}
