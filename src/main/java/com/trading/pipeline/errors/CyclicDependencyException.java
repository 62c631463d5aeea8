package com.trading.pipeline.errors;

import java.util.List;

/**
 * A term depends, directly or transitively, on itself.
 * The message and {@link #chain()} name every link of the cycle, first element
 * repeated at the end.
 */
public class CyclicDependencyException extends TermGraphException {
    private final List<String> chain;

    public CyclicDependencyException(List<String> chain) {
        super("Cyclic dependency: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    public List<String> chain() {
        return chain;
    }
}
