package com.trading.pipeline;

import com.trading.pipeline.errors.DuplicateOutputNameException;
import com.trading.pipeline.errors.UnsupportedDTypeException;
import com.trading.pipeline.term.Term;
import com.trading.pipeline.term.TermKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named output terms plus an optional screen. The date range and universe are
 * supplied when the pipeline is evaluated.
 */
public final class Pipeline {
    private final Map<String, Term> outputs;
    private final Term screen;

    private Pipeline(LinkedHashMap<String, Term> outputs, Term screen) {
        this.outputs = Collections.unmodifiableMap(outputs);
        this.screen = screen;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Output name to term, in declaration order. */
    public Map<String, Term> outputs() {
        return outputs;
    }

    /** The screen filter, or null. */
    public Term screen() {
        return screen;
    }

    @Override
    public String toString() {
        return "Pipeline" + outputs.keySet() + (screen == null ? "" : " screen=" + screen.name());
    }

    public static final class Builder {
        private final LinkedHashMap<String, Term> outputs = new LinkedHashMap<>();
        private Term screen;

        public Builder add(String name, Term term) {
            if (name == null || name.isBlank())
                throw new IllegalArgumentException("Output name must not be blank");
            Objects.requireNonNull(term, "term");
            if (outputs.containsKey(name))
                throw new DuplicateOutputNameException(name);
            outputs.put(name, term);
            return this;
        }

        public Builder screen(Term filter) {
            if (filter != null && filter.kind() != TermKind.FILTER)
                throw new UnsupportedDTypeException("Screen must be a FILTER, got " + filter.kind() + ": "
                        + filter.name());
            this.screen = filter;
            return this;
        }

        public Pipeline build() {
            if (outputs.isEmpty())
                throw new IllegalArgumentException("A pipeline needs at least one output");
            return new Pipeline(new LinkedHashMap<>(outputs), screen);
        }
    }
}
