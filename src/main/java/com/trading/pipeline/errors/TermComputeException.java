package com.trading.pipeline.errors;

/**
 * A compute step threw. Insufficient history or degenerate input never lands
 * here (those produce missing values); this is a defect in the step itself.
 */
public class TermComputeException extends PipelineException {
    private final String termName;

    public TermComputeException(String termName, Throwable cause) {
        super("Compute failed for term " + termName + ": " + cause, cause);
        this.termName = termName;
    }

    public String termName() {
        return termName;
    }
}
