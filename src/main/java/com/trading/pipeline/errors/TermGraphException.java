package com.trading.pipeline.errors;

/** A statically detectable problem in a term or pipeline definition. */
public class TermGraphException extends PipelineException {

    public TermGraphException(String message) {
        super(message);
    }
}
