package com.trading.pipeline.errors;

public class RunCancelledException extends PipelineException {

    public RunCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
