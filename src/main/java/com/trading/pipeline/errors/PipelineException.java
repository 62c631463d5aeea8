package com.trading.pipeline.errors;

/**
 * Root of every error raised by the pipeline engine.
 *
 * <p>
 * Build-time errors extend {@link TermGraphException} and are raised before any
 * data is loaded. Run-time errors ({@link LoaderFailureException},
 * {@link TermComputeException}, {@link RunCancelledException}) abort the run in
 * progress; the run's private caches are discarded and nothing else is touched.
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
