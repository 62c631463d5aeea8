package com.trading.pipeline.errors;

import com.trading.pipeline.api.LoadRequest;

/**
 * The loader could not supply a window. Carries the failing request so callers
 * can see which node, date range and asset set were being fetched.
 */
public class LoaderFailureException extends PipelineException {
    private final transient LoadRequest request;

    public LoaderFailureException(LoadRequest request, String reason) {
        super("Loader failed for " + request + ": " + reason);
        this.request = request;
    }

    public LoaderFailureException(LoadRequest request, Throwable cause) {
        super("Loader failed for " + request + ": " + cause.getMessage(), cause);
        this.request = request;
    }

    public LoadRequest request() {
        return request;
    }
}
