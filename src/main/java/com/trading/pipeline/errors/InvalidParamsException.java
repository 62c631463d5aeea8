package com.trading.pipeline.errors;

/** Bound parameters do not match the names declared by the compute definition. */
public class InvalidParamsException extends TermGraphException {

    public InvalidParamsException(String message) {
        super(message);
    }
}
