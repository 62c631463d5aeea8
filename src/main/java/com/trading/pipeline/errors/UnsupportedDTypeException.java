package com.trading.pipeline.errors;

/** A term was wired to an input (or mask, or screen) of a kind it cannot consume. */
public class UnsupportedDTypeException extends TermGraphException {

    public UnsupportedDTypeException(String message) {
        super(message);
    }
}
