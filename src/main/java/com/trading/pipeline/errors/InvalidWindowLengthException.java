package com.trading.pipeline.errors;

public class InvalidWindowLengthException extends TermGraphException {

    public InvalidWindowLengthException(String message) {
        super(message);
    }
}
