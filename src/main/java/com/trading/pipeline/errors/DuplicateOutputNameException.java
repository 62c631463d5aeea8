package com.trading.pipeline.errors;

public class DuplicateOutputNameException extends TermGraphException {
    private final String outputName;

    public DuplicateOutputNameException(String outputName) {
        super("Duplicate output name: " + outputName);
        this.outputName = outputName;
    }

    public String outputName() {
        return outputName;
    }
}
