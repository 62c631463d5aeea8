package com.trading.pipeline.term;

/** Leaf terms bound to a dataset column. */
public final class Columns {

    private Columns() {
    }

    public static Term factor(String dataset, String column) {
        return Term.column(ComputeDefinition.column(dataset, column, TermKind.FACTOR));
    }

    public static Term filter(String dataset, String column) {
        return Term.column(ComputeDefinition.column(dataset, column, TermKind.FILTER));
    }

    public static Term classifier(String dataset, String column) {
        return Term.column(ComputeDefinition.column(dataset, column, TermKind.CLASSIFIER));
    }

    public static Term of(String dataset, String column, TermKind kind) {
        return Term.column(ComputeDefinition.column(dataset, column, kind));
    }
}
