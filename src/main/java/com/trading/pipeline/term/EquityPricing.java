package com.trading.pipeline.term;

/** Daily OHLCV pricing columns. */
public final class EquityPricing {
    public static final String DATASET = "EquityPricing";

    public static final Term OPEN = Columns.factor(DATASET, "open");
    public static final Term HIGH = Columns.factor(DATASET, "high");
    public static final Term LOW = Columns.factor(DATASET, "low");
    public static final Term CLOSE = Columns.factor(DATASET, "close");
    public static final Term VOLUME = Columns.factor(DATASET, "volume");

    private EquityPricing() {
    }
}
