package com.trading.pipeline.dsl;

import com.trading.pipeline.fn.finance.ExponentialWeightedMovingAverage;
import com.trading.pipeline.fn.finance.ExponentialWeightedMovingStdDev;
import com.trading.pipeline.fn.finance.MaxDrawdown;
import com.trading.pipeline.fn.finance.Returns;
import com.trading.pipeline.fn.finance.RollingBeta;
import com.trading.pipeline.fn.finance.RollingCorrelation;
import com.trading.pipeline.fn.finance.Rsi;
import com.trading.pipeline.fn.finance.SimpleMovingAverage;
import com.trading.pipeline.fn.finance.WeightedAverageValue;
import com.trading.pipeline.term.EquityPricing;
import com.trading.pipeline.term.Term;
import com.trading.pipeline.term.TermParams;

import java.util.List;

/**
 * Trailing-window technical factors.
 *
 * <p>
 * Every overload taking a {@code mask} excludes masked-out observations from
 * the statistic; the output itself is missing wherever the mask is false.
 */
public final class Technicals {

    private Technicals() {
    }

    /** Percent change of close over {@code windowLength} sessions. */
    public static Term returns(int windowLength) {
        return returns(EquityPricing.CLOSE, windowLength, null);
    }

    public static Term returns(Term prices, int windowLength, Term mask) {
        return Term.of(Returns.DEFINITION, List.of(prices), windowLength, mask, TermParams.EMPTY);
    }

    public static Term rsi() {
        return rsi(EquityPricing.CLOSE, Rsi.DEFAULT_WINDOW, null);
    }

    public static Term rsi(Term prices, int windowLength, Term mask) {
        return Term.of(Rsi.DEFINITION, List.of(prices), windowLength, mask, TermParams.EMPTY);
    }

    public static Term sma(Term input, int windowLength) {
        return sma(input, windowLength, null);
    }

    public static Term sma(Term input, int windowLength, Term mask) {
        return Term.of(SimpleMovingAverage.DEFINITION, List.of(input), windowLength, mask, TermParams.EMPTY);
    }

    public static Term weightedAverage(Term values, Term weights, int windowLength, Term mask) {
        return Term.of(WeightedAverageValue.DEFINITION, List.of(values, weights), windowLength, mask,
                TermParams.EMPTY);
    }

    /** Volume-weighted average close. */
    public static Term vwap(int windowLength) {
        return vwap(windowLength, null);
    }

    public static Term vwap(int windowLength, Term mask) {
        return weightedAverage(EquityPricing.CLOSE, EquityPricing.VOLUME, windowLength, mask);
    }

    public static Term maxDrawdown(Term input, int windowLength) {
        return maxDrawdown(input, windowLength, null);
    }

    public static Term maxDrawdown(Term input, int windowLength, Term mask) {
        return Term.of(MaxDrawdown.DEFINITION, List.of(input), windowLength, mask, TermParams.EMPTY);
    }

    /** Today's {@code close * volume}. */
    public static Term dollarVolume() {
        return Factors.times(EquityPricing.CLOSE, EquityPricing.VOLUME);
    }

    /** Average of {@link #dollarVolume()} over the window. */
    public static Term averageDollarVolume(int windowLength) {
        return averageDollarVolume(windowLength, null);
    }

    public static Term averageDollarVolume(int windowLength, Term mask) {
        return sma(dollarVolume(), windowLength, mask);
    }

    public static Term ewma(Term input, int windowLength, double decayRate) {
        return ewma(input, windowLength, decayRate, null);
    }

    public static Term ewma(Term input, int windowLength, double decayRate, Term mask) {
        checkDecayRate(decayRate);
        return Term.of(ExponentialWeightedMovingAverage.DEFINITION, List.of(input), windowLength, mask,
                TermParams.of(ExponentialWeightedMovingAverage.DECAY_RATE, decayRate));
    }

    public static Term ewmstd(Term input, int windowLength, double decayRate) {
        return ewmstd(input, windowLength, decayRate, null);
    }

    public static Term ewmstd(Term input, int windowLength, double decayRate, Term mask) {
        checkDecayRate(decayRate);
        return Term.of(ExponentialWeightedMovingStdDev.DEFINITION, List.of(input), windowLength, mask,
                TermParams.of(ExponentialWeightedMovingAverage.DECAY_RATE, decayRate));
    }

    public static Term correlation(Term x, Term y, int windowLength) {
        return correlation(x, y, windowLength, null);
    }

    public static Term correlation(Term x, Term y, int windowLength, Term mask) {
        return Term.of(RollingCorrelation.DEFINITION, List.of(x, y), windowLength, mask, TermParams.EMPTY);
    }

    /** Slope of {@code asset} regressed on {@code benchmark}. */
    public static Term beta(Term asset, Term benchmark, int windowLength) {
        return beta(asset, benchmark, windowLength, null);
    }

    public static Term beta(Term asset, Term benchmark, int windowLength, Term mask) {
        return Term.of(RollingBeta.DEFINITION, List.of(asset, benchmark), windowLength, mask, TermParams.EMPTY);
    }

    // Decay rate conversions

    /** {@code 1 - 2 / (span + 1)}; span must exceed 1. */
    public static double decayFromSpan(double span) {
        if (!(span > 1.0))
            throw new IllegalArgumentException("span must be > 1, got " + span);
        return 1.0 - 2.0 / (span + 1.0);
    }

    /** {@code exp(ln(0.5) / halflife)}; halflife must be positive. */
    public static double decayFromHalflife(double halflife) {
        if (!(halflife > 0.0))
            throw new IllegalArgumentException("halflife must be > 0, got " + halflife);
        return Math.exp(Math.log(0.5) / halflife);
    }

    /** {@code 1 - 1 / (1 + centerOfMass)}; centerOfMass must be positive. */
    public static double decayFromCenterOfMass(double centerOfMass) {
        if (!(centerOfMass > 0.0))
            throw new IllegalArgumentException("center of mass must be > 0, got " + centerOfMass);
        return 1.0 - 1.0 / (1.0 + centerOfMass);
    }

    public static Term ewmaFromSpan(Term input, int windowLength, double span) {
        return ewma(input, windowLength, decayFromSpan(span));
    }

    public static Term ewmaFromHalflife(Term input, int windowLength, double halflife) {
        return ewma(input, windowLength, decayFromHalflife(halflife));
    }

    public static Term ewmaFromCenterOfMass(Term input, int windowLength, double centerOfMass) {
        return ewma(input, windowLength, decayFromCenterOfMass(centerOfMass));
    }

    public static Term ewmstdFromSpan(Term input, int windowLength, double span) {
        return ewmstd(input, windowLength, decayFromSpan(span));
    }

    public static Term ewmstdFromHalflife(Term input, int windowLength, double halflife) {
        return ewmstd(input, windowLength, decayFromHalflife(halflife));
    }

    public static Term ewmstdFromCenterOfMass(Term input, int windowLength, double centerOfMass) {
        return ewmstd(input, windowLength, decayFromCenterOfMass(centerOfMass));
    }

    private static void checkDecayRate(double decayRate) {
        if (!(decayRate > 0.0 && decayRate <= 1.0))
            throw new IllegalArgumentException("decay_rate must be in (0, 1], got " + decayRate);
    }
}
