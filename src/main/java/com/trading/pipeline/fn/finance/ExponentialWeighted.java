package com.trading.pipeline.fn.finance;

/**
 * Shared weighting for the exponentially weighted statistics.
 *
 * Over a window of {@code n} rows, row {@code i} (oldest first) is weighted
 * {@code decay^(n + 1 - i)}: the newest row gets {@code decay^2}, each older row
 * one more power of {@code decay}.
 */
final class ExponentialWeighted {
    static final String DECAY_RATE = "decay_rate";

    private ExponentialWeighted() {
    }

    static double[] weights(int length, double decayRate) {
        double[] w = new double[length];
        for (int i = 0; i < length; i++)
            w[i] = Math.pow(decayRate, length + 1 - i);
        return w;
    }

    static void checkDecayRate(double decayRate) {
        if (!(decayRate > 0.0 && decayRate <= 1.0))
            throw new IllegalArgumentException("decay_rate must be in (0, 1], got " + decayRate);
    }
}
