package com.trading.pipeline.fn.finance;

import com.trading.pipeline.data.Window;
import com.trading.pipeline.fn.FactorFn;
import com.trading.pipeline.term.ComputeDefinition;
import com.trading.pipeline.term.TermKind;
import com.trading.pipeline.term.TermParams;

import java.time.LocalDate;
import java.util.List;

/**
 * Rolling Pearson correlation of X and Y, per asset.
 *
 * Corr = Cov(X, Y) / (StdDev(X) * StdDev(Y))
 *
 * Only days where both X and Y are present take part. Missing with fewer than
 * two such days or when either series is flat.
 */
public final class RollingCorrelation implements FactorFn {
    public static final ComputeDefinition DEFINITION = ComputeDefinition.factor(
            "RollingCorrelation", List.of(TermKind.FACTOR, TermKind.FACTOR), List.of(), 2,
            new RollingCorrelation());

    @Override
    public void compute(LocalDate today, Window[] inputs, TermParams params, double[] out) {
        Window xs = inputs[0];
        Window ys = inputs[1];
        for (int a = 0; a < out.length; a++) {
            PairStats s = PairStats.of(xs, ys, a);
            if (s.count < 2 || s.varX <= 0.0 || s.varY <= 0.0)
                continue;
            out[a] = s.cov / Math.sqrt(s.varX * s.varY);
        }
    }

    /** Two-pass moments over the days where both series are present. */
    static final class PairStats {
        int count;
        double cov;
        double varX;
        double varY;

        static PairStats of(Window xs, Window ys, int asset) {
            PairStats s = new PairStats();
            double sumX = 0, sumY = 0;
            for (int d = 0; d < xs.length(); d++) {
                double x = xs.getDouble(d, asset);
                double y = ys.getDouble(d, asset);
                if (Double.isNaN(x) || Double.isNaN(y))
                    continue;
                sumX += x;
                sumY += y;
                s.count++;
            }
            if (s.count == 0)
                return s;
            double meanX = sumX / s.count;
            double meanY = sumY / s.count;
            for (int d = 0; d < xs.length(); d++) {
                double x = xs.getDouble(d, asset);
                double y = ys.getDouble(d, asset);
                if (Double.isNaN(x) || Double.isNaN(y))
                    continue;
                s.cov += (x - meanX) * (y - meanY);
                s.varX += (x - meanX) * (x - meanX);
                s.varY += (y - meanY) * (y - meanY);
            }
            s.cov /= s.count;
            s.varX /= s.count;
            s.varY /= s.count;
            return s;
        }
    }
}
