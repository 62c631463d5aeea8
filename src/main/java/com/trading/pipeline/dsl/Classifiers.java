package com.trading.pipeline.dsl;

import com.trading.pipeline.fn.ops.Comparisons;
import com.trading.pipeline.fn.ops.CrossSectional;
import com.trading.pipeline.term.Term;
import com.trading.pipeline.term.TermParams;

import java.util.List;

/** Classifier constructors and classifier-derived filters. */
public final class Classifiers {

    private Classifiers() {
    }

    /** Labels each asset 0..bins-1 by its rank among the day's non-missing values. */
    public static Term quantiles(Term factor, int bins) {
        return quantiles(factor, bins, null);
    }

    public static Term quantiles(Term factor, int bins, Term mask) {
        if (bins < 1)
            throw new IllegalArgumentException("bins must be >= 1, got " + bins);
        return Term.of(CrossSectional.QUANTILES, List.of(factor), 0, mask, TermParams.of(CrossSectional.BINS, bins));
    }

    public static Term quartiles(Term factor) {
        return quantiles(factor, 4);
    }

    public static Term quintiles(Term factor) {
        return quantiles(factor, 5);
    }

    public static Term deciles(Term factor) {
        return quantiles(factor, 10);
    }

    /** Filter: the classifier's label equals {@code label}. */
    public static Term eq(Term classifier, int label) {
        return Term.of(Comparisons.LABEL_EQ, List.of(classifier), 0, null, TermParams.of(Comparisons.LABEL, label));
    }
}
