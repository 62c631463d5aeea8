package com.trading.pipeline.term;

import com.trading.pipeline.dsl.Factors;
import com.trading.pipeline.dsl.Filters;
import com.trading.pipeline.dsl.Technicals;
import com.trading.pipeline.errors.InvalidParamsException;
import com.trading.pipeline.errors.InvalidWindowLengthException;
import com.trading.pipeline.errors.UnsupportedDTypeException;
import com.trading.pipeline.fn.FactorFn;
import com.trading.pipeline.fn.finance.ExponentialWeightedMovingAverage;
import com.trading.pipeline.fn.finance.Returns;
import com.trading.pipeline.fn.finance.SimpleMovingAverage;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class TermTest {

    @Test
    public void testStructurallyEqualTermsAreEqual() {
        Term a = Technicals.sma(EquityPricing.CLOSE, 10);
        Term b = Technicals.sma(Columns.factor("EquityPricing", "close"), 10);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotSame(a, b);

        Set<Term> set = new HashSet<>(List.of(a, b));
        assertEquals(1, set.size());
    }

    @Test
    public void testDifferentWindowOrParamsAreDifferentTerms() {
        assertNotEquals(Technicals.sma(EquityPricing.CLOSE, 10), Technicals.sma(EquityPricing.CLOSE, 11));
        assertNotEquals(Technicals.sma(EquityPricing.CLOSE, 10), Technicals.sma(EquityPricing.OPEN, 10));
        assertNotEquals(Technicals.ewma(EquityPricing.CLOSE, 10, 0.5), Technicals.ewma(EquityPricing.CLOSE, 10, 0.6));
    }

    @Test
    public void testCustomFactorIdentityIncludesComputeStep() {
        FactorFn plusOne = (today, in, params, out) -> {
            for (int a = 0; a < out.length; a++)
                out[a] = in[0].latestDouble(a) + 1;
        };
        FactorFn timesTen = (today, in, params, out) -> {
            for (int a = 0; a < out.length; a++)
                out[a] = in[0].latestDouble(a) * 10;
        };
        Term a = Factors.custom("f", List.of(EquityPricing.CLOSE), 1, plusOne);
        Term b = Factors.custom("f", List.of(EquityPricing.CLOSE), 1, timesTen);
        assertNotEquals(a, b);
        assertEquals(2, new HashSet<>(List.of(a, b)).size());
        assertEquals(a, Factors.custom("f", List.of(EquityPricing.CLOSE), 1, plusOne));
    }

    @Test
    public void testMaskIsPartOfIdentity() {
        Term liquid = Filters.gt(EquityPricing.VOLUME, 1000);
        Term plain = Technicals.sma(EquityPricing.CLOSE, 5);
        Term masked = Technicals.sma(EquityPricing.CLOSE, 5, liquid);
        assertNotEquals(plain, masked);
        assertEquals(masked, plain.withMask(liquid));
        assertEquals(plain, masked.withoutMask());
    }

    @Test
    public void testLookback() {
        assertEquals(0, Factors.latest(EquityPricing.CLOSE).lookback());
        assertEquals(0, Technicals.sma(EquityPricing.CLOSE, 1).lookback());
        assertEquals(4, Technicals.sma(EquityPricing.CLOSE, 5).lookback());
        assertEquals(0, EquityPricing.CLOSE.lookback());
    }

    @Test
    public void testName() {
        assertEquals("EquityPricing.close", EquityPricing.CLOSE.name());
        assertEquals("SimpleMovingAverage(EquityPricing.close, window=10)",
                Technicals.sma(EquityPricing.CLOSE, 10).name());
    }

    @Test
    public void testDependenciesListInputsThenMask() {
        Term mask = Filters.notMissing(EquityPricing.VOLUME);
        Term t = Technicals.weightedAverage(EquityPricing.CLOSE, EquityPricing.VOLUME, 3, mask);
        assertEquals(List.of(EquityPricing.CLOSE, EquityPricing.VOLUME, mask), t.dependencies());
        assertTrue(EquityPricing.CLOSE.isLoadable());
        assertFalse(t.isLoadable());
    }

    @Test(expected = InvalidWindowLengthException.class)
    public void testNegativeWindowRejected() {
        Term.of(SimpleMovingAverage.DEFINITION, List.of(EquityPricing.CLOSE), -1, null, TermParams.EMPTY);
    }

    @Test(expected = InvalidWindowLengthException.class)
    public void testWindowBelowDefinitionMinimumRejected() {
        Term.of(Returns.DEFINITION, List.of(EquityPricing.CLOSE), 1, null, TermParams.EMPTY);
    }

    @Test(expected = InvalidWindowLengthException.class)
    public void testColumnWithWindowRejected() {
        Term.of(EquityPricing.CLOSE.definition(), List.of(), 3, null, TermParams.EMPTY);
    }

    @Test(expected = UnsupportedDTypeException.class)
    public void testFactorInputKindChecked() {
        Technicals.sma(Filters.notMissing(EquityPricing.CLOSE), 5);
    }

    @Test(expected = UnsupportedDTypeException.class)
    public void testArityChecked() {
        Term.of(SimpleMovingAverage.DEFINITION, List.of(EquityPricing.CLOSE, EquityPricing.OPEN), 5, null,
                TermParams.EMPTY);
    }

    @Test(expected = UnsupportedDTypeException.class)
    public void testMaskMustBeFilter() {
        Technicals.sma(EquityPricing.CLOSE, 5, EquityPricing.VOLUME);
    }

    @Test(expected = InvalidParamsException.class)
    public void testMissingParamRejected() {
        Term.of(ExponentialWeightedMovingAverage.DEFINITION, List.of(EquityPricing.CLOSE), 5, null,
                TermParams.EMPTY);
    }

    @Test(expected = InvalidParamsException.class)
    public void testUndeclaredParamRejected() {
        Term.of(SimpleMovingAverage.DEFINITION, List.of(EquityPricing.CLOSE), 5, null,
                TermParams.of("decay_rate", 0.5));
    }
}
