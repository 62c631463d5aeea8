package com.trading.pipeline.term;

import com.trading.pipeline.errors.InvalidParamsException;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class TermParamsTest {

    @Test
    public void testEqualityIgnoresInsertionOrder() {
        TermParams a = TermParams.of("alpha", 1, "beta", "x");
        TermParams b = TermParams.of("beta", "x", "alpha", 1);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(List.of("alpha", "beta"), List.copyOf(a.names()));
    }

    @Test
    public void testIntegralNumbersNormalized() {
        assertEquals(TermParams.of("n", 5), TermParams.of("n", 5L));
        assertEquals(TermParams.of("x", 1.5f), TermParams.of("x", 1.5d));
        assertEquals(5, TermParams.of("n", 5L).getInt("n"));
        assertEquals(5.0, TermParams.of("n", 5).getDouble("n"), 0.0);
    }

    @Test
    public void testTypedAccessors() {
        TermParams p = TermParams.ofMap(Map.of("flag", true, "method", "dense"));
        assertTrue(p.getBoolean("flag"));
        assertEquals("dense", p.getString("method"));
        assertSame(TermParams.EMPTY, TermParams.ofMap(Map.of()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownParam() {
        TermParams.EMPTY.get("missing");
    }

    @Test(expected = InvalidParamsException.class)
    public void testNonScalarValueRejected() {
        TermParams.of("list", List.of(1, 2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrongTypeAccess() {
        TermParams.of("method", "dense").getDouble("method");
    }
}
