package com.trading.pipeline.fn.ops;

import com.trading.pipeline.fn.ops.CrossSectional.RankMethod;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class CrossSectionalTest {
    private static final double NaN = Double.NaN;

    private static double[] rank(RankMethod method, boolean ascending, double... values) {
        double[] out = new double[values.length];
        Arrays.fill(out, NaN);
        CrossSectional.rank(values, method, ascending, out);
        return out;
    }

    @Test
    public void testRankMethodsWithTies() {
        double[] v = { 3, 1, 3, NaN, 2 };
        assertArrayEquals(new double[] { 3, 1, 4, NaN, 2 }, rank(RankMethod.ORDINAL, true, v), 0.0);
        assertArrayEquals(new double[] { 3.5, 1, 3.5, NaN, 2 }, rank(RankMethod.AVERAGE, true, v), 0.0);
        assertArrayEquals(new double[] { 3, 1, 3, NaN, 2 }, rank(RankMethod.MIN, true, v), 0.0);
        assertArrayEquals(new double[] { 4, 1, 4, NaN, 2 }, rank(RankMethod.MAX, true, v), 0.0);
        assertArrayEquals(new double[] { 3, 1, 3, NaN, 2 }, rank(RankMethod.DENSE, true, v), 0.0);
    }

    @Test
    public void testDescendingRank() {
        assertArrayEquals(new double[] { 3, 1, 2 }, rank(RankMethod.ORDINAL, false, 1, 9, 5), 0.0);
    }

    @Test
    public void testZscoreAndDemean() {
        double[] values = { 1, 2, 3, NaN };
        double[] z = new double[4];
        Arrays.fill(z, NaN);
        CrossSectional.normalize(values, null, true, z);
        double std = Math.sqrt(2.0 / 3.0);
        assertArrayEquals(new double[] { -1 / std, 0, 1 / std, NaN }, z, 1e-12);

        double[] d = new double[4];
        Arrays.fill(d, NaN);
        CrossSectional.normalize(values, null, false, d);
        assertArrayEquals(new double[] { -1, 0, 1, NaN }, d, 1e-12);
    }

    @Test
    public void testZscoreOfConstantIsMissing() {
        double[] z = { NaN, NaN };
        CrossSectional.normalize(new double[] { 4, 4 }, null, true, z);
        assertTrue(Double.isNaN(z[0]));
    }

    @Test
    public void testGroupedDemean() {
        double[] values = { 1, 3, 10, 20, 5 };
        int[] groups = { 0, 0, 1, 1, -1 };
        double[] out = new double[5];
        Arrays.fill(out, NaN);
        CrossSectional.normalize(values, groups, false, out);
        assertArrayEquals(new double[] { -1, 1, -5, 5, NaN }, out, 1e-12);
    }

    @Test
    public void testQuantiles() {
        int[] out = { -1, -1, -1, -1, -1 };
        CrossSectional.quantiles(new double[] { 40, 10, NaN, 30, 20 }, 2, out);
        assertArrayEquals(new int[] { 1, 0, -1, 1, 0 }, out);
    }

    @Test
    public void testPercentileBetween() {
        double[] values = { 1, 2, 3, 4, 5, NaN };
        boolean[] out = new boolean[6];
        // 25th percentile = 2, 75th = 4
        CrossSectional.percentileBetween(values, 25, 75, out);
        assertArrayEquals(new boolean[] { false, true, true, true, false, false }, out);
    }

    @Test
    public void testRankMethodParse() {
        assertEquals(RankMethod.DENSE, RankMethod.parse(" dense "));
    }
}
