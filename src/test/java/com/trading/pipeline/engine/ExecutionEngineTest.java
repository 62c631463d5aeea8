package com.trading.pipeline.engine;

import com.trading.pipeline.api.EvaluationListener;
import com.trading.pipeline.api.Loader;
import com.trading.pipeline.calendar.WeekdayCalendar;
import com.trading.pipeline.data.AssetUniverse;
import com.trading.pipeline.data.BooleanMatrix;
import com.trading.pipeline.data.DoubleMatrix;
import com.trading.pipeline.dsl.Factors;
import com.trading.pipeline.dsl.Filters;
import com.trading.pipeline.dsl.Technicals;
import com.trading.pipeline.errors.LoaderFailureException;
import com.trading.pipeline.errors.TermComputeException;
import com.trading.pipeline.loader.InMemoryLoader;
import com.trading.pipeline.term.EquityPricing;
import com.trading.pipeline.term.Term;
import org.junit.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.Assert.*;

public class ExecutionEngineTest {
    // 2024-01-01 is a Monday
    private static final LocalDate MON = LocalDate.of(2024, 1, 1);
    private static final WeekdayCalendar CALENDAR = new WeekdayCalendar();
    private static final AssetUniverse ONE = AssetUniverse.of(1);
    private static final AssetUniverse THREE = AssetUniverse.of(1, 2, 3);

    private final TermGraphBuilder builder = new TermGraphBuilder();

    private static Map<String, Term> outputs(Object... nameThenTerm) {
        Map<String, Term> m = new LinkedHashMap<>();
        for (int i = 0; i < nameThenTerm.length; i += 2)
            m.put((String) nameThenTerm[i], (Term) nameThenTerm[i + 1]);
        return m;
    }

    private static ExecutionEngine engine(Loader loader) {
        return new ExecutionEngine(loader, CALENDAR, EngineConfig.DEFAULT);
    }

    private static double get(RunResult r, String output, int row, int col) {
        return ((DoubleMatrix) r.outputs().get(output)).get(row, col);
    }

    /** Random walk closes and volumes for THREE over {@code sessions} sessions starting MON. */
    private static InMemoryLoader.Builder randomData(long seed, int sessions) {
        Random rnd = new Random(seed);
        InMemoryLoader.Builder b = InMemoryLoader.builder(CALENDAR);
        for (long sid = 1; sid <= 3; sid++) {
            double[] closes = new double[sessions];
            double[] volumes = new double[sessions];
            double px = 50 + 10 * sid;
            for (int i = 0; i < sessions; i++) {
                px *= 1 + rnd.nextGaussian() * 0.02;
                closes[i] = px;
                volumes[i] = 1000 + rnd.nextInt(5000);
            }
            b.series(EquityPricing.CLOSE, sid, MON, closes).series(EquityPricing.VOLUME, sid, MON, volumes);
        }
        return b;
    }

    @Test
    public void testReturnsConcreteCase() {
        // closes on Tue..Fri; nothing stored for Monday
        InMemoryLoader loader = InMemoryLoader.builder(CALENDAR)
                .series(EquityPricing.CLOSE, 1, MON.plusDays(1), 10, 11, 12, 13)
                .build();
        Term returns = Technicals.returns(2);
        ExecutionPlan plan = builder.build(outputs("ret", returns), null);

        RunResult r = engine(loader).run(plan, MON.plusDays(1), MON.plusDays(4), ONE);

        assertEquals(4, r.sessions().size());
        assertTrue(Double.isNaN(get(r, "ret", 0, 0)));
        assertEquals(0.1, get(r, "ret", 1, 0), 1e-12);
        assertEquals(1.0 / 11.0, get(r, "ret", 2, 0), 1e-12);
        assertEquals(1.0 / 12.0, get(r, "ret", 3, 0), 1e-12);

        // one extra session was requested for the window
        assertEquals(1, loader.requests().size());
        assertEquals(MON, loader.requests().get(0).start());
        assertEquals(MON.plusDays(4), loader.requests().get(0).end());
    }

    @Test
    public void testNoLookAhead() {
        Term sma = Technicals.sma(EquityPricing.CLOSE, 5);
        Term ret = Technicals.returns(3);
        Term ewm = Technicals.ewmstd(Technicals.returns(2), 4, 0.8);
        Term rank = Factors.rank(Technicals.vwap(3));
        ExecutionPlan plan = builder.build(outputs("sma", sma, "ret", ret, "ewm", ewm, "rank", rank), null);

        LocalDate start = MON.plusDays(14); // third Monday
        LocalDate end = start.plusDays(11);
        RunResult base = engine(randomData(7, 40).build()).run(plan, start, end, THREE);

        // Overwrite everything after the cutoff with different values
        LocalDate cutoff = start.plusDays(4);
        InMemoryLoader.Builder perturbed = randomData(7, 40);
        Random rnd = new Random(99);
        for (LocalDate d = cutoff.plusDays(1); !d.isAfter(end); d = d.plusDays(1)) {
            for (long sid = 1; sid <= 3; sid++) {
                perturbed.put(EquityPricing.CLOSE, d, sid, 1 + rnd.nextDouble() * 500);
                perturbed.put(EquityPricing.VOLUME, d, sid, 1 + rnd.nextDouble() * 1e6);
            }
        }
        RunResult changed = engine(perturbed.build()).run(plan, start, end, THREE);

        int cutoffRow = base.sessions().indexOf(cutoff);
        assertTrue(cutoffRow > 0);
        for (String name : List.of("sma", "ret", "ewm", "rank"))
            for (int row = 0; row <= cutoffRow; row++)
                for (int c = 0; c < 3; c++)
                    assertEquals(name + " row " + row, get(base, name, row, c), get(changed, name, row, c), 0.0);

        // and the perturbation is visible afterwards
        assertNotEquals(get(base, "sma", cutoffRow + 1, 0), get(changed, "sma", cutoffRow + 1, 0), 1e-9);
    }

    @Test
    public void testSharedLeafLoadedOnce() {
        InMemoryLoader loader = randomData(1, 30).build();
        Term sma = Technicals.sma(EquityPricing.CLOSE, 5);
        Term ret = Technicals.returns(3);
        ExecutionPlan plan = builder.build(outputs("sma", sma, "ret", ret, "close", EquityPricing.CLOSE), null);

        engine(loader).run(plan, MON.plusDays(7), MON.plusDays(18), THREE);
        assertEquals(1, loader.callCount());
    }

    @Test
    public void testMaskedAndUnmaskedLeafShareOneLoad() {
        Term liquid = Filters.gt(EquityPricing.VOLUME, 2000);
        Term maskedClose = EquityPricing.CLOSE.withMask(liquid);
        ExecutionPlan plan = builder.build(outputs("close", EquityPricing.CLOSE, "masked", maskedClose), null);

        InMemoryLoader coalesced = randomData(3, 20).build();
        new ExecutionEngine(coalesced, CALENDAR, EngineConfig.DEFAULT).run(plan, MON.plusDays(7), MON.plusDays(11),
                THREE);
        assertEquals(2, coalesced.callCount()); // close, volume

        InMemoryLoader plain = randomData(3, 20).build();
        new ExecutionEngine(plain, CALENDAR, EngineConfig.builder().coalesceLoads(false).build())
                .run(plan, MON.plusDays(7), MON.plusDays(11), THREE);
        assertEquals(3, plain.callCount());
    }

    @Test
    public void testMaskedValuesExcludedFromAverage() {
        InMemoryLoader loader = InMemoryLoader.builder(CALENDAR)
                .series(EquityPricing.CLOSE, 1, MON, 1, 100, 3, 100, 5)
                .series(EquityPricing.VOLUME, 1, MON, 10, 0, 10, 0, 10)
                .build();
        Term liquid = Filters.gt(EquityPricing.VOLUME, 5);
        Term masked = Technicals.sma(EquityPricing.CLOSE, 5, liquid);
        Term unmasked = Technicals.sma(EquityPricing.CLOSE, 5);
        ExecutionPlan plan = builder.build(outputs("masked", masked, "unmasked", unmasked), null);

        LocalDate fri = MON.plusDays(4);
        RunResult r = engine(loader).run(plan, fri, fri, ONE);
        assertEquals(3.0, get(r, "masked", 0, 0), 1e-12);
        assertEquals(209.0 / 5, get(r, "unmasked", 0, 0), 1e-12);

        // Thursday: mask is false on the day itself, so the output is missing
        LocalDate thu = MON.plusDays(3);
        RunResult r2 = engine(loader).run(plan, thu, fri, ONE);
        assertTrue(Double.isNaN(get(r2, "masked", 0, 0)));
        assertEquals(3.0, get(r2, "masked", 1, 0), 1e-12);
    }

    @Test
    public void testMaskedEwmaSkipsMaskedDays() {
        InMemoryLoader loader = InMemoryLoader.builder(CALENDAR)
                .series(EquityPricing.CLOSE, 1, MON, 100, 1000, 100)
                .series(EquityPricing.VOLUME, 1, MON, 10, 0, 10)
                .build();
        Term liquid = Filters.gt(EquityPricing.VOLUME, 5);
        Term ewma = Technicals.ewma(EquityPricing.CLOSE, 3, 0.5, liquid);
        ExecutionPlan plan = builder.build(outputs("ewma", ewma), null);

        RunResult r = engine(loader).run(plan, MON.plusDays(2), MON.plusDays(2), ONE);
        // both surviving observations are 100, so any weighting gives 100
        assertEquals(100.0, get(r, "ewma", 0, 0), 1e-12);
    }

    @Test
    public void testLoaderExceptionWrapped() {
        Loader failing = (term, start, end, assets) -> {
            throw new IllegalStateException("disk on fire");
        };
        ExecutionPlan plan = builder.build(outputs("sma", Technicals.sma(EquityPricing.CLOSE, 3)), null);
        try {
            engine(failing).run(plan, MON.plusDays(7), MON.plusDays(8), THREE);
            fail("Expected loader failure");
        } catch (LoaderFailureException e) {
            assertEquals(EquityPricing.CLOSE, e.request().term());
            assertEquals(MON.plusDays(3), e.request().start());
            assertEquals(MON.plusDays(8), e.request().end());
            assertEquals(THREE, e.request().assets());
            assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    @Test
    public void testUnknownAssetFailsRun() {
        InMemoryLoader loader = randomData(1, 10).build();
        ExecutionPlan plan = builder.build(outputs("close", EquityPricing.CLOSE), null);
        try {
            engine(loader).run(plan, MON, MON.plusDays(4), AssetUniverse.of(1, 42));
            fail("Expected loader failure");
        } catch (LoaderFailureException e) {
            assertTrue(e.getMessage().contains("42"));
        }
    }

    @Test(expected = LoaderFailureException.class)
    public void testWrongShapeRejected() {
        Loader shortRows = (term, start, end, assets) -> new DoubleMatrix(1, assets.size());
        ExecutionPlan plan = builder.build(outputs("close", EquityPricing.CLOSE), null);
        engine(shortRows).run(plan, MON, MON.plusDays(4), THREE);
    }

    @Test(expected = LoaderFailureException.class)
    public void testWrongKindRejected() {
        Loader wrongKind = (term, start, end, assets) -> new BooleanMatrix(5, assets.size());
        ExecutionPlan plan = builder.build(outputs("close", EquityPricing.CLOSE), null);
        engine(wrongKind).run(plan, MON, MON.plusDays(4), THREE);
    }

    @Test
    public void testComputeFailureReportsTerm() {
        Term boom = Factors.custom("Boom", List.of(EquityPricing.CLOSE), 2, (today, in, params, out) -> {
            throw new ArithmeticException("bad math");
        });
        ExecutionPlan plan = builder.build(outputs("boom", boom), null);
        RecordingListener listener = new RecordingListener();
        ExecutionEngine engine = engine(randomData(1, 10).build());
        engine.setListener(listener);
        try {
            engine.run(plan, MON.plusDays(2), MON.plusDays(4), THREE);
            fail("Expected compute failure");
        } catch (TermComputeException e) {
            assertTrue(e.termName().startsWith("Boom("));
            assertTrue(e.getCause() instanceof ArithmeticException);
        }
        assertEquals(List.of("Boom(EquityPricing.close, window=2)"), listener.errors);
        assertEquals(RunState.FAILED, listener.finalState);
    }

    @Test
    public void testCustomFactorsSharingNameComputeSeparately() {
        InMemoryLoader loader = InMemoryLoader.builder(CALENDAR).series(EquityPricing.CLOSE, 1, MON, 5).build();
        Term plusOne = Factors.custom("f", List.of(EquityPricing.CLOSE), 1, (today, in, params, out) -> {
            for (int a = 0; a < out.length; a++)
                out[a] = in[0].latestDouble(a) + 1;
        });
        Term timesTen = Factors.custom("f", List.of(EquityPricing.CLOSE), 1, (today, in, params, out) -> {
            for (int a = 0; a < out.length; a++)
                out[a] = in[0].latestDouble(a) * 10;
        });
        ExecutionPlan plan = builder.build(outputs("plusOne", plusOne, "timesTen", timesTen), null);
        assertEquals(3, plan.nodeCount());

        RunResult r = engine(loader).run(plan, MON, MON, ONE);
        assertEquals(6.0, get(r, "plusOne", 0, 0), 0.0);
        assertEquals(50.0, get(r, "timesTen", 0, 0), 0.0);
    }

    @Test
    public void testDollarVolumeAndPowerUseTodaysValues() {
        InMemoryLoader loader = InMemoryLoader.builder(CALENDAR)
                .series(EquityPricing.CLOSE, 1, MON, 10, 20)
                .series(EquityPricing.VOLUME, 1, MON, 100, 300)
                .build();
        ExecutionPlan plan = builder.build(outputs("dv", Technicals.dollarVolume(),
                "adv", Technicals.averageDollarVolume(2),
                "sq", Factors.pow(EquityPricing.CLOSE, 2),
                "ln", Factors.log(EquityPricing.CLOSE)), null);
        RunResult r = engine(loader).run(plan, MON.plusDays(1), MON.plusDays(1), ONE);
        assertEquals(6000.0, get(r, "dv", 0, 0), 0.0);
        assertEquals(3500.0, get(r, "adv", 0, 0), 0.0);
        assertEquals(400.0, get(r, "sq", 0, 0), 0.0);
        assertEquals(Math.log(20), get(r, "ln", 0, 0), 1e-12);
    }

    @Test
    public void testParallelMatchesSequential() {
        Term liquid = Filters.gt(Technicals.averageDollarVolume(5), 1e5);
        Map<String, Term> outs = outputs(
                "sma", Technicals.sma(EquityPricing.CLOSE, 10),
                "ewma", Technicals.ewmaFromSpan(EquityPricing.CLOSE, 8, 4),
                "rsi", Technicals.rsi(EquityPricing.CLOSE, 6, liquid),
                "z", Factors.zscore(Technicals.returns(5)),
                "beta", Technicals.beta(Technicals.returns(2), Technicals.returns(EquityPricing.OPEN, 2, null), 6),
                "dd", Technicals.maxDrawdown(EquityPricing.CLOSE, 7));
        ExecutionPlan plan = builder.build(outs, liquid);

        InMemoryLoader.Builder data = randomData(11, 60);
        Random rnd = new Random(5);
        for (LocalDate d = MON; d.isBefore(MON.plusDays(90)); d = d.plusDays(1))
            if (CALENDAR.isSession(d))
                for (long sid = 1; sid <= 3; sid++)
                    data.put(EquityPricing.OPEN, d, sid, 40 + rnd.nextDouble() * 20);
        InMemoryLoader loader = data.build();

        LocalDate start = MON.plusDays(21), end = MON.plusDays(70);
        RunResult seq = engine(loader).run(plan, start, end, THREE);
        RunResult par = new ExecutionEngine(loader, CALENDAR, EngineConfig.builder().parallelism(4).build())
                .run(plan, start, end, THREE);

        assertEquals(seq.sessions(), par.sessions());
        assertEquals(seq.outputs(), par.outputs());
        assertEquals(seq.screen(), par.screen());
    }

    @Test
    public void testParallelFailurePropagates() {
        Term boom = Factors.custom("Boom", List.of(EquityPricing.CLOSE), 1, (today, in, params, out) -> {
            throw new IllegalStateException("nope");
        });
        ExecutionPlan plan = builder.build(outputs("ok", Technicals.sma(EquityPricing.CLOSE, 3),
                "boom", Factors.plus(boom, 1.0)), null);
        ExecutionEngine engine = new ExecutionEngine(randomData(1, 10).build(), CALENDAR,
                EngineConfig.builder().parallelism(3).build());
        try {
            engine.run(plan, MON.plusDays(2), MON.plusDays(4), THREE);
            fail("Expected compute failure");
        } catch (TermComputeException e) {
            assertTrue(e.termName().startsWith("Boom"));
        }
    }

    @Test
    public void testReevaluationIsStable() {
        ExecutionPlan plan = builder.build(outputs(
                "rank", Factors.rank(Technicals.returns(4)),
                "corr", Technicals.correlation(EquityPricing.CLOSE, EquityPricing.VOLUME, 5)), null);
        ExecutionEngine engine = engine(randomData(4, 30).build());
        RunResult a = engine.run(plan, MON.plusDays(7), MON.plusDays(25), THREE);
        RunResult b = engine.run(plan, MON.plusDays(7), MON.plusDays(25), THREE);
        assertEquals(a.outputs(), b.outputs());
        assertNotEquals(a.runId(), b.runId());
    }

    @Test
    public void testIntermediatesReleasedAfterLastConsumer() {
        Term inner = Technicals.sma(EquityPricing.CLOSE, 3);
        Term outer = Technicals.sma(inner, 3);
        ExecutionPlan plan = builder.build(outputs("outer", outer), null);

        RecordingListener listener = new RecordingListener();
        ExecutionEngine engine = engine(randomData(2, 20).build());
        engine.setListener(listener);
        RunResult r = engine.run(plan, MON.plusDays(7), MON.plusDays(11), THREE);

        assertEquals(List.of(EquityPricing.CLOSE.name(), inner.name()), listener.released);
        assertEquals(List.of(EquityPricing.CLOSE.name()), listener.loaded);
        assertEquals(List.of(inner.name(), outer.name()), listener.computed);
        assertEquals(RunState.DONE, listener.finalState);
        assertEquals(3, r.nodesEvaluated());
        assertEquals(5, r.outputs().get("outer").rows());

        RecordingListener keepAll = new RecordingListener();
        ExecutionEngine noRelease = new ExecutionEngine(randomData(2, 20).build(), CALENDAR,
                EngineConfig.builder().releaseIntermediates(false).build());
        noRelease.setListener(keepAll);
        RunResult kept = noRelease.run(plan, MON.plusDays(7), MON.plusDays(11), THREE);
        assertTrue(keepAll.released.isEmpty());
        assertEquals(r.outputs(), kept.outputs());
    }

    @Test
    public void testEmptyRangeSkipsLoader() {
        InMemoryLoader loader = randomData(1, 10).build();
        ExecutionPlan plan = builder.build(outputs("sma", Technicals.sma(EquityPricing.CLOSE, 3)), null);
        // Saturday and Sunday
        RunResult r = engine(loader).run(plan, MON.plusDays(5), MON.plusDays(6), THREE);
        assertTrue(r.sessions().isEmpty());
        assertEquals(0, r.outputs().get("sma").rows());
        assertEquals(0, loader.callCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testStartAfterEndRejected() {
        ExecutionPlan plan = builder.build(outputs("close", EquityPricing.CLOSE), null);
        engine(randomData(1, 10).build()).run(plan, MON.plusDays(3), MON, THREE);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidParallelismRejected() {
        new ExecutionEngine(randomData(1, 10).build(), CALENDAR, EngineConfig.builder().parallelism(0).build());
    }

    private static final class RecordingListener implements EvaluationListener {
        final List<String> loaded = Collections.synchronizedList(new ArrayList<>());
        final List<String> computed = Collections.synchronizedList(new ArrayList<>());
        final List<String> released = Collections.synchronizedList(new ArrayList<>());
        final List<String> errors = Collections.synchronizedList(new ArrayList<>());
        volatile RunState finalState;

        @Override
        public void onRunStart(long runId, int nodeCount, int sessions) {
        }

        @Override
        public void onNodeLoaded(long runId, int topoIndex, String termName, int rows, long durationNanos) {
            loaded.add(termName);
        }

        @Override
        public void onNodeComputed(long runId, int topoIndex, String termName, long durationNanos) {
            computed.add(termName);
        }

        @Override
        public void onNodeReleased(long runId, int topoIndex, String termName) {
            released.add(termName);
        }

        @Override
        public void onNodeError(long runId, int topoIndex, String termName, Throwable error) {
            errors.add(termName);
        }

        @Override
        public void onRunEnd(long runId, RunState finalState, int nodesEvaluated) {
            this.finalState = finalState;
        }
    }
}
