package com.trading.pipeline.util;

import com.trading.pipeline.FactorPipeline;
import com.trading.pipeline.Pipeline;
import com.trading.pipeline.PipelineEngine;
import com.trading.pipeline.api.EvaluationListener;
import com.trading.pipeline.data.AssetUniverse;
import com.trading.pipeline.dsl.Factors;
import com.trading.pipeline.dsl.Technicals;
import com.trading.pipeline.engine.RunState;
import com.trading.pipeline.errors.LoaderFailureException;
import com.trading.pipeline.loader.InMemoryLoader;
import com.trading.pipeline.term.EquityPricing;
import com.trading.pipeline.term.Term;
import org.junit.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class ListenersTest {
    private static final LocalDate MON = LocalDate.of(2024, 1, 1);
    private static final AssetUniverse ONE = AssetUniverse.of(1);

    private static final Term SMA = Technicals.sma(EquityPricing.CLOSE, 2);

    private static PipelineEngine engine() {
        return FactorPipeline.engine(InMemoryLoader.builder()
                .series(EquityPricing.CLOSE, 1, MON, 1, 2, 3, 4, 5)
                .build());
    }

    private static Pipeline pipeline() {
        return FactorPipeline.definePipeline(Map.of("sma", SMA, "neg", Factors.negate(SMA)), null);
    }

    /** Records run-level events only. */
    private static final class RunLog implements EvaluationListener {
        final List<String> events = new ArrayList<>();

        @Override
        public void onRunStart(long runId, int nodeCount, int sessions) {
            events.add("start " + nodeCount + " " + sessions);
        }

        @Override
        public void onNodeLoaded(long runId, int topoIndex, String termName, int rows, long durationNanos) {
        }

        @Override
        public void onNodeComputed(long runId, int topoIndex, String termName, long durationNanos) {
        }

        @Override
        public void onNodeError(long runId, int topoIndex, String termName, Throwable error) {
            events.add("error " + termName);
        }

        @Override
        public void onRunEnd(long runId, RunState finalState, int nodesEvaluated) {
            events.add("end " + finalState + " " + nodesEvaluated);
        }
    }

    @Test
    public void testProfileCountsLoadsAndComputes() {
        TermProfileListener profile = new TermProfileListener();
        PipelineEngine engine = engine();
        engine.setListener(profile);
        engine.evaluate(pipeline(), MON.plusDays(1), MON.plusDays(4), ONE);
        engine.evaluate(pipeline(), MON.plusDays(1), MON.plusDays(4), ONE);

        assertEquals(2, profile.runs());
        assertEquals(0, profile.failedRuns());
        TermProfileListener.TermStats close = profile.stats(EquityPricing.CLOSE.name());
        assertEquals(2, close.count);
        assertEquals(2, close.loads);
        TermProfileListener.TermStats sma = profile.stats(SMA.name());
        assertEquals(2, sma.count);
        assertEquals(0, sma.loads);
        assertTrue(profile.dump().contains("Avg (us)"));

        profile.reset();
        assertNull(profile.stats(SMA.name()));
    }

    @Test
    public void testRunCountsSurviveConcurrentRuns() throws Exception {
        TermProfileListener profile = new TermProfileListener();
        int threads = 8, perThread = 5_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<?>> done = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                done.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perThread; i++)
                        profile.onRunEnd(i, i % 2 == 0 ? RunState.DONE : RunState.FAILED, 0);
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : done)
                f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(threads * perThread, profile.runs());
        assertEquals(threads * perThread / 2, profile.failedRuns());
    }

    @Test
    public void testCompositeFansOutInOrder() {
        RunLog first = new RunLog();
        RunLog second = new RunLog();
        TermProfileListener profile = new TermProfileListener();
        PipelineEngine engine = engine();
        engine.setListener(new CompositeEvaluationListener().add(first).add(second).add(profile));
        engine.evaluate(pipeline(), MON.plusDays(1), MON.plusDays(2), ONE);

        assertEquals(List.of("start 3 2", "end DONE 3"), first.events);
        assertEquals(first.events, second.events);
        assertEquals(1, profile.runs());
    }

    @Test
    public void testFailedRunIsReported() {
        RunLog log = new RunLog();
        TermProfileListener profile = new TermProfileListener();
        PipelineEngine engine = FactorPipeline.engine(InMemoryLoader.builder().build());
        engine.setListener(new CompositeEvaluationListener().add(log).add(profile));
        try {
            engine.evaluate(pipeline(), MON, MON, ONE);
            fail("Expected a loader failure");
        } catch (LoaderFailureException expected) {
            // unknown column
        }
        assertEquals(1, profile.failedRuns());
        assertEquals(1, profile.stats(EquityPricing.CLOSE.name()).errors);
        assertEquals("end FAILED 0", log.events.get(log.events.size() - 1));
    }

    @Test
    public void testPlanExplain() {
        var plan = engine().plan(pipeline());
        String dump = PlanExplain.dump(plan);
        assertTrue(dump, dump.contains("output sma = #1"));
        assertTrue(dump, dump.contains("extra=1"));

        String one = PlanExplain.explainTerm(plan, EquityPricing.CLOSE);
        assertTrue(one, one.contains("Extra rows: 1"));
        assertTrue(one, one.contains("Loaded: true"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExplainUnknownTerm() {
        PlanExplain.explainTerm(engine().plan(pipeline()), EquityPricing.OPEN);
    }
}
