package com.trading.pipeline.engine;

import com.trading.pipeline.api.EvaluationListener;
import com.trading.pipeline.api.LoadRequest;
import com.trading.pipeline.api.Loader;
import com.trading.pipeline.calendar.TradingCalendar;
import com.trading.pipeline.data.AssetUniverse;
import com.trading.pipeline.data.BooleanMatrix;
import com.trading.pipeline.data.DoubleMatrix;
import com.trading.pipeline.data.LabelMatrix;
import com.trading.pipeline.data.Matrix;
import com.trading.pipeline.data.Window;
import com.trading.pipeline.errors.LoaderFailureException;
import com.trading.pipeline.errors.PipelineException;
import com.trading.pipeline.errors.RunCancelledException;
import com.trading.pipeline.errors.TermComputeException;
import com.trading.pipeline.loader.CoalescingLoader;
import com.trading.pipeline.term.ComputeDefinition;
import com.trading.pipeline.term.Term;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Evaluates an {@link ExecutionPlan} over a date range and asset universe.
 *
 * <p>
 * Algorithm:
 * <ol>
 * <li>Resolve the output sessions and the earliest session any term needs
 * ({@code maxExtraRows} sessions before the first output date).</li>
 * <li>Visit terms in plan order. Leaf terms are fetched from the loader over
 * {@code [first needed session, end]}; computed terms call their compute step
 * once per row with trailing windows cut from their inputs.</li>
 * <li>Masks are applied to a copy of each input before windows are cut, and the
 * term's own output is forced missing where the mask is false.</li>
 * <li>Once every consumer has read a term, its output is dropped unless it is an
 * output or the screen.</li>
 * </ol>
 *
 * <p>
 * With {@code parallelism > 1}, each term becomes a task that starts when its
 * dependencies finish. Results are identical to sequential evaluation since
 * every compute step only sees its own inputs.
 *
 * <p>
 * Fail fast: the first load or compute failure aborts the run. Remaining tasks
 * are skipped, the listener sees {@link RunState#FAILED}, and the failure is
 * rethrown as a {@link PipelineException}.
 */
public final class ExecutionEngine {
    private static final Logger log = LogManager.getLogger(ExecutionEngine.class);

    private final Loader loader;
    private final TradingCalendar calendar;
    private final EngineConfig config;
    private final AtomicLong runIds = new AtomicLong();
    private volatile EvaluationListener listener;

    public ExecutionEngine(Loader loader, TradingCalendar calendar, EngineConfig config) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.calendar = Objects.requireNonNull(calendar, "calendar");
        this.config = Objects.requireNonNull(config, "config").validate();
    }

    public void setListener(EvaluationListener listener) {
        this.listener = listener;
    }

    public EngineConfig config() {
        return config;
    }

    public RunResult run(ExecutionPlan plan, LocalDate start, LocalDate end, AssetUniverse assets) {
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(assets, "assets");
        if (start.isAfter(end))
            throw new IllegalArgumentException("start " + start + " is after end " + end);

        List<LocalDate> sessions = calendar.sessions(start, end);
        Run run = new Run(runIds.incrementAndGet(), plan, sessions, assets);
        return run.execute();
    }

    /** State of one call to {@link #run}. */
    private final class Run {
        final long runId;
        final ExecutionPlan plan;
        final List<LocalDate> sessions;
        final AssetUniverse assets;
        final int n;
        final int maxExtra;
        final List<LocalDate> timeline;
        final TermCache cache;
        final Loader source;
        final EvaluationListener l;
        final AtomicInteger evaluated = new AtomicInteger();
        final AtomicBoolean aborted = new AtomicBoolean();
        final AtomicReference<RuntimeException> firstFailure = new AtomicReference<>();
        RunState state = RunState.INITIALIZED;

        Run(long runId, ExecutionPlan plan, List<LocalDate> sessions, AssetUniverse assets) {
            this.runId = runId;
            this.plan = plan;
            this.sessions = sessions;
            this.assets = assets;
            this.n = sessions.size();
            this.maxExtra = plan.maxExtraRows();
            this.timeline = n == 0 ? List.of()
                    : calendar.sessions(calendar.sessionsBefore(sessions.get(0), maxExtra), sessions.get(n - 1));
            if (n > 0 && timeline.size() != maxExtra + n)
                throw new IllegalStateException("Calendar returned " + timeline.size() + " sessions, expected "
                        + (maxExtra + n));
            this.cache = new TermCache(plan, config.isReleaseIntermediates());
            this.source = config.isCoalesceLoads() ? new CoalescingLoader(loader) : loader;
            this.l = listener;
        }

        RunResult execute() {
            long t0 = System.nanoTime();
            log.info("Run {} starting: {} terms, {} sessions, {} assets, parallelism={}", runId, plan.nodeCount(), n,
                    assets.size(), config.getParallelism());
            if (l != null)
                l.onRunStart(runId, plan.nodeCount(), n);

            try {
                if (n > 0) {
                    if (config.getParallelism() > 1)
                        evaluateParallel();
                    else
                        for (int ti = 0; ti < plan.nodeCount(); ti++)
                            evaluate(ti);
                }
                advance(RunState.ASSEMBLING);
                RunResult result = collect();
                advance(RunState.DONE);
                log.info("Run {} done: {} terms evaluated in {} ms, peak cached terms={}", runId, evaluated.get(),
                        (System.nanoTime() - t0) / 1_000_000, cache.peakLiveCount());
                if (l != null)
                    l.onRunEnd(runId, RunState.DONE, evaluated.get());
                return result;
            } catch (RuntimeException e) {
                fail();
                log.error("Run {} failed: {}", runId, e.getMessage());
                if (l != null)
                    l.onRunEnd(runId, RunState.FAILED, evaluated.get());
                throw e;
            }
        }

        private void evaluateParallel() {
            int nodes = plan.nodeCount();
            AtomicInteger threadIds = new AtomicInteger();
            ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.getParallelism(), nodes), r -> {
                Thread t = new Thread(r, "pipeline-run-" + runId + "-worker-" + threadIds.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            CompletableFuture<?>[] tasks = new CompletableFuture<?>[nodes];
            try {
                for (int ti = 0; ti < nodes; ti++) {
                    final int node = ti;
                    int[] deps = plan.distinctDependencies(ti);
                    Runnable step = () -> {
                        if (aborted.get())
                            throw new CancellationException("run " + runId + " aborted");
                        evaluate(node);
                    };
                    if (deps.length == 0) {
                        tasks[ti] = CompletableFuture.runAsync(step, pool);
                    } else {
                        CompletableFuture<?>[] upstream = new CompletableFuture<?>[deps.length];
                        for (int k = 0; k < deps.length; k++)
                            upstream[k] = tasks[deps[k]];
                        tasks[ti] = CompletableFuture.allOf(upstream).thenRunAsync(step, pool);
                    }
                }
                CompletableFuture.allOf(tasks).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                aborted.set(true);
                for (CompletableFuture<?> task : tasks)
                    if (task != null)
                        task.cancel(true);
                throw new RunCancelledException("Run " + runId + " interrupted", e);
            } catch (ExecutionException e) {
                RuntimeException first = firstFailure.get();
                if (first != null)
                    throw first;
                Throwable cause = unwrap(e);
                if (cause instanceof RuntimeException re)
                    throw re;
                throw new IllegalStateException("Run " + runId + " failed", cause);
            } finally {
                pool.shutdownNow();
            }
        }

        private Throwable unwrap(Throwable t) {
            while ((t instanceof ExecutionException || t instanceof CompletionException) && t.getCause() != null)
                t = t.getCause();
            return t;
        }

        private void evaluate(int ti) {
            Term term = plan.term(ti);
            int extra = plan.extraRows(ti);
            int rows = extra + n;
            long start = System.nanoTime();
            Matrix result;
            try {
                if (term.isLoadable()) {
                    advance(RunState.LOADING);
                    result = load(ti, term, extra, rows);
                    if (l != null)
                        l.onNodeLoaded(runId, ti, term.name(), rows, System.nanoTime() - start);
                } else {
                    advance(RunState.COMPUTING);
                    result = compute(ti, term, extra, rows);
                    if (l != null)
                        l.onNodeComputed(runId, ti, term.name(), System.nanoTime() - start);
                }
            } catch (RuntimeException e) {
                PipelineException failure = e instanceof PipelineException pe ? pe
                        : new TermComputeException(term.name(), e);
                aborted.set(true);
                if (!firstFailure.compareAndSet(null, failure))
                    log.warn("Run {} term #{} {} also failed after abort: {}", runId, ti, term.name(),
                            failure.getMessage());
                if (l != null)
                    l.onNodeError(runId, ti, term.name(), failure);
                throw failure;
            }
            if (log.isDebugEnabled())
                log.debug("Run {} term #{} {} -> {} rows in {} us", runId, ti, term.name(), rows,
                        (System.nanoTime() - start) / 1000);

            advance(RunState.CACHING);
            cache.put(ti, result);
            evaluated.incrementAndGet();
            for (int dep : plan.distinctDependencies(ti)) {
                if (cache.consumed(dep) && l != null)
                    l.onNodeReleased(runId, dep, plan.term(dep).name());
            }
        }

        private Matrix load(int ti, Term term, int extra, int rows) {
            LoadRequest request = new LoadRequest(term.withoutMask(), timeline.get(maxExtra - extra),
                    timeline.get(timeline.size() - 1), assets);
            Matrix raw;
            try {
                raw = source.getWindow(request.term(), request.start(), request.end(), request.assets());
            } catch (LoaderFailureException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new LoaderFailureException(request, e);
            }
            if (raw == null)
                throw new LoaderFailureException(request, "loader returned no data");
            if (raw.kind() != term.kind())
                throw new LoaderFailureException(request, "expected " + term.kind() + " data, got " + raw.kind());
            if (raw.rows() != rows || raw.columns() != assets.size())
                throw new LoaderFailureException(request, "expected " + rows + "x" + assets.size() + " window, got "
                        + raw.rows() + "x" + raw.columns());
            if (!term.hasMask())
                return raw;
            Matrix masked = raw.copy();
            int mi = plan.maskIndex(ti);
            masked.applyMask((BooleanMatrix) cache.get(mi), plan.extraRows(mi) - extra);
            return masked;
        }

        private Matrix compute(int ti, Term term, int extra, int rows) {
            int lookback = term.lookback();
            int width = lookback + 1;
            int arity = plan.inputCount(ti);
            int mi = plan.maskIndex(ti);
            BooleanMatrix mask = mi >= 0 ? (BooleanMatrix) cache.get(mi) : null;

            // Inputs are aligned so that window row 0 of output row r is source row base[k] + r.
            Matrix[] sources = new Matrix[arity];
            int[] base = new int[arity];
            for (int k = 0; k < arity; k++) {
                int j = plan.input(ti, k);
                Matrix in = cache.get(j);
                int from = plan.extraRows(j) - extra - lookback;
                if (mask == null) {
                    sources[k] = in;
                    base[k] = from;
                } else {
                    Matrix copy = in.rowSlice(from, in.rows());
                    copy.applyMask(mask, plan.extraRows(mi) - extra - lookback);
                    sources[k] = copy;
                    base[k] = 0;
                }
            }

            ComputeDefinition def = term.definition();
            int cols = assets.size();
            Matrix out = term.kind().allocate(rows, cols);
            Window[] windows = new Window[arity];
            int firstDate = maxExtra - extra;

            switch (term.kind()) {
                case FACTOR -> {
                    double[] buf = new double[cols];
                    DoubleMatrix dm = (DoubleMatrix) out;
                    for (int r = 0; r < rows; r++) {
                        cut(sources, base, windows, r, width);
                        Arrays.fill(buf, Double.NaN);
                        def.factorFn().compute(timeline.get(firstDate + r), windows, term.params(), buf);
                        dm.setRow(r, buf);
                    }
                }
                case FILTER -> {
                    boolean[] buf = new boolean[cols];
                    BooleanMatrix bm = (BooleanMatrix) out;
                    for (int r = 0; r < rows; r++) {
                        cut(sources, base, windows, r, width);
                        Arrays.fill(buf, false);
                        def.filterFn().compute(timeline.get(firstDate + r), windows, term.params(), buf);
                        bm.setRow(r, buf);
                    }
                }
                case CLASSIFIER -> {
                    int[] buf = new int[cols];
                    LabelMatrix lm = (LabelMatrix) out;
                    for (int r = 0; r < rows; r++) {
                        cut(sources, base, windows, r, width);
                        Arrays.fill(buf, LabelMatrix.MISSING);
                        def.classifierFn().compute(timeline.get(firstDate + r), windows, term.params(), buf);
                        lm.setRow(r, buf);
                    }
                }
            }
            if (mask != null)
                out.applyMask(mask, plan.extraRows(mi) - extra);
            return out;
        }

        private void cut(Matrix[] sources, int[] base, Window[] windows, int row, int width) {
            for (int k = 0; k < sources.length; k++)
                windows[k] = new Window(sources[k], base[k] + row, width);
        }

        private RunResult collect() {
            Map<String, Matrix> outputs = new LinkedHashMap<>();
            for (var e : plan.outputs().entrySet())
                outputs.put(e.getKey(), lastRows(e.getValue()));
            BooleanMatrix screen = plan.hasScreen() ? (BooleanMatrix) lastRows(plan.screenIndex()) : null;
            return new RunResult(runId, List.copyOf(sessions), assets, outputs, screen, evaluated.get());
        }

        private Matrix lastRows(int ti) {
            if (n == 0)
                return plan.term(ti).kind().allocate(0, assets.size());
            Matrix m = cache.get(ti);
            return plan.extraRows(ti) == 0 ? m : m.rowSlice(m.rows() - n, m.rows());
        }

        private synchronized void advance(RunState next) {
            if (!state.canAdvanceTo(next))
                throw new IllegalStateException("Run " + runId + " cannot move from " + state + " to " + next);
            state = next;
        }

        private synchronized void fail() {
            if (!state.isTerminal())
                state = RunState.FAILED;
        }
    }
}
