package com.trading.pipeline;

import com.trading.pipeline.api.Loader;
import com.trading.pipeline.calendar.TradingCalendar;
import com.trading.pipeline.calendar.WeekdayCalendar;
import com.trading.pipeline.engine.EngineConfig;
import com.trading.pipeline.engine.ExecutionEngine;
import com.trading.pipeline.term.Term;

import java.util.Map;

/**
 * Factor Pipeline: declarative factor, filter and classifier computations over
 * a panel of assets and business days.
 *
 * <h2>Model</h2>
 * <ul>
 * <li><b>Terms</b> are immutable, structurally compared descriptions of one
 * computation (see {@link com.trading.pipeline.dsl.Factors},
 * {@link com.trading.pipeline.dsl.Filters},
 * {@link com.trading.pipeline.dsl.Classifiers},
 * {@link com.trading.pipeline.dsl.Technicals}).</li>
 * <li>A <b>pipeline</b> names the terms to output and an optional screen.</li>
 * <li>The <b>engine</b> turns the pipeline into a plan, loads leaf columns
 * through a {@link Loader} with exactly the trailing history each window needs,
 * computes every distinct term once and returns a table indexed by
 * (date, asset).</li>
 * </ul>
 */
public final class FactorPipeline {

    private FactorPipeline() {
    }

    public static Pipeline definePipeline(Map<String, Term> outputs, Term screen) {
        Pipeline.Builder b = Pipeline.builder();
        outputs.forEach(b::add);
        return b.screen(screen).build();
    }

    /** Sequential engine on a Monday-to-Friday calendar. */
    public static PipelineEngine engine(Loader loader) {
        return engine(loader, new WeekdayCalendar(), EngineConfig.DEFAULT);
    }

    public static PipelineEngine engine(Loader loader, TradingCalendar calendar, EngineConfig config) {
        return new PipelineEngine(new ExecutionEngine(loader, calendar, config));
    }
}
