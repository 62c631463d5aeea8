package com.trading.pipeline;

import com.trading.pipeline.api.EvaluationListener;
import com.trading.pipeline.data.AssetUniverse;
import com.trading.pipeline.engine.ExecutionEngine;
import com.trading.pipeline.engine.ExecutionPlan;
import com.trading.pipeline.engine.OutputAssembler;
import com.trading.pipeline.engine.ResultTable;
import com.trading.pipeline.engine.RunResult;
import com.trading.pipeline.engine.TermGraphBuilder;
import com.trading.pipeline.util.PlanExplain;

import java.time.LocalDate;

import lombok.extern.log4j.Log4j2;

/**
 * Builds, runs and assembles pipelines: plan, then execute, then flatten into a
 * {@link ResultTable}. Holds no per-run state, so one instance can serve
 * concurrent callers.
 */
@Log4j2
public final class PipelineEngine {
    private final TermGraphBuilder builder = new TermGraphBuilder();
    private final OutputAssembler assembler = new OutputAssembler();
    private final ExecutionEngine engine;

    public PipelineEngine(ExecutionEngine engine) {
        this.engine = engine;
    }

    public void setListener(EvaluationListener listener) {
        engine.setListener(listener);
    }

    /** Compiles the pipeline without loading anything. */
    public ExecutionPlan plan(Pipeline pipeline) {
        ExecutionPlan plan = builder.build(pipeline.outputs(), pipeline.screen());
        if (log.isDebugEnabled())
            log.debug("Plan for {}:\n{}", pipeline, PlanExplain.dump(plan));
        return plan;
    }

    public ResultTable evaluate(Pipeline pipeline, LocalDate start, LocalDate end, AssetUniverse assets) {
        return evaluate(plan(pipeline), start, end, assets);
    }

    /** Runs a plan compiled earlier; useful for evaluating one pipeline over many ranges. */
    public ResultTable evaluate(ExecutionPlan plan, LocalDate start, LocalDate end, AssetUniverse assets) {
        RunResult raw = engine.run(plan, start, end, assets);
        return assembler.assemble(raw);
    }

    /** Per-term arrays without assembly into a table. */
    public RunResult run(Pipeline pipeline, LocalDate start, LocalDate end, AssetUniverse assets) {
        return engine.run(plan(pipeline), start, end, assets);
    }
}
