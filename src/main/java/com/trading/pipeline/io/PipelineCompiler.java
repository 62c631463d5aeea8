package com.trading.pipeline.io;

import com.trading.pipeline.Pipeline;
import com.trading.pipeline.engine.DependencyOrder;
import com.trading.pipeline.errors.InvalidWindowLengthException;
import com.trading.pipeline.term.Term;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a {@link PipelineDefinition} into a {@link Pipeline}.
 *
 * <p>
 * Steps:
 * <ol>
 * <li>Index term definitions by name, rejecting duplicates and unknown
 * references.</li>
 * <li>Order names so that every term follows its inputs and mask. A term that
 * depends on itself, directly or through others, fails here with
 * {@link com.trading.pipeline.errors.CyclicDependencyException}.</li>
 * <li>Instantiate terms in that order through their {@link TermType}.</li>
 * <li>Bind outputs and the screen.</li>
 * </ol>
 * Nothing is loaded: a definition that compiles can still fail at run time only
 * through its data.
 */
@Log4j2
public final class PipelineCompiler {

    public Pipeline compile(String json) {
        return compile(PipelineDefinitionParser.parse(json));
    }

    public Pipeline compile(PipelineDefinition def) {
        PipelineDefinition.PipelineInfo info = def.getPipeline();
        if (info == null)
            throw new IllegalArgumentException("Missing 'pipeline' key");
        List<PipelineDefinition.TermDef> termDefs = info.getTerms() == null ? List.of() : info.getTerms();

        Map<String, PipelineDefinition.TermDef> byName = new LinkedHashMap<>();
        for (PipelineDefinition.TermDef td : termDefs) {
            if (td.getName() == null || td.getName().isBlank())
                throw new IllegalArgumentException("Every term needs a name");
            if (byName.putIfAbsent(td.getName(), td) != null)
                throw new IllegalArgumentException("Duplicate term name: " + td.getName());
        }
        for (PipelineDefinition.TermDef td : termDefs)
            for (String ref : references(td))
                if (!byName.containsKey(ref))
                    throw new IllegalArgumentException("Term '" + td.getName() + "' references unknown term '"
                            + ref + "'");

        List<String> order = DependencyOrder.sort(byName.keySet(), n -> references(byName.get(n)), n -> n);

        Map<String, Term> terms = new HashMap<>(order.size() * 2);
        for (String name : order) {
            PipelineDefinition.TermDef td = byName.get(name);
            List<Term> inputs = new ArrayList<>();
            if (td.getInputs() != null)
                for (String in : td.getInputs())
                    inputs.add(terms.get(in));
            Term mask = td.getMask() == null ? null : terms.get(td.getMask());
            int window = windowLength(td);
            terms.put(name, TermType.fromString(td.getType()).create(name, inputs, window, td.getProperties(),
                    mask));
        }

        Pipeline.Builder builder = Pipeline.builder();
        List<PipelineDefinition.OutputDef> outputs = info.getOutputs() == null ? List.of() : info.getOutputs();
        for (PipelineDefinition.OutputDef od : outputs)
            builder.add(od.getName(), resolve(terms, od.getTerm(), "output " + od.getName()));
        if (info.getScreen() != null)
            builder.screen(resolve(terms, info.getScreen(), "screen"));

        Pipeline pipeline = builder.build();
        log.debug("Compiled pipeline '{}': {} terms, {} outputs", info.getName(), terms.size(), outputs.size());
        return pipeline;
    }

    private static List<String> references(PipelineDefinition.TermDef td) {
        List<String> refs = new ArrayList<>();
        if (td.getInputs() != null)
            refs.addAll(td.getInputs());
        if (td.getMask() != null)
            refs.add(td.getMask());
        return refs;
    }

    private static int windowLength(PipelineDefinition.TermDef td) {
        Number n = td.getWindowLength();
        if (n == null)
            return 0;
        double d = n.doubleValue();
        if (d != Math.rint(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE)
            throw new InvalidWindowLengthException("Term '" + td.getName()
                    + "': window_length must be an integer, got " + n);
        return n.intValue();
    }

    private static Term resolve(Map<String, Term> terms, String name, String what) {
        Term t = name == null ? null : terms.get(name);
        if (t == null)
            throw new IllegalArgumentException("The " + what + " references unknown term '" + name + "'");
        return t;
    }
}
