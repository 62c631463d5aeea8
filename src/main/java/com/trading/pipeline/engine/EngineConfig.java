package com.trading.pipeline.engine;

import java.util.Properties;

import lombok.Builder;
import lombok.Value;

/**
 * Engine tuning knobs.
 *
 * <ul>
 * <li>{@code parallelism}: worker threads per run. 1 evaluates sequentially on
 * the calling thread.</li>
 * <li>{@code releaseIntermediates}: drop a term's output once every consumer
 * has read it.</li>
 * <li>{@code coalesceLoads}: share one loader call between identical requests
 * within a run.</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class EngineConfig {
    public static final String PARALLELISM = "pipeline.parallelism";
    public static final String RELEASE_INTERMEDIATES = "pipeline.releaseIntermediates";
    public static final String COALESCE_LOADS = "pipeline.coalesceLoads";

    public static final EngineConfig DEFAULT = EngineConfig.builder().build();

    @Builder.Default
    int parallelism = 1;

    @Builder.Default
    boolean releaseIntermediates = true;

    @Builder.Default
    boolean coalesceLoads = true;

    /** Reads {@code pipeline.*} keys; absent keys keep their defaults. */
    public static EngineConfig fromProperties(Properties props) {
        var b = EngineConfig.builder();
        String p = props.getProperty(PARALLELISM);
        if (p != null) {
            try {
                b.parallelism(Integer.parseInt(p.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + PARALLELISM + ": " + p, e);
            }
        }
        String r = props.getProperty(RELEASE_INTERMEDIATES);
        if (r != null)
            b.releaseIntermediates(Boolean.parseBoolean(r.trim()));
        String c = props.getProperty(COALESCE_LOADS);
        if (c != null)
            b.coalesceLoads(Boolean.parseBoolean(c.trim()));
        return b.build().validate();
    }

    EngineConfig validate() {
        if (parallelism < 1)
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        return this;
    }
}
