package com.trading.pipeline.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO form of a declarative pipeline. Terms refer to each other by name.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PipelineDefinition {
    private PipelineInfo pipeline;

    /** The pipeline body. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class PipelineInfo {
        private String name, description;
        private List<TermDef> terms;
        private List<OutputDef> outputs;
        private String screen;
    }

    /**
     * One named term. {@code type} is a {@link TermType} name. The window length
     * is kept as read; the compiler rejects fractional values.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class TermDef {
        private String name, type, mask;
        private List<String> inputs;
        private Number windowLength;
        private Map<String, Object> properties;
    }

    /** Output column {@code name} takes the values of term {@code term}. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class OutputDef {
        private String name, term;
    }
}
