package com.trading.pipeline.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Reads {@link PipelineDefinition}s from JSON. */
public final class PipelineDefinitionParser {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private PipelineDefinitionParser() {
    }

    public static PipelineDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    public static PipelineDefinition parse(String json) {
        PipelineDefinition def;
        try {
            def = MAPPER.readValue(json, PipelineDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed pipeline definition: " + e.getOriginalMessage(), e);
        }
        if (def == null || def.getPipeline() == null)
            throw new IllegalArgumentException("Missing 'pipeline' key");
        return def;
    }

    public static String toJson(PipelineDefinition def) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(def);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize pipeline definition", e);
        }
    }
}
