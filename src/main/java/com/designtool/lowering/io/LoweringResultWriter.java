package com.designtool.lowering.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.designtool.lowering.pipeline.LoweringResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Serializes lowering results. Properties and map keys are sorted and null
 * fields omitted, so equal results always produce identical bytes.
 */
public class LoweringResultWriter {
    private static final Logger log = LoggerFactory.getLogger(LoweringResultWriter.class);

    private final ObjectWriter writer;

    public LoweringResultWriter() {
        this(true);
    }

    public LoweringResultWriter(boolean pretty) {
        ObjectMapper mapper = JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
        this.writer = pretty ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
    }

    public String writeToString(LoweringResult result) throws JsonProcessingException {
        return writer.writeValueAsString(result);
    }

    public void write(LoweringResult result, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        writer.writeValue(output.toFile(), result);
        log.debug("Wrote lowering result for {} to {}", result.getId(), output);
    }
}
