package com.mainframe.jcl.export;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mainframe.jcl.pipeline.AnalysisResult;

/**
 * Writes analysis results as JSON with snake_case field names. This is the hand-off point
 * to whatever stores the model.
 */
public class JsonModelExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonModelExporter.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(AnalysisResult result) throws IOException {
        return mapper.writeValueAsString(ExportedRun.from(result));
    }

    public String toJson(List<AnalysisResult> results) throws IOException {
        return mapper.writeValueAsString(results.stream().map(ExportedRun::from).toList());
    }

    public void write(AnalysisResult result, Path path) throws IOException {
        writeString(path, toJson(result));
        log.info("Wrote {} step(s) for {} to {}", result.getSteps().size(), result.getMember(), path);
    }

    /**
     * Several runs go out as one JSON array, in the given order.
     */
    public void writeAll(List<AnalysisResult> results, Path path) throws IOException {
        writeString(path, toJson(results));
        log.info("Wrote {} run(s) to {}", results.size(), path);
    }

    private void writeString(Path path, String json) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, json + System.lineSeparator());
    }
}
