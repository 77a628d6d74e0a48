package com.mlpromote.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Writes validation reports as pretty-printed JSON for the approval reviewer.
 */
public class ValidationReportWriter {
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final Path reportRoot;

    public ValidationReportWriter(Path reportRoot) {
        this.reportRoot = reportRoot;
    }

    public Path write(String runId, String environment, ValidationReport report) throws IOException {
        Path runDirectory = reportRoot.resolve(runId);
        Files.createDirectories(runDirectory);
        Path reportPath = runDirectory.resolve(environment + "-validation.json");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), report);
        return reportPath;
    }

    public ValidationReport read(Path reportPath) throws IOException {
        return objectMapper.readValue(reportPath.toFile(), ValidationReport.class);
    }
}
