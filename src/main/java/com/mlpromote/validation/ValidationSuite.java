package com.mlpromote.validation;

import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Named set of checks plus the samples they send to the endpoint. Samples with an
 * {@code expected} value are labeled and count towards accuracy.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidationSuite(
        String name,
        List<CheckDefinition> checks,
        List<Sample> samples) {

    public ValidationSuite {
        name = name == null || name.isBlank() ? "unnamed-suite" : name;
        checks = checks == null ? List.of() : List.copyOf(checks);
        samples = samples == null ? List.of() : List.copyOf(samples);
    }

    public List<Sample> labeledSamples() {
        return samples.stream().filter(Sample::labeled).toList();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CheckDefinition(
            String id,
            CheckType type,
            int repetitions,
            Double maxP95LatencyMs,
            Double minAccuracy) {
        public CheckDefinition {
            type = type == null ? CheckType.FUNCTIONAL : type;
            id = id == null || id.isBlank() ? type.name().toLowerCase(Locale.ROOT) : id;
            repetitions = Math.max(1, repetitions);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Sample(String input, String expected) {
        public boolean labeled() {
            return expected != null;
        }
    }
}
