package com.mlpromote.validation;

import java.time.Instant;
import java.util.List;

public record ValidationReport(
        String suiteName,
        String endpointName,
        boolean passed,
        ValidationMetrics metrics,
        List<CheckResult> checks,
        Instant startedAt,
        Instant completedAt) {

    public ValidationReport {
        checks = checks == null ? List.of() : List.copyOf(checks);
    }
}
