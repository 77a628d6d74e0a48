package com.mlpromote.gate;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.mlpromote.validation.CheckResult;
import com.mlpromote.validation.CheckType;
import com.mlpromote.validation.ValidationMetrics;
import com.mlpromote.validation.ValidationReport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GateEvaluatorTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final GateEvaluator evaluator = new GateEvaluator();
    private final EnvironmentPolicy staging = new EnvironmentPolicy("staging", 0.85, 1000, 0.0, false);
    private final EnvironmentPolicy production = new EnvironmentPolicy("production", 0.85, 1000, 0.0, true);

    @Test
    void shouldAllowAccuracyExactlyAtThreshold() {
        GateDecision decision = evaluator.evaluate(report(true, 0.85, 200, 0.0), staging, ApprovalState.NONE);

        assertEquals(GateDecision.Decision.ALLOW, decision.decision());
        assertTrue(decision.reasons().isEmpty());
    }

    @Test
    void shouldBlockAccuracyJustBelowThreshold() {
        GateDecision decision = evaluator.evaluate(report(true, 0.8499, 200, 0.0), staging, ApprovalState.NONE);

        assertEquals(GateDecision.Decision.BLOCK, decision.decision());
        assertTrue(decision.reasons().get(0).contains("Accuracy below minimum"));
        assertTrue(decision.reasons().get(0).contains("delta"));
    }

    @Test
    void shouldAllowLatencyAndErrorRateAtThresholds() {
        EnvironmentPolicy tolerant = new EnvironmentPolicy("staging", 0.85, 1000, 0.05, false);

        assertEquals(GateDecision.Decision.ALLOW, evaluator.evaluate(report(true, 0.9, 1000, 0.05), tolerant, ApprovalState.NONE).decision());
        assertEquals(GateDecision.Decision.BLOCK, evaluator.evaluate(report(true, 0.9, 1000.01, 0.05), tolerant, ApprovalState.NONE).decision());
        assertEquals(GateDecision.Decision.BLOCK, evaluator.evaluate(report(true, 0.9, 1000, 0.0501), tolerant, ApprovalState.NONE).decision());
    }

    @Test
    void shouldBlockFailedReportBeforeLookingAtMetrics() {
        GateDecision decision = evaluator.evaluate(report(false, 0.99, 10, 0.0), production, ApprovalState.APPROVED);

        assertEquals(GateDecision.Decision.BLOCK, decision.decision());
        assertTrue(decision.reasons().stream().anyMatch(reason -> reason.contains("Check latency failed")));
    }

    @Test
    void shouldRequireApprovalRegardlessOfMetrics() {
        GateDecision decision = evaluator.evaluate(report(true, 1.0, 1, 0.0), production, ApprovalState.NONE);

        assertEquals(GateDecision.Decision.NEEDS_APPROVAL, decision.decision());
    }

    @Test
    void shouldAllowOnceApprovalIsRecorded() {
        GateDecision decision = evaluator.evaluate(report(true, 0.9, 200, 0.0), production, ApprovalState.APPROVED);

        assertEquals(GateDecision.Decision.ALLOW, decision.decision());
    }

    @Test
    void shouldReportEveryViolatedThreshold() {
        GateDecision decision = evaluator.evaluate(report(true, 0.5, 5000, 0.2), production, ApprovalState.NONE);

        assertEquals(GateDecision.Decision.BLOCK, decision.decision());
        assertEquals(3, decision.reasons().size());
    }

    @Test
    void shouldWarnOnSlowMeanLatencyWithoutBlocking() {
        EnvironmentPolicy relaxed = new EnvironmentPolicy("staging", 0.85, 2000, 0.0, false, 1000);

        GateDecision decision = evaluator.evaluate(report(true, 0.9, 1800, 0.0, 1200), relaxed, ApprovalState.NONE);

        assertEquals(GateDecision.Decision.ALLOW, decision.decision());
        assertEquals(1, decision.warnings().size());
        assertTrue(decision.warnings().get(0).contains("High average latency"));
        assertTrue(decision.summary().contains("warnings"));
    }

    @Test
    void shouldNotWarnAtLatencyWarningThreshold() {
        EnvironmentPolicy relaxed = new EnvironmentPolicy("production", 0.85, 2000, 0.0, true, 1000);

        GateDecision decision = evaluator.evaluate(report(true, 0.9, 1500, 0.0, 1000), relaxed, ApprovalState.NONE);

        assertEquals(GateDecision.Decision.NEEDS_APPROVAL, decision.decision());
        assertTrue(decision.warnings().isEmpty());
    }

    @Test
    void shouldReturnIdenticalDecisionsForIdenticalInputs() {
        ValidationReport report = report(true, 0.85, 1000, 0.0);
        for (EnvironmentPolicy policy : List.of(staging, production)) {
            for (ApprovalState approval : ApprovalState.values()) {
                GateDecision first = evaluator.evaluate(report, policy, approval);
                for (int i = 0; i < 20; i++) {
                    assertEquals(first, evaluator.evaluate(report, policy, approval));
                }
            }
        }
    }

    private static ValidationReport report(boolean passed, double accuracy, double p95, double errorRate) {
        return report(passed, accuracy, p95, errorRate, p95 / 2);
    }

    private static ValidationReport report(boolean passed, double accuracy, double p95, double errorRate, double meanLatency) {
        List<CheckResult> checks = List.of(
                new CheckResult("functional", CheckType.FUNCTIONAL, true, 4, 0, "ok"),
                new CheckResult("latency", CheckType.LATENCY, passed, 12, 0, passed ? "ok" : "p95 too high"));
        return new ValidationReport(
                "suite",
                "staging-endpoint",
                passed,
                new ValidationMetrics(p95 / 2, p95, p95, meanLatency, accuracy, errorRate, 16),
                checks,
                NOW,
                NOW);
    }
}
