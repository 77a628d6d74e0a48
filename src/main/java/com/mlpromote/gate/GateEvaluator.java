package com.mlpromote.gate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.mlpromote.validation.ValidationMetrics;
import com.mlpromote.validation.ValidationReport;

/**
 * Decides whether a validated deployment may proceed. Rules apply in order: a failed report
 * blocks, then any violated threshold blocks, then a missing human approval waits, otherwise the
 * promotion is allowed. Values equal to a threshold pass. A slow mean latency is reported as a
 * warning on passing decisions.
 */
public class GateEvaluator {

    public GateDecision evaluate(ValidationReport report, EnvironmentPolicy policy, ApprovalState approvalState) {
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(approvalState, "approvalState");

        if (!report.passed()) {
            List<String> reasons = new ArrayList<>();
            reasons.add("Validation suite " + report.suiteName() + " did not pass");
            report.checks().stream()
                    .filter(check -> !check.passed())
                    .forEach(check -> reasons.add("Check " + check.checkId() + " failed: " + check.detail()));
            return new GateDecision(GateDecision.Decision.BLOCK, reasons);
        }

        List<String> violations = thresholdViolations(report.metrics(), policy);
        if (!violations.isEmpty()) {
            return new GateDecision(GateDecision.Decision.BLOCK, violations);
        }

        List<String> warnings = latencyWarnings(report.metrics(), policy);
        if (policy.requiresHumanApproval() && approvalState != ApprovalState.APPROVED) {
            return new GateDecision(
                    GateDecision.Decision.NEEDS_APPROVAL,
                    List.of("Environment " + policy.environment() + " requires human approval"),
                    warnings);
        }
        return new GateDecision(GateDecision.Decision.ALLOW, List.of(), warnings);
    }

    private List<String> latencyWarnings(ValidationMetrics metrics, EnvironmentPolicy policy) {
        if (metrics.meanLatencyMs() <= policy.latencyWarningMs()) {
            return List.of();
        }
        return List.of(String.format(Locale.ROOT,
                "High average latency (mean=%.2fms, warn above %.2fms)",
                metrics.meanLatencyMs(),
                policy.latencyWarningMs()));
    }

    private List<String> thresholdViolations(ValidationMetrics metrics, EnvironmentPolicy policy) {
        List<String> violations = new ArrayList<>();
        if (metrics.accuracy() < policy.minAccuracy()) {
            violations.add(String.format(Locale.ROOT,
                    "Accuracy below minimum (actual=%.4f, min=%.4f, delta=-%.4f)",
                    metrics.accuracy(),
                    policy.minAccuracy(),
                    policy.minAccuracy() - metrics.accuracy()));
        }
        if (metrics.p95LatencyMs() > policy.maxLatencyMs()) {
            violations.add(String.format(Locale.ROOT,
                    "p95 latency threshold exceeded (actual=%.2fms, max=%.2fms, delta=+%.2fms)",
                    metrics.p95LatencyMs(),
                    policy.maxLatencyMs(),
                    metrics.p95LatencyMs() - policy.maxLatencyMs()));
        }
        if (metrics.errorRate() > policy.maxErrorRate()) {
            violations.add(String.format(Locale.ROOT,
                    "Error rate threshold exceeded (actual=%.4f, max=%.4f, delta=+%.4f)",
                    metrics.errorRate(),
                    policy.maxErrorRate(),
                    metrics.errorRate() - policy.maxErrorRate()));
        }
        return violations;
    }
}
