package com.mlpromote.registry;

import java.io.IOException;
import java.util.Locale;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Marks a pending artifact as approved when one of its offline metrics meets a threshold.
 * Artifacts below the threshold keep their status.
 */
public class ArtifactApprover {
    private static final Logger log = LoggerFactory.getLogger(ArtifactApprover.class);

    private final ArtifactRegistry registry;

    public ArtifactApprover(ArtifactRegistry registry) {
        this.registry = registry;
    }

    public ApprovalResult approveIfQualified(String artifactId, String metricName, double minValue) throws IOException {
        ArtifactVersion artifact = registry.getArtifact(artifactId);
        if (artifact.approvalStatus() == ApprovalStatus.APPROVED) {
            return new ApprovalResult(true, "Artifact " + artifactId + " is already approved");
        }
        OptionalDouble value = artifact.metric(metricName);
        if (value.isEmpty()) {
            return new ApprovalResult(false, "Artifact " + artifactId + " has no metric " + metricName);
        }
        if (value.getAsDouble() < minValue) {
            return new ApprovalResult(false, String.format(Locale.ROOT,
                    "%s %.4f is below required minimum %.4f", metricName, value.getAsDouble(), minValue));
        }
        registry.setApprovalStatus(artifactId, ApprovalStatus.APPROVED);
        log.info("registry.approve artifact={} {}={} min={}", artifactId, metricName, value.getAsDouble(), minValue);
        return new ApprovalResult(true, String.format(Locale.ROOT,
                "Approved: %s %.4f >= %.4f", metricName, value.getAsDouble(), minValue));
    }

    public record ApprovalResult(boolean approved, String detail) {
    }
}
