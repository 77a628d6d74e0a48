package com.mlpromote.registry;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

public record ArtifactVersion(
        String id,
        String group,
        Map<String, Double> sourceMetrics,
        Instant createdAt,
        ApprovalStatus approvalStatus) {

    public ArtifactVersion {
        Objects.requireNonNull(id, "id");
        group = group == null || group.isBlank() ? "default" : group;
        sourceMetrics = sourceMetrics == null ? Map.of() : Map.copyOf(sourceMetrics);
        approvalStatus = approvalStatus == null ? ApprovalStatus.PENDING : approvalStatus;
    }

    public ArtifactVersion withApprovalStatus(ApprovalStatus status) {
        return new ArtifactVersion(id, group, sourceMetrics, createdAt, status);
    }

    public OptionalDouble metric(String name) {
        Double value = sourceMetrics.get(name);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
}
