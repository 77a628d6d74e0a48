package com.mlpromote.serving;

import java.time.Instant;

import com.mlpromote.environment.ResourceProfile;

/**
 * Serving setup of an environment at the moment a promotion succeeded; what a rollback restores.
 */
public record ServingConfiguration(
        String environment,
        String endpointName,
        String configurationId,
        String artifactVersionId,
        ResourceProfile resourceProfile,
        Instant recordedAt) {

    public static ServingConfiguration of(ServingEndpointHandle handle, ResourceProfile profile, Instant recordedAt) {
        return new ServingConfiguration(
                handle.environment(),
                handle.endpointName(),
                handle.configurationId(),
                handle.artifactVersionId(),
                profile,
                recordedAt);
    }
}
