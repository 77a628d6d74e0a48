package com.mlpromote.serving;

/**
 * Reference to a deployed endpoint. {@code status} is the status observed when the handle was
 * issued; call {@link ServingResourceManager#getStatus} for the current one.
 */
public record ServingEndpointHandle(
        String endpointName,
        String environment,
        String configurationId,
        String artifactVersionId,
        String endpointUrl,
        EndpointStatus status) {
}
