package com.mlpromote.serving;

import com.mlpromote.environment.Environment;
import com.mlpromote.registry.ArtifactVersion;

/**
 * Creates, replaces and removes the endpoint serving an artifact in an environment.
 * Implementations report failures as {@link TransientResourceException} or
 * {@link TerminalResourceException}.
 */
public interface ServingResourceManager {

    ServingEndpointHandle deploy(ArtifactVersion artifact, Environment environment);

    EndpointStatus getStatus(ServingEndpointHandle handle);

    ServingEndpointHandle restore(Environment environment, ServingConfiguration priorConfiguration);

    void delete(ServingEndpointHandle handle);
}
