package com.mlpromote.validation;

import java.io.IOException;

import com.mlpromote.serving.ServingEndpointHandle;

/**
 * Sends one payload to a live serving endpoint. An {@link IOException} marks a failed invocation.
 */
@FunctionalInterface
public interface EndpointInvoker {
    InvocationResult invoke(ServingEndpointHandle endpoint, String payload) throws IOException;
}
