package com.mlpromote.environment;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

import com.mlpromote.gate.EnvironmentPolicy;

public record Environment(
        String name,
        ResourceProfile resourceProfile,
        EnvironmentPolicy policy,
        String promotesTo,
        String endpointUrl,
        Path suitePath,
        StateTimeouts timeouts) {

    public Environment {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(resourceProfile, "resourceProfile");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(timeouts, "timeouts");
        promotesTo = promotesTo == null || promotesTo.isBlank() ? null : promotesTo;
    }

    public boolean requiresHumanApproval() {
        return policy.requiresHumanApproval();
    }

    public Optional<String> nextEnvironment() {
        return Optional.ofNullable(promotesTo);
    }
}
