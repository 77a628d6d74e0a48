package com.mlpromote.environment;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.mlpromote.gate.EnvironmentPolicy;
import com.mlpromote.runtime.AppConfig;

/**
 * Immutable set of deployment targets, built once from configuration at process start.
 */
public final class EnvironmentCatalog {
    private final Map<String, Environment> environments;

    private EnvironmentCatalog(Map<String, Environment> environments) {
        this.environments = environments;
    }

    public static EnvironmentCatalog of(Collection<Environment> environments) {
        Map<String, Environment> byName = new LinkedHashMap<>();
        for (Environment environment : environments) {
            if (byName.putIfAbsent(environment.name(), environment) != null) {
                throw new IllegalArgumentException("Duplicate environment: " + environment.name());
            }
        }
        validateChain(byName);
        return new EnvironmentCatalog(Collections.unmodifiableMap(byName));
    }

    public static EnvironmentCatalog fromConfig(AppConfig config) {
        if (config.getEnvironments().isEmpty()) {
            throw new IllegalArgumentException("At least one environment must be configured");
        }
        AppConfig.OrchestratorConfig orchestrator = config.getOrchestrator();
        List<Environment> environments = config.getEnvironments().entrySet().stream()
                .map(entry -> toEnvironment(entry.getKey(), entry.getValue(), orchestrator))
                .toList();
        return of(environments);
    }

    public Environment get(String name) {
        Environment environment = environments.get(name);
        if (environment == null) {
            throw new IllegalArgumentException("Unknown environment: " + name);
        }
        return environment;
    }

    public Optional<Environment> find(String name) {
        return Optional.ofNullable(environments.get(name));
    }

    public Collection<Environment> all() {
        return environments.values();
    }

    public Set<String> names() {
        return environments.keySet();
    }

    /**
     * Ready budget for a resource profile when the environment does not configure one:
     * larger instances and bigger initial pools get proportionally longer.
     */
    public static Duration defaultReadyTimeout(ResourceProfile profile, AppConfig.OrchestratorConfig orchestrator) {
        long millis = orchestrator.getBaseReadyTimeoutMs() * profile.sizeFactor()
                + orchestrator.getPerReplicaReadyTimeoutMs() * (profile.initialReplicas() - 1L);
        return Duration.ofMillis(millis);
    }

    private static Environment toEnvironment(String name, AppConfig.EnvironmentConfig config, AppConfig.OrchestratorConfig orchestrator) {
        AppConfig.AutoscalingConfig autoscaling = config.getAutoscaling();
        AppConfig.MonitoringConfig monitoring = config.getMonitoring();
        ResourceProfile profile = new ResourceProfile(
                config.getInstanceClass(),
                config.getInitialReplicas(),
                config.getMinReplicas(),
                config.getMaxReplicas(),
                new AutoscalingPolicy(
                        autoscaling.isEnabled(),
                        autoscaling.getTargetInvocationsPerInstance(),
                        autoscaling.getScaleInCooldownSeconds(),
                        autoscaling.getScaleOutCooldownSeconds()),
                new MonitoringPolicy(
                        monitoring.isEnabled(),
                        monitoring.getDataCaptureSamplingPercent(),
                        monitoring.getScheduleIntervalMinutes()));

        AppConfig.GateConfig gate = config.getGate();
        EnvironmentPolicy policy = new EnvironmentPolicy(
                name,
                gate.getMinAccuracy(),
                gate.getMaxLatencyMs(),
                gate.getMaxErrorRate(),
                config.isRequiresHumanApproval(),
                gate.getLatencyWarningMs());

        StateTimeouts timeouts = new StateTimeouts(
                millis(config.getDeployTimeoutMs(), orchestrator.getDeployTimeoutMs()),
                config.getReadyTimeoutMs() != null
                        ? Duration.ofMillis(config.getReadyTimeoutMs())
                        : defaultReadyTimeout(profile, orchestrator),
                millis(config.getValidationTimeoutMs(), orchestrator.getValidationTimeoutMs()),
                millis(config.getApprovalTimeoutMs(), orchestrator.getApprovalTimeoutMs()),
                Duration.ofMillis(orchestrator.getRollbackTimeoutMs()));

        Path suitePath = config.getSuitePath() == null || config.getSuitePath().isBlank()
                ? null
                : Path.of(config.getSuitePath());
        return new Environment(name, profile, policy, config.getPromotesTo(), config.getEndpointUrl(), suitePath, timeouts);
    }

    private static Duration millis(Long override, long fallback) {
        return Duration.ofMillis(override != null ? override : fallback);
    }

    private static void validateChain(Map<String, Environment> byName) {
        for (Environment environment : byName.values()) {
            Set<String> seen = new HashSet<>();
            seen.add(environment.name());
            String next = environment.promotesTo();
            while (next != null) {
                Environment target = byName.get(next);
                if (target == null) {
                    throw new IllegalArgumentException("Environment " + environment.name() + " promotes to unknown environment " + next);
                }
                if (!seen.add(next)) {
                    throw new IllegalArgumentException("Promotion chain starting at " + environment.name() + " contains a cycle");
                }
                next = target.promotesTo();
            }
        }
    }
}
