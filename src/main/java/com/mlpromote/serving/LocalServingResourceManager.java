package com.mlpromote.serving;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mlpromote.environment.Environment;
import com.mlpromote.environment.MonitoringPolicy;
import com.mlpromote.registry.ArtifactVersion;

/**
 * Serving backend for local runs: one endpoint per environment, answered by whatever model
 * server listens on the environment's endpoint URL. A configuration turns in service once the
 * ready delay has elapsed. Endpoints of environments with monitoring enabled keep a data capture
 * and monitoring schedule for as long as a configuration is active.
 */
public class LocalServingResourceManager implements ServingResourceManager {
    private static final Logger log = LoggerFactory.getLogger(LocalServingResourceManager.class);

    private final Clock clock;
    private final Duration readyDelay;
    private final AtomicLong configurationSequence = new AtomicLong();
    private final Map<String, Deployment> deployments = new HashMap<>();
    private final Map<String, String> activeConfigurationByEndpoint = new HashMap<>();
    private final Map<String, MonitoringPolicy> monitoringByEndpoint = new HashMap<>();

    public LocalServingResourceManager(Duration readyDelay) {
        this(Clock.systemUTC(), readyDelay);
    }

    public LocalServingResourceManager(Clock clock, Duration readyDelay) {
        this.clock = clock;
        this.readyDelay = readyDelay;
    }

    @Override
    public synchronized ServingEndpointHandle deploy(ArtifactVersion artifact, Environment environment) {
        if (environment.endpointUrl() == null || environment.endpointUrl().isBlank()) {
            throw new TerminalResourceException("Environment " + environment.name() + " has no endpointUrl configured");
        }
        String endpointName = endpointName(environment);
        String configurationId = endpointName + "-config-" + clock.millis() + "-" + configurationSequence.incrementAndGet();
        EndpointStatus initial = activeConfigurationByEndpoint.containsKey(endpointName)
                ? EndpointStatus.UPDATING
                : EndpointStatus.CREATING;
        ServingEndpointHandle handle = new ServingEndpointHandle(
                endpointName,
                environment.name(),
                configurationId,
                artifact.id(),
                environment.endpointUrl(),
                initial);
        deployments.put(configurationId, new Deployment(handle, clock.instant().plus(readyDelay), initial));
        activeConfigurationByEndpoint.put(endpointName, configurationId);
        log.info("local.serving.deploy endpoint={} configuration={} artifact={} instanceClass={} replicas={}",
                endpointName,
                configurationId,
                artifact.id(),
                environment.resourceProfile().instanceClass(),
                environment.resourceProfile().initialReplicas());
        scheduleMonitoring(endpointName, environment);
        return handle;
    }

    @Override
    public synchronized EndpointStatus getStatus(ServingEndpointHandle handle) {
        Deployment deployment = deployments.get(handle.configurationId());
        if (deployment == null || deployment.deleted) {
            return EndpointStatus.DELETED;
        }
        return clock.instant().isBefore(deployment.readyAt) ? deployment.pendingStatus : EndpointStatus.IN_SERVICE;
    }

    @Override
    public synchronized ServingEndpointHandle restore(Environment environment, ServingConfiguration priorConfiguration) {
        Deployment prior = deployments.get(priorConfiguration.configurationId());
        String endpointUrl = prior != null ? prior.handle.endpointUrl() : environment.endpointUrl();
        if (endpointUrl == null || endpointUrl.isBlank()) {
            throw new TerminalResourceException("Cannot restore " + priorConfiguration.configurationId() + ": no endpointUrl for " + environment.name());
        }
        ServingEndpointHandle restored = new ServingEndpointHandle(
                priorConfiguration.endpointName(),
                environment.name(),
                priorConfiguration.configurationId(),
                priorConfiguration.artifactVersionId(),
                endpointUrl,
                EndpointStatus.UPDATING);
        deployments.put(priorConfiguration.configurationId(), new Deployment(restored, clock.instant().plus(readyDelay), EndpointStatus.UPDATING));
        activeConfigurationByEndpoint.put(priorConfiguration.endpointName(), priorConfiguration.configurationId());
        log.info("local.serving.restore endpoint={} configuration={} artifact={}",
                priorConfiguration.endpointName(),
                priorConfiguration.configurationId(),
                priorConfiguration.artifactVersionId());
        scheduleMonitoring(priorConfiguration.endpointName(), environment);
        return restored;
    }

    @Override
    public synchronized void delete(ServingEndpointHandle handle) {
        Deployment deployment = deployments.get(handle.configurationId());
        if (deployment != null) {
            deployment.deleted = true;
        }
        if (activeConfigurationByEndpoint.remove(handle.endpointName(), handle.configurationId())
                && monitoringByEndpoint.remove(handle.endpointName()) != null) {
            log.info("local.serving.monitoring endpoint={} action=stopped", handle.endpointName());
        }
        log.info("local.serving.delete endpoint={} configuration={}", handle.endpointName(), handle.configurationId());
    }

    public synchronized Optional<String> activeConfiguration(String endpointName) {
        return Optional.ofNullable(activeConfigurationByEndpoint.get(endpointName));
    }

    public synchronized Optional<MonitoringPolicy> monitoring(String endpointName) {
        return Optional.ofNullable(monitoringByEndpoint.get(endpointName));
    }

    private void scheduleMonitoring(String endpointName, Environment environment) {
        MonitoringPolicy monitoring = environment.resourceProfile().monitoring();
        if (!monitoring.enabled()) {
            monitoringByEndpoint.remove(endpointName);
            return;
        }
        monitoringByEndpoint.put(endpointName, monitoring);
        log.info("local.serving.monitoring endpoint={} action=scheduled samplingPercent={} intervalMinutes={}",
                endpointName,
                monitoring.dataCaptureSamplingPercent(),
                monitoring.scheduleIntervalMinutes());
    }

    public static String endpointName(Environment environment) {
        return environment.name() + "-endpoint";
    }

    private static final class Deployment {
        private final ServingEndpointHandle handle;
        private final Instant readyAt;
        private final EndpointStatus pendingStatus;
        private boolean deleted;

        private Deployment(ServingEndpointHandle handle, Instant readyAt, EndpointStatus pendingStatus) {
            this.handle = handle;
            this.readyAt = readyAt;
            this.pendingStatus = pendingStatus;
        }
    }
}
