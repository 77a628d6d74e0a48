package com.mlpromote.promotion;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import com.mlpromote.environment.Environment;
import com.mlpromote.registry.ArtifactVersion;
import com.mlpromote.serving.EndpointStatus;
import com.mlpromote.serving.ServingConfiguration;
import com.mlpromote.serving.ServingEndpointHandle;
import com.mlpromote.serving.ServingResourceManager;
import com.mlpromote.serving.TransientResourceException;

/**
 * In-memory serving backend whose failures and statuses are set up by each test.
 */
class ScriptedServingResourceManager implements ServingResourceManager {
    final AtomicInteger deployCalls = new AtomicInteger();
    final AtomicInteger restoreCalls = new AtomicInteger();
    final AtomicInteger statusCalls = new AtomicInteger();

    private final Deque<RuntimeException> deployFailures = new ArrayDeque<>();
    private final Deque<RuntimeException> statusFailures = new ArrayDeque<>();
    private final Map<String, String> activeConfiguration = new HashMap<>();
    private final Map<String, String> artifactByConfiguration = new HashMap<>();
    private final Set<String> deleted = new HashSet<>();
    private final Set<String> restored = new HashSet<>();
    private final Map<String, CountDownLatch> statusGates = new ConcurrentHashMap<>();
    private final Map<String, CountDownLatch> deleteGates = new ConcurrentHashMap<>();
    private int sequence;

    private volatile CountDownLatch deployGate;
    private volatile EndpointStatus candidateStatus = EndpointStatus.IN_SERVICE;
    private volatile EndpointStatus restoredStatus = EndpointStatus.IN_SERVICE;
    private volatile RuntimeException restoreFailure;

    synchronized ScriptedServingResourceManager failDeploy(RuntimeException failure) {
        deployFailures.add(failure);
        return this;
    }

    synchronized ScriptedServingResourceManager failStatus(RuntimeException failure) {
        statusFailures.add(failure);
        return this;
    }

    ScriptedServingResourceManager blockDeploysUntil(CountDownLatch gate) {
        this.deployGate = gate;
        return this;
    }

    /** Status calls for {@code environment} block until {@code gate} opens. */
    ScriptedServingResourceManager hangStatus(String environment, CountDownLatch gate) {
        statusGates.put(environment, gate);
        return this;
    }

    ScriptedServingResourceManager hangDelete(String environment, CountDownLatch gate) {
        deleteGates.put(environment, gate);
        return this;
    }

    ScriptedServingResourceManager candidateStatus(EndpointStatus status) {
        this.candidateStatus = status;
        return this;
    }

    ScriptedServingResourceManager restoredStatus(EndpointStatus status) {
        this.restoredStatus = status;
        return this;
    }

    ScriptedServingResourceManager failRestore(RuntimeException failure) {
        this.restoreFailure = failure;
        return this;
    }

    @Override
    public ServingEndpointHandle deploy(ArtifactVersion artifact, Environment environment) {
        deployCalls.incrementAndGet();
        await(deployGate, "deploy");
        synchronized (this) {
            RuntimeException failure = deployFailures.poll();
            if (failure != null) {
                throw failure;
            }
            String endpointName = environment.name() + "-endpoint";
            String configurationId = endpointName + "-config-" + (++sequence);
            activeConfiguration.put(endpointName, configurationId);
            artifactByConfiguration.put(configurationId, artifact.id());
            return new ServingEndpointHandle(
                    endpointName, environment.name(), configurationId, artifact.id(), environment.endpointUrl(), EndpointStatus.CREATING);
        }
    }

    @Override
    public EndpointStatus getStatus(ServingEndpointHandle handle) {
        statusCalls.incrementAndGet();
        await(statusGates.get(handle.environment()), "status");
        synchronized (this) {
            RuntimeException failure = statusFailures.poll();
            if (failure != null) {
                throw failure;
            }
            if (deleted.contains(handle.configurationId())) {
                return EndpointStatus.DELETED;
            }
            return restored.contains(handle.configurationId()) ? restoredStatus : candidateStatus;
        }
    }

    @Override
    public ServingEndpointHandle restore(Environment environment, ServingConfiguration priorConfiguration) {
        restoreCalls.incrementAndGet();
        RuntimeException failure = restoreFailure;
        if (failure != null) {
            throw failure;
        }
        synchronized (this) {
            activeConfiguration.put(priorConfiguration.endpointName(), priorConfiguration.configurationId());
            restored.add(priorConfiguration.configurationId());
            deleted.remove(priorConfiguration.configurationId());
            return new ServingEndpointHandle(
                    priorConfiguration.endpointName(),
                    environment.name(),
                    priorConfiguration.configurationId(),
                    priorConfiguration.artifactVersionId(),
                    environment.endpointUrl(),
                    EndpointStatus.UPDATING);
        }
    }

    @Override
    public void delete(ServingEndpointHandle handle) {
        await(deleteGates.get(handle.environment()), "delete");
        synchronized (this) {
            deleted.add(handle.configurationId());
            activeConfiguration.remove(handle.endpointName(), handle.configurationId());
        }
    }

    private static void await(CountDownLatch gate, String call) {
        if (gate == null) {
            return;
        }
        try {
            gate.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientResourceException(call + " interrupted", e);
        }
    }

    synchronized Optional<String> activeConfiguration(String environment) {
        return Optional.ofNullable(activeConfiguration.get(environment + "-endpoint"));
    }

    synchronized Optional<String> activeArtifact(String environment) {
        return activeConfiguration(environment).map(artifactByConfiguration::get);
    }

    synchronized boolean isDeleted(String configurationId) {
        return deleted.contains(configurationId);
    }
}
