package com.mlpromote.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private OrchestratorConfig orchestrator = new OrchestratorConfig();
    private RegistryConfig registry = new RegistryConfig();
    private ValidationConfig validation = new ValidationConfig();
    private ServingConfig serving = new ServingConfig();
    private Map<String, EnvironmentConfig> environments = new LinkedHashMap<>();

    public OrchestratorConfig getOrchestrator() {
        return orchestrator;
    }

    public void setOrchestrator(OrchestratorConfig orchestrator) {
        this.orchestrator = orchestrator == null ? new OrchestratorConfig() : orchestrator;
    }

    public RegistryConfig getRegistry() {
        return registry;
    }

    public void setRegistry(RegistryConfig registry) {
        this.registry = registry == null ? new RegistryConfig() : registry;
    }

    public ValidationConfig getValidation() {
        return validation;
    }

    public void setValidation(ValidationConfig validation) {
        this.validation = validation == null ? new ValidationConfig() : validation;
    }

    public ServingConfig getServing() {
        return serving;
    }

    public void setServing(ServingConfig serving) {
        this.serving = serving == null ? new ServingConfig() : serving;
    }

    public Map<String, EnvironmentConfig> getEnvironments() {
        return environments;
    }

    public void setEnvironments(Map<String, EnvironmentConfig> environments) {
        this.environments = environments == null ? new LinkedHashMap<>() : environments;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OrchestratorConfig {
        private int schedulerThreads = 2;
        private long pollIntervalMs = 30000;
        private long statusCallTimeoutMs = 30000;
        private long deployTimeoutMs = 300000;
        private long validationTimeoutMs = 600000;
        private long approvalTimeoutMs = 86400000;
        private long rollbackTimeoutMs = 900000;
        private long baseReadyTimeoutMs = 900000;
        private long perReplicaReadyTimeoutMs = 120000;
        private RetryConfig retry = new RetryConfig();
        private String historyPath = ".mlpromote/promotion-history.jsonl";
        private String eventLogPath = ".mlpromote/promotion-events.jsonl";
        private String lastKnownGoodPath = ".mlpromote/last-known-good.json";
        private String reportDirectory = ".mlpromote/reports";

        public int getSchedulerThreads() {
            return schedulerThreads;
        }

        public void setSchedulerThreads(int schedulerThreads) {
            this.schedulerThreads = schedulerThreads;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getStatusCallTimeoutMs() {
            return statusCallTimeoutMs;
        }

        public void setStatusCallTimeoutMs(long statusCallTimeoutMs) {
            this.statusCallTimeoutMs = statusCallTimeoutMs;
        }

        public long getDeployTimeoutMs() {
            return deployTimeoutMs;
        }

        public void setDeployTimeoutMs(long deployTimeoutMs) {
            this.deployTimeoutMs = deployTimeoutMs;
        }

        public long getValidationTimeoutMs() {
            return validationTimeoutMs;
        }

        public void setValidationTimeoutMs(long validationTimeoutMs) {
            this.validationTimeoutMs = validationTimeoutMs;
        }

        public long getApprovalTimeoutMs() {
            return approvalTimeoutMs;
        }

        public void setApprovalTimeoutMs(long approvalTimeoutMs) {
            this.approvalTimeoutMs = approvalTimeoutMs;
        }

        public long getRollbackTimeoutMs() {
            return rollbackTimeoutMs;
        }

        public void setRollbackTimeoutMs(long rollbackTimeoutMs) {
            this.rollbackTimeoutMs = rollbackTimeoutMs;
        }

        public long getBaseReadyTimeoutMs() {
            return baseReadyTimeoutMs;
        }

        public void setBaseReadyTimeoutMs(long baseReadyTimeoutMs) {
            this.baseReadyTimeoutMs = baseReadyTimeoutMs;
        }

        public long getPerReplicaReadyTimeoutMs() {
            return perReplicaReadyTimeoutMs;
        }

        public void setPerReplicaReadyTimeoutMs(long perReplicaReadyTimeoutMs) {
            this.perReplicaReadyTimeoutMs = perReplicaReadyTimeoutMs;
        }

        public RetryConfig getRetry() {
            return retry;
        }

        public void setRetry(RetryConfig retry) {
            this.retry = retry == null ? new RetryConfig() : retry;
        }

        public String getHistoryPath() {
            return historyPath;
        }

        public void setHistoryPath(String historyPath) {
            this.historyPath = historyPath;
        }

        public String getEventLogPath() {
            return eventLogPath;
        }

        public void setEventLogPath(String eventLogPath) {
            this.eventLogPath = eventLogPath;
        }

        public String getLastKnownGoodPath() {
            return lastKnownGoodPath;
        }

        public void setLastKnownGoodPath(String lastKnownGoodPath) {
            this.lastKnownGoodPath = lastKnownGoodPath;
        }

        public String getReportDirectory() {
            return reportDirectory;
        }

        public void setReportDirectory(String reportDirectory) {
            this.reportDirectory = reportDirectory;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetryConfig {
        private int maxAttempts = 3;
        private long initialBackoffMs = 1000;
        private double backoffMultiplier = 2.0;
        private long maxBackoffMs = 30000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RegistryConfig {
        private String path = ".mlpromote/artifact-registry.json";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ValidationConfig {
        private long connectTimeoutMs = 5000;
        private long readTimeoutMs = 60000;
        private String contentType = "text/csv";

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public long getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(long readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }

        public String getContentType() {
            return contentType;
        }

        public void setContentType(String contentType) {
            this.contentType = contentType;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ServingConfig {
        private long localReadyDelayMs = 5000;

        public long getLocalReadyDelayMs() {
            return localReadyDelayMs;
        }

        public void setLocalReadyDelayMs(long localReadyDelayMs) {
            this.localReadyDelayMs = localReadyDelayMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EnvironmentConfig {
        private String instanceClass = "ml.m5.xlarge";
        private int initialReplicas = 1;
        private int minReplicas = 1;
        private int maxReplicas = 10;
        private AutoscalingConfig autoscaling = new AutoscalingConfig();
        private MonitoringConfig monitoring = new MonitoringConfig();
        private GateConfig gate = new GateConfig();
        private boolean requiresHumanApproval = false;
        private String promotesTo;
        private String endpointUrl;
        private String suitePath;
        private Long readyTimeoutMs;
        private Long deployTimeoutMs;
        private Long validationTimeoutMs;
        private Long approvalTimeoutMs;

        public String getInstanceClass() {
            return instanceClass;
        }

        public void setInstanceClass(String instanceClass) {
            this.instanceClass = instanceClass;
        }

        public int getInitialReplicas() {
            return initialReplicas;
        }

        public void setInitialReplicas(int initialReplicas) {
            this.initialReplicas = initialReplicas;
        }

        public int getMinReplicas() {
            return minReplicas;
        }

        public void setMinReplicas(int minReplicas) {
            this.minReplicas = minReplicas;
        }

        public int getMaxReplicas() {
            return maxReplicas;
        }

        public void setMaxReplicas(int maxReplicas) {
            this.maxReplicas = maxReplicas;
        }

        public AutoscalingConfig getAutoscaling() {
            return autoscaling;
        }

        public void setAutoscaling(AutoscalingConfig autoscaling) {
            this.autoscaling = autoscaling == null ? new AutoscalingConfig() : autoscaling;
        }

        public MonitoringConfig getMonitoring() {
            return monitoring;
        }

        public void setMonitoring(MonitoringConfig monitoring) {
            this.monitoring = monitoring == null ? new MonitoringConfig() : monitoring;
        }

        public GateConfig getGate() {
            return gate;
        }

        public void setGate(GateConfig gate) {
            this.gate = gate == null ? new GateConfig() : gate;
        }

        public boolean isRequiresHumanApproval() {
            return requiresHumanApproval;
        }

        public void setRequiresHumanApproval(boolean requiresHumanApproval) {
            this.requiresHumanApproval = requiresHumanApproval;
        }

        public String getPromotesTo() {
            return promotesTo;
        }

        public void setPromotesTo(String promotesTo) {
            this.promotesTo = promotesTo;
        }

        public String getEndpointUrl() {
            return endpointUrl;
        }

        public void setEndpointUrl(String endpointUrl) {
            this.endpointUrl = endpointUrl;
        }

        public String getSuitePath() {
            return suitePath;
        }

        public void setSuitePath(String suitePath) {
            this.suitePath = suitePath;
        }

        public Long getReadyTimeoutMs() {
            return readyTimeoutMs;
        }

        public void setReadyTimeoutMs(Long readyTimeoutMs) {
            this.readyTimeoutMs = readyTimeoutMs;
        }

        public Long getDeployTimeoutMs() {
            return deployTimeoutMs;
        }

        public void setDeployTimeoutMs(Long deployTimeoutMs) {
            this.deployTimeoutMs = deployTimeoutMs;
        }

        public Long getValidationTimeoutMs() {
            return validationTimeoutMs;
        }

        public void setValidationTimeoutMs(Long validationTimeoutMs) {
            this.validationTimeoutMs = validationTimeoutMs;
        }

        public Long getApprovalTimeoutMs() {
            return approvalTimeoutMs;
        }

        public void setApprovalTimeoutMs(Long approvalTimeoutMs) {
            this.approvalTimeoutMs = approvalTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AutoscalingConfig {
        private boolean enabled = false;
        private double targetInvocationsPerInstance = 70.0;
        private int scaleInCooldownSeconds = 300;
        private int scaleOutCooldownSeconds = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getTargetInvocationsPerInstance() {
            return targetInvocationsPerInstance;
        }

        public void setTargetInvocationsPerInstance(double targetInvocationsPerInstance) {
            this.targetInvocationsPerInstance = targetInvocationsPerInstance;
        }

        public int getScaleInCooldownSeconds() {
            return scaleInCooldownSeconds;
        }

        public void setScaleInCooldownSeconds(int scaleInCooldownSeconds) {
            this.scaleInCooldownSeconds = scaleInCooldownSeconds;
        }

        public int getScaleOutCooldownSeconds() {
            return scaleOutCooldownSeconds;
        }

        public void setScaleOutCooldownSeconds(int scaleOutCooldownSeconds) {
            this.scaleOutCooldownSeconds = scaleOutCooldownSeconds;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MonitoringConfig {
        private boolean enabled = false;
        private int dataCaptureSamplingPercent = 100;
        private long scheduleIntervalMinutes = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getDataCaptureSamplingPercent() {
            return dataCaptureSamplingPercent;
        }

        public void setDataCaptureSamplingPercent(int dataCaptureSamplingPercent) {
            this.dataCaptureSamplingPercent = dataCaptureSamplingPercent;
        }

        public long getScheduleIntervalMinutes() {
            return scheduleIntervalMinutes;
        }

        public void setScheduleIntervalMinutes(long scheduleIntervalMinutes) {
            this.scheduleIntervalMinutes = scheduleIntervalMinutes;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GateConfig {
        private double minAccuracy = 0.85;
        private double maxLatencyMs = 1000;
        private double maxErrorRate = 0.0;
        private double latencyWarningMs = 1000;

        public double getMinAccuracy() {
            return minAccuracy;
        }

        public void setMinAccuracy(double minAccuracy) {
            this.minAccuracy = minAccuracy;
        }

        public double getMaxLatencyMs() {
            return maxLatencyMs;
        }

        public void setMaxLatencyMs(double maxLatencyMs) {
            this.maxLatencyMs = maxLatencyMs;
        }

        public double getMaxErrorRate() {
            return maxErrorRate;
        }

        public void setMaxErrorRate(double maxErrorRate) {
            this.maxErrorRate = maxErrorRate;
        }

        public double getLatencyWarningMs() {
            return latencyWarningMs;
        }

        public void setLatencyWarningMs(double latencyWarningMs) {
            this.latencyWarningMs = latencyWarningMs;
        }
    }
}
