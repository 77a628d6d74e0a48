package com.mlpromote.environment;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.mlpromote.gate.EnvironmentPolicy;
import com.mlpromote.runtime.AppConfig;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvironmentCatalogTest {

    @Test
    void shouldBuildEnvironmentsFromConfig() {
        AppConfig config = new AppConfig();
        AppConfig.EnvironmentConfig staging = new AppConfig.EnvironmentConfig();
        staging.setPromotesTo("production");
        staging.setRequiresHumanApproval(true);
        staging.setDeployTimeoutMs(1000L);
        AppConfig.EnvironmentConfig production = new AppConfig.EnvironmentConfig();
        production.setInstanceClass("ml.m5.4xlarge");
        production.setInitialReplicas(2);
        production.setMinReplicas(2);
        production.setReadyTimeoutMs(42L);
        production.getMonitoring().setEnabled(true);
        production.getMonitoring().setDataCaptureSamplingPercent(20);
        production.getGate().setLatencyWarningMs(250);
        config.getEnvironments().put("staging", staging);
        config.getEnvironments().put("production", production);

        EnvironmentCatalog catalog = EnvironmentCatalog.fromConfig(config);

        assertEquals(List.of("staging", "production"), List.copyOf(catalog.names()));
        Environment stagingEnv = catalog.get("staging");
        assertEquals("production", stagingEnv.nextEnvironment().orElseThrow());
        assertTrue(stagingEnv.requiresHumanApproval());
        assertEquals(Duration.ofMillis(1000), stagingEnv.timeouts().deploy());
        assertEquals(Duration.ofMillis(900000), stagingEnv.timeouts().ready());
        assertEquals(Duration.ofMillis(42), catalog.get("production").timeouts().ready());
        assertEquals(Duration.ofMillis(300000), catalog.get("production").timeouts().deploy());
        MonitoringPolicy monitoring = catalog.get("production").resourceProfile().monitoring();
        assertTrue(monitoring.enabled());
        assertEquals(20, monitoring.dataCaptureSamplingPercent());
        assertEquals(60, monitoring.scheduleIntervalMinutes());
        assertFalse(stagingEnv.resourceProfile().monitoring().enabled());
        assertEquals(250.0, catalog.get("production").policy().latencyWarningMs(), 1e-9);
        assertEquals(EnvironmentPolicy.DEFAULT_LATENCY_WARNING_MS, stagingEnv.policy().latencyWarningMs(), 1e-9);
        assertTrue(catalog.find("dev").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> catalog.get("dev"));
    }

    @Test
    void shouldScaleDefaultReadyTimeoutWithProfile() {
        AppConfig.OrchestratorConfig orchestrator = new AppConfig.OrchestratorConfig();
        orchestrator.setBaseReadyTimeoutMs(1000);
        orchestrator.setPerReplicaReadyTimeoutMs(100);

        Duration timeout = EnvironmentCatalog.defaultReadyTimeout(
                new ResourceProfile("ml.m5.4xlarge", 3, 1, 5, null, null), orchestrator);

        assertEquals(Duration.ofMillis(4200), timeout);
    }

    @Test
    void shouldLoadOversizedInstanceClassWithCappedReadyTimeout() {
        AppConfig config = new AppConfig();
        AppConfig.EnvironmentConfig huge = new AppConfig.EnvironmentConfig();
        huge.setInstanceClass("ml.m5.99999999999xlarge");
        config.getEnvironments().put("huge", huge);

        EnvironmentCatalog catalog = EnvironmentCatalog.fromConfig(config);

        assertEquals(Duration.ofMillis(900000L * ResourceProfile.MAX_SIZE_FACTOR), catalog.get("huge").timeouts().ready());
    }

    @Test
    void shouldRejectBrokenChains() {
        assertThrows(IllegalArgumentException.class,
                () -> EnvironmentCatalog.of(List.of(environment("staging", "production"))));
        assertThrows(IllegalArgumentException.class,
                () -> EnvironmentCatalog.of(List.of(environment("a", "b"), environment("b", "a"))));
        assertThrows(IllegalArgumentException.class,
                () -> EnvironmentCatalog.of(List.of(environment("a", null), environment("a", null))));
        assertThrows(IllegalArgumentException.class, () -> EnvironmentCatalog.fromConfig(new AppConfig()));
    }

    private static Environment environment(String name, String promotesTo) {
        Duration minute = Duration.ofMinutes(1);
        return new Environment(
                name,
                new ResourceProfile("ml.m5.xlarge", 1, 1, 1, null, null),
                new EnvironmentPolicy(name, 0.8, 1000, 0.0, false),
                promotesTo,
                null,
                null,
                new StateTimeouts(minute, minute, minute, minute, minute));
    }
}
