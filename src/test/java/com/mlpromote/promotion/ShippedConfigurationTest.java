package com.mlpromote.promotion;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mlpromote.environment.EnvironmentCatalog;
import com.mlpromote.gate.GateEvaluator;
import com.mlpromote.registry.ApprovalStatus;
import com.mlpromote.registry.ArtifactVersion;
import com.mlpromote.registry.FileArtifactRegistry;
import com.mlpromote.runtime.AppConfig;
import com.mlpromote.runtime.AppConfigLoader;
import com.mlpromote.validation.InvocationResult;
import com.mlpromote.validation.ValidationReportWriter;
import com.mlpromote.validation.ValidationSuite;
import com.mlpromote.validation.Validator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs a promotion through the environments, gates and default suite that ship in
 * {@code application.yml}.
 */
class ShippedConfigurationTest {
    private static final Duration WAIT = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    private AppConfig config;
    private ScriptedServingResourceManager serving;
    private FileArtifactRegistry registry;
    private PromotionOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws Exception {
        config = AppConfigLoader.load(Path.of(ShippedConfigurationTest.class.getResource("/application.yml").toURI()));
        EnvironmentCatalog catalog = EnvironmentCatalog.fromConfig(config);

        registry = new FileArtifactRegistry(tempDir.resolve("registry.json"));
        registry.register(new ArtifactVersion(
                "iris-v1", "iris", Map.of("accuracy", 0.97), Instant.parse("2024-05-01T10:00:00Z"), ApprovalStatus.PENDING));

        Validator validator = perfectIrisValidator();
        serving = new ScriptedServingResourceManager();
        orchestrator = new PromotionOrchestrator(
                catalog,
                registry,
                serving,
                validator,
                new GateEvaluator(),
                new LastKnownGoodStore(tempDir.resolve("last-known-good.json")),
                new PromotionHistoryLog(tempDir.resolve("history.jsonl")),
                new ValidationReportWriter(tempDir.resolve("reports")),
                new OrchestratorSettings(
                        Duration.ofMillis(10),
                        RetryPolicy.fromConfig(config.getOrchestrator().getRetry()),
                        config.getOrchestrator().getSchedulerThreads(),
                        Duration.ofMillis(config.getOrchestrator().getStatusCallTimeoutMs())),
                Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    @Test
    void shouldShipEnvironmentsWithoutSuitePath() {
        assertTrue(config.getEnvironments().values().stream().allMatch(environment -> environment.getSuitePath() == null));
        assertTrue(config.getEnvironments().get("production").getMonitoring().isEnabled());
    }

    @Test
    void shouldPromoteThroughStagingIntoProductionWithShippedDefaults() throws Exception {
        PromotionRun run = orchestrator.submit(
                new PromotionRequest("iris-v1", "staging", "ci", PromotionRequest.Trigger.BUILD, Instant.now()));

        RunSnapshot pending = orchestrator.awaitTermination(run.id(), WAIT);
        assertEquals(PromotionState.AWAITING_APPROVAL, pending.state(), pending.detail());
        assertEquals("default-endpoint-suite", pending.latestReport().suiteName());
        assertTrue(pending.latestReport().passed());
        assertEquals(1.0, pending.latestReport().metrics().accuracy(), 1e-9);

        orchestrator.approve(run.id(), "release-manager");
        RunSnapshot result = orchestrator.awaitTermination(run.id(), WAIT);

        assertEquals(PromotionState.PROMOTED, result.state(), result.detail());
        assertEquals("production", result.currentEnvironment());
        assertEquals("iris-v1", orchestrator.lastKnownGood("production").orElseThrow().artifactVersionId());
        assertTrue(orchestrator.lastKnownGood("production").orElseThrow().resourceProfile().monitoring().enabled());
        assertFalse(orchestrator.lastKnownGood("staging").isPresent());
        assertNull(catalogSuitePath("production"));
        assertEquals(ApprovalStatus.APPROVED, registry.getArtifact("iris-v1").approvalStatus());
    }

    private Path catalogSuitePath(String environment) {
        return EnvironmentCatalog.fromConfig(config).get(environment).suitePath();
    }

    private static Validator perfectIrisValidator() throws Exception {
        ValidationSuite shipped = new Validator((endpoint, payload) -> new InvocationResult("", 0.0)).loadDefaultSuite();
        Map<String, String> answers = shipped.samples().stream()
                .collect(Collectors.toMap(ValidationSuite.Sample::input, ValidationSuite.Sample::expected, (a, b) -> a));
        return new Validator((endpoint, payload) -> new InvocationResult(answers.get(payload), 5.0));
    }
}
