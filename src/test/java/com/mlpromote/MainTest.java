package com.mlpromote;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mlpromote.promotion.LastKnownGoodStore;
import com.mlpromote.promotion.PromotionHistoryLog;
import com.mlpromote.promotion.PromotionState;
import com.mlpromote.promotion.RunSnapshot;
import com.mlpromote.registry.ApprovalStatus;
import com.mlpromote.registry.FileArtifactRegistry;

import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    @TempDir
    Path tempDir;

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return new MockResponse().setResponseCode(200).setBody("0\n");
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldListConfiguredEnvironments() throws IOException {
        int exitCode = new CommandLine(new Main()).execute("--mode", "environments", "--config", writeConfig().toString());

        assertEquals(0, exitCode);
    }

    @Test
    void shouldFailWithoutEnvironments() {
        int exitCode = new CommandLine(new Main()).execute("--mode", "environments", "--config", tempDir.resolve("missing.yml").toString());

        assertEquals(2, exitCode);
    }

    @Test
    void shouldRequireArtifactAndEnvironmentForPromotion() throws IOException {
        int exitCode = new CommandLine(new Main()).execute("--mode", "promote", "--config", writeConfig().toString());

        assertEquals(2, exitCode);
    }

    @Test
    void shouldRegisterApproveAndFindLatestArtifact() throws IOException {
        String config = writeConfig().toString();

        assertEquals(0, new CommandLine(new Main()).execute(
                "--mode", "register", "--config", config, "--artifact", "v1", "--group", "iris", "--metric", "accuracy=0.91"));
        assertEquals(1, new CommandLine(new Main()).execute(
                "--mode", "register", "--config", config, "--artifact", "v1", "--group", "iris"));
        assertEquals(1, new CommandLine(new Main()).execute(
                "--mode", "latest", "--config", config, "--group", "iris"));
        assertEquals(1, new CommandLine(new Main()).execute(
                "--mode", "approve", "--config", config, "--artifact", "v1", "--min-accuracy", "0.95"));
        assertEquals(0, new CommandLine(new Main()).execute(
                "--mode", "approve", "--config", config, "--artifact", "v1", "--min-accuracy", "0.9"));
        assertEquals(0, new CommandLine(new Main()).execute(
                "--mode", "latest", "--config", config, "--group", "iris"));

        FileArtifactRegistry registry = new FileArtifactRegistry(tempDir.resolve("registry.json"));
        assertEquals(ApprovalStatus.APPROVED, registry.getArtifact("v1").approvalStatus());
    }

    @Test
    void shouldValidateEnvironmentEndpoint() throws IOException {
        int exitCode = new CommandLine(new Main()).execute(
                "--mode", "validate", "--config", writeConfig().toString(), "--environment", "dev", "--artifact", "v1");

        assertEquals(0, exitCode);
        try (var reports = Files.list(tempDir.resolve("reports"))) {
            assertTrue(reports.findAny().isPresent());
        }
    }

    @Test
    void shouldPromoteRegisteredArtifactEndToEnd() throws IOException {
        String config = writeConfig().toString();
        assertEquals(0, new CommandLine(new Main()).execute(
                "--mode", "register", "--config", config, "--artifact", "v1", "--metric", "accuracy=0.91"));

        int exitCode = new CommandLine(new Main()).execute(
                "--mode", "promote", "--config", config, "--artifact", "v1", "--environment", "dev", "--requested-by", "tester");

        assertEquals(0, exitCode);
        List<RunSnapshot> history = new PromotionHistoryLog(tempDir.resolve("history.jsonl")).readAll();
        assertEquals(1, history.size());
        assertEquals(PromotionState.PROMOTED, history.get(0).state());
        assertEquals("tester", history.get(0).request().requestedBy());
        assertEquals("v1", new LastKnownGoodStore(tempDir.resolve("lkg.json")).get("dev").orElseThrow().artifactVersionId());
        assertEquals(ApprovalStatus.APPROVED, new FileArtifactRegistry(tempDir.resolve("registry.json")).getArtifact("v1").approvalStatus());
        assertTrue(Files.readString(tempDir.resolve("events.jsonl")).contains("PROMOTION_SUCCEEDED"));
    }

    @Test
    void shouldRejectPromotionToUnknownEnvironment() throws IOException {
        String config = writeConfig().toString();
        new CommandLine(new Main()).execute("--mode", "register", "--config", config, "--artifact", "v1");

        int exitCode = new CommandLine(new Main()).execute(
                "--mode", "promote", "--config", config, "--artifact", "v1", "--environment", "qa");

        assertEquals(2, exitCode);
    }

    private Path writeConfig() throws IOException {
        Path suitePath = tempDir.resolve("suite.json");
        Files.writeString(suitePath, """
                {
                  "name": "smoke",
                  "checks": [
                    { "id": "functional", "type": "FUNCTIONAL", "repetitions": 1 },
                    { "id": "accuracy", "type": "ACCURACY", "repetitions": 1, "minAccuracy": 0.5 }
                  ],
                  "samples": [
                    { "input": "5.1,3.5,1.4,0.2", "expected": "0" },
                    { "input": "4.9,3.0,1.4,0.2", "expected": "0" }
                  ]
                }
                """);
        Path configPath = tempDir.resolve("application.yml");
        Files.writeString(configPath, """
                orchestrator:
                  pollIntervalMs: 20
                  deployTimeoutMs: 5000
                  validationTimeoutMs: 10000
                  rollbackTimeoutMs: 5000
                  historyPath: %s
                  eventLogPath: %s
                  lastKnownGoodPath: %s
                  reportDirectory: %s
                  retry:
                    maxAttempts: 1
                registry:
                  path: %s
                serving:
                  localReadyDelayMs: 0
                validation:
                  connectTimeoutMs: 2000
                  readTimeoutMs: 2000
                environments:
                  dev:
                    endpointUrl: %s
                    suitePath: %s
                    readyTimeoutMs: 5000
                    gate:
                      minAccuracy: 0.8
                      maxLatencyMs: 5000
                      maxErrorRate: 0.0
                """.formatted(
                yamlPath(tempDir.resolve("history.jsonl")),
                yamlPath(tempDir.resolve("events.jsonl")),
                yamlPath(tempDir.resolve("lkg.json")),
                yamlPath(tempDir.resolve("reports")),
                yamlPath(tempDir.resolve("registry.json")),
                server.url("/invocations"),
                yamlPath(suitePath)));
        return configPath;
    }

    private static String yamlPath(Path path) {
        return path.toString().replace('\\', '/');
    }
}
