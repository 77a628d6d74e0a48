package com.mlpromote;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mlpromote.environment.Environment;
import com.mlpromote.environment.EnvironmentCatalog;
import com.mlpromote.gate.GateEvaluator;
import com.mlpromote.promotion.ConflictException;
import com.mlpromote.promotion.JsonLinesNotificationSink;
import com.mlpromote.promotion.LastKnownGoodStore;
import com.mlpromote.promotion.LoggingNotificationSink;
import com.mlpromote.promotion.OrchestratorSettings;
import com.mlpromote.promotion.PromotionHistoryLog;
import com.mlpromote.promotion.PromotionOrchestrator;
import com.mlpromote.promotion.PromotionRequest;
import com.mlpromote.promotion.PromotionRun;
import com.mlpromote.promotion.PromotionState;
import com.mlpromote.promotion.RunSnapshot;
import com.mlpromote.registry.ApprovalStatus;
import com.mlpromote.registry.ArtifactApprover;
import com.mlpromote.registry.ArtifactNotFoundException;
import com.mlpromote.registry.ArtifactVersion;
import com.mlpromote.registry.FileArtifactRegistry;
import com.mlpromote.runtime.AppConfig;
import com.mlpromote.runtime.AppConfigLoader;
import com.mlpromote.serving.EndpointStatus;
import com.mlpromote.serving.LocalServingResourceManager;
import com.mlpromote.serving.ServingEndpointHandle;
import com.mlpromote.validation.HttpEndpointInvoker;
import com.mlpromote.validation.ValidationReport;
import com.mlpromote.validation.ValidationReportWriter;
import com.mlpromote.validation.Validator;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "model-promoter",
        mixinStandardHelpOptions = true,
        version = "model-promoter 0.1.0",
        description = "Promotes trained model artifacts through validated, gated serving environments.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "environments")
    Mode mode;

    @Option(names = "--artifact", description = "Artifact version id")
    String artifactId;

    @Option(names = "--environment", description = "Target environment name")
    String environmentName;

    @Option(names = "--requested-by", description = "Who requested the promotion", defaultValue = "${sys:user.name}")
    String requestedBy;

    @Option(names = "--group", description = "Artifact group", defaultValue = "default")
    String group;

    @Option(names = "--metric", description = "Offline metric of a registered artifact, e.g. --metric accuracy=0.91")
    Map<String, Double> metrics = new LinkedHashMap<>();

    @Option(names = "--status", description = "Approval status for latest mode: ${COMPLETION-CANDIDATES}", defaultValue = "APPROVED")
    ApprovalStatus status;

    @Option(names = "--approval-metric", description = "Metric checked by approve mode", defaultValue = "accuracy")
    String approvalMetric;

    @Option(names = "--min-accuracy", description = "Minimum metric value for approve mode", defaultValue = "0.8")
    double minAccuracy;

    @Option(names = "--wait-timeout-minutes", description = "How long promote mode waits for a run to settle", defaultValue = "1440")
    long waitTimeoutMinutes;

    enum Mode {
        promote,
        register,
        approve,
        latest,
        validate,
        environments
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = AppConfigLoader.load(Path.of(configPath));
        log.info("Starting model-promoter in {} mode", mode);
        log.info("Using config file: {}", configPath);

        return switch (mode) {
            case promote -> runPromotion(config);
            case register -> runRegister(config);
            case approve -> runApprove(config);
            case latest -> runLatest(config);
            case validate -> runValidate(config);
            case environments -> runEnvironments(config);
        };
    }

    private int runPromotion(AppConfig config) throws IOException, InterruptedException {
        if (isBlank(artifactId) || isBlank(environmentName)) {
            log.error("--artifact and --environment are required in promote mode");
            return 2;
        }
        EnvironmentCatalog catalog = EnvironmentCatalog.fromConfig(config);
        AppConfig.OrchestratorConfig orchestratorConfig = config.getOrchestrator();
        try (PromotionOrchestrator orchestrator = new PromotionOrchestrator(
                catalog,
                new FileArtifactRegistry(Path.of(config.getRegistry().getPath())),
                new LocalServingResourceManager(Duration.ofMillis(config.getServing().getLocalReadyDelayMs())),
                new Validator(httpInvoker(config)),
                new GateEvaluator(),
                new LastKnownGoodStore(Path.of(orchestratorConfig.getLastKnownGoodPath())),
                new PromotionHistoryLog(Path.of(orchestratorConfig.getHistoryPath())),
                new ValidationReportWriter(Path.of(orchestratorConfig.getReportDirectory())),
                OrchestratorSettings.fromConfig(orchestratorConfig),
                Clock.systemUTC())) {
            orchestrator.subscribe(new LoggingNotificationSink());
            orchestrator.subscribe(new JsonLinesNotificationSink(Path.of(orchestratorConfig.getEventLogPath())));

            PromotionRun run;
            try {
                run = orchestrator.submit(PromotionRequest.manual(artifactId, environmentName, requestedBy, Instant.now()));
            } catch (ArtifactNotFoundException | IllegalStateException | ConflictException e) {
                log.error("Promotion not admitted: {}", e.getMessage());
                return 1;
            } catch (IllegalArgumentException e) {
                log.error("Promotion not admitted: {}", e.getMessage());
                return 2;
            }

            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            Duration waitTimeout = Duration.ofMinutes(waitTimeoutMinutes);
            RunSnapshot snapshot = orchestrator.awaitTermination(run.id(), waitTimeout);
            while (snapshot.state() == PromotionState.AWAITING_APPROVAL) {
                promptForApproval(orchestrator, snapshot, reader);
                snapshot = orchestrator.awaitTermination(run.id(), waitTimeout);
            }
            log.info("Promotion runId={} artifact={} environment={} finished state={} detail={}",
                    snapshot.runId(),
                    artifactId,
                    snapshot.currentEnvironment(),
                    snapshot.state(),
                    snapshot.detail());
            return snapshot.state() == PromotionState.PROMOTED ? 0 : 1;
        } catch (TimeoutException e) {
            log.error("Promotion did not settle: {}", e.getMessage());
            return 1;
        }
    }

    private void promptForApproval(PromotionOrchestrator orchestrator, RunSnapshot snapshot, BufferedReader reader) throws IOException {
        ValidationReport report = snapshot.latestReport();
        System.out.println("Approval required for " + artifactId + " in " + snapshot.currentEnvironment());
        if (report != null) {
            System.out.printf(Locale.ROOT, "  accuracy=%.4f p95=%.2fms errorRate=%.4f invocations=%d%n",
                    report.metrics().accuracy(),
                    report.metrics().p95LatencyMs(),
                    report.metrics().errorRate(),
                    report.metrics().invocations());
        }
        if (snapshot.reportPath() != null) {
            System.out.println("  report: " + snapshot.reportPath());
        }
        System.out.print("approve? [y/N] ");
        System.out.flush();
        String answer = reader.readLine();
        if (answer != null && answer.trim().toLowerCase(Locale.ROOT).startsWith("y")) {
            orchestrator.approve(snapshot.runId(), requestedBy);
        } else {
            orchestrator.reject(snapshot.runId(), requestedBy, answer == null ? "no approver input" : "declined at prompt");
        }
    }

    private int runRegister(AppConfig config) throws IOException {
        if (isBlank(artifactId)) {
            log.error("--artifact is required in register mode");
            return 2;
        }
        FileArtifactRegistry registry = new FileArtifactRegistry(Path.of(config.getRegistry().getPath()));
        try {
            registry.register(new ArtifactVersion(artifactId, group, metrics, Instant.now(), ApprovalStatus.PENDING));
        } catch (IllegalArgumentException e) {
            log.error("Registration failed: {}", e.getMessage());
            return 1;
        }
        log.info("Registered artifact={} group={} metrics={}", artifactId, group, metrics);
        return 0;
    }

    private int runApprove(AppConfig config) throws IOException {
        if (isBlank(artifactId)) {
            log.error("--artifact is required in approve mode");
            return 2;
        }
        ArtifactApprover approver = new ArtifactApprover(new FileArtifactRegistry(Path.of(config.getRegistry().getPath())));
        try {
            ArtifactApprover.ApprovalResult result = approver.approveIfQualified(artifactId, approvalMetric, minAccuracy);
            log.info("Artifact approval artifact={} approved={} detail={}", artifactId, result.approved(), result.detail());
            return result.approved() ? 0 : 1;
        } catch (ArtifactNotFoundException e) {
            log.error("Approval failed: {}", e.getMessage());
            return 1;
        }
    }

    private int runLatest(AppConfig config) throws IOException {
        FileArtifactRegistry registry = new FileArtifactRegistry(Path.of(config.getRegistry().getPath()));
        Optional<ArtifactVersion> latest = registry.latestWithStatus(group, status);
        if (latest.isEmpty()) {
            log.warn("No {} artifact in group {}", status, group);
            return 1;
        }
        System.out.println(latest.get().id());
        return 0;
    }

    private int runValidate(AppConfig config) throws IOException {
        if (isBlank(environmentName)) {
            log.error("--environment is required in validate mode");
            return 2;
        }
        EnvironmentCatalog catalog = EnvironmentCatalog.fromConfig(config);
        Environment environment = catalog.get(environmentName);
        if (isBlank(environment.endpointUrl())) {
            log.error("Environment {} has no endpointUrl", environmentName);
            return 2;
        }
        ServingEndpointHandle handle = new ServingEndpointHandle(
                LocalServingResourceManager.endpointName(environment),
                environment.name(),
                "adhoc",
                artifactId,
                environment.endpointUrl(),
                EndpointStatus.IN_SERVICE);
        Validator validator = new Validator(httpInvoker(config));
        ValidationReport report = validator.run(handle, validator.loadSuite(environment.suitePath()));
        Path reportPath = new ValidationReportWriter(Path.of(config.getOrchestrator().getReportDirectory()))
                .write("adhoc-" + Instant.now().toEpochMilli(), environment.name(), report);
        log.info("Validation environment={} passed={} metrics={} report={}",
                environment.name(),
                report.passed(),
                report.metrics().asMap(),
                reportPath);
        return report.passed() ? 0 : 1;
    }

    private int runEnvironments(AppConfig config) {
        if (config.getEnvironments().isEmpty()) {
            log.error("No environments configured in {}", configPath);
            return 2;
        }
        EnvironmentCatalog catalog = EnvironmentCatalog.fromConfig(config);
        for (Environment environment : catalog.all()) {
            System.out.printf(Locale.ROOT,
                    "%s instanceClass=%s replicas=%d..%d(initial %d) autoscaling=%s monitoring=%s approval=%s promotesTo=%s readyTimeoutMs=%d%n",
                    environment.name(),
                    environment.resourceProfile().instanceClass(),
                    environment.resourceProfile().minReplicas(),
                    environment.resourceProfile().maxReplicas(),
                    environment.resourceProfile().initialReplicas(),
                    environment.resourceProfile().autoscaling().enabled(),
                    environment.resourceProfile().monitoring().describe(),
                    environment.requiresHumanApproval(),
                    environment.nextEnvironment().orElse("-"),
                    environment.timeouts().ready().toMillis());
        }
        return 0;
    }

    private static HttpEndpointInvoker httpInvoker(AppConfig config) {
        AppConfig.ValidationConfig validation = config.getValidation();
        return HttpEndpointInvoker.create(
                Duration.ofMillis(validation.getConnectTimeoutMs()),
                Duration.ofMillis(validation.getReadTimeoutMs()),
                validation.getContentType());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
