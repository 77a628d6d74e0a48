package com.mlpromote.promotion;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mlpromote.environment.Environment;
import com.mlpromote.environment.EnvironmentCatalog;
import com.mlpromote.gate.ApprovalState;
import com.mlpromote.gate.GateDecision;
import com.mlpromote.gate.GateEvaluator;
import com.mlpromote.registry.ApprovalStatus;
import com.mlpromote.registry.ArtifactRegistry;
import com.mlpromote.registry.ArtifactVersion;
import com.mlpromote.serving.ServingConfiguration;
import com.mlpromote.serving.ServingEndpointHandle;
import com.mlpromote.serving.ServingResourceManager;
import com.mlpromote.validation.ValidationReport;
import com.mlpromote.validation.ValidationReportWriter;
import com.mlpromote.validation.ValidationSuite;
import com.mlpromote.validation.Validator;

/**
 * Drives promotion runs through deploy, readiness, validation, gating and approval. A failed
 * deploy, readiness check, validation or gate rolls the environment back to its last known-good
 * serving configuration; a rejected, expired or cancelled approval restores that configuration in
 * place and leaves the run {@code FAILED}.
 *
 * <p>Each run is owned by one driver task at a time. Collaborator calls run on a separate I/O pool
 * with a per-state timeout; readiness polling and approval timeouts run on the scheduler. A run
 * waiting for approval holds no thread: the driver returns and is resubmitted once the approval
 * is settled.
 */
public class PromotionOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PromotionOrchestrator.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final EnvironmentCatalog catalog;
    private final ArtifactRegistry registry;
    private final ServingResourceManager serving;
    private final Validator validator;
    private final GateEvaluator gateEvaluator;
    private final LastKnownGoodStore lastKnownGood;
    private final PromotionHistoryLog historyLog;
    private final ValidationReportWriter reportWriter;
    private final RetryPolicy retryPolicy;
    private final Duration pollInterval;
    private final Clock clock;
    private final ErrorClassifier errorClassifier = new ErrorClassifier();

    private final ExecutorService drivers;
    private final ExecutorService io;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService notifier;
    private final LifecyclePoller poller;

    private final Map<String, PromotionRun> runs = new ConcurrentHashMap<>();
    private final Map<String, String> activeKeys = new ConcurrentHashMap<>();
    private final List<NotificationSink> sinks = new CopyOnWriteArrayList<>();

    public PromotionOrchestrator(
            EnvironmentCatalog catalog,
            ArtifactRegistry registry,
            ServingResourceManager serving,
            Validator validator,
            GateEvaluator gateEvaluator,
            LastKnownGoodStore lastKnownGood,
            PromotionHistoryLog historyLog,
            ValidationReportWriter reportWriter,
            OrchestratorSettings settings,
            Clock clock) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.serving = Objects.requireNonNull(serving, "serving");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.gateEvaluator = Objects.requireNonNull(gateEvaluator, "gateEvaluator");
        this.lastKnownGood = Objects.requireNonNull(lastKnownGood, "lastKnownGood");
        this.historyLog = Objects.requireNonNull(historyLog, "historyLog");
        this.reportWriter = Objects.requireNonNull(reportWriter, "reportWriter");
        this.retryPolicy = settings.retryPolicy();
        this.pollInterval = settings.pollInterval();
        this.clock = Objects.requireNonNull(clock, "clock");

        this.drivers = Executors.newCachedThreadPool(namedThreads("promotion-driver"));
        this.io = Executors.newCachedThreadPool(namedThreads("promotion-io"));
        this.scheduler = Executors.newScheduledThreadPool(settings.schedulerThreads(), namedThreads("promotion-scheduler"));
        this.notifier = Executors.newSingleThreadExecutor(namedThreads("promotion-notifier"));
        this.poller = new LifecyclePoller(
                serving, scheduler, io, settings.pollInterval(), settings.statusCallTimeout(), errorClassifier);
    }

    /**
     * Admits a request and schedules its run.
     *
     * @throws IllegalArgumentException for an unknown environment or artifact
     * @throws IllegalStateException when the artifact has been rejected
     * @throws ConflictException when the artifact already has an active run for the environment
     */
    public PromotionRun submit(PromotionRequest request) throws IOException {
        Environment environment = catalog.get(request.targetEnvironment());
        ArtifactVersion artifact = registry.getArtifact(request.artifactVersionId());
        if (artifact.approvalStatus() == ApprovalStatus.REJECTED) {
            throw new IllegalStateException("Artifact " + artifact.id() + " is rejected and cannot be promoted");
        }

        PromotionRun run = new PromotionRun(UUID.randomUUID().toString(), request, artifact);
        claimKey(run, environment.name());
        runs.put(run.id(), run);
        log.info("promotion.submitted runId={} artifact={} environment={} requestedBy={} trigger={}",
                run.id(),
                artifact.id(),
                environment.name(),
                request.requestedBy(),
                request.trigger());
        schedule(run);
        return run;
    }

    public PromotionRun getRun(String runId) {
        PromotionRun run = runs.get(runId);
        if (run == null) {
            throw new IllegalArgumentException("Unknown run: " + runId);
        }
        return run;
    }

    public List<PromotionRun> activeRuns() {
        return runs.values().stream()
                .filter(run -> !run.isArchived())
                .toList();
    }

    public Optional<ServingConfiguration> lastKnownGood(String environment) {
        return lastKnownGood.get(catalog.get(environment).name());
    }

    public void subscribe(NotificationSink sink) {
        sinks.add(Objects.requireNonNull(sink, "sink"));
    }

    public void approve(String runId, String approver) {
        PromotionRun run = getRun(runId);
        if (!run.settleApproval(ApprovalResolution.Outcome.APPROVED, approver, null)) {
            throw new IllegalStateException("Run " + runId + " is not awaiting approval (state " + run.state() + ")");
        }
        log.info("promotion.approval runId={} environment={} decision=APPROVED approver={}", runId, run.currentEnvironment(), approver);
        schedule(run);
    }

    public void reject(String runId, String approver, String reason) {
        PromotionRun run = getRun(runId);
        if (!run.settleApproval(ApprovalResolution.Outcome.REJECTED, approver, reason)) {
            throw new IllegalStateException("Run " + runId + " is not awaiting approval (state " + run.state() + ")");
        }
        log.info("promotion.approval runId={} environment={} decision=REJECTED approver={} reason={}",
                runId, run.currentEnvironment(), approver, reason);
        schedule(run);
    }

    /**
     * Requests cancellation. Takes effect at the run's next suspension point and ends it in
     * {@code FAILED}; the environment is put back on its last known-good configuration in place,
     * or cleared of the candidate when it has none.
     *
     * @return false when the run is already past the point where it can be cancelled
     */
    public boolean cancel(String runId, String reason) {
        PromotionRun run = getRun(runId);
        boolean accepted = run.requestCancel(reason);
        if (accepted) {
            log.info("promotion.cancel runId={} state={} reason={}", runId, run.state(), reason);
            schedule(run);
        }
        return accepted;
    }

    /**
     * Blocks until the run is terminal and archived, or waiting for an approval.
     */
    public RunSnapshot awaitTermination(String runId, Duration timeout) throws InterruptedException, TimeoutException {
        return getRun(runId).awaitSettled(timeout);
    }

    public void shutdown() {
        for (PromotionRun run : activeRuns()) {
            run.requestCancel("orchestrator shutdown");
        }
        drivers.shutdown();
        awaitQuietly(drivers, "drivers");
        io.shutdownNow();
        scheduler.shutdownNow();
        notifier.shutdown();
        awaitQuietly(notifier, "notifier");
        log.info("promotion.shutdown runs={} active={}", runs.size(), activeRuns().size());
    }

    @Override
    public void close() {
        shutdown();
    }

    private void schedule(PromotionRun run) {
        try {
            drivers.execute(() -> drive(run));
        } catch (RejectedExecutionException e) {
            log.warn("promotion.schedule.rejected runId={} state={} reason=orchestrator-shut-down", run.id(), run.state());
        }
    }

    private void drive(PromotionRun run) {
        run.driveLock().lock();
        try {
            run.setWorker(Thread.currentThread());
            boolean progressed = true;
            while (progressed) {
                try {
                    progressed = advance(run);
                } catch (RuntimeException e) {
                    log.error("promotion.driver.unexpected runId={} state={} reason={}", run.id(), run.state(), e.getMessage(), e);
                    progressed = failUnexpected(run, e);
                }
            }
        } finally {
            run.setWorker(null);
            // A cancel interrupt may land after the run already left its cancellable states.
            Thread.interrupted();
            run.driveLock().unlock();
        }
        if (run.isTerminal() && run.claimFinish()) {
            finish(run);
        }
    }

    /**
     * Performs exactly one step of the state machine.
     *
     * @return true if the run changed state and may be able to continue, false if it is terminal
     *         or waiting on an external event
     */
    boolean advance(PromotionRun run) {
        if (run.isTerminal()) {
            return false;
        }
        PromotionState state = run.state();
        if (state.isCancellable() && run.isCancelRequested()) {
            failRun(run, "cancelled: " + run.cancelReason(), Cleanup.RESTORE);
            return true;
        }
        try {
            switch (state) {
                case REQUESTED -> {
                    transition(run, PromotionState.DEPLOYING, "deploying " + run.artifact().id() + " to " + run.currentEnvironment());
                    return true;
                }
                case DEPLOYING -> {
                    deploy(run);
                    return true;
                }
                case AWAITING_READY -> {
                    awaitReady(run);
                    return true;
                }
                case VALIDATING -> {
                    return validate(run);
                }
                case AWAITING_APPROVAL -> {
                    return resolveApproval(run);
                }
                case FAILED -> {
                    transition(run, PromotionState.ROLLBACK, "restoring last known-good configuration of " + run.currentEnvironment());
                    return true;
                }
                case ROLLBACK -> {
                    rollback(run);
                    return true;
                }
                default -> {
                    return false;
                }
            }
        } catch (StepFailure e) {
            failRun(run, e.getMessage(), e.cleanup);
            return true;
        } catch (InterruptedException e) {
            failRun(run, interruptionDetail(run, state), interruptionCleanup(run));
            return true;
        }
    }

    private static String interruptionDetail(PromotionRun run, PromotionState state) {
        return run.isCancelRequested() ? "cancelled: " + run.cancelReason() : "interrupted in " + state;
    }

    private static Cleanup interruptionCleanup(PromotionRun run) {
        return run.isCancelRequested() ? Cleanup.RESTORE : Cleanup.ROLLBACK;
    }

    private void deploy(PromotionRun run) throws StepFailure, InterruptedException {
        Environment environment = environmentOf(run);
        run.markDeployAttempted();
        Duration timeout = environment.timeouts().deploy();
        for (int attempt = 1; ; attempt++) {
            CompletableFuture<ServingEndpointHandle> pending =
                    CompletableFuture.supplyAsync(() -> serving.deploy(run.artifact(), environment), io);
            try {
                ServingEndpointHandle handle = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                run.setCandidate(handle);
                transition(run, PromotionState.AWAITING_READY,
                        "deployed configuration " + handle.configurationId() + " on " + handle.endpointName()
                                + (attempt > 1 ? " after " + attempt + " attempts" : ""));
                return;
            } catch (TimeoutException e) {
                cleanUpWhenDone(pending, run, environment);
                throw new StepFailure(
                        "deploy timed out after " + timeout.toMillis() + "ms; deploy attempt still outstanding", Cleanup.ROLLBACK);
            } catch (InterruptedException e) {
                cleanUpWhenDone(pending, run, environment);
                throw new StepFailure(
                        interruptionDetail(run, PromotionState.DEPLOYING) + "; deploy attempt still outstanding", interruptionCleanup(run));
            } catch (ExecutionException e) {
                boolean transientFailure = errorClassifier.classify(e) == ErrorClassifier.ErrorClass.TRANSIENT;
                if (!transientFailure || attempt >= retryPolicy.maxAttempts()) {
                    throw new StepFailure(
                            "deploy failed after " + attempt + " attempt(s): " + ErrorClassifier.describe(e), Cleanup.ROLLBACK);
                }
                Duration backoff = retryPolicy.backoffAfter(attempt);
                log.warn("promotion.deploy.retry runId={} environment={} attempt={} backoffMs={} reason={}",
                        run.id(),
                        environment.name(),
                        attempt,
                        backoff.toMillis(),
                        ErrorClassifier.describe(e));
                Thread.sleep(backoff.toMillis());
            }
        }
    }

    /**
     * A deploy the run stopped waiting for may still complete; whatever it creates must not stay
     * in service.
     */
    private void cleanUpWhenDone(CompletableFuture<ServingEndpointHandle> pending, PromotionRun run, Environment environment) {
        pending.whenComplete((handle, error) -> {
            if (handle == null) {
                return;
            }
            try {
                Optional<ServingConfiguration> prior = lastKnownGood.get(environment.name());
                if (prior.isPresent()) {
                    serving.restore(environment, prior.get());
                    log.info("promotion.deploy.late-cleanup runId={} configuration={} action=restore restored={}",
                            run.id(), handle.configurationId(), prior.get().configurationId());
                } else {
                    serving.delete(handle);
                    log.info("promotion.deploy.late-cleanup runId={} configuration={} action=delete", run.id(), handle.configurationId());
                }
            } catch (RuntimeException e) {
                log.warn("promotion.deploy.late-cleanup.failed runId={} configuration={} reason={}",
                        run.id(), handle.configurationId(), e.getMessage(), e);
            }
        });
    }

    private void awaitReady(PromotionRun run) throws StepFailure, InterruptedException {
        Environment environment = environmentOf(run);
        ReadyOutcome outcome = waitForReady(run.candidate(), environment.timeouts().ready());
        if (outcome.result() != ReadyOutcome.Result.READY) {
            throw new StepFailure(outcome.detail(), Cleanup.ROLLBACK);
        }
        transition(run, PromotionState.VALIDATING, "endpoint " + run.candidate().endpointName() + " in service");
    }

    private ReadyOutcome waitForReady(ServingEndpointHandle handle, Duration timeout) throws StepFailure, InterruptedException {
        CompletableFuture<ReadyOutcome> pending = poller.waitUntilReady(handle, timeout);
        try {
            // The poller enforces the deadline itself; the extra interval covers a stalled scheduler.
            return pending.get(timeout.plus(pollInterval).toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(false);
            return ReadyOutcome.timedOut(handle.status(),
                    "endpoint " + handle.endpointName() + " not in service within " + timeout.toMillis() + "ms (no status received)");
        } catch (InterruptedException e) {
            pending.cancel(false);
            throw e;
        } catch (ExecutionException e) {
            throw new StepFailure("readiness check failed: " + ErrorClassifier.describe(e), Cleanup.ROLLBACK);
        }
    }

    private boolean validate(PromotionRun run) throws StepFailure, InterruptedException {
        Environment environment = environmentOf(run);
        ValidationSuite suite;
        try {
            suite = validator.loadSuite(environment.suitePath());
        } catch (IOException e) {
            throw new StepFailure(
                    "unable to load validation suite " + environment.suitePath() + ": " + e.getMessage(), Cleanup.ROLLBACK);
        }

        ServingEndpointHandle candidate = run.candidate();
        Duration timeout = environment.timeouts().validation();
        Future<ValidationReport> pending;
        try {
            pending = io.submit(() -> validator.run(candidate, suite));
        } catch (RejectedExecutionException e) {
            throw new StepFailure("validation not started: orchestrator shutting down", Cleanup.ROLLBACK);
        }
        ValidationReport report;
        try {
            report = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // Interrupts the validating thread so it stops calling the endpoint.
            pending.cancel(true);
            throw new StepFailure("validation timed out after " + timeout.toMillis() + "ms", Cleanup.ROLLBACK);
        } catch (InterruptedException e) {
            pending.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw new StepFailure("validation failed: " + ErrorClassifier.describe(e), Cleanup.ROLLBACK);
        }
        run.setLatestReport(report, writeReport(run, environment, report));

        GateDecision decision = gateEvaluator.evaluate(report, environment.policy(), run.approvalState());
        log.info("promotion.gate runId={} environment={} decision={} reasons={}",
                run.id(), environment.name(), decision.decision(), decision.reasons());
        for (String warning : decision.warnings()) {
            log.warn("promotion.gate.warning runId={} environment={} warning={}", run.id(), environment.name(), warning);
        }
        switch (decision.decision()) {
            case ALLOW -> {
                promote(run, environment, "gate allowed: " + decision.summary());
                return true;
            }
            case BLOCK -> {
                updateRegistryStatus(run, ApprovalStatus.REJECTED);
                throw new StepFailure("gate blocked: " + decision.summary(), Cleanup.ROLLBACK);
            }
            default -> {
                return requestApproval(run, environment, decision);
            }
        }
    }

    private String writeReport(PromotionRun run, Environment environment, ValidationReport report) {
        try {
            return reportWriter.write(run.id(), environment.name(), report).toString();
        } catch (IOException e) {
            log.warn("promotion.report.write-failed runId={} environment={} reason={}", run.id(), environment.name(), e.getMessage(), e);
            return null;
        }
    }

    private boolean requestApproval(PromotionRun run, Environment environment, GateDecision decision) {
        int epoch = run.beginApproval();
        transition(run, PromotionState.AWAITING_APPROVAL, decision.summary());
        Duration timeout = environment.timeouts().approval();
        run.setApprovalTimer(scheduler.schedule(() -> {
            if (run.settleApproval(
                    ApprovalResolution.Outcome.TIMED_OUT,
                    "system",
                    "approval not granted within " + timeout.toMillis() + "ms",
                    epoch)) {
                log.warn("promotion.approval.timeout runId={} environment={} timeoutMs={}", run.id(), environment.name(), timeout.toMillis());
                schedule(run);
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS));
        String reportPath = run.snapshot().reportPath();
        publish(run, PromotionEvent.EventType.APPROVAL_REQUESTED, null, PromotionState.AWAITING_APPROVAL,
                "approval required for " + environment.name() + (reportPath == null ? "" : "; report " + reportPath));
        // A cancel that arrived while validating has to be acted on now; nothing else will wake the run.
        return run.isCancelRequested();
    }

    private boolean resolveApproval(PromotionRun run) throws StepFailure {
        ApprovalResolution resolution = run.approvalResolution();
        if (resolution == null) {
            return false;
        }
        run.cancelApprovalTimer();
        Environment environment = environmentOf(run);
        switch (resolution.outcome()) {
            case APPROVED -> {
                run.setApprovalState(ApprovalState.APPROVED);
                Optional<String> next = environment.nextEnvironment();
                if (next.isEmpty()) {
                    promote(run, environment, resolution.describe());
                    return true;
                }
                Environment nextEnvironment = catalog.get(next.get());
                try {
                    claimKey(run, nextEnvironment.name());
                } catch (ConflictException e) {
                    throw new StepFailure(resolution.describe() + "; " + e.getMessage(), Cleanup.NONE);
                }
                run.startLeg(nextEnvironment.name());
                transition(run, PromotionState.DEPLOYING,
                        resolution.describe() + "; deploying " + run.artifact().id() + " to " + nextEnvironment.name());
                return true;
            }
            case REJECTED -> {
                updateRegistryStatus(run, ApprovalStatus.REJECTED);
                throw new StepFailure(resolution.describe(), Cleanup.RESTORE);
            }
            default -> throw new StepFailure(resolution.describe(), Cleanup.RESTORE);
        }
    }

    private void promote(PromotionRun run, Environment environment, String detail) throws StepFailure {
        ServingConfiguration configuration = ServingConfiguration.of(run.candidate(), environment.resourceProfile(), clock.instant());
        synchronized (run) {
            if (run.isCancelRequested()) {
                throw new StepFailure("cancelled: " + run.cancelReason(), Cleanup.RESTORE);
            }
            lastKnownGood.record(configuration);
            transition(run, PromotionState.PROMOTED, detail);
        }
        Thread.interrupted();
        updateRegistryStatus(run, ApprovalStatus.APPROVED);
    }

    private void rollback(PromotionRun run) {
        Environment environment = environmentOf(run);
        Optional<ServingConfiguration> prior = lastKnownGood.get(environment.name());
        if (prior.isEmpty()) {
            rollbackFailed(run, environment, "no known-good configuration recorded for " + environment.name());
            return;
        }
        try {
            transition(run, PromotionState.ROLLED_BACK, restoreLastKnownGood(environment, prior.get()));
        } catch (StepFailure e) {
            rollbackFailed(run, environment, e.getMessage());
        } catch (InterruptedException e) {
            rollbackFailed(run, environment, "rollback interrupted");
        }
    }

    /**
     * Puts {@code configuration} back in service and waits for it, all within the environment's
     * rollback budget.
     */
    private String restoreLastKnownGood(Environment environment, ServingConfiguration configuration)
            throws StepFailure, InterruptedException {
        Duration budget = environment.timeouts().rollback();
        Instant deadline = clock.instant().plus(budget);
        CompletableFuture<ServingEndpointHandle> restore =
                CompletableFuture.supplyAsync(() -> serving.restore(environment, configuration), io);
        ServingEndpointHandle restored;
        try {
            restored = restore.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            restore.cancel(true);
            throw new StepFailure("restore timed out after " + budget.toMillis() + "ms", Cleanup.NONE);
        } catch (ExecutionException e) {
            throw new StepFailure("restore failed: " + ErrorClassifier.describe(e), Cleanup.NONE);
        } catch (InterruptedException e) {
            restore.cancel(true);
            throw e;
        }
        Duration remaining = Duration.between(clock.instant(), deadline);
        ReadyOutcome outcome = waitForReady(restored, remaining.isNegative() ? Duration.ZERO : remaining);
        if (outcome.result() != ReadyOutcome.Result.READY) {
            throw new StepFailure("restored endpoint not ready: " + outcome.detail(), Cleanup.NONE);
        }
        return "restored configuration " + configuration.configurationId() + " (artifact " + configuration.artifactVersionId() + ")";
    }

    private void rollbackFailed(PromotionRun run, Environment environment, String detail) {
        log.error("promotion.rollback.failed runId={} environment={} detail={} action=manual-intervention-required",
                run.id(), environment.name(), detail);
        transition(run, PromotionState.ROLLBACK_FAILED, detail);
    }

    /**
     * Records a failure. Once a deploy was attempted the environment is rolled back through
     * {@code ROLLBACK}, restored in place, or cleared of the candidate, depending on
     * {@code cleanup} and whether a known-good configuration exists.
     */
    private void failRun(PromotionRun run, String detail, Cleanup cleanup) {
        // A cancel interrupt must not abort the cleanup calls below.
        Thread.interrupted();
        run.cancelApprovalTimer();
        String failureDetail = detail;
        boolean rollback = false;
        if (cleanup != Cleanup.NONE && run.isDeployAttempted()) {
            Optional<ServingConfiguration> prior = lastKnownGood.get(run.currentEnvironment());
            if (prior.isPresent() && cleanup == Cleanup.ROLLBACK) {
                rollback = true;
            } else if (prior.isPresent()) {
                failureDetail = detail + "; " + restoreInPlace(run, prior.get());
            } else if (run.candidate() != null) {
                failureDetail = detail + "; " + deleteCandidate(run, run.candidate());
            }
        }
        StateTransition transition = run.fail(clock.instant(), failureDetail, rollback);
        Thread.interrupted();
        logTransition(run, transition);
        publish(run, PromotionEvent.EventType.TRANSITION, transition.from(), transition.to(), transition.detail());
    }

    private String restoreInPlace(PromotionRun run, ServingConfiguration configuration) {
        Environment environment = environmentOf(run);
        try {
            String restored = restoreLastKnownGood(environment, configuration);
            log.info("promotion.restore runId={} environment={} configuration={}",
                    run.id(), environment.name(), configuration.configurationId());
            return restored;
        } catch (StepFailure e) {
            log.error("promotion.restore.failed runId={} environment={} detail={} action=manual-intervention-required",
                    run.id(), environment.name(), e.getMessage());
            return "failed to restore configuration " + configuration.configurationId() + ": " + e.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("promotion.restore.failed runId={} environment={} detail=interrupted action=manual-intervention-required",
                    run.id(), environment.name());
            return "restore of configuration " + configuration.configurationId() + " interrupted";
        }
    }

    private boolean failUnexpected(PromotionRun run, RuntimeException error) {
        String detail = "unexpected error: " + ErrorClassifier.describe(error);
        try {
            PromotionState state = run.state();
            if (state == PromotionState.ROLLBACK) {
                rollbackFailed(run, environmentOf(run), detail);
            } else if (!state.isTerminal()) {
                failRun(run, detail, Cleanup.ROLLBACK);
                return true;
            }
        } catch (RuntimeException e) {
            log.error("promotion.driver.abandoned runId={} state={} reason={}", run.id(), run.state(), e.getMessage(), e);
        }
        return false;
    }

    private String deleteCandidate(PromotionRun run, ServingEndpointHandle candidate) {
        Duration timeout = environmentOf(run).timeouts().deploy();
        CompletableFuture<Void> pending;
        try {
            pending = CompletableFuture.runAsync(() -> serving.delete(candidate), io);
        } catch (RejectedExecutionException e) {
            return "candidate configuration " + candidate.configurationId() + " not deleted: orchestrator shutting down";
        }
        try {
            pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return "deleted candidate configuration " + candidate.configurationId();
        } catch (TimeoutException e) {
            log.warn("promotion.cleanup.slow runId={} configuration={} timeoutMs={}", run.id(), candidate.configurationId(), timeout.toMillis());
            return "delete of candidate configuration " + candidate.configurationId() + " timed out after " + timeout.toMillis()
                    + "ms; delete still outstanding";
        } catch (ExecutionException e) {
            log.warn("promotion.cleanup.failed runId={} configuration={} reason={}", run.id(), candidate.configurationId(), e.getMessage(), e);
            return "failed to delete candidate configuration " + candidate.configurationId() + ": " + ErrorClassifier.describe(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "delete of candidate configuration " + candidate.configurationId() + " interrupted; delete still outstanding";
        }
    }

    private void transition(PromotionRun run, PromotionState next, String detail) {
        StateTransition transition = run.transitionTo(next, clock.instant(), detail);
        logTransition(run, transition);
        publish(run, PromotionEvent.EventType.TRANSITION, transition.from(), transition.to(), detail);
    }

    private void logTransition(PromotionRun run, StateTransition transition) {
        log.info("promotion.transition runId={} environment={} from={} to={} detail={}",
                run.id(), transition.environment(), transition.from(), transition.to(), transition.detail());
    }

    private void finish(PromotionRun run) {
        for (String key : run.claimedKeys()) {
            activeKeys.remove(key, run.id());
        }
        RunSnapshot snapshot = run.snapshot();
        try {
            historyLog.append(snapshot);
        } catch (IOException e) {
            log.warn("promotion.archive.failed runId={} reason={}", run.id(), e.getMessage(), e);
        }
        PromotionEvent.EventType type = switch (snapshot.state()) {
            case PROMOTED -> PromotionEvent.EventType.PROMOTION_SUCCEEDED;
            case ROLLBACK_FAILED -> PromotionEvent.EventType.ROLLBACK_FAILED;
            default -> PromotionEvent.EventType.PROMOTION_FAILED;
        };
        publish(run, type, null, snapshot.state(), snapshot.detail());
        log.info("promotion.finished runId={} artifact={} environment={} state={} transitions={}",
                run.id(), run.artifact().id(), snapshot.currentEnvironment(), snapshot.state(), snapshot.history().size());
        run.markArchived();
    }

    private void claimKey(PromotionRun run, String environment) {
        String key = run.artifact().id() + "|" + environment;
        String holder = activeKeys.putIfAbsent(key, run.id());
        if (holder != null && !holder.equals(run.id())) {
            throw new ConflictException(
                    "Artifact " + run.artifact().id() + " already has an active run " + holder + " for " + environment, holder);
        }
        run.claim(key);
    }

    private void updateRegistryStatus(PromotionRun run, ApprovalStatus status) {
        try {
            registry.setApprovalStatus(run.artifact().id(), status);
            log.info("promotion.registry.status runId={} artifact={} status={}", run.id(), run.artifact().id(), status);
        } catch (IOException | RuntimeException e) {
            log.warn("promotion.registry.status-failed runId={} artifact={} status={} reason={}",
                    run.id(), run.artifact().id(), status, e.getMessage(), e);
        }
    }

    private void publish(PromotionRun run, PromotionEvent.EventType type, PromotionState from, PromotionState to, String detail) {
        if (sinks.isEmpty()) {
            return;
        }
        PromotionEvent event = new PromotionEvent(type, run.id(), run.artifact().id(), run.currentEnvironment(), from, to, detail, clock.instant());
        try {
            notifier.execute(() -> {
                for (NotificationSink sink : sinks) {
                    try {
                        sink.publish(event);
                    } catch (RuntimeException e) {
                        log.warn("promotion.notify.failed sink={} event={} runId={} reason={}",
                                sink.getClass().getSimpleName(), type, run.id(), e.getMessage(), e);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("promotion.notify.dropped event={} runId={} reason=orchestrator-shut-down", type, run.id());
        }
    }

    private Environment environmentOf(PromotionRun run) {
        return catalog.get(run.currentEnvironment());
    }

    private static void awaitQuietly(ExecutorService executor, String name) {
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("promotion.shutdown.timeout pool={} graceMs={}", name, SHUTDOWN_GRACE.toMillis());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /** What a failure does to the environment once a deploy was attempted. */
    private enum Cleanup {
        NONE,
        ROLLBACK,
        RESTORE
    }

    /**
     * A step that ended the current leg. {@code cleanup} is NONE only when nothing was deployed
     * on behalf of the failing leg.
     */
    private static final class StepFailure extends Exception {
        private final Cleanup cleanup;

        private StepFailure(String message, Cleanup cleanup) {
            super(message);
            this.cleanup = cleanup;
        }
    }
}
