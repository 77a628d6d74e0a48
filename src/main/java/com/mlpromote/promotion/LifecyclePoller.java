package com.mlpromote.promotion;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mlpromote.serving.EndpointStatus;
import com.mlpromote.serving.ServingEndpointHandle;
import com.mlpromote.serving.ServingResourceManager;

/**
 * Waits for an endpoint to leave its transitional status. The scheduler only triggers polls and
 * the deadline; status calls run on the status executor, one at a time, each bounded by the
 * status call timeout. Cancelling the returned future stops both.
 */
public class LifecyclePoller {
    private static final Logger log = LoggerFactory.getLogger(LifecyclePoller.class);

    private final ServingResourceManager servingResourceManager;
    private final ScheduledExecutorService scheduler;
    private final Executor statusExecutor;
    private final Duration pollInterval;
    private final Duration statusCallTimeout;
    private final ErrorClassifier errorClassifier;

    public LifecyclePoller(
            ServingResourceManager servingResourceManager,
            ScheduledExecutorService scheduler,
            Executor statusExecutor,
            Duration pollInterval,
            Duration statusCallTimeout,
            ErrorClassifier errorClassifier) {
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (statusCallTimeout.isZero() || statusCallTimeout.isNegative()) {
            throw new IllegalArgumentException("statusCallTimeout must be positive");
        }
        this.servingResourceManager = servingResourceManager;
        this.scheduler = scheduler;
        this.statusExecutor = statusExecutor;
        this.pollInterval = pollInterval;
        this.statusCallTimeout = statusCallTimeout;
        this.errorClassifier = errorClassifier;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    /**
     * Completes with READY on {@code IN_SERVICE}, FAILED on {@code FAILED} or {@code DELETED},
     * and TIMED_OUT once {@code timeout} has elapsed without either, even while a status call
     * is still hanging.
     */
    public CompletableFuture<ReadyOutcome> waitUntilReady(ServingEndpointHandle handle, Duration timeout) {
        CompletableFuture<ReadyOutcome> outcome = new CompletableFuture<>();
        AtomicReference<EndpointStatus> lastStatus = new AtomicReference<>(handle.status());
        AtomicReference<CompletableFuture<EndpointStatus>> inFlight = new AtomicReference<>();

        ScheduledFuture<?> polling = scheduler.scheduleWithFixedDelay(
                () -> pollOnce(handle, outcome, lastStatus, inFlight),
                0,
                pollInterval.toMillis(),
                TimeUnit.MILLISECONDS);
        ScheduledFuture<?> deadline = scheduler.schedule(
                () -> outcome.complete(ReadyOutcome.timedOut(
                        lastStatus.get(),
                        "endpoint " + handle.endpointName() + " not in service within " + timeout.toMillis() + "ms (last status "
                                + lastStatus.get() + ")")),
                Math.max(0L, timeout.toMillis()),
                TimeUnit.MILLISECONDS);

        outcome.whenComplete((result, error) -> {
            polling.cancel(false);
            deadline.cancel(false);
            CompletableFuture<EndpointStatus> call = inFlight.get();
            if (call != null) {
                call.cancel(false);
            }
        });
        return outcome;
    }

    private void pollOnce(
            ServingEndpointHandle handle,
            CompletableFuture<ReadyOutcome> outcome,
            AtomicReference<EndpointStatus> lastStatus,
            AtomicReference<CompletableFuture<EndpointStatus>> inFlight) {
        if (outcome.isDone()) {
            return;
        }
        CompletableFuture<EndpointStatus> previous = inFlight.get();
        if (previous != null && !previous.isDone()) {
            return;
        }
        CompletableFuture<EndpointStatus> call;
        try {
            call = CompletableFuture.supplyAsync(() -> servingResourceManager.getStatus(handle), statusExecutor)
                    .orTimeout(statusCallTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            outcome.complete(ReadyOutcome.failed(lastStatus.get(), "status check not scheduled: executor shut down"));
            return;
        }
        inFlight.set(call);
        call.whenComplete((status, error) -> {
            if (error == null) {
                onStatus(handle, status, outcome, lastStatus);
            } else {
                onStatusError(handle, error, outcome, lastStatus);
            }
        });
    }

    private void onStatus(
            ServingEndpointHandle handle,
            EndpointStatus status,
            CompletableFuture<ReadyOutcome> outcome,
            AtomicReference<EndpointStatus> lastStatus) {
        lastStatus.set(status);
        log.debug("lifecycle.poll endpoint={} configuration={} status={}", handle.endpointName(), handle.configurationId(), status);
        if (status == EndpointStatus.IN_SERVICE) {
            outcome.complete(ReadyOutcome.ready(status));
        } else if (status == EndpointStatus.FAILED || status == EndpointStatus.DELETED) {
            outcome.complete(ReadyOutcome.failed(status, "endpoint " + handle.endpointName() + " reported " + status));
        }
    }

    private void onStatusError(
            ServingEndpointHandle handle,
            Throwable error,
            CompletableFuture<ReadyOutcome> outcome,
            AtomicReference<EndpointStatus> lastStatus) {
        if (outcome.isDone()) {
            return;
        }
        Throwable cause = ErrorClassifier.unwrap(error);
        if (cause instanceof TimeoutException) {
            log.warn("lifecycle.poll.slow endpoint={} timeoutMs={}", handle.endpointName(), statusCallTimeout.toMillis());
            return;
        }
        if (errorClassifier.classify(cause) == ErrorClassifier.ErrorClass.TRANSIENT) {
            log.warn("lifecycle.poll.transient endpoint={} reason={}", handle.endpointName(), cause.getMessage());
            return;
        }
        log.warn("lifecycle.poll.failed endpoint={} reason={}", handle.endpointName(), cause.getMessage(), cause);
        outcome.complete(ReadyOutcome.failed(lastStatus.get(), "status check failed: " + ErrorClassifier.describe(cause)));
    }
}
