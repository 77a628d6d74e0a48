package com.mlpromote.promotion;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import com.mlpromote.gate.ApprovalState;
import com.mlpromote.registry.ArtifactVersion;
import com.mlpromote.serving.ServingEndpointHandle;
import com.mlpromote.validation.ValidationReport;

/**
 * One execution of the promotion state machine for a single request. State is mutated only by
 * the orchestrator's driver for this run; the public accessors are safe to call from any thread.
 */
public class PromotionRun {
    private final String id;
    private final PromotionRequest request;
    private final ArtifactVersion artifact;
    private final List<StateTransition> history = new ArrayList<>();
    private final Set<String> claimedKeys = new LinkedHashSet<>();
    private final ReentrantLock driveLock = new ReentrantLock();
    private final AtomicBoolean finishing = new AtomicBoolean();

    private PromotionState state = PromotionState.REQUESTED;
    private String currentEnvironment;
    private ApprovalState approvalState = ApprovalState.NONE;
    private ServingEndpointHandle candidate;
    private boolean deployAttempted;
    private boolean rollbackPending;
    private ValidationReport latestReport;
    private String reportPath;
    private String detail;

    private boolean cancelRequested;
    private String cancelReason;
    private Thread worker;

    private ApprovalResolution approvalResolution;
    private int approvalEpoch;
    private ScheduledFuture<?> approvalTimer;
    private boolean archived;

    PromotionRun(String id, PromotionRequest request, ArtifactVersion artifact) {
        this.id = id;
        this.request = request;
        this.artifact = artifact;
        this.currentEnvironment = request.targetEnvironment();
    }

    public String id() {
        return id;
    }

    public PromotionRequest request() {
        return request;
    }

    public ArtifactVersion artifact() {
        return artifact;
    }

    public synchronized PromotionState state() {
        return state;
    }

    public synchronized String currentEnvironment() {
        return currentEnvironment;
    }

    public synchronized ApprovalState approvalState() {
        return approvalState;
    }

    public synchronized List<StateTransition> history() {
        return List.copyOf(history);
    }

    public synchronized ValidationReport latestReport() {
        return latestReport;
    }

    public synchronized String detail() {
        return detail;
    }

    /**
     * Terminal once the state machine has nothing left to do, including a pending rollback.
     */
    public synchronized boolean isTerminal() {
        return state.isTerminal() && !rollbackPending;
    }

    public synchronized RunSnapshot snapshot() {
        return new RunSnapshot(id, request, state, currentEnvironment, approvalState, history, latestReport, reportPath, detail);
    }

    synchronized StateTransition transitionTo(PromotionState next, Instant timestamp, String transitionDetail) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next + " for run " + id);
        }
        StateTransition transition = new StateTransition(state, next, currentEnvironment, timestamp, transitionDetail);
        history.add(transition);
        state = next;
        detail = transitionDetail;
        if (next == PromotionState.ROLLBACK) {
            rollbackPending = false;
        }
        notifyAll();
        return transition;
    }

    synchronized StateTransition fail(Instant timestamp, String failureDetail, boolean rollback) {
        StateTransition transition = transitionTo(PromotionState.FAILED, timestamp, failureDetail);
        rollbackPending = rollback;
        return transition;
    }

    synchronized boolean isRollbackPending() {
        return rollbackPending;
    }

    synchronized ServingEndpointHandle candidate() {
        return candidate;
    }

    synchronized void setCandidate(ServingEndpointHandle candidate) {
        this.candidate = candidate;
    }

    synchronized boolean isDeployAttempted() {
        return deployAttempted;
    }

    synchronized void markDeployAttempted() {
        this.deployAttempted = true;
    }

    synchronized void setLatestReport(ValidationReport report, String path) {
        this.latestReport = report;
        this.reportPath = path;
    }

    synchronized void setApprovalState(ApprovalState approvalState) {
        this.approvalState = approvalState;
    }

    /**
     * Moves the run onto the next environment of the chain. The recorded approval carries over.
     */
    synchronized void startLeg(String environment) {
        this.currentEnvironment = environment;
        this.candidate = null;
        this.deployAttempted = false;
    }

    ReentrantLock driveLock() {
        return driveLock;
    }

    synchronized void setWorker(Thread worker) {
        this.worker = worker;
    }

    synchronized boolean isCancelRequested() {
        return cancelRequested;
    }

    synchronized String cancelReason() {
        return cancelReason;
    }

    /**
     * Flags the run as cancelled. A run waiting for approval has its approval settled as
     * cancelled; a run inside a collaborator call has its driver interrupted.
     *
     * @return false if the run is past the point where cancellation applies
     */
    synchronized boolean requestCancel(String reason) {
        if (!state.isCancellable() || cancelRequested) {
            return false;
        }
        cancelRequested = true;
        cancelReason = reason;
        if (state == PromotionState.AWAITING_APPROVAL) {
            settleApproval(ApprovalResolution.Outcome.CANCELLED, "system", reason, approvalEpoch);
        } else if (worker != null) {
            worker.interrupt();
        }
        return true;
    }

    synchronized int beginApproval() {
        approvalResolution = null;
        approvalEpoch++;
        return approvalEpoch;
    }

    synchronized void setApprovalTimer(ScheduledFuture<?> timer) {
        this.approvalTimer = timer;
    }

    synchronized void cancelApprovalTimer() {
        if (approvalTimer != null) {
            approvalTimer.cancel(false);
            approvalTimer = null;
        }
    }

    synchronized ApprovalResolution approvalResolution() {
        return approvalResolution;
    }

    /**
     * Settles the current approval request.
     *
     * @return false when the run is not awaiting approval, the request was already settled, or
     *         {@code epoch} belongs to an earlier request
     */
    synchronized boolean settleApproval(ApprovalResolution.Outcome outcome, String actor, String reason, int epoch) {
        if (state != PromotionState.AWAITING_APPROVAL || approvalResolution != null || epoch != approvalEpoch) {
            return false;
        }
        approvalResolution = new ApprovalResolution(outcome, actor, reason, epoch);
        notifyAll();
        return true;
    }

    synchronized boolean settleApproval(ApprovalResolution.Outcome outcome, String actor, String reason) {
        return settleApproval(outcome, actor, reason, approvalEpoch);
    }

    synchronized void claim(String key) {
        claimedKeys.add(key);
    }

    synchronized List<String> claimedKeys() {
        return List.copyOf(claimedKeys);
    }

    boolean claimFinish() {
        return finishing.compareAndSet(false, true);
    }

    synchronized void markArchived() {
        archived = true;
        notifyAll();
    }

    synchronized boolean isArchived() {
        return archived;
    }

    /**
     * Archived, or parked on an approval nobody has answered yet.
     */
    synchronized boolean isSettled() {
        return archived || (state == PromotionState.AWAITING_APPROVAL && approvalResolution == null && !cancelRequested);
    }

    synchronized RunSnapshot awaitSettled(Duration timeout) throws InterruptedException, TimeoutException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!isSettled()) {
            long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMillis <= 0) {
                throw new TimeoutException("Run " + id + " still " + state + " after " + timeout.toMillis() + "ms");
            }
            wait(remainingMillis);
        }
        return snapshot();
    }
}
