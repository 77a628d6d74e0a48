package com.mlpromote.promotion;

import java.util.List;

import com.mlpromote.gate.ApprovalState;
import com.mlpromote.validation.ValidationReport;

/**
 * Immutable copy of a run, as archived in the history log.
 */
public record RunSnapshot(
        String runId,
        PromotionRequest request,
        PromotionState state,
        String currentEnvironment,
        ApprovalState approvalState,
        List<StateTransition> history,
        ValidationReport latestReport,
        String reportPath,
        String detail) {

    public RunSnapshot {
        history = history == null ? List.of() : List.copyOf(history);
    }
}
