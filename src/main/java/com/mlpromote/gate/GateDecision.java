package com.mlpromote.gate;

import java.util.List;

/**
 * Outcome of a gate evaluation. Warnings never change the decision.
 */
public record GateDecision(Decision decision, List<String> reasons, List<String> warnings) {

    public GateDecision {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public GateDecision(Decision decision, List<String> reasons) {
        this(decision, reasons, List.of());
    }

    public String summary() {
        String summary = reasons.isEmpty() ? decision.name() : decision + ": " + String.join("; ", reasons);
        return warnings.isEmpty() ? summary : summary + " (warnings: " + String.join("; ", warnings) + ")";
    }

    public enum Decision {
        ALLOW,
        BLOCK,
        NEEDS_APPROVAL
    }
}
