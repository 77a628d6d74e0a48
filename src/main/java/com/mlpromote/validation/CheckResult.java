package com.mlpromote.validation;

public record CheckResult(
        String checkId,
        CheckType type,
        boolean passed,
        int invocations,
        int failedInvocations,
        String detail) {
}
