package com.mlpromote.promotion;

import com.mlpromote.serving.EndpointStatus;

public record ReadyOutcome(Result result, EndpointStatus lastStatus, String detail) {

    static ReadyOutcome ready(EndpointStatus status) {
        return new ReadyOutcome(Result.READY, status, "endpoint is " + status);
    }

    static ReadyOutcome failed(EndpointStatus status, String detail) {
        return new ReadyOutcome(Result.FAILED, status, detail);
    }

    static ReadyOutcome timedOut(EndpointStatus status, String detail) {
        return new ReadyOutcome(Result.TIMED_OUT, status, detail);
    }

    public enum Result {
        READY,
        FAILED,
        TIMED_OUT
    }
}
