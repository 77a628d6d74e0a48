package com.mlpromote.validation;

public record InvocationResult(String prediction, double latencyMs) {
}
