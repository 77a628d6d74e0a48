package com.mlpromote.validation;

public enum CheckType {
    FUNCTIONAL,
    LATENCY,
    ACCURACY
}
