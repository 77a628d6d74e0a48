package com.mlpromote.registry;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED
}
