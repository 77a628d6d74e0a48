package com.mlpromote.gate;

public enum ApprovalState {
    NONE,
    APPROVED
}
