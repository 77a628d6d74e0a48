package com.mlpromote.serving;

public enum EndpointStatus {
    CREATING,
    IN_SERVICE,
    UPDATING,
    FAILED,
    DELETED
}
