package com.vcc.router.model;

public enum TraceStatus {
    IN_PROGRESS,
    SUCCEEDED,
    DENIED,
    FAILED,
    CLIENT_CANCELLED
}
