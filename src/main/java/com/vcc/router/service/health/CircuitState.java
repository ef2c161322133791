package com.vcc.router.service.health;

public enum CircuitState {
    /** Normal traffic. */
    CLOSED,
    /** Rejects new traffic until the cool-down elapses. */
    OPEN,
    /** Admits a single trial request. */
    HALF_OPEN
}
