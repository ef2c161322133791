package com.vcc.router.model;

public enum FirewallState {
    CLEAN,
    FLAGGED,
    REDRAFTED
}
