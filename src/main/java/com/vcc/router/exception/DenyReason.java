package com.vcc.router.exception;

public enum DenyReason {
    NO_ELIGIBLE_MODEL("no_eligible_model"),
    BUDGET_EXCEEDED("budget_exceeded"),
    COMPLIANCE_BLOCK("compliance_block"),
    NO_ACTIVE_POLICY("no_active_policy");

    private final String code;

    DenyReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
