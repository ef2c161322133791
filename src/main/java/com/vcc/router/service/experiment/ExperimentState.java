package com.vcc.router.service.experiment;

public enum ExperimentState {
    ACTIVE,
    ROLLED_BACK
}
