package com.vcc.router.service.experiment;

import java.util.Locale;

public enum ExperimentArm {
    CONTROL,
    TREATMENT;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExperimentArm fromLabel(String label) {
        return valueOf(label.toUpperCase(Locale.ROOT));
    }
}
