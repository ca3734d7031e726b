package com.company.incidentrisk.domain.enums;

public enum InferenceMode {
    BATCH,
    LIVE;

    public String tag() {
        return name().toLowerCase();
    }
}
