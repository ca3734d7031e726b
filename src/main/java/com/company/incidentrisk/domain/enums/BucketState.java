package com.company.incidentrisk.domain.enums;

/**
 * Lifecycle of one (service, route, bucket) in the feature store.
 */
public enum BucketState {
    COMPUTED,   // row written, still accepts late events
    FROZEN,     // grace deadline passed, row is final
    FAILED;     // retry budget exhausted, no row emitted

    public static BucketState fromString(String state) {
        if (state == null) {
            return COMPUTED;
        }
        try {
            return BucketState.valueOf(state.toUpperCase());
        } catch (IllegalArgumentException e) {
            return COMPUTED;
        }
    }
}
