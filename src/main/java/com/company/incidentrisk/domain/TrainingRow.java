package com.company.incidentrisk.domain;

import lombok.Value;

/**
 * A feature row joined with its outcome. The label only ever looks at data after the bucket end.
 */
@Value
public class TrainingRow {
    FeatureRow features;
    int label;

    public boolean isPositive() {
        return label == 1;
    }
}
