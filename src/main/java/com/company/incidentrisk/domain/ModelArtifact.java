package com.company.incidentrisk.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A trained linear-logistic scorer. Immutable once published; referenced by version.
 * Weights, means and standard deviations are parallel to {@link #featureNames}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ModelArtifact implements Serializable {
    private static final long serialVersionUID = 1L;

    long version;
    String modelFamily;
    List<String> featureNames;
    List<Double> weights;
    double bias;
    List<Double> means;
    List<Double> stdDevs;
    TrainingMetadata metadata;
    Instant createdAt;

    @JsonIgnore
    public List<Feature> features() {
        return featureNames.stream().map(Feature::fromFieldName).toList();
    }
}
