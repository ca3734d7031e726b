package com.company.incidentrisk.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Output of one training run before it is published as a {@link ModelArtifact}.
 * Weights, means and standard deviations are parallel to {@link #features}.
 */
@Value
@Builder
public class FittedModel {
    List<Feature> features;
    List<Double> weights;
    double bias;
    List<Double> means;
    List<Double> stdDevs;
    TrainingMetadata metadata;
}
