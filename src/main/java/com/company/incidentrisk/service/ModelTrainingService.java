package com.company.incidentrisk.service;

import com.company.incidentrisk.config.IncidentRiskProperties;
import com.company.incidentrisk.domain.Feature;
import com.company.incidentrisk.domain.FittedModel;
import com.company.incidentrisk.domain.ModelArtifact;
import com.company.incidentrisk.domain.TrainingHyperparameters;
import com.company.incidentrisk.domain.TrainingRow;
import com.company.incidentrisk.exception.InsufficientTrainingDataException;
import com.company.incidentrisk.exception.TrainingInProgressException;
import com.company.incidentrisk.exception.TrainingInterruptedException;
import com.company.incidentrisk.util.CancellationToken;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Single-flight training per model family. A failed or interrupted run publishes nothing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ModelTrainingService {

    private final LabelGenerator labelGenerator;
    private final LogisticRegressionTrainer trainer;
    private final ModelRegistryService modelRegistry;
    private final IncidentRiskProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final ConcurrentMap<String, Instant> runningFamilies = new ConcurrentHashMap<>();

    public TrainingHyperparameters defaultHyperparameters() {
        IncidentRiskProperties.Training training = properties.getTraining();
        return TrainingHyperparameters.builder()
                .learningRate(training.getLearningRate())
                .maxIterations(training.getMaxIterations())
                .tolerance(training.getTolerance())
                .l2(training.getL2())
                .validationFraction(training.getValidationFraction())
                .minRows(training.getMinRows())
                .includeTotalRequests(training.isIncludeTotalRequests())
                .lookaheadBuckets(properties.getLabels().getLookaheadBuckets())
                .incidentThreshold(properties.getLabels().getIncidentThreshold())
                .timeBudget(training.getTimeBudget())
                .build();
    }

    /**
     * Labels the configured training window ending now and trains the default family on it.
     *
     * @param hyperparameters overrides, or null for configured defaults
     */
    public ModelArtifact trainModel(TrainingHyperparameters hyperparameters) {
        TrainingHyperparameters effective = hyperparameters != null ? hyperparameters : defaultHyperparameters();
        String family = properties.getTraining().getModelFamily();

        Instant windowEnd = clock.instant();
        Instant windowStart = windowEnd.minus(properties.getTraining().getTrainingWindow());

        return runExclusive(family, () -> {
            List<TrainingRow> rows = labelGenerator.buildTrainingRows(windowStart, windowEnd,
                    effective.getLookaheadBuckets(), effective.getIncidentThreshold());
            return fitAndPublish(family, rows, effective,
                    CancellationToken.withBudget(clock, effective.getTimeBudget()));
        });
    }

    /**
     * Trains on caller-supplied rows.
     *
     * @throws InsufficientTrainingDataException below the minimum row count or with a single label class
     * @throws TrainingInProgressException when the family is already training
     * @throws TrainingInterruptedException when the token trips; nothing is published
     */
    public ModelArtifact train(String family, List<TrainingRow> rows, TrainingHyperparameters hyperparameters,
                               CancellationToken cancellationToken) {
        return runExclusive(family, () -> fitAndPublish(family, rows, hyperparameters, cancellationToken));
    }

    private ModelArtifact runExclusive(String family, Supplier<ModelArtifact> work) {
        if (runningFamilies.putIfAbsent(family, clock.instant()) != null) {
            meterRegistry.counter("incident.model.train.runs", "outcome", "busy").increment();
            throw new TrainingInProgressException(family);
        }
        try {
            return work.get();
        } finally {
            runningFamilies.remove(family);
        }
    }

    private ModelArtifact fitAndPublish(String family, List<TrainingRow> rows,
                                        TrainingHyperparameters hyperparameters,
                                        CancellationToken cancellationToken) {
        int positives = (int) rows.stream().filter(TrainingRow::isPositive).count();
        int negatives = rows.size() - positives;

        if (rows.size() < hyperparameters.getMinRows() || positives == 0 || negatives == 0) {
            meterRegistry.counter("incident.model.train.runs", "outcome", "insufficient_data").increment();
            log.warn("Training {} refused: {} rows, {} positive, {} negative (min rows {})",
                    family, rows.size(), positives, negatives, hyperparameters.getMinRows());
            throw new InsufficientTrainingDataException(rows.size(), positives, hyperparameters.getMinRows());
        }

        List<Feature> features = Feature.schema(hyperparameters.isIncludeTotalRequests());
        log.info("Training {} on {} rows ({} positive) with {} features",
                family, rows.size(), positives, features.size());

        FittedModel fitted;
        try {
            fitted = trainer.fit(rows, features, hyperparameters, cancellationToken);
        } catch (TrainingInterruptedException e) {
            meterRegistry.counter("incident.model.train.runs", "outcome", "interrupted").increment();
            throw e;
        }

        ModelArtifact artifact = modelRegistry.publish(family, fitted);
        meterRegistry.counter("incident.model.train.runs", "outcome", "success").increment();
        return artifact;
    }

    public boolean isTraining(String family) {
        return runningFamilies.containsKey(family);
    }
}
