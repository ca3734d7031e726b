package com.company.incidentrisk.service;

import com.company.incidentrisk.domain.Feature;
import com.company.incidentrisk.domain.FittedModel;
import com.company.incidentrisk.domain.ScoredExample;
import com.company.incidentrisk.domain.TrainingHyperparameters;
import com.company.incidentrisk.domain.TrainingMetadata;
import com.company.incidentrisk.domain.TrainingRow;
import com.company.incidentrisk.domain.enums.StopReason;
import com.company.incidentrisk.exception.TrainingInterruptedException;
import com.company.incidentrisk.util.CancellationToken;
import com.company.incidentrisk.util.RankingMetrics;
import com.company.incidentrisk.util.StatsUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Full-batch gradient descent on L2-regularized log-loss over z-scored features.
 */
@Component
@Slf4j
public class LogisticRegressionTrainer {

    static final double STD_FLOOR = 1e-6;

    private static final Comparator<TrainingRow> CHRONOLOGICAL = Comparator
            .comparing((TrainingRow row) -> row.getFeatures().getBucketStart())
            .thenComparing(row -> row.getFeatures().getService())
            .thenComparing(row -> row.getFeatures().getRoute());

    private final Clock clock;

    public LogisticRegressionTrainer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Splits chronologically, the newest {@code validationFraction} of rows held out.
     *
     * @throws TrainingInterruptedException when the token trips between iterations; it carries
     *         the weights reached so far, which are never published
     */
    public FittedModel fit(List<TrainingRow> rows, List<Feature> features, TrainingHyperparameters hyperparameters,
                           CancellationToken cancellationToken) {
        List<TrainingRow> ordered = new ArrayList<>(rows);
        ordered.sort(CHRONOLOGICAL);

        int validationSize = (int) Math.floor(ordered.size() * hyperparameters.getValidationFraction());
        int fitSize = ordered.size() - validationSize;
        List<TrainingRow> fitRows = ordered.subList(0, fitSize);
        List<TrainingRow> validationRows = ordered.subList(fitSize, ordered.size());

        int d = features.size();
        double[] means = new double[d];
        double[] stdDevs = new double[d];
        computeNormalization(fitRows, features, means, stdDevs);

        double[][] x = normalize(fitRows, features, means, stdDevs);
        int[] y = fitRows.stream().mapToInt(TrainingRow::getLabel).toArray();

        double[] weights = new double[d];
        double bias = 0.0;
        double previousLoss = Double.POSITIVE_INFINITY;
        double loss = Double.NaN;
        int iterations = 0;
        StopReason stopReason = StopReason.MAX_ITERATIONS;

        TrainingMetadata.TrainingMetadataBuilder metadata = TrainingMetadata.builder()
                .totalRows(ordered.size())
                .fitRows(fitSize)
                .validationRows(validationSize)
                .positiveRows((int) ordered.stream().filter(TrainingRow::isPositive).count())
                .windowStart(ordered.isEmpty() ? null : ordered.get(0).getFeatures().getBucketStart())
                .windowEnd(ordered.isEmpty() ? null : ordered.get(ordered.size() - 1).getFeatures().getBucketEnd())
                .hyperparameters(hyperparameters);

        while (iterations < hyperparameters.getMaxIterations()) {
            if (cancellationToken.isCancellationRequested()) {
                FittedModel partial = FittedModel.builder()
                        .features(List.copyOf(features))
                        .weights(toList(weights))
                        .bias(bias)
                        .means(toList(means))
                        .stdDevs(toList(stdDevs))
                        .metadata(metadata
                                .trainedAt(clock.instant())
                                .iterations(iterations)
                                .fitLoss(Double.isNaN(loss) ? 0.0 : loss)
                                .stopReason(StopReason.CANCELLED)
                                .build())
                        .build();
                log.warn("Training cancelled after {} iterations: {}", iterations, cancellationToken.reason());
                throw new TrainingInterruptedException(cancellationToken.reason(), partial);
            }

            double[] gradient = new double[d];
            double biasGradient = 0.0;
            double lossSum = 0.0;

            for (int i = 0; i < x.length; i++) {
                double p = StatsUtils.sigmoid(dot(weights, x[i]) + bias);
                double error = p - y[i];
                for (int j = 0; j < d; j++) {
                    gradient[j] += error * x[i][j];
                }
                biasGradient += error;
                lossSum += StatsUtils.logLoss(p, y[i]);
            }

            int n = x.length;
            loss = lossSum / n + 0.5 * hyperparameters.getL2() * dot(weights, weights);

            for (int j = 0; j < d; j++) {
                weights[j] -= hyperparameters.getLearningRate() * (gradient[j] / n + hyperparameters.getL2() * weights[j]);
            }
            bias -= hyperparameters.getLearningRate() * (biasGradient / n);
            iterations++;

            if (Math.abs(previousLoss - loss) < hyperparameters.getTolerance()) {
                stopReason = StopReason.CONVERGED;
                break;
            }
            previousLoss = loss;
        }

        Double validationLoss = null;
        Double validationAuc = null;
        if (!validationRows.isEmpty()) {
            double[][] vx = normalize(validationRows, features, means, stdDevs);
            List<ScoredExample> scored = new ArrayList<>();
            double vLoss = 0.0;
            for (int i = 0; i < vx.length; i++) {
                TrainingRow row = validationRows.get(i);
                double p = StatsUtils.sigmoid(dot(weights, vx[i]) + bias);
                vLoss += StatsUtils.logLoss(p, row.getLabel());
                scored.add(new ScoredExample(row.getFeatures().getBucketStart(), p, row.getLabel()));
            }
            validationLoss = vLoss / vx.length;
            long positives = RankingMetrics.countPositives(scored);
            if (positives > 0 && positives < scored.size()) {
                validationAuc = RankingMetrics.auc(scored);
            }
        }

        log.info("Training finished: {} after {} iterations, fit loss {}, validation AUC {}",
                stopReason, iterations, loss, validationAuc);

        return FittedModel.builder()
                .features(List.copyOf(features))
                .weights(toList(weights))
                .bias(bias)
                .means(toList(means))
                .stdDevs(toList(stdDevs))
                .metadata(metadata
                        .trainedAt(clock.instant())
                        .iterations(iterations)
                        .fitLoss(loss)
                        .validationLoss(validationLoss)
                        .validationAuc(validationAuc)
                        .stopReason(stopReason)
                        .build())
                .build();
    }

    private static void computeNormalization(List<TrainingRow> rows, List<Feature> features,
                                             double[] means, double[] stdDevs) {
        int n = rows.size();
        for (int j = 0; j < features.size(); j++) {
            Feature feature = features.get(j);
            double sum = 0.0;
            for (TrainingRow row : rows) {
                sum += feature.valueOf(row.getFeatures());
            }
            double mean = n == 0 ? 0.0 : sum / n;

            double squares = 0.0;
            for (TrainingRow row : rows) {
                double delta = feature.valueOf(row.getFeatures()) - mean;
                squares += delta * delta;
            }
            double std = n == 0 ? 0.0 : Math.sqrt(squares / n);

            means[j] = mean;
            stdDevs[j] = std < STD_FLOOR ? 1.0 : std;
        }
    }

    private static double[][] normalize(List<TrainingRow> rows, List<Feature> features,
                                        double[] means, double[] stdDevs) {
        double[][] x = new double[rows.size()][features.size()];
        for (int i = 0; i < rows.size(); i++) {
            for (int j = 0; j < features.size(); j++) {
                x[i][j] = (features.get(j).valueOf(rows.get(i).getFeatures()) - means[j]) / stdDevs[j];
            }
        }
        return x;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private static List<Double> toList(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double value : values) {
            list.add(value);
        }
        return List.copyOf(list);
    }
}
