package com.company.incidentrisk.service;

import com.company.incidentrisk.config.IncidentRiskProperties;
import com.company.incidentrisk.domain.BacktestMetrics;
import com.company.incidentrisk.domain.ModelArtifact;
import com.company.incidentrisk.domain.ScoredExample;
import com.company.incidentrisk.domain.TrainingHyperparameters;
import com.company.incidentrisk.domain.TrainingRow;
import com.company.incidentrisk.exception.BacktestDataException;
import com.company.incidentrisk.exception.BacktestInterruptedException;
import com.company.incidentrisk.util.CancellationToken;
import com.company.incidentrisk.util.RankingMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Replays labeled history through a pinned model version. Independent of the active model
 * and of the alerting path.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BacktestService {

    private final ModelRegistryService modelRegistry;
    private final LabelGenerator labelGenerator;
    private final RiskScorer riskScorer;
    private final IncidentRiskProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Labels use the horizon the model was trained with, falling back to configuration.
     *
     * @param k top-K cut-off, or null for the configured default
     */
    public BacktestMetrics runBacktest(Instant from, Instant to, long modelVersion, Integer k) {
        if (!from.isBefore(to)) {
            throw new IllegalArgumentException("from must be before to");
        }
        int effectiveK = k != null ? k : properties.getBacktest().getDefaultK();
        if (effectiveK < 1) {
            throw new IllegalArgumentException("k must be at least 1");
        }

        ModelArtifact model = modelRegistry.getModel(modelVersion);

        int lookahead = properties.getLabels().getLookaheadBuckets();
        double threshold = properties.getLabels().getIncidentThreshold();
        TrainingHyperparameters trainedWith = model.getMetadata() != null
                ? model.getMetadata().getHyperparameters() : null;
        if (trainedWith != null) {
            lookahead = trainedWith.getLookaheadBuckets();
            threshold = trainedWith.getIncidentThreshold();
        }

        List<TrainingRow> rows = labelGenerator.buildTrainingRows(from, to, lookahead, threshold);

        BacktestMetrics metrics = backtest(rows, model, effectiveK, from, to,
                CancellationToken.withBudget(clock, properties.getBacktest().getTimeBudget()));

        meterRegistry.counter("incident.backtest.runs", "outcome", "success").increment();
        log.info("Backtest of model {} over [{}, {}): {} rows, auc={}, precision@{}={}, recall={}",
                modelVersion, from, to, metrics.getEvaluatedRows(), metrics.getAuc(),
                effectiveK, metrics.getPrecisionAtK(), metrics.getRecallIncidents());
        return metrics;
    }

    /**
     * Scores every row, checking the token between rows.
     *
     * @throws BacktestDataException when the rows hold no positive label
     * @throws BacktestInterruptedException with metrics over the rows scored so far
     */
    public BacktestMetrics backtest(List<TrainingRow> rows, ModelArtifact model, int k,
                                    Instant from, Instant to, CancellationToken cancellationToken) {
        int positives = (int) rows.stream().filter(TrainingRow::isPositive).count();
        if (positives == 0) {
            meterRegistry.counter("incident.backtest.runs", "outcome", "insufficient_data").increment();
            throw new BacktestDataException(rows.size(), positives);
        }

        List<ScoredExample> scored = new ArrayList<>(rows.size());
        for (TrainingRow row : rows) {
            if (cancellationToken.isCancellationRequested()) {
                meterRegistry.counter("incident.backtest.runs", "outcome", "interrupted").increment();
                log.warn("Backtest of model {} interrupted after {} of {} rows: {}",
                        model.getVersion(), scored.size(), rows.size(), cancellationToken.reason());
                throw new BacktestInterruptedException(cancellationToken.reason(),
                        partialMetrics(scored, k, model.getVersion(), from, to), scored.size(), rows.size());
            }
            double score = riskScorer.score(row.getFeatures(), model, 0).getRiskScore();
            scored.add(new ScoredExample(row.getFeatures().getBucketStart(), score, row.getLabel()));
        }

        return computeMetrics(scored, k, model.getVersion(), from, to);
    }

    /**
     * Ranking metrics over already scored examples. AUC is left null when no row is negative.
     *
     * @throws BacktestDataException when no row is positive
     */
    public static BacktestMetrics computeMetrics(List<ScoredExample> scored, int k, long modelVersion,
                                                 Instant from, Instant to) {
        int positives = (int) RankingMetrics.countPositives(scored);
        if (positives == 0) {
            throw new BacktestDataException(scored.size(), positives);
        }

        return BacktestMetrics.builder()
                .auc(positives < scored.size() ? RankingMetrics.auc(scored) : null)
                .precisionAtK(RankingMetrics.precisionAtK(scored, k))
                .recallIncidents(RankingMetrics.recallAtK(scored, k))
                .support(positives)
                .k(k)
                .evaluatedRows(scored.size())
                .modelVersion(modelVersion)
                .from(from)
                .to(to)
                .build();
    }

    private static BacktestMetrics partialMetrics(List<ScoredExample> scored, int k, long modelVersion,
                                                  Instant from, Instant to) {
        if (RankingMetrics.countPositives(scored) == 0) {
            return null;
        }
        return computeMetrics(scored, k, modelVersion, from, to);
    }
}
