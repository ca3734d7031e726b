package com.company.incidentrisk.service;

import com.company.incidentrisk.config.IncidentRiskProperties;
import com.company.incidentrisk.domain.FeatureRow;
import com.company.incidentrisk.domain.ModelArtifact;
import com.company.incidentrisk.domain.PredictionResult;
import com.company.incidentrisk.domain.enums.InferenceMode;
import com.company.incidentrisk.repository.FeatureRowRepository;
import com.company.incidentrisk.util.BucketWindows;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Scores feature rows against one immutable model snapshot, read once per call.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InferenceService {

    private final ModelRegistryService modelRegistry;
    private final FeatureRowRepository featureRowRepository;
    private final RiskScorer riskScorer;
    private final BucketWindows bucketWindows;
    private final IncidentRiskProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Scores the given rows with the active model, in input order.
     *
     * @throws com.company.incidentrisk.exception.ModelNotFoundException when no model is active
     */
    public List<PredictionResult> inferBatch(List<FeatureRow> rows) {
        ModelArtifact model = modelRegistry.getActiveModel();
        return score(rows, model, InferenceMode.BATCH);
    }

    /**
     * Scores the newest closed bucket of every monitored series, optionally narrowed by service and route.
     */
    public List<PredictionResult> inferLive(String service, String route) {
        ModelArtifact model = modelRegistry.getActiveModel();

        Instant latestClosed = bucketWindows.latestClosedBucketStart(clock.instant());
        List<FeatureRow> rows = featureRowRepository.findLatestPerSeries(latestClosed).stream()
                .filter(row -> service == null || service.equals(row.getService()))
                .filter(row -> route == null || route.equals(row.getRoute()))
                .toList();

        log.debug("Live inference over {} series (latest closed bucket {})", rows.size(), latestClosed);
        return score(rows, model, InferenceMode.LIVE);
    }

    private List<PredictionResult> score(List<FeatureRow> rows, ModelArtifact model, InferenceMode mode) {
        int topFactors = properties.getInference().getTopFactors();

        List<PredictionResult> predictions = rows.parallelStream()
                .map(row -> riskScorer.score(row, model, topFactors))
                .toList();

        meterRegistry.counter("incident.inference.predictions",
                "mode", mode.tag()
        ).increment(predictions.size());

        log.info("Scored {} rows in {} mode with model version {}", predictions.size(), mode.tag(), model.getVersion());
        return predictions;
    }
}
