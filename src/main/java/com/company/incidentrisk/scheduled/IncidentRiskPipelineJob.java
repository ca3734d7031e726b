package com.company.incidentrisk.scheduled;

import com.company.incidentrisk.config.IncidentRiskProperties;
import com.company.incidentrisk.domain.PredictionResult;
import com.company.incidentrisk.exception.ModelNotFoundException;
import com.company.incidentrisk.service.AlertEvaluationService;
import com.company.incidentrisk.service.FeatureAggregationService;
import com.company.incidentrisk.service.InferenceService;
import com.company.incidentrisk.service.TelemetryIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Optional orchestration: derives explicit time ranges and calls the same operations
 * exposed over HTTP. Disabled unless incident-risk.scheduler.enabled=true.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "incident-risk.scheduler.enabled",
        havingValue = "true",
        matchIfMissing = false
)
public class IncidentRiskPipelineJob {

    private final FeatureAggregationService aggregationService;
    private final InferenceService inferenceService;
    private final AlertEvaluationService alertEvaluationService;
    private final TelemetryIngestionService ingestionService;
    private final IncidentRiskProperties properties;
    private final Clock clock;

    /**
     * ETL over the lookback window, then live scoring and alert evaluation
     */
    @Scheduled(fixedDelayString = "${incident-risk.scheduler.pipeline-interval-ms:60000}", initialDelay = 30000)
    public void runPipeline() {
        Instant now = clock.instant();
        Instant windowStart = now.minus(properties.getScheduler().getEtlLookback());

        try {
            aggregationService.runEtl(windowStart, now);
        } catch (Exception e) {
            log.error("Scheduled ETL run failed", e);
            return;
        }

        try {
            List<PredictionResult> predictions = inferenceService.inferLive(null, null);
            alertEvaluationService.evaluate(predictions);
        } catch (ModelNotFoundException e) {
            log.info("Skipping live scoring: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled live scoring failed", e);
        }
    }

    /**
     * Raw telemetry retention, hourly
     */
    @Scheduled(cron = "0 15 * * * *")
    public void purgeExpiredTelemetry() {
        try {
            ingestionService.purgeExpired();
        } catch (Exception e) {
            log.error("Telemetry purge failed", e);
        }
    }
}
