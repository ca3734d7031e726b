package com.company.incidentrisk.scheduled;

import com.company.incidentrisk.domain.PredictionResult;
import com.company.incidentrisk.exception.ModelNotFoundException;
import com.company.incidentrisk.exception.StoreUnavailableException;
import com.company.incidentrisk.service.AlertEvaluationService;
import com.company.incidentrisk.service.FeatureAggregationService;
import com.company.incidentrisk.service.InferenceService;
import com.company.incidentrisk.service.TelemetryIngestionService;
import com.company.incidentrisk.support.MutableClock;
import com.company.incidentrisk.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.company.incidentrisk.support.TestFixtures.T0;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IncidentRiskPipelineJobTest {

    @Mock
    private FeatureAggregationService aggregationService;

    @Mock
    private InferenceService inferenceService;

    @Mock
    private AlertEvaluationService alertEvaluationService;

    @Mock
    private TelemetryIngestionService ingestionService;

    private IncidentRiskPipelineJob job;

    @BeforeEach
    void setUp() {
        job = new IncidentRiskPipelineJob(aggregationService, inferenceService, alertEvaluationService,
                ingestionService, TestFixtures.properties(), new MutableClock(T0.plus(Duration.ofHours(1))));
    }

    @Test
    void runsEtlOverLookbackThenScoresAndEvaluates() {
        List<PredictionResult> predictions = List.of(PredictionResult.builder()
                .service("checkout").route("/pay").bucketStart(T0).riskScore(0.2).modelVersion(1L)
                .topFactors(List.of())
                .build());
        when(inferenceService.inferLive(null, null)).thenReturn(predictions);

        job.runPipeline();

        Instant now = T0.plus(Duration.ofHours(1));
        verify(aggregationService).runEtl(now.minus(Duration.ofMinutes(30)), now);
        verify(alertEvaluationService).evaluate(predictions);
    }

    @Test
    void skipsScoringWithoutActiveModel() {
        when(inferenceService.inferLive(null, null))
                .thenThrow(ModelNotFoundException.noActiveModel("incident-risk-logistic"));

        job.runPipeline();

        verifyNoInteractions(alertEvaluationService);
    }

    @Test
    void etlFailureStopsTheCycle() {
        when(aggregationService.runEtl(any(), any())).thenThrow(new StoreUnavailableException("down", null));

        job.runPipeline();

        verifyNoInteractions(inferenceService, alertEvaluationService);
    }

    @Test
    void purgeDelegatesToIngestion() {
        job.purgeExpiredTelemetry();

        verify(ingestionService).purgeExpired();
    }
}
