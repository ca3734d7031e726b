package com.company.incidentrisk.service;

import com.company.incidentrisk.config.IncidentRiskProperties;
import com.company.incidentrisk.domain.EtlRunResult;
import com.company.incidentrisk.domain.TelemetryTotals;
import com.company.incidentrisk.domain.enums.Severity;
import com.company.incidentrisk.dto.response.RiskSummaryResponse;
import com.company.incidentrisk.repository.AlertRepository;
import com.company.incidentrisk.repository.FeatureRowRepository;
import com.company.incidentrisk.repository.TelemetryEventRepository;
import com.company.incidentrisk.util.StatsUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class IncidentRiskSummaryService {

    private static final Duration RECENT_ALERT_WINDOW = Duration.ofHours(24);

    private final ModelRegistryService modelRegistry;
    private final ModelTrainingService trainingService;
    private final FeatureAggregationService aggregationService;
    private final TelemetryIngestionService ingestionService;
    private final TelemetryEventRepository telemetryRepository;
    private final FeatureRowRepository featureRowRepository;
    private final AlertRepository alertRepository;
    private final IncidentRiskProperties properties;
    private final Clock clock;

    public RiskSummaryResponse getSummary() {
        Instant now = clock.instant();
        String family = properties.getTraining().getModelFamily();

        Map<Severity, Long> recent = alertRepository.countCreatedSince(now.minus(RECENT_ALERT_WINDOW));
        Map<String, Long> alertsBySeverity = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            alertsBySeverity.put(severity.name(), recent.getOrDefault(severity, 0L));
        }

        TelemetryTotals totals = telemetryRepository.summarize();
        Optional<EtlRunResult> lastRun = aggregationService.getLastRun();

        return RiskSummaryResponse.builder()
                .modelFamily(family)
                .activeModelVersion(modelRegistry.findActiveVersion().orElse(null))
                .trainingInProgress(trainingService.isTraining(family))
                .openAlerts(alertRepository.countOpen())
                .alertsLast24h(alertsBySeverity)
                .lastEtlRunAt(lastRun.map(EtlRunResult::getCompletedAt).orElse(null))
                .lastEtlRowsUpserted(lastRun.map(EtlRunResult::getRowsUpserted).orElse(null))
                .totalEvents(totals.getTotalEvents())
                .errorRate(StatsUtils.ratio(totals.getServerErrors(), totals.getTotalEvents()))
                .timeoutRate(StatsUtils.ratio(totals.getTimeouts(), totals.getTotalEvents()))
                .lateDroppedEvents(ingestionService.getLateDroppedCount())
                .featureRows(featureRowRepository.count())
                .generatedAt(now)
                .build();
    }
}
