package com.company.incidentrisk.controller;

import com.company.incidentrisk.domain.EtlRunResult;
import com.company.incidentrisk.domain.IncidentRecord;
import com.company.incidentrisk.domain.IngestionBatchResult;
import com.company.incidentrisk.domain.TelemetryEvent;
import com.company.incidentrisk.dto.request.EtlRunRequest;
import com.company.incidentrisk.dto.request.IncidentRequest;
import com.company.incidentrisk.dto.request.TelemetryBatchRequest;
import com.company.incidentrisk.dto.request.TelemetryEventRequest;
import com.company.incidentrisk.security.CallerContext;
import com.company.incidentrisk.service.FeatureAggregationService;
import com.company.incidentrisk.service.IncidentOutcomeService;
import com.company.incidentrisk.service.TelemetryIngestionService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;

@RestController
@RequestMapping("/api/v1/incident-risk")
@Tag(name = "Telemetry Pipeline", description = "Telemetry ingestion, feature ETL and incident outcomes")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class TelemetryController {

    private final TelemetryIngestionService ingestionService;
    private final FeatureAggregationService aggregationService;
    private final IncidentOutcomeService incidentOutcomeService;
    private final CallerContext callerContext;
    private final MeterRegistry meterRegistry;

    @PostMapping("/telemetry")
    @Operation(summary = "Ingest telemetry events",
            description = "Each event is validated on its own; the response counts accepted, rejected and late-dropped events")
    @PreAuthorize("hasRole('TELEMETRY_WRITER')")
    public ResponseEntity<IngestionBatchResult> ingestTelemetry(@Valid @RequestBody TelemetryBatchRequest request) {
        meterRegistry.counter("api.telemetry.requests").increment();

        List<TelemetryEvent> events = request.getEvents().stream()
                .map(TelemetryController::toEvent)
                .toList();

        IngestionBatchResult result = ingestionService.ingestBatch(events);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(result);
    }

    @PostMapping("/etl/run")
    @Operation(summary = "Run feature ETL", description = "Computes closed buckets in the given window")
    @PreAuthorize("hasRole('ML_OPERATOR')")
    public ResponseEntity<EtlRunResult> runEtl(@Valid @RequestBody EtlRunRequest request) {
        log.info("ETL run requested by {} for [{}, {})",
                callerContext.getCurrentUserId(), request.getWindowStart(), request.getWindowEnd());

        return ResponseEntity.ok(aggregationService.runEtl(request.getWindowStart(), request.getWindowEnd()));
    }

    @PostMapping("/incidents")
    @Operation(summary = "Record an observed incident", description = "Outcome used to label training data")
    @PreAuthorize("hasAnyRole('ML_OPERATOR', 'TELEMETRY_WRITER')")
    public ResponseEntity<IncidentRecord> recordIncident(@Valid @RequestBody IncidentRequest request) {
        IncidentRecord incident = incidentOutcomeService.recordIncident(IncidentRecord.builder()
                .service(request.getService())
                .route(request.getRoute())
                .startedAt(request.getStartedAt())
                .severity(request.getSeverity())
                .description(request.getDescription())
                .build());

        return ResponseEntity
                .created(URI.create("/api/v1/incident-risk/incidents/" + incident.getIncidentId()))
                .body(incident);
    }

    private static TelemetryEvent toEvent(TelemetryEventRequest request) {
        return TelemetryEvent.builder()
                .timestamp(request.getTimestamp())
                .service(request.getService())
                .route(request.getRoute())
                .statusCode(request.getStatusCode())
                .latencyMs(request.getLatencyMs())
                .memoryMb(request.getMemoryMb())
                .cpuPct(request.getCpuPct())
                .retries(request.getRetries())
                .timeout(request.isTimeout())
                .build();
    }
}
