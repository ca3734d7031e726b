package com.company.incidentrisk.controller;

import com.company.incidentrisk.domain.Alert;
import com.company.incidentrisk.domain.PredictionResult;
import com.company.incidentrisk.domain.enums.AlertStatus;
import com.company.incidentrisk.dto.request.EvaluateAlertsRequest;
import com.company.incidentrisk.dto.response.AlertResponse;
import com.company.incidentrisk.security.CallerContext;
import com.company.incidentrisk.service.AlertEvaluationService;
import com.company.incidentrisk.service.InferenceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/incident-risk/alerts")
@Tag(name = "Alerts", description = "Alert evaluation and status transitions")
@RequiredArgsConstructor
@Slf4j
@Validated
@SecurityRequirement(name = "bearer-jwt")
public class AlertController {

    private final AlertEvaluationService alertEvaluationService;
    private final InferenceService inferenceService;
    private final CallerContext callerContext;

    @PostMapping("/evaluate")
    @Operation(summary = "Evaluate predictions into alerts",
            description = "Without predictions in the body, the current live predictions are evaluated")
    @PreAuthorize("hasRole('ML_OPERATOR')")
    public ResponseEntity<List<AlertResponse>> evaluate(@RequestBody(required = false) EvaluateAlertsRequest request) {
        List<PredictionResult> predictions = request != null && request.getPredictions() != null
                ? request.getPredictions()
                : inferenceService.inferLive(null, null);

        List<Alert> created = alertEvaluationService.evaluate(predictions);
        return ResponseEntity.ok(created.stream().map(AlertController::toResponse).toList());
    }

    @PostMapping("/{alertId}/acknowledge")
    @Operation(summary = "Acknowledge an open alert")
    @PreAuthorize("hasAnyRole('ML_OPERATOR', 'UI_READER')")
    public ResponseEntity<AlertResponse> acknowledge(@PathVariable long alertId) {
        log.info("Alert {} acknowledged by {}", alertId, callerContext.getCurrentUserId());
        return ResponseEntity.ok(toResponse(alertEvaluationService.acknowledge(alertId)));
    }

    @PostMapping("/{alertId}/resolve")
    @Operation(summary = "Resolve an alert")
    @PreAuthorize("hasAnyRole('ML_OPERATOR', 'UI_READER')")
    public ResponseEntity<AlertResponse> resolve(@PathVariable long alertId) {
        log.info("Alert {} resolved by {}", alertId, callerContext.getCurrentUserId());
        return ResponseEntity.ok(toResponse(alertEvaluationService.resolve(alertId)));
    }

    @GetMapping
    @Operation(summary = "List alerts, newest first")
    @PreAuthorize("hasAnyRole('UI_READER', 'ML_OPERATOR')")
    public ResponseEntity<List<AlertResponse>> listAlerts(
            @Parameter(description = "OPEN, ACKNOWLEDGED or RESOLVED; all when omitted")
            @RequestParam(required = false) AlertStatus status,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {

        return ResponseEntity.ok(alertEvaluationService.listAlerts(status, limit).stream()
                .map(AlertController::toResponse)
                .toList());
    }

    @GetMapping("/{alertId}")
    @Operation(summary = "Get one alert")
    @PreAuthorize("hasAnyRole('UI_READER', 'ML_OPERATOR')")
    public ResponseEntity<AlertResponse> getAlert(@PathVariable long alertId) {
        return ResponseEntity.ok(toResponse(alertEvaluationService.getAlert(alertId)));
    }

    private static AlertResponse toResponse(Alert alert) {
        return AlertResponse.builder()
                .alertId(alert.getAlertId())
                .service(alert.getService())
                .route(alert.getRoute())
                .bucketStart(alert.getBucketStart())
                .severity(alert.getSeverity().name())
                .riskScore(alert.getRiskScore())
                .modelVersion(alert.getModelVersion())
                .topFactors(alert.getTopFactors())
                .status(alert.getStatus().name())
                .createdAt(alert.getCreatedAt())
                .acknowledgedAt(alert.getAcknowledgedAt())
                .resolvedAt(alert.getResolvedAt())
                .deliveryStatus(alert.getDeliveryStatus() != null ? alert.getDeliveryStatus().name() : null)
                .build();
    }
}
