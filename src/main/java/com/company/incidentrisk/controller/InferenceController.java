package com.company.incidentrisk.controller;

import com.company.incidentrisk.domain.FeatureRow;
import com.company.incidentrisk.domain.PredictionResult;
import com.company.incidentrisk.dto.request.BatchInferenceRequest;
import com.company.incidentrisk.dto.request.FeatureRowRequest;
import com.company.incidentrisk.service.InferenceService;
import com.company.incidentrisk.util.BucketWindows;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/incident-risk/infer")
@Tag(name = "Inference", description = "Risk scoring against the active model")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class InferenceController {

    private final InferenceService inferenceService;
    private final BucketWindows bucketWindows;

    @PostMapping("/batch")
    @Operation(summary = "Score feature rows", description = "Missing feature values are scored as 0")
    @PreAuthorize("hasRole('ML_OPERATOR')")
    public ResponseEntity<List<PredictionResult>> inferBatch(@Valid @RequestBody BatchInferenceRequest request) {
        List<FeatureRow> rows = request.getRows().stream()
                .map(this::toFeatureRow)
                .toList();

        return ResponseEntity.ok(inferenceService.inferBatch(rows));
    }

    @GetMapping("/live")
    @Operation(summary = "Score the latest closed bucket of each monitored series")
    @PreAuthorize("hasAnyRole('UI_READER', 'ML_OPERATOR')")
    public ResponseEntity<List<PredictionResult>> inferLive(
            @Parameter(description = "Only this service") @RequestParam(required = false) String service,
            @Parameter(description = "Only this route") @RequestParam(required = false) String route) {

        return ResponseEntity.ok(inferenceService.inferLive(service, route));
    }

    private FeatureRow toFeatureRow(FeatureRowRequest request) {
        return FeatureRow.builder()
                .service(request.getService())
                .route(request.getRoute())
                .bucketStart(request.getBucketStart())
                .bucketEnd(bucketWindows.bucketEnd(request.getBucketStart()))
                .errorRate(orZero(request.getErrorRate()))
                .p95LatencyMs(orZero(request.getP95LatencyMs()))
                .p99LatencyMs(orZero(request.getP99LatencyMs()))
                .avgMemoryMb(orZero(request.getAvgMemoryMb()))
                .avgCpuPct(orZero(request.getAvgCpuPct()))
                .retriesRate(orZero(request.getRetriesRate()))
                .timeoutRate(orZero(request.getTimeoutRate()))
                .totalRequests(request.getTotalRequests() != null ? request.getTotalRequests() : 0L)
                .build();
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}
