package com.company.incidentrisk.controller;

import com.company.incidentrisk.domain.BacktestMetrics;
import com.company.incidentrisk.dto.request.BacktestRequest;
import com.company.incidentrisk.dto.response.RiskSummaryResponse;
import com.company.incidentrisk.security.CallerContext;
import com.company.incidentrisk.service.BacktestService;
import com.company.incidentrisk.service.IncidentRiskSummaryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api/v1/incident-risk")
@Tag(name = "Evaluation", description = "Backtests and pipeline summary")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class BacktestController {

    private final BacktestService backtestService;
    private final IncidentRiskSummaryService summaryService;
    private final CallerContext callerContext;

    @PostMapping("/backtest")
    @Operation(summary = "Backtest a model version over a historical range",
            description = "Returns AUC, precision@K, recall and support")
    @PreAuthorize("hasRole('ML_OPERATOR')")
    public ResponseEntity<BacktestMetrics> backtest(@Valid @RequestBody BacktestRequest request) {
        log.info("Backtest of model {} requested by {}", request.getModelVersion(), callerContext.getCurrentUserId());

        return ResponseEntity.ok(backtestService.runBacktest(
                request.getFrom(), request.getTo(), request.getModelVersion(), request.getK()));
    }

    @GetMapping("/summary")
    @Operation(summary = "Pipeline summary", description = "Active model, recent alerts, last ETL run and telemetry totals")
    @PreAuthorize("hasAnyRole('UI_READER', 'ML_OPERATOR')")
    public ResponseEntity<RiskSummaryResponse> getSummary() {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(15, TimeUnit.SECONDS).cachePrivate())
                .body(summaryService.getSummary());
    }
}
