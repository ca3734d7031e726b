package com.company.incidentrisk.controller;

import com.company.incidentrisk.domain.BacktestMetrics;
import com.company.incidentrisk.exception.BacktestDataException;
import com.company.incidentrisk.exception.BacktestInterruptedException;
import com.company.incidentrisk.security.CallerContext;
import com.company.incidentrisk.service.BacktestService;
import com.company.incidentrisk.service.IncidentRiskSummaryService;
import com.company.incidentrisk.support.MockMvcSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class BacktestControllerTest {

    private static final Instant FROM = Instant.parse("2026-01-05T00:00:00Z");
    private static final Instant TO = Instant.parse("2026-01-06T00:00:00Z");
    private static final String BODY = "{\"from\": \"2026-01-05T00:00:00Z\", \"to\": \"2026-01-06T00:00:00Z\", \"modelVersion\": 2}";

    @Mock
    private BacktestService backtestService;

    @Mock
    private IncidentRiskSummaryService summaryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcSupport.standalone(new BacktestController(backtestService, summaryService, new CallerContext()));
    }

    @Test
    void backtestReturnsMetrics() throws Exception {
        when(backtestService.runBacktest(FROM, TO, 2L, null)).thenReturn(BacktestMetrics.builder()
                .auc(0.81).precisionAtK(0.4).recallIncidents(0.5).support(8).k(20).evaluatedRows(288)
                .modelVersion(2L).from(FROM).to(TO)
                .build());

        mockMvc.perform(post("/api/v1/incident-risk/backtest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.auc").value(0.81))
                .andExpect(jsonPath("$.support").value(8));
    }

    @Test
    void backtestWithoutPositivesIsUnprocessable() throws Exception {
        when(backtestService.runBacktest(FROM, TO, 2L, null)).thenThrow(new BacktestDataException(288, 0));

        mockMvc.perform(post("/api/v1/incident-risk/backtest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.rowCount").value(288))
                .andExpect(jsonPath("$.positiveCount").value(0));
    }

    @Test
    void interruptedBacktestReportsTimeout() throws Exception {
        when(backtestService.runBacktest(FROM, TO, 2L, null))
                .thenThrow(new BacktestInterruptedException("time budget exceeded", null, 10, 288));

        mockMvc.perform(post("/api/v1/incident-risk/backtest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isRequestTimeout())
                .andExpect(jsonPath("$.message").value("Backtest stopped after scoring 10 of 288 rows: time budget exceeded"));
    }

    @Test
    void missingModelVersionIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/incident-risk/backtest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"from\": \"2026-01-05T00:00:00Z\", \"to\": \"2026-01-06T00:00:00Z\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.modelVersion").value("Model version is required"));
    }
}
