package com.company.incidentrisk.controller;

import com.company.incidentrisk.domain.EtlRunResult;
import com.company.incidentrisk.domain.IncidentRecord;
import com.company.incidentrisk.domain.IngestionBatchResult;
import com.company.incidentrisk.domain.TelemetryEvent;
import com.company.incidentrisk.security.CallerContext;
import com.company.incidentrisk.service.FeatureAggregationService;
import com.company.incidentrisk.service.IncidentOutcomeService;
import com.company.incidentrisk.service.TelemetryIngestionService;
import com.company.incidentrisk.support.MockMvcSupport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class TelemetryControllerTest {

    @Mock
    private TelemetryIngestionService ingestionService;

    @Mock
    private FeatureAggregationService aggregationService;

    @Mock
    private IncidentOutcomeService incidentOutcomeService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        TelemetryController controller = new TelemetryController(ingestionService, aggregationService,
                incidentOutcomeService, new CallerContext(), new SimpleMeterRegistry());
        mockMvc = MockMvcSupport.standalone(controller);
    }

    @Test
    @SuppressWarnings("unchecked")
    void ingestReturnsAcceptedWithCounts() throws Exception {
        when(ingestionService.ingestBatch(any())).thenReturn(IngestionBatchResult.builder()
                .received(2).accepted(1).rejected(1).droppedLate(0)
                .errors(List.of("event[1]: route must not be empty"))
                .build());

        mockMvc.perform(post("/api/v1/incident-risk/telemetry")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"events": [
                                  {"timestamp": "2026-01-05T00:00:10Z", "service": "checkout", "route": "/pay",
                                   "statusCode": 503, "latencyMs": 812.5, "memoryMb": 512, "cpuPct": 71.0,
                                   "retries": 1, "timeout": true},
                                  {"timestamp": "2026-01-05T00:00:11Z", "service": "checkout", "route": "",
                                   "statusCode": 200, "latencyMs": 20}
                                ]}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.accepted").value(1))
                .andExpect(jsonPath("$.rejected").value(1))
                .andExpect(jsonPath("$.errors[0]").value("event[1]: route must not be empty"));

        ArgumentCaptor<List<TelemetryEvent>> events = ArgumentCaptor.forClass(List.class);
        verify(ingestionService).ingestBatch(events.capture());
        TelemetryEvent first = events.getValue().get(0);
        assertThat(first.getTimestamp()).isEqualTo(Instant.parse("2026-01-05T00:00:10Z"));
        assertThat(first.isServerError()).isTrue();
        assertThat(first.isTimeout()).isTrue();
        assertThat(first.getReceivedAt()).isNull();
    }

    @Test
    void emptyBatchIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/incident-risk/telemetry")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"events\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"))
                .andExpect(jsonPath("$.errors.events").exists());

        verifyNoInteractions(ingestionService);
    }

    @Test
    void etlRunRequiresBothWindowBounds() throws Exception {
        mockMvc.perform(post("/api/v1/incident-risk/etl/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"windowStart\": \"2026-01-05T00:00:00Z\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.windowEnd").value("Window end is required"));
    }

    @Test
    void etlRunReturnsSummary() throws Exception {
        Instant start = Instant.parse("2026-01-05T00:00:00Z");
        Instant end = Instant.parse("2026-01-05T01:00:00Z");
        when(aggregationService.runEtl(start, end)).thenReturn(EtlRunResult.builder()
                .windowStart(start).windowEnd(end)
                .bucketsEvaluated(12).rowsUpserted(10).bucketsPending(2)
                .build());

        mockMvc.perform(post("/api/v1/incident-risk/etl/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"windowStart\": \"2026-01-05T00:00:00Z\", \"windowEnd\": \"2026-01-05T01:00:00Z\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rowsUpserted").value(10))
                .andExpect(jsonPath("$.bucketsPending").value(2));
    }

    @Test
    void invertedEtlWindowIsBadRequest() throws Exception {
        when(aggregationService.runEtl(any(), any()))
                .thenThrow(new IllegalArgumentException("windowStart must be before windowEnd"));

        mockMvc.perform(post("/api/v1/incident-risk/etl/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"windowStart\": \"2026-01-05T01:00:00Z\", \"windowEnd\": \"2026-01-05T00:00:00Z\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("windowStart must be before windowEnd"));
    }

    @Test
    void recordIncidentReturnsCreated() throws Exception {
        when(incidentOutcomeService.recordIncident(any())).thenAnswer(invocation -> {
            IncidentRecord incident = invocation.getArgument(0);
            incident.setIncidentId(11L);
            return incident;
        });

        mockMvc.perform(post("/api/v1/incident-risk/incidents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"service": "checkout", "route": "/pay",
                                 "startedAt": "2026-01-05T00:20:00Z", "severity": "SEV2"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.incidentId").value(11));
    }
}
