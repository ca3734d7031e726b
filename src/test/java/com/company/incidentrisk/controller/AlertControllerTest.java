package com.company.incidentrisk.controller;

import com.company.incidentrisk.domain.Alert;
import com.company.incidentrisk.domain.PredictionResult;
import com.company.incidentrisk.domain.enums.AlertStatus;
import com.company.incidentrisk.domain.enums.DeliveryStatus;
import com.company.incidentrisk.domain.enums.Severity;
import com.company.incidentrisk.exception.AlertNotFoundException;
import com.company.incidentrisk.exception.InvalidAlertTransitionException;
import com.company.incidentrisk.security.CallerContext;
import com.company.incidentrisk.service.AlertEvaluationService;
import com.company.incidentrisk.service.InferenceService;
import com.company.incidentrisk.support.MockMvcSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static com.company.incidentrisk.support.TestFixtures.T0;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AlertControllerTest {

    @Mock
    private AlertEvaluationService alertEvaluationService;

    @Mock
    private InferenceService inferenceService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcSupport.standalone(
                new AlertController(alertEvaluationService, inferenceService, new CallerContext()));
    }

    private static Alert alert(long id, AlertStatus status) {
        return Alert.builder()
                .alertId(id)
                .service("checkout")
                .route("/pay")
                .bucketStart(T0)
                .severity(Severity.CRITICAL)
                .riskScore(0.93)
                .modelVersion(2L)
                .topFactors("errorRate=+2.1000")
                .status(status)
                .createdAt(T0)
                .deliveryStatus(DeliveryStatus.SENT)
                .build();
    }

    @Test
    void evaluateWithoutBodyUsesLivePredictions() throws Exception {
        List<PredictionResult> live = List.of(PredictionResult.builder()
                .service("checkout").route("/pay").bucketStart(T0).riskScore(0.93).modelVersion(2L)
                .topFactors(List.of())
                .build());
        when(inferenceService.inferLive(null, null)).thenReturn(live);
        when(alertEvaluationService.evaluate(live)).thenReturn(List.of(alert(1L, AlertStatus.OPEN)));

        mockMvc.perform(post("/api/v1/incident-risk/alerts/evaluate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].alertId").value(1))
                .andExpect(jsonPath("$[0].severity").value("CRITICAL"))
                .andExpect(jsonPath("$[0].status").value("OPEN"));

        verify(alertEvaluationService).evaluate(live);
    }

    @Test
    void acknowledgeReturnsUpdatedAlert() throws Exception {
        when(alertEvaluationService.acknowledge(4L)).thenReturn(alert(4L, AlertStatus.ACKNOWLEDGED));

        mockMvc.perform(post("/api/v1/incident-risk/alerts/4/acknowledge"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACKNOWLEDGED"));
    }

    @Test
    void invalidTransitionIsConflict() throws Exception {
        when(alertEvaluationService.acknowledge(4L))
                .thenThrow(new InvalidAlertTransitionException(4L, AlertStatus.RESOLVED, AlertStatus.ACKNOWLEDGED));

        mockMvc.perform(post("/api/v1/incident-risk/alerts/4/acknowledge"))
                .andExpect(status().isConflict());
    }

    @Test
    void unknownAlertIsNotFound() throws Exception {
        when(alertEvaluationService.getAlert(9L)).thenThrow(new AlertNotFoundException(9L));

        mockMvc.perform(get("/api/v1/incident-risk/alerts/9"))
                .andExpect(status().isNotFound());
    }

    @Test
    void listFiltersByStatus() throws Exception {
        when(alertEvaluationService.listAlerts(AlertStatus.OPEN, 100)).thenReturn(List.of(alert(1L, AlertStatus.OPEN)));

        mockMvc.perform(get("/api/v1/incident-risk/alerts").param("status", "OPEN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void unknownStatusIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/incident-risk/alerts").param("status", "SNOOZED"))
                .andExpect(status().isBadRequest());
    }
}
