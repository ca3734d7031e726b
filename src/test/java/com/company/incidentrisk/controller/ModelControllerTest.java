package com.company.incidentrisk.controller;

import com.company.incidentrisk.domain.ModelArtifact;
import com.company.incidentrisk.domain.TrainingHyperparameters;
import com.company.incidentrisk.exception.InsufficientTrainingDataException;
import com.company.incidentrisk.exception.ModelNotFoundException;
import com.company.incidentrisk.exception.TrainingInProgressException;
import com.company.incidentrisk.security.CallerContext;
import com.company.incidentrisk.service.ModelRegistryService;
import com.company.incidentrisk.service.ModelTrainingService;
import com.company.incidentrisk.support.MockMvcSupport;
import com.company.incidentrisk.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ModelControllerTest {

    @Mock
    private ModelTrainingService trainingService;

    @Mock
    private ModelRegistryService modelRegistry;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcSupport.standalone(new ModelController(trainingService, modelRegistry, new CallerContext()));
    }

    @Test
    void noActiveModelIsNotFound() throws Exception {
        when(modelRegistry.getActiveModel())
                .thenThrow(ModelNotFoundException.noActiveModel("incident-risk-logistic"));

        mockMvc.perform(get("/api/v1/incident-risk/models/active"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void trainingWithoutEnoughDataIsUnprocessable() throws Exception {
        when(trainingService.trainModel(null)).thenThrow(new InsufficientTrainingDataException(12, 0, 50));

        mockMvc.perform(post("/api/v1/incident-risk/models/train"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.rowCount").value(12))
                .andExpect(jsonPath("$.positiveCount").value(0))
                .andExpect(jsonPath("$.negativeCount").value(12))
                .andExpect(jsonPath("$.minRows").value(50));
    }

    @Test
    void concurrentTrainingIsConflict() throws Exception {
        when(trainingService.trainModel(null)).thenThrow(new TrainingInProgressException("incident-risk-logistic"));

        mockMvc.perform(post("/api/v1/incident-risk/models/train"))
                .andExpect(status().isConflict());
    }

    @Test
    void trainMergesOverridesOntoDefaults() throws Exception {
        when(trainingService.defaultHyperparameters()).thenReturn(TestFixtures.hyperparameters());
        when(trainingService.trainModel(any())).thenReturn(TestFixtures.errorRateModel(5L, 1.0, 0.0));

        mockMvc.perform(post("/api/v1/incident-risk/models/train")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"minRows\": 25, \"lookaheadBuckets\": 6, \"timeBudgetSeconds\": 30}"))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "/api/v1/incident-risk/models/5"))
                .andExpect(jsonPath("$.version").value(5))
                .andExpect(jsonPath("$.active").value(false));

        ArgumentCaptor<TrainingHyperparameters> captor = ArgumentCaptor.forClass(TrainingHyperparameters.class);
        verify(trainingService).trainModel(captor.capture());
        TrainingHyperparameters used = captor.getValue();
        assertThat(used.getMinRows()).isEqualTo(25);
        assertThat(used.getLookaheadBuckets()).isEqualTo(6);
        assertThat(used.getTimeBudget()).isEqualTo(Duration.ofSeconds(30));
        assertThat(used.getLearningRate()).isEqualTo(TestFixtures.hyperparameters().getLearningRate());
    }

    @Test
    void invalidOverrideIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/incident-risk/models/train")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"validationFraction\": 0.95}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.validationFraction").exists());
    }

    @Test
    void activateMarksVersionActive() throws Exception {
        when(modelRegistry.activate(3L)).thenReturn(TestFixtures.errorRateModel(3L, 1.0, 0.0));

        mockMvc.perform(post("/api/v1/incident-risk/models/3/activate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(3))
                .andExpect(jsonPath("$.active").value(true));
    }

    @Test
    void listFlagsOnlyTheActiveVersion() throws Exception {
        ModelArtifact v1 = TestFixtures.errorRateModel(1L, 1.0, 0.0);
        ModelArtifact v2 = TestFixtures.errorRateModel(2L, 2.0, 0.0);
        when(modelRegistry.findActiveVersion()).thenReturn(Optional.of(1L));
        when(modelRegistry.listModels()).thenReturn(List.of(v1, v2));

        mockMvc.perform(get("/api/v1/incident-risk/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].active").value(true))
                .andExpect(jsonPath("$[1].active").value(false));
    }
}
