package com.company.incidentrisk.controller;

import com.company.incidentrisk.domain.ModelArtifact;
import com.company.incidentrisk.domain.TrainingHyperparameters;
import com.company.incidentrisk.dto.request.TrainModelRequest;
import com.company.incidentrisk.dto.response.ModelResponse;
import com.company.incidentrisk.security.CallerContext;
import com.company.incidentrisk.service.ModelRegistryService;
import com.company.incidentrisk.service.ModelTrainingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/incident-risk/models")
@Tag(name = "Models", description = "Training, activation and inspection of risk models")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class ModelController {

    private final ModelTrainingService trainingService;
    private final ModelRegistryService modelRegistry;
    private final CallerContext callerContext;

    @PostMapping("/train")
    @Operation(summary = "Train a new model version",
            description = "Publishes a new immutable version; it is not activated")
    @PreAuthorize("hasRole('ML_OPERATOR')")
    public ResponseEntity<ModelResponse> train(@Valid @RequestBody(required = false) TrainModelRequest request) {
        log.info("Training requested by {}", callerContext.getCurrentUserId());

        ModelArtifact artifact = trainingService.trainModel(
                request != null ? toHyperparameters(request) : null);

        return ResponseEntity
                .created(URI.create("/api/v1/incident-risk/models/" + artifact.getVersion()))
                .body(toResponse(artifact, Optional.empty()));
    }

    @PostMapping("/{version}/activate")
    @Operation(summary = "Activate a model version", description = "Also used to roll back to an older version")
    @PreAuthorize("hasRole('ML_OPERATOR')")
    public ResponseEntity<ModelResponse> activate(@PathVariable long version) {
        log.info("Activation of model version {} requested by {}", version, callerContext.getCurrentUserId());

        ModelArtifact artifact = modelRegistry.activate(version);
        return ResponseEntity.ok(toResponse(artifact, Optional.of(version)));
    }

    @GetMapping
    @Operation(summary = "List retained model versions")
    @PreAuthorize("hasAnyRole('UI_READER', 'ML_OPERATOR')")
    public ResponseEntity<List<ModelResponse>> listModels() {
        Optional<Long> active = modelRegistry.findActiveVersion();
        return ResponseEntity.ok(modelRegistry.listModels().stream()
                .map(artifact -> toResponse(artifact, active))
                .toList());
    }

    @GetMapping("/active")
    @Operation(summary = "Get the active model")
    @PreAuthorize("hasAnyRole('UI_READER', 'ML_OPERATOR')")
    public ResponseEntity<ModelResponse> getActiveModel() {
        ModelArtifact artifact = modelRegistry.getActiveModel();
        return ResponseEntity.ok(toResponse(artifact, Optional.of(artifact.getVersion())));
    }

    @GetMapping("/{version}")
    @Operation(summary = "Get a model version")
    @PreAuthorize("hasAnyRole('UI_READER', 'ML_OPERATOR')")
    public ResponseEntity<ModelResponse> getModel(@PathVariable long version) {
        return ResponseEntity.ok(toResponse(modelRegistry.getModel(version), modelRegistry.findActiveVersion()));
    }

    private TrainingHyperparameters toHyperparameters(TrainModelRequest request) {
        TrainingHyperparameters defaults = trainingService.defaultHyperparameters();
        return defaults.toBuilder()
                .learningRate(request.getLearningRate() != null ? request.getLearningRate() : defaults.getLearningRate())
                .maxIterations(request.getMaxIterations() != null ? request.getMaxIterations() : defaults.getMaxIterations())
                .tolerance(request.getTolerance() != null ? request.getTolerance() : defaults.getTolerance())
                .l2(request.getL2() != null ? request.getL2() : defaults.getL2())
                .validationFraction(request.getValidationFraction() != null
                        ? request.getValidationFraction() : defaults.getValidationFraction())
                .minRows(request.getMinRows() != null ? request.getMinRows() : defaults.getMinRows())
                .includeTotalRequests(request.getIncludeTotalRequests() != null
                        ? request.getIncludeTotalRequests() : defaults.isIncludeTotalRequests())
                .lookaheadBuckets(request.getLookaheadBuckets() != null
                        ? request.getLookaheadBuckets() : defaults.getLookaheadBuckets())
                .incidentThreshold(request.getIncidentThreshold() != null
                        ? request.getIncidentThreshold() : defaults.getIncidentThreshold())
                .timeBudget(request.getTimeBudgetSeconds() != null
                        ? Duration.ofSeconds(request.getTimeBudgetSeconds()) : defaults.getTimeBudget())
                .build();
    }

    private static ModelResponse toResponse(ModelArtifact artifact, Optional<Long> activeVersion) {
        return ModelResponse.builder()
                .version(artifact.getVersion())
                .modelFamily(artifact.getModelFamily())
                .active(activeVersion.map(v -> v == artifact.getVersion()).orElse(false))
                .featureNames(artifact.getFeatureNames())
                .weights(artifact.getWeights())
                .bias(artifact.getBias())
                .means(artifact.getMeans())
                .stdDevs(artifact.getStdDevs())
                .metadata(artifact.getMetadata())
                .createdAt(artifact.getCreatedAt())
                .build();
    }
}
