package com.company.incidentrisk.service;

import com.company.incidentrisk.config.IncidentRiskProperties;
import com.company.incidentrisk.domain.Feature;
import com.company.incidentrisk.domain.FittedModel;
import com.company.incidentrisk.domain.ModelArtifact;
import com.company.incidentrisk.exception.ModelNotFoundException;
import com.company.incidentrisk.repository.ModelArtifactRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Versioned artifact store with an explicit active-version pointer per model family.
 * Publishing never changes the active version.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ModelRegistryService {

    private final ModelArtifactRepository artifactRepository;
    private final IncidentRiskProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ModelArtifact publish(String modelFamily, FittedModel fitted) {
        long version = artifactRepository.nextVersion();

        ModelArtifact artifact = ModelArtifact.builder()
                .version(version)
                .modelFamily(modelFamily)
                .featureNames(fitted.getFeatures().stream().map(Feature::getFieldName).toList())
                .weights(fitted.getWeights())
                .bias(fitted.getBias())
                .means(fitted.getMeans())
                .stdDevs(fitted.getStdDevs())
                .metadata(fitted.getMetadata())
                .createdAt(clock.instant())
                .build();

        artifactRepository.save(artifact);

        log.info("Published model {} version {} ({} features)", modelFamily, version, artifact.getFeatureNames().size());
        return artifact;
    }

    /**
     * Points the artifact's family at this version. Re-activating an older version is a rollback.
     */
    public ModelArtifact activate(long version) {
        ModelArtifact artifact = artifactRepository.findByVersion(version)
                .orElseThrow(() -> new ModelNotFoundException(version));

        Optional<Long> previous = artifactRepository.findActiveVersion(artifact.getModelFamily());
        artifactRepository.setActiveVersion(artifact.getModelFamily(), version);

        meterRegistry.counter("incident.model.activations",
                "family", artifact.getModelFamily()
        ).increment();

        log.info("Activated model {} version {} (previous: {})",
                artifact.getModelFamily(), version, previous.map(String::valueOf).orElse("none"));
        return artifact;
    }

    @Cacheable(value = "modelArtifacts", key = "#version")
    public ModelArtifact getModel(long version) {
        return artifactRepository.findByVersion(version)
                .orElseThrow(() -> new ModelNotFoundException(version));
    }

    public Optional<Long> findActiveVersion() {
        return artifactRepository.findActiveVersion(properties.getTraining().getModelFamily());
    }

    /**
     * @throws ModelNotFoundException when no version has ever been activated
     */
    public ModelArtifact getActiveModel() {
        String family = properties.getTraining().getModelFamily();
        long version = artifactRepository.findActiveVersion(family)
                .orElseThrow(() -> ModelNotFoundException.noActiveModel(family));
        return artifactRepository.findByVersion(version)
                .orElseThrow(() -> new ModelNotFoundException(version));
    }

    public List<ModelArtifact> listModels() {
        return artifactRepository.findAll();
    }
}
