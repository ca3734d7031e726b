package com.company.incidentrisk.repository;

import com.company.incidentrisk.domain.ModelArtifact;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

@Repository
@ConditionalOnProperty(value = "incident-risk.store.type", havingValue = "memory")
public class InMemoryModelArtifactRepository implements ModelArtifactRepository {

    private final AtomicLong versionSequence = new AtomicLong();
    private final Map<Long, ModelArtifact> artifacts = new ConcurrentSkipListMap<>();
    private final Map<String, Long> activeVersions = new ConcurrentHashMap<>();

    @Override
    public long nextVersion() {
        return versionSequence.incrementAndGet();
    }

    @Override
    public ModelArtifact save(ModelArtifact artifact) {
        ModelArtifact existing = artifacts.putIfAbsent(artifact.getVersion(), artifact);
        if (existing != null) {
            throw new IllegalStateException("Model version " + artifact.getVersion() + " is already published");
        }
        return artifact;
    }

    @Override
    public Optional<ModelArtifact> findByVersion(long version) {
        return Optional.ofNullable(artifacts.get(version));
    }

    @Override
    public List<ModelArtifact> findAll() {
        return new ArrayList<>(artifacts.values());
    }

    @Override
    public Optional<Long> findActiveVersion(String modelFamily) {
        return Optional.ofNullable(activeVersions.get(modelFamily));
    }

    @Override
    public void setActiveVersion(String modelFamily, long version) {
        activeVersions.put(modelFamily, version);
    }
}
