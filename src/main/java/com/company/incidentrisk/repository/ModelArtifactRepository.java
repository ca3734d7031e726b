package com.company.incidentrisk.repository;

import com.company.incidentrisk.domain.ModelArtifact;

import java.util.List;
import java.util.Optional;

/**
 * Versioned, write-once model store with an explicit active-version pointer per family.
 */
public interface ModelArtifactRepository {

    /**
     * Reserves the next version id; ids increase monotonically.
     */
    long nextVersion();

    ModelArtifact save(ModelArtifact artifact);

    Optional<ModelArtifact> findByVersion(long version);

    List<ModelArtifact> findAll();

    Optional<Long> findActiveVersion(String modelFamily);

    void setActiveVersion(String modelFamily, long version);
}
