package com.company.incidentrisk.repository;

import com.company.incidentrisk.domain.ModelArtifact;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * Artifacts are stored as JSON documents and only ever inserted.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "incident-risk.store.type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcModelArtifactRepository implements ModelArtifactRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public long nextVersion() {
        Long version = jdbcTemplate.queryForObject("SELECT nextval('model_version_seq')", Long.class);
        if (version == null) {
            throw new IllegalStateException("Model version sequence returned no value");
        }
        return version;
    }

    @Override
    public ModelArtifact save(ModelArtifact artifact) {
        String sql = """
            INSERT INTO model_artifacts (version, model_family, artifact_json, created_at)
            VALUES (?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
                artifact.getVersion(),
                artifact.getModelFamily(),
                toJson(artifact),
                Timestamp.from(artifact.getCreatedAt())
        );
        return artifact;
    }

    @Override
    public Optional<ModelArtifact> findByVersion(long version) {
        String sql = "SELECT artifact_json FROM model_artifacts WHERE version = ?";
        return jdbcTemplate.query(sql, artifactMapper(), version).stream().findFirst();
    }

    @Override
    public List<ModelArtifact> findAll() {
        return jdbcTemplate.query("SELECT artifact_json FROM model_artifacts ORDER BY version", artifactMapper());
    }

    @Override
    public Optional<Long> findActiveVersion(String modelFamily) {
        String sql = "SELECT version FROM active_models WHERE model_family = ?";
        return jdbcTemplate.queryForList(sql, Long.class, modelFamily).stream().findFirst();
    }

    @Override
    public void setActiveVersion(String modelFamily, long version) {
        String sql = """
            INSERT INTO active_models (model_family, version, activated_at)
            VALUES (?, ?, NOW())
            ON CONFLICT (model_family)
            DO UPDATE SET version = EXCLUDED.version, activated_at = NOW()
            """;

        jdbcTemplate.update(sql, modelFamily, version);
    }

    private RowMapper<ModelArtifact> artifactMapper() {
        return (rs, rowNum) -> {
            String json = rs.getString("artifact_json");
            try {
                return objectMapper.readValue(json, ModelArtifact.class);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Corrupt model artifact document", e);
            }
        };
    }

    private String toJson(ModelArtifact artifact) {
        try {
            return objectMapper.writeValueAsString(artifact);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize model version {}", artifact.getVersion(), e);
            throw new IllegalStateException("Failed to serialize model artifact", e);
        }
    }
}
