package com.company.incidentrisk.repository;

import com.company.incidentrisk.domain.IncidentRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(value = "incident-risk.store.type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcIncidentRecordRepository implements IncidentRecordRepository {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public IncidentRecord save(IncidentRecord incident) {
        String sql = """
            INSERT INTO incident_records (service, route, started_at, severity, description, recorded_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"incident_id"});
            ps.setString(1, incident.getService());
            ps.setString(2, incident.getRoute());
            ps.setTimestamp(3, Timestamp.from(incident.getStartedAt()));
            ps.setString(4, incident.getSeverity());
            ps.setString(5, incident.getDescription());
            ps.setTimestamp(6, Timestamp.from(incident.getRecordedAt()));
            return ps;
        }, keyHolder);

        incident.setIncidentId(keyHolder.getKey().longValue());
        return incident;
    }

    @Override
    public List<IncidentRecord> findIncidents(Instant from, Instant to) {
        String sql = """
            SELECT incident_id, service, route, started_at, severity, description, recorded_at
            FROM incident_records
            WHERE started_at >= ? AND started_at < ?
            ORDER BY started_at
            """;

        return jdbcTemplate.query(sql, new IncidentRecordRowMapper(), Timestamp.from(from), Timestamp.from(to));
    }

    private static class IncidentRecordRowMapper implements RowMapper<IncidentRecord> {
        @Override
        public IncidentRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return IncidentRecord.builder()
                    .incidentId(rs.getLong("incident_id"))
                    .service(rs.getString("service"))
                    .route(rs.getString("route"))
                    .startedAt(rs.getTimestamp("started_at").toInstant())
                    .severity(rs.getString("severity"))
                    .description(rs.getString("description"))
                    .recordedAt(rs.getTimestamp("recorded_at").toInstant())
                    .build();
        }
    }
}
