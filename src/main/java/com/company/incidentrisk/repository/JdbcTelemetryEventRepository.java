package com.company.incidentrisk.repository;

import com.company.incidentrisk.domain.SeriesKey;
import com.company.incidentrisk.domain.TelemetryEvent;
import com.company.incidentrisk.domain.TelemetryTotals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Repository
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "incident-risk.store.type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcTelemetryEventRepository implements TelemetryEventRepository {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void append(TelemetryEvent event) {
        String sql = """
            INSERT INTO telemetry_events (
                service, route, event_time, status_code, latency_ms,
                memory_mb, cpu_pct, retries, timeout, received_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
                event.getService(),
                event.getRoute(),
                Timestamp.from(event.getTimestamp()),
                event.getStatusCode(),
                event.getLatencyMs(),
                event.getMemoryMb(),
                event.getCpuPct(),
                event.getRetries(),
                event.isTimeout(),
                Timestamp.from(event.getReceivedAt())
        );
    }

    @Override
    public List<TelemetryEvent> findBySeries(SeriesKey key, Instant from, Instant to) {
        String sql = """
            SELECT service, route, event_time, status_code, latency_ms,
                   memory_mb, cpu_pct, retries, timeout, received_at
            FROM telemetry_events
            WHERE service = ? AND route = ?
            AND event_time >= ? AND event_time < ?
            """;

        return jdbcTemplate.query(sql, new TelemetryEventRowMapper(),
                key.getService(), key.getRoute(), Timestamp.from(from), Timestamp.from(to));
    }

    @Override
    public Set<SeriesKey> findSeriesKeys(Instant from, Instant to) {
        String sql = """
            SELECT DISTINCT service, route
            FROM telemetry_events
            WHERE event_time >= ? AND event_time < ?
            """;

        return new HashSet<>(jdbcTemplate.query(sql,
                (rs, rowNum) -> SeriesKey.of(rs.getString("service"), rs.getString("route")),
                Timestamp.from(from), Timestamp.from(to)));
    }

    @Override
    public TelemetryTotals summarize() {
        String sql = """
            SELECT COUNT(*) AS total_events,
                   COUNT(*) FILTER (WHERE status_code >= 500) AS server_errors,
                   COUNT(*) FILTER (WHERE timeout) AS timeouts
            FROM telemetry_events
            """;

        try {
            return jdbcTemplate.queryForObject(sql, (rs, rowNum) -> new TelemetryTotals(
                    rs.getLong("total_events"),
                    rs.getLong("server_errors"),
                    rs.getLong("timeouts")));
        } catch (DataAccessException e) {
            log.error("Failed to summarize telemetry", e);
            throw e;
        }
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM telemetry_events WHERE event_time < ?", Timestamp.from(cutoff));
    }

    private static class TelemetryEventRowMapper implements RowMapper<TelemetryEvent> {
        @Override
        public TelemetryEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
            return TelemetryEvent.builder()
                    .service(rs.getString("service"))
                    .route(rs.getString("route"))
                    .timestamp(rs.getTimestamp("event_time").toInstant())
                    .statusCode(rs.getInt("status_code"))
                    .latencyMs(rs.getDouble("latency_ms"))
                    .memoryMb(rs.getDouble("memory_mb"))
                    .cpuPct(rs.getDouble("cpu_pct"))
                    .retries(rs.getInt("retries"))
                    .timeout(rs.getBoolean("timeout"))
                    .receivedAt(rs.getTimestamp("received_at").toInstant())
                    .build();
        }
    }
}
