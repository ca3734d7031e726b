package com.company.incidentrisk.repository;

import com.company.incidentrisk.domain.Alert;
import com.company.incidentrisk.domain.SeriesKey;
import com.company.incidentrisk.domain.enums.AlertStatus;
import com.company.incidentrisk.domain.enums.DeliveryStatus;
import com.company.incidentrisk.domain.enums.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "incident-risk.store.type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcAlertRepository implements AlertRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT alert_id, service, route, bucket_start, severity, risk_score, model_version,
               top_factors, status, created_at, acknowledged_at, resolved_at,
               delivery_status, delivery_attempts, last_error, delivered_at
        FROM risk_alerts
        """;

    /**
     * Insert; the unique (service, route, bucket_start) constraint backs bucket idempotence.
     */
    @Override
    public Alert save(Alert alert) {
        String sql = """
            INSERT INTO risk_alerts (
                service, route, bucket_start, severity, risk_score, model_version,
                top_factors, status, created_at, delivery_status, delivery_attempts
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"alert_id"});
            ps.setString(1, alert.getService());
            ps.setString(2, alert.getRoute());
            ps.setTimestamp(3, Timestamp.from(alert.getBucketStart()));
            ps.setString(4, alert.getSeverity().name());
            ps.setDouble(5, alert.getRiskScore());
            ps.setObject(6, alert.getModelVersion());
            ps.setString(7, alert.getTopFactors());
            ps.setString(8, alert.getStatus().name());
            ps.setTimestamp(9, Timestamp.from(alert.getCreatedAt()));
            ps.setString(10, alert.getDeliveryStatus().name());
            ps.setInt(11, alert.getDeliveryAttempts() != null ? alert.getDeliveryAttempts() : 0);
            return ps;
        }, keyHolder);

        alert.setAlertId(keyHolder.getKey().longValue());
        return alert;
    }

    @Override
    public void updateStatus(Alert alert) {
        String sql = """
            UPDATE risk_alerts
            SET status = ?,
                acknowledged_at = ?,
                resolved_at = ?
            WHERE alert_id = ?
            """;

        jdbcTemplate.update(sql,
                alert.getStatus().name(),
                toTimestamp(alert.getAcknowledgedAt()),
                toTimestamp(alert.getResolvedAt()),
                alert.getAlertId()
        );
    }

    @Override
    public void updateDelivery(long alertId, DeliveryStatus deliveryStatus, int deliveryAttempts,
                               String lastError, Instant deliveredAt) {
        String sql = """
            UPDATE risk_alerts
            SET delivery_status = ?,
                delivery_attempts = ?,
                last_error = ?,
                delivered_at = ?
            WHERE alert_id = ?
            """;

        jdbcTemplate.update(sql,
                deliveryStatus.name(),
                deliveryAttempts,
                lastError,
                toTimestamp(deliveredAt),
                alertId
        );
    }

    @Override
    public Optional<Alert> findById(long alertId) {
        return jdbcTemplate.query(SELECT_BASE + "WHERE alert_id = ?", new AlertRowMapper(), alertId)
                .stream().findFirst();
    }

    @Override
    public Optional<Alert> findLatestOpen(SeriesKey key, Instant createdAfter) {
        String sql = SELECT_BASE + """
            WHERE service = ? AND route = ?
            AND status = 'OPEN'
            AND created_at > ?
            ORDER BY created_at DESC
            LIMIT 1
            """;

        return jdbcTemplate.query(sql, new AlertRowMapper(),
                key.getService(), key.getRoute(), Timestamp.from(createdAfter)).stream().findFirst();
    }

    @Override
    public boolean existsForBucket(SeriesKey key, Instant bucketStart) {
        String sql = """
            SELECT EXISTS (
                SELECT 1 FROM risk_alerts WHERE service = ? AND route = ? AND bucket_start = ?
            )
            """;

        Boolean exists = jdbcTemplate.queryForObject(sql, Boolean.class,
                key.getService(), key.getRoute(), Timestamp.from(bucketStart));
        return Boolean.TRUE.equals(exists);
    }

    @Override
    public List<Alert> findByStatus(AlertStatus status, int limit) {
        if (status == null) {
            return jdbcTemplate.query(SELECT_BASE + "ORDER BY created_at DESC LIMIT ?", new AlertRowMapper(), limit);
        }
        return jdbcTemplate.query(SELECT_BASE + "WHERE status = ? ORDER BY created_at DESC LIMIT ?",
                new AlertRowMapper(), status.name(), limit);
    }

    @Override
    public List<Alert> findUndelivered(int limit) {
        String sql = SELECT_BASE + """
            WHERE delivery_status IN ('PENDING', 'FAILED')
            ORDER BY created_at ASC
            LIMIT ?
            """;

        return jdbcTemplate.query(sql, new AlertRowMapper(), limit);
    }

    @Override
    public Map<Severity, Long> countCreatedSince(Instant since) {
        String sql = """
            SELECT severity, COUNT(*) AS alert_count
            FROM risk_alerts
            WHERE created_at >= ?
            GROUP BY severity
            """;

        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        jdbcTemplate.query(sql, rs -> {
            counts.put(Severity.fromString(rs.getString("severity")), rs.getLong("alert_count"));
        }, Timestamp.from(since));
        return counts;
    }

    @Override
    public long countOpen() {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM risk_alerts WHERE status = 'OPEN'", Long.class);
        return count != null ? count : 0;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static class AlertRowMapper implements RowMapper<Alert> {
        @Override
        public Alert mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Alert.builder()
                    .alertId(rs.getLong("alert_id"))
                    .service(rs.getString("service"))
                    .route(rs.getString("route"))
                    .bucketStart(rs.getTimestamp("bucket_start").toInstant())
                    .severity(Severity.fromString(rs.getString("severity")))
                    .riskScore(rs.getDouble("risk_score"))
                    .modelVersion(rs.getObject("model_version", Long.class))
                    .topFactors(rs.getString("top_factors"))
                    .status(AlertStatus.fromString(rs.getString("status")))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .acknowledgedAt(toInstant(rs.getTimestamp("acknowledged_at")))
                    .resolvedAt(toInstant(rs.getTimestamp("resolved_at")))
                    .deliveryStatus(DeliveryStatus.fromString(rs.getString("delivery_status")))
                    .deliveryAttempts(rs.getInt("delivery_attempts"))
                    .lastError(rs.getString("last_error"))
                    .deliveredAt(toInstant(rs.getTimestamp("delivered_at")))
                    .build();
        }
    }
}
