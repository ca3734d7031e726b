package com.company.incidentrisk.repository;

import com.company.incidentrisk.domain.BucketStatus;
import com.company.incidentrisk.domain.FeatureRow;
import com.company.incidentrisk.domain.SeriesKey;
import com.company.incidentrisk.domain.enums.BucketState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Feature store keyed by (service, route, bucket_start); recomputes replace the row in place.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "incident-risk.store.type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcFeatureRowRepository implements FeatureRowRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT service, route, bucket_start, bucket_end, error_rate,
               p95_latency_ms, p99_latency_ms, avg_memory_mb, avg_cpu_pct,
               retries_rate, timeout_rate, total_requests
        FROM feature_rows
        """;

    @Override
    public Optional<FeatureRow> find(SeriesKey key, Instant bucketStart) {
        String sql = SELECT_BASE + """
            WHERE service = ? AND route = ? AND bucket_start = ?
            """;

        List<FeatureRow> rows = jdbcTemplate.query(sql, new FeatureRowRowMapper(),
                key.getService(), key.getRoute(), Timestamp.from(bucketStart));
        return rows.stream().findFirst();
    }

    @Override
    public void upsert(FeatureRow row) {
        String sql = """
            INSERT INTO feature_rows (
                service, route, bucket_start, bucket_end, error_rate,
                p95_latency_ms, p99_latency_ms, avg_memory_mb, avg_cpu_pct,
                retries_rate, timeout_rate, total_requests, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, NOW())
            ON CONFLICT (service, route, bucket_start)
            DO UPDATE SET
                bucket_end = EXCLUDED.bucket_end,
                error_rate = EXCLUDED.error_rate,
                p95_latency_ms = EXCLUDED.p95_latency_ms,
                p99_latency_ms = EXCLUDED.p99_latency_ms,
                avg_memory_mb = EXCLUDED.avg_memory_mb,
                avg_cpu_pct = EXCLUDED.avg_cpu_pct,
                retries_rate = EXCLUDED.retries_rate,
                timeout_rate = EXCLUDED.timeout_rate,
                total_requests = EXCLUDED.total_requests,
                updated_at = NOW()
            """;

        jdbcTemplate.update(sql,
                row.getService(),
                row.getRoute(),
                Timestamp.from(row.getBucketStart()),
                Timestamp.from(row.getBucketEnd()),
                row.getErrorRate(),
                row.getP95LatencyMs(),
                row.getP99LatencyMs(),
                row.getAvgMemoryMb(),
                row.getAvgCpuPct(),
                row.getRetriesRate(),
                row.getTimeoutRate(),
                row.getTotalRequests()
        );
    }

    @Override
    public List<FeatureRow> findByRange(Instant from, Instant to) {
        String sql = SELECT_BASE + """
            WHERE bucket_start >= ? AND bucket_start < ?
            ORDER BY bucket_start, service, route
            """;

        return jdbcTemplate.query(sql, new FeatureRowRowMapper(), Timestamp.from(from), Timestamp.from(to));
    }

    @Override
    public List<FeatureRow> findLatestPerSeries(Instant maxBucketStart) {
        String sql = """
            SELECT DISTINCT ON (service, route)
                   service, route, bucket_start, bucket_end, error_rate,
                   p95_latency_ms, p99_latency_ms, avg_memory_mb, avg_cpu_pct,
                   retries_rate, timeout_rate, total_requests
            FROM feature_rows
            WHERE bucket_start <= ?
            ORDER BY service, route, bucket_start DESC
            """;

        return jdbcTemplate.query(sql, new FeatureRowRowMapper(), Timestamp.from(maxBucketStart));
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM feature_rows", Long.class);
        return count != null ? count : 0;
    }

    @Override
    public Optional<BucketStatus> findStatus(SeriesKey key, Instant bucketStart) {
        String sql = """
            SELECT service, route, bucket_start, state, attempts, reason, updated_at
            FROM etl_bucket_status
            WHERE service = ? AND route = ? AND bucket_start = ?
            """;

        List<BucketStatus> statuses = jdbcTemplate.query(sql, new BucketStatusRowMapper(),
                key.getService(), key.getRoute(), Timestamp.from(bucketStart));
        return statuses.stream().findFirst();
    }

    @Override
    public void saveStatus(BucketStatus status) {
        String sql = """
            INSERT INTO etl_bucket_status (service, route, bucket_start, state, attempts, reason, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (service, route, bucket_start)
            DO UPDATE SET
                state = EXCLUDED.state,
                attempts = EXCLUDED.attempts,
                reason = EXCLUDED.reason,
                updated_at = EXCLUDED.updated_at
            """;

        jdbcTemplate.update(sql,
                status.getService(),
                status.getRoute(),
                Timestamp.from(status.getBucketStart()),
                status.getState().name(),
                status.getAttempts(),
                status.getReason(),
                Timestamp.from(status.getUpdatedAt())
        );
    }

    @Override
    public List<BucketStatus> findStatuses(BucketState state, Instant from, Instant to) {
        String sql = """
            SELECT service, route, bucket_start, state, attempts, reason, updated_at
            FROM etl_bucket_status
            WHERE state = ? AND bucket_start >= ? AND bucket_start < ?
            ORDER BY bucket_start
            """;

        return jdbcTemplate.query(sql, new BucketStatusRowMapper(),
                state.name(), Timestamp.from(from), Timestamp.from(to));
    }

    private static class FeatureRowRowMapper implements RowMapper<FeatureRow> {
        @Override
        public FeatureRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            return FeatureRow.builder()
                    .service(rs.getString("service"))
                    .route(rs.getString("route"))
                    .bucketStart(rs.getTimestamp("bucket_start").toInstant())
                    .bucketEnd(rs.getTimestamp("bucket_end").toInstant())
                    .errorRate(rs.getDouble("error_rate"))
                    .p95LatencyMs(rs.getDouble("p95_latency_ms"))
                    .p99LatencyMs(rs.getDouble("p99_latency_ms"))
                    .avgMemoryMb(rs.getDouble("avg_memory_mb"))
                    .avgCpuPct(rs.getDouble("avg_cpu_pct"))
                    .retriesRate(rs.getDouble("retries_rate"))
                    .timeoutRate(rs.getDouble("timeout_rate"))
                    .totalRequests(rs.getLong("total_requests"))
                    .build();
        }
    }

    private static class BucketStatusRowMapper implements RowMapper<BucketStatus> {
        @Override
        public BucketStatus mapRow(ResultSet rs, int rowNum) throws SQLException {
            return BucketStatus.builder()
                    .service(rs.getString("service"))
                    .route(rs.getString("route"))
                    .bucketStart(rs.getTimestamp("bucket_start").toInstant())
                    .state(BucketState.fromString(rs.getString("state")))
                    .attempts(rs.getInt("attempts"))
                    .reason(rs.getString("reason"))
                    .updatedAt(rs.getTimestamp("updated_at").toInstant())
                    .build();
        }
    }
}
