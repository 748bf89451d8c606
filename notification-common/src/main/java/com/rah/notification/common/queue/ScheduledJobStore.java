package com.rah.notification.common.queue;

import com.rah.notification.common.job.JobKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * JDBC access to the {@code scheduled_jobs} table.
 *
 * <p>Rows are claimed with {@code FOR UPDATE SKIP LOCKED}, so {@link #claimDue} must
 * run inside a transaction; concurrent dispatchers never claim the same row.
 */
@Slf4j
@RequiredArgsConstructor
public class ScheduledJobStore {

    private static final RowMapper<ScheduledJob> ROW_MAPPER = (rs, rowNum) -> new ScheduledJob(
        rs.getString("id"),
        JobKind.valueOf(rs.getString("kind")),
        rs.getString("payload"),
        rs.getTimestamp("start_after").toInstant(),
        rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public void insert(ScheduledJob job) {
        String sql = """
            INSERT INTO scheduled_jobs (id, kind, payload, start_after, created_at)
            VALUES (?, ?, ?, ?, ?)
            """;
        jdbcTemplate.update(sql,
            job.id(),
            job.kind().name(),
            job.payload(),
            Timestamp.from(job.startAfter()),
            Timestamp.from(job.createdAt())
        );
        log.debug("Stored scheduled job {} ({}) for {}", job.id(), job.kind(), job.startAfter());
    }

    /**
     * Lock and return up to {@code limit} jobs whose start time has passed, oldest first.
     */
    public List<ScheduledJob> claimDue(Instant now, int limit) {
        String sql = """
            SELECT id, kind, payload, start_after, created_at
            FROM scheduled_jobs
            WHERE start_after <= ?
            ORDER BY start_after, created_at
            LIMIT ?
            FOR UPDATE SKIP LOCKED
            """;
        return jdbcTemplate.query(sql, ROW_MAPPER, Timestamp.from(now), limit);
    }

    /**
     * @return true if a row was removed
     */
    public boolean delete(String jobId) {
        return jdbcTemplate.update("DELETE FROM scheduled_jobs WHERE id = ?", jobId) > 0;
    }

    public long countPending() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM scheduled_jobs", Long.class);
        return count != null ? count : 0;
    }
}
