package io.jobrelay.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.jobrelay.config.JobRelayConfig;
import io.jobrelay.model.Job;
import io.jobrelay.model.JobDefinition;
import io.jobrelay.model.JobStatus;
import io.jobrelay.model.Schedule;
import io.jobrelay.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable job rows. Every mutation of a claimed row is a single conditional {@code UPDATE}; a
 * predicate miss is reported through the return value and is never an error.
 */
public final class JobStore {
    private static final String COLUMNS = """
            id,type,status,description,config,schedule,interval_minutes,next_run_at_ms,last_run_at_ms,
            run_count,last_result,last_error,claimed_by,claimed_at_ms,claim_epoch,retry_count,max_retries,
            retry_delay_minutes,next_retry_at_ms,last_retry_error,permanently_failed,permanent_failure_at_ms,
            permanent_failure_reason,timeout_minutes,created_at_ms,updated_at_ms
            """;

    // Unclaimed, or claimed longer than the stale threshold, or longer than the job's own timeout.
    private static final String RECLAIMABLE = """
            (claimed_by IS NULL OR claimed_at_ms IS NULL
             OR claimed_at_ms < ?
             OR claimed_at_ms < ? - timeout_minutes * 60000)
            """;

    private final Database database;

    public JobStore(Database database) {
        this.database = database;
    }

    public boolean register(JobDefinition def, long nowMs) {
        Schedule schedule = def.parsedSchedule();
        String sql = """
                INSERT OR IGNORE INTO jobs(
                    id,type,status,description,config,schedule,interval_minutes,next_run_at_ms,
                    max_retries,retry_delay_minutes,timeout_minutes,created_at_ms,updated_at_ms
                ) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, def.id().trim());
            ps.setString(2, def.type().trim());
            ps.setString(3, JobStatus.ACTIVE.dbValue());
            ps.setString(4, def.description());
            ps.setString(5, def.config() == null ? "{}" : Jsons.toCompactJson(def.config()));
            ps.setString(6, schedule.descriptor());
            setNullableInt(ps, 7, schedule.intervalColumn());
            ps.setLong(8, def.nextRunAtMs() == null ? nowMs : def.nextRunAtMs());
            ps.setInt(9, def.maxRetries() == null ? JobRelayConfig.DEFAULT_MAX_RETRIES : def.maxRetries());
            ps.setInt(10, def.retryDelayMinutes() == null ? JobRelayConfig.DEFAULT_RETRY_DELAY_MINUTES : def.retryDelayMinutes());
            ps.setInt(11, def.timeoutMinutes() == null ? JobRelayConfig.DEFAULT_TIMEOUT_MINUTES : def.timeoutMinutes());
            ps.setLong(12, nowMs);
            ps.setLong(13, nowMs);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to register job: " + def.id(), e);
        }
    }

    public Optional<Job> get(String jobId) {
        try (Connection c = database.openConnection()) {
            return readJob(c, jobId);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to read job: " + jobId, e);
        }
    }

    public List<Job> list(JobStatus status, String type, int limit) {
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM jobs WHERE 1=1");
        if (status != null) {
            sql.append(" AND status=?");
        }
        if (type != null && !type.isBlank()) {
            sql.append(" AND type=?");
        }
        sql.append(" ORDER BY id ASC LIMIT ?");
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int idx = 1;
            if (status != null) {
                ps.setString(idx++, status.dbValue());
            }
            if (type != null && !type.isBlank()) {
                ps.setString(idx++, type.trim());
            }
            ps.setInt(idx, Math.max(1, limit));
            return readJobs(ps);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list jobs", e);
        }
    }

    /**
     * Claims one job for {@code workerId}. The row must be active, not permanently failed, due,
     * and unclaimed or holding a claim older than {@code staleThresholdMs} or its own timeout.
     */
    public ClaimGrant tryClaim(String jobId, String workerId, long nowMs, long staleThresholdMs) {
        String sql = "UPDATE jobs SET claimed_by=?,claimed_at_ms=?,claim_epoch=claim_epoch+1,updated_at_ms=? "
                + "WHERE id=? AND status=? AND permanently_failed=0 AND " + RECLAIMABLE
                + " AND (next_run_at_ms IS NULL OR next_run_at_ms<=?)"
                + " AND (next_retry_at_ms IS NULL OR next_retry_at_ms<=?)";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, workerId);
                ps.setLong(2, nowMs);
                ps.setLong(3, nowMs);
                ps.setString(4, jobId);
                ps.setString(5, JobStatus.ACTIVE.dbValue());
                ps.setLong(6, nowMs - staleThresholdMs);
                ps.setLong(7, nowMs);
                ps.setLong(8, nowMs);
                ps.setLong(9, nowMs);
                if (ps.executeUpdate() == 0) {
                    c.commit();
                    return ClaimGrant.conflict();
                }
                Optional<Job> claimed = readJob(c, jobId);
                c.commit();
                return claimed.map(ClaimGrant::granted).orElseGet(ClaimGrant::conflict);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to claim job: " + jobId, e);
        }
    }

    /**
     * Candidates for {@link #tryClaim}: claimable and due, ordered by {@code next_run_at} with
     * never-scheduled rows first. A non-null {@code types} restricts the candidates to those job
     * types; an empty collection yields no candidates.
     */
    public List<Job> claimCandidates(long nowMs, long staleThresholdMs, Collection<String> types, int limit) {
        if (types != null && types.isEmpty()) {
            return List.of();
        }
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS)
                .append(" FROM jobs WHERE status=? AND permanently_failed=0 AND ").append(RECLAIMABLE)
                .append(" AND (next_run_at_ms IS NULL OR next_run_at_ms<=?)")
                .append(" AND (next_retry_at_ms IS NULL OR next_retry_at_ms<=?)");
        if (types != null) {
            sql.append(" AND type IN (").append(String.join(",", Collections.nCopies(types.size(), "?"))).append(')');
        }
        sql.append(" ORDER BY next_run_at_ms ASC NULLS FIRST, id ASC LIMIT ?");
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int idx = 1;
            ps.setString(idx++, JobStatus.ACTIVE.dbValue());
            ps.setLong(idx++, nowMs - staleThresholdMs);
            ps.setLong(idx++, nowMs);
            ps.setLong(idx++, nowMs);
            ps.setLong(idx++, nowMs);
            if (types != null) {
                for (String type : types) {
                    ps.setString(idx++, type);
                }
            }
            ps.setInt(idx, Math.max(1, limit));
            return readJobs(ps);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list claim candidates", e);
        }
    }

    public boolean releaseSuccess(String jobId, String workerId, long claimEpoch, JsonNode result,
                                  Long nextRunAtMs, boolean oneShot, long nowMs) {
        String sql = """
                UPDATE jobs SET
                    claimed_by=NULL,claimed_at_ms=NULL,
                    run_count=run_count+1,last_run_at_ms=?,last_result=?,last_error=NULL,
                    retry_count=0,next_retry_at_ms=NULL,last_retry_error=NULL,
                    next_run_at_ms=?,
                    status=CASE WHEN ?=1 THEN ? ELSE status END,
                    updated_at_ms=?
                WHERE id=? AND claimed_by=? AND claim_epoch=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setString(2, result == null ? null : Jsons.toCompactJson(result));
            setNullableLong(ps, 3, nextRunAtMs);
            ps.setInt(4, oneShot ? 1 : 0);
            ps.setString(5, JobStatus.INACTIVE.dbValue());
            ps.setLong(6, nowMs);
            ps.setString(7, jobId);
            ps.setString(8, workerId);
            ps.setLong(9, claimEpoch);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to release job after success: " + jobId, e);
        }
    }

    public boolean releaseForRetry(String jobId, String workerId, long claimEpoch, String error,
                                   int retryCount, long nextRetryAtMs, long nowMs) {
        String sql = """
                UPDATE jobs SET
                    claimed_by=NULL,claimed_at_ms=NULL,last_error=?,
                    retry_count=?,next_retry_at_ms=?,last_retry_error=?,
                    updated_at_ms=?
                WHERE id=? AND claimed_by=? AND claim_epoch=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, error);
            ps.setInt(2, retryCount);
            ps.setLong(3, nextRetryAtMs);
            ps.setString(4, error);
            ps.setLong(5, nowMs);
            ps.setString(6, jobId);
            ps.setString(7, workerId);
            ps.setLong(8, claimEpoch);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to schedule retry: " + jobId, e);
        }
    }

    public boolean releaseAsPermanentFailure(String jobId, String workerId, long claimEpoch, String error, long nowMs) {
        String sql = """
                UPDATE jobs SET
                    claimed_by=NULL,claimed_at_ms=NULL,last_error=?,
                    next_retry_at_ms=NULL,
                    permanently_failed=1,permanent_failure_at_ms=?,permanent_failure_reason=?,
                    status=?,updated_at_ms=?
                WHERE id=? AND claimed_by=? AND claim_epoch=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, error);
            ps.setLong(2, nowMs);
            ps.setString(3, error);
            ps.setString(4, JobStatus.FAILED.dbValue());
            ps.setLong(5, nowMs);
            ps.setString(6, jobId);
            ps.setString(7, workerId);
            ps.setLong(8, claimEpoch);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to record permanent failure: " + jobId, e);
        }
    }

    /**
     * Operator toggle between {@code active} and {@code inactive}. Permanently failed jobs are
     * left alone; they go through {@link #resetPermanentFailure}.
     */
    public boolean setStatus(String jobId, JobStatus status, long nowMs) {
        if (status == JobStatus.FAILED) {
            throw new IllegalArgumentException("failed status is set by the retry path only");
        }
        String sql = "UPDATE jobs SET status=?,updated_at_ms=? WHERE id=? AND permanently_failed=0";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, status.dbValue());
            ps.setLong(2, nowMs);
            ps.setString(3, jobId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to set job status: " + jobId, e);
        }
    }

    public boolean resetPermanentFailure(String jobId, long nowMs) {
        String sql = """
                UPDATE jobs SET
                    permanently_failed=0,permanent_failure_at_ms=NULL,permanent_failure_reason=NULL,
                    retry_count=0,next_retry_at_ms=NULL,last_retry_error=NULL,
                    claimed_by=NULL,claimed_at_ms=NULL,
                    status=?,next_run_at_ms=?,updated_at_ms=?
                WHERE id=? AND permanently_failed=1
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, JobStatus.ACTIVE.dbValue());
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            ps.setString(4, jobId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to reset permanent failure: " + jobId, e);
        }
    }

    public List<Job> claimable(long nowMs, long staleThresholdMs, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM jobs WHERE status=? AND permanently_failed=0 AND " + RECLAIMABLE
                + " ORDER BY next_run_at_ms ASC NULLS FIRST, id ASC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, JobStatus.ACTIVE.dbValue());
            ps.setLong(2, nowMs - staleThresholdMs);
            ps.setLong(3, nowMs);
            ps.setInt(4, Math.max(1, limit));
            return readJobs(ps);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list claimable jobs", e);
        }
    }

    public List<Job> pendingRetry(long nowMs, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM jobs WHERE status=? AND permanently_failed=0"
                + " AND next_retry_at_ms IS NOT NULL AND next_retry_at_ms<=?"
                + " ORDER BY next_retry_at_ms ASC, id ASC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, JobStatus.ACTIVE.dbValue());
            ps.setLong(2, nowMs);
            ps.setInt(3, Math.max(1, limit));
            return readJobs(ps);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list jobs pending retry", e);
        }
    }

    public List<Job> staleClaims(long cutoffMs, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM jobs WHERE claimed_at_ms IS NOT NULL AND claimed_at_ms<?"
                + " ORDER BY claimed_at_ms ASC, id ASC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, cutoffMs);
            ps.setInt(2, Math.max(1, limit));
            return readJobs(ps);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list stale claims", e);
        }
    }

    public JobCounts countByStatus() {
        String sql = """
                SELECT status,
                       COUNT(1) AS total,
                       SUM(CASE WHEN claimed_by IS NOT NULL THEN 1 ELSE 0 END) AS claimed,
                       SUM(CASE WHEN next_retry_at_ms IS NOT NULL THEN 1 ELSE 0 END) AS retrying
                FROM jobs GROUP BY status
                """;
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        for (JobStatus status : JobStatus.values()) {
            byStatus.put(status.dbValue(), 0);
        }
        int claimed = 0;
        int retrying = 0;
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                byStatus.put(rs.getString("status"), rs.getInt("total"));
                claimed += rs.getInt("claimed");
                retrying += rs.getInt("retrying");
            }
            return new JobCounts(byStatus, claimed, retrying);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to count jobs by status", e);
        }
    }

    private Optional<Job> readJob(Connection c, String jobId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM jobs WHERE id=?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapJob(rs));
            }
        }
    }

    private List<Job> readJobs(PreparedStatement ps) throws SQLException {
        List<Job> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(mapJob(rs));
            }
        }
        return out;
    }

    private Job mapJob(ResultSet rs) throws SQLException {
        JsonNode config = Jsons.readTreeOrNull(rs.getString("config"));
        return new Job(
                rs.getString("id"),
                rs.getString("type"),
                JobStatus.fromString(rs.getString("status")),
                rs.getString("description"),
                config == null ? Jsons.mapper().createObjectNode() : config,
                Schedule.parse(rs.getString("schedule"), nullableInt(rs, "interval_minutes")),
                nullableLong(rs, "next_run_at_ms"),
                nullableLong(rs, "last_run_at_ms"),
                rs.getInt("run_count"),
                Jsons.readTreeOrNull(rs.getString("last_result")),
                rs.getString("last_error"),
                rs.getString("claimed_by"),
                nullableLong(rs, "claimed_at_ms"),
                rs.getLong("claim_epoch"),
                rs.getInt("retry_count"),
                rs.getInt("max_retries"),
                rs.getInt("retry_delay_minutes"),
                nullableLong(rs, "next_retry_at_ms"),
                rs.getString("last_retry_error"),
                rs.getInt("permanently_failed") == 1,
                nullableLong(rs, "permanent_failure_at_ms"),
                rs.getString("permanent_failure_reason"),
                rs.getInt("timeout_minutes"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableLong(PreparedStatement ps, int idx, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.BIGINT);
        } else {
            ps.setLong(idx, value);
        }
    }

    private static void setNullableInt(PreparedStatement ps, int idx, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.INTEGER);
        } else {
            ps.setInt(idx, value);
        }
    }

    public record ClaimGrant(boolean granted, Job job) {
        public static ClaimGrant granted(Job job) {
            return new ClaimGrant(true, job);
        }

        public static ClaimGrant conflict() {
            return new ClaimGrant(false, null);
        }
    }

    public record JobCounts(Map<String, Integer> byStatus, int claimed, int retrying) {
        public int total() {
            return byStatus.values().stream().mapToInt(Integer::intValue).sum();
        }
    }
}
