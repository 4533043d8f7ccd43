package io.jobrelay.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.jobrelay.model.HealthStatus;
import io.jobrelay.model.Heartbeat;
import io.jobrelay.model.HeartbeatHistoryEntry;
import io.jobrelay.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Latest heartbeat per worker plus an append-only history. Recording a heartbeat writes both in
 * one transaction.
 */
public final class HeartbeatRegistry {
    private static final String COLUMNS = """
            worker_id,status,uptime_seconds,start_time_ms,total_jobs,running_jobs,registered_types,
            worker_version,heartbeat_interval_seconds,queue_check_interval_seconds,status_payload,heartbeat_at_ms
            """;
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final Database database;

    public HeartbeatRegistry(Database database) {
        this.database = database;
    }

    public void record(Heartbeat hb) {
        String upsert = """
                INSERT INTO worker_heartbeats(
                    worker_id,status,uptime_seconds,start_time_ms,total_jobs,running_jobs,registered_types,
                    worker_version,heartbeat_interval_seconds,queue_check_interval_seconds,status_payload,
                    heartbeat_at_ms,created_at_ms
                ) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(worker_id) DO UPDATE SET
                    status=excluded.status,
                    uptime_seconds=excluded.uptime_seconds,
                    start_time_ms=excluded.start_time_ms,
                    total_jobs=excluded.total_jobs,
                    running_jobs=excluded.running_jobs,
                    registered_types=excluded.registered_types,
                    worker_version=excluded.worker_version,
                    heartbeat_interval_seconds=excluded.heartbeat_interval_seconds,
                    queue_check_interval_seconds=excluded.queue_check_interval_seconds,
                    status_payload=excluded.status_payload,
                    heartbeat_at_ms=excluded.heartbeat_at_ms
                """;
        String history = """
                INSERT INTO worker_heartbeat_history(
                    worker_id,status,uptime_seconds,total_jobs,running_jobs,status_payload,heartbeat_at_ms
                ) VALUES(?,?,?,?,?,?,?)
                """;
        String payload = hb.statusPayload() == null ? null : Jsons.toCompactJson(hb.statusPayload());
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement up = c.prepareStatement(upsert);
                 PreparedStatement hist = c.prepareStatement(history)) {
                up.setString(1, hb.workerId());
                up.setString(2, hb.status().dbValue());
                up.setLong(3, hb.uptimeSeconds());
                up.setLong(4, hb.startTimeMs());
                up.setInt(5, hb.totalJobs());
                up.setInt(6, hb.runningJobs());
                up.setString(7, Jsons.toCompactJson(hb.registeredTypes()));
                up.setString(8, hb.workerVersion());
                up.setInt(9, hb.heartbeatIntervalSeconds());
                up.setInt(10, hb.queueCheckIntervalSeconds());
                up.setString(11, payload);
                up.setLong(12, hb.heartbeatAtMs());
                up.setLong(13, hb.heartbeatAtMs());
                up.executeUpdate();

                hist.setString(1, hb.workerId());
                hist.setString(2, hb.status().dbValue());
                hist.setLong(3, hb.uptimeSeconds());
                hist.setInt(4, hb.totalJobs());
                hist.setInt(5, hb.runningJobs());
                hist.setString(6, payload);
                hist.setLong(7, hb.heartbeatAtMs());
                hist.executeUpdate();
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to record heartbeat: " + hb.workerId(), e);
        }
    }

    public Optional<Heartbeat> get(String workerId) {
        String sql = "SELECT " + COLUMNS + " FROM worker_heartbeats WHERE worker_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, workerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapHeartbeat(rs));
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to read heartbeat: " + workerId, e);
        }
    }

    public List<Heartbeat> list() {
        String sql = "SELECT " + COLUMNS + " FROM worker_heartbeats ORDER BY worker_id";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            return readHeartbeats(ps);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list heartbeats", e);
        }
    }

    /**
     * Workers whose latest heartbeat is at or after {@code cutoffMs}, most recent first.
     */
    public List<Heartbeat> heartbeatsSince(long cutoffMs) {
        String sql = "SELECT " + COLUMNS + " FROM worker_heartbeats WHERE heartbeat_at_ms>=?"
                + " ORDER BY heartbeat_at_ms DESC, worker_id ASC";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, cutoffMs);
            return readHeartbeats(ps);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list active workers", e);
        }
    }

    public List<HeartbeatHistoryEntry> history(String workerId, int limit) {
        String sql = """
                SELECT id,worker_id,status,uptime_seconds,total_jobs,running_jobs,status_payload,heartbeat_at_ms
                FROM worker_heartbeat_history
                WHERE worker_id=?
                ORDER BY heartbeat_at_ms DESC, id DESC
                LIMIT ?
                """;
        List<HeartbeatHistoryEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, workerId);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new HeartbeatHistoryEntry(
                            rs.getLong("id"),
                            rs.getString("worker_id"),
                            HealthStatus.fromString(rs.getString("status")),
                            rs.getLong("uptime_seconds"),
                            rs.getInt("total_jobs"),
                            rs.getInt("running_jobs"),
                            Jsons.readTreeOrNull(rs.getString("status_payload")),
                            rs.getLong("heartbeat_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to read heartbeat history: " + workerId, e);
        }
    }

    private List<Heartbeat> readHeartbeats(PreparedStatement ps) throws SQLException {
        List<Heartbeat> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(mapHeartbeat(rs));
            }
        }
        return out;
    }

    private Heartbeat mapHeartbeat(ResultSet rs) throws SQLException {
        return new Heartbeat(
                rs.getString("worker_id"),
                HealthStatus.fromString(rs.getString("status")),
                rs.getLong("uptime_seconds"),
                rs.getLong("start_time_ms"),
                rs.getInt("total_jobs"),
                rs.getInt("running_jobs"),
                registeredTypes(rs.getString("registered_types")),
                rs.getString("worker_version"),
                rs.getInt("heartbeat_interval_seconds"),
                rs.getInt("queue_check_interval_seconds"),
                Jsons.readTreeOrNull(rs.getString("status_payload")),
                rs.getLong("heartbeat_at_ms")
        );
    }

    private static List<String> registeredTypes(String raw) {
        JsonNode node = Jsons.readTreeOrNull(raw);
        if (node == null || !node.isArray()) {
            return List.of();
        }
        return Jsons.mapper().convertValue(node, STRING_LIST);
    }
}
