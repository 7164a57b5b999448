package io.launchpad.storage;

import io.launchpad.model.FireworkRecord;
import io.launchpad.model.LaunchRecord;
import io.launchpad.model.WorkflowRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Row access for the fireworks, workflows, mapping and launches tables.
 *
 * <p>Every method runs on a connection supplied by the caller, so several of
 * them compose into one transaction opened with {@link Database#inTransaction}.
 * Nothing here caches rows between calls.
 */
public final class DocumentStore {

    public Optional<FireworkRecord> getFirework(Connection c, long fwId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT fw_id,state,data FROM fireworks WHERE fw_id=?")) {
            ps.setLong(1, fwId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new FireworkRecord(rs.getLong("fw_id"), rs.getString("state"), rs.getString("data")));
            }
        }
    }

    public void putFirework(Connection c, FireworkRecord record, long nowMs) throws SQLException {
        putFireworks(c, List.of(record), nowMs);
    }

    public void putFireworks(Connection c, Collection<FireworkRecord> records, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO fireworks(fw_id,state,data,updated_at_ms) VALUES(?,?,?,?) "
                        + "ON CONFLICT(fw_id) DO UPDATE SET state=excluded.state,data=excluded.data,updated_at_ms=excluded.updated_at_ms")) {
            for (FireworkRecord r : records) {
                ps.setLong(1, r.fwId());
                ps.setString(2, r.state());
                ps.setString(3, r.data());
                ps.setLong(4, nowMs);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    public boolean deleteFirework(Connection c, long fwId) throws SQLException {
        return executeUpdate(c, "DELETE FROM fireworks WHERE fw_id=?", ps -> ps.setLong(1, fwId)) > 0;
    }

    /**
     * Moves a firework from {@code expected} to {@code next} only if it is
     * still in {@code expected}. Returns false when another writer got there
     * first.
     */
    public boolean compareAndSetState(Connection c, long fwId, String expected, String next, long nowMs) throws SQLException {
        return executeUpdate(c, "UPDATE fireworks SET state=?,updated_at_ms=? WHERE fw_id=? AND state=?", ps -> {
            ps.setString(1, next);
            ps.setLong(2, nowMs);
            ps.setLong(3, fwId);
            ps.setString(4, expected);
        }) == 1;
    }

    public List<FireworkRecord> findFireworksByState(Connection c, String state) throws SQLException {
        List<FireworkRecord> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("SELECT fw_id,state,data FROM fireworks WHERE state=? ORDER BY fw_id ASC")) {
            ps.setString(1, state);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new FireworkRecord(rs.getLong("fw_id"), rs.getString("state"), rs.getString("data")));
                }
            }
        }
        return out;
    }

    public List<Long> findFireworkIds(Connection c, String stateOrNull) throws SQLException {
        String sql = stateOrNull == null
                ? "SELECT fw_id FROM fireworks ORDER BY fw_id ASC"
                : "SELECT fw_id FROM fireworks WHERE state=? ORDER BY fw_id ASC";
        return queryIds(c, sql, ps -> {
            if (stateOrNull != null) {
                ps.setString(1, stateOrNull);
            }
        });
    }

    public Optional<WorkflowRecord> getWorkflow(Connection c, long wfId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT wf_id,data FROM workflows WHERE wf_id=?")) {
            ps.setLong(1, wfId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new WorkflowRecord(rs.getLong("wf_id"), rs.getString("data")));
            }
        }
    }

    public void putWorkflow(Connection c, WorkflowRecord record, long nowMs) throws SQLException {
        executeUpdate(c, "INSERT INTO workflows(wf_id,data,updated_at_ms) VALUES(?,?,?) "
                + "ON CONFLICT(wf_id) DO UPDATE SET data=excluded.data,updated_at_ms=excluded.updated_at_ms", ps -> {
            ps.setLong(1, record.wfId());
            ps.setString(2, record.data());
            ps.setLong(3, nowMs);
        });
    }

    public List<Long> listWorkflowIds(Connection c) throws SQLException {
        return queryIds(c, "SELECT wf_id FROM workflows ORDER BY wf_id ASC", ps -> { });
    }

    public Optional<Long> findWorkflowIdForFirework(Connection c, long fwId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT wf_id FROM mapping WHERE fw_id=?")) {
            ps.setLong(1, fwId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
            }
        }
    }

    public void putMappings(Connection c, Collection<Long> fwIds, long wfId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO mapping(fw_id,wf_id) VALUES(?,?) ON CONFLICT(fw_id) DO UPDATE SET wf_id=excluded.wf_id")) {
            for (Long fwId : fwIds) {
                ps.setLong(1, fwId);
                ps.setLong(2, wfId);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    public List<Long> listFireworkIdsForWorkflow(Connection c, long wfId) throws SQLException {
        return queryIds(c, "SELECT fw_id FROM mapping WHERE wf_id=? ORDER BY fw_id ASC", ps -> ps.setLong(1, wfId));
    }

    public Optional<LaunchRecord> getLaunch(Connection c, long launchId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT launch_id,fw_id,state,last_ping_ms,data FROM launches WHERE launch_id=?")) {
            ps.setLong(1, launchId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readLaunch(rs)) : Optional.empty();
            }
        }
    }

    public void putLaunch(Connection c, LaunchRecord record) throws SQLException {
        executeUpdate(c, "INSERT INTO launches(launch_id,fw_id,state,last_ping_ms,data) VALUES(?,?,?,?,?) "
                + "ON CONFLICT(launch_id) DO UPDATE SET state=excluded.state,last_ping_ms=excluded.last_ping_ms,data=excluded.data", ps -> {
            ps.setLong(1, record.launchId());
            ps.setLong(2, record.fwId());
            ps.setString(3, record.state());
            ps.setLong(4, record.lastPingMs());
            ps.setString(5, record.data());
        });
    }

    /**
     * Launches in {@code state} whose last heartbeat is at or before
     * {@code cutoffMs}, oldest first.
     */
    public List<LaunchRecord> findStaleLaunches(Connection c, String state, long cutoffMs) throws SQLException {
        List<LaunchRecord> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT launch_id,fw_id,state,last_ping_ms,data FROM launches WHERE state=? AND last_ping_ms<=? ORDER BY last_ping_ms ASC, launch_id ASC")) {
            ps.setString(1, state);
            ps.setLong(2, cutoffMs);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readLaunch(rs));
                }
            }
        }
        return out;
    }

    private static LaunchRecord readLaunch(ResultSet rs) throws SQLException {
        return new LaunchRecord(
                rs.getLong("launch_id"),
                rs.getLong("fw_id"),
                rs.getString("state"),
                rs.getLong("last_ping_ms"),
                rs.getString("data")
        );
    }

    private static List<Long> queryIds(Connection c, String sql, Binder binder) throws SQLException {
        List<Long> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getLong(1));
                }
            }
        }
        return out;
    }

    private static int executeUpdate(Connection c, String sql, Binder binder) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        }
    }

    private interface Binder { void bind(PreparedStatement ps) throws SQLException; }
}
