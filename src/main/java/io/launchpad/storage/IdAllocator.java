package io.launchpad.storage;

import io.launchpad.exceptions.AllocatorExhaustedException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Hands out contiguous id ranges from the named counters in the {@code meta}
 * table. Each counter holds the next unused value.
 */
public final class IdAllocator {
    public static final String NODE_COUNTER = "next_node_id";
    public static final String LAUNCH_COUNTER = "next_launch_id";
    public static final String GRAPH_COUNTER = "next_graph_id";

    static final List<String> COUNTERS = List.of(NODE_COUNTER, LAUNCH_COUNTER, GRAPH_COUNTER);

    private final Database database;

    public IdAllocator(Database database) {
        this.database = database;
    }

    static void seedCounters(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("INSERT OR IGNORE INTO meta(name,value) VALUES(?,1)")) {
            for (String counter : COUNTERS) {
                ps.setString(1, counter);
                ps.executeUpdate();
            }
        }
    }

    /**
     * Reserves {@code quantity} ids in its own transaction and returns the
     * first one.
     */
    public long nextId(String counter, long quantity) {
        return database.inTransaction(conn -> nextId(conn, counter, quantity));
    }

    /**
     * Reserves {@code quantity} ids inside the caller's transaction. The caller
     * owns {@code [first, first + quantity)}.
     */
    public long nextId(Connection conn, String counter, long quantity) throws SQLException {
        if (quantity < 1) {
            throw new IllegalArgumentException("quantity must be >= 1, got " + quantity);
        }
        long next;
        try (PreparedStatement ps = conn.prepareStatement("SELECT value FROM meta WHERE name=?")) {
            ps.setString(1, counter);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalArgumentException("Unknown counter: " + counter);
                }
                next = rs.getLong(1);
            }
        }
        long advanced;
        try {
            advanced = Math.addExact(next, quantity);
        } catch (ArithmeticException e) {
            throw new AllocatorExhaustedException(counter, next, quantity);
        }
        try (PreparedStatement ps = conn.prepareStatement("UPDATE meta SET value=? WHERE name=? AND value=?")) {
            ps.setLong(1, advanced);
            ps.setString(2, counter);
            ps.setLong(3, next);
            if (ps.executeUpdate() != 1) {
                throw new IllegalStateException("Counter " + counter + " moved during allocation");
            }
        }
        return next;
    }

    /**
     * Sets {@code counter} to {@code value}. Used by tests to drive a counter
     * to its limit.
     */
    void forceCounter(String counter, long value) {
        database.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("UPDATE meta SET value=? WHERE name=?")) {
                ps.setLong(1, value);
                ps.setString(2, counter);
                ps.executeUpdate();
            }
            return null;
        });
    }
}
