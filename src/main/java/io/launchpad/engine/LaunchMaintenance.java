package io.launchpad.engine;

import io.launchpad.exceptions.InvalidTransitionException;
import io.launchpad.exceptions.NotFoundException;
import io.launchpad.model.FireworkState;
import io.launchpad.model.Launch;
import io.launchpad.model.LaunchRecord;
import io.launchpad.model.LaunchState;
import io.launchpad.storage.Database;
import io.launchpad.storage.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Heartbeats and reclamation of abandoned launches.
 *
 * <p>Nothing here runs on its own; a supervisor decides when to scan. The
 * scan reads candidates first, then reclaims each one in its own transaction
 * after checking it is still active and still stale.
 */
public final class LaunchMaintenance {
    private static final Logger log = LoggerFactory.getLogger(LaunchMaintenance.class);

    private final Database database;
    private final DocumentStore store;
    private final RefreshEngine refreshEngine;

    public LaunchMaintenance(Database database, DocumentStore store, RefreshEngine refreshEngine) {
        this.database = database;
        this.store = store;
        this.refreshEngine = refreshEngine;
    }

    public Launch ping(long launchId, Instant now) {
        return database.inTransaction(c -> {
            Launch launch = Launch.fromRecord(store.getLaunch(c, launchId)
                    .orElseThrow(() -> NotFoundException.launch(launchId)));
            if (!launch.state().isActive()) {
                throw new InvalidTransitionException(launchId, launch.state(), launch.state());
            }
            launch.ping(now);
            store.putLaunch(c, launch.toRecord());
            return launch;
        });
    }

    /**
     * RUNNING launches silent for longer than {@code expiryMs} end FIZZLED and
     * their fireworks go back to READY.
     *
     * @return ids of the reclaimed launches
     */
    public List<Long> detectLostRuns(long expiryMs, Instant now) {
        return reclaim(LaunchState.RUNNING, FireworkState.RUNNING, expiryMs, now);
    }

    /**
     * Same as {@link #detectLostRuns} for reservations nobody started.
     */
    public List<Long> detectUnreserved(long expiryMs, Instant now) {
        return reclaim(LaunchState.RESERVED, FireworkState.RESERVED, expiryMs, now);
    }

    private List<Long> reclaim(LaunchState launchState, FireworkState fwState, long expiryMs, Instant now) {
        long cutoffMs = now.toEpochMilli() - Math.max(0L, expiryMs);
        List<LaunchRecord> candidates = database.inTransaction(
                c -> store.findStaleLaunches(c, launchState.name(), cutoffMs));
        List<Long> reclaimed = new ArrayList<>();
        for (LaunchRecord candidate : candidates) {
            boolean done = database.inTransaction(c -> {
                LaunchRecord current = store.getLaunch(c, candidate.launchId()).orElse(null);
                if (current == null || !launchState.name().equals(current.state()) || current.lastPingMs() > cutoffMs) {
                    return false;
                }
                Launch launch = Launch.fromRecord(current);
                WorkflowSnapshot snapshot = WorkflowSnapshot.forFirework(store, c, launch.fwId());
                if (snapshot.state(launch.fwId()) == fwState) {
                    snapshot.setState(launch.fwId(), FireworkState.READY, now);
                    refreshEngine.step(snapshot, launch.fwId(), now);
                }
                launch.advance(LaunchState.FIZZLED, now);
                snapshot.persist(store, c, now);
                store.putLaunch(c, launch.toRecord());
                return true;
            });
            if (done) {
                reclaimed.add(candidate.launchId());
                log.warn("Reclaimed {} launch {} of firework {}, last ping {} ms ago",
                        launchState, candidate.launchId(), candidate.fwId(), now.toEpochMilli() - candidate.lastPingMs());
            }
        }
        return reclaimed;
    }
}
