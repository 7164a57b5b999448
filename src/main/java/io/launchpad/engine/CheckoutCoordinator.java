package io.launchpad.engine;

import io.launchpad.exceptions.ConcurrentClaimLostException;
import io.launchpad.exceptions.InvalidTransitionException;
import io.launchpad.exceptions.NotFoundException;
import io.launchpad.model.Firework;
import io.launchpad.model.FireworkRecord;
import io.launchpad.model.FireworkState;
import io.launchpad.model.Launch;
import io.launchpad.model.LaunchState;
import io.launchpad.storage.Database;
import io.launchpad.storage.DocumentStore;
import io.launchpad.storage.IdAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Claims READY fireworks for workers.
 *
 * <p>Selection and the READY to RESERVED to RUNNING transition share one
 * IMMEDIATE transaction, and each transition is a conditional update on the
 * expected state. If a condition fails the candidate was taken by someone
 * else; the transaction is rolled back and selection starts over, up to
 * {@code maxClaimAttempts} times.
 *
 * <p>While every writer goes through {@link Database#inTransaction} the write
 * lock is held from selection to claim, so the conditional updates act as a
 * guard: a lost claim means a row changed under this connection between the
 * read and the update, and is treated like a lost race.
 */
public final class CheckoutCoordinator {
    private static final Logger log = LoggerFactory.getLogger(CheckoutCoordinator.class);

    private final Database database;
    private final DocumentStore store;
    private final IdAllocator allocator;
    private final RefreshEngine refreshEngine;
    private final int maxClaimAttempts;
    private volatile Comparator<Firework> order;

    public CheckoutCoordinator(Database database, DocumentStore store, IdAllocator allocator,
                               RefreshEngine refreshEngine, int maxClaimAttempts, Comparator<Firework> order) {
        this.database = database;
        this.store = store;
        this.allocator = allocator;
        this.refreshEngine = refreshEngine;
        this.maxClaimAttempts = Math.max(1, maxClaimAttempts);
        this.order = Objects.requireNonNull(order, "order");
    }

    public void setOrder(Comparator<Firework> order) {
        this.order = Objects.requireNonNull(order, "order");
    }

    /**
     * Claims a READY firework straight into RUNNING with a new RUNNING launch.
     *
     * @param fwId a specific firework to claim, or null to pick one
     */
    public CheckoutResult checkout(String worker, String host, String launchDir, Long fwId, Instant now) {
        return claim(worker, host, launchDir, fwId, LaunchState.RUNNING, now);
    }

    /**
     * Claims a READY firework into RESERVED; the launch stays RESERVED until
     * {@link #startReservation} or {@link #cancelReservation}.
     */
    public CheckoutResult reserve(String worker, String host, String launchDir, Long fwId, Instant now) {
        return claim(worker, host, launchDir, fwId, LaunchState.RESERVED, now);
    }

    public CheckoutResult startReservation(long launchId, Instant now) {
        return database.inTransaction(c -> {
            Launch launch = loadLaunch(c, launchId);
            if (launch.state() != LaunchState.RESERVED) {
                throw new InvalidTransitionException(launchId, launch.state(), LaunchState.RUNNING);
            }
            WorkflowSnapshot snapshot = WorkflowSnapshot.forFirework(store, c, launch.fwId());
            Firework fw = snapshot.firework(launch.fwId());
            if (fw.state() != FireworkState.RESERVED) {
                throw new InvalidTransitionException(fw.fwId(), fw.state(), FireworkState.RUNNING);
            }
            snapshot.setState(fw.fwId(), FireworkState.RUNNING, now);
            launch.advance(LaunchState.RUNNING, now);
            refreshEngine.step(snapshot, fw.fwId(), now);
            snapshot.persist(store, c, now);
            store.putLaunch(c, launch.toRecord());
            log.info("Started reserved launch {} for firework {}", launchId, fw.fwId());
            return CheckoutResult.claimed(fw, launch);
        });
    }

    /**
     * Gives a reservation back: the launch ends FIZZLED and its firework
     * returns to READY.
     */
    public Launch cancelReservation(long launchId, Instant now) {
        return database.inTransaction(c -> {
            Launch launch = loadLaunch(c, launchId);
            if (launch.state() != LaunchState.RESERVED) {
                throw new InvalidTransitionException(launchId, launch.state(), LaunchState.FIZZLED);
            }
            WorkflowSnapshot snapshot = WorkflowSnapshot.forFirework(store, c, launch.fwId());
            if (snapshot.state(launch.fwId()) == FireworkState.RESERVED) {
                snapshot.setState(launch.fwId(), FireworkState.READY, now);
                refreshEngine.step(snapshot, launch.fwId(), now);
            }
            launch.advance(LaunchState.FIZZLED, now);
            snapshot.persist(store, c, now);
            store.putLaunch(c, launch.toRecord());
            log.info("Cancelled reservation {} for firework {}", launchId, launch.fwId());
            return launch;
        });
    }

    private CheckoutResult claim(String worker, String host, String launchDir, Long fwId,
                                 LaunchState target, Instant now) {
        return retryLostClaims(() -> database.inTransaction(
                c -> claimOnce(c, worker, host, launchDir, fwId, target, now)));
    }

    /**
     * Runs {@code claimAttempt} until it returns without losing its candidate,
     * giving up with an empty result after {@code maxClaimAttempts} losses.
     */
    CheckoutResult retryLostClaims(Supplier<CheckoutResult> claimAttempt) {
        ConcurrentClaimLostException last = null;
        for (int attempt = 1; attempt <= maxClaimAttempts; attempt++) {
            try {
                return claimAttempt.get();
            } catch (ConcurrentClaimLostException e) {
                last = e;
                log.debug("Claim attempt {} lost firework {}, selecting again", attempt, e.getFwId());
            }
        }
        log.warn("Gave up claiming after {} attempts, last lost firework {}", maxClaimAttempts, last.getFwId());
        return CheckoutResult.none();
    }

    private CheckoutResult claimOnce(Connection c, String worker, String host, String launchDir, Long fwId,
                                     LaunchState target, Instant now) throws SQLException {
        FireworkState requested = target == LaunchState.RUNNING ? FireworkState.RUNNING : FireworkState.RESERVED;
        Firework candidate = select(c, fwId, requested);
        if (candidate == null) {
            return CheckoutResult.none();
        }
        return claimCandidate(c, candidate.fwId(), worker, host, launchDir, target, now);
    }

    /**
     * The firework a claim would take: {@code fwId} when given (it must be
     * READY), otherwise the first READY firework in selection order, or null.
     */
    Firework select(Connection c, Long fwId, FireworkState requested) throws SQLException {
        Firework candidate;
        if (fwId != null) {
            FireworkRecord record = store.getFirework(c, fwId).orElseThrow(() -> NotFoundException.firework(fwId));
            candidate = Firework.fromRecord(record);
            if (candidate.state() != FireworkState.READY) {
                throw new InvalidTransitionException(fwId, candidate.state(), requested);
            }
        } else {
            List<FireworkRecord> ready = store.findFireworksByState(c, FireworkState.READY.name());
            candidate = ready.stream().map(Firework::fromRecord).min(order).orElse(null);
        }
        return candidate;
    }

    /**
     * Moves the selected firework out of READY and records its launch.
     *
     * @throws ConcurrentClaimLostException if the firework is no longer READY
     */
    CheckoutResult claimCandidate(Connection c, long id, String worker, String host, String launchDir,
                                  LaunchState target, Instant now) throws SQLException {
        FireworkState requested = target == LaunchState.RUNNING ? FireworkState.RUNNING : FireworkState.RESERVED;
        long nowMs = now.toEpochMilli();
        if (!store.compareAndSetState(c, id, FireworkState.READY.name(), FireworkState.RESERVED.name(), nowMs)) {
            throw lost(c, id);
        }
        if (target == LaunchState.RUNNING
                && !store.compareAndSetState(c, id, FireworkState.RESERVED.name(), FireworkState.RUNNING.name(), nowMs)) {
            throw lost(c, id);
        }

        WorkflowSnapshot snapshot = WorkflowSnapshot.forFirework(store, c, id);
        Firework fw = snapshot.firework(id);
        long launchId = allocator.nextId(c, IdAllocator.LAUNCH_COUNTER, 1);
        Launch launch = Launch.start(launchId, id, target, worker, host, launchDir, now);
        fw.appendLaunch(launchId);
        fw.changeState(requested, now);
        snapshot.markDirty(id);
        refreshEngine.step(snapshot, id, now);
        snapshot.persist(store, c, now);
        store.putLaunch(c, launch.toRecord());
        log.info("Worker {} claimed firework {} as {} with launch {}", worker, id, requested, launchId);
        return CheckoutResult.claimed(fw, launch);
    }

    private ConcurrentClaimLostException lost(Connection c, long fwId) throws SQLException {
        String observed = store.getFirework(c, fwId).map(FireworkRecord::state).orElse("MISSING");
        return new ConcurrentClaimLostException(fwId, observed);
    }

    private Launch loadLaunch(Connection c, long launchId) throws SQLException {
        return Launch.fromRecord(store.getLaunch(c, launchId).orElseThrow(() -> NotFoundException.launch(launchId)));
    }
}
