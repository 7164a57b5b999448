package io.launchpad.engine;

import io.launchpad.exceptions.InvalidTransitionException;
import io.launchpad.model.Firework;
import io.launchpad.model.FireworkState;
import io.launchpad.model.WorkflowView;
import io.launchpad.storage.Database;
import io.launchpad.storage.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Operator-driven state flips on single fireworks and whole workflows.
 *
 * <p>These change states directly instead of through refresh propagation,
 * then re-derive whatever they released. Each call is one transaction and
 * returns the workflow as it was committed.
 */
public final class OperatorActions {
    private static final Logger log = LoggerFactory.getLogger(OperatorActions.class);

    private final Database database;
    private final DocumentStore store;
    private final RefreshEngine refreshEngine;

    public OperatorActions(Database database, DocumentStore store, RefreshEngine refreshEngine) {
        this.database = database;
        this.store = store;
        this.refreshEngine = refreshEngine;
    }

    public WorkflowView pause(long fwId, Instant now) {
        return onFirework(fwId, now, snapshot -> {
            FireworkState current = snapshot.state(fwId);
            if (!current.isDerivable()) {
                throw new InvalidTransitionException(fwId, current, FireworkState.PAUSED);
            }
            snapshot.setState(fwId, FireworkState.PAUSED, now);
        });
    }

    public WorkflowView resume(long fwId, Instant now) {
        return onFirework(fwId, now, snapshot -> {
            FireworkState current = snapshot.state(fwId);
            if (current != FireworkState.PAUSED) {
                throw new InvalidTransitionException(fwId, current, FireworkState.WAITING);
            }
            snapshot.setState(fwId, snapshot.derive(fwId), now);
            refreshEngine.propagate(snapshot, withParents(snapshot, List.of(fwId)), now);
        });
    }

    /**
     * Defuses the firework and every unfinished firework below it.
     */
    public WorkflowView defuse(long fwId, Instant now) {
        return onFirework(fwId, now, snapshot -> {
            FireworkState current = snapshot.state(fwId);
            if (!CompletionHandler.defusable(current)) {
                throw new InvalidTransitionException(fwId, current, FireworkState.DEFUSED);
            }
            snapshot.setState(fwId, FireworkState.DEFUSED, now);
            for (Long id : snapshot.workflow().descendants(fwId)) {
                if (CompletionHandler.defusable(snapshot.state(id))) {
                    snapshot.setState(id, FireworkState.DEFUSED, now);
                }
            }
        });
    }

    /**
     * Brings a defused firework and its defused descendants back to
     * WAITING and re-derives each of them.
     */
    public WorkflowView reignite(long fwId, Instant now) {
        return onFirework(fwId, now, snapshot -> {
            FireworkState current = snapshot.state(fwId);
            if (current != FireworkState.DEFUSED) {
                throw new InvalidTransitionException(fwId, current, FireworkState.WAITING);
            }
            List<Long> released = new ArrayList<>();
            released.add(fwId);
            for (Long id : snapshot.workflow().descendants(fwId)) {
                if (snapshot.state(id) == FireworkState.DEFUSED) {
                    released.add(id);
                }
            }
            rederive(snapshot, released, now);
        });
    }

    /**
     * Puts a finished firework back in line. Everything downstream that is
     * not paused or archived returns to WAITING; earlier launches are kept.
     */
    public WorkflowView rerun(long fwId, Instant now) {
        return onFirework(fwId, now, snapshot -> {
            FireworkState current = snapshot.state(fwId);
            if (current != FireworkState.COMPLETED && current != FireworkState.FIZZLED
                    && current != FireworkState.DEFUSED) {
                throw new InvalidTransitionException(fwId, current, FireworkState.WAITING);
            }
            List<Long> reset = new ArrayList<>();
            reset.add(fwId);
            for (Long id : snapshot.workflow().descendants(fwId)) {
                FireworkState s = snapshot.state(id);
                if (s.isInFlight()) {
                    throw new InvalidTransitionException(id, s, FireworkState.WAITING);
                }
                if (s != FireworkState.PAUSED && s != FireworkState.ARCHIVED) {
                    reset.add(id);
                }
            }
            rederive(snapshot, reset, now);
        });
    }

    public WorkflowView setPriority(long fwId, int priority, Instant now) {
        return onFirework(fwId, now, snapshot -> {
            Firework fw = snapshot.firework(fwId);
            fw.spec().put(Firework.PRIORITY_KEY, priority);
            fw.changeState(fw.state(), now);
            snapshot.markDirty(fwId);
        });
    }

    public WorkflowView pauseWorkflow(long fwId, Instant now) {
        return onFirework(fwId, now, snapshot -> {
            for (Long id : snapshot.workflow().nodeIds()) {
                if (snapshot.state(id).isDerivable()) {
                    snapshot.setState(id, FireworkState.PAUSED, now);
                }
            }
        });
    }

    public WorkflowView resumeWorkflow(long fwId, Instant now) {
        return onFirework(fwId, now, snapshot -> rederive(snapshot, membersIn(snapshot, FireworkState.PAUSED), now));
    }

    public WorkflowView defuseWorkflow(long fwId, Instant now) {
        return onFirework(fwId, now, snapshot -> {
            for (Long id : snapshot.workflow().nodeIds()) {
                if (CompletionHandler.defusable(snapshot.state(id))) {
                    snapshot.setState(id, FireworkState.DEFUSED, now);
                }
            }
        });
    }

    public WorkflowView reigniteWorkflow(long fwId, Instant now) {
        return onFirework(fwId, now, snapshot -> rederive(snapshot, membersIn(snapshot, FireworkState.DEFUSED), now));
    }

    /**
     * Archives every member that is not in flight. Archived fireworks are
     * never claimed or re-derived again.
     */
    public WorkflowView archiveWorkflow(long fwId, Instant now) {
        return onFirework(fwId, now, snapshot -> {
            for (Long id : snapshot.workflow().nodeIds()) {
                if (!snapshot.state(id).isInFlight()) {
                    snapshot.setState(id, FireworkState.ARCHIVED, now);
                }
            }
        });
    }

    private static List<Long> membersIn(WorkflowSnapshot snapshot, FireworkState state) {
        List<Long> out = new ArrayList<>();
        for (Long id : snapshot.workflow().nodeIds()) {
            if (snapshot.state(id) == state) {
                out.add(id);
            }
        }
        return out;
    }

    // Everything in ids goes to WAITING first so no member sees a stale parent,
    // then each is re-derived and propagation runs from the whole set.
    private void rederive(WorkflowSnapshot snapshot, List<Long> ids, Instant now) {
        for (Long id : ids) {
            snapshot.setState(id, FireworkState.WAITING, now);
        }
        for (Long id : ids) {
            snapshot.setState(id, snapshot.derive(id), now);
        }
        refreshEngine.propagate(snapshot, withParents(snapshot, ids), now);
    }

    // A released firework may sit under a parent that fizzled or was defused
    // while it was held, so its parents are stepped again before it.
    private static Set<Long> withParents(WorkflowSnapshot snapshot, List<Long> ids) {
        Set<Long> start = new LinkedHashSet<>();
        for (Long id : ids) {
            start.addAll(snapshot.workflow().parents(id));
        }
        start.addAll(ids);
        return start;
    }

    private WorkflowView onFirework(long fwId, Instant now, SnapshotChange change) {
        return database.inTransaction(c -> {
            WorkflowSnapshot snapshot = WorkflowSnapshot.forFirework(store, c, fwId);
            change.apply(snapshot);
            Set<Long> touched = snapshot.dirtyIds();
            snapshot.persist(store, c, now);
            log.info("Operator change on firework {} in workflow {} touched {}", fwId, snapshot.wfId(), touched);
            return snapshot.toView();
        });
    }

    @FunctionalInterface
    private interface SnapshotChange {
        void apply(WorkflowSnapshot snapshot) throws SQLException;
    }
}
