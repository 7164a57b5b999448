package io.launchpad.engine;

import io.launchpad.model.FireworkState;
import io.launchpad.storage.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Re-derives firework states after a change, one level at a time.
 *
 * <p>A single step looks at the changed firework and its direct children only:
 * <ul>
 *   <li>a WAITING or READY firework is re-derived from its parents;</li>
 *   <li>a COMPLETED firework re-derives each WAITING or READY child;</li>
 *   <li>a FIZZLED or DEFUSED firework defuses each WAITING or READY child.</li>
 * </ul>
 * Paused, archived, in-flight and finished fireworks are never touched, which
 * is where propagation stops. Callers that need the fixed point use
 * {@link #propagate}, which keeps stepping over whatever changed.
 */
public final class RefreshEngine {
    private static final Logger log = LoggerFactory.getLogger(RefreshEngine.class);

    private final DocumentStore store;

    public RefreshEngine(DocumentStore store) {
        this.store = store;
    }

    /**
     * Loads the owning workflow of {@code fwId}, runs one step and persists
     * the changed fireworks with the workflow state cache.
     */
    public Set<Long> refresh(Connection c, long fwId, Instant now) throws SQLException {
        WorkflowSnapshot snapshot = WorkflowSnapshot.forFirework(store, c, fwId);
        Set<Long> changed = step(snapshot, fwId, now);
        snapshot.persist(store, c, now);
        return changed;
    }

    /**
     * One step on an already loaded snapshot; returns the ids whose state
     * changed.
     */
    public Set<Long> step(WorkflowSnapshot snapshot, long fwId, Instant now) {
        Set<Long> changed = new LinkedHashSet<>();
        FireworkState state = snapshot.state(fwId);
        if (state.isDerivable()) {
            if (snapshot.setState(fwId, snapshot.derive(fwId), now)) {
                changed.add(fwId);
            }
        } else if (state == FireworkState.COMPLETED) {
            for (Long child : snapshot.workflow().children(fwId)) {
                if (snapshot.state(child).isDerivable() && snapshot.setState(child, snapshot.derive(child), now)) {
                    changed.add(child);
                }
            }
        } else if (state == FireworkState.FIZZLED || state == FireworkState.DEFUSED) {
            for (Long child : snapshot.workflow().children(fwId)) {
                if (snapshot.state(child).isDerivable() && snapshot.setState(child, FireworkState.DEFUSED, now)) {
                    changed.add(child);
                }
            }
        }
        if (!changed.isEmpty()) {
            log.debug("Refresh of firework {} in workflow {} changed {}", fwId, snapshot.wfId(), changed);
        }
        return changed;
    }

    /**
     * Steps breadth first from {@code start} until nothing changes. Every
     * changed firework is stepped in turn, so a completion can ready a
     * grandchild only after the child itself has completed.
     */
    public Set<Long> propagate(WorkflowSnapshot snapshot, Collection<Long> start, Instant now) {
        Set<Long> all = new LinkedHashSet<>();
        Deque<Long> queue = new ArrayDeque<>(start);
        while (!queue.isEmpty()) {
            long id = queue.poll();
            for (Long changed : step(snapshot, id, now)) {
                all.add(changed);
                queue.add(changed);
            }
        }
        return all;
    }

    /**
     * Loads, propagates from {@code fwId} to the fixed point and persists.
     */
    public Set<Long> refreshToFixedPoint(Connection c, long fwId, Instant now) throws SQLException {
        WorkflowSnapshot snapshot = WorkflowSnapshot.forFirework(store, c, fwId);
        Set<Long> changed = propagate(snapshot, Set.of(fwId), now);
        snapshot.persist(store, c, now);
        return changed;
    }
}
