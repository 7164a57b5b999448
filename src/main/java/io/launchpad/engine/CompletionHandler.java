package io.launchpad.engine;

import io.launchpad.exceptions.InvalidTransitionException;
import io.launchpad.exceptions.NotFoundException;
import io.launchpad.model.Detour;
import io.launchpad.model.Firework;
import io.launchpad.model.FireworkState;
import io.launchpad.model.FwAction;
import io.launchpad.model.Launch;
import io.launchpad.model.LaunchState;
import io.launchpad.model.WorkflowView;
import io.launchpad.storage.Database;
import io.launchpad.storage.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finishes a running launch and applies the action its tasks returned.
 *
 * <p>Spec changes, detours, defusals, the final state and the propagation
 * that follows all commit in one transaction.
 */
public final class CompletionHandler {
    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    private final Database database;
    private final DocumentStore store;
    private final WorkflowInserter inserter;
    private final RefreshEngine refreshEngine;

    public CompletionHandler(Database database, DocumentStore store, WorkflowInserter inserter, RefreshEngine refreshEngine) {
        this.database = database;
        this.store = store;
        this.inserter = inserter;
        this.refreshEngine = refreshEngine;
    }

    public Completion complete(long launchId, FwAction action, FireworkState finalState, Instant now) {
        if (finalState != FireworkState.COMPLETED && finalState != FireworkState.FIZZLED) {
            throw new IllegalArgumentException("A launch can only finish as COMPLETED or FIZZLED, got " + finalState);
        }
        FwAction effective = action == null ? FwAction.empty() : action;
        LaunchState launchState = finalState == FireworkState.COMPLETED ? LaunchState.COMPLETED : LaunchState.FIZZLED;
        return database.inTransaction(c -> {
            Launch launch = Launch.fromRecord(store.getLaunch(c, launchId)
                    .orElseThrow(() -> NotFoundException.launch(launchId)));
            if (launch.state() != LaunchState.RUNNING) {
                throw new InvalidTransitionException(launchId, launch.state(), launchState);
            }
            long fwId = launch.fwId();
            WorkflowSnapshot snapshot = WorkflowSnapshot.forFirework(store, c, fwId);
            Firework fw = snapshot.firework(fwId);
            if (fw.state() != FireworkState.RUNNING) {
                throw new InvalidTransitionException(fwId, fw.state(), finalState);
            }

            fw.replaceSpec(effective.applyTo(fw.spec()));
            snapshot.setState(fwId, finalState, now);
            snapshot.markDirty(fwId);
            if (effective.carriesSpecChanges()) {
                // Children that have not run yet inherit the same changes.
                for (Long child : snapshot.workflow().children(fwId)) {
                    Firework next = snapshot.firework(child);
                    if (defusable(next.state()) || next.state() == FireworkState.DEFUSED) {
                        next.replaceSpec(effective.applyTo(next.spec()));
                        snapshot.markDirty(child);
                    }
                }
            }

            List<Long> added = new ArrayList<>();
            for (Detour detour : effective.detours()) {
                Map<Long, Long> ids = inserter.insert(c, snapshot, detour.graph(), detour.attachment(), fwId, now);
                added.addAll(ids.values());
            }

            Set<Long> start = new LinkedHashSet<>();
            start.add(fwId);
            if (effective.defuseChildren()) {
                for (Long child : snapshot.workflow().children(fwId)) {
                    if (defusable(snapshot.state(child)) && snapshot.setState(child, FireworkState.DEFUSED, now)) {
                        start.add(child);
                    }
                }
            }
            if (effective.defuseWorkflow()) {
                for (Long member : snapshot.workflow().nodeIds()) {
                    if (defusable(snapshot.state(member)) && snapshot.setState(member, FireworkState.DEFUSED, now)) {
                        start.add(member);
                    }
                }
            }
            Set<Long> changed = refreshEngine.propagate(snapshot, start, now);

            launch.recordAction(effective);
            launch.advance(launchState, now);
            snapshot.persist(store, c, now);
            store.putLaunch(c, launch.toRecord());
            log.info("Launch {} finished firework {} as {}, {} detour fireworks, {} downstream changes",
                    launchId, fwId, finalState, added.size(), changed.size());
            return new Completion(launch, snapshot.toView(), added, changed);
        });
    }

    static boolean defusable(FireworkState state) {
        return state.isDerivable() || state == FireworkState.PAUSED;
    }

    /**
     * What a completion did: the finished launch, the workflow afterwards,
     * ids of inserted detour fireworks and ids whose state propagation
     * changed.
     */
    public record Completion(Launch launch, WorkflowView workflow, List<Long> detourIds, Set<Long> changed) {
        public Completion {
            detourIds = List.copyOf(detourIds);
            changed = Set.copyOf(changed);
        }
    }
}
