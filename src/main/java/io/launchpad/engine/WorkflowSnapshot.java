package io.launchpad.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.launchpad.exceptions.ConsistencyViolationException;
import io.launchpad.exceptions.NotFoundException;
import io.launchpad.model.Firework;
import io.launchpad.model.FireworkRecord;
import io.launchpad.model.FireworkState;
import io.launchpad.model.Workflow;
import io.launchpad.model.WorkflowRecord;
import io.launchpad.model.WorkflowView;
import io.launchpad.storage.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The authoritative state of one workflow, loaded inside a transaction.
 *
 * <p>Operations change fireworks and links in memory and mark what they
 * touched; {@link #persist} then writes the touched fireworks, any new
 * membership rows and the workflow payload with a refreshed state cache.
 * A snapshot lives for one transaction only.
 */
public final class WorkflowSnapshot {
    private static final Logger log = LoggerFactory.getLogger(WorkflowSnapshot.class);

    private final Workflow workflow;
    private final Map<Long, Firework> fireworks;
    private final Set<Long> dirty = new LinkedHashSet<>();
    private final Set<Long> newMembers = new LinkedHashSet<>();
    private boolean topologyChanged;

    private WorkflowSnapshot(Workflow workflow, Map<Long, Firework> fireworks, boolean fresh) {
        this.workflow = workflow;
        this.fireworks = fireworks;
        this.topologyChanged = fresh;
    }

    static WorkflowSnapshot create(long wfId, String name, ObjectNode metadata, Instant now) {
        Workflow wf = new Workflow(wfId, name, metadata, Map.of(), Map.of(), now, now);
        return new WorkflowSnapshot(wf, new TreeMap<>(), true);
    }

    /**
     * Loads the workflow that owns {@code fwId}, resolved through the
     * membership index.
     */
    public static WorkflowSnapshot forFirework(DocumentStore store, Connection c, long fwId) throws SQLException {
        Optional<Long> wfId = store.findWorkflowIdForFirework(c, fwId);
        if (wfId.isEmpty()) {
            if (store.getFirework(c, fwId).isPresent()) {
                throw inconsistent(-1L, "firework " + fwId + " has no membership row");
            }
            throw NotFoundException.firework(fwId);
        }
        WorkflowSnapshot snapshot = load(store, c, wfId.get());
        if (!snapshot.workflow.contains(fwId)) {
            throw inconsistent(wfId.get(), "membership row for " + fwId + " but the workflow does not list it");
        }
        return snapshot;
    }

    public static WorkflowSnapshot load(DocumentStore store, Connection c, long wfId) throws SQLException {
        WorkflowRecord record = store.getWorkflow(c, wfId).orElseThrow(() -> NotFoundException.workflow(wfId));
        Workflow wf = Workflow.fromRecord(record);
        Set<Long> mapped = new TreeSet<>(store.listFireworkIdsForWorkflow(c, wfId));
        Set<Long> listed = new TreeSet<>(wf.nodeIds());
        if (!mapped.equals(listed)) {
            Set<Long> onlyMapped = new TreeSet<>(mapped);
            onlyMapped.removeAll(listed);
            Set<Long> onlyListed = new TreeSet<>(listed);
            onlyListed.removeAll(mapped);
            throw inconsistent(wfId, "membership index differs from payload, index-only=" + onlyMapped
                    + ", payload-only=" + onlyListed);
        }
        Map<Long, Firework> fws = new TreeMap<>();
        for (Long id : listed) {
            FireworkRecord fr = store.getFirework(c, id)
                    .orElseThrow(() -> inconsistent(wfId, "member " + id + " has no firework row"));
            fws.put(id, Firework.fromRecord(fr));
        }
        return new WorkflowSnapshot(wf, fws, false);
    }

    private static ConsistencyViolationException inconsistent(long wfId, String message) {
        ConsistencyViolationException e = new ConsistencyViolationException(wfId, message);
        log.warn(e.getMessage());
        return e;
    }

    public Workflow workflow() {
        return workflow;
    }

    public long wfId() {
        return workflow.wfId();
    }

    public Firework firework(long fwId) {
        Firework fw = fireworks.get(fwId);
        if (fw == null) {
            throw NotFoundException.firework(fwId);
        }
        return fw;
    }

    public FireworkState state(long fwId) {
        return firework(fwId).state();
    }

    /**
     * READY when every parent is COMPLETED (or there are none), else WAITING.
     */
    public FireworkState derive(long fwId) {
        for (Long parent : workflow.parents(fwId)) {
            if (state(parent) != FireworkState.COMPLETED) {
                return FireworkState.WAITING;
            }
        }
        return FireworkState.READY;
    }

    /**
     * Sets the state of {@code fwId}; returns true if it actually changed.
     */
    public boolean setState(long fwId, FireworkState next, Instant now) {
        Firework fw = firework(fwId);
        if (fw.state() == next) {
            return false;
        }
        fw.changeState(next, now);
        dirty.add(fwId);
        return true;
    }

    public void markDirty(long fwId) {
        firework(fwId);
        dirty.add(fwId);
    }

    void addMember(Firework fw) {
        fireworks.put(fw.fwId(), fw);
        dirty.add(fw.fwId());
        newMembers.add(fw.fwId());
        topologyChanged = true;
    }

    void topologyChanged() {
        this.topologyChanged = true;
    }

    public Set<Long> dirtyIds() {
        return Set.copyOf(dirty);
    }

    /**
     * Writes what changed. The workflow payload is rewritten only when the
     * topology changed or its state cache no longer matches the fireworks, so
     * persisting an untouched snapshot writes nothing.
     */
    public void persist(DocumentStore store, Connection c, Instant now) throws SQLException {
        List<FireworkRecord> records = new ArrayList<>();
        for (Long id : dirty) {
            records.add(fireworks.get(id).toRecord());
        }
        if (!records.isEmpty()) {
            store.putFireworks(c, records, now.toEpochMilli());
        }
        if (!newMembers.isEmpty()) {
            store.putMappings(c, newMembers, workflow.wfId());
        }
        boolean cacheStale = false;
        Set<Long> seen = new HashSet<>();
        for (Firework fw : fireworks.values()) {
            seen.add(fw.fwId());
            if (workflow.cachedState(fw.fwId()) != fw.state()) {
                workflow.cacheState(fw.fwId(), fw.state());
                cacheStale = true;
            }
        }
        if (!seen.containsAll(workflow.fwStates().keySet())) {
            throw inconsistent(workflow.wfId(), "state cache lists ids outside the workflow");
        }
        if (topologyChanged || cacheStale || !dirty.isEmpty()) {
            workflow.touch(now);
            store.putWorkflow(c, workflow.toRecord(), now.toEpochMilli());
        }
        dirty.clear();
        newMembers.clear();
        topologyChanged = false;
    }

    public WorkflowView toView() {
        return new WorkflowView(workflow, fireworks);
    }
}
