package io.launchpad.engine;

import io.launchpad.model.DetourAttachment;
import io.launchpad.model.Firework;
import io.launchpad.model.FireworkState;
import io.launchpad.model.Workflow;
import io.launchpad.model.WorkflowDraft;
import io.launchpad.storage.DocumentStore;
import io.launchpad.storage.IdAllocator;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inserts a draft into a workflow. A fresh submission and a detour added by a
 * completing firework go through the same {@link #insert} call; only the
 * target snapshot and the attachment differ.
 */
public final class WorkflowInserter {
    private final DocumentStore store;
    private final IdAllocator allocator;

    public WorkflowInserter(DocumentStore store, IdAllocator allocator) {
        this.store = store;
        this.allocator = allocator;
    }

    /**
     * Creates a new workflow from {@code draft} and persists it with its
     * membership rows. Roots start READY, every other member WAITING.
     */
    public InsertResult submit(Connection c, WorkflowDraft draft, Instant now) throws SQLException {
        long wfId = allocator.nextId(c, IdAllocator.GRAPH_COUNTER, 1);
        WorkflowSnapshot snapshot = WorkflowSnapshot.create(wfId, draft.name(), draft.metadata(), now);
        Map<Long, Long> idMap = insert(c, snapshot, draft, DetourAttachment.ROOT, null, now);
        snapshot.persist(store, c, now);
        return new InsertResult(wfId, idMap);
    }

    /**
     * Adds {@code draft} to the workflow held by {@code snapshot}. Nothing is
     * written until the snapshot is persisted, so the caller's transaction
     * decides whether the extension lands.
     *
     * @param anchorFwId the member the draft attaches to; ignored for ROOT
     * @return local draft id to allocated id
     */
    public Map<Long, Long> insert(Connection c, WorkflowSnapshot snapshot, WorkflowDraft draft,
                                  DetourAttachment attachment, Long anchorFwId, Instant now) throws SQLException {
        if (attachment != DetourAttachment.ROOT) {
            if (anchorFwId == null) {
                throw new IllegalArgumentException(attachment + " attachment needs an anchor firework");
            }
            snapshot.firework(anchorFwId);
        }
        int size = draft.fireworks().size();
        long first = allocator.nextId(c, IdAllocator.NODE_COUNTER, size);
        Map<Long, Long> idMap = new LinkedHashMap<>();
        long next = first;
        for (Firework fw : draft.fireworks()) {
            idMap.put(fw.fwId(), next++);
        }

        Map<Long, List<Long>> links = new LinkedHashMap<>();
        draft.links().forEach((id, children) -> {
            List<Long> mapped = new ArrayList<>();
            children.forEach(child -> mapped.add(idMap.get(child)));
            links.put(idMap.get(id), mapped);
        });
        List<Long> draftRoots = draft.roots().stream().map(idMap::get).toList();
        List<Long> draftLeaves = draft.leaves().stream().map(idMap::get).toList();

        Workflow workflow = snapshot.workflow();
        workflow.extend(links);
        if (attachment == DetourAttachment.CHILD) {
            List<Long> anchorChildren = new ArrayList<>(workflow.children(anchorFwId));
            anchorChildren.addAll(draftRoots);
            workflow.replaceChildren(anchorFwId, anchorChildren);
        } else if (attachment == DetourAttachment.INTERPOSE) {
            List<Long> former = new ArrayList<>(workflow.children(anchorFwId));
            workflow.replaceChildren(anchorFwId, draftRoots);
            for (Long leaf : draftLeaves) {
                List<Long> leafChildren = new ArrayList<>(workflow.children(leaf));
                leafChildren.addAll(former);
                workflow.replaceChildren(leaf, leafChildren);
            }
        }

        for (Firework fw : draft.fireworks()) {
            Firework placed = fw.withId(idMap.get(fw.fwId()));
            placed.changeState(FireworkState.WAITING, now);
            snapshot.addMember(placed);
        }
        for (Long id : idMap.values()) {
            snapshot.setState(id, snapshot.derive(id), now);
        }
        snapshot.topologyChanged();
        return idMap;
    }

    public record InsertResult(long wfId, Map<Long, Long> idMap) {
        public InsertResult {
            idMap = Collections.unmodifiableMap(new LinkedHashMap<>(idMap));
        }
    }
}
