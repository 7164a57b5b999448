package io.launchpad.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.launchpad.util.Jsons;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Structure of one workflow: member ids, parent to child links, a name,
 * free-form metadata and the cached state of every member.
 *
 * <p>Every member id is a key of {@link #links()}, so the adjacency and the
 * membership set are the same set of ids. The firework rows themselves live
 * in the fireworks table; only their last known state is cached here.
 */
public final class Workflow {
    private final long wfId;
    private final String name;
    private final ObjectNode metadata;
    private final Map<Long, List<Long>> links;
    private final Map<Long, FireworkState> fwStates;
    private final Instant createdOn;
    private Instant updatedOn;

    public Workflow(long wfId, String name, ObjectNode metadata, Map<Long, List<Long>> links,
                    Map<Long, FireworkState> fwStates, Instant createdOn, Instant updatedOn) {
        this.wfId = wfId;
        this.name = name == null || name.isBlank() ? "Unnamed WF" : name;
        this.metadata = metadata == null ? Jsons.newObject() : metadata;
        this.links = new TreeMap<>();
        if (links != null) {
            links.forEach((k, v) -> this.links.put(k, new ArrayList<>(v)));
        }
        this.fwStates = new TreeMap<>();
        if (fwStates != null) {
            this.fwStates.putAll(fwStates);
        }
        this.createdOn = createdOn == null ? Instant.now() : createdOn;
        this.updatedOn = updatedOn == null ? this.createdOn : updatedOn;
    }

    public long wfId() {
        return wfId;
    }

    public String name() {
        return name;
    }

    public ObjectNode metadata() {
        return metadata;
    }

    public Map<Long, List<Long>> links() {
        return Collections.unmodifiableMap(links);
    }

    public Set<Long> nodeIds() {
        return Collections.unmodifiableSet(links.keySet());
    }

    public boolean contains(long fwId) {
        return links.containsKey(fwId);
    }

    public List<Long> children(long fwId) {
        List<Long> out = links.get(fwId);
        return out == null ? List.of() : Collections.unmodifiableList(out);
    }

    public List<Long> parents(long fwId) {
        List<Long> out = new ArrayList<>();
        for (Map.Entry<Long, List<Long>> e : links.entrySet()) {
            if (e.getValue().contains(fwId)) {
                out.add(e.getKey());
            }
        }
        return out;
    }

    public List<Long> roots() {
        Set<Long> withParent = new LinkedHashSet<>();
        links.values().forEach(withParent::addAll);
        List<Long> out = new ArrayList<>();
        for (Long id : links.keySet()) {
            if (!withParent.contains(id)) {
                out.add(id);
            }
        }
        return out;
    }

    public List<Long> leaves() {
        List<Long> out = new ArrayList<>();
        links.forEach((id, children) -> {
            if (children.isEmpty()) {
                out.add(id);
            }
        });
        return out;
    }

    /**
     * All ids reachable from {@code fwId} through child links, breadth first,
     * excluding {@code fwId} itself.
     */
    public List<Long> descendants(long fwId) {
        Set<Long> seen = new LinkedHashSet<>();
        Deque<Long> queue = new ArrayDeque<>(children(fwId));
        while (!queue.isEmpty()) {
            long next = queue.poll();
            if (seen.add(next)) {
                queue.addAll(children(next));
            }
        }
        return new ArrayList<>(seen);
    }

    public Map<Long, FireworkState> fwStates() {
        return Collections.unmodifiableMap(fwStates);
    }

    public FireworkState cachedState(long fwId) {
        return fwStates.get(fwId);
    }

    public void cacheState(long fwId, FireworkState state) {
        fwStates.put(fwId, state);
    }

    public Instant createdOn() {
        return createdOn;
    }

    public Instant updatedOn() {
        return updatedOn;
    }

    public void touch(Instant at) {
        this.updatedOn = at;
    }

    /**
     * Adds members and links. Existing members keep their links; new links
     * from existing members are appended.
     */
    public void extend(Map<Long, List<Long>> newLinks) {
        newLinks.forEach((id, children) -> {
            List<Long> current = links.computeIfAbsent(id, k -> new ArrayList<>());
            for (Long child : children) {
                if (!current.contains(child)) {
                    current.add(child);
                }
            }
        });
        for (List<Long> children : newLinks.values()) {
            for (Long child : children) {
                links.computeIfAbsent(child, k -> new ArrayList<>());
            }
        }
    }

    public void replaceChildren(long fwId, List<Long> children) {
        if (!links.containsKey(fwId)) {
            throw new IllegalArgumentException("Workflow " + wfId + " has no member " + fwId);
        }
        links.put(fwId, new ArrayList<>(children));
    }

    public WorkflowState state() {
        return WorkflowState.derive(fwStates.values());
    }

    public WorkflowRecord toRecord() {
        ObjectNode data = Jsons.newObject();
        data.put("name", name);
        data.set("metadata", metadata);
        ArrayNode nodes = data.putArray("nodes");
        links.keySet().forEach(nodes::add);
        ObjectNode linkNode = data.putObject("links");
        links.forEach((id, children) -> {
            ArrayNode arr = linkNode.putArray(String.valueOf(id));
            children.forEach(arr::add);
        });
        ObjectNode states = data.putObject("fw_states");
        fwStates.forEach((id, s) -> states.put(String.valueOf(id), s.name()));
        data.put("created_on", createdOn.toString());
        data.put("updated_on", updatedOn.toString());
        return new WorkflowRecord(wfId, Jsons.toCompactJson(data));
    }

    public static Workflow fromRecord(WorkflowRecord record) {
        ObjectNode data = Jsons.readObject(record.data());
        Map<Long, List<Long>> links = new LinkedHashMap<>();
        for (JsonNode n : data.path("nodes")) {
            links.put(n.asLong(), new ArrayList<>());
        }
        Iterator<Map.Entry<String, JsonNode>> it = data.path("links").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            List<Long> children = new ArrayList<>();
            for (JsonNode c : e.getValue()) {
                children.add(c.asLong());
            }
            links.put(Long.parseLong(e.getKey()), children);
        }
        Map<Long, FireworkState> states = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> st = data.path("fw_states").fields();
        while (st.hasNext()) {
            Map.Entry<String, JsonNode> e = st.next();
            states.put(Long.parseLong(e.getKey()), FireworkState.fromString(e.getValue().asText()));
        }
        JsonNode meta = data.get("metadata");
        return new Workflow(
                record.wfId(),
                data.path("name").asText(null),
                meta instanceof ObjectNode obj ? obj : Jsons.newObject(),
                links,
                states,
                Firework.parseInstant(data.path("created_on").asText(null)),
                Firework.parseInstant(data.path("updated_on").asText(null))
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Workflow other)) {
            return false;
        }
        return wfId == other.wfId
                && name.equals(other.name)
                && metadata.equals(other.metadata)
                && links.equals(other.links)
                && fwStates.equals(other.fwStates)
                && createdOn.equals(other.createdOn)
                && updatedOn.equals(other.updatedOn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(wfId, name, links);
    }

    @Override
    public String toString() {
        return "Workflow{id=" + wfId + ", name=" + name + ", nodes=" + links.keySet() + "}";
    }
}
