package io.launchpad.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.launchpad.util.Jsons;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A workflow (or an extension of one) before insertion. Firework ids here are
 * local placeholders; insertion replaces every one of them with an
 * allocated id.
 */
public record WorkflowDraft(String name, ObjectNode metadata, List<Firework> fireworks, Map<Long, List<Long>> links) {

    public WorkflowDraft {
        if (fireworks == null || fireworks.isEmpty()) {
            throw new IllegalArgumentException("A workflow needs at least one firework");
        }
        fireworks = List.copyOf(fireworks);
        metadata = metadata == null ? Jsons.newObject() : metadata;
        Map<Long, List<Long>> copy = new LinkedHashMap<>();
        Set<Long> ids = new LinkedHashSet<>();
        for (Firework fw : fireworks) {
            if (!ids.add(fw.fwId())) {
                throw new IllegalArgumentException("Duplicate firework id in workflow: " + fw.fwId());
            }
            copy.put(fw.fwId(), new ArrayList<>());
        }
        if (links != null) {
            for (Map.Entry<Long, List<Long>> e : links.entrySet()) {
                if (!ids.contains(e.getKey())) {
                    throw new IllegalArgumentException("Link from unknown firework: " + e.getKey());
                }
                for (Long child : e.getValue()) {
                    if (!ids.contains(child)) {
                        throw new IllegalArgumentException("Link to unknown firework: " + child);
                    }
                    if (child.equals(e.getKey())) {
                        throw new IllegalArgumentException("Firework cannot depend on itself: " + child);
                    }
                    if (!copy.get(e.getKey()).contains(child)) {
                        copy.get(e.getKey()).add(child);
                    }
                }
            }
        }
        links = copy;
        List<Long> order = topologicalOrder(copy);
        if (order.size() != copy.size()) {
            List<Long> remaining = new ArrayList<>(copy.keySet());
            remaining.removeAll(order);
            throw new IllegalArgumentException("Circular dependency detected among fireworks: " + remaining);
        }
    }

    public static WorkflowDraft single(Firework fw) {
        return new WorkflowDraft(fw.name(), null, List.of(fw), Map.of());
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

    // Kahn's algorithm; a result shorter than the node count means a cycle.
    private static List<Long> topologicalOrder(Map<Long, List<Long>> links) {
        Map<Long, Integer> inDegree = new HashMap<>();
        links.keySet().forEach(id -> inDegree.put(id, 0));
        links.values().forEach(children -> children.forEach(c -> inDegree.merge(c, 1, Integer::sum)));
        Deque<Long> queue = new ArrayDeque<>();
        for (Long id : links.keySet()) {
            if (inDegree.get(id) == 0) {
                queue.add(id);
            }
        }
        List<Long> out = new ArrayList<>();
        while (!queue.isEmpty()) {
            Long current = queue.poll();
            out.add(current);
            for (Long child : links.get(current)) {
                int left = inDegree.merge(child, -1, Integer::sum);
                if (left == 0) {
                    queue.add(child);
                }
            }
        }
        return out;
    }

    public ObjectNode toJson() {
        ObjectNode out = Jsons.newObject();
        out.put("name", name);
        out.set("metadata", metadata);
        ArrayNode fws = out.putArray("fireworks");
        for (Firework fw : fireworks) {
            ObjectNode n = fws.addObject();
            n.put("fw_id", fw.fwId());
            n.put("name", fw.name());
            n.set("spec", fw.spec());
            ArrayNode tasks = n.putArray("tasks");
            fw.tasks().forEach(tasks::add);
        }
        ObjectNode linkNode = out.putObject("links");
        links.forEach((id, children) -> {
            ArrayNode arr = linkNode.putArray(String.valueOf(id));
            children.forEach(arr::add);
        });
        return out;
    }

    public static WorkflowDraft fromJson(JsonNode node) {
        List<Firework> fireworks = new ArrayList<>();
        // Fireworks without an fw_id get -1, -2, ... below every explicit id.
        long nextLocal = -1L;
        for (JsonNode f : node.path("fireworks")) {
            if (f.has("fw_id")) {
                nextLocal = Math.min(nextLocal, f.get("fw_id").asLong() - 1L);
            }
        }
        for (JsonNode f : node.path("fireworks")) {
            long id;
            if (f.has("fw_id")) {
                id = f.get("fw_id").asLong();
            } else {
                id = nextLocal;
                nextLocal--;
            }
            List<ObjectNode> tasks = new ArrayList<>();
            for (JsonNode t : f.path("tasks")) {
                if (t instanceof ObjectNode obj) {
                    tasks.add(obj.deepCopy());
                }
            }
            JsonNode spec = f.get("spec");
            fireworks.add(Firework.draft(
                    id,
                    f.path("name").asText(null),
                    tasks,
                    spec instanceof ObjectNode obj ? obj.deepCopy() : Jsons.newObject()
            ));
        }
        Map<Long, List<Long>> links = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.path("links").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            List<Long> children = new ArrayList<>();
            for (JsonNode c : e.getValue()) {
                children.add(c.asLong());
            }
            links.put(Long.parseLong(e.getKey()), children);
        }
        JsonNode meta = node.get("metadata");
        return new WorkflowDraft(
                node.path("name").asText(null),
                meta instanceof ObjectNode obj ? obj.deepCopy() : null,
                fireworks,
                links
        );
    }
}
