package io.launchpad.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.launchpad.util.Jsons;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single task unit of a workflow.
 *
 * <p>The id never changes once the firework is built; insertion creates a copy
 * under the allocated id with {@link #withId(long)}. State, spec and the
 * launch list are mutated in place while a store operation works on it.
 */
public final class Firework {
    public static final String PRIORITY_KEY = "_priority";

    private final long fwId;
    private final String name;
    private final List<ObjectNode> tasks;
    private final Instant createdOn;
    private final List<Long> launchIds;
    private ObjectNode spec;
    private FireworkState state;
    private Instant updatedOn;

    public Firework(long fwId, String name, List<ObjectNode> tasks, ObjectNode spec, FireworkState state,
                    List<Long> launchIds, Instant createdOn, Instant updatedOn) {
        this.fwId = fwId;
        this.name = name == null || name.isBlank() ? "Unnamed FW" : name;
        this.tasks = tasks == null ? new ArrayList<>() : new ArrayList<>(tasks);
        this.spec = spec == null ? Jsons.newObject() : spec;
        this.state = state == null ? FireworkState.WAITING : state;
        this.launchIds = launchIds == null ? new ArrayList<>() : new ArrayList<>(launchIds);
        this.createdOn = createdOn == null ? Instant.now() : createdOn;
        this.updatedOn = updatedOn == null ? this.createdOn : updatedOn;
    }

    public static Firework draft(long localId, String name, List<ObjectNode> tasks, ObjectNode spec) {
        return new Firework(localId, name, tasks, spec, FireworkState.WAITING, List.of(), null, null);
    }

    public Firework withId(long newId) {
        return new Firework(newId, name, tasks, spec.deepCopy(), state, launchIds, createdOn, updatedOn);
    }

    public long fwId() {
        return fwId;
    }

    public String name() {
        return name;
    }

    public List<ObjectNode> tasks() {
        return Collections.unmodifiableList(tasks);
    }

    public ObjectNode spec() {
        return spec;
    }

    public void replaceSpec(ObjectNode newSpec) {
        this.spec = Objects.requireNonNull(newSpec, "spec");
    }

    public FireworkState state() {
        return state;
    }

    public void changeState(FireworkState newState, Instant at) {
        this.state = Objects.requireNonNull(newState, "state");
        this.updatedOn = at;
    }

    public List<Long> launchIds() {
        return Collections.unmodifiableList(launchIds);
    }

    public void appendLaunch(long launchId) {
        launchIds.add(launchId);
    }

    public Instant createdOn() {
        return createdOn;
    }

    public Instant updatedOn() {
        return updatedOn;
    }

    public int priority() {
        JsonNode p = spec.get(PRIORITY_KEY);
        return p != null && p.isNumber() ? p.asInt() : 0;
    }

    public FireworkRecord toRecord() {
        ObjectNode data = Jsons.newObject();
        data.put("name", name);
        data.set("spec", spec);
        ArrayNode taskArray = data.putArray("tasks");
        tasks.forEach(taskArray::add);
        ArrayNode launches = data.putArray("launches");
        launchIds.forEach(launches::add);
        data.put("created_on", createdOn.toString());
        data.put("updated_on", updatedOn.toString());
        return new FireworkRecord(fwId, state.name(), Jsons.toCompactJson(data));
    }

    public static Firework fromRecord(FireworkRecord record) {
        ObjectNode data = Jsons.readObject(record.data());
        List<ObjectNode> tasks = new ArrayList<>();
        for (JsonNode t : data.path("tasks")) {
            if (t instanceof ObjectNode obj) {
                tasks.add(obj);
            }
        }
        List<Long> launches = new ArrayList<>();
        for (JsonNode l : data.path("launches")) {
            launches.add(l.asLong());
        }
        JsonNode specNode = data.get("spec");
        ObjectNode spec = specNode instanceof ObjectNode obj ? obj : Jsons.newObject();
        return new Firework(
                record.fwId(),
                data.path("name").asText(null),
                tasks,
                spec,
                FireworkState.fromString(record.state()),
                launches,
                parseInstant(data.path("created_on").asText(null)),
                parseInstant(data.path("updated_on").asText(null))
        );
    }

    static Instant parseInstant(String raw) {
        return raw == null || raw.isBlank() ? null : Instant.parse(raw);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Firework other)) {
            return false;
        }
        return fwId == other.fwId
                && name.equals(other.name)
                && tasks.equals(other.tasks)
                && spec.equals(other.spec)
                && state == other.state
                && launchIds.equals(other.launchIds)
                && createdOn.equals(other.createdOn)
                && updatedOn.equals(other.updatedOn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fwId, name, state, launchIds);
    }

    @Override
    public String toString() {
        return "Firework{id=" + fwId + ", name=" + name + ", state=" + state + "}";
    }
}
