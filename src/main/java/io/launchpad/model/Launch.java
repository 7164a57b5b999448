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
 * One attempt to run a firework. Identity, owner, host, worker and directory
 * are fixed at creation; only the state, heartbeat and completion fields move.
 */
public final class Launch {
    private final long launchId;
    private final long fwId;
    private final String worker;
    private final String host;
    private final String launchDir;
    private final Instant createdOn;
    private final List<StateChange> stateHistory;
    private LaunchState state;
    private Instant lastPing;
    private Instant endedOn;
    private ObjectNode action;

    public Launch(long launchId, long fwId, LaunchState state, String worker, String host, String launchDir,
                  Instant createdOn, Instant lastPing, Instant endedOn, ObjectNode action, List<StateChange> stateHistory) {
        this.launchId = launchId;
        this.fwId = fwId;
        this.state = Objects.requireNonNull(state, "state");
        this.worker = worker == null ? "" : worker;
        this.host = host == null ? "" : host;
        this.launchDir = launchDir == null ? "" : launchDir;
        this.createdOn = createdOn == null ? Instant.now() : createdOn;
        this.lastPing = lastPing == null ? this.createdOn : lastPing;
        this.endedOn = endedOn;
        this.action = action;
        this.stateHistory = stateHistory == null ? new ArrayList<>() : new ArrayList<>(stateHistory);
        if (this.stateHistory.isEmpty()) {
            this.stateHistory.add(new StateChange(state, this.createdOn));
        }
    }

    public static Launch start(long launchId, long fwId, LaunchState state, String worker, String host,
                               String launchDir, Instant now) {
        return new Launch(launchId, fwId, state, worker, host, launchDir, now, now, null, null, null);
    }

    public long launchId() {
        return launchId;
    }

    public long fwId() {
        return fwId;
    }

    public LaunchState state() {
        return state;
    }

    public String worker() {
        return worker;
    }

    public String host() {
        return host;
    }

    public String launchDir() {
        return launchDir;
    }

    public Instant createdOn() {
        return createdOn;
    }

    public Instant lastPing() {
        return lastPing;
    }

    public Instant endedOn() {
        return endedOn;
    }

    public ObjectNode action() {
        return action;
    }

    public List<StateChange> stateHistory() {
        return Collections.unmodifiableList(stateHistory);
    }

    public void ping(Instant at) {
        this.lastPing = at;
    }

    public void advance(LaunchState next, Instant at) {
        if (!state.isActive()) {
            throw new IllegalStateException("Launch " + launchId + " already finished as " + state);
        }
        this.state = next;
        this.lastPing = at;
        this.stateHistory.add(new StateChange(next, at));
        if (!next.isActive()) {
            this.endedOn = at;
        }
    }

    public void recordAction(FwAction fwAction) {
        this.action = fwAction == null ? null : fwAction.toJson();
    }

    public LaunchRecord toRecord() {
        ObjectNode data = Jsons.newObject();
        data.put("worker", worker);
        data.put("host", host);
        data.put("launch_dir", launchDir);
        data.put("created_on", createdOn.toString());
        data.put("last_ping", lastPing.toString());
        if (endedOn != null) {
            data.put("ended_on", endedOn.toString());
        }
        if (action != null) {
            data.set("action", action);
        }
        ArrayNode history = data.putArray("state_history");
        for (StateChange change : stateHistory) {
            ObjectNode n = history.addObject();
            n.put("state", change.state().name());
            n.put("at", change.at().toString());
        }
        return new LaunchRecord(launchId, fwId, state.name(), lastPing.toEpochMilli(), Jsons.toCompactJson(data));
    }

    public static Launch fromRecord(LaunchRecord record) {
        ObjectNode data = Jsons.readObject(record.data());
        List<StateChange> history = new ArrayList<>();
        for (JsonNode n : data.path("state_history")) {
            history.add(new StateChange(LaunchState.fromString(n.path("state").asText()), Instant.parse(n.path("at").asText())));
        }
        JsonNode action = data.get("action");
        return new Launch(
                record.launchId(),
                record.fwId(),
                LaunchState.fromString(record.state()),
                data.path("worker").asText(null),
                data.path("host").asText(null),
                data.path("launch_dir").asText(null),
                Firework.parseInstant(data.path("created_on").asText(null)),
                Firework.parseInstant(data.path("last_ping").asText(null)),
                Firework.parseInstant(data.path("ended_on").asText(null)),
                action instanceof ObjectNode obj ? obj : null,
                history
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Launch other)) {
            return false;
        }
        return launchId == other.launchId
                && fwId == other.fwId
                && state == other.state
                && worker.equals(other.worker)
                && host.equals(other.host)
                && launchDir.equals(other.launchDir)
                && createdOn.equals(other.createdOn)
                && lastPing.equals(other.lastPing)
                && Objects.equals(endedOn, other.endedOn)
                && Objects.equals(action, other.action)
                && stateHistory.equals(other.stateHistory);
    }

    @Override
    public int hashCode() {
        return Objects.hash(launchId, fwId, state);
    }

    public record StateChange(LaunchState state, Instant at) {
    }
}
