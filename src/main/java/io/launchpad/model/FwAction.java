package io.launchpad.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.launchpad.util.Jsons;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * What a finished task asks the store to do.
 *
 * @param storedData     kept on the launch, not on the firework
 * @param updateSpec     merged key by key into the firework spec
 * @param pushSpec       each value is appended to the array under its key
 * @param detours        sub-graphs inserted into the same workflow
 * @param defuseChildren defuse the direct children of the completing firework
 * @param defuseWorkflow defuse every unfinished member of the workflow
 */
public record FwAction(
        ObjectNode storedData,
        ObjectNode updateSpec,
        ObjectNode pushSpec,
        List<Detour> detours,
        boolean defuseChildren,
        boolean defuseWorkflow
) {
    public FwAction {
        storedData = storedData == null ? Jsons.newObject() : storedData;
        updateSpec = updateSpec == null ? Jsons.newObject() : updateSpec;
        pushSpec = pushSpec == null ? Jsons.newObject() : pushSpec;
        detours = detours == null ? List.of() : List.copyOf(detours);
    }

    public static FwAction empty() {
        return new FwAction(null, null, null, List.of(), false, false);
    }

    public static FwAction updating(ObjectNode updateSpec) {
        return new FwAction(updateSpec.deepCopy(), updateSpec, null, List.of(), false, false);
    }

    public static FwAction withDetours(List<Detour> detours) {
        return new FwAction(null, null, null, detours, false, false);
    }

    public static FwAction defusingWorkflow() {
        return new FwAction(null, null, null, List.of(), false, true);
    }

    public FwAction withPush(String key, JsonNode value) {
        ObjectNode push = pushSpec.deepCopy();
        JsonNode existing = push.get(key);
        ArrayNode values = existing instanceof ArrayNode arr ? arr : push.putArray(key);
        values.add(value);
        return new FwAction(storedData, updateSpec, push, detours, defuseChildren, defuseWorkflow);
    }

    public FwAction withDefuseChildren() {
        return new FwAction(storedData, updateSpec, pushSpec, detours, true, defuseWorkflow);
    }

    public boolean carriesSpecChanges() {
        return !updateSpec.isEmpty() || !pushSpec.isEmpty();
    }

    public boolean isEmpty() {
        return storedData.isEmpty() && updateSpec.isEmpty() && pushSpec.isEmpty()
                && detours.isEmpty() && !defuseChildren && !defuseWorkflow;
    }

    /**
     * Combines two actions, {@code later} winning on conflicting spec keys.
     */
    public FwAction merge(FwAction later) {
        ObjectNode stored = storedData.deepCopy();
        stored.setAll(later.storedData());
        ObjectNode update = updateSpec.deepCopy();
        update.setAll(later.updateSpec());
        ObjectNode push = pushSpec.deepCopy();
        Iterator<Map.Entry<String, JsonNode>> it = later.pushSpec().fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode existing = push.get(e.getKey());
            ArrayNode values = existing instanceof ArrayNode arr ? arr : push.putArray(e.getKey());
            if (e.getValue() instanceof ArrayNode more) {
                values.addAll(more);
            } else {
                values.add(e.getValue());
            }
        }
        List<Detour> allDetours = new ArrayList<>(detours);
        allDetours.addAll(later.detours());
        return new FwAction(stored, update, push, allDetours,
                defuseChildren || later.defuseChildren(), defuseWorkflow || later.defuseWorkflow());
    }

    /**
     * Applies the spec part of this action to {@code spec} and returns the
     * result; {@code spec} itself is not modified.
     */
    public ObjectNode applyTo(ObjectNode spec) {
        ObjectNode out = spec.deepCopy();
        out.setAll(updateSpec.deepCopy());
        Iterator<Map.Entry<String, JsonNode>> it = pushSpec.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode existing = out.get(e.getKey());
            ArrayNode target;
            if (existing == null || existing.isNull()) {
                target = out.putArray(e.getKey());
            } else if (existing instanceof ArrayNode arr) {
                target = arr;
            } else {
                throw new IllegalArgumentException("Cannot push into non-list spec field: " + e.getKey());
            }
            if (e.getValue() instanceof ArrayNode values) {
                values.forEach(v -> target.add(v.deepCopy()));
            } else {
                target.add(e.getValue().deepCopy());
            }
        }
        return out;
    }

    public ObjectNode toJson() {
        ObjectNode out = Jsons.newObject();
        out.set("stored_data", storedData);
        out.set("update_spec", updateSpec);
        out.set("push_spec", pushSpec);
        ArrayNode det = out.putArray("detours");
        for (Detour d : detours) {
            ObjectNode n = det.addObject();
            n.put("attachment", d.attachment().name());
            n.set("graph", d.graph().toJson());
        }
        out.put("defuse_children", defuseChildren);
        out.put("defuse_workflow", defuseWorkflow);
        return out;
    }

    public static FwAction fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return empty();
        }
        List<Detour> detours = new ArrayList<>();
        for (JsonNode d : node.path("detours")) {
            detours.add(new Detour(
                    WorkflowDraft.fromJson(d.path("graph")),
                    DetourAttachment.valueOf(d.path("attachment").asText(DetourAttachment.CHILD.name()))
            ));
        }
        return new FwAction(
                objectOrNull(node.get("stored_data")),
                objectOrNull(node.get("update_spec")),
                objectOrNull(node.get("push_spec")),
                detours,
                node.path("defuse_children").asBoolean(false),
                node.path("defuse_workflow").asBoolean(false)
        );
    }

    private static ObjectNode objectOrNull(JsonNode node) {
        return node instanceof ObjectNode obj ? obj.deepCopy() : null;
    }
}
