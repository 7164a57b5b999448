package io.launchpad.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.launchpad.model.FwAction;
import io.launchpad.util.Jsons;

/**
 * Collects several spec values into one object under {@code outputs}, with
 * optional renaming through {@code rename}.
 */
public final class JoinDictTask implements FireTask {
    @Override
    public String name() {
        return "join_dict";
    }

    @Override
    public FwAction run(TaskContext context) {
        JsonNode outputParam = context.params().get("outputs");
        if (outputParam == null || !outputParam.isTextual()) {
            throw new IllegalArgumentException("\"outputs\" must be a single string item");
        }
        String output = outputParam.asText();
        ObjectNode joined;
        JsonNode existing = context.spec().get(output);
        if (existing == null) {
            joined = Jsons.newObject();
        } else if (existing instanceof ObjectNode obj) {
            joined = obj.deepCopy();
        } else {
            throw new IllegalArgumentException("\"outputs\" exists but is not an object");
        }
        JsonNode rename = context.params().path("rename");
        for (JsonNode in : context.params().path("inputs")) {
            String key = in.asText();
            String target = rename.hasNonNull(key) ? rename.get(key).asText() : key;
            joined.set(target, context.specValue(key).deepCopy());
        }
        ObjectNode values = Jsons.newObject();
        values.set(output, joined);
        return new FwAction(values.deepCopy(), values, null, null, false, false);
    }
}
