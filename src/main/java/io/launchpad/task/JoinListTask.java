package io.launchpad.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.launchpad.model.FwAction;
import io.launchpad.util.Jsons;

/**
 * Appends several spec values to the list under {@code outputs}.
 */
public final class JoinListTask implements FireTask {
    @Override
    public String name() {
        return "join_list";
    }

    @Override
    public FwAction run(TaskContext context) {
        JsonNode outputParam = context.params().get("outputs");
        if (outputParam == null || !outputParam.isTextual()) {
            throw new IllegalArgumentException("\"outputs\" must be a single string item");
        }
        String output = outputParam.asText();
        ArrayNode joined;
        JsonNode existing = context.spec().get(output);
        if (existing == null) {
            joined = Jsons.compact().createArrayNode();
        } else if (existing instanceof ArrayNode arr) {
            joined = arr.deepCopy();
        } else {
            throw new IllegalArgumentException("\"outputs\" exists but is not a list");
        }
        for (JsonNode in : context.params().path("inputs")) {
            joined.add(context.specValue(in.asText()).deepCopy());
        }
        ObjectNode values = Jsons.newObject();
        values.set(output, joined);
        return new FwAction(values.deepCopy(), values, null, null, false, false);
    }
}
