package io.launchpad.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.launchpad.model.FwAction;
import io.launchpad.util.Jsons;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies a registered function to spec values and hands the result on.
 *
 * <p>Parameters: {@code function} (required), {@code inputs} (a spec key or
 * a list of them), {@code outputs} (a key or a list of keys) and
 * {@code current}. Results are stored on the launch and merged into the spec;
 * when {@code current} is present they are pushed onto a list instead, so
 * parallel branches can collect into one downstream firework.
 */
public final class SingleTask implements FireTask {
    public static final String NAME = "single";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public FwAction run(TaskContext context) throws Exception {
        String functionName = context.requireText("function");
        TaskFunction function = context.registry().findFunction(functionName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown function: " + functionName));

        List<JsonNode> inputs = new ArrayList<>();
        JsonNode inputParam = context.params().get("inputs");
        if (inputParam != null && inputParam.isTextual()) {
            inputs.add(context.specValue(inputParam.asText()));
        } else if (inputParam != null && inputParam.isArray()) {
            for (JsonNode key : inputParam) {
                inputs.add(context.specValue(key.asText()));
            }
        } else if (inputParam != null && !inputParam.isNull()) {
            throw new IllegalArgumentException("inputs must be a string or a list");
        }

        JsonNode result = function.apply(inputs);
        JsonNode outputParam = context.params().get("outputs");
        if (outputParam == null || outputParam.isNull()) {
            return FwAction.empty();
        }

        ObjectNode values = Jsons.newObject();
        if (outputParam.isArray() && result instanceof ArrayNode spread) {
            for (int i = 0; i < outputParam.size(); i++) {
                values.set(outputParam.get(i).asText(), spread.get(i));
            }
        } else {
            values.set(outputParam.asText(), result);
        }

        if (context.params().has("current")) {
            FwAction action = new FwAction(values.deepCopy(), null, null, null, false, false);
            for (String key : iterable(values)) {
                action = action.withPush(key, values.get(key));
            }
            return action;
        }
        return new FwAction(values.deepCopy(), values, null, null, false, false);
    }

    private static Iterable<String> iterable(ObjectNode node) {
        return node::fieldNames;
    }
}
