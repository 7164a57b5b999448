package io.launchpad.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * @param params   the task entry from the firework, including {@code _task}
 * @param spec     the firework spec as left by the previous task; tasks must
 *                 not modify it and report changes through their action
 * @param registry lets a task reach registered functions
 */
public record TaskContext(
        long fwId,
        long launchId,
        ObjectNode params,
        ObjectNode spec,
        TaskRegistry registry
) {
    public String requireText(String key) {
        JsonNode value = params.get(key);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException("Task " + params.path(TaskRegistry.TASK_KEY).asText() + " needs a string '" + key + "'");
        }
        return value.asText();
    }

    public JsonNode specValue(String key) {
        JsonNode value = spec.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Spec has no key '" + key + "'");
        }
        return value;
    }
}
