package io.launchpad.task;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A named function that {@link SingleTask} applies to spec values. An
 * {@code ArrayNode} result is spread over several outputs when the task
 * names more than one.
 */
@FunctionalInterface
public interface TaskFunction {
    JsonNode apply(List<JsonNode> inputs) throws Exception;
}
