package io.launchpad.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.launchpad.model.Detour;
import io.launchpad.model.DetourAttachment;
import io.launchpad.model.Firework;
import io.launchpad.model.FwAction;
import io.launchpad.model.WorkflowDraft;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fans a spec list out into one {@link SingleTask} firework per element.
 *
 * <p>The new fireworks are interposed between this firework and its children,
 * so the children wait for every branch. An empty list defuses the workflow.
 */
public final class ForeachTask implements FireTask {
    @Override
    public String name() {
        return "foreach";
    }

    @Override
    public FwAction run(TaskContext context) {
        String function = context.requireText("function");
        String split = context.requireText("split");
        JsonNode inputs = context.params().get("inputs");
        if (inputs == null) {
            throw new IllegalArgumentException("foreach task needs 'inputs'");
        }
        boolean listed = false;
        if (inputs.isArray()) {
            for (JsonNode in : inputs) {
                listed |= split.equals(in.asText());
            }
        } else {
            listed = split.equals(inputs.asText());
        }
        if (!listed) {
            throw new IllegalArgumentException("the split key '" + split + "' must be one of the inputs");
        }
        JsonNode values = context.specValue(split);
        if (!values.isArray()) {
            throw new IllegalArgumentException("the split key '" + split + "' must point to a list");
        }
        if (values.isEmpty()) {
            return FwAction.defusingWorkflow();
        }

        List<Firework> branches = new ArrayList<>();
        for (int index = 0; index < values.size(); index++) {
            ObjectNode spec = context.spec().deepCopy();
            spec.set(split, values.get(index).deepCopy());
            ObjectNode task = spec.objectNode();
            task.put(TaskRegistry.TASK_KEY, SingleTask.NAME);
            task.put("function", function);
            task.set("inputs", inputs.deepCopy());
            if (context.params().hasNonNull("outputs")) {
                task.set("outputs", context.params().get("outputs").deepCopy());
            }
            task.put("current", index);
            branches.add(Firework.draft(-(index + 1L), name() + " " + index, List.of(task), spec));
        }
        WorkflowDraft draft = new WorkflowDraft(name() + " branches", null, branches, Map.of());
        return FwAction.withDetours(List.of(new Detour(draft, DetourAttachment.INTERPOSE)));
    }
}
