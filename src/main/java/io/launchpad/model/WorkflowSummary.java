package io.launchpad.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record WorkflowSummary(long wfId, String name, WorkflowState state, Map<FireworkState, Integer> counts,
                              int size, Instant updatedOn) {
    public WorkflowSummary {
        Map<FireworkState, Integer> copy = new EnumMap<>(FireworkState.class);
        copy.putAll(counts);
        counts = Collections.unmodifiableMap(copy);
    }

    public static WorkflowSummary of(WorkflowView view) {
        Map<FireworkState, Integer> counts = new EnumMap<>(FireworkState.class);
        for (Firework fw : view.fireworks().values()) {
            counts.merge(fw.state(), 1, Integer::sum);
        }
        Workflow wf = view.workflow();
        return new WorkflowSummary(wf.wfId(), wf.name(), wf.state(), counts, view.fireworks().size(), wf.updatedOn());
    }

    public int count(FireworkState state) {
        return counts.getOrDefault(state, 0);
    }
}
