package io.launchpad.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A workflow together with every member firework, read in one transaction.
 */
public record WorkflowView(Workflow workflow, Map<Long, Firework> fireworks) {
    public WorkflowView {
        fireworks = Collections.unmodifiableMap(new TreeMap<>(fireworks));
    }

    public Firework firework(long fwId) {
        return fireworks.get(fwId);
    }

    public WorkflowState state() {
        return workflow.state();
    }
}
