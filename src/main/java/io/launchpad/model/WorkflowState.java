package io.launchpad.model;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Summary state of a workflow, derived from the states of its members.
 */
public enum WorkflowState {
    WAITING,
    READY,
    RUNNING,
    COMPLETED,
    FIZZLED,
    PAUSED,
    DEFUSED,
    ARCHIVED;

    public static WorkflowState derive(Collection<FireworkState> states) {
        if (states.isEmpty()) {
            return WAITING;
        }
        Map<FireworkState, Integer> counts = new EnumMap<>(FireworkState.class);
        for (FireworkState s : states) {
            counts.merge(s, 1, Integer::sum);
        }
        int total = states.size();
        if (counts.getOrDefault(FireworkState.ARCHIVED, 0) == total) {
            return ARCHIVED;
        }
        if (counts.getOrDefault(FireworkState.COMPLETED, 0) == total) {
            return COMPLETED;
        }
        if (counts.containsKey(FireworkState.FIZZLED)) {
            return FIZZLED;
        }
        boolean inFlight = counts.containsKey(FireworkState.RUNNING) || counts.containsKey(FireworkState.RESERVED);
        if (counts.containsKey(FireworkState.DEFUSED) && !inFlight) {
            return DEFUSED;
        }
        if (counts.containsKey(FireworkState.PAUSED) && !inFlight) {
            return PAUSED;
        }
        if (inFlight || counts.containsKey(FireworkState.COMPLETED)) {
            return RUNNING;
        }
        if (counts.containsKey(FireworkState.READY)) {
            return READY;
        }
        return WAITING;
    }
}
