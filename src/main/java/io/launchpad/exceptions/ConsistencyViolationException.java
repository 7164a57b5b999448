package io.launchpad.exceptions;

/**
 * The membership index and a workflow payload disagree, or a workflow names a
 * firework with no stored row. The operation that detects it is aborted and
 * its transaction rolled back.
 */
public class ConsistencyViolationException extends LaunchPadException {

    private final long workflowId;

    public ConsistencyViolationException(long workflowId, String message) {
        super("Workflow " + workflowId + " is inconsistent: " + message);
        this.workflowId = workflowId;
    }

    public long getWorkflowId() {
        return workflowId;
    }
}
