package io.launchpad.model;

public record WorkflowRecord(long wfId, String data) {
}
