package io.launchpad.model;

import java.util.Objects;

public record Detour(WorkflowDraft graph, DetourAttachment attachment) {
    public Detour {
        Objects.requireNonNull(graph, "graph");
        attachment = attachment == null ? DetourAttachment.CHILD : attachment;
    }
}
