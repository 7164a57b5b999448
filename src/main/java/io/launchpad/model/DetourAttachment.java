package io.launchpad.model;

/**
 * Where the roots of an inserted sub-graph hang off the existing workflow.
 */
public enum DetourAttachment {
    /** No edge to existing members; the sub-graph roots start READY. */
    ROOT,
    /** Sub-graph roots become children of the completing firework. */
    CHILD,
    /**
     * Sub-graph roots become children of the completing firework and its
     * former children move under the sub-graph leaves.
     */
    INTERPOSE
}
