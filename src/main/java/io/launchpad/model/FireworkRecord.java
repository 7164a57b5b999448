package io.launchpad.model;

/**
 * Stored form of a firework: the queryable columns plus the JSON blob.
 */
public record FireworkRecord(long fwId, String state, String data) {
}
