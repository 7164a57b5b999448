package io.launchpad.model;

public record LaunchRecord(long launchId, long fwId, String state, long lastPingMs, String data) {
}
