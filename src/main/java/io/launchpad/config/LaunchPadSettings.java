package io.launchpad.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.launchpad.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables read from {@code launchpad-settings.json} in the data root.
 * Any field missing from the file keeps its default.
 */
public record LaunchPadSettings(
        long lostRunExpiryMs,
        long reservationExpiryMs,
        int busyTimeoutMs,
        int maxClaimAttempts,
        String workerName
) {
    public LaunchPadSettings {
        if (lostRunExpiryMs <= 0L) {
            throw new IllegalArgumentException("lostRunExpiryMs must be positive");
        }
        if (reservationExpiryMs <= 0L) {
            throw new IllegalArgumentException("reservationExpiryMs must be positive");
        }
        if (busyTimeoutMs < 0) {
            throw new IllegalArgumentException("busyTimeoutMs must not be negative");
        }
        if (maxClaimAttempts < 1) {
            throw new IllegalArgumentException("maxClaimAttempts must be at least 1");
        }
        workerName = workerName == null || workerName.isBlank() ? LaunchPadConfig.DEFAULT_WORKER_NAME : workerName.trim();
    }

    public static LaunchPadSettings defaults() {
        return new LaunchPadSettings(
                LaunchPadConfig.DEFAULT_LOST_RUN_EXPIRY_MS,
                LaunchPadConfig.DEFAULT_RESERVATION_EXPIRY_MS,
                LaunchPadConfig.DEFAULT_BUSY_TIMEOUT_MS,
                LaunchPadConfig.DEFAULT_MAX_CLAIM_ATTEMPTS,
                LaunchPadConfig.DEFAULT_WORKER_NAME
        );
    }

    public static LaunchPadSettings load(LaunchPadConfig config) {
        return load(config.settingsFile());
    }

    public static LaunchPadSettings load(Path file) {
        LaunchPadSettings defaults = defaults();
        if (!Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return new LaunchPadSettings(
                    raw.lostRunExpiryMs() == null ? defaults.lostRunExpiryMs() : raw.lostRunExpiryMs(),
                    raw.reservationExpiryMs() == null ? defaults.reservationExpiryMs() : raw.reservationExpiryMs(),
                    raw.busyTimeoutMs() == null ? defaults.busyTimeoutMs() : raw.busyTimeoutMs(),
                    raw.maxClaimAttempts() == null ? defaults.maxClaimAttempts() : raw.maxClaimAttempts(),
                    raw.workerName() == null ? defaults.workerName() : raw.workerName()
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings file: " + file, e);
        }
    }

    public LaunchPadSettings withLostRunExpiryMs(long value) {
        return new LaunchPadSettings(value, reservationExpiryMs, busyTimeoutMs, maxClaimAttempts, workerName);
    }

    public LaunchPadSettings withMaxClaimAttempts(int value) {
        return new LaunchPadSettings(lostRunExpiryMs, reservationExpiryMs, busyTimeoutMs, value, workerName);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long lostRunExpiryMs,
            Long reservationExpiryMs,
            Integer busyTimeoutMs,
            Integer maxClaimAttempts,
            String workerName
    ) {
    }
}
