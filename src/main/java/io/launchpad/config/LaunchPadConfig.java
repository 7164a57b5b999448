package io.launchpad.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class LaunchPadConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DB_FILE_NAME = "launchpad.db";
    public static final String SETTINGS_FILE_NAME = "launchpad-settings.json";
    public static final long DEFAULT_LOST_RUN_EXPIRY_MS = 4L * 60L * 60L * 1_000L;
    public static final long DEFAULT_RESERVATION_EXPIRY_MS = 14L * 24L * 60L * 60L * 1_000L;
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5_000;
    public static final int DEFAULT_MAX_CLAIM_ATTEMPTS = 8;
    public static final String DEFAULT_WORKER_NAME = "local";

    private final Path rootDir;

    public LaunchPadConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static LaunchPadConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new LaunchPadConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve(DB_FILE_NAME);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path launchRoot() {
        return rootDir.resolve("launches");
    }
}
