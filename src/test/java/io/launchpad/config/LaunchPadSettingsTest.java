package io.launchpad.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class LaunchPadSettingsTest {

    @Test
    void missingFileGivesDefaults() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-settings-default-");
        try {
            LaunchPadConfig config = LaunchPadConfig.fromRoot(root.toString());
            LaunchPadSettings settings = LaunchPadSettings.load(config);
            Assertions.assertEquals(LaunchPadSettings.defaults(), settings);
            Assertions.assertEquals(4L * 60L * 60L * 1_000L, settings.lostRunExpiryMs());
            Assertions.assertEquals(root.toAbsolutePath().normalize().resolve("launchpad.db"), config.dbFile());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileOverridesOnlyTheFieldsItNames() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-settings-file-");
        try {
            LaunchPadConfig config = LaunchPadConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(),
                    "{\"lostRunExpiryMs\": 60000, \"workerName\": \" night-shift \", \"unrelated\": true}",
                    StandardCharsets.UTF_8);

            LaunchPadSettings settings = LaunchPadSettings.load(config);

            Assertions.assertEquals(60_000L, settings.lostRunExpiryMs());
            Assertions.assertEquals("night-shift", settings.workerName());
            Assertions.assertEquals(LaunchPadConfig.DEFAULT_MAX_CLAIM_ATTEMPTS, settings.maxClaimAttempts());
            Assertions.assertEquals(LaunchPadConfig.DEFAULT_RESERVATION_EXPIRY_MS, settings.reservationExpiryMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidValuesAreRejected() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-settings-invalid-");
        try {
            LaunchPadConfig config = LaunchPadConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), "{\"maxClaimAttempts\": 0}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> LaunchPadSettings.load(config));

            Files.writeString(config.settingsFile(), "{not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(RuntimeException.class, () -> LaunchPadSettings.load(config));

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> LaunchPadSettings.defaults().withLostRunExpiryMs(0L));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
