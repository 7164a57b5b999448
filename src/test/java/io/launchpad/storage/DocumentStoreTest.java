package io.launchpad.storage;

import io.launchpad.config.LaunchPadConfig;
import io.launchpad.config.LaunchPadSettings;
import io.launchpad.model.FireworkRecord;
import io.launchpad.model.LaunchRecord;
import io.launchpad.model.WorkflowRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

final class DocumentStoreTest {

    @Test
    void compareAndSetStateOnlyMovesFromTheExpectedState() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-store-cas-");
        try {
            Database db = newDatabase(root);
            DocumentStore store = new DocumentStore();
            db.inTransaction(c -> {
                store.putFireworks(c, List.of(
                        new FireworkRecord(1L, "READY", "{\"fw_id\":1}"),
                        new FireworkRecord(2L, "WAITING", "{\"fw_id\":2}"),
                        new FireworkRecord(3L, "READY", "{\"fw_id\":3}")
                ), 100L);
                return null;
            });

            boolean claimed = db.inTransaction(c -> store.compareAndSetState(c, 1L, "READY", "RESERVED", 200L));
            boolean claimedAgain = db.inTransaction(c -> store.compareAndSetState(c, 1L, "READY", "RESERVED", 300L));
            boolean claimedMissing = db.inTransaction(c -> store.compareAndSetState(c, 99L, "READY", "RESERVED", 300L));
            Assertions.assertTrue(claimed);
            Assertions.assertFalse(claimedAgain);
            Assertions.assertFalse(claimedMissing);

            Assertions.assertEquals(List.of(3L), db.inTransaction(c -> store.findFireworkIds(c, "READY")));
            Assertions.assertEquals(List.of(1L, 2L, 3L), db.inTransaction(c -> store.findFireworkIds(c, null)));
            Assertions.assertEquals("RESERVED", db.inTransaction(c -> store.getFirework(c, 1L)).orElseThrow().state());

            boolean deleted = db.inTransaction(c -> store.deleteFirework(c, 2L));
            Assertions.assertTrue(deleted);
            Assertions.assertEquals(Optional.empty(), db.inTransaction(c -> store.getFirework(c, 2L)));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void mappingRowsResolveOwningWorkflow() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-store-mapping-");
        try {
            Database db = newDatabase(root);
            DocumentStore store = new DocumentStore();
            db.inTransaction(c -> {
                store.putWorkflow(c, new WorkflowRecord(7L, "{\"wf_id\":7}"), 100L);
                store.putMappings(c, List.of(11L, 12L, 10L), 7L);
                return null;
            });

            Assertions.assertEquals(Optional.of(7L), db.inTransaction(c -> store.findWorkflowIdForFirework(c, 12L)));
            Assertions.assertEquals(Optional.empty(), db.inTransaction(c -> store.findWorkflowIdForFirework(c, 13L)));
            Assertions.assertEquals(List.of(10L, 11L, 12L), db.inTransaction(c -> store.listFireworkIdsForWorkflow(c, 7L)));
            Assertions.assertEquals(List.of(7L), db.inTransaction(store::listWorkflowIds));
            Assertions.assertEquals("{\"wf_id\":7}", db.inTransaction(c -> store.getWorkflow(c, 7L)).orElseThrow().data());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void staleLaunchQueryFiltersByStateAndHeartbeat() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-store-stale-");
        try {
            Database db = newDatabase(root);
            DocumentStore store = new DocumentStore();
            db.inTransaction(c -> {
                store.putLaunch(c, new LaunchRecord(1L, 10L, "RUNNING", 1_000L, "{}"));
                store.putLaunch(c, new LaunchRecord(2L, 11L, "RUNNING", 5_000L, "{}"));
                store.putLaunch(c, new LaunchRecord(3L, 12L, "RESERVED", 500L, "{}"));
                store.putLaunch(c, new LaunchRecord(4L, 13L, "RUNNING", 200L, "{}"));
                return null;
            });

            List<LaunchRecord> stale = db.inTransaction(c -> store.findStaleLaunches(c, "RUNNING", 1_000L));
            Assertions.assertEquals(List.of(4L, 1L), stale.stream().map(LaunchRecord::launchId).toList());

            db.inTransaction(c -> {
                store.putLaunch(c, new LaunchRecord(1L, 10L, "FIZZLED", 1_000L, "{}"));
                return null;
            });
            stale = db.inTransaction(c -> store.findStaleLaunches(c, "RUNNING", 1_000L));
            Assertions.assertEquals(List.of(4L), stale.stream().map(LaunchRecord::launchId).toList());
            Assertions.assertEquals("FIZZLED", db.inTransaction(c -> store.getLaunch(c, 1L)).orElseThrow().state());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Database newDatabase(Path root) {
        Database db = new Database(LaunchPadConfig.fromRoot(root.toString()), LaunchPadSettings.defaults());
        db.init();
        return db;
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
