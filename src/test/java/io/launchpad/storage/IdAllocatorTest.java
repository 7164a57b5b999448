package io.launchpad.storage;

import io.launchpad.config.LaunchPadConfig;
import io.launchpad.config.LaunchPadSettings;
import io.launchpad.exceptions.AllocatorExhaustedException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class IdAllocatorTest {

    @Test
    void resetStartsEveryCounterAtOne() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-alloc-reset-");
        try {
            Database db = newDatabase(root);
            IdAllocator allocator = new IdAllocator(db);
            allocator.nextId(IdAllocator.NODE_COUNTER, 40);
            allocator.nextId(IdAllocator.LAUNCH_COUNTER, 3);

            db.reset();

            Assertions.assertEquals(1L, allocator.nextId(IdAllocator.NODE_COUNTER, 5));
            Assertions.assertEquals(6L, allocator.nextId(IdAllocator.NODE_COUNTER, 1));
            Assertions.assertEquals(1L, allocator.nextId(IdAllocator.LAUNCH_COUNTER, 1));
            Assertions.assertEquals(1L, allocator.nextId(IdAllocator.GRAPH_COUNTER, 1));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentRequestsPartitionTheIdSpace() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-alloc-concurrent-");
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            Database db = newDatabase(root);
            IdAllocator allocator = new IdAllocator(db);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<long[]>> futures = new ArrayList<>();
            long total = 0L;
            for (int t = 0; t < 6; t++) {
                for (int r = 0; r < 10; r++) {
                    long quantity = 1L + ((t * 7L + r * 3L) % 5L);
                    total += quantity;
                    Callable<long[]> request = () -> {
                        start.await();
                        return new long[]{allocator.nextId(IdAllocator.NODE_COUNTER, quantity), quantity};
                    };
                    futures.add(pool.submit(request));
                }
            }
            start.countDown();

            List<long[]> ranges = new ArrayList<>();
            for (Future<long[]> f : futures) {
                ranges.add(f.get(30, TimeUnit.SECONDS));
            }
            ranges.sort(Comparator.comparingLong(r -> r[0]));
            long expectedNext = 1L;
            for (long[] range : ranges) {
                Assertions.assertEquals(expectedNext, range[0], "ranges must be contiguous and disjoint");
                expectedNext = range[0] + range[1];
            }
            Assertions.assertEquals(total + 1L, expectedNext);
            Assertions.assertEquals(total + 1L, allocator.nextId(IdAllocator.NODE_COUNTER, 1));
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void overflowFailsWithoutMovingTheCounter() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-alloc-overflow-");
        try {
            Database db = newDatabase(root);
            IdAllocator allocator = new IdAllocator(db);
            allocator.forceCounter(IdAllocator.LAUNCH_COUNTER, Long.MAX_VALUE - 2L);

            Assertions.assertThrows(AllocatorExhaustedException.class,
                    () -> allocator.nextId(IdAllocator.LAUNCH_COUNTER, 5));
            Assertions.assertEquals(Long.MAX_VALUE - 2L, allocator.nextId(IdAllocator.LAUNCH_COUNTER, 2));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rejectsUnknownCounterAndEmptyRequests() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-alloc-args-");
        try {
            IdAllocator allocator = new IdAllocator(newDatabase(root));
            Assertions.assertThrows(IllegalArgumentException.class, () -> allocator.nextId("next_widget_id", 1));
            Assertions.assertThrows(IllegalArgumentException.class, () -> allocator.nextId(IdAllocator.NODE_COUNTER, 0));
            Assertions.assertEquals(1L, allocator.nextId(IdAllocator.NODE_COUNTER, 1));
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
