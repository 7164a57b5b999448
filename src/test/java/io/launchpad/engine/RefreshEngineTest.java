package io.launchpad.engine;

import io.launchpad.LaunchPad;
import io.launchpad.config.LaunchPadConfig;
import io.launchpad.config.LaunchPadSettings;
import io.launchpad.engine.CompletionHandler.Completion;
import io.launchpad.engine.WorkflowInserter.InsertResult;
import io.launchpad.model.Firework;
import io.launchpad.model.FireworkState;
import io.launchpad.model.FwAction;
import io.launchpad.model.WorkflowDraft;
import io.launchpad.model.WorkflowState;
import io.launchpad.model.WorkflowView;
import io.launchpad.storage.Database;
import io.launchpad.storage.DocumentStore;
import io.launchpad.storage.IdAllocator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Stream;

final class RefreshEngineTest {

    @Test
    void linearChainCompletesThenFizzleDefusesDownstream() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-refresh-linear-");
        try {
            LaunchPad lp = newLaunchPad(root);
            InsertResult submitted = lp.submit(draft(3, Map.of(-1L, List.of(-2L), -2L, List.of(-3L))));
            long a = submitted.idMap().get(-1L);
            long b = submitted.idMap().get(-2L);
            long c = submitted.idMap().get(-3L);
            String dir = root.resolve("launch").toString();

            Assertions.assertEquals(FireworkState.READY, lp.getFirework(a).state());
            Assertions.assertEquals(FireworkState.WAITING, lp.getFirework(b).state());
            Assertions.assertEquals(FireworkState.WAITING, lp.getFirework(c).state());

            CheckoutResult first = lp.checkout(dir, null);
            Assertions.assertEquals(a, first.firework().fwId());
            Assertions.assertEquals(FireworkState.RUNNING, lp.getFirework(a).state());
            lp.complete(first.launch().launchId(), FwAction.empty(), FireworkState.COMPLETED);
            Assertions.assertEquals(FireworkState.READY, lp.getFirework(b).state());
            Assertions.assertEquals(FireworkState.WAITING, lp.getFirework(c).state());

            CheckoutResult second = lp.checkout(dir, null);
            Assertions.assertEquals(b, second.firework().fwId());
            Completion done = lp.complete(second.launch().launchId(), FwAction.empty(), FireworkState.FIZZLED);

            Assertions.assertEquals(FireworkState.DEFUSED, lp.getFirework(c).state());
            Assertions.assertTrue(done.changed().contains(c));
            Assertions.assertEquals(WorkflowState.FIZZLED, lp.getWorkflowByFirework(c).state());
            Assertions.assertTrue(lp.checkout(dir, null).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void diamondJoinWaitsForBothBranches() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-refresh-diamond-");
        try {
            LaunchPad lp = newLaunchPad(root);
            InsertResult submitted = lp.submit(draft(4, Map.of(
                    -1L, List.of(-2L, -3L),
                    -2L, List.of(-4L),
                    -3L, List.of(-4L))));
            long d = submitted.idMap().get(-4L);
            String dir = root.resolve("launch").toString();

            runNext(lp, dir);
            Assertions.assertEquals(FireworkState.READY, lp.getFirework(submitted.idMap().get(-2L)).state());
            Assertions.assertEquals(FireworkState.READY, lp.getFirework(submitted.idMap().get(-3L)).state());
            Assertions.assertEquals(FireworkState.WAITING, lp.getFirework(d).state());

            runNext(lp, dir);
            Assertions.assertEquals(FireworkState.WAITING, lp.getFirework(d).state());
            runNext(lp, dir);
            Assertions.assertEquals(FireworkState.READY, lp.getFirework(d).state());
            runNext(lp, dir);
            Assertions.assertEquals(WorkflowState.COMPLETED, lp.getWorkflowByFirework(d).state());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void singleStepOnlyReachesDirectChildren() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-refresh-step-");
        try {
            Parts parts = newParts(root);
            Instant now = Instant.now();
            InsertResult submitted = parts.db().inTransaction(
                    c -> parts.inserter().submit(c, draft(3, Map.of(-1L, List.of(-2L), -2L, List.of(-3L))), now));
            long a = submitted.idMap().get(-1L);
            long b = submitted.idMap().get(-2L);
            long c3 = submitted.idMap().get(-3L);

            pin(parts, submitted.wfId(), Map.of(a, FireworkState.COMPLETED), now);
            Assertions.assertEquals(Set.of(b), parts.db().inTransaction(c -> parts.engine().refresh(c, a, now)));
            Assertions.assertEquals(FireworkState.WAITING, stateOf(parts, c3));

            pin(parts, submitted.wfId(), Map.of(b, FireworkState.COMPLETED), now);
            Assertions.assertEquals(Set.of(), parts.db().inTransaction(c -> parts.engine().refresh(c, a, now)));
            Assertions.assertEquals(Set.of(c3), parts.db().inTransaction(c -> parts.engine().refresh(c, b, now)));
            Assertions.assertEquals(FireworkState.READY, stateOf(parts, c3));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fixedPointFromFizzleDefusesWholeChain() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-refresh-fixed-");
        try {
            Parts parts = newParts(root);
            Instant now = Instant.now();
            InsertResult submitted = parts.db().inTransaction(
                    c -> parts.inserter().submit(c, draft(3, Map.of(-1L, List.of(-2L), -2L, List.of(-3L))), now));
            long a = submitted.idMap().get(-1L);

            pin(parts, submitted.wfId(), Map.of(a, FireworkState.FIZZLED), now);
            Set<Long> changed = parts.db().inTransaction(c -> parts.engine().refreshToFixedPoint(c, a, now));

            Assertions.assertEquals(Set.of(submitted.idMap().get(-2L), submitted.idMap().get(-3L)), changed);
            Assertions.assertEquals(FireworkState.DEFUSED, stateOf(parts, submitted.idMap().get(-3L)));
            Assertions.assertEquals(Set.of(), parts.db().inTransaction(c -> parts.engine().refreshToFixedPoint(c, a, now)));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void randomGraphsSettleOnTheDerivedStatesAndStayThere() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-refresh-random-");
        try {
            Parts parts = newParts(root);
            Random random = new Random(20240611L);
            for (int round = 0; round < 6; round++) {
                Instant now = Instant.now();
                int size = 6 + random.nextInt(10);
                Map<Long, List<Long>> links = new LinkedHashMap<>();
                Map<Integer, List<Integer>> parents = new LinkedHashMap<>();
                for (int i = 0; i < size; i++) {
                    parents.put(i, new ArrayList<>());
                }
                for (int i = 0; i < size; i++) {
                    List<Long> children = new ArrayList<>();
                    for (int j = i + 1; j < size; j++) {
                        if (random.nextDouble() < 0.3) {
                            children.add(-(j + 1L));
                            parents.get(j).add(i);
                        }
                    }
                    links.put(-(i + 1L), children);
                }
                WorkflowDraft graph = draft(size, links);
                InsertResult submitted = parts.db().inTransaction(c -> parts.inserter().submit(c, graph, now));
                List<Long> ids = new ArrayList<>();
                for (int i = 0; i < size; i++) {
                    ids.add(submitted.idMap().get(-(i + 1L)));
                }

                Map<Long, FireworkState> pinned = new LinkedHashMap<>();
                for (Long id : ids) {
                    if (random.nextDouble() < 0.4) {
                        pinned.put(id, random.nextDouble() < 0.7 ? FireworkState.COMPLETED : FireworkState.FIZZLED);
                    }
                }
                pin(parts, submitted.wfId(), pinned, now);

                int passes = 0;
                boolean moved = true;
                while (moved) {
                    moved = false;
                    for (Long id : ids) {
                        if (!parts.db().inTransaction(c -> parts.engine().refresh(c, id, now)).isEmpty()) {
                            moved = true;
                        }
                    }
                    Assertions.assertTrue(++passes <= size + 1, "refresh did not settle");
                }

                List<FireworkState> expected = new ArrayList<>();
                for (int i = 0; i < size; i++) {
                    FireworkState fixed = pinned.get(ids.get(i));
                    if (fixed != null) {
                        expected.add(fixed);
                        continue;
                    }
                    boolean defused = false;
                    boolean ready = true;
                    for (Integer p : parents.get(i)) {
                        FireworkState parent = expected.get(p);
                        defused |= parent == FireworkState.FIZZLED || parent == FireworkState.DEFUSED;
                        ready &= parent == FireworkState.COMPLETED;
                    }
                    expected.add(defused ? FireworkState.DEFUSED : ready ? FireworkState.READY : FireworkState.WAITING);
                }
                WorkflowView view = parts.db().inTransaction(c -> WorkflowSnapshot.load(parts.store(), c, submitted.wfId()).toView());
                for (int i = 0; i < size; i++) {
                    Assertions.assertEquals(expected.get(i), view.firework(ids.get(i)).state(), "node " + i + " of round " + round);
                    Assertions.assertEquals(expected.get(i), view.workflow().cachedState(ids.get(i)));
                }

                String before = parts.db().inTransaction(c -> parts.store().getWorkflow(c, submitted.wfId())).orElseThrow().data();
                for (Long id : ids) {
                    Assertions.assertEquals(Set.of(), parts.db().inTransaction(c -> parts.engine().refresh(c, id, now)));
                }
                String after = parts.db().inTransaction(c -> parts.store().getWorkflow(c, submitted.wfId())).orElseThrow().data();
                Assertions.assertEquals(before, after);
            }
        } finally {
            deleteRecursively(root);
        }
    }

    private static void runNext(LaunchPad lp, String dir) {
        CheckoutResult claim = lp.checkout(dir, null);
        Assertions.assertFalse(claim.isEmpty());
        lp.complete(claim.launch().launchId(), FwAction.empty(), FireworkState.COMPLETED);
    }

    private static void pin(Parts parts, long wfId, Map<Long, FireworkState> states, Instant now) {
        parts.db().inTransaction(c -> {
            WorkflowSnapshot snapshot = WorkflowSnapshot.load(parts.store(), c, wfId);
            states.forEach((id, state) -> snapshot.setState(id, state, now));
            snapshot.persist(parts.store(), c, now);
            return null;
        });
    }

    private static FireworkState stateOf(Parts parts, long fwId) {
        return parts.db().inTransaction(c -> Firework.fromRecord(parts.store().getFirework(c, fwId).orElseThrow())).state();
    }

    static WorkflowDraft draft(int size, Map<Long, List<Long>> links) {
        List<Firework> fws = new ArrayList<>();
        for (int i = 1; i <= size; i++) {
            fws.add(Firework.draft(-i, "fw " + i, List.of(), null));
        }
        return new WorkflowDraft("graph", null, fws, links);
    }

    private static LaunchPad newLaunchPad(Path root) {
        return new LaunchPad(LaunchPadConfig.fromRoot(root.toString()), LaunchPadSettings.defaults(), Clock.systemUTC());
    }

    private static Parts newParts(Path root) {
        Database db = new Database(LaunchPadConfig.fromRoot(root.toString()), LaunchPadSettings.defaults());
        db.init();
        DocumentStore store = new DocumentStore();
        IdAllocator allocator = new IdAllocator(db);
        return new Parts(db, store, new WorkflowInserter(store, allocator), new RefreshEngine(store));
    }

    private record Parts(Database db, DocumentStore store, WorkflowInserter inserter, RefreshEngine engine) {
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
