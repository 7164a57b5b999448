package io.launchpad.engine;

import io.launchpad.LaunchPad;
import io.launchpad.config.LaunchPadConfig;
import io.launchpad.config.LaunchPadSettings;
import io.launchpad.engine.WorkflowInserter.InsertResult;
import io.launchpad.exceptions.InvalidTransitionException;
import io.launchpad.model.FireworkState;
import io.launchpad.model.FwAction;
import io.launchpad.model.WorkflowState;
import io.launchpad.model.WorkflowSummary;
import io.launchpad.model.WorkflowView;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class OperatorActionsTest {

    @Test
    void pausedFireworkIsSkippedUntilResumed() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-ops-pause-");
        try {
            LaunchPad lp = newLaunchPad(root);
            InsertResult chain = lp.submit(RefreshEngineTest.draft(2, Map.of(-1L, List.of(-2L))));
            long a = chain.idMap().get(-1L);
            long b = chain.idMap().get(-2L);

            WorkflowView paused = lp.pause(a);
            Assertions.assertEquals(FireworkState.PAUSED, paused.firework(a).state());
            Assertions.assertEquals(WorkflowState.PAUSED, paused.state());
            Assertions.assertTrue(lp.checkout(dir(root), null).isEmpty());
            Assertions.assertThrows(InvalidTransitionException.class, () -> lp.pause(a));

            WorkflowView resumed = lp.resume(a);
            Assertions.assertEquals(FireworkState.READY, resumed.firework(a).state());
            Assertions.assertEquals(FireworkState.WAITING, resumed.firework(b).state());
            Assertions.assertThrows(InvalidTransitionException.class, () -> lp.resume(a));

            lp.checkout(dir(root), a);
            Assertions.assertThrows(InvalidTransitionException.class, () -> lp.pause(a));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void resumeUnderParentThatFizzledWhilePausedDefusesTheChain() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-ops-resume-fizzled-");
        try {
            LaunchPad lp = newLaunchPad(root);
            InsertResult chain = lp.submit(RefreshEngineTest.draft(3, Map.of(-1L, List.of(-2L), -2L, List.of(-3L))));
            long a = chain.idMap().get(-1L);
            long b = chain.idMap().get(-2L);
            long c = chain.idMap().get(-3L);

            lp.pause(b);
            CheckoutResult running = lp.checkout(dir(root), a);
            lp.complete(running.launch().launchId(), FwAction.empty(), FireworkState.FIZZLED);
            Assertions.assertEquals(FireworkState.PAUSED, lp.getFirework(b).state());
            Assertions.assertEquals(FireworkState.WAITING, lp.getFirework(c).state());

            WorkflowView resumed = lp.resume(b);
            Assertions.assertEquals(FireworkState.FIZZLED, resumed.firework(a).state());
            Assertions.assertEquals(FireworkState.DEFUSED, resumed.firework(b).state());
            Assertions.assertEquals(FireworkState.DEFUSED, resumed.firework(c).state());
            Assertions.assertTrue(lp.refresh(a).isEmpty());
            Assertions.assertTrue(lp.refresh(b).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void resumeWorkflowUnderFizzledParentDefusesReleasedMembers() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-ops-resume-wf-fizzled-");
        try {
            LaunchPad lp = newLaunchPad(root);
            InsertResult chain = lp.submit(RefreshEngineTest.draft(3, Map.of(-1L, List.of(-2L), -2L, List.of(-3L))));
            long a = chain.idMap().get(-1L);
            long b = chain.idMap().get(-2L);
            long c = chain.idMap().get(-3L);

            CheckoutResult running = lp.checkout(dir(root), a);
            lp.pauseWorkflow(a);
            lp.complete(running.launch().launchId(), FwAction.empty(), FireworkState.FIZZLED);

            WorkflowView resumed = lp.resumeWorkflow(a);
            Assertions.assertEquals(FireworkState.DEFUSED, resumed.firework(b).state());
            Assertions.assertEquals(FireworkState.DEFUSED, resumed.firework(c).state());
            Assertions.assertTrue(lp.refresh(a).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void defuseReachesDescendantsAndReigniteReleasesThem() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-ops-defuse-");
        try {
            LaunchPad lp = newLaunchPad(root);
            InsertResult chain = lp.submit(RefreshEngineTest.draft(3, Map.of(-1L, List.of(-2L), -2L, List.of(-3L))));
            long a = chain.idMap().get(-1L);
            long b = chain.idMap().get(-2L);
            long c = chain.idMap().get(-3L);

            WorkflowView defused = lp.defuse(a);
            Assertions.assertEquals(FireworkState.DEFUSED, defused.firework(a).state());
            Assertions.assertEquals(FireworkState.DEFUSED, defused.firework(b).state());
            Assertions.assertEquals(FireworkState.DEFUSED, defused.firework(c).state());
            Assertions.assertEquals(WorkflowState.DEFUSED, defused.state());

            WorkflowView reignited = lp.reignite(a);
            Assertions.assertEquals(FireworkState.READY, reignited.firework(a).state());
            Assertions.assertEquals(FireworkState.WAITING, reignited.firework(b).state());
            Assertions.assertEquals(FireworkState.WAITING, reignited.firework(c).state());
            Assertions.assertThrows(InvalidTransitionException.class, () -> lp.reignite(a));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rerunResetsDownstreamAndKeepsLaunchHistory() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-ops-rerun-");
        try {
            LaunchPad lp = newLaunchPad(root);
            InsertResult chain = lp.submit(RefreshEngineTest.draft(2, Map.of(-1L, List.of(-2L))));
            long a = chain.idMap().get(-1L);
            long b = chain.idMap().get(-2L);

            Assertions.assertThrows(InvalidTransitionException.class, () -> lp.rerun(a));
            runNext(lp, dir(root));
            CheckoutResult running = lp.checkout(dir(root), b);
            Assertions.assertThrows(InvalidTransitionException.class, () -> lp.rerun(a));
            lp.complete(running.launch().launchId(), FwAction.empty(), FireworkState.COMPLETED);
            Assertions.assertEquals(WorkflowState.COMPLETED, lp.getWorkflowByFirework(a).state());

            WorkflowView rerun = lp.rerun(a);
            Assertions.assertEquals(FireworkState.READY, rerun.firework(a).state());
            Assertions.assertEquals(FireworkState.WAITING, rerun.firework(b).state());
            Assertions.assertEquals(1, rerun.firework(a).launchIds().size());

            runNext(lp, dir(root));
            Assertions.assertEquals(2, lp.getFirework(a).launchIds().size());
            Assertions.assertEquals(FireworkState.READY, lp.getFirework(b).state());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void workflowWideActionsTouchEveryEligibleMember() throws Exception {
        Path root = Files.createTempDirectory("launchpad-test-ops-workflow-");
        try {
            LaunchPad lp = newLaunchPad(root);
            InsertResult graph = lp.submit(RefreshEngineTest.draft(3, Map.of(-1L, List.of(-2L))));
            long a = graph.idMap().get(-1L);
            long b = graph.idMap().get(-2L);
            long c = graph.idMap().get(-3L);

            WorkflowSummary paused = WorkflowSummary.of(lp.pauseWorkflow(b));
            Assertions.assertEquals(3, paused.count(FireworkState.PAUSED));
            WorkflowView resumed = lp.resumeWorkflow(c);
            Assertions.assertEquals(FireworkState.READY, resumed.firework(a).state());
            Assertions.assertEquals(FireworkState.WAITING, resumed.firework(b).state());
            Assertions.assertEquals(FireworkState.READY, resumed.firework(c).state());

            lp.defuseWorkflow(a);
            Assertions.assertEquals(3, lp.getWorkflowSummary(a).count(FireworkState.DEFUSED));
            WorkflowView reignited = lp.reigniteWorkflow(a);
            Assertions.assertEquals(FireworkState.READY, reignited.firework(a).state());
            Assertions.assertEquals(FireworkState.WAITING, reignited.firework(b).state());

            CheckoutResult running = lp.checkout(dir(root), c);
            WorkflowView archived = lp.archiveWorkflow(a);
            Assertions.assertEquals(FireworkState.ARCHIVED, archived.firework(a).state());
            Assertions.assertEquals(FireworkState.ARCHIVED, archived.firework(b).state());
            Assertions.assertEquals(FireworkState.RUNNING, archived.firework(c).state());
            Assertions.assertTrue(lp.checkout(dir(root), null).isEmpty());

            lp.complete(running.launch().launchId(), FwAction.empty(), FireworkState.COMPLETED);
            Assertions.assertEquals(FireworkState.COMPLETED, lp.getFirework(c).state());
            Assertions.assertEquals(FireworkState.ARCHIVED, lp.getFirework(b).state());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void runNext(LaunchPad lp, String dir) {
        CheckoutResult claim = lp.checkout(dir, null);
        Assertions.assertFalse(claim.isEmpty());
        lp.complete(claim.launch().launchId(), FwAction.empty(), FireworkState.COMPLETED);
    }

    private static String dir(Path root) {
        return root.resolve("launch").toString();
    }

    private static LaunchPad newLaunchPad(Path root) {
        return new LaunchPad(LaunchPadConfig.fromRoot(root.toString()), LaunchPadSettings.defaults(), Clock.systemUTC());
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
