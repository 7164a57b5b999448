package io.launchpad.task;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.launchpad.LaunchPad;
import io.launchpad.engine.CheckoutResult;
import io.launchpad.engine.CompletionHandler.Completion;
import io.launchpad.exceptions.StoreAccessException;
import io.launchpad.model.Firework;
import io.launchpad.model.FireworkState;
import io.launchpad.model.FwAction;
import io.launchpad.model.Launch;
import io.launchpad.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs claimed fireworks in this process: claim, run every task in order,
 * then complete the launch with the merged action. Any task failure finishes
 * the launch FIZZLED with the error kept in the launch's stored data.
 */
public final class Rocket {
    private static final Logger log = LoggerFactory.getLogger(Rocket.class);
    private static final AtomicLong SEQ = new AtomicLong();

    private final LaunchPad launchPad;
    private final TaskRegistry registry;
    private final String worker;

    public Rocket(LaunchPad launchPad, TaskRegistry registry, String worker) {
        this.launchPad = launchPad;
        this.registry = registry;
        this.worker = worker == null || worker.isBlank() ? launchPad.settings().workerName() : worker;
    }

    /**
     * Claims and runs one firework.
     *
     * @param fwId a specific READY firework, or null for the next one
     * @return empty when nothing was runnable
     */
    public Optional<Completion> launchOnce(Long fwId) {
        Path launchDir = newLaunchDir();
        CheckoutResult claim = launchPad.checkout(worker, launchDir.toString(), fwId);
        if (claim.isEmpty()) {
            return Optional.empty();
        }
        Firework fw = claim.firework();
        Launch launch = claim.launch();
        FwAction action = FwAction.empty();
        ObjectNode spec = fw.spec().deepCopy();
        try {
            for (ObjectNode params : fw.tasks()) {
                String taskName = params.path(TaskRegistry.TASK_KEY).asText("");
                FireTask task = registry.findTask(taskName)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown task: '" + taskName + "'"));
                FwAction result = task.run(new TaskContext(fw.fwId(), launch.launchId(), params, spec.deepCopy(), registry));
                if (result != null) {
                    spec = result.applyTo(spec);
                    action = action.merge(result);
                }
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("Firework {} failed in launch {}: {}", fw.fwId(), launch.launchId(), e.getMessage());
            ObjectNode stored = Jsons.newObject();
            stored.put("_exception", e.getClass().getSimpleName() + ": " + e.getMessage());
            FwAction failed = new FwAction(stored, null, null, null, false, false);
            return Optional.of(launchPad.complete(launch.launchId(), failed, FireworkState.FIZZLED));
        }
        return Optional.of(launchPad.complete(launch.launchId(), action, FireworkState.COMPLETED));
    }

    /**
     * Launches until nothing is READY or {@code maxLaunches} is reached; a
     * non-positive limit means no limit.
     *
     * @return number of launches run
     */
    public int rapidfire(int maxLaunches) {
        int count = 0;
        while (maxLaunches <= 0 || count < maxLaunches) {
            if (launchOnce(null).isEmpty()) {
                break;
            }
            count++;
        }
        log.info("Rapidfire by {} finished after {} launches", worker, count);
        return count;
    }

    private Path newLaunchDir() {
        Path dir = launchPad.config().launchRoot()
                .resolve("launcher_" + System.currentTimeMillis() + "_" + SEQ.incrementAndGet());
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StoreAccessException("Failed to create launch directory " + dir, e);
        }
        return dir;
    }
}
