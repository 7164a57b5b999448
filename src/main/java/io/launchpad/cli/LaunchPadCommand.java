package io.launchpad.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.launchpad.LaunchPad;
import io.launchpad.config.LaunchPadConfig;
import io.launchpad.engine.CompletionHandler.Completion;
import io.launchpad.engine.SelectionPolicy;
import io.launchpad.engine.WorkflowInserter;
import io.launchpad.exceptions.LaunchPadException;
import io.launchpad.model.Firework;
import io.launchpad.model.FireworkState;
import io.launchpad.model.Launch;
import io.launchpad.model.WorkflowDraft;
import io.launchpad.model.WorkflowSummary;
import io.launchpad.model.WorkflowView;
import io.launchpad.task.Rocket;
import io.launchpad.task.TaskRegistry;
import io.launchpad.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.LongFunction;

@Command(
        name = "lpad",
        mixinStandardHelpOptions = true,
        description = "LaunchPad workflow store CLI",
        subcommands = {
                LaunchPadCommand.ResetCommand.class,
                LaunchPadCommand.AddCommand.class,
                LaunchPadCommand.GetFireworkCommand.class,
                LaunchPadCommand.GetWorkflowCommand.class,
                LaunchPadCommand.GetLaunchCommand.class,
                LaunchPadCommand.SummaryCommand.class,
                LaunchPadCommand.PauseCommand.class,
                LaunchPadCommand.ResumeCommand.class,
                LaunchPadCommand.DefuseCommand.class,
                LaunchPadCommand.ReigniteCommand.class,
                LaunchPadCommand.RerunCommand.class,
                LaunchPadCommand.ArchiveWorkflowCommand.class,
                LaunchPadCommand.SetPriorityCommand.class,
                LaunchPadCommand.DetectLostRunsCommand.class,
                LaunchPadCommand.RocketLaunchCommand.class
        }
)
public final class LaunchPadCommand implements Runnable {

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: reset | add | get-fw | get-wf | get-launch | summary | pause | resume | defuse | reignite | rerun | archive-wf | set-priority | detect-lostruns | rlaunch");
    }

    LaunchPad launchPad() {
        return LaunchPad.open(LaunchPadConfig.fromRoot(root));
    }

    static int fail(String message) {
        ObjectNode out = Jsons.newObject();
        out.put("error", message == null ? "" : message);
        System.out.println(Jsons.toJson(out));
        return 1;
    }

    static ObjectNode fireworkJson(Firework fw) {
        ObjectNode out = Jsons.newObject();
        out.put("fw_id", fw.fwId());
        out.put("name", fw.name());
        out.put("state", fw.state().name());
        out.set("spec", fw.spec());
        ArrayNode tasks = out.putArray("tasks");
        fw.tasks().forEach(tasks::add);
        ArrayNode launches = out.putArray("launches");
        fw.launchIds().forEach(launches::add);
        out.put("created_on", fw.createdOn().toString());
        out.put("updated_on", fw.updatedOn().toString());
        return out;
    }

    static ObjectNode workflowJson(WorkflowView view) {
        ObjectNode out = Jsons.newObject();
        out.put("wf_id", view.workflow().wfId());
        out.put("name", view.workflow().name());
        out.put("state", view.state().name());
        out.set("metadata", view.workflow().metadata());
        ObjectNode links = out.putObject("links");
        view.workflow().links().forEach((id, children) -> {
            ArrayNode arr = links.putArray(String.valueOf(id));
            children.forEach(arr::add);
        });
        ArrayNode fws = out.putArray("fireworks");
        view.fireworks().values().forEach(fw -> fws.add(fireworkJson(fw)));
        return out;
    }

    static ObjectNode summaryJson(WorkflowSummary summary) {
        ObjectNode out = Jsons.newObject();
        out.put("wf_id", summary.wfId());
        out.put("name", summary.name());
        out.put("state", summary.state().name());
        out.put("size", summary.size());
        ObjectNode counts = out.putObject("counts");
        summary.counts().forEach((state, n) -> counts.put(state.name(), n));
        out.put("updated_on", summary.updatedOn().toString());
        return out;
    }

    static ObjectNode launchJson(Launch launch) {
        ObjectNode out = Jsons.readObject(launch.toRecord().data());
        out.put("launch_id", launch.launchId());
        out.put("fw_id", launch.fwId());
        out.put("state", launch.state().name());
        return out;
    }

    @Command(name = "reset", description = "Delete every workflow, firework and launch and restart all ids at 1")
    static final class ResetCommand implements Callable<Integer> {
        @ParentCommand
        LaunchPadCommand parent;

        @Option(names = {"--confirm"}, description = "Required; the reset cannot be undone")
        boolean confirm;

        @Override
        public Integer call() {
            if (!confirm) {
                return fail("reset needs --confirm");
            }
            LaunchPad lp = parent.launchPad();
            lp.resetStore();
            System.out.println("Reset LaunchPad at: " + lp.config().rootDir());
            return 0;
        }
    }

    @Command(name = "add", description = "Submit a workflow (or a list of workflows) from a JSON file")
    static final class AddCommand implements Callable<Integer> {
        @ParentCommand
        LaunchPadCommand parent;

        @Option(names = {"--file"}, required = true, description = "Workflow JSON file path")
        String file;

        @Override
        public Integer call() throws Exception {
            JsonNode raw = Jsons.readTree(Files.readString(Path.of(file)));
            List<WorkflowDraft> drafts = new ArrayList<>();
            if (raw.isArray()) {
                raw.forEach(n -> drafts.add(WorkflowDraft.fromJson(n)));
            } else {
                drafts.add(WorkflowDraft.fromJson(raw));
            }
            LaunchPad lp = parent.launchPad();
            List<WorkflowInserter.InsertResult> results = lp.bulkSubmit(drafts);
            ArrayNode out = Jsons.compact().createArrayNode();
            for (WorkflowInserter.InsertResult r : results) {
                ObjectNode n = out.addObject();
                n.put("wf_id", r.wfId());
                ObjectNode ids = n.putObject("id_map");
                r.idMap().forEach((local, assigned) -> ids.put(String.valueOf(local), assigned));
            }
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "get-fw", description = "Show one firework")
    static final class GetFireworkCommand implements Callable<Integer> {
        @ParentCommand
        LaunchPadCommand parent;

        @Parameters(index = "0", description = "Firework id")
        long fwId;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(fireworkJson(parent.launchPad().getFirework(fwId))));
                return 0;
            } catch (LaunchPadException e) {
                return fail(e.getMessage());
            }
        }
    }

    @Command(name = "get-wf", description = "Show the workflow that owns a firework")
    static final class GetWorkflowCommand implements Callable<Integer> {
        @ParentCommand
        LaunchPadCommand parent;

        @Parameters(index = "0", description = "Firework id of any member")
        long fwId;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(workflowJson(parent.launchPad().getWorkflowByFirework(fwId))));
                return 0;
            } catch (LaunchPadException e) {
                return fail(e.getMessage());
            }
        }
    }

    @Command(name = "get-launch", description = "Show one launch")
    static final class GetLaunchCommand implements Callable<Integer> {
        @ParentCommand
        LaunchPadCommand parent;

        @Parameters(index = "0", description = "Launch id")
        long launchId;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(launchJson(parent.launchPad().getLaunch(launchId))));
                return 0;
            } catch (LaunchPadException e) {
                return fail(e.getMessage());
            }
        }
    }

    @Command(name = "summary", description = "Summarize every workflow and count fireworks by state")
    static final class SummaryCommand implements Callable<Integer> {
        @ParentCommand
        LaunchPadCommand parent;

        @Override
        public Integer call() {
            LaunchPad lp = parent.launchPad();
            ObjectNode out = Jsons.newObject();
            ArrayNode workflows = out.putArray("workflows");
            for (Long wfId : lp.getWorkflowIds()) {
                workflows.add(summaryJson(WorkflowSummary.of(lp.getWorkflow(wfId))));
            }
            ObjectNode fireworks = out.putObject("fireworks");
            for (FireworkState state : FireworkState.values()) {
                fireworks.put(state.name(), lp.getFireworkIds(state).size());
            }
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    abstract static class FireworkOperatorCommand implements Callable<Integer> {
        @ParentCommand
        LaunchPadCommand parent;

        @Parameters(index = "0", description = "Firework id")
        long fwId;

        abstract LongFunction<WorkflowView> operation(LaunchPad lp);

        @Override
        public Integer call() {
            try {
                WorkflowView view = operation(parent.launchPad()).apply(fwId);
                System.out.println(Jsons.toJson(summaryJson(WorkflowSummary.of(view))));
                return 0;
            } catch (LaunchPadException e) {
                return fail(e.getMessage());
            }
        }
    }

    @Command(name = "pause", description = "Pause a WAITING or READY firework")
    static final class PauseCommand extends FireworkOperatorCommand {
        @Option(names = {"--wf"}, description = "Pause the whole workflow")
        boolean workflow;

        @Override
        LongFunction<WorkflowView> operation(LaunchPad lp) {
            return workflow ? lp::pauseWorkflow : lp::pause;
        }
    }

    @Command(name = "resume", description = "Resume a PAUSED firework")
    static final class ResumeCommand extends FireworkOperatorCommand {
        @Option(names = {"--wf"}, description = "Resume the whole workflow")
        boolean workflow;

        @Override
        LongFunction<WorkflowView> operation(LaunchPad lp) {
            return workflow ? lp::resumeWorkflow : lp::resume;
        }
    }

    @Command(name = "defuse", description = "Defuse a firework and everything unfinished below it")
    static final class DefuseCommand extends FireworkOperatorCommand {
        @Option(names = {"--wf"}, description = "Defuse the whole workflow")
        boolean workflow;

        @Override
        LongFunction<WorkflowView> operation(LaunchPad lp) {
            return workflow ? lp::defuseWorkflow : lp::defuse;
        }
    }

    @Command(name = "reignite", description = "Bring a DEFUSED firework back")
    static final class ReigniteCommand extends FireworkOperatorCommand {
        @Option(names = {"--wf"}, description = "Reignite the whole workflow")
        boolean workflow;

        @Override
        LongFunction<WorkflowView> operation(LaunchPad lp) {
            return workflow ? lp::reigniteWorkflow : lp::reignite;
        }
    }

    @Command(name = "rerun", description = "Run a finished firework and its dependents again")
    static final class RerunCommand extends FireworkOperatorCommand {
        @Override
        LongFunction<WorkflowView> operation(LaunchPad lp) {
            return lp::rerun;
        }
    }

    @Command(name = "archive-wf", description = "Archive the workflow that owns a firework")
    static final class ArchiveWorkflowCommand extends FireworkOperatorCommand {
        @Override
        LongFunction<WorkflowView> operation(LaunchPad lp) {
            return lp::archiveWorkflow;
        }
    }

    @Command(name = "set-priority", description = "Set the _priority of a firework")
    static final class SetPriorityCommand extends FireworkOperatorCommand {
        @Parameters(index = "1", description = "Priority, higher runs first under the priority policy")
        int priority;

        @Override
        LongFunction<WorkflowView> operation(LaunchPad lp) {
            return id -> lp.setPriority(id, priority);
        }
    }

    @Command(name = "detect-lostruns", description = "Reclaim launches whose heartbeat stopped")
    static final class DetectLostRunsCommand implements Callable<Integer> {
        @ParentCommand
        LaunchPadCommand parent;

        @Option(names = {"--expiry-ms"}, description = "Silence after which a launch counts as lost; defaults to settings")
        Long expiryMs;

        @Option(names = {"--unreserved"}, description = "Also reclaim reservations older than the reservation expiry")
        boolean unreserved;

        @Override
        public Integer call() {
            LaunchPad lp = parent.launchPad();
            ObjectNode out = Jsons.newObject();
            ArrayNode lost = out.putArray("lost_launches");
            (expiryMs == null ? lp.detectLostRuns() : lp.detectLostRuns(expiryMs)).forEach(lost::add);
            if (unreserved) {
                ArrayNode expired = out.putArray("expired_reservations");
                lp.detectUnreserved().forEach(expired::add);
            }
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "rlaunch", description = "Run READY fireworks in this process")
    static final class RocketLaunchCommand implements Callable<Integer> {
        @ParentCommand
        LaunchPadCommand parent;

        @Option(names = {"--once"}, description = "Run a single firework and stop")
        boolean once;

        @Option(names = {"--fw-id"}, description = "With --once, the firework to run")
        Long fwId;

        @Option(names = {"--max"}, defaultValue = "0", description = "Stop after this many launches; 0 runs until nothing is READY")
        int max;

        @Option(names = {"--policy"}, defaultValue = "lowest_id", description = "Selection order: lowest_id|priority")
        String policy;

        @Option(names = {"--worker"}, description = "Worker name recorded on launches; defaults to settings")
        String worker;

        @Override
        public Integer call() {
            LaunchPad lp = parent.launchPad();
            lp.setSelectionOrder(SelectionPolicy.fromString(policy).order());
            Rocket rocket = new Rocket(lp, TaskRegistry.withBuiltins(), worker);
            try {
                if (once) {
                    Optional<Completion> done = rocket.launchOnce(fwId);
                    ObjectNode out = Jsons.newObject();
                    if (done.isEmpty()) {
                        out.put("launched", false);
                    } else {
                        out.put("launched", true);
                        out.set("launch", launchJson(done.get().launch()));
                    }
                    System.out.println(Jsons.toJson(out));
                    return 0;
                }
                int count = rocket.rapidfire(max);
                ObjectNode out = Jsons.newObject();
                out.put("launches", count);
                System.out.println(Jsons.toJson(out));
                return 0;
            } catch (LaunchPadException e) {
                return fail(e.getMessage());
            }
        }
    }
}
