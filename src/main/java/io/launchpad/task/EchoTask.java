package io.launchpad.task;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.launchpad.model.FwAction;
import io.launchpad.util.Jsons;

import java.time.Instant;

/**
 * Records what it received on the launch and changes nothing else.
 */
public final class EchoTask implements FireTask {
    @Override
    public String name() {
        return "echo";
    }

    @Override
    public FwAction run(TaskContext context) {
        ObjectNode stored = Jsons.newObject();
        stored.put("task", "echo");
        stored.put("timestamp", Instant.now().toString());
        stored.put("fw_id", context.fwId());
        stored.put("launch_id", context.launchId());
        if (context.params().hasNonNull("message")) {
            stored.set("message", context.params().get("message").deepCopy());
        }
        stored.set("received", context.spec().deepCopy());
        return new FwAction(stored, null, null, null, false, false);
    }
}
