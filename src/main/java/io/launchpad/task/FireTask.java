package io.launchpad.task;

import io.launchpad.model.FwAction;

/**
 * A unit of work a firework runs. Implementations are registered by name in
 * a {@link TaskRegistry} and looked up through the {@code _task} key of each
 * task entry.
 */
public interface FireTask {
    String name();

    FwAction run(TaskContext context) throws Exception;
}
