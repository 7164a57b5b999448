package io.launchpad.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;
import io.launchpad.util.Jsons;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to implementation tables for tasks and for the functions tasks call.
 * Built at process start; nothing is resolved by reflection.
 */
public final class TaskRegistry {
    public static final String TASK_KEY = "_task";

    private final Map<String, FireTask> tasks = new ConcurrentHashMap<>();
    private final Map<String, TaskFunction> functions = new ConcurrentHashMap<>();

    public static TaskRegistry withBuiltins() {
        TaskRegistry registry = new TaskRegistry();
        registry.register(new EchoTask());
        registry.register(new ScriptTask());
        registry.register(new SingleTask());
        registry.register(new ForeachTask());
        registry.register(new JoinDictTask());
        registry.register(new JoinListTask());
        registry.registerFunction("identity", inputs -> {
            if (inputs.size() == 1) {
                return inputs.get(0);
            }
            ArrayNode out = Jsons.compact().createArrayNode();
            inputs.forEach(out::add);
            return out;
        });
        registry.registerFunction("sum", TaskRegistry::sum);
        return registry;
    }

    public void register(FireTask task) {
        tasks.put(task.name(), task);
    }

    public void registerFunction(String name, TaskFunction function) {
        functions.put(name, function);
    }

    public Optional<FireTask> findTask(String name) {
        return Optional.ofNullable(tasks.get(name));
    }

    public Optional<TaskFunction> findFunction(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Collection<String> listTaskNames() {
        return new TreeSet<>(tasks.keySet());
    }

    private static JsonNode sum(List<JsonNode> inputs) {
        boolean integral = true;
        double total = 0.0;
        long longTotal = 0L;
        for (JsonNode in : inputs) {
            Iterable<JsonNode> values = in.isArray() ? in : List.of(in);
            for (JsonNode v : values) {
                if (!v.isNumber()) {
                    throw new IllegalArgumentException("sum accepts numbers only, got " + v.getNodeType());
                }
                integral &= v.isIntegralNumber();
                total += v.asDouble();
                longTotal += v.asLong();
            }
        }
        return integral ? LongNode.valueOf(longTotal) : DoubleNode.valueOf(total);
    }
}
