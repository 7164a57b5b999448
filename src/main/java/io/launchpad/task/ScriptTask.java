package io.launchpad.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.launchpad.model.FwAction;
import io.launchpad.util.Jsons;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs an external command with the spec as JSON on stdin.
 *
 * <p>Parameters: {@code command} (list of strings, required),
 * {@code timeout_ms} (default one minute) and {@code output} (spec key that
 * receives stdout, parsed as JSON when it is JSON). A non-zero exit fails the
 * task.
 */
public final class ScriptTask implements FireTask {
    private static final int MAX_ERROR_CHARS = 512;
    private static final long DEFAULT_TIMEOUT_MS = 60_000L;
    private static final long OUTPUT_DRAIN_MS = 5_000L;

    @Override
    public String name() {
        return "script";
    }

    @Override
    public FwAction run(TaskContext context) throws Exception {
        List<String> command = new ArrayList<>();
        for (JsonNode part : context.params().path("command")) {
            command.add(part.asText());
        }
        if (command.isEmpty()) {
            throw new IllegalArgumentException("script task needs a non-empty 'command' list");
        }
        long timeoutMs = Math.max(1_000L, context.params().path("timeout_ms").asLong(DEFAULT_TIMEOUT_MS));

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new TaskExecutionException("script spawn failed: " + e.getMessage());
        }

        // Output is read while the process runs so a full pipe cannot stall it.
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        AtomicReference<IOException> readFailure = new AtomicReference<>();
        Thread drainer = new Thread(() -> {
            try (InputStream in = process.getInputStream()) {
                in.transferTo(captured);
            } catch (IOException e) {
                readFailure.set(e);
            }
        }, "script-output-" + context.launchId());
        drainer.setDaemon(true);
        drainer.start();

        String combined;
        try {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(Jsons.toCompactJson(context.spec()).getBytes(StandardCharsets.UTF_8));
            }

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                throw new TaskExecutionException("script timeout after " + Duration.ofMillis(timeoutMs));
            }
            drainer.join(OUTPUT_DRAIN_MS);
            if (drainer.isAlive()) {
                throw new TaskExecutionException("script output still open " + OUTPUT_DRAIN_MS + "ms after exit");
            }
            if (readFailure.get() != null) {
                throw readFailure.get();
            }
            combined = captured.toString(StandardCharsets.UTF_8).strip();
        } catch (IOException | InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
        if (process.exitValue() != 0) {
            throw new TaskExecutionException("script exit=" + process.exitValue() + " output=" + truncate(combined));
        }

        ObjectNode stored = Jsons.newObject();
        stored.put("stdout", combined);
        ObjectNode update = null;
        String output = context.params().path("output").asText("");
        if (!output.isBlank()) {
            update = Jsons.newObject();
            update.set(output, parseOrText(combined));
        }
        return new FwAction(stored, update, null, null, false, false);
    }

    private static JsonNode parseOrText(String raw) {
        try {
            JsonNode node = Jsons.compact().readTree(raw);
            return node == null || node.isMissingNode() ? TextNode.valueOf(raw) : node;
        } catch (IOException e) {
            return TextNode.valueOf(raw);
        }
    }

    private static String truncate(String raw) {
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
