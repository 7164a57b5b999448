package io.launchpad.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.launchpad.exceptions.StoreAccessException;
import io.launchpad.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends one compact JSON line per operator-visible event to the audit file.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final Clock clock;

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new StoreAccessException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    public Path auditFile() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details());
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StoreAccessException("Failed to write audit log", e);
        }
    }

    /**
     * Reads back every row, oldest first. Blank lines are skipped.
     */
    public synchronized List<JsonNode> readAll() {
        try {
            List<JsonNode> out = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    out.add(Jsons.readTree(line));
                }
            }
            return out;
        } catch (IOException e) {
            throw new StoreAccessException("Failed to read audit log", e);
        }
    }

    public record AuditEvent(String action, String actor, String resource, String result, Map<String, Object> details) {
        public AuditEvent {
            details = details == null ? Map.of() : new LinkedHashMap<>(details);
        }

        public static AuditEvent ok(String action, String actor, String resource, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, "ok", details);
        }

        public static AuditEvent rejected(String action, String actor, String resource, String reason) {
            return new AuditEvent(action, actor, resource, "rejected", Map.of("reason", reason == null ? "" : reason));
        }
    }
}
