package io.calcrelay.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.calcrelay.security.SensitiveDataMasker;
import io.calcrelay.util.Hashing;
import io.calcrelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines record of what the runner did: claims, step
 * transitions, retries, exceptions and run summaries. Each row carries the
 * hash of the previous one, so truncation or edits are detectable.
 */
public final class AuditLogger {
    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
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
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("calcjob_pk", event.calcjobPk());
        row.put("step", event.step());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Last {@code limit} rows, oldest first.
     */
    public synchronized List<JsonNode> tail(int limit) {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
        List<JsonNode> out = new ArrayList<>();
        int from = Math.max(0, lines.size() - Math.max(1, limit));
        for (int i = from; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                out.add(Jsons.mapper().readTree(line));
            } catch (IOException e) {
                throw new RuntimeException("Corrupt audit row at line " + (i + 1), e);
            }
        }
        return out;
    }

    /**
     * Recomputes every row hash and checks that each row points at its
     * predecessor. Stops at the first broken line.
     */
    public synchronized IntegrityReport verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to verify audit log", e);
        }
        int checked = 0;
        String expectedPrev = "";
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            JsonNode parsed;
            try {
                parsed = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                return new IntegrityReport(false, checked, i + 1, "invalid_json", expectedPrev);
            }
            if (!parsed.isObject()) {
                return new IntegrityReport(false, checked, i + 1, "invalid_json", expectedPrev);
            }
            if (!parsed.path("prev_hash").asText("").equals(expectedPrev)) {
                return new IntegrityReport(false, checked, i + 1, "prev_hash_mismatch", expectedPrev);
            }
            String hash = parsed.path("hash").asText("");
            ObjectNode canonical = ((ObjectNode) parsed).deepCopy();
            canonical.remove("hash");
            if (!Hashing.sha256Hex(Jsons.toCompactJson(canonical)).equals(hash)) {
                return new IntegrityReport(false, checked, i + 1, "hash_mismatch", expectedPrev);
            }
            checked++;
            expectedPrev = hash;
        }
        return new IntegrityReport(true, checked, 0, "", expectedPrev);
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, Map.class);
    }

    public record IntegrityReport(
            boolean ok,
            int checkedRows,
            int brokenLine,
            String reason,
            String tailHash
    ) {
    }

    public record AuditEvent(
            String action,
            String actor,
            Long calcjobPk,
            String step,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, Long calcjobPk, String step, String result,
                                    Map<String, Object> details) {
            return new AuditEvent(action, actor, calcjobPk, step, result, details == null ? Map.of() : details);
        }

        public static AuditEvent global(String action, String actor, String result, Map<String, Object> details) {
            return of(action, actor, null, null, result, details);
        }
    }
}
