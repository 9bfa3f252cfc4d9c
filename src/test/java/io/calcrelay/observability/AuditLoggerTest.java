package io.calcrelay.observability;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void rowsAreHashChainedAcrossReopen() throws Exception {
        Path root = Files.createTempDirectory("calcrelay-test-audit-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger first = new AuditLogger(file);
            first.log(AuditLogger.AuditEvent.of("calcjob.step", "runner-1", 7L, "created", "ok",
                    Map.of("from", "created", "to", "uploading")));
            String tail = first.currentHash();

            AuditLogger reopened = new AuditLogger(file);
            Assertions.assertEquals(tail, reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.global("runner.summary", "runner-1", "idle", Map.of("driven", 1)));

            List<JsonNode> rows = reopened.tail(10);
            Assertions.assertEquals(2, rows.size());
            Assertions.assertEquals("", rows.get(0).path("prev_hash").asText());
            Assertions.assertEquals(rows.get(0).path("hash").asText(), rows.get(1).path("prev_hash").asText());
            Assertions.assertEquals(7L, rows.get(0).path("calcjob_pk").asLong());
            Assertions.assertTrue(rows.get(1).path("calcjob_pk").isNull());

            AuditLogger.IntegrityReport report = reopened.verify();
            Assertions.assertTrue(report.ok());
            Assertions.assertEquals(2, report.checkedRows());
            Assertions.assertEquals(reopened.currentHash(), report.tailHash());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("calcrelay-test-audit-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger audit = new AuditLogger(file);
            for (int i = 0; i < 3; i++) {
                audit.log(AuditLogger.AuditEvent.of("calcjob.claim", "runner-1", (long) i, null, "granted", Map.of()));
            }
            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.set(1, lines.get(1).replace("\"granted\"", "\"conflict\""));
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.IntegrityReport report = new AuditLogger(file).verify();
            Assertions.assertFalse(report.ok());
            Assertions.assertEquals(2, report.brokenLine());
            Assertions.assertEquals("hash_mismatch", report.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void secretsInDetailsAreMasked() throws Exception {
        Path root = Files.createTempDirectory("calcrelay-test-audit-");
        try {
            AuditLogger audit = new AuditLogger(root.resolve("audit.log"));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("client_secret", "hunter2");
            details.put("access_token", "abc");
            details.put("opaque", "QWxhZGRpbjpvcGVuIHNlc2FtZQ-abcdefgh");
            details.put("script_key", "a".repeat(64));
            details.put("uuid", "5d2f6c1e-8c1b-4b7e-9d1a-0f3b2c4d5e6f");
            details.put("folder", "/scratch/calc/5d2f6c1e-8c1b-4b7e-9d1a-0f3b2c4d5e6f");
            audit.log(AuditLogger.AuditEvent.global("project.import", "cli", "ok", details));

            JsonNode logged = audit.tail(1).get(0).path("details");
            Assertions.assertEquals("***", logged.path("client_secret").asText());
            Assertions.assertEquals("***", logged.path("access_token").asText());
            Assertions.assertEquals("***", logged.path("opaque").asText());
            Assertions.assertEquals("a".repeat(64), logged.path("script_key").asText());
            Assertions.assertEquals("5d2f6c1e-8c1b-4b7e-9d1a-0f3b2c4d5e6f", logged.path("uuid").asText());
            Assertions.assertTrue(logged.path("folder").asText().startsWith("/scratch/calc/"));
        } finally {
            deleteRecursively(root);
        }
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
