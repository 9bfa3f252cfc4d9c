package io.calcrelay.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.calcrelay.util.Hashing;
import io.calcrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class CalcRelayCommandTest {

    @Test
    void initAddRunAndInspect() throws Exception {
        Path root = Files.createTempDirectory("calcrelay-test-cli-");
        try {
            Path project = root.resolve("project");
            Path importFile = root.resolve("hello.json");
            Files.writeString(importFile, """
                    {
                      "objects": {"greeting": {"content": "hi\\n"}},
                      "clients": [{"label": "localhost", "client_url": "local:", "machine_name": "localhost",
                                   "work_dir": "%s", "client_secret": "topsecret"}],
                      "codes": [{"label": "echo", "client_label": "localhost",
                                 "script": "cat greeting.txt > output.txt",
                                 "upload_paths": {"greeting.txt": {"label": "greeting"}}}],
                      "calcjobs": [{"label": "hello", "code_label": "echo", "download_globs": ["output.txt"]}]
                    }
                    """.formatted(root.resolve("remote").toString()), StandardCharsets.UTF_8);

            Result init = run("--root", project.toString(), "init", "--add", importFile.toString());
            Assertions.assertEquals(0, init.code(), init.out());
            JsonNode added = Jsons.mapper().readTree(init.out()).path("added");
            Assertions.assertEquals(1, added.path("calcjobs").size());

            Files.writeString(project.resolve("calcrelay-settings.json"),
                    "{\"pollInitialMs\": 20, \"pollMaxMs\": 100, \"selectionIntervalMs\": 50}", StandardCharsets.UTF_8);
            Result runResult = run("--root", project.toString(), "run", "-n", "2");
            Assertions.assertEquals(0, runResult.code(), runResult.out());
            Assertions.assertEquals(1, Jsons.mapper().readTree(runResult.out()).path("finished").asInt(), runResult.out());

            JsonNode status = Jsons.mapper().readTree(run("--root", project.toString(), "status").out());
            Assertions.assertEquals(1, status.path("calcjobsByState").path("finished").asInt());

            JsonNode clients = Jsons.mapper().readTree(run("--root", project.toString(), "client", "list").out());
            Assertions.assertEquals("***", clients.get(0).path("clientSecret").asText());
            Assertions.assertFalse(run("--root", project.toString(), "client", "show", "localhost").out().contains("topsecret"));

            JsonNode finished = Jsons.mapper().readTree(
                    run("--root", project.toString(), "calcjob", "list", "--state", "finished").out());
            Assertions.assertEquals(1L, finished.path("total").asLong());
            Assertions.assertEquals("hello", finished.path("calcjobs").get(0).path("label").asText());

            JsonNode shown = Jsons.mapper().readTree(run("--root", project.toString(), "calcjob", "show", "1").out());
            String outputKey = shown.path("processing").path("retrievedPaths").path("output.txt").asText();
            Assertions.assertEquals(Hashing.sha256Hex("hi\n"), outputKey);
            Assertions.assertEquals("hi\n", run("--root", project.toString(), "object", "cat", outputKey).out());

            Assertions.assertEquals(0, run("--root", project.toString(), "audit-verify").code());
            Assertions.assertFalse(run("--root", project.toString(), "audit-tail", "--lines", "5").out().isBlank());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void errorsAreReportedAsJson() throws Exception {
        Path root = Files.createTempDirectory("calcrelay-test-cli-");
        try {
            Path project = root.resolve("project");
            Assertions.assertEquals(0, run("--root", project.toString(), "init").code());

            Result missing = run("--root", project.toString(), "calcjob", "show", "42");
            Assertions.assertEquals(1, missing.code());
            Assertions.assertTrue(Jsons.mapper().readTree(missing.out()).has("error"));

            Result badState = run("--root", project.toString(), "calcjob", "list", "--state", "sleeping");
            Assertions.assertEquals(1, badState.code());

            Path bad = root.resolve("bad.json");
            Files.writeString(bad, "{\"codes\": [{\"label\": \"x\"}]}", StandardCharsets.UTF_8);
            Result rejected = run("--root", project.toString(), "add", bad.toString());
            Assertions.assertEquals(1, rejected.code());
            Assertions.assertTrue(rejected.out().contains("codes[0] has no 'client_label' key"), rejected.out());

            Path client = root.resolve("client.json");
            Files.writeString(client, """
                    {"clients": [{"label": "c", "client_url": "local:", "machine_name": "m", "work_dir": "/w"}]}
                    """, StandardCharsets.UTF_8);
            Assertions.assertEquals(0, run("--root", project.toString(), "add", client.toString()).code());
            Result duplicate = run("--root", project.toString(), "add", client.toString());
            Assertions.assertEquals(1, duplicate.code());
            Assertions.assertEquals("Client label already exists: c",
                    Jsons.mapper().readTree(duplicate.out()).path("error").asText(), duplicate.out());

            Path escaping = root.resolve("escaping.json");
            Files.writeString(escaping, """
                    {"objects": {"o": {"content": "x"}},
                     "codes": [{"label": "k", "client_label": "c", "script": "true"}],
                     "calcjobs": [{"label": "j", "uuid": "../../escape", "code_label": "k",
                                   "upload_paths": {"../../../etc/owned": {"label": "o"}}}]}
                    """, StandardCharsets.UTF_8);
            Result unsafe = run("--root", project.toString(), "add", escaping.toString());
            Assertions.assertEquals(1, unsafe.code(), unsafe.out());
            Assertions.assertTrue(Jsons.mapper().readTree(unsafe.out()).has("error"), unsafe.out());
            Assertions.assertEquals(0L, Jsons.mapper().readTree(run("--root", project.toString(), "status").out())
                    .path("codes").asLong());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Result run(String... args) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int code;
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            code = new CommandLine(new CalcRelayCommand()).execute(args);
        } finally {
            System.setOut(original);
        }
        return new Result(code, buffer.toString(StandardCharsets.UTF_8));
    }

    private record Result(int code, String out) {
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
