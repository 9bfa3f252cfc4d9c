package io.calcrelay.runtime;

import io.calcrelay.config.CalcRelayConfig;
import io.calcrelay.config.RunnerSettings;
import io.calcrelay.error.NotFoundException;
import io.calcrelay.model.ProcessStep;
import io.calcrelay.model.ProcessingView;
import io.calcrelay.runner.RunOutcome;
import io.calcrelay.storage.Database;
import io.calcrelay.util.Hashing;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class CalcRelayRuntimeTest {

    @Test
    void helloWorldRunsThroughTheLocalGateway() throws Exception {
        Path root = Files.createTempDirectory("calcrelay-test-hello-");
        try {
            Path remote = root.resolve("remote");
            Path importFile = root.resolve("hello.json");
            Files.writeString(importFile, """
                    {
                      "clients": [{"label": "localhost", "client_url": "local:", "machine_name": "localhost",
                                   "work_dir": "%s"}],
                      "codes": [{"label": "echo", "client_label": "localhost",
                                 "script": "echo '{{parameters.echo_string}}' > output.txt"}],
                      "calcjobs": [{"label": "hello", "code_label": "echo",
                                    "parameters": {"echo_string": "Hello world!"},
                                    "download_globs": ["output.txt"]}]
                    }
                    """.formatted(remote.toString()), StandardCharsets.UTF_8);
            CalcRelayRuntime runtime = new CalcRelayRuntime(CalcRelayConfig.fromRoot(root.resolve("project").toString()));
            runtime.init();
            long pk = runtime.addFromFile(importFile).calcjobs().get(0);

            RunnerSettings settings = new RunnerSettings(2, 3, 10L, 100L, 20L, 200L, 2.0d,
                    60_000L, 5_000L, 0L, 50L);
            RunOutcome outcome = runtime.runUntilIdle(settings, 0);

            Assertions.assertEquals(1, outcome.finished(), outcome.toString());
            ProcessingView view = runtime.metadataStore().requireProcessing(pk);
            Assertions.assertEquals(ProcessStep.FINISHED, view.step(), String.valueOf(view.exception()));
            Assertions.assertEquals("COMPLETED", view.remoteState());
            String expected = Hashing.sha256Hex("Hello world!\n");
            Assertions.assertEquals(expected, view.retrievedPaths().get("output.txt"));
            Assertions.assertArrayEquals("Hello world!\n".getBytes(StandardCharsets.UTF_8), runtime.readObject(expected));

            String uuid = runtime.metadataStore().requireCalcJob(pk).uuid();
            Assertions.assertTrue(Files.isRegularFile(remote.resolve(uuid).resolve("job.sh")));
            Assertions.assertEquals(ProcessStep.FINISHED, runtime.showCalcJob(uuid).processing().step());

            CalcRelayRuntime.StatusSnapshot status = runtime.status();
            Assertions.assertEquals(1L, status.calcjobs());
            Assertions.assertEquals(1L, status.calcjobsByState().get("finished"));
            Assertions.assertEquals(2, status.objects());
            Assertions.assertTrue(runtime.verifyAudit().ok());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lookupsAcceptLabelsOrKeysAndMaskSecrets() throws Exception {
        Path root = Files.createTempDirectory("calcrelay-test-lookup-");
        try {
            Path importFile = root.resolve("rows.json");
            Files.writeString(importFile, """
                    {
                      "clients": [{"label": "daint", "client_url": "https://firecrest.example/", "client_id": "id",
                                   "client_secret": "very-secret", "token_uri": "https://auth.example/token",
                                   "machine_name": "daint", "work_dir": "/scratch"}],
                      "codes": [{"label": "echo", "client_label": "daint", "script": "true"}]
                    }
                    """, StandardCharsets.UTF_8);
            CalcRelayRuntime runtime = new CalcRelayRuntime(CalcRelayConfig.fromRoot(root.resolve("project").toString()));
            runtime.init();
            runtime.addFromFile(importFile);

            CalcRelayRuntime.ClientSummary byLabel = runtime.showClient("daint");
            Assertions.assertEquals("***", byLabel.clientSecret());
            Assertions.assertEquals(byLabel, runtime.showClient(Long.toString(byLabel.pk())));
            Assertions.assertEquals("echo", runtime.showCode("echo").label());
            Assertions.assertThrows(NotFoundException.class, () -> runtime.showCode("missing"));
            Assertions.assertThrows(NotFoundException.class, () -> runtime.showCalcJob("99"));
            runtime.init();
            List<Database.SchemaMigrationRow> migrations = runtime.listSchemaMigrations(10);
            Assertions.assertEquals(List.of("002", "001"),
                    migrations.stream().map(Database.SchemaMigrationRow::version).toList());
            Assertions.assertTrue(migrations.stream().allMatch(Database.SchemaMigrationRow::success));
            Assertions.assertEquals("project.import", runtime.auditTail(1).get(0).path("action").asText());
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
