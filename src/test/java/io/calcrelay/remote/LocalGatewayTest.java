package io.calcrelay.remote;

import io.calcrelay.model.ClientRow;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class LocalGatewayTest {
    @Test
    void exitStatusIsReadableByAGatewayCreatedAfterSubmission() throws Exception {
        Path root = Files.createTempDirectory("calcrelay-test-local-");
        try {
            ClientRow client = client(root);
            String ok = writeScript(root, "ok", "echo done > out.txt\n");
            String broken = writeScript(root, "broken", "exit 3\n");

            LocalGateway submitter = new LocalGateway(client);
            String okJob = submitter.submit(ok);
            String brokenJob = submitter.submit(broken);
            submitter.close();

            LocalGateway poller = new LocalGateway(client);
            Map<String, RemoteStatus> statuses = pollUntilDone(poller, List.of(okJob, brokenJob));
            Assertions.assertEquals(RemoteStatus.COMPLETED, statuses.get(okJob));
            Assertions.assertEquals(RemoteStatus.FAILED, statuses.get(brokenJob));
            Assertions.assertEquals("done\n",
                    Files.readString(root.resolve("work").resolve("ok").resolve("out.txt"), StandardCharsets.UTF_8));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runningJobsReportRunningAndMissingScriptsAreNotFound() throws Exception {
        Path root = Files.createTempDirectory("calcrelay-test-local-");
        try {
            ClientRow client = client(root);
            Path release = root.resolve("release");
            String waiting = writeScript(root, "waiting",
                    "while [ ! -f '" + release + "' ]; do sleep 0.05; done\n");
            LocalGateway gateway = new LocalGateway(client);
            String job = gateway.submit(waiting);

            Assertions.assertEquals(RemoteStatus.RUNNING, gateway.poll(List.of(job)).get(job));
            Files.writeString(release, "go", StandardCharsets.UTF_8);
            Assertions.assertEquals(RemoteStatus.COMPLETED, pollUntilDone(gateway, List.of(job)).get(job));

            RemoteCallException missing = Assertions.assertThrows(RemoteCallException.class,
                    () -> gateway.submit(root.resolve("work").resolve("nowhere").resolve("job.sh").toString()));
            Assertions.assertEquals(RemoteCallException.Kind.NOT_FOUND, missing.kind());
        } finally {
            deleteRecursively(root);
        }
    }

    private static ClientRow client(Path root) {
        return new ClientRow(1L, "here", LocalGateway.SCHEME, "", "", "", "localhost",
                root.resolve("work").toString(), 5, 0L);
    }

    private static String writeScript(Path root, String uuid, String body) throws IOException {
        Path folder = Files.createDirectories(root.resolve("work").resolve(uuid));
        Path script = folder.resolve("job.sh");
        Files.writeString(script, body, StandardCharsets.UTF_8);
        return script.toString();
    }

    private static Map<String, RemoteStatus> pollUntilDone(LocalGateway gateway, List<String> jobs)
            throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000L;
        while (true) {
            Map<String, RemoteStatus> statuses = gateway.poll(jobs);
            if (!statuses.containsValue(RemoteStatus.RUNNING) || System.currentTimeMillis() > deadline) {
                return statuses;
            }
            Thread.sleep(20L);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
