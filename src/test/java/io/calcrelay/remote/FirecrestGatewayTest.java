package io.calcrelay.remote;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.calcrelay.model.ClientRow;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

final class FirecrestGatewayTest {

    @Test
    void expiredTokenIsRefreshedAndTheJobSubmittedOnce() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        AtomicInteger tokenRequests = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        AtomicInteger accepted = new AtomicInteger();
        List<String> forms = new CopyOnWriteArrayList<>();
        server.createContext("/token", exchange -> {
            String form = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            forms.add(form);
            respond(exchange, 200, "{\"access_token\":\"tok-" + tokenRequests.incrementAndGet() + "\",\"expires_in\":3600}");
        });
        server.createContext("/compute/jobs/path", exchange -> {
            // the first token is treated as already expired
            if (!"Bearer tok-2".equals(exchange.getRequestHeaders().getFirst("Authorization"))) {
                rejected.incrementAndGet();
                respond(exchange, 401, "{\"message\":\"token expired\"}");
                return;
            }
            if (!"daint".equals(exchange.getRequestHeaders().getFirst("X-Machine-Name"))) {
                respond(exchange, 400, "{}");
                return;
            }
            accepted.incrementAndGet();
            respond(exchange, 201, "{\"jobid\":\"4242\"}");
        });
        server.start();
        try (FirecrestGateway gateway = new FirecrestGateway(client(server, 5), 5_000L)) {
            Assertions.assertEquals("4242", gateway.submit("/scratch/run-1/job.sh"));
            Assertions.assertEquals(1, rejected.get());
            Assertions.assertEquals(1, accepted.get());
            Assertions.assertEquals(2, tokenRequests.get());
            Assertions.assertTrue(forms.get(0).contains("grant_type=client_credentials"));
            Assertions.assertTrue(forms.get(0).contains("client_id=calc-client"));
        } finally {
            server.stop(0);
        }
    }

    @Test
    void forbiddenAnswerRefreshesTheTokenOnce() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        AtomicInteger tokenRequests = new AtomicInteger();
        AtomicInteger forbidden = new AtomicInteger();
        server.createContext("/token", exchange ->
                respond(exchange, 200, "{\"access_token\":\"tok-" + tokenRequests.incrementAndGet() + "\"}"));
        server.createContext("/utilities/mkdir", exchange -> {
            if ("Bearer tok-1".equals(exchange.getRequestHeaders().getFirst("Authorization"))) {
                forbidden.incrementAndGet();
                respond(exchange, 403, "{\"message\":\"token expired\"}");
                return;
            }
            respond(exchange, 201, "{}");
        });
        server.start();
        try (FirecrestGateway gateway = new FirecrestGateway(client(server, 5), 5_000L)) {
            gateway.mkdirs("/scratch/run-2");
            Assertions.assertEquals(1, forbidden.get());
            Assertions.assertEquals(2, tokenRequests.get());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void pollsInOneRequestAndListsRecursively() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        List<String> acctQueries = new CopyOnWriteArrayList<>();
        server.createContext("/token", exchange -> respond(exchange, 200, "{\"access_token\":\"tok\"}"));
        server.createContext("/compute/acct", exchange -> {
            acctQueries.add(exchange.getRequestURI().getQuery());
            respond(exchange, 200, "{\"output\":["
                    + "{\"jobid\":\"1\",\"state\":\"COMPLETED\"},"
                    + "{\"jobid\":\"2\",\"state\":\"RUNNING\"},"
                    + "{\"jobid\":\"3\",\"state\":\"TIMEOUT\"}]}");
        });
        server.createContext("/utilities/ls", exchange -> {
            String query = exchange.getRequestURI().getQuery();
            if (query.contains("targetPath=/scratch/run-1/out&")) {
                respond(exchange, 200, "{\"output\":[{\"name\":\"b.dat\",\"type\":\"-\",\"size\":\"7\"}]}");
            } else {
                respond(exchange, 200, "{\"output\":["
                        + "{\"name\":\"job.sh\",\"type\":\"-\",\"size\":\"20\"},"
                        + "{\"name\":\"out\",\"type\":\"d\",\"size\":\"4096\"},"
                        + "{\"name\":\"a.dat\",\"type\":\"-\",\"size\":\"3\"}]}");
            }
        });
        server.createContext("/utilities/download", exchange -> {
            if (exchange.getRequestURI().getQuery().equals("sourcePath=/scratch/run-1/a.dat")) {
                respond(exchange, 200, "abc");
            } else {
                respond(exchange, 404, "{}");
            }
        });
        server.start();
        try (FirecrestGateway gateway = new FirecrestGateway(client(server, 5), 5_000L)) {
            Map<String, RemoteStatus> statuses = gateway.poll(List.of("1", "2", "3"));
            Assertions.assertEquals(Map.of("1", RemoteStatus.COMPLETED, "2", RemoteStatus.RUNNING, "3", RemoteStatus.FAILED),
                    statuses);
            Assertions.assertEquals(List.of("jobs=1,2,3"), acctQueries);

            List<RemoteEntry> all = gateway.list("/scratch/run-1", List.of());
            Assertions.assertEquals(List.of("a.dat", "job.sh", "out", "out/b.dat"),
                    all.stream().map(RemoteEntry::path).toList());
            Assertions.assertTrue(all.get(2).directory());
            Assertions.assertEquals(List.of("a.dat", "out/b.dat"),
                    gateway.list("/scratch/run-1", List.of("*.dat", "out/*.dat")).stream().map(RemoteEntry::path).toList());

            Assertions.assertArrayEquals("abc".getBytes(StandardCharsets.UTF_8), gateway.download("/scratch/run-1/a.dat"));
            RemoteCallException missing = Assertions.assertThrows(RemoteCallException.class,
                    () -> gateway.download("/scratch/run-1/nope"));
            Assertions.assertEquals(RemoteCallException.Kind.NOT_FOUND, missing.kind());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void uploadsAsMultipartIntoTheParentFolder() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        List<String> bodies = new CopyOnWriteArrayList<>();
        server.createContext("/token", exchange -> respond(exchange, 200, "{\"access_token\":\"tok\"}"));
        server.createContext("/utilities/upload", exchange -> {
            bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 201, "{}");
        });
        server.start();
        try (FirecrestGateway inMemory = new FirecrestGateway(client(server, 5), 5_000L);
             FirecrestGateway streamed = new FirecrestGateway(client(server, 0), 5_000L)) {
            inMemory.upload(UploadSource.ofBytes("small".getBytes(StandardCharsets.UTF_8)), "/scratch/run-1/in.txt");
            streamed.upload(UploadSource.ofBytes("large".getBytes(StandardCharsets.UTF_8)), "/scratch/run-1/big.bin");

            Assertions.assertEquals(2, bodies.size());
            Assertions.assertTrue(bodies.get(0).contains("name=\"targetPath\"\r\n\r\n/scratch/run-1\r\n"));
            Assertions.assertTrue(bodies.get(0).contains("filename=\"in.txt\""));
            Assertions.assertTrue(bodies.get(0).contains("\r\n\r\nsmall\r\n"));
            Assertions.assertTrue(bodies.get(1).contains("filename=\"big.bin\""));
            Assertions.assertTrue(bodies.get(1).contains("\r\n\r\nlarge\r\n"));
        } finally {
            server.stop(0);
        }
    }

    @Test
    void statusCodesMapToFailureKinds() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/token", exchange -> respond(exchange, 200, "{\"access_token\":\"tok\"}"));
        server.createContext("/utilities/mkdir", exchange -> respond(exchange, 503, "{}"));
        server.createContext("/compute/jobs/path", exchange -> respond(exchange, 403, "{}"));
        server.createContext("/compute/acct", exchange -> respond(exchange, 200, "not json"));
        server.createContext("/utilities/download", exchange -> respond(exchange, 400, "{}"));
        server.start();
        try (FirecrestGateway gateway = new FirecrestGateway(client(server, 5), 5_000L)) {
            Assertions.assertEquals(RemoteCallException.Kind.TRANSIENT,
                    Assertions.assertThrows(RemoteCallException.class, () -> gateway.mkdirs("/scratch/x")).kind());
            Assertions.assertEquals(RemoteCallException.Kind.AUTH,
                    Assertions.assertThrows(RemoteCallException.class, () -> gateway.submit("/scratch/x/job.sh")).kind());
            Assertions.assertEquals(RemoteCallException.Kind.FATAL,
                    Assertions.assertThrows(RemoteCallException.class, () -> gateway.download("/scratch/x/out")).kind());
            Assertions.assertEquals(RemoteCallException.Kind.FATAL,
                    Assertions.assertThrows(RemoteCallException.class, () -> gateway.poll(List.of("1"))).kind());
        } finally {
            server.stop(0);
        }
    }

    private static ClientRow client(HttpServer server, int smallFileSizeMb) {
        String base = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        return new ClientRow(1L, "cluster", base, "calc-client", "s3cret", base + "token", "daint", "/scratch",
                smallFileSizeMb, 0L);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        exchange.getRequestBody().readAllBytes();
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
