package io.calcrelay.remote;

import com.fasterxml.jackson.databind.JsonNode;
import io.calcrelay.model.ClientRow;
import io.calcrelay.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.PathMatcher;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * Gateway speaking the FirecREST HTTP API of one client.
 *
 * <p>All requests carry the machine name header and, when the client has a
 * token endpoint, a bearer token. A 401 or 403 answer invalidates the token
 * and the request is repeated once with a fresh one.
 */
public final class FirecrestGateway implements RemoteGateway {
    private static final String MACHINE_HEADER = "X-Machine-Name";

    private final ClientRow client;
    private final String baseUrl;
    private final HttpClient http;
    private final TokenProvider tokens;
    private final Duration requestTimeout;

    public FirecrestGateway(ClientRow client, long requestTimeoutMs) {
        this.client = client;
        this.baseUrl = client.clientUrl().endsWith("/") ? client.clientUrl() : client.clientUrl() + "/";
        this.requestTimeout = Duration.ofMillis(Math.max(100L, requestTimeoutMs));
        this.http = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.tokens = new TokenProvider(http, client.tokenUri(), client.clientId(), client.clientSecret(), requestTimeout);
    }

    @Override
    public void mkdirs(String dir) {
        String form = "targetPath=" + enc(dir) + "&p=true";
        send("mkdir " + dir, token -> request("utilities/mkdir", token)
                        .header("Content-Type", "application/x-www-form-urlencoded")
                        .POST(HttpRequest.BodyPublishers.ofString(form, StandardCharsets.UTF_8))
                        .build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    @Override
    public void upload(UploadSource source, String path) {
        String boundary = "calcrelay-" + UUID.randomUUID();
        String head = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"targetPath\"\r\n\r\n"
                + RemotePaths.parent(path) + "\r\n"
                + "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"file\"; filename=\"" + RemotePaths.fileName(path) + "\"\r\n"
                + "Content-Type: application/octet-stream\r\n\r\n";
        String tail = "\r\n--" + boundary + "--\r\n";
        boolean small = source.size() <= client.smallFileThresholdBytes();
        byte[] inMemory = small ? readSmall(source, path) : null;
        send("upload " + path, token -> {
            HttpRequest.BodyPublisher content = small
                    ? HttpRequest.BodyPublishers.ofByteArray(inMemory)
                    : HttpRequest.BodyPublishers.ofInputStream(source::openStream);
            return request("utilities/upload", token)
                    .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                    .POST(HttpRequest.BodyPublishers.concat(
                            HttpRequest.BodyPublishers.ofString(head, StandardCharsets.UTF_8),
                            content,
                            HttpRequest.BodyPublishers.ofString(tail, StandardCharsets.UTF_8)))
                    .build();
        }, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    @Override
    public String submit(String scriptPath) {
        String form = "targetPath=" + enc(scriptPath);
        HttpResponse<String> resp = send("submit " + scriptPath, token -> request("compute/jobs/path", token)
                        .header("Content-Type", "application/x-www-form-urlencoded")
                        .POST(HttpRequest.BodyPublishers.ofString(form, StandardCharsets.UTF_8))
                        .build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        JsonNode body = parse(resp.body(), "submit");
        String jobId = body.path("jobid").asText("");
        if (jobId.isBlank()) {
            throw new RemoteCallException(RemoteCallException.Kind.FATAL, "submit response has no jobid: " + resp.body());
        }
        return jobId;
    }

    @Override
    public Map<String, RemoteStatus> poll(Collection<String> jobIds) {
        Map<String, RemoteStatus> out = new LinkedHashMap<>();
        if (jobIds == null || jobIds.isEmpty()) {
            return out;
        }
        String query = "compute/acct?jobs=" + enc(String.join(",", jobIds));
        HttpResponse<String> resp = send("poll " + jobIds, token -> request(query, token).GET().build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        JsonNode body = parse(resp.body(), "poll");
        JsonNode rows = body.isArray() ? body : body.path("output");
        for (JsonNode row : rows) {
            String jobId = row.path("jobid").asText("");
            if (!jobId.isBlank()) {
                out.put(jobId, RemoteStatus.fromSchedulerState(row.path("state").asText("")));
            }
        }
        return out;
    }

    @Override
    public List<RemoteEntry> list(String dir, List<String> globs) {
        List<PathMatcher> matchers = RemotePaths.compile(globs);
        List<RemoteEntry> out = new ArrayList<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push("");
        while (!pending.isEmpty()) {
            String relative = pending.pop();
            String target = RemotePaths.join(dir, relative);
            String query = "utilities/ls?targetPath=" + enc(target) + "&showhidden=true";
            HttpResponse<String> resp = send("ls " + target, token -> request(query, token).GET().build(),
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            for (JsonNode item : parse(resp.body(), "ls").path("output")) {
                String name = item.path("name").asText("");
                if (name.isEmpty() || name.equals(".") || name.equals("..")) {
                    continue;
                }
                String childPath = relative.isEmpty() ? name : relative + "/" + name;
                boolean directory = "d".equals(item.path("type").asText());
                if (directory) {
                    pending.push(childPath);
                }
                if (RemotePaths.matchesAny(matchers, childPath)) {
                    out.add(new RemoteEntry(childPath, directory, directory ? 0L : item.path("size").asLong(0L)));
                }
            }
        }
        out.sort((a, b) -> a.path().compareTo(b.path()));
        return out;
    }

    @Override
    public byte[] download(String path) {
        String query = "utilities/download?sourcePath=" + enc(path);
        return send("download " + path, token -> request(query, token).GET().build(),
                HttpResponse.BodyHandlers.ofByteArray()).body();
    }

    @Override
    public void close() {
        // nothing to release: JDK 17 HttpClient is not closeable
    }

    private HttpRequest.Builder request(String endpoint, String token) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + endpoint))
                .timeout(requestTimeout)
                .header(MACHINE_HEADER, client.machineName());
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder;
    }

    private <T> HttpResponse<T> send(String op, Function<String, HttpRequest> requestFactory,
                                     HttpResponse.BodyHandler<T> handler) {
        HttpResponse<T> resp = sendOnce(op, requestFactory.apply(tokens.currentToken()), handler);
        if (RemoteCallException.kindForStatus(resp.statusCode()) == RemoteCallException.Kind.AUTH && tokens.enabled()) {
            tokens.invalidate();
            resp = sendOnce(op, requestFactory.apply(tokens.currentToken()), handler);
        }
        int status = resp.statusCode();
        if (status / 100 != 2) {
            throw new RemoteCallException(
                    RemoteCallException.kindForStatus(status),
                    status,
                    op + " failed status=" + status,
                    null
            );
        }
        return resp;
    }

    private <T> HttpResponse<T> sendOnce(String op, HttpRequest req, HttpResponse.BodyHandler<T> handler) {
        try {
            return http.send(req, handler);
        } catch (IOException e) {
            throw new RemoteCallException(RemoteCallException.Kind.TRANSIENT, op + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteCallException(RemoteCallException.Kind.TRANSIENT, op + " interrupted", e);
        }
    }

    private static byte[] readSmall(UploadSource source, String path) {
        try {
            return source.readAllBytes();
        } catch (IOException e) {
            throw new RemoteCallException(RemoteCallException.Kind.FATAL, "cannot read upload source for " + path, e);
        }
    }

    private static JsonNode parse(String body, String op) {
        try {
            return Jsons.mapper().readTree(body == null ? "" : body);
        } catch (IOException e) {
            throw new RemoteCallException(RemoteCallException.Kind.FATAL, op + " response is not JSON", e);
        }
    }

    private static String enc(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
