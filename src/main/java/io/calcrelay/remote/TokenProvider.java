package io.calcrelay.remote;

import com.fasterxml.jackson.databind.JsonNode;
import io.calcrelay.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * OAuth2 client-credentials token source. A token is reused until shortly
 * before it expires or until {@link #invalidate()} is called.
 */
public final class TokenProvider {
    private static final long EXPIRY_MARGIN_MS = 10_000L;
    private static final long DEFAULT_LIFETIME_MS = 300_000L;

    private final HttpClient http;
    private final String tokenUri;
    private final String clientId;
    private final String clientSecret;
    private final Duration requestTimeout;

    private String token;
    private long expiresAtMs;

    public TokenProvider(HttpClient http, String tokenUri, String clientId, String clientSecret, Duration requestTimeout) {
        this.http = http;
        this.tokenUri = tokenUri;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.requestTimeout = requestTimeout;
    }

    public boolean enabled() {
        return tokenUri != null && !tokenUri.isBlank();
    }

    /**
     * @return the bearer token, or null when the client has no token endpoint
     */
    public synchronized String currentToken() {
        if (!enabled()) {
            return null;
        }
        long now = System.currentTimeMillis();
        if (token == null || now >= expiresAtMs - EXPIRY_MARGIN_MS) {
            fetch(now);
        }
        return token;
    }

    public synchronized void invalidate() {
        token = null;
        expiresAtMs = 0L;
    }

    private void fetch(long nowMs) {
        String form = "grant_type=client_credentials"
                + "&client_id=" + URLEncoder.encode(nullToEmpty(clientId), StandardCharsets.UTF_8)
                + "&client_secret=" + URLEncoder.encode(nullToEmpty(clientSecret), StandardCharsets.UTF_8);
        HttpRequest req = HttpRequest.newBuilder(URI.create(tokenUri))
                .timeout(requestTimeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form, StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RemoteCallException(RemoteCallException.Kind.TRANSIENT, "token request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteCallException(RemoteCallException.Kind.TRANSIENT, "token request interrupted", e);
        }
        int status = resp.statusCode();
        if (status / 100 != 2) {
            RemoteCallException.Kind kind = status == 400 || status == 401 || status == 403
                    ? RemoteCallException.Kind.AUTH
                    : RemoteCallException.kindForStatus(status);
            throw new RemoteCallException(kind, status, "token request rejected status=" + status, null);
        }
        JsonNode body;
        try {
            body = Jsons.mapper().readTree(resp.body());
        } catch (IOException e) {
            throw new RemoteCallException(RemoteCallException.Kind.FATAL, "token response is not JSON", e);
        }
        String accessToken = body.path("access_token").asText("");
        if (accessToken.isBlank()) {
            throw new RemoteCallException(RemoteCallException.Kind.FATAL, "token response has no access_token");
        }
        long lifetimeMs = body.hasNonNull("expires_in")
                ? body.get("expires_in").asLong() * 1000L
                : DEFAULT_LIFETIME_MS;
        token = accessToken;
        expiresAtMs = nowMs + lifetimeMs;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
