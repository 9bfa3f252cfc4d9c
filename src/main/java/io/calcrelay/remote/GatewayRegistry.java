package io.calcrelay.remote;

import io.calcrelay.model.ClientRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily opened {@link RemoteSession}s keyed by client primary key.
 */
public final class GatewayRegistry implements AutoCloseable {
    private final RemoteGatewayFactory factory;
    private final long statusTtlMs;
    private final Map<Long, RemoteSession> sessions = new ConcurrentHashMap<>();

    public GatewayRegistry(RemoteGatewayFactory factory, long statusTtlMs) {
        this.factory = factory;
        this.statusTtlMs = statusTtlMs;
    }

    public RemoteSession session(ClientRow client) {
        return sessions.computeIfAbsent(client.pk(),
                pk -> new RemoteSession(client, factory.create(client), statusTtlMs));
    }

    @Override
    public void close() {
        List<RuntimeException> failures = new ArrayList<>();
        for (RemoteSession session : sessions.values()) {
            try {
                session.close();
            } catch (RuntimeException e) {
                failures.add(e);
            }
        }
        sessions.clear();
        if (!failures.isEmpty()) {
            RuntimeException first = failures.get(0);
            for (int i = 1; i < failures.size(); i++) {
                first.addSuppressed(failures.get(i));
            }
            throw first;
        }
    }
}
