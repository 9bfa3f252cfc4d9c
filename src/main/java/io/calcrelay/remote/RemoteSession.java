package io.calcrelay.remote;

import io.calcrelay.model.ClientRow;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The connection state shared by every calcjob of one client: a single
 * gateway plus a status batcher.
 *
 * <p>Asking for one job's status refreshes every job currently watched on
 * the client in one request. Answers are reused for {@code statusTtlMs}, so
 * concurrent pollers within that window cause no extra requests.
 */
public final class RemoteSession implements AutoCloseable {
    private final ClientRow client;
    private final RemoteGateway gateway;
    private final long statusTtlMs;
    private final Set<String> watched = ConcurrentHashMap.newKeySet();
    private final Map<String, RemoteStatus> statuses = new HashMap<>();
    private final Object statusLock = new Object();
    private final AtomicLong statusRequests = new AtomicLong();
    private long refreshedAtMs = Long.MIN_VALUE;

    public RemoteSession(ClientRow client, RemoteGateway gateway, long statusTtlMs) {
        this.client = client;
        this.gateway = gateway;
        this.statusTtlMs = Math.max(0L, statusTtlMs);
    }

    public ClientRow client() {
        return client;
    }

    public RemoteGateway gateway() {
        return gateway;
    }

    public void watch(String jobId) {
        watched.add(jobId);
    }

    public RemoteStatus status(String jobId) {
        watched.add(jobId);
        synchronized (statusLock) {
            long now = System.currentTimeMillis();
            boolean stale = refreshedAtMs == Long.MIN_VALUE || now - refreshedAtMs >= statusTtlMs;
            if (stale || !statuses.containsKey(jobId)) {
                List<String> batch = new ArrayList<>(watched);
                statusRequests.incrementAndGet();
                Map<String, RemoteStatus> fresh = gateway.poll(batch);
                statuses.clear();
                statuses.putAll(fresh);
                refreshedAtMs = now;
                for (Map.Entry<String, RemoteStatus> entry : fresh.entrySet()) {
                    if (entry.getValue().isTerminal()) {
                        watched.remove(entry.getKey());
                    }
                }
            }
            // not reported yet, e.g. right after submission
            return statuses.getOrDefault(jobId, RemoteStatus.RUNNING);
        }
    }

    public long statusRequests() {
        return statusRequests.get();
    }

    @Override
    public void close() {
        gateway.close();
    }
}
