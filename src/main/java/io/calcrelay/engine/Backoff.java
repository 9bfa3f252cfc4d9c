package io.calcrelay.engine;

import java.util.concurrent.ThreadLocalRandom;

public final class Backoff {
    private static final long MAX_JITTER_MS = 250L;

    private Backoff() {
    }

    /**
     * Doubling delay for the given 1-based attempt, capped at {@code maxMs},
     * plus up to 250 ms of jitter.
     */
    public static long exponential(int attempt, long baseMs, long maxMs) {
        long backoff = baseMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxMs / 2L) {
                backoff = maxMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxMs);
        long jitter = ThreadLocalRandom.current().nextLong(0L, Math.min(MAX_JITTER_MS, Math.max(1L, baseMs)) + 1L);
        return Math.min(maxMs, backoff + jitter);
    }

    /**
     * Next poll interval: grows by {@code multiplier}, and by at least 1 ms,
     * until it reaches {@code maxMs}.
     */
    public static long nextPollInterval(long currentMs, double multiplier, long maxMs) {
        long next = (long) Math.ceil(currentMs * multiplier);
        return Math.min(maxMs, Math.max(currentMs + 1L, next));
    }
}
