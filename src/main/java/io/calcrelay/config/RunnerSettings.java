package io.calcrelay.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.calcrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Effective runner tuning. Values come from {@link CalcRelayConfig} defaults,
 * optionally overridden by {@code calcrelay-settings.json} in the project root.
 */
public record RunnerSettings(
        int concurrency,
        int maxStepAttempts,
        long baseBackoffMs,
        long maxBackoffMs,
        long pollInitialMs,
        long pollMaxMs,
        double pollMultiplier,
        long leaseTimeoutMs,
        long requestTimeoutMs,
        long statusCacheTtlMs,
        long selectionIntervalMs
) {
    public static RunnerSettings defaults() {
        return new RunnerSettings(
                CalcRelayConfig.DEFAULT_CONCURRENCY,
                CalcRelayConfig.DEFAULT_MAX_STEP_ATTEMPTS,
                CalcRelayConfig.DEFAULT_BASE_BACKOFF_MS,
                CalcRelayConfig.DEFAULT_MAX_BACKOFF_MS,
                CalcRelayConfig.DEFAULT_POLL_INITIAL_MS,
                CalcRelayConfig.DEFAULT_POLL_MAX_MS,
                CalcRelayConfig.DEFAULT_POLL_MULTIPLIER,
                CalcRelayConfig.DEFAULT_LEASE_TIMEOUT_MS,
                CalcRelayConfig.DEFAULT_REQUEST_TIMEOUT_MS,
                CalcRelayConfig.DEFAULT_STATUS_CACHE_TTL_MS,
                CalcRelayConfig.DEFAULT_SELECTION_INTERVAL_MS
        );
    }

    public static RunnerSettings load(CalcRelayConfig config) {
        Path file = config.settingsFile();
        if (!Files.isRegularFile(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings file: " + file, e);
        }
    }

    static RunnerSettings fromFile(SettingsFile file, RunnerSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int concurrency = sanitizeInt(file.concurrency(), defaults.concurrency(), 1);
        int maxStepAttempts = sanitizeInt(file.maxStepAttempts(), defaults.maxStepAttempts(), 1);
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 1L);
        long maxBackoff = Math.max(baseBackoff, sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), 1L));
        long pollInitial = sanitizeLong(file.pollInitialMs(), defaults.pollInitialMs(), 1L);
        long pollMax = Math.max(pollInitial, sanitizeLong(file.pollMaxMs(), defaults.pollMaxMs(), 1L));
        double multiplier = sanitizeMultiplier(file.pollMultiplier(), defaults.pollMultiplier());
        long leaseTimeout = sanitizeLong(file.leaseTimeoutMs(), defaults.leaseTimeoutMs(), 1_000L);
        long requestTimeout = sanitizeLong(file.requestTimeoutMs(), defaults.requestTimeoutMs(), 100L);
        long statusTtl = sanitizeLong(file.statusCacheTtlMs(), defaults.statusCacheTtlMs(), 0L);
        long selectionInterval = sanitizeLong(file.selectionIntervalMs(), defaults.selectionIntervalMs(), 10L);
        return new RunnerSettings(
                concurrency,
                maxStepAttempts,
                baseBackoff,
                maxBackoff,
                pollInitial,
                pollMax,
                multiplier,
                leaseTimeout,
                requestTimeout,
                statusTtl,
                selectionInterval
        );
    }

    public RunnerSettings withConcurrency(int value) {
        return new RunnerSettings(Math.max(1, value), maxStepAttempts, baseBackoffMs, maxBackoffMs,
                pollInitialMs, pollMaxMs, pollMultiplier, leaseTimeoutMs, requestTimeoutMs,
                statusCacheTtlMs, selectionIntervalMs);
    }

    public RunnerSettings withMaxStepAttempts(int value) {
        return new RunnerSettings(concurrency, Math.max(1, value), baseBackoffMs, maxBackoffMs,
                pollInitialMs, pollMaxMs, pollMultiplier, leaseTimeoutMs, requestTimeoutMs,
                statusCacheTtlMs, selectionIntervalMs);
    }

    public RunnerSettings withPolling(long initialMs, long maxMs, double multiplier) {
        long initial = Math.max(1L, initialMs);
        return new RunnerSettings(concurrency, maxStepAttempts, baseBackoffMs, maxBackoffMs,
                initial, Math.max(initial, maxMs), sanitizeMultiplier(multiplier, pollMultiplier), leaseTimeoutMs,
                requestTimeoutMs, statusCacheTtlMs, selectionIntervalMs);
    }

    /**
     * Polling must back off, so a multiplier of 1.0 or less is replaced by the fallback.
     */
    private static double sanitizeMultiplier(Double raw, double fallback) {
        if (raw == null || raw.isNaN() || raw <= 1.0d) {
            return fallback;
        }
        return raw;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Integer concurrency,
            Integer maxStepAttempts,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Long pollInitialMs,
            Long pollMaxMs,
            Double pollMultiplier,
            Long leaseTimeoutMs,
            Long requestTimeoutMs,
            Long statusCacheTtlMs,
            Long selectionIntervalMs
    ) {
    }
}
