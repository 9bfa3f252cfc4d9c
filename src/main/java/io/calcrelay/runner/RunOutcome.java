package io.calcrelay.runner;

public record RunOutcome(
        String owner,
        int driven,
        int finished,
        int excepted,
        int suspended,
        int claimConflicts,
        int peakConcurrency,
        boolean stopped,
        long durationMs
) {
}
