package io.calcrelay.model;

import java.util.Map;

/**
 * Snapshot of the mutable execution record of one calcjob.
 * {@code retrievedPaths} maps a relative path to a content key, or to null for a directory.
 */
public record ProcessingView(
        long calcjobPk,
        ProcessState state,
        ProcessStep step,
        String jobId,
        String remoteState,
        String scriptKey,
        String exception,
        ProcessStep failedStep,
        Map<String, String> retrievedPaths,
        String leaseOwner,
        long leaseEpoch,
        long createdAtMs,
        long updatedAtMs
) {
    public boolean terminal() {
        return step.isTerminal();
    }
}
