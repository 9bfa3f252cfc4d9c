package io.calcrelay.model;

public record CalcJobSummary(
        long pk,
        String label,
        String uuid,
        String codeLabel,
        String clientLabel,
        String state,
        String step,
        String jobId,
        String exception,
        long updatedAtMs
) {
}
