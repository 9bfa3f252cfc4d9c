package io.calcrelay.model;

public record ClientRow(
        long pk,
        String label,
        String clientUrl,
        String clientId,
        String clientSecret,
        String tokenUri,
        String machineName,
        String workDir,
        int smallFileSizeMb,
        long createdAtMs
) {
    public long smallFileThresholdBytes() {
        return smallFileSizeMb * 1024L * 1024L;
    }

    @Override
    public String toString() {
        return "Client(" + pk + ", " + label + ")";
    }
}
