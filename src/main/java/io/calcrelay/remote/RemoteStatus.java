package io.calcrelay.remote;

import java.util.Locale;

public enum RemoteStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    /**
     * Maps a batch scheduler state (Slurm accounting names) onto the four
     * statuses the engine distinguishes. Anything not known to be final is running.
     */
    public static RemoteStatus fromSchedulerState(String raw) {
        if (raw == null || raw.isBlank()) {
            return RUNNING;
        }
        String state = raw.trim().toUpperCase(Locale.ROOT);
        int space = state.indexOf(' ');
        if (space > 0) {
            state = state.substring(0, space);
        }
        return switch (state) {
            case "COMPLETED" -> COMPLETED;
            case "CANCELLED" -> CANCELLED;
            case "FAILED", "TIMEOUT", "NODE_FAIL", "OUT_OF_MEMORY", "BOOT_FAIL", "DEADLINE", "PREEMPTED" -> FAILED;
            default -> RUNNING;
        };
    }
}
