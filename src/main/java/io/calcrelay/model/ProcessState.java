package io.calcrelay.model;

import java.util.Locale;

public enum ProcessState {
    PLAYING,
    FINISHED,
    EXCEPTED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * The coarse lifecycle flag is never stored independently of the step.
     */
    public static ProcessState of(ProcessStep step) {
        if (step == ProcessStep.FINISHED) {
            return FINISHED;
        }
        if (step == ProcessStep.EXCEPTED) {
            return EXCEPTED;
        }
        return PLAYING;
    }

    public static ProcessState fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("state must not be blank");
        }
        for (ProcessState value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown state: " + raw);
    }
}
