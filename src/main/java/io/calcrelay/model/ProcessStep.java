package io.calcrelay.model;

import java.util.Locale;

/**
 * Stage a calcjob is currently in. Non-terminal steps are executed in
 * declaration order; any of them may instead jump to {@link #EXCEPTED}.
 */
public enum ProcessStep {
    CREATED,
    UPLOADING,
    SUBMITTING,
    SUBMITTED,
    POLLING,
    DOWNLOADING,
    PARSING,
    FINISHED,
    EXCEPTED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == FINISHED || this == EXCEPTED;
    }

    public ProcessStep next() {
        if (isTerminal()) {
            throw new IllegalStateException("Terminal step has no successor: " + dbValue());
        }
        return values()[ordinal() + 1];
    }

    /**
     * Forward by exactly one step, or straight to excepted. Terminal steps never move.
     */
    public boolean canAdvanceTo(ProcessStep target) {
        if (isTerminal() || target == null) {
            return false;
        }
        return target == EXCEPTED || target == next();
    }

    public static ProcessStep fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("step must not be blank");
        }
        for (ProcessStep value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown step: " + raw);
    }
}
