package io.calcrelay.storage;

import io.calcrelay.model.ProcessState;
import io.calcrelay.model.ProcessStep;
import io.calcrelay.model.ProcessingView;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Full replacement tuple for the mutable columns of a processing row.
 * The state column is always derived from {@link #step()}.
 */
public record ProcessingUpdate(
        ProcessStep step,
        String jobId,
        String remoteState,
        String scriptKey,
        String exception,
        ProcessStep failedStep,
        Map<String, String> retrievedPaths
) {
    public static ProcessingUpdate from(ProcessingView view) {
        return new ProcessingUpdate(
                view.step(),
                view.jobId(),
                view.remoteState(),
                view.scriptKey(),
                view.exception(),
                view.failedStep(),
                view.retrievedPaths()
        );
    }

    public ProcessState state() {
        return ProcessState.of(step);
    }

    public ProcessingUpdate advanceTo(ProcessStep target) {
        return new ProcessingUpdate(target, jobId, remoteState, scriptKey, exception, failedStep, retrievedPaths);
    }

    public ProcessingUpdate withJobId(String value) {
        return new ProcessingUpdate(step, value, remoteState, scriptKey, exception, failedStep, retrievedPaths);
    }

    public ProcessingUpdate withRemoteState(String value) {
        return new ProcessingUpdate(step, jobId, value, scriptKey, exception, failedStep, retrievedPaths);
    }

    public ProcessingUpdate withScriptKey(String value) {
        return new ProcessingUpdate(step, jobId, remoteState, value, exception, failedStep, retrievedPaths);
    }

    public ProcessingUpdate withRetrievedPaths(Map<String, String> value) {
        Map<String, String> copy = value == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(value));
        return new ProcessingUpdate(step, jobId, remoteState, scriptKey, exception, failedStep, copy);
    }

    public ProcessingUpdate excepted(ProcessStep at, String message) {
        return new ProcessingUpdate(ProcessStep.EXCEPTED, jobId, remoteState, scriptKey, message, at, retrievedPaths);
    }
}
