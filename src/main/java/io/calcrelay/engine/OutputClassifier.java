package io.calcrelay.engine;

import io.calcrelay.error.ParseException;
import io.calcrelay.remote.RemoteStatus;

import java.util.Map;

/**
 * Decides whether a calcjob whose outputs were retrieved counts as finished.
 */
@FunctionalInterface
public interface OutputClassifier {
    /**
     * @param retrievedPaths relative path to content key, null values for directories
     * @throws ParseException when the outputs do not amount to a successful calculation
     */
    void classify(CalcJobContext ctx, RemoteStatus remoteStatus, Map<String, String> retrievedPaths);
}
