package io.calcrelay.engine;

import io.calcrelay.error.ParseException;
import io.calcrelay.remote.RemotePaths;
import io.calcrelay.remote.RemoteStatus;

import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Map;

/**
 * Accepts a calcjob when the remote job completed and every download glob
 * matched at least one retrieved path.
 */
public final class RequiredOutputsClassifier implements OutputClassifier {
    @Override
    public void classify(CalcJobContext ctx, RemoteStatus remoteStatus, Map<String, String> retrievedPaths) {
        if (remoteStatus != RemoteStatus.COMPLETED) {
            throw new ParseException("remote job ended as " + remoteStatus);
        }
        List<String> globs = ctx.calcjob().downloadGlobs();
        if (globs == null) {
            return;
        }
        for (String glob : globs) {
            List<PathMatcher> matcher = RemotePaths.compile(List.of(glob));
            boolean found = false;
            for (String path : retrievedPaths.keySet()) {
                if (RemotePaths.matchesAny(matcher, path)) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                throw new ParseException("no retrieved output matches '" + glob + "'");
            }
        }
    }
}
