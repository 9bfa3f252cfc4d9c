package io.calcrelay.engine;

import io.calcrelay.model.CalcJobRow;
import io.calcrelay.model.ClientRow;
import io.calcrelay.model.CodeRow;
import io.calcrelay.remote.RemotePaths;

/**
 * The immutable rows a step works on.
 */
public record CalcJobContext(CalcJobRow calcjob, CodeRow code, ClientRow client) {
    public static final String JOB_SCRIPT_NAME = "job.sh";

    public String remoteFolder() {
        return RemotePaths.join(client.workDir(), calcjob.uuid());
    }

    public String remoteScriptPath() {
        return RemotePaths.join(remoteFolder(), JOB_SCRIPT_NAME);
    }
}
