package io.calcrelay.engine;

import io.calcrelay.config.RunnerSettings;
import io.calcrelay.error.CalcJobException;
import io.calcrelay.error.NotFoundException;
import io.calcrelay.error.ParseException;
import io.calcrelay.error.PollException;
import io.calcrelay.error.StepSuspendedException;
import io.calcrelay.error.SubmissionException;
import io.calcrelay.error.TransferException;
import io.calcrelay.model.ProcessStep;
import io.calcrelay.remote.GatewayRegistry;
import io.calcrelay.remote.RemoteCallException;
import io.calcrelay.remote.RemoteEntry;
import io.calcrelay.remote.RemoteGateway;
import io.calcrelay.remote.RemotePaths;
import io.calcrelay.remote.RemoteSession;
import io.calcrelay.remote.RemoteStatus;
import io.calcrelay.remote.UploadSource;
import io.calcrelay.storage.ContentStore;
import io.calcrelay.storage.ProcessingUpdate;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The work done at each non-terminal step. Every method is safe to repeat:
 * a step that fails or is interrupted before its update is committed can be
 * executed again from the same processing row.
 */
public final class StepExecutor {
    private final ContentStore contentStore;
    private final GatewayRegistry gateways;
    private final RunnerSettings settings;
    private final ScriptRenderer renderer;
    private final OutputClassifier classifier;
    private final StopSignal stop;

    public StepExecutor(
            ContentStore contentStore,
            GatewayRegistry gateways,
            RunnerSettings settings,
            ScriptRenderer renderer,
            OutputClassifier classifier,
            StopSignal stop
    ) {
        this.contentStore = contentStore;
        this.gateways = gateways;
        this.settings = settings;
        this.renderer = renderer;
        this.classifier = classifier;
        this.stop = stop;
    }

    public ProcessingUpdate execute(ProcessStep step, CalcJobContext ctx, ProcessingUpdate current) {
        return switch (step) {
            case CREATED -> prepare(ctx, current);
            case UPLOADING -> upload(ctx, current);
            case SUBMITTING -> submit(ctx, current);
            case SUBMITTED -> accept(ctx, current);
            case POLLING -> poll(ctx, current);
            case DOWNLOADING -> download(ctx, current);
            case PARSING -> parse(ctx, current);
            case FINISHED, EXCEPTED -> throw new IllegalStateException("No work for terminal step " + step.dbValue());
        };
    }

    ProcessingUpdate prepare(CalcJobContext ctx, ProcessingUpdate current) {
        String script = renderer.render(ctx);
        String key = contentStore.put(script.getBytes(StandardCharsets.UTF_8), "sh");
        return current.withScriptKey(key).advanceTo(ProcessStep.UPLOADING);
    }

    ProcessingUpdate upload(CalcJobContext ctx, ProcessingUpdate current) {
        RemoteGateway gateway = session(ctx).gateway();
        String folder = ctx.remoteFolder();
        String target = folder;
        try {
            gateway.mkdirs(folder);
            target = ctx.remoteScriptPath();
            gateway.upload(UploadSource.ofObject(contentStore, requireScriptKey(current)), target);

            Map<String, String> paths = new LinkedHashMap<>();
            if (ctx.code().uploadPaths() != null) {
                paths.putAll(ctx.code().uploadPaths());
            }
            if (ctx.calcjob().uploadPaths() != null) {
                paths.putAll(ctx.calcjob().uploadPaths());
            }
            for (Map.Entry<String, String> entry : paths.entrySet()) {
                target = RemotePaths.join(folder, entry.getKey());
                if (entry.getValue() == null) {
                    gateway.mkdirs(target);
                    continue;
                }
                String parent = RemotePaths.parent(target);
                if (!parent.equals(folder)) {
                    gateway.mkdirs(parent);
                }
                gateway.upload(UploadSource.ofObject(contentStore, entry.getValue()), target);
            }
        } catch (RemoteCallException e) {
            throw new TransferException("upload to " + target + " failed: " + e.getMessage(), e.transientFailure(), e);
        } catch (NotFoundException e) {
            throw new TransferException("input for " + target + " is missing locally: " + e.getMessage(), false, e);
        } catch (IllegalArgumentException e) {
            throw new TransferException("invalid upload path: " + e.getMessage(), false, e);
        }
        return current.advanceTo(ProcessStep.SUBMITTING);
    }

    ProcessingUpdate submit(CalcJobContext ctx, ProcessingUpdate current) {
        String jobId;
        try {
            jobId = session(ctx).gateway().submit(ctx.remoteScriptPath());
        } catch (RemoteCallException e) {
            throw new SubmissionException("submit failed: " + e.getMessage(), e.transientFailure(), e);
        }
        return current.withJobId(jobId).advanceTo(ProcessStep.SUBMITTED);
    }

    ProcessingUpdate accept(CalcJobContext ctx, ProcessingUpdate current) {
        if (current.jobId() == null || current.jobId().isBlank()) {
            throw new SubmissionException("no job id recorded for submitted calcjob", false);
        }
        session(ctx).watch(current.jobId());
        return current.advanceTo(ProcessStep.POLLING);
    }

    ProcessingUpdate poll(CalcJobContext ctx, ProcessingUpdate current) {
        String jobId = current.jobId();
        if (jobId == null || jobId.isBlank()) {
            throw new PollException("no job id to poll", false);
        }
        RemoteSession session = session(ctx);
        long interval = settings.pollInitialMs();
        while (true) {
            if (stop.isRequested()) {
                throw new StepSuspendedException("stop requested while polling job " + jobId);
            }
            RemoteStatus status;
            try {
                status = session.status(jobId);
            } catch (RemoteCallException e) {
                throw new PollException("status of job " + jobId + " unavailable: " + e.getMessage(),
                        e.transientFailure(), e);
            }
            if (status.isTerminal()) {
                return current.withRemoteState(status.name()).advanceTo(ProcessStep.DOWNLOADING);
            }
            if (stop.await(interval)) {
                throw new StepSuspendedException("stop requested while polling job " + jobId);
            }
            interval = Backoff.nextPollInterval(interval, settings.pollMultiplier(), settings.pollMaxMs());
        }
    }

    ProcessingUpdate download(CalcJobContext ctx, ProcessingUpdate current) {
        List<String> globs = ctx.calcjob().downloadGlobs();
        Map<String, String> retrieved = new LinkedHashMap<>();
        if (globs == null || globs.isEmpty()) {
            return current.withRetrievedPaths(retrieved).advanceTo(ProcessStep.PARSING);
        }
        RemoteGateway gateway = session(ctx).gateway();
        String folder = ctx.remoteFolder();
        String target = folder;
        try {
            for (RemoteEntry entry : gateway.list(folder, globs)) {
                if (entry.directory()) {
                    retrieved.put(entry.path(), null);
                    continue;
                }
                target = RemotePaths.join(folder, entry.path());
                byte[] content = gateway.download(target);
                retrieved.put(entry.path(), contentStore.put(content, extensionOf(entry.path())));
            }
        } catch (RemoteCallException e) {
            throw new TransferException("download of " + target + " failed: " + e.getMessage(), e.transientFailure(), e);
        }
        return current.withRetrievedPaths(retrieved).advanceTo(ProcessStep.PARSING);
    }

    ProcessingUpdate parse(CalcJobContext ctx, ProcessingUpdate current) {
        if (current.remoteState() == null) {
            throw new ParseException("no remote state recorded");
        }
        RemoteStatus status;
        try {
            status = RemoteStatus.valueOf(current.remoteState());
        } catch (IllegalArgumentException e) {
            throw new ParseException("unknown remote state: " + current.remoteState());
        }
        Map<String, String> retrieved = current.retrievedPaths() == null ? Map.of() : current.retrievedPaths();
        classifier.classify(ctx, status, retrieved);
        return current.advanceTo(ProcessStep.FINISHED);
    }

    private RemoteSession session(CalcJobContext ctx) {
        return gateways.session(ctx.client());
    }

    private static String requireScriptKey(ProcessingUpdate current) {
        if (current.scriptKey() == null) {
            throw new NotFoundException("rendered job script was not recorded");
        }
        return current.scriptKey();
    }

    private static String extensionOf(String path) {
        String name = RemotePaths.fileName(path);
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot + 1);
    }

    /**
     * Whether a failure raised by {@link #execute} may be attempted again.
     */
    public static boolean retryable(RuntimeException e) {
        return e instanceof CalcJobException && ((CalcJobException) e).retryable();
    }
}
