package io.calcrelay.engine;

import io.calcrelay.error.CalcJobException;
import io.calcrelay.model.CalcJobRow;
import io.calcrelay.model.ClientRow;
import io.calcrelay.model.CodeRow;
import io.calcrelay.model.ProcessStep;
import io.calcrelay.model.ProcessingView;
import io.calcrelay.observability.AuditLogger;
import io.calcrelay.storage.Lease;
import io.calcrelay.storage.MetadataStore;
import io.calcrelay.storage.ProcessingUpdate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Moves a leased calcjob through
 * {@code created -> uploading -> submitting -> submitted -> polling -> downloading -> parsing -> finished},
 * or to {@code excepted} from any non-terminal step. One call to
 * {@link #advance} executes the current step and commits its result.
 */
public final class ProcessEngine {
    private final MetadataStore store;
    private final StepExecutor executor;
    private final AuditLogger audit;

    public ProcessEngine(MetadataStore store, StepExecutor executor, AuditLogger audit) {
        this.store = store;
        this.executor = executor;
        this.audit = audit;
    }

    public CalcJobContext loadContext(long calcjobPk) {
        CalcJobRow calcjob = store.requireCalcJob(calcjobPk);
        CodeRow code = store.requireCode(calcjob.codePk());
        ClientRow client = store.requireClient(code.clientPk());
        return new CalcJobContext(calcjob, code, client);
    }

    /**
     * Executes exactly one step. Exceptions from the step leave the row untouched.
     */
    public ProcessingView advance(Lease lease) {
        ProcessingView view = store.requireProcessing(lease.calcjobPk());
        if (view.terminal()) {
            return view;
        }
        CalcJobContext ctx = loadContext(lease.calcjobPk());
        ProcessingUpdate update = executor.execute(view.step(), ctx, ProcessingUpdate.from(view));
        ProcessingView after = store.commitTransition(lease, view.step(), update);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", view.step().dbValue());
        details.put("to", after.step().dbValue());
        if (after.jobId() != null) {
            details.put("job_id", after.jobId());
        }
        if (after.step() == ProcessStep.DOWNLOADING) {
            details.put("remote_state", after.remoteState());
        }
        audit.log(AuditLogger.AuditEvent.of("calcjob.step", lease.owner(), lease.calcjobPk(),
                view.step().dbValue(), "ok", details));
        return after;
    }

    /**
     * Records a terminal failure that happened while executing {@code step}.
     */
    public ProcessingView except(Lease lease, ProcessStep step, RuntimeException error) {
        ProcessingView view = store.requireProcessing(lease.calcjobPk());
        if (view.terminal()) {
            return view;
        }
        String message = describe(error);
        ProcessingView after = store.commitTransition(lease, step,
                ProcessingUpdate.from(view).excepted(step, message));
        audit.log(AuditLogger.AuditEvent.of("calcjob.excepted", lease.owner(), lease.calcjobPk(),
                step.dbValue(), "excepted", Map.of("exception", message)));
        return after;
    }

    public static String describe(Throwable error) {
        if (error instanceof CalcJobException) {
            return ((CalcJobException) error).describe();
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
