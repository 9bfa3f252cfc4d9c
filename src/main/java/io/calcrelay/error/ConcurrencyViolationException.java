package io.calcrelay.error;

/**
 * The caller no longer owns the calcjob it tried to write, or tried to claim one
 * that another driver holds. Never recorded on the processing row.
 */
public class ConcurrencyViolationException extends CalcJobException {
    public ConcurrencyViolationException(String message) {
        super(message, false);
    }
}
