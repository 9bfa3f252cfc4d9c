package io.calcrelay.error;

/**
 * A step stopped waiting because the runner was asked to stop. Nothing was committed.
 */
public class StepSuspendedException extends CalcJobException {
    public StepSuspendedException(String message) {
        super(message, false);
    }
}
