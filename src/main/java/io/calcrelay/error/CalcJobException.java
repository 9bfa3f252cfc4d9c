package io.calcrelay.error;

/**
 * Base of the step-level error taxonomy. A retryable failure may be repeated
 * by the runner with backoff; anything else moves the calcjob to excepted.
 */
public abstract class CalcJobException extends RuntimeException {
    private final boolean retryable;

    protected CalcJobException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    protected CalcJobException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }

    /**
     * Text captured into the processing record, e.g. {@code TransferException: upload failed}.
     */
    public String describe() {
        return getClass().getSimpleName() + ": " + getMessage();
    }
}
