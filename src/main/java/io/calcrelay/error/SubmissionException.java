package io.calcrelay.error;

public class SubmissionException extends CalcJobException {
    public SubmissionException(String message, boolean retryable) {
        super(message, retryable);
    }

    public SubmissionException(String message, boolean retryable, Throwable cause) {
        super(message, retryable, cause);
    }
}
