package io.calcrelay.error;

public class PollException extends CalcJobException {
    public PollException(String message, boolean retryable) {
        super(message, retryable);
    }

    public PollException(String message, boolean retryable, Throwable cause) {
        super(message, retryable, cause);
    }
}
