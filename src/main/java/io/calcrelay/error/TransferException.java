package io.calcrelay.error;

public class TransferException extends CalcJobException {
    public TransferException(String message, boolean retryable) {
        super(message, retryable);
    }

    public TransferException(String message, boolean retryable, Throwable cause) {
        super(message, retryable, cause);
    }
}
