package io.calcrelay.error;

/**
 * Retrieved outputs do not satisfy expectations. Never retried: the remote run is over.
 */
public class ParseException extends CalcJobException {
    public ParseException(String message) {
        super(message, false);
    }
}
