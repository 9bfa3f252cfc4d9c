package io.calcrelay.error;

/**
 * A content key or metadata row is missing. Always fatal to the calling operation.
 */
public class NotFoundException extends CalcJobException {
    public NotFoundException(String message) {
        super(message, false);
    }
}
