package io.calcrelay.remote;

/**
 * Failure of a single remote call, classified so callers can decide whether
 * a retry may succeed.
 */
public class RemoteCallException extends RuntimeException {
    public enum Kind {
        TRANSIENT,
        AUTH,
        NOT_FOUND,
        FATAL
    }

    private final Kind kind;
    private final int statusCode;

    public RemoteCallException(Kind kind, String message) {
        this(kind, -1, message, null);
    }

    public RemoteCallException(Kind kind, String message, Throwable cause) {
        this(kind, -1, message, cause);
    }

    public RemoteCallException(Kind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public Kind kind() {
        return kind;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean transientFailure() {
        return kind == Kind.TRANSIENT;
    }

    public static Kind kindForStatus(int status) {
        if (status == 401 || status == 403) {
            return Kind.AUTH;
        }
        if (status == 404) {
            return Kind.NOT_FOUND;
        }
        if (status == 408 || status == 429 || status >= 500) {
            return Kind.TRANSIENT;
        }
        return Kind.FATAL;
    }
}
