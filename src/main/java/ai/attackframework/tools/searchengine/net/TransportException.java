package ai.attackframework.tools.searchengine.net;

/** Thrown (or passed to a callback) when a fetch fails at the HTTP level. */
public final class TransportException extends RuntimeException {

    private final int statusCode;

    public TransportException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status code, or -1 when the failure happened below HTTP. */
    public int statusCode() {
        return statusCode;
    }
}
