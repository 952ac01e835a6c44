package org.ysim.runtime.spi;

/**
 * Failure of an external collaborator: the content service, a recommender or the language backend.
 * <p>
 * Transient failures (timeouts, HTTP 5xx, broken connections) may succeed when repeated; the
 * dispatcher retries them for idempotent actions only. Everything else is permanent.
 */
public class GatewayException extends Exception {

    private final boolean transientFailure;
    private final boolean timeout;

    public GatewayException(String message) {
        this(message, null, false, false);
    }

    public GatewayException(String message, Throwable cause) {
        this(message, cause, false, false);
    }

    protected GatewayException(String message, Throwable cause, boolean transientFailure, boolean timeout) {
        super(message, cause);
        this.transientFailure = transientFailure || timeout;
        this.timeout = timeout;
    }

    /**
     * Creates a failure that may succeed when the call is repeated.
     */
    public static GatewayException transientFailure(String message, Throwable cause) {
        return new GatewayException(message, cause, true, false);
    }

    /**
     * Creates a failure for a call that exceeded its timeout. Timeouts are transient.
     */
    public static GatewayException timeout(String message, Throwable cause) {
        return new GatewayException(message, cause, true, true);
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
