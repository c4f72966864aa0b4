package com.storedsafe.client;

/**
 * Base exception for every failure surfaced by a StoredSafe lookup.
 *
 * <p>Each exception names the {@link Phase} in which it occurred so callers can
 * report where the lookup stopped. When the failure came from an HTTP response
 * the status code is kept; status 0 means no response was received.
 */
public class StoredSafeException extends Exception {

    /**
     * The stage of a lookup in which a failure occurred.
     */
    public enum Phase {
        CONFIG("config"),
        AUTH("auth"),
        FETCH("fetch"),
        REFRESH("refresh");

        private final String label;

        Phase(String label) {
            this.label = label;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    private final Phase phase;
    private final int httpStatusCode;

    public StoredSafeException(Phase phase, String message) {
        this(phase, message, 0, null);
    }

    public StoredSafeException(Phase phase, String message, Throwable cause) {
        this(phase, message, 0, cause);
    }

    /**
     * Creates a new StoredSafeException.
     *
     * @param phase          the failing phase
     * @param message        the error message
     * @param httpStatusCode the HTTP status code (0 when no response was received)
     * @param cause          the underlying cause, or null
     */
    public StoredSafeException(Phase phase, String message, int httpStatusCode, Throwable cause) {
        super(message, cause);
        this.phase = phase;
        this.httpStatusCode = httpStatusCode;
    }

    public Phase getPhase() {
        return phase;
    }

    /**
     * Gets the HTTP status code of the response that caused this failure.
     *
     * @return the status code, or 0 if the failure did not come from a response
     */
    public int getHttpStatusCode() {
        return httpStatusCode;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "phase=" + phase +
                ", message='" + getMessage() + '\'' +
                ", httpStatusCode=" + httpStatusCode +
                '}';
    }
}
