package com.storedsafe.client;

/**
 * Result of fetching one field of one object.
 *
 * <p>Only {@link Kind#TOKEN_REJECTED} is recoverable, by refreshing the token and
 * fetching again. The lookup fails on {@link Kind#TRANSIENT_FAILURE} and
 * {@link Kind#MALFORMED}.
 */
public final class FetchOutcome {

    public enum Kind {
        SUCCESS,
        TOKEN_REJECTED,
        TRANSIENT_FAILURE,
        MALFORMED
    }

    private static final FetchOutcome TOKEN_REJECTED = new FetchOutcome(Kind.TOKEN_REJECTED, null, 403, null);

    private final Kind kind;
    private final String value;
    private final int statusCode;
    private final String detail;

    private FetchOutcome(Kind kind, String value, int statusCode, String detail) {
        this.kind = kind;
        this.value = value;
        this.statusCode = statusCode;
        this.detail = detail;
    }

    public static FetchOutcome success(String value) {
        return new FetchOutcome(Kind.SUCCESS, value, 200, null);
    }

    public static FetchOutcome tokenRejected() {
        return TOKEN_REJECTED;
    }

    /**
     * @param statusCode the HTTP status, 400 or above and not 403
     * @param detail     the server's error messages, or a generic description
     */
    public static FetchOutcome transientFailure(int statusCode, String detail) {
        return new FetchOutcome(Kind.TRANSIENT_FAILURE, null, statusCode, detail);
    }

    /**
     * @param reason why the response did not yield a value
     */
    public static FetchOutcome malformed(String reason) {
        return new FetchOutcome(Kind.MALFORMED, null, 0, reason);
    }

    public Kind getKind() {
        return kind;
    }

    /** The fetched value; only set for {@link Kind#SUCCESS}. */
    public String getValue() {
        return value;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /** Failure description for {@link Kind#TRANSIENT_FAILURE} and {@link Kind#MALFORMED}. */
    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        switch (kind) {
            case SUCCESS:
                return "FetchOutcome{SUCCESS}";
            case TRANSIENT_FAILURE:
                return "FetchOutcome{TRANSIENT_FAILURE, status=" + statusCode + ", detail=" + detail + "}";
            case MALFORMED:
                return "FetchOutcome{MALFORMED, detail=" + detail + "}";
            default:
                return "FetchOutcome{" + kind + "}";
        }
    }
}
