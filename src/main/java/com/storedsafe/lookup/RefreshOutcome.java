package com.storedsafe.lookup;

import java.time.Duration;

/**
 * Result of one run of the token update script.
 */
final class RefreshOutcome {

    enum Kind {
        SUCCESS,
        FAILED,
        TIMED_OUT
    }

    private final Kind kind;
    private final int attempt;
    private final Session session;
    private final int exitCode;
    private final String detail;

    private RefreshOutcome(Kind kind, int attempt, Session session, int exitCode, String detail) {
        this.kind = kind;
        this.attempt = attempt;
        this.session = session;
        this.exitCode = exitCode;
        this.detail = detail;
    }

    static RefreshOutcome success(int attempt, Session session) {
        return new RefreshOutcome(Kind.SUCCESS, attempt, session, 0, null);
    }

    /**
     * @param exitCode the script's exit status, or -1 if it never ran to completion
     */
    static RefreshOutcome failed(int attempt, int exitCode, String detail) {
        return new RefreshOutcome(Kind.FAILED, attempt, null, exitCode, detail);
    }

    static RefreshOutcome timedOut(int attempt) {
        return new RefreshOutcome(Kind.TIMED_OUT, attempt, null, -1, null);
    }

    Kind getKind() {
        return kind;
    }

    int getAttempt() {
        return attempt;
    }

    Session getSession() {
        return session;
    }

    int getExitCode() {
        return exitCode;
    }

    String getDetail() {
        return detail;
    }

    /** The failure as an exception, for use as the cause of a final failure. */
    TokenUpdateException toException(String script, Duration timeout) {
        if (kind == Kind.TIMED_OUT) {
            return new TokenUpdateTimeoutException(script, timeout);
        }
        return new TokenUpdateFailedException("Token update script " + script + " failed on attempt "
                + attempt + ": " + detail);
    }
}
