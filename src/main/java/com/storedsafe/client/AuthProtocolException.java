package com.storedsafe.client;

/**
 * Thrown when the auth check answers with a 2xx status but the body does not carry
 * the {@code CALLINFO.status == "SUCCESS"} marker.
 *
 * <p>This is a contract violation by the server, not a token problem, so it is never
 * answered with a token refresh.
 */
public class AuthProtocolException extends StoredSafeException {

    public AuthProtocolException(String message, int httpStatusCode) {
        super(Phase.AUTH, message, httpStatusCode, null);
    }
}
