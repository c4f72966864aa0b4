package com.storedsafe.client;

/**
 * Thrown when no HTTP response could be obtained from the StoredSafe server at all
 * (connection refused, DNS failure, TLS handshake failure, request timeout).
 *
 * <p>Not retried: the lookup fails as soon as the server cannot be reached.
 */
public class UnreachableException extends StoredSafeException {

    public UnreachableException(Phase phase, String url, Throwable cause) {
        super(phase, "Can not reach \"" + url + "\": " + cause.getMessage(), 0, cause);
    }
}
