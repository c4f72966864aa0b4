package com.storedsafe.lookup;

/**
 * Thrown when the token could not be refreshed: the update script exited with a
 * non-zero status, left no token behind, the retry budget ran out, or the lock file
 * could not be managed.
 */
public class TokenUpdateFailedException extends TokenUpdateException {

    public TokenUpdateFailedException(String message) {
        super(message);
    }

    public TokenUpdateFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
