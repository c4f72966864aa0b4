package com.storedsafe.lookup;

/**
 * Thrown when a token refresh is needed but no update script is configured, or the
 * configured path does not exist. Never retried.
 */
public class TokenUpdateScriptNotFoundException extends TokenUpdateException {

    public TokenUpdateScriptNotFoundException(String message) {
        super(message);
    }
}
