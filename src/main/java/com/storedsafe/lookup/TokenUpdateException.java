package com.storedsafe.lookup;

import com.storedsafe.client.StoredSafeException;

/**
 * Base class for failures while refreshing the token with the update script.
 */
public class TokenUpdateException extends StoredSafeException {

    public TokenUpdateException(String message) {
        super(Phase.REFRESH, message);
    }

    public TokenUpdateException(String message, Throwable cause) {
        super(Phase.REFRESH, message, cause);
    }
}
