package com.storedsafe.lookup;

import java.time.Duration;

/**
 * Describes an update script run that was killed after exceeding its timeout.
 */
public class TokenUpdateTimeoutException extends TokenUpdateException {

    public TokenUpdateTimeoutException(String script, Duration timeout) {
        super("Failed running token update script " + script + ". Timed out after "
                + timeout.getSeconds() + "s");
    }
}
