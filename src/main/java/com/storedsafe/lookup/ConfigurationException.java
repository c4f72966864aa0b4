package com.storedsafe.lookup;

import com.storedsafe.client.StoredSafeException;

/**
 * Thrown when a lookup cannot start: no server, no token and no way to obtain one,
 * an invalid setting, or a malformed lookup term.
 */
public class ConfigurationException extends StoredSafeException {

    public ConfigurationException(String message) {
        super(Phase.CONFIG, message);
    }
}
