package com.storedsafe.lookup;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Thrown when another process held the token update lock for longer than the
 * configured maximum wait.
 */
public class LockTimeoutException extends TokenUpdateException {

    public LockTimeoutException(Path lockFile, Duration waited) {
        super("Token update lock " + lockFile + " still held after waiting "
                + waited.getSeconds() + "s");
    }
}
