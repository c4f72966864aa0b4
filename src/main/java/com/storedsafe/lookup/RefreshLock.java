package com.storedsafe.lookup;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Advisory lock serializing token updates across processes.
 *
 * <p>The lock is held while the lock file exists. It is created atomically, so two
 * processes can never both believe they hold it. Use with try-with-resources so the
 * file is removed on every exit path:
 * <pre>{@code
 * try (RefreshLock lock = RefreshLock.acquire(path, pollInterval, maxWait)) {
 *     // run the update script
 * }
 * }</pre>
 *
 * <p>A process that dies while holding the lock leaves the file behind. Other
 * processes then wait until it is removed by hand, or until {@code maxWait}.
 */
public final class RefreshLock implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RefreshLock.class);

    public static final Path DEFAULT_LOCK_FILE = Paths.get("/tmp/.storedsafe_token_update_lock");

    /** Pause between checks while another process holds the lock. */
    public static final Duration UPDATE_WAIT_SLEEP = Duration.ofSeconds(1);

    private final Path lockFile;
    private boolean released;

    private RefreshLock(Path lockFile) {
        this.lockFile = lockFile;
    }

    /**
     * Creates the lock file, waiting while another process holds it.
     *
     * @param lockFile     the lock file path
     * @param pollInterval pause between attempts
     * @param maxWait      maximum time to wait; zero or negative waits forever
     * @return the held lock
     * @throws LockTimeoutException       if {@code maxWait} elapsed
     * @throws TokenUpdateFailedException if the file cannot be created or the wait is interrupted
     */
    public static RefreshLock acquire(Path lockFile, Duration pollInterval, Duration maxWait)
            throws TokenUpdateException {
        long started = System.nanoTime();
        boolean logged = false;

        while (true) {
            try {
                Files.createFile(lockFile);
                logger.debug("Acquired token update lock {}", lockFile);
                return new RefreshLock(lockFile);
            } catch (FileAlreadyExistsException e) {
                Duration waited = Duration.ofNanos(System.nanoTime() - started);
                if (!maxWait.isZero() && !maxWait.isNegative() && waited.compareTo(maxWait) >= 0) {
                    throw new LockTimeoutException(lockFile, waited);
                }
                if (!logged) {
                    logger.info("Token update in progress by another process, waiting for {}", lockFile);
                    logged = true;
                }
            } catch (IOException e) {
                throw new TokenUpdateFailedException("Cannot create token update lock " + lockFile, e);
            }

            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TokenUpdateFailedException("Interrupted while waiting for token update lock " + lockFile, e);
            }
        }
    }

    public Path getLockFile() {
        return lockFile;
    }

    /**
     * Removes the lock file. Calling it again has no effect.
     *
     * @throws TokenUpdateFailedException if the file cannot be removed; it would
     *                                    otherwise block every later update
     */
    @Override
    public void close() throws TokenUpdateFailedException {
        if (released) {
            return;
        }
        released = true;
        try {
            Files.deleteIfExists(lockFile);
            logger.debug("Released token update lock {}", lockFile);
        } catch (IOException e) {
            throw new TokenUpdateFailedException("Cannot remove token update lock " + lockFile
                    + "; remove it by hand", e);
        }
    }
}
