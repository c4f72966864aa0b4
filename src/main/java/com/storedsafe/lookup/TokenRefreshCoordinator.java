package com.storedsafe.lookup;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Refreshes the session token by running the operator's token update script.
 *
 * <p>The script is expected to log in to StoredSafe (interactively or not) and
 * write the new token to the rc file. Runs are serialized across processes by a
 * {@link RefreshLock}; concurrent lookups against the same StoredSafe therefore
 * run the script one at a time.
 *
 * <p>Each attempt:
 * <ol>
 *   <li>acquires the lock (waiting does not count against the budget),</li>
 *   <li>runs {@code /bin/sh <script>} with no arguments,</li>
 *   <li>on exit status 0 re-reads the rc file for the new token,</li>
 *   <li>releases the lock, whatever happened.</li>
 * </ol>
 * A non-zero exit, a timeout, or an rc file without a token counts as a failed
 * attempt and is retried while the {@link RetryBudget} allows.
 */
public class TokenRefreshCoordinator implements SessionRefresher {

    private static final Logger logger = LoggerFactory.getLogger(TokenRefreshCoordinator.class);

    private static final String SHELL = "/bin/sh";
    private static final Duration KILL_GRACE = Duration.ofSeconds(5);
    private static final int MAX_DIAGNOSTIC_CHARS = 2000;

    private final Path lockFile;
    private final Duration pollInterval;

    public TokenRefreshCoordinator() {
        this(RefreshLock.DEFAULT_LOCK_FILE, RefreshLock.UPDATE_WAIT_SLEEP);
    }

    /**
     * @param lockFile     the lock file shared by all processes using the same rc file
     * @param pollInterval pause between lock checks
     */
    public TokenRefreshCoordinator(Path lockFile, Duration pollInterval) {
        this.lockFile = lockFile;
        this.pollInterval = pollInterval;
    }

    @Override
    public Session refresh(Config config, Session current, RetryBudget budget) throws TokenUpdateException {
        String script = requireScript(config);

        RefreshOutcome last = null;
        while (budget.tryConsume()) {
            int attempt = budget.getUsed();
            logger.info("Updating StoredSafe token with {} (attempt {} of {})",
                    script, attempt, budget.getMaxAttempts());

            RefreshOutcome outcome;
            try (RefreshLock lock = RefreshLock.acquire(lockFile, pollInterval, config.getLockWaitTimeout())) {
                outcome = runScript(config, current, script, attempt);
            }

            if (outcome.getKind() == RefreshOutcome.Kind.SUCCESS) {
                logger.debug("Token update succeeded, new {}", outcome.getSession());
                return outcome.getSession();
            }
            if (outcome.getKind() == RefreshOutcome.Kind.TIMED_OUT) {
                logger.warn("Token update attempt {} timed out after {}s", attempt,
                        config.getRefreshTimeout().getSeconds());
            } else {
                logger.warn("Token update attempt {} failed: {}", attempt, outcome.getDetail());
            }
            last = outcome;
        }

        TokenUpdateException cause = last != null ? last.toException(script, config.getRefreshTimeout()) : null;
        throw new TokenUpdateFailedException("Token update failed, maximum retries reached ("
                + budget.getMaxAttempts() + ")", cause);
    }

    private String requireScript(Config config) throws TokenUpdateScriptNotFoundException {
        String script = config.getRefreshScript();
        if (script == null) {
            throw new TokenUpdateScriptNotFoundException("Not logged in to StoredSafe and no update script "
                    + "available. Specify token update script in variable \""
                    + ConfigResolver.VAR_TOKEN_UPDATE_SCRIPT + "\" or "
                    + ConfigResolver.ENV_TOKEN_UPDATE_SCRIPT + " environment variable.");
        }
        if (!Files.exists(Paths.get(script))) {
            logger.debug("Token update script path is {}", script);
            throw new TokenUpdateScriptNotFoundException("Token update script does not exist at given path: " + script);
        }
        return script;
    }

    private RefreshOutcome runScript(Config config, Session current, String script, int attempt)
            throws TokenUpdateException {
        Path stdout = null;
        Path stderr = null;
        try {
            stdout = Files.createTempFile("storedsafe-update-", ".out");
            stderr = Files.createTempFile("storedsafe-update-", ".err");

            Process process = new ProcessBuilder(SHELL, script)
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile())
                    .start();

            Duration timeout = config.getRefreshTimeout();
            if (timeout.isZero()) {
                process.waitFor();
            } else if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly().waitFor(KILL_GRACE.toMillis(), TimeUnit.MILLISECONDS);
                return RefreshOutcome.timedOut(attempt);
            }

            int exitCode = process.exitValue();
            logger.debug("Token update script exited with {}", exitCode);
            logger.debug("Token update script stdout: {}", readDiagnostics(stdout));
            logger.debug("Token update script stderr: {}", readDiagnostics(stderr));

            if (exitCode != 0) {
                return RefreshOutcome.failed(attempt, exitCode, "exit status " + exitCode);
            }
            return readRefreshedSession(config, current, attempt);

        } catch (IOException e) {
            return RefreshOutcome.failed(attempt, -1, "could not run script: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenUpdateFailedException("Interrupted while running token update script " + script, e);
        } finally {
            deleteTempFile(stdout);
            deleteTempFile(stderr);
        }
    }

    private RefreshOutcome readRefreshedSession(Config config, Session current, int attempt) {
        RcFile rc;
        try {
            rc = RcFile.read(config.getRcFile());
        } catch (ConfigurationException e) {
            return RefreshOutcome.failed(attempt, 0, e.getMessage());
        }
        if (rc.getToken() == null) {
            return RefreshOutcome.failed(attempt, 0, "script succeeded but " + config.getRcFile()
                    + " holds no token");
        }

        String server = current.getServer();
        if (config.isServerFromRcFile() && rc.getServer() != null) {
            server = rc.getServer();
        }
        logger.info("Token update retrieved token {} for server {}", Tokens.mask(rc.getToken()), server);
        return RefreshOutcome.success(attempt, new Session(server, rc.getToken()));
    }

    private static String readDiagnostics(Path file) throws IOException {
        String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8).strip();
        if (text.length() > MAX_DIAGNOSTIC_CHARS) {
            return text.substring(0, MAX_DIAGNOSTIC_CHARS) + "...";
        }
        return text;
    }

    private static void deleteTempFile(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Could not delete temporary file {}: {}", file, e.getMessage());
        }
    }
}
