package com.storedsafe.lookup;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Config} from the environment, the host runtime's variables and
 * the rc file.
 *
 * <h2>Resolution order</h2>
 * <p>For every setting the environment variable wins over the framework variable of
 * the same meaning. Server and token then fall back to the rc file.
 * <ul>
 *   <li>{@code STOREDSAFE_SERVER} / {@code storedsafe_server} / rc {@code mysite}</li>
 *   <li>{@code STOREDSAFE_TOKEN} / rc {@code token}</li>
 *   <li>{@code STOREDSAFE_CABUNDLE} / {@code storedsafe_cabundle}</li>
 *   <li>{@code STOREDSAFE_SKIP_VERIFY} / {@code storedsafe_skip_verify}</li>
 *   <li>{@code STOREDSAFE_TOKEN_UPDATE_SCRIPT} / {@code storedsafe_token_update_script}</li>
 *   <li>{@code STOREDSAFE_RC_FILE} / {@code storedsafe_rc_file}, default {@code ~/.storedsafe-client.rc}</li>
 *   <li>{@code STOREDSAFE_TOKEN_UPDATE_TIMEOUT} / {@code storedsafe_token_update_timeout} (seconds, 0 waits forever)</li>
 *   <li>{@code STOREDSAFE_LOCK_WAIT_TIMEOUT} / {@code storedsafe_lock_wait_timeout} (seconds, 0 waits forever)</li>
 * </ul>
 *
 * <p>Skip-verify is the exception: the environment and framework variable are
 * OR-combined, so either one set to a true value disables verification.
 */
public class ConfigResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConfigResolver.class);

    // Environment variable names
    static final String ENV_SERVER = "STOREDSAFE_SERVER";
    static final String ENV_TOKEN = "STOREDSAFE_TOKEN";
    static final String ENV_CABUNDLE = "STOREDSAFE_CABUNDLE";
    static final String ENV_SKIP_VERIFY = "STOREDSAFE_SKIP_VERIFY";
    static final String ENV_TOKEN_UPDATE_SCRIPT = "STOREDSAFE_TOKEN_UPDATE_SCRIPT";
    static final String ENV_RC_FILE = "STOREDSAFE_RC_FILE";
    static final String ENV_TOKEN_UPDATE_TIMEOUT = "STOREDSAFE_TOKEN_UPDATE_TIMEOUT";
    static final String ENV_LOCK_WAIT_TIMEOUT = "STOREDSAFE_LOCK_WAIT_TIMEOUT";

    // Framework variable names
    static final String VAR_SERVER = "storedsafe_server";
    static final String VAR_CABUNDLE = "storedsafe_cabundle";
    static final String VAR_SKIP_VERIFY = "storedsafe_skip_verify";
    static final String VAR_TOKEN_UPDATE_SCRIPT = "storedsafe_token_update_script";
    static final String VAR_RC_FILE = "storedsafe_rc_file";
    static final String VAR_TOKEN_UPDATE_TIMEOUT = "storedsafe_token_update_timeout";
    static final String VAR_LOCK_WAIT_TIMEOUT = "storedsafe_lock_wait_timeout";

    static final Duration DEFAULT_REFRESH_TIMEOUT = Duration.ofSeconds(300);

    /** Exact literals accepted from the environment. */
    private static final Set<String> ENV_TRUE_VALUES = Set.of("1", "true", "True", "t");

    /** Case-insensitive literals accepted from framework variables. */
    private static final Set<String> VAR_TRUE_VALUES = Set.of("1", "true", "t", "yes", "y", "on");

    /**
     * Resolves the rc file location, then the rest of the configuration.
     *
     * @param env           environment variables
     * @param frameworkVars variables supplied by the host runtime, may be null
     * @return the configuration
     * @throws ConfigurationException if no server can be found, if there is neither a
     *                                token nor an update script, or a value is invalid
     */
    public Config resolve(Map<String, String> env, Map<String, ?> frameworkVars) throws ConfigurationException {
        String rcFile = getConfig(env, frameworkVars, ENV_RC_FILE, VAR_RC_FILE);
        return resolve(env, frameworkVars, rcFile != null ? Paths.get(rcFile) : RcFile.defaultPath());
    }

    /**
     * Resolves the configuration against a given rc file.
     *
     * @see #resolve(Map, Map)
     */
    public Config resolve(Map<String, String> env, Map<String, ?> frameworkVars, Path rcFile)
            throws ConfigurationException {
        String server = getConfig(env, frameworkVars, ENV_SERVER, VAR_SERVER);
        String token = getConfig(env, null, ENV_TOKEN, null);
        boolean serverFromRcFile = false;

        if (server == null || token == null) {
            RcFile rc = RcFile.read(rcFile);
            if (server == null) {
                server = rc.getServer();
                serverFromRcFile = server != null;
            }
            if (token == null) {
                token = rc.getToken();
            }
        }

        if (server == null) {
            throw new ConfigurationException("StoredSafe address not set. Specify with "
                    + ENV_SERVER + " environment variable, " + VAR_SERVER
                    + " variable or in " + rcFile);
        }

        String refreshScript = getConfig(env, frameworkVars, ENV_TOKEN_UPDATE_SCRIPT, VAR_TOKEN_UPDATE_SCRIPT);
        if (token == null && refreshScript == null) {
            throw new ConfigurationException("StoredSafe token not set and no update script available. "
                    + "Specify token with " + ENV_TOKEN + " environment variable or in " + rcFile
                    + ", or specify a token update script with " + ENV_TOKEN_UPDATE_SCRIPT
                    + " environment variable or " + VAR_TOKEN_UPDATE_SCRIPT + " variable.");
        }

        Config config = Config.builder()
                .server(server)
                .token(token)
                .caBundle(getConfig(env, frameworkVars, ENV_CABUNDLE, VAR_CABUNDLE))
                .skipVerify(resolveSkipVerify(env, frameworkVars))
                .refreshScript(refreshScript)
                .rcFile(rcFile)
                .serverFromRcFile(serverFromRcFile)
                .refreshTimeout(getSeconds(env, frameworkVars, ENV_TOKEN_UPDATE_TIMEOUT,
                        VAR_TOKEN_UPDATE_TIMEOUT, DEFAULT_REFRESH_TIMEOUT))
                .lockWaitTimeout(getSeconds(env, frameworkVars, ENV_LOCK_WAIT_TIMEOUT,
                        VAR_LOCK_WAIT_TIMEOUT, Duration.ZERO))
                .build();

        logger.debug("Resolved {}", config);
        return config;
    }

    private boolean resolveSkipVerify(Map<String, String> env, Map<String, ?> frameworkVars) {
        String envValue = env.get(ENV_SKIP_VERIFY);
        if (envValue != null && ENV_TRUE_VALUES.contains(envValue)) {
            return true;
        }
        Object value = frameworkVars != null ? frameworkVars.get(VAR_SKIP_VERIFY) : null;
        return isTruthy(value);
    }

    static boolean isTruthy(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        return value != null && VAR_TRUE_VALUES.contains(value.toString().trim().toLowerCase(Locale.ROOT));
    }

    private Duration getSeconds(Map<String, String> env, Map<String, ?> frameworkVars,
                                String envName, String varName, Duration defaultValue)
            throws ConfigurationException {
        String raw = getConfig(env, frameworkVars, envName, varName);
        if (raw == null) {
            return defaultValue;
        }
        try {
            long seconds = Long.parseLong(raw.trim());
            if (seconds < 0) {
                throw new NumberFormatException("negative value");
            }
            return Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + envName + " / " + varName + " value: '"
                    + raw + "'. Must be a non-negative number of seconds.");
        }
    }

    /**
     * Get configuration value with resolution order: env → framework variable.
     * Blank values count as unset.
     */
    private String getConfig(Map<String, String> env, Map<String, ?> frameworkVars,
                             String envName, String varName) {
        String value = env.get(envName);
        if (value != null && !value.isBlank()) {
            return value;
        }

        if (varName != null && frameworkVars != null) {
            Object var = frameworkVars.get(varName);
            if (var != null && !var.toString().isBlank()) {
                return var.toString();
            }
        }
        return null;
    }
}
