package com.storedsafe.lookup;

import com.storedsafe.client.Preconditions;
import com.storedsafe.client.VerifyMode;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Resolved settings for one lookup run. Built by {@link ConfigResolver}, never
 * modified afterwards.
 */
public final class Config {

    private final String server;
    private final String token;
    private final String caBundle;
    private final boolean skipVerify;
    private final String refreshScript;
    private final Path rcFile;
    private final boolean serverFromRcFile;
    private final Duration refreshTimeout;
    private final Duration lockWaitTimeout;

    private Config(Builder builder) {
        this.server = Preconditions.requireNonBlank(builder.server, "Server");
        this.token = builder.token;
        this.caBundle = builder.caBundle;
        this.skipVerify = builder.skipVerify;
        this.refreshScript = builder.refreshScript;
        this.rcFile = builder.rcFile != null ? builder.rcFile : RcFile.defaultPath();
        this.serverFromRcFile = builder.serverFromRcFile;
        this.refreshTimeout = builder.refreshTimeout;
        this.lockWaitTimeout = builder.lockWaitTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getServer() {
        return server;
    }

    /** The configured token, or null when it has to come from the update script. */
    public String getToken() {
        return token;
    }

    public String getCaBundle() {
        return caBundle;
    }

    public boolean isSkipVerify() {
        return skipVerify;
    }

    public String getRefreshScript() {
        return refreshScript;
    }

    public Path getRcFile() {
        return rcFile;
    }

    /** True when no environment or framework variable named the server and it was read from the rc file. */
    public boolean isServerFromRcFile() {
        return serverFromRcFile;
    }

    /** Maximum run time of the update script; zero lets it run until it exits. */
    public Duration getRefreshTimeout() {
        return refreshTimeout;
    }

    /** Maximum wait for another process's refresh lock; zero waits forever. */
    public Duration getLockWaitTimeout() {
        return lockWaitTimeout;
    }

    /**
     * Skip verification wins over a CA bundle when both are set.
     */
    public VerifyMode getVerifyMode() {
        if (skipVerify) {
            return VerifyMode.skipVerification();
        }
        if (caBundle != null) {
            return VerifyMode.caBundle(caBundle);
        }
        return VerifyMode.defaultMode();
    }

    @Override
    public String toString() {
        return "Config{server=" + server
                + ", token=" + Tokens.mask(token)
                + ", verifyMode=" + getVerifyMode()
                + ", refreshScript=" + refreshScript
                + ", rcFile=" + rcFile + "}";
    }

    public static final class Builder {
        private String server;
        private String token;
        private String caBundle;
        private boolean skipVerify;
        private String refreshScript;
        private Path rcFile;
        private boolean serverFromRcFile;
        private Duration refreshTimeout = ConfigResolver.DEFAULT_REFRESH_TIMEOUT;
        private Duration lockWaitTimeout = Duration.ZERO;

        private Builder() {
        }

        public Builder server(String server) {
            this.server = server;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder caBundle(String caBundle) {
            this.caBundle = caBundle;
            return this;
        }

        public Builder skipVerify(boolean skipVerify) {
            this.skipVerify = skipVerify;
            return this;
        }

        public Builder refreshScript(String refreshScript) {
            this.refreshScript = refreshScript;
            return this;
        }

        public Builder rcFile(Path rcFile) {
            this.rcFile = rcFile;
            return this;
        }

        public Builder serverFromRcFile(boolean serverFromRcFile) {
            this.serverFromRcFile = serverFromRcFile;
            return this;
        }

        public Builder refreshTimeout(Duration refreshTimeout) {
            this.refreshTimeout = refreshTimeout;
            return this;
        }

        public Builder lockWaitTimeout(Duration lockWaitTimeout) {
            this.lockWaitTimeout = lockWaitTimeout;
            return this;
        }

        public Config build() {
            return new Config(this);
        }
    }
}
