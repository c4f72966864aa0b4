package com.storedsafe.lookup;

import com.storedsafe.client.Preconditions;

/**
 * The server and token a lookup currently talks to.
 *
 * <p>Immutable: a token refresh yields a new session.
 */
public final class Session {

    private final String server;
    private final String token;
    private final String baseUrl;

    /**
     * @param server the StoredSafe host name, without scheme
     * @param token  the session token, or null when none is known yet
     */
    public Session(String server, String token) {
        this.server = Preconditions.requireNonBlank(server, "Server");
        this.token = token;
        this.baseUrl = "https://" + server + "/api/1.0";
    }

    /** The session a lookup starts with: whatever server and token the configuration holds. */
    public static Session initial(Config config) {
        return new Session(config.getServer(), config.getToken());
    }

    public String getServer() {
        return server;
    }

    /** The token, or null before the first refresh when none was configured. */
    public String getToken() {
        return token;
    }

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public String toString() {
        return "Session{server=" + server + ", token=" + Tokens.mask(token) + "}";
    }
}
