package com.storedsafe.lookup;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The StoredSafe client rc file, as written by the StoredSafe login tools.
 *
 * <pre>
 * username:alice
 * mysite:safe.example.com
 * token:Xk3r9VxzAb12
 * </pre>
 *
 * <p>Only {@code mysite} and {@code token} are read. A literal {@code none} for
 * either one means the user is logged out: the file then yields neither server
 * nor token.
 */
public final class RcFile {

    private static final Logger logger = LoggerFactory.getLogger(RcFile.class);

    public static final String DEFAULT_FILE_NAME = ".storedsafe-client.rc";

    static final String KEY_SERVER = "mysite";
    static final String KEY_TOKEN = "token";
    static final String VALUE_NONE = "none";

    private static final RcFile EMPTY = new RcFile(null, null);

    private final String server;
    private final String token;

    private RcFile(String server, String token) {
        this.server = server;
        this.token = token;
    }

    /** {@code ~/.storedsafe-client.rc} */
    public static Path defaultPath() {
        return Paths.get(System.getProperty("user.home"), DEFAULT_FILE_NAME);
    }

    /**
     * Reads an rc file.
     *
     * @param path the file to read
     * @return the server and token it holds; both absent when the file is missing
     *         or either key is {@code none}
     * @throws ConfigurationException if the file exists but cannot be read
     */
    public static RcFile read(Path path) throws ConfigurationException {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            logger.debug("No rc file at {}", path);
            return EMPTY;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read rc file " + path + ": " + e.getMessage());
        }

        String server = null;
        String token = null;
        for (String line : lines) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String key = line.substring(0, colon).trim();
            String value = line.substring(colon + 1).trim();
            if (!KEY_SERVER.equals(key) && !KEY_TOKEN.equals(key)) {
                continue;
            }
            if (VALUE_NONE.equals(value)) {
                logger.debug("rc file {} marks {} as none, treating session as logged out", path, key);
                return EMPTY;
            }
            if (KEY_SERVER.equals(key)) {
                server = value.isEmpty() ? null : value;
            } else {
                token = value.isEmpty() ? null : value;
            }
        }
        return new RcFile(server, token);
    }

    /** The {@code mysite} value, or null. */
    public String getServer() {
        return server;
    }

    /** The {@code token} value, or null. */
    public String getToken() {
        return token;
    }
}
