package com.storedsafe.client;

import com.storedsafe.client.StoredSafeException.Phase;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.net.ssl.SSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the two StoredSafe REST calls a lookup needs.
 *
 * <ul>
 *   <li>{@code POST /auth/check}: is the token still valid?</li>
 *   <li>{@code GET /object/<id>}: fetch and decrypt one object, optionally with its file data</li>
 * </ul>
 *
 * <p>The client keeps no session state: the base URL and token are passed on every
 * call. One {@link HttpClient} is built per {@link VerifyMode} and reused.
 *
 * <p>The class is not final so tests can mock it.
 */
public class StoredSafeHttpClient {

    private static final Logger logger = LoggerFactory.getLogger(StoredSafeHttpClient.class);

    /** Field name that selects the object's file content instead of a field value. */
    public static final String DOWNLOAD_FIELD = "download";

    static final String HEADER_TOKEN = "x-http-token";

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final String CONTENT_TYPE_JSON = "application/json";

    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final Map<VerifyMode, HttpClient> httpClients = new ConcurrentHashMap<>();

    public StoredSafeHttpClient() {
        this(DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT);
    }

    /**
     * @param connectTimeout timeout for establishing a connection
     * @param requestTimeout timeout for a whole request, response body included
     */
    public StoredSafeHttpClient(Duration connectTimeout, Duration requestTimeout) {
        this.connectTimeout = connectTimeout;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Checks whether a token is accepted by the server.
     *
     * @param baseUrl    the API base URL, e.g. {@code https://safe.example.com/api/1.0}
     * @param token      the session token
     * @param verifyMode how to verify the server certificate
     * @return true if the token is valid, false if the server answered with a non-2xx status
     * @throws UnreachableException  if no response was received
     * @throws AuthProtocolException if a 2xx response lacks the success marker
     * @throws StoredSafeException   if the TLS setup for {@code verifyMode} fails
     */
    public boolean authCheck(String baseUrl, String token, VerifyMode verifyMode) throws StoredSafeException {
        Preconditions.requireNonBlank(token, "Token");
        String url = baseUrl + "/auth/check";

        // Token in both header and body: older servers only read the body.
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .header(HEADER_TOKEN, token)
                .header("Content-Type", CONTENT_TYPE_JSON)
                .POST(HttpRequest.BodyPublishers.ofString(JsonUtil.toJson(Map.of("token", token))))
                .build();

        HttpResponse<String> response = send(request, verifyMode, Phase.AUTH);
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            logger.debug("Auth check rejected with status {}", status);
            return false;
        }

        StoredSafeResponse parsed = StoredSafeResponse.fromJson(status, response.body());
        if (!parsed.isJson()) {
            throw new AuthProtocolException(
                    "Auth check returned status " + status + " without a JSON body", status);
        }
        String marker = parsed.getCallInfoStatus();
        if (!StoredSafeResponse.STATUS_SUCCESS.equals(marker)) {
            throw new AuthProtocolException(
                    "Session not authenticated with server, CALLINFO.status was '" + marker + "'", status);
        }
        return true;
    }

    /**
     * Fetches one field of an object, decrypted.
     *
     * <p>For the plain-field case the value is looked up in the object's
     * {@code crypted} map, then its {@code public} map, then its top-level keys; the
     * first map that has the key decides. For {@link #DOWNLOAD_FIELD} only the
     * base64 {@code FILEDATA} is used and returned decoded as UTF-8 text.
     *
     * @param baseUrl    the API base URL
     * @param token      the session token
     * @param objectId   the object id
     * @param fieldName  the field to read, or {@code download} for the file content
     * @param verifyMode how to verify the server certificate
     * @return the outcome; never null
     * @throws UnreachableException if no response was received
     * @throws StoredSafeException  if the TLS setup for {@code verifyMode} fails
     */
    public FetchOutcome fetchObject(String baseUrl, String token, String objectId, String fieldName,
                                    VerifyMode verifyMode) throws StoredSafeException {
        Preconditions.requireNonBlank(token, "Token");
        boolean download = DOWNLOAD_FIELD.equals(fieldName);

        StringBuilder url = new StringBuilder(baseUrl)
                .append("/object/").append(encode(objectId).replace("+", "%20"))
                .append("?token=").append(encode(token))
                .append("&decrypt=true");
        if (download) {
            url.append("&filedata=true");
            logger.debug("Requesting file content of object {}", objectId);
        }

        HttpRequest request = HttpRequest.newBuilder(URI.create(url.toString()))
                .timeout(requestTimeout)
                .GET()
                .build();

        HttpResponse<String> response = send(request, verifyMode, Phase.FETCH);
        int status = response.statusCode();
        if (status == 403) {
            return FetchOutcome.tokenRejected();
        }
        if (status >= 400) {
            return FetchOutcome.transientFailure(status, describeErrors(status, response.body()));
        }

        StoredSafeResponse parsed = StoredSafeResponse.fromJson(status, response.body());
        if (!parsed.isJson()) {
            return FetchOutcome.malformed("Response for object " + objectId + " is not JSON");
        }
        List<Map<String, Object>> objects = parsed.getObjects();
        if (objects.isEmpty()) {
            return FetchOutcome.malformed("No object " + objectId + " returned");
        }
        return download ? extractFileData(parsed, objectId) : extractField(objects.get(0), objectId, fieldName);
    }

    private FetchOutcome extractField(Map<String, Object> object, String objectId, String fieldName) {
        Object value = null;
        boolean found = false;
        for (String section : new String[]{"crypted", "public"}) {
            Object fields = object.get(section);
            if (fields instanceof Map && ((Map<?, ?>) fields).containsKey(fieldName)) {
                value = ((Map<?, ?>) fields).get(fieldName);
                found = true;
                logger.debug("Field {} of object {} found in '{}' fields", fieldName, objectId, section);
                break;
            }
        }
        if (!found) {
            value = object.get(fieldName);
        }

        String text = value != null ? value.toString() : null;
        if (text == null || text.isEmpty()) {
            return FetchOutcome.malformed("Object " + objectId + " has no value for field '" + fieldName + "'");
        }
        return FetchOutcome.success(text);
    }

    private FetchOutcome extractFileData(StoredSafeResponse parsed, String objectId) {
        String fileData = parsed.getFileData();
        if (fileData == null || fileData.isEmpty()) {
            return FetchOutcome.malformed("Object " + objectId + " has no file data");
        }
        try {
            byte[] content = Base64.getMimeDecoder().decode(fileData);
            logger.debug("Decoded {} bytes of file content for object {}", content.length, objectId);
            return FetchOutcome.success(new String(content, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            return FetchOutcome.malformed("File data of object " + objectId + " is not valid base64");
        }
    }

    private HttpResponse<String> send(HttpRequest request, VerifyMode verifyMode, Phase phase)
            throws StoredSafeException {
        HttpClient httpClient = httpClientFor(verifyMode);
        // The token travels in the query string; never log the full URI.
        logger.debug("StoredSafe request: {} {}{}", request.method(), request.uri().getHost(),
                request.uri().getPath());
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            logger.debug("StoredSafe response: {} ({})", response.statusCode(),
                    response.body() != null ? response.body().length() + " bytes" : "empty");
            return response;
        } catch (IOException e) {
            String target = request.uri().getScheme() + "://" + request.uri().getAuthority();
            throw new UnreachableException(phase, target, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoredSafeException(phase, "Request interrupted", e);
        }
    }

    private HttpClient httpClientFor(VerifyMode verifyMode) throws StoredSafeException {
        HttpClient existing = httpClients.get(verifyMode);
        if (existing != null) {
            return existing;
        }

        SSLContext sslContext;
        try {
            sslContext = SslContextBuilder.forMode(verifyMode);
        } catch (GeneralSecurityException | IOException e) {
            throw new StoredSafeException(Phase.CONFIG,
                    "Cannot set up TLS for verification mode " + verifyMode + ": " + e.getMessage(), e);
        }
        if (verifyMode.getKind() == VerifyMode.Kind.SKIP_VERIFICATION) {
            logger.warn("TLS certificate verification disabled for StoredSafe requests");
        }

        HttpClient.Builder builder = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (sslContext != null) {
            builder.sslContext(sslContext);
        }

        HttpClient created = builder.build();
        HttpClient raced = httpClients.putIfAbsent(verifyMode, created);
        return raced != null ? raced : created;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String describeErrors(int status, String body) {
        List<String> errors = JsonUtil.parseErrors(body);
        if (!errors.isEmpty()) {
            return String.join("; ", errors);
        }
        return "StoredSafe returned status " + status;
    }
}
