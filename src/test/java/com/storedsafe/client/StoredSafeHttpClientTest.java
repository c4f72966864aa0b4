package com.storedsafe.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for StoredSafeHttpClient against a local mock server.
 */
class StoredSafeHttpClientTest {

    private static final String TOKEN = "Xk3r9VxzAb12";
    private static final String AUTH_OK = "{\"CALLINFO\":{\"status\":\"SUCCESS\"}}";

    private MockWebServer server;
    private StoredSafeHttpClient client;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        baseUrl = server.url("/api/1.0").toString();
        client = new StoredSafeHttpClient(Duration.ofSeconds(2), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    // --- authCheck ---

    @Test
    void authCheck_withSuccessMarker_returnsTrue() throws Exception {
        server.enqueue(new MockResponse().setBody(AUTH_OK));

        boolean authed = client.authCheck(baseUrl, TOKEN, VerifyMode.defaultMode());

        assertThat(authed).isTrue();
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/api/1.0/auth/check");
        assertThat(request.getHeader("x-http-token")).isEqualTo(TOKEN);
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"token\":\"" + TOKEN + "\"}");
    }

    @Test
    void authCheck_withNon2xxStatus_returnsFalse() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(401)
                .setBody("{\"CALLINFO\":{\"status\":\"FAILED\"}}"));

        assertThat(client.authCheck(baseUrl, TOKEN, VerifyMode.defaultMode())).isFalse();
    }

    @Test
    void authCheck_with403_returnsFalse() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(403));

        assertThat(client.authCheck(baseUrl, TOKEN, VerifyMode.defaultMode())).isFalse();
    }

    @Test
    void authCheck_with2xxButWrongMarker_throwsAuthProtocolException() {
        server.enqueue(new MockResponse().setBody("{\"CALLINFO\":{\"status\":\"FAILED\"}}"));

        assertThatThrownBy(() -> client.authCheck(baseUrl, TOKEN, VerifyMode.defaultMode()))
                .isInstanceOf(AuthProtocolException.class)
                .hasMessageContaining("FAILED");
    }

    @Test
    void authCheck_with2xxButNoJson_throwsAuthProtocolException() {
        server.enqueue(new MockResponse().setBody("<html>maintenance</html>"));

        assertThatThrownBy(() -> client.authCheck(baseUrl, TOKEN, VerifyMode.defaultMode()))
                .isInstanceOf(AuthProtocolException.class)
                .hasMessageContaining("without a JSON body");
    }

    @Test
    void authCheck_whenServerDown_throwsUnreachable() throws IOException {
        String deadUrl = unusedBaseUrl();

        assertThatThrownBy(() -> client.authCheck(deadUrl, TOKEN, VerifyMode.defaultMode()))
                .isInstanceOf(UnreachableException.class)
                .satisfies(e -> assertThat(((StoredSafeException) e).getPhase())
                        .isEqualTo(StoredSafeException.Phase.AUTH));
    }

    @Test
    void authCheck_withBlankToken_throwsIllegalArgument() {
        assertThatThrownBy(() -> client.authCheck(baseUrl, " ", VerifyMode.defaultMode()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // --- fetchObject: request shape ---

    @Test
    void fetchObject_sendsTokenAndDecryptFlag() throws Exception {
        server.enqueue(new MockResponse().setBody(objectJson("\"crypted\":{\"password\":\"s3cret\"}")));

        client.fetchObject(baseUrl, TOKEN, "100", "password", VerifyMode.defaultMode());

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/api/1.0/object/100");
        assertThat(request.getRequestUrl().queryParameter("token")).isEqualTo(TOKEN);
        assertThat(request.getRequestUrl().queryParameter("decrypt")).isEqualTo("true");
        assertThat(request.getRequestUrl().queryParameter("filedata")).isNull();
    }

    @Test
    void fetchObject_download_requestsFileData() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"OBJECT\":[{}],\"FILEDATA\":\"" + base64("x") + "\"}"));

        client.fetchObject(baseUrl, TOKEN, "1718", "download", VerifyMode.defaultMode());

        RecordedRequest request = server.takeRequest();
        assertThat(request.getRequestUrl().queryParameter("filedata")).isEqualTo("true");
    }

    // --- fetchObject: field extraction ---

    @Test
    void fetchObject_prefersCryptedOverPublicAndTopLevel() throws Exception {
        server.enqueue(new MockResponse().setBody(objectJson(
                "\"password\":\"top\",\"public\":{\"password\":\"public\"},\"crypted\":{\"password\":\"crypted\"}")));

        FetchOutcome outcome = client.fetchObject(baseUrl, TOKEN, "100", "password", VerifyMode.defaultMode());

        assertThat(outcome.getKind()).isEqualTo(FetchOutcome.Kind.SUCCESS);
        assertThat(outcome.getValue()).isEqualTo("crypted");
    }

    @Test
    void fetchObject_fallsBackToPublicThenTopLevel() throws Exception {
        server.enqueue(new MockResponse().setBody(objectJson(
                "\"username\":\"top\",\"public\":{\"username\":\"alice\"},\"crypted\":{\"password\":\"x\"}")));
        server.enqueue(new MockResponse().setBody(objectJson(
                "\"objectname\":\"db-admin\",\"public\":{},\"crypted\":{}")));

        FetchOutcome fromPublic = client.fetchObject(baseUrl, TOKEN, "100", "username", VerifyMode.defaultMode());
        FetchOutcome fromTop = client.fetchObject(baseUrl, TOKEN, "100", "objectname", VerifyMode.defaultMode());

        assertThat(fromPublic.getValue()).isEqualTo("alice");
        assertThat(fromTop.getValue()).isEqualTo("db-admin");
    }

    @Test
    void fetchObject_withEmptyCryptedValue_isMalformed() throws Exception {
        server.enqueue(new MockResponse().setBody(objectJson(
                "\"public\":{\"pin\":\"1234\"},\"crypted\":{\"pin\":\"\"}")));

        FetchOutcome outcome = client.fetchObject(baseUrl, TOKEN, "655", "pin", VerifyMode.defaultMode());

        assertThat(outcome.getKind()).isEqualTo(FetchOutcome.Kind.MALFORMED);
    }

    @Test
    void fetchObject_withUnknownField_isMalformed() throws Exception {
        server.enqueue(new MockResponse().setBody(objectJson("\"crypted\":{\"password\":\"x\"}")));

        FetchOutcome outcome = client.fetchObject(baseUrl, TOKEN, "100", "nosuchfield", VerifyMode.defaultMode());

        assertThat(outcome.getKind()).isEqualTo(FetchOutcome.Kind.MALFORMED);
        assertThat(outcome.getDetail()).contains("nosuchfield");
    }

    @Test
    void fetchObject_withNoObjects_isMalformed() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"OBJECT\":[],\"CALLINFO\":{\"status\":\"SUCCESS\"}}"));

        FetchOutcome outcome = client.fetchObject(baseUrl, TOKEN, "100", "password", VerifyMode.defaultMode());

        assertThat(outcome.getKind()).isEqualTo(FetchOutcome.Kind.MALFORMED);
    }

    @Test
    void fetchObject_withNumericValue_returnsItsText() throws Exception {
        server.enqueue(new MockResponse().setBody(objectJson("\"public\":{\"port\":5432}")));

        FetchOutcome outcome = client.fetchObject(baseUrl, TOKEN, "100", "port", VerifyMode.defaultMode());

        assertThat(outcome.getValue()).isEqualTo("5432");
    }

    @Test
    void fetchObject_withFractionalValue_returnsLiteralText() throws Exception {
        server.enqueue(new MockResponse().setBody(objectJson(
                "\"size\":18446744073709551616,\"public\":{\"version\":1.10}")));

        FetchOutcome outcome = client.fetchObject(baseUrl, TOKEN, "100", "version", VerifyMode.defaultMode());

        assertThat(outcome.getKind()).isEqualTo(FetchOutcome.Kind.SUCCESS);
        assertThat(outcome.getValue()).isEqualTo("1.10");
    }

    // --- fetchObject: download ---

    @Test
    void fetchObject_download_decodesFileDataAndIgnoresFieldMaps() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"OBJECT\":[{\"download\":\"top\","
                + "\"crypted\":{\"download\":\"crypted\"}}],\"FILEDATA\":\"" + base64("file content\n") + "\"}"));

        FetchOutcome outcome = client.fetchObject(baseUrl, TOKEN, "1718", "download", VerifyMode.defaultMode());

        assertThat(outcome.getKind()).isEqualTo(FetchOutcome.Kind.SUCCESS);
        assertThat(outcome.getValue()).isEqualTo("file content\n");
    }

    @Test
    void fetchObject_download_withoutFileData_isMalformedEvenIfFieldExists() throws Exception {
        server.enqueue(new MockResponse().setBody(objectJson("\"crypted\":{\"download\":\"crypted\"}")));

        FetchOutcome outcome = client.fetchObject(baseUrl, TOKEN, "1718", "download", VerifyMode.defaultMode());

        assertThat(outcome.getKind()).isEqualTo(FetchOutcome.Kind.MALFORMED);
    }

    @Test
    void fetchObject_download_withInvalidBase64_isMalformed() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"OBJECT\":[{}],\"FILEDATA\":\"Q\"}"));

        FetchOutcome outcome = client.fetchObject(baseUrl, TOKEN, "1718", "download", VerifyMode.defaultMode());

        assertThat(outcome.getKind()).isEqualTo(FetchOutcome.Kind.MALFORMED);
    }

    // --- fetchObject: status handling ---

    @Test
    void fetchObject_with403_isTokenRejected() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(403).setBody("{\"ERRORS\":[\"Invalid token\"]}"));

        FetchOutcome outcome = client.fetchObject(baseUrl, TOKEN, "100", "password", VerifyMode.defaultMode());

        assertThat(outcome.getKind()).isEqualTo(FetchOutcome.Kind.TOKEN_REJECTED);
    }

    @Test
    void fetchObject_with404_isTransientFailureWithServerErrors() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"ERRORS\":[\"Object not found.\"]}"));

        FetchOutcome outcome = client.fetchObject(baseUrl, TOKEN, "999", "password", VerifyMode.defaultMode());

        assertThat(outcome.getKind()).isEqualTo(FetchOutcome.Kind.TRANSIENT_FAILURE);
        assertThat(outcome.getStatusCode()).isEqualTo(404);
        assertThat(outcome.getDetail()).isEqualTo("Object not found.");
    }

    @Test
    void fetchObject_with500AndNoBody_isTransientFailure() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(500));

        FetchOutcome outcome = client.fetchObject(baseUrl, TOKEN, "100", "password", VerifyMode.defaultMode());

        assertThat(outcome.getKind()).isEqualTo(FetchOutcome.Kind.TRANSIENT_FAILURE);
        assertThat(outcome.getDetail()).contains("500");
    }

    @Test
    void fetchObject_whenServerDown_throwsUnreachableInFetchPhase() throws IOException {
        String deadUrl = unusedBaseUrl();

        assertThatThrownBy(() -> client.fetchObject(deadUrl, TOKEN, "100", "password", VerifyMode.defaultMode()))
                .isInstanceOf(UnreachableException.class)
                .satisfies(e -> assertThat(((StoredSafeException) e).getPhase())
                        .isEqualTo(StoredSafeException.Phase.FETCH));
    }

    @Test
    void fetchObject_withUnreadableCaBundle_failsInConfigPhase() {
        VerifyMode mode = VerifyMode.caBundle("/nonexistent/ca.pem");

        assertThatThrownBy(() -> client.fetchObject(baseUrl, TOKEN, "100", "password", mode))
                .isInstanceOf(StoredSafeException.class)
                .satisfies(e -> assertThat(((StoredSafeException) e).getPhase())
                        .isEqualTo(StoredSafeException.Phase.CONFIG));
        assertThat(server.getRequestCount()).isZero();
    }

    private static String objectJson(String objectFields) {
        return "{\"OBJECT\":[{\"id\":\"100\"," + objectFields + "}],\"CALLINFO\":{\"status\":\"SUCCESS\"}}";
    }

    /** Base URL on a local port nothing listens on. */
    private static String unusedBaseUrl() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return "http://127.0.0.1:" + socket.getLocalPort() + "/api/1.0";
        }
    }

    private static String base64(String text) {
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
    }
}
