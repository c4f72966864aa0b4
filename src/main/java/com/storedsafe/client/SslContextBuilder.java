package com.storedsafe.client;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;

/**
 * Builds the {@link SSLContext} for a {@link VerifyMode}.
 *
 * <p>Example usage:
 * <pre>{@code
 * SSLContext ctx = SslContextBuilder.create()
 *     .withCaBundle("/etc/ssl/storedsafe-ca.pem")
 *     .build();
 * }</pre>
 */
public class SslContextBuilder {

    private static final Pattern PEM_CERT_PATTERN = Pattern.compile(
            "-----BEGIN CERTIFICATE-----([A-Za-z0-9+/=\\s]+)-----END CERTIFICATE-----");

    private String caBundlePath;
    private boolean skipVerify;

    private SslContextBuilder() {
    }

    public static SslContextBuilder create() {
        return new SslContextBuilder();
    }

    /**
     * Returns the SSL context for a verification mode.
     *
     * @param mode the verification mode
     * @return the context, or null for {@link VerifyMode.Kind#DEFAULT} (JVM defaults apply)
     * @throws GeneralSecurityException if the trust store cannot be set up
     * @throws IOException              if the CA bundle cannot be read
     */
    public static SSLContext forMode(VerifyMode mode) throws GeneralSecurityException, IOException {
        switch (mode.getKind()) {
            case SKIP_VERIFICATION:
                return create().withSkipVerify(true).build();
            case CUSTOM_CA_BUNDLE:
                return create().withCaBundle(mode.getCaBundlePath()).build();
            default:
                return null;
        }
    }

    /**
     * Trusts only the certificates found in a PEM bundle.
     *
     * @param path path to the PEM file, may hold several certificates
     * @return this builder
     */
    public SslContextBuilder withCaBundle(String path) {
        this.caBundlePath = path;
        return this;
    }

    /**
     * Accepts any server certificate and host name.
     *
     * <p><strong>Warning:</strong> only for servers with self-signed certificates on
     * trusted networks.
     *
     * @param skip true to skip verification
     * @return this builder
     */
    public SslContextBuilder withSkipVerify(boolean skip) {
        this.skipVerify = skip;
        return this;
    }

    public SSLContext build() throws GeneralSecurityException, IOException {
        SSLContext sslContext = SSLContext.getInstance("TLS");
        sslContext.init(null, createTrustManagers(), new SecureRandom());
        return sslContext;
    }

    private TrustManager[] createTrustManagers() throws GeneralSecurityException, IOException {
        if (skipVerify) {
            return new TrustManager[]{new TrustAllManager()};
        }
        if (caBundlePath == null) {
            return null;
        }

        KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
        trustStore.load(null, null);
        List<X509Certificate> certs = loadCertificates(caBundlePath);
        for (int i = 0; i < certs.size(); i++) {
            trustStore.setCertificateEntry("storedsafe-ca-" + i, certs.get(i));
        }

        TrustManagerFactory tmf = TrustManagerFactory.getInstance(
                TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(trustStore);
        return tmf.getTrustManagers();
    }

    static List<X509Certificate> loadCertificates(String path) throws IOException, GeneralSecurityException {
        String pem = Files.readString(Path.of(path), StandardCharsets.US_ASCII);
        CertificateFactory cf = CertificateFactory.getInstance("X.509");
        List<X509Certificate> certs = new ArrayList<>();

        Matcher matcher = PEM_CERT_PATTERN.matcher(pem);
        while (matcher.find()) {
            byte[] der = Base64.getMimeDecoder().decode(matcher.group(1).trim());
            certs.add((X509Certificate) cf.generateCertificate(new ByteArrayInputStream(der)));
        }

        if (certs.isEmpty()) {
            throw new GeneralSecurityException("No certificates found in CA bundle: " + path);
        }
        return certs;
    }

    /**
     * Extended so the JSSE layer does not wrap it with its own host name check.
     */
    private static final class TrustAllManager extends X509ExtendedTrustManager {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
