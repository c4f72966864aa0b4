package com.storedsafe.client;

import java.util.Objects;

/**
 * How the TLS peer of the StoredSafe server is verified.
 *
 * <p>The mode is fixed when the configuration is resolved. The client never falls
 * back from one mode to another.
 */
public final class VerifyMode {

    public enum Kind {
        /** Verify against the JVM default trust store. */
        DEFAULT,
        /** Accept any certificate and host name. */
        SKIP_VERIFICATION,
        /** Verify against the certificates of a PEM bundle only. */
        CUSTOM_CA_BUNDLE
    }

    private static final VerifyMode DEFAULT = new VerifyMode(Kind.DEFAULT, null);
    private static final VerifyMode SKIP = new VerifyMode(Kind.SKIP_VERIFICATION, null);

    private final Kind kind;
    private final String caBundlePath;

    private VerifyMode(Kind kind, String caBundlePath) {
        this.kind = kind;
        this.caBundlePath = caBundlePath;
    }

    public static VerifyMode defaultMode() {
        return DEFAULT;
    }

    public static VerifyMode skipVerification() {
        return SKIP;
    }

    public static VerifyMode caBundle(String path) {
        return new VerifyMode(Kind.CUSTOM_CA_BUNDLE, Preconditions.requireNonBlank(path, "CA bundle path"));
    }

    public Kind getKind() {
        return kind;
    }

    /** The PEM bundle path, or null unless the kind is {@link Kind#CUSTOM_CA_BUNDLE}. */
    public String getCaBundlePath() {
        return caBundlePath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VerifyMode)) {
            return false;
        }
        VerifyMode other = (VerifyMode) o;
        return kind == other.kind && Objects.equals(caBundlePath, other.caBundlePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, caBundlePath);
    }

    @Override
    public String toString() {
        return caBundlePath == null ? kind.name() : kind.name() + "(" + caBundlePath + ")";
    }
}
