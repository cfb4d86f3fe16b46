package org.irdump.writer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Computes a stable fingerprint of a diagnostic message. Dumps carry the fingerprint
 * instead of the message so they stay readable and single-line, while a change
 * to the message still changes the dump.
 * <p>
 * A cryptographic digest is used because string hash codes collide.
 */
public final class MessageFingerprint {

    /** The digest used when nothing else is configured. */
    public static final String DEFAULT_ALGORITHM = "MD5";

    private final String algorithm;

    /**
     * @param algorithm A JCA {@link MessageDigest} algorithm name, e.g. {@code MD5} or {@code SHA-256}.
     * @throws IllegalArgumentException if the algorithm is not available.
     */
    public MessageFingerprint(String algorithm) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        newDigest(algorithm);
    }

    public String algorithm() {
        return algorithm;
    }

    /**
     * Hashes the UTF-8 bytes of the message and renders the full digest as lowercase hex.
     *
     * @param message The message text.
     * @return Two hex characters per digest byte.
     */
    public String of(String message) {
        byte[] hash = newDigest(algorithm).digest(message.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(hash);
    }

    /**
     * @param algorithm A JCA {@link MessageDigest} algorithm name.
     * @throws IllegalArgumentException if the algorithm is not available.
     */
    static void checkAvailable(String algorithm) {
        newDigest(algorithm);
    }

    private static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unsupported fingerprint algorithm: " + algorithm, e);
        }
    }
}
