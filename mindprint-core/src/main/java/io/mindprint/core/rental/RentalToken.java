package io.mindprint.core.rental;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Token text helpers. A token reads {@code <namespace>@<opaque>}; only the opaque part identifies the rental.
 */
public final class RentalToken {
    static final char SEPARATOR = '@';

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private RentalToken() {
    }

    static String newOpaque(SecureRandom random, int bytes) {
        byte[] buffer = new byte[bytes];
        random.nextBytes(buffer);
        return ENCODER.encodeToString(buffer);
    }

    static String format(String namespace, String opaque) {
        return namespace + SEPARATOR + opaque;
    }

    /**
     * Returns the opaque part: everything after the last {@code '@'}, or the whole text when there is none.
     */
    public static String opaque(String token) {
        if (token == null) {
            return "";
        }
        String trimmed = token.strip();
        return trimmed.substring(trimmed.lastIndexOf(SEPARATOR) + 1);
    }

    /**
     * Short, log-safe fingerprint of a token.
     */
    public static String fingerprint(String token) {
        return sha256Hex(opaque(token)).substring(0, 12);
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
