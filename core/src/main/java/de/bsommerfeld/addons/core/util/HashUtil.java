package de.bsommerfeld.addons.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Hex digests of short strings, used to derive stable identifiers from
 * names.
 */
public final class HashUtil {

    private static final String ALGORITHM = "SHA-1";

    private HashUtil() {
    }

    /** Computes the lower-case hex SHA-1 of the UTF-8 bytes of {@code value}. */
    public static String sha1(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JVM ships SHA-1
            throw new AssertionError(ALGORITHM + " not available", e);
        }
    }
}
