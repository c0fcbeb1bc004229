package com.filenvault.crypto;

import java.security.SecureRandom;

/**
 * Cryptographically secure random material: raw bytes for keys and nonces, and
 * alphanumeric strings for upload keys, removal tokens and v2 nonces.
 */
public final class SecureRandoms {

    private static final SecureRandom RANDOM = new SecureRandom();

    private static final char[] ALPHANUMERIC =
            "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();

    private SecureRandoms() {}

    public static byte[] bytes(int length) {
        byte[] out = new byte[length];
        RANDOM.nextBytes(out);
        return out;
    }

    public static String alphanumeric(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHANUMERIC[RANDOM.nextInt(ALPHANUMERIC.length)]);
        }
        return sb.toString();
    }
}
