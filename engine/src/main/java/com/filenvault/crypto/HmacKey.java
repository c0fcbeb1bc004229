package com.filenvault.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.interfaces.RSAPrivateKey;
import java.util.Arrays;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.util.BigIntegers;
import org.bouncycastle.util.encoders.Hex;

/**
 * 256-bit key for keyed hashing of names and search tokens.
 *
 * <p>Derived from the RSA private exponent with HKDF-SHA256 (no salt, info
 * {@code "hmac-sha256-key"}), so every auth version ends up with the same kind of key.
 */
public final class HmacKey {

    private static final byte[] HKDF_INFO = "hmac-sha256-key".getBytes(StandardCharsets.US_ASCII);

    private final byte[] key;

    public HmacKey(byte[] key) {
        if (key.length != 32) {
            throw new IllegalArgumentException("HMAC key must be 32 bytes");
        }
        this.key = key.clone();
    }

    public static HmacKey fromPrivateKey(RSAPrivateKey privateKey) {
        byte[] exponent = BigIntegers.asUnsignedByteArray(privateKey.getPrivateExponent());
        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(new HKDFParameters(exponent, null, HKDF_INFO));
        byte[] out = new byte[32];
        hkdf.generateBytes(out, 0, out.length);
        return new HmacKey(out);
    }

    /** Hex HMAC-SHA256 of the UTF-8 bytes of {@code data}. */
    public String hash(String data) {
        return hash(data.getBytes(StandardCharsets.UTF_8));
    }

    public String hash(byte[] data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(key, "HmacSHA256"));
            return Hex.toHexString(mac.doFinal(data));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof HmacKey other && Arrays.equals(key, other.key);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(key);
    }

    @Override
    public String toString() {
        return "HmacKey[redacted]";
    }
}
