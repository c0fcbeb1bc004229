package com.filenvault.crypto;

import java.nio.charset.StandardCharsets;

import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.SHA1Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.util.encoders.Hex;

/**
 * Hex-encoded message digests used by the legacy hashing schemes.
 */
public final class Digests {

    private Digests() {}

    public static String hex(Digest digest, byte[] data) {
        digest.update(data, 0, data.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return Hex.toHexString(out);
    }

    /** {@code hex(digest(utf8(data)))}, for chaining one hex digest into the next. */
    public static String hex(Digest digest, String data) {
        return hex(digest, data.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha512Hex(byte[] data) {
        return hex(new SHA512Digest(), data);
    }

    /**
     * {@code hex(SHA1(hex(SHA512(data))))}. Hashes names under auth versions 1 and 2 and
     * derives the v1 master key from the password.
     */
    public static String v2Hash(String data) {
        return hex(new SHA1Digest(), hex(new SHA512Digest(), data));
    }
}
