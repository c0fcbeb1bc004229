package com.filenvault.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

import org.bouncycastle.crypto.digests.MD5Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * A legacy (auth version 1 and 2) metadata key.
 *
 * <p>The AES key is PBKDF2-HMAC-SHA512 over the raw key with the raw key as salt, one
 * iteration, 32 bytes. Encryption produces the v2 format
 * {@code "002" + 12-character nonce + base64(ciphertext || tag)}. Decryption also reads the
 * v1 format, an OpenSSL "Salted__" AES-256-CBC blob.
 */
public final class MasterKey implements MetaCrypter {

    static final String V1_PREFIX = "U2FsdGVk";
    static final String V2_PREFIX = "002";
    private static final int V2_NONCE_END = V2_PREFIX.length() + Ciphers.IV_SIZE;

    private final byte[] raw;
    private final byte[] derived;

    public MasterKey(byte[] raw) {
        this.raw = raw.clone();
        this.derived = pbkdf2Sha512(raw, raw, 1, 32);
    }

    public MasterKey(String raw) {
        this(raw.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] raw() {
        return raw.clone();
    }

    /** The raw key as the string the server stores in the master-key list. */
    public String rawString() {
        return new String(raw, StandardCharsets.UTF_8);
    }

    boolean sameDerivedKey(MasterKey other) {
        return Arrays.equals(derived, other.derived);
    }

    @Override
    public String encryptMeta(String metadata) {
        String nonce = SecureRandoms.alphanumeric(Ciphers.IV_SIZE);
        byte[] sealed = Ciphers.sealGcm(derived, nonce.getBytes(StandardCharsets.ISO_8859_1),
                metadata.getBytes(StandardCharsets.UTF_8));
        return V2_PREFIX + nonce + Base64.getEncoder().encodeToString(sealed);
    }

    @Override
    public String decryptMeta(String encrypted) {
        if (encrypted.startsWith(V1_PREFIX)) {
            return decryptMetaV1(encrypted);
        }
        if (encrypted.startsWith(V2_PREFIX)) {
            return decryptMetaV2(encrypted);
        }
        throw new IllegalArgumentException("unknown metadata format");
    }

    String decryptMetaV2(String encrypted) {
        if (encrypted.length() < V2_NONCE_END) {
            throw new IllegalArgumentException("malformed v2 metadata");
        }
        byte[] nonce = encrypted.substring(V2_PREFIX.length(), V2_NONCE_END).getBytes(StandardCharsets.ISO_8859_1);
        byte[] sealed;
        try {
            sealed = Base64.getDecoder().decode(encrypted.substring(V2_NONCE_END));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("malformed v2 metadata", e);
        }
        return new String(Ciphers.openGcm(derived, nonce, sealed), StandardCharsets.UTF_8);
    }

    String decryptMetaV1(String encrypted) {
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(encrypted);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("malformed v1 metadata", e);
        }
        if (decoded.length <= 16) {
            throw new IllegalArgumentException("malformed v1 metadata");
        }
        byte[] salt = Arrays.copyOfRange(decoded, 8, 16);
        byte[] ciphertext = Arrays.copyOfRange(decoded, 16, decoded.length);
        byte[][] keyAndIv = evpBytesToKey(raw, salt, 32, 16);
        return new String(Ciphers.openCbc(keyAndIv[0], keyAndIv[1], ciphertext), StandardCharsets.UTF_8);
    }

    static byte[] pbkdf2Sha512(byte[] password, byte[] salt, int iterations, int length) {
        PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA512Digest());
        generator.init(password, salt, iterations);
        return ((KeyParameter) generator.generateDerivedParameters(length * 8)).getKey();
    }

    // OpenSSL EVP_BytesToKey with MD5 and a single round, as used by "Salted__" blobs.
    static byte[][] evpBytesToKey(byte[] key, byte[] salt, int keyLength, int ivLength) {
        byte[] keyAndIv = new byte[keyLength + ivLength];
        byte[] previous = new byte[0];
        int offset = 0;
        while (offset < keyAndIv.length) {
            MD5Digest md5 = new MD5Digest();
            md5.update(previous, 0, previous.length);
            md5.update(key, 0, key.length);
            md5.update(salt, 0, salt.length);
            byte[] digest = new byte[md5.getDigestSize()];
            md5.doFinal(digest, 0);
            int copy = Math.min(digest.length, keyAndIv.length - offset);
            System.arraycopy(digest, 0, keyAndIv, offset, copy);
            offset += copy;
            previous = digest;
        }
        return new byte[][] {
                Arrays.copyOfRange(keyAndIv, 0, keyLength),
                Arrays.copyOfRange(keyAndIv, keyLength, keyLength + ivLength)
        };
    }

    @Override
    public String toString() {
        return "MasterKey[redacted]";
    }
}
