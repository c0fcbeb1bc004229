package com.filenvault.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

/**
 * A 256-bit AES-GCM key.
 *
 * <p>Used as the per-object key of every file and directory (assigned once at creation and
 * never rotated), and as the account DEK and KEK under auth version 3. Instances are
 * immutable and safe to share between threads.
 *
 * <p>Metadata encrypted with this key uses the v3 string format:
 * {@code "003" + hex(nonce) + base64(ciphertext || tag)}. File content uses
 * {@code nonce || ciphertext || tag}.
 */
public final class EncryptionKey implements MetaCrypter {

    public static final int KEY_SIZE = 32;

    static final String V3_PREFIX = "003";
    private static final int V3_NONCE_HEX_END = V3_PREFIX.length() + Ciphers.IV_SIZE * 2;

    private final byte[] bytes;

    public EncryptionKey(byte[] bytes) {
        if (bytes.length != KEY_SIZE) {
            throw new IllegalArgumentException("encryption key must be " + KEY_SIZE + " bytes, got " + bytes.length);
        }
        this.bytes = bytes.clone();
    }

    /** A fresh key from 32 random bytes. */
    public static EncryptionKey random() {
        return new EncryptionKey(SecureRandoms.bytes(KEY_SIZE));
    }

    /**
     * Generates a per-object key for the given file-encryption version. Version 2 keys are
     * 32 random alphanumeric characters taken as raw bytes; version 3 keys are 32 random bytes.
     */
    public static EncryptionKey generate(int fileEncryptionVersion) {
        switch (fileEncryptionVersion) {
            case 2:
                return new EncryptionKey(SecureRandoms.alphanumeric(KEY_SIZE).getBytes(StandardCharsets.ISO_8859_1));
            case 3:
                return random();
            default:
                throw new IllegalArgumentException("unsupported file encryption version " + fileEncryptionVersion);
        }
    }

    /** Parses a 64-character hex string. */
    public static EncryptionKey fromHex(String hex) {
        if (hex.length() != KEY_SIZE * 2) {
            throw new IllegalArgumentException("hex key must be " + KEY_SIZE * 2 + " characters");
        }
        try {
            return new EncryptionKey(Hex.decode(hex));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("key is not valid hex", e);
        }
    }

    /**
     * Parses a key string whose version is not known up front: 32 characters are a raw
     * v1/v2 key, 64 characters are a hex v3 key.
     */
    public static EncryptionKey fromUnknownString(String key) {
        switch (key.length()) {
            case KEY_SIZE:
                return new EncryptionKey(key.getBytes(StandardCharsets.ISO_8859_1));
            case KEY_SIZE * 2:
                return fromHex(key);
            default:
                throw new IllegalArgumentException("key length " + key.length() + " is neither 32 nor 64");
        }
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public String toHex() {
        return Hex.toHexString(bytes);
    }

    /** The form stored in an object's metadata blob: hex for v3, the raw characters before that. */
    public String toStringWithVersion(int fileEncryptionVersion) {
        if (fileEncryptionVersion == 3) {
            return toHex();
        }
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    /**
     * The same bytes used as a v2 master key. Object names, sizes and MIME types in a
     * completion request are encrypted this way.
     */
    public MasterKey toMasterKey() {
        return new MasterKey(bytes);
    }

    public byte[] encryptData(byte[] plaintext) {
        byte[] nonce = SecureRandoms.bytes(Ciphers.IV_SIZE);
        byte[] sealed = Ciphers.sealGcm(bytes, nonce, plaintext);
        byte[] out = new byte[nonce.length + sealed.length];
        System.arraycopy(nonce, 0, out, 0, nonce.length);
        System.arraycopy(sealed, 0, out, nonce.length, sealed.length);
        return out;
    }

    public byte[] decryptData(byte[] data) {
        if (data.length < Ciphers.IV_SIZE + Ciphers.TAG_SIZE / 8) {
            throw new IllegalArgumentException("encrypted chunk is too short");
        }
        byte[] nonce = Arrays.copyOfRange(data, 0, Ciphers.IV_SIZE);
        byte[] sealed = Arrays.copyOfRange(data, Ciphers.IV_SIZE, data.length);
        return Ciphers.openGcm(bytes, nonce, sealed);
    }

    @Override
    public String encryptMeta(String metadata) {
        byte[] nonce = SecureRandoms.bytes(Ciphers.IV_SIZE);
        byte[] sealed = Ciphers.sealGcm(bytes, nonce, metadata.getBytes(StandardCharsets.UTF_8));
        return V3_PREFIX + Hex.toHexString(nonce) + Base64.getEncoder().encodeToString(sealed);
    }

    @Override
    public String decryptMeta(String encrypted) {
        if (!encrypted.startsWith(V3_PREFIX) || encrypted.length() < V3_NONCE_HEX_END) {
            throw new IllegalArgumentException("unsupported metadata format (allowed: 003)");
        }
        byte[] nonce;
        byte[] sealed;
        try {
            nonce = Hex.decode(encrypted.substring(V3_PREFIX.length(), V3_NONCE_HEX_END));
            sealed = Base64.getDecoder().decode(encrypted.substring(V3_NONCE_HEX_END));
        } catch (DecoderException | IllegalArgumentException e) {
            throw new IllegalArgumentException("malformed v3 metadata", e);
        }
        return new String(Ciphers.openGcm(bytes, nonce, sealed), StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EncryptionKey other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "EncryptionKey[redacted]";
    }
}
