package com.filenvault.crypto;

import java.security.GeneralSecurityException;
import java.security.NoSuchAlgorithmException;
import java.security.NoSuchProviderException;
import java.security.Security;

import javax.crypto.AEADBadTagException;
import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import com.filenvault.error.KeyMismatchException;

/**
 * AES-256-GCM helpers shared by every symmetric key type.
 *
 * <p>Ciphertext layout is always {@code ciphertext || tag}; the 12-byte nonce travels
 * separately so each encrypted-string format can encode it in its own way.
 */
final class Ciphers {

    static {
        Security.addProvider(new BouncyCastleProvider());
    }

    static final String AES_ALGO = "AES/GCM/NoPadding";
    static final int IV_SIZE = 12;   // 96-bit IV
    static final int TAG_SIZE = 128; // 128-bit Authentication Tag

    private Ciphers() {}

    static byte[] sealGcm(byte[] key, byte[] iv, byte[] plaintext) {
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, "BC");
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_SIZE, iv));
            return cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw failure("AES-GCM encryption", e);
        }
    }

    /**
     * Opens an AES-GCM ciphertext. An authentication failure means the key does not
     * belong to this blob and surfaces as {@link KeyMismatchException}.
     */
    static byte[] openGcm(byte[] key, byte[] iv, byte[] ciphertext) {
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, "BC");
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_SIZE, iv));
            return cipher.doFinal(ciphertext);
        } catch (AEADBadTagException e) {
            throw new KeyMismatchException("AES-GCM authentication failed", e);
        } catch (GeneralSecurityException e) {
            throw failure("AES-GCM decryption", e);
        }
    }

    /** AES-256-CBC with PKCS#7 padding, used only to read v1 metadata. */
    static byte[] openCbc(byte[] key, byte[] iv, byte[] ciphertext) {
        try {
            Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding", "BC");
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));
            return cipher.doFinal(ciphertext);
        } catch (BadPaddingException e) {
            throw new KeyMismatchException("AES-CBC padding check failed", e);
        } catch (GeneralSecurityException e) {
            throw failure("AES-CBC decryption", e);
        }
    }

    /**
     * A missing algorithm or provider is a broken runtime; anything else (a bad key length,
     * a truncated block) is bad input.
     */
    static RuntimeException failure(String operation, GeneralSecurityException e) {
        if (e instanceof NoSuchAlgorithmException || e instanceof NoSuchProviderException
                || e instanceof NoSuchPaddingException) {
            return new IllegalStateException(operation + " unavailable", e);
        }
        return new IllegalArgumentException(operation + " rejected its input", e);
    }
}
