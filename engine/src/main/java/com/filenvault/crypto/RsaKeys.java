package com.filenvault.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PSource;

import com.filenvault.error.KeyMismatchException;

/**
 * RSA helpers for sharing. Public keys travel as base64 X.509 SubjectPublicKeyInfo, private
 * keys as base64 PKCS#8. Share metadata is RSA-OAEP with SHA-512 for both the label hash and
 * MGF1, base64 encoded.
 */
public final class RsaKeys {

    private static final String OAEP = "RSA/ECB/OAEPPadding";
    private static final OAEPParameterSpec OAEP_SHA512 = new OAEPParameterSpec(
            "SHA-512", "MGF1", MGF1ParameterSpec.SHA512, PSource.PSpecified.DEFAULT);

    private RsaKeys() {}

    public static RSAPublicKey publicKeyFromString(String base64) {
        try {
            byte[] der = Base64.getDecoder().decode(base64);
            return (RSAPublicKey) KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
        } catch (IllegalArgumentException | InvalidKeySpecException | ClassCastException e) {
            throw new IllegalArgumentException("not a base64 RSA public key", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("RSA key factory unavailable", e);
        }
    }

    /**
     * Parses the account keypair and checks that both halves belong together.
     */
    public static KeyPair keyPairFromStrings(String privateKeyBase64, String publicKeyBase64) {
        RSAPublicKey publicKey = publicKeyFromString(publicKeyBase64);
        RSAPrivateCrtKey privateKey;
        try {
            byte[] der = Base64.getDecoder().decode(privateKeyBase64);
            privateKey = (RSAPrivateCrtKey) KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (IllegalArgumentException | InvalidKeySpecException | ClassCastException e) {
            throw new IllegalArgumentException("not a base64 PKCS#8 RSA private key", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("RSA key factory unavailable", e);
        }
        if (!publicKey.getModulus().equals(privateKey.getModulus())
                || !publicKey.getPublicExponent().equals(privateKey.getPublicExponent())) {
            throw new IllegalArgumentException("public and private key mismatch");
        }
        return new KeyPair(publicKey, privateKey);
    }

    public static String encodePublicKey(PublicKey publicKey) {
        return Base64.getEncoder().encodeToString(publicKey.getEncoded());
    }

    public static String encodePrivateKey(PrivateKey privateKey) {
        return Base64.getEncoder().encodeToString(privateKey.getEncoded());
    }

    public static String publicEncrypt(PublicKey publicKey, String data) {
        try {
            Cipher cipher = Cipher.getInstance(OAEP);
            cipher.init(Cipher.ENCRYPT_MODE, publicKey, OAEP_SHA512);
            return Base64.getEncoder().encodeToString(cipher.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw Ciphers.failure("RSA-OAEP encryption", e);
        }
    }

    /** Recipient side of {@link #publicEncrypt}. */
    public static String privateDecrypt(PrivateKey privateKey, String base64) {
        try {
            Cipher cipher = Cipher.getInstance(OAEP);
            cipher.init(Cipher.DECRYPT_MODE, privateKey, OAEP_SHA512);
            return new String(cipher.doFinal(Base64.getDecoder().decode(base64)), StandardCharsets.UTF_8);
        } catch (BadPaddingException e) {
            throw new KeyMismatchException("RSA-OAEP decryption failed", e);
        } catch (GeneralSecurityException e) {
            throw Ciphers.failure("RSA-OAEP decryption", e);
        }
    }
}
