package com.filenvault.account;

import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Locale;

import com.filenvault.crypto.Digests;
import com.filenvault.crypto.HmacKey;
import com.filenvault.crypto.KeyHierarchy;

/**
 * Every key of a logged-in account. Immutable; a credential refresh publishes a new instance
 * through {@link AccountKeysHolder} rather than mutating this one.
 */
public record AccountKeys(
        String email,
        KeyHierarchy hierarchy,
        RSAPublicKey publicKey,
        RSAPrivateKey privateKey,
        HmacKey hmacKey
) {

    public int authVersion() {
        return hierarchy.authVersion();
    }

    /**
     * Hash of the lowercased name that lets the server detect name clashes without seeing
     * the name.
     */
    public String hashFileName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (authVersion() < 3) {
            return Digests.v2Hash(lower);
        }
        return hmacKey.hash(lower);
    }

    @Override
    public String toString() {
        return "AccountKeys[email=" + email + ", authVersion=" + authVersion() + "]";
    }
}
