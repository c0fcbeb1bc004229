package com.filenvault.crypto;

import com.filenvault.error.KeyMismatchException;

/**
 * Auth version 3: one DEK, no fallback. A blob the DEK cannot open is a
 * {@link KeyMismatchException} straight away.
 */
public final class DekKeyHierarchy implements KeyHierarchy {

    private final EncryptionKey dek;

    public DekKeyHierarchy(EncryptionKey dek) {
        this.dek = dek;
    }

    @Override
    public int authVersion() {
        return 3;
    }

    @Override
    public String encryptMeta(String metadata) {
        return dek.encryptMeta(metadata);
    }

    @Override
    public String decryptMeta(String encrypted) {
        if (!encrypted.startsWith(EncryptionKey.V3_PREFIX)) {
            throw new KeyMismatchException("DEK only decrypts v3 metadata");
        }
        return dek.decryptMeta(encrypted);
    }
}
