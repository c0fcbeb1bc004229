package com.filenvault.crypto;

/**
 * Auth versions 1 and 2: metadata is encrypted under the newest master key and decrypted by
 * trying every key of the ring in order.
 */
public final class LegacyKeyHierarchy implements KeyHierarchy {

    private final int authVersion;
    private final MasterKeyRing ring;

    public LegacyKeyHierarchy(int authVersion, MasterKeyRing ring) {
        if (authVersion != 1 && authVersion != 2) {
            throw new IllegalArgumentException("legacy hierarchy needs auth version 1 or 2, got " + authVersion);
        }
        this.authVersion = authVersion;
        this.ring = ring;
    }

    @Override
    public int authVersion() {
        return authVersion;
    }

    public MasterKeyRing ring() {
        return ring;
    }

    @Override
    public String encryptMeta(String metadata) {
        return ring.encryptMeta(metadata);
    }

    @Override
    public String decryptMeta(String encrypted) {
        return ring.decryptMeta(encrypted);
    }
}
