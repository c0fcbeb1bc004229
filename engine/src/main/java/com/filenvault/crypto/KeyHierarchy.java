package com.filenvault.crypto;

/**
 * The account's metadata keys: a master-key ring under auth versions 1 and 2, a single DEK
 * under version 3.
 *
 * <p>Used only for the owner's own view of the object tree. Shares are encrypted under the
 * recipient's RSA key and links under the link key; neither goes through the hierarchy.
 * Implementations are immutable, so one instance can serve concurrent calls.
 */
public interface KeyHierarchy extends MetaCrypter {

    int authVersion();

    default int fileEncryptionVersion() {
        return authVersion() >= 3 ? 3 : 2;
    }

    default int metadataEncryptionVersion() {
        return authVersion() >= 3 ? 3 : 2;
    }

    /** Encrypts a per-object key in the string form of the current file-encryption version. */
    default String wrapKey(EncryptionKey key) {
        return encryptMeta(key.toStringWithVersion(fileEncryptionVersion()));
    }

    default EncryptionKey unwrapKey(String wrapped) {
        return EncryptionKey.fromUnknownString(decryptMeta(wrapped));
    }

    /**
     * Turns a decrypted symmetric key string (a link key, for instance) into a metadata
     * crypter: 64 hex characters are a v3 key, anything else a v2 master key.
     */
    static MetaCrypter crypterForKeyString(String key) {
        if (key.length() == EncryptionKey.KEY_SIZE * 2 && key.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
            return EncryptionKey.fromHex(key);
        }
        return new MasterKey(key);
    }
}
