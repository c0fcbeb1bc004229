package com.filenvault.crypto;

/**
 * Anything that can turn a small metadata string into an encrypted string and back.
 *
 * <p>Implemented by single keys ({@link MasterKey}, {@link EncryptionKey}), by the legacy
 * {@link MasterKeyRing}, and by the account-level {@link KeyHierarchy}.
 */
public interface MetaCrypter {

    String encryptMeta(String metadata);

    /**
     * @throws com.filenvault.error.KeyMismatchException if no key held by this crypter
     *         can authenticate the blob
     * @throws IllegalArgumentException if the blob is not in a format this crypter reads
     */
    String decryptMeta(String encrypted);
}
