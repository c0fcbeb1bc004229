package com.filenvault.crypto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.filenvault.error.KeyMismatchException;

/**
 * The legacy master-key ring, ordered oldest to newest.
 *
 * <p>A new master key is appended each time the account password changes. Encryption always
 * uses the newest key; decryption tries every key in list order and returns the first
 * authenticated result.
 */
public final class MasterKeyRing implements MetaCrypter {

    private final List<MasterKey> keys;

    public MasterKeyRing(List<MasterKey> keys) {
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("master key ring must hold at least one key");
        }
        this.keys = List.copyOf(keys);
    }

    /**
     * Builds the ring from the decrypted {@code |}-separated key list the server returns.
     * The key derived from the current password is the newest entry; a copy of it inside
     * the server list is dropped.
     */
    public static MasterKeyRing fromServerList(MasterKey current, String pipeSeparated) {
        List<MasterKey> ring = new ArrayList<>();
        for (String rawKey : pipeSeparated.split("\\|")) {
            if (rawKey.isEmpty()) {
                continue;
            }
            MasterKey key = new MasterKey(rawKey);
            if (!key.sameDerivedKey(current)) {
                ring.add(key);
            }
        }
        ring.add(current);
        return new MasterKeyRing(ring);
    }

    public List<MasterKey> keys() {
        return Collections.unmodifiableList(keys);
    }

    public MasterKey newest() {
        return keys.get(keys.size() - 1);
    }

    @Override
    public String encryptMeta(String metadata) {
        return newest().encryptMeta(metadata);
    }

    @Override
    public String decryptMeta(String encrypted) {
        KeyMismatchException failure = null;
        for (MasterKey key : keys) {
            try {
                return key.decryptMeta(encrypted);
            } catch (KeyMismatchException e) {
                if (failure == null) {
                    failure = new KeyMismatchException("all " + keys.size() + " master keys failed");
                }
                failure.addSuppressed(e);
            }
        }
        throw failure;
    }
}
