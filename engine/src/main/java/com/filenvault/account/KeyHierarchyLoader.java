package com.filenvault.account;

import java.security.KeyPair;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.filenvault.client.AuthInfo;
import com.filenvault.client.FilenClient;
import com.filenvault.crypto.DekKeyHierarchy;
import com.filenvault.crypto.DerivedCredentials;
import com.filenvault.crypto.EncryptionKey;
import com.filenvault.crypto.HmacKey;
import com.filenvault.crypto.KeyHierarchy;
import com.filenvault.crypto.LegacyKeyHierarchy;
import com.filenvault.crypto.MasterKey;
import com.filenvault.crypto.MasterKeyRing;
import com.filenvault.crypto.PasswordDerivation;
import com.filenvault.crypto.RsaKeys;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Rebuilds the account's key hierarchy from the password.
 *
 * Flow:
 *   1. auth info tells which derivation to run and the salt
 *   2. the password yields a master key (v1, v2) or the KEK (v3)
 *   3. v1/v2: the server's master-key list is decrypted into the ring;
 *      v3: the DEK is decrypted with the KEK
 *   4. the RSA keypair is decrypted with the hierarchy and the HMAC key derived from it
 *
 * The derived password is not needed here; the transport is already authorized.
 */
@Service
public class KeyHierarchyLoader {

    private static final Logger log = LoggerFactory.getLogger(KeyHierarchyLoader.class);

    private final FilenClient client;
    private final AccountKeysHolder holder;

    public KeyHierarchyLoader(FilenClient client, AccountKeysHolder holder) {
        this.client = client;
        this.holder = holder;
    }

    /** Loads the keys and publishes them to the {@link AccountKeysHolder}. */
    public Mono<AccountKeys> load(String email, String password) {
        return client.authInfo(email)
                // Argon2id and 200k PBKDF2 rounds are CPU-bound
                .publishOn(Schedulers.boundedElastic())
                .map(info -> derive(info, password))
                .flatMap(derived -> loadHierarchy(derived.info().authVersion(), derived.credentials()))
                .flatMap(hierarchy -> loadKeyPair(email, hierarchy))
                .doOnNext(keys -> {
                    holder.set(keys);
                    log.info("Loaded keys for auth version {}", keys.authVersion());
                });
    }

    private Derived derive(AuthInfo info, String password) {
        return new Derived(info, PasswordDerivation.derive(info.authVersion(), password, info.salt()));
    }

    Mono<KeyHierarchy> loadHierarchy(int authVersion, DerivedCredentials credentials) {
        if (authVersion >= 3) {
            EncryptionKey kek = (EncryptionKey) credentials.rootKey();
            return client.userDek()
                    .map(encryptedDek -> new DekKeyHierarchy(EncryptionKey.fromHex(kek.decryptMeta(encryptedDek))));
        }
        MasterKey current = (MasterKey) credentials.rootKey();
        return client.masterKeys(current.encryptMeta(current.rawString()))
                .map(encryptedKeys -> {
                    MasterKeyRing ring = MasterKeyRing.fromServerList(current, current.decryptMeta(encryptedKeys));
                    log.debug("Master key ring holds {} keys", ring.keys().size());
                    return new LegacyKeyHierarchy(authVersion, ring);
                });
    }

    private Mono<AccountKeys> loadKeyPair(String email, KeyHierarchy hierarchy) {
        return client.keyPairInfo().map(info -> {
            KeyPair keyPair = RsaKeys.keyPairFromStrings(hierarchy.decryptMeta(info.privateKey()), info.publicKey());
            RSAPrivateKey privateKey = (RSAPrivateKey) keyPair.getPrivate();
            return new AccountKeys(email, hierarchy, (RSAPublicKey) keyPair.getPublic(), privateKey,
                    HmacKey.fromPrivateKey(privateKey));
        });
    }

    private record Derived(AuthInfo info, DerivedCredentials credentials) {
    }
}
