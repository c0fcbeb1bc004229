package com.filenvault;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.List;

import com.filenvault.account.AccountKeys;
import com.filenvault.crypto.DekKeyHierarchy;
import com.filenvault.crypto.EncryptionKey;
import com.filenvault.crypto.HmacKey;
import com.filenvault.crypto.KeyHierarchy;
import com.filenvault.crypto.LegacyKeyHierarchy;
import com.filenvault.crypto.MasterKey;
import com.filenvault.crypto.MasterKeyRing;

/**
 * Shared key material for tests. RSA-4096 generation is slow, so each keypair is generated
 * once per JVM.
 */
public final class TestAccounts {

    public static final String EMAIL = "owner@filenvault.test";

    private static KeyPair owner;
    private static KeyPair recipient;

    private TestAccounts() {}

    public static synchronized KeyPair ownerKeyPair() {
        if (owner == null) {
            owner = generate();
        }
        return owner;
    }

    public static synchronized KeyPair recipientKeyPair() {
        if (recipient == null) {
            recipient = generate();
        }
        return recipient;
    }

    /** An auth version 3 account with a random DEK. */
    public static AccountKeys v3() {
        return account(new DekKeyHierarchy(EncryptionKey.random()));
    }

    /** An auth version 2 account whose ring holds an older and a current master key. */
    public static AccountKeys v2() {
        MasterKeyRing ring = new MasterKeyRing(List.of(
                new MasterKey("older-master-key-0123456789abcdef"),
                new MasterKey("current-master-key-0123456789abcd")));
        return account(new LegacyKeyHierarchy(2, ring));
    }

    public static AccountKeys account(KeyHierarchy hierarchy) {
        KeyPair keyPair = ownerKeyPair();
        RSAPrivateKey privateKey = (RSAPrivateKey) keyPair.getPrivate();
        return new AccountKeys(EMAIL, hierarchy, (RSAPublicKey) keyPair.getPublic(), privateKey,
                HmacKey.fromPrivateKey(privateKey));
    }

    private static KeyPair generate() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(4096);
            return generator.generateKeyPair();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
