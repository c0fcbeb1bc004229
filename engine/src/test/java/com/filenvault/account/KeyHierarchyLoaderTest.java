package com.filenvault.account;

import java.security.KeyPair;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.filenvault.TestAccounts;
import com.filenvault.client.AuthInfo;
import com.filenvault.client.FilenClient;
import com.filenvault.client.KeyPairInfo;
import com.filenvault.crypto.DekKeyHierarchy;
import com.filenvault.crypto.DerivedCredentials;
import com.filenvault.crypto.EncryptionKey;
import com.filenvault.crypto.KeyHierarchy;
import com.filenvault.crypto.LegacyKeyHierarchy;
import com.filenvault.crypto.MasterKey;
import com.filenvault.crypto.MasterKeyRing;
import com.filenvault.crypto.PasswordDerivation;
import com.filenvault.crypto.RsaKeys;
import com.filenvault.error.KeyMismatchException;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KeyHierarchyLoaderTest {

    @Mock
    private FilenClient client;

    private AccountKeysHolder holder;
    private KeyHierarchyLoader loader;

    @BeforeEach
    void setup() {
        holder = new AccountKeysHolder();
        loader = new KeyHierarchyLoader(client, holder);
    }

    // ── Helper ──────────────────────────────────────────────────────────────

    private KeyPairInfo keyPairInfo(KeyHierarchy hierarchy) {
        KeyPair keyPair = TestAccounts.ownerKeyPair();
        return new KeyPairInfo(
                hierarchy.encryptMeta(RsaKeys.encodePrivateKey(keyPair.getPrivate())),
                RsaKeys.encodePublicKey(keyPair.getPublic()));
    }

    // ── Tests ───────────────────────────────────────────────────────────────

    @Test
    void v2LoginBuildsRingAndPublishesKeys() {
        MasterKey older = new MasterKey("older-master-key-0123456789abcdef");
        MasterKey current = (MasterKey) PasswordDerivation.derive(2, "correct horse", "account-salt").rootKey();
        LegacyKeyHierarchy expected = new LegacyKeyHierarchy(2, new MasterKeyRing(List.of(older, current)));

        when(client.authInfo("owner@filenvault.test")).thenReturn(Mono.just(new AuthInfo(2, "account-salt")));
        when(client.masterKeys(anyString()))
                .thenReturn(Mono.just(current.encryptMeta(older.rawString() + "|" + current.rawString())));
        // keypair encrypted under the older key, as after a password change
        when(client.keyPairInfo()).thenReturn(Mono.just(keyPairInfo(
                new LegacyKeyHierarchy(2, new MasterKeyRing(List.of(older))))));

        StepVerifier.create(loader.load("owner@filenvault.test", "correct horse"))
                .assertNext(keys -> {
                    LegacyKeyHierarchy hierarchy = assertInstanceOf(LegacyKeyHierarchy.class, keys.hierarchy());
                    assertEquals(2, hierarchy.ring().keys().size());
                    assertEquals(current.rawString(), hierarchy.ring().newest().rawString());
                    assertEquals("sample", expected.decryptMeta(hierarchy.encryptMeta("sample")));
                    assertEquals(TestAccounts.ownerKeyPair().getPublic(), keys.publicKey());
                })
                .verifyComplete();

        assertTrue(holder.isLoaded());
        verify(client).masterKeys(argThat(sent -> current.rawString().equals(current.decryptMeta(sent))));
    }

    @Test
    void v3HierarchyDecryptsDekWithKek() {
        EncryptionKey kek = EncryptionKey.random();
        EncryptionKey dek = EncryptionKey.random();
        when(client.userDek()).thenReturn(Mono.just(kek.encryptMeta(dek.toHex())));

        StepVerifier.create(loader.loadHierarchy(3, new DerivedCredentials(kek, "derived")))
                .assertNext(hierarchy -> {
                    assertInstanceOf(DekKeyHierarchy.class, hierarchy);
                    assertEquals("sample", dek.decryptMeta(hierarchy.encryptMeta("sample")));
                })
                .verifyComplete();

        verify(client, never()).masterKeys(anyString());
    }

    @Test
    void wrongPasswordSurfacesAsKeyMismatch() {
        EncryptionKey dek = EncryptionKey.random();
        when(client.userDek()).thenReturn(Mono.just(EncryptionKey.random().encryptMeta(dek.toHex())));

        StepVerifier.create(loader.loadHierarchy(3, new DerivedCredentials(EncryptionKey.random(), "derived")))
                .expectError(KeyMismatchException.class)
                .verify();

        assertFalse(holder.isLoaded());
    }

    @Test
    void currentWithoutLoginFails() {
        assertThrows(IllegalStateException.class, holder::current);
    }

    @Test
    void fileNameHashDependsOnAuthVersion() {
        AccountKeys v2 = TestAccounts.v2();
        AccountKeys v3 = TestAccounts.v3();

        assertEquals("d89593201f2af51d421a78761446eb9d941a92d7", v2.hashFileName("Report.PDF"));
        assertEquals(v3.hmacKey().hash("report.pdf"), v3.hashFileName("Report.PDF"));
    }
}
