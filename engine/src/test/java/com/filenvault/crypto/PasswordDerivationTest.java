package com.filenvault.crypto;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PasswordDerivationTest {

    @Test
    void v1HashesPasswordThroughBothDigestChains() {
        String hashed = PasswordDerivation.v1HashPassword("hunter2");

        assertEquals(256, hashed.length());
        assertEquals("beeb16d2fc5146d10b243bd8857949a443d48d737adc0f58a3be81af75e63e03"
                + "48b68fd7eaf55c76cca59d0abaf1a386b0d4ce6652ff69587eb02ad1e040cc4a", hashed.substring(0, 128));
    }

    @Test
    void v1MasterKeyIsV2HashOfPassword() {
        DerivedCredentials credentials = PasswordDerivation.derive(1, "hunter2", "ignored");

        assertEquals(Digests.v2Hash("hunter2"), ((MasterKey) credentials.rootKey()).rawString());
    }

    @Test
    void v2SplitsPbkdf2OutputIntoMasterKeyAndPassword() {
        DerivedCredentials credentials = PasswordDerivation.derive(2, "correct horse", "account-salt");

        assertEquals("8198db42b7a4669c54f9ed761c9e276e0c6769ac4c0d210d7fdc4a5f5457046d",
                ((MasterKey) credentials.rootKey()).rawString());
        assertEquals("80238760194bfc932e8346d830d992811783cf4c3eb50b6e29a72cab087089bd"
                        + "7cb15bff7c1eed05da0a8f2ec12c6387c3dcd2a4ab1e88865051931573c3a92b",
                credentials.derivedPassword());
    }

    @Test
    void v3DerivesKekAndPasswordFromArgon2() {
        String salt = "00112233445566778899aabbccddeeff";

        DerivedCredentials first = PasswordDerivation.derive(3, "correct horse", salt);
        DerivedCredentials second = PasswordDerivation.derive(3, "correct horse", salt);

        EncryptionKey kek = assertInstanceOf(EncryptionKey.class, first.rootKey());
        assertEquals(32, kek.bytes().length);
        assertTrue(first.derivedPassword().matches("[0-9a-f]{64}"));
        assertEquals(kek, second.rootKey());
        assertEquals(first.derivedPassword(), second.derivedPassword());
        assertNotEquals(kek.toHex(), first.derivedPassword());
    }

    @Test
    void v3RejectsNonHexSalt() {
        assertThrows(IllegalArgumentException.class, () -> PasswordDerivation.derive(3, "pw", "not-hex!"));
    }

    @Test
    void unknownAuthVersionIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> PasswordDerivation.derive(4, "pw", "salt"));
    }

    @Test
    void credentialsNeverPrintThePassword() {
        DerivedCredentials credentials = PasswordDerivation.derive(1, "hunter2", "");

        assertFalse(credentials.toString().contains(credentials.derivedPassword()));
    }
}
