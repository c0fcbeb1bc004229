package com.filenvault.crypto;

import java.nio.charset.StandardCharsets;

import org.bouncycastle.crypto.digests.MD2Digest;
import org.bouncycastle.crypto.digests.MD4Digest;
import org.bouncycastle.crypto.digests.MD5Digest;
import org.bouncycastle.crypto.digests.SHA1Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.digests.SHA384Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

/**
 * Derives the account root key and the server-side auth password from the plaintext
 * password, for each auth version.
 *
 * <ul>
 *   <li>v1: chained hex digests. The master key is {@link Digests#v2Hash} of the password.</li>
 *   <li>v2: PBKDF2-HMAC-SHA512, 200 000 iterations, 64 bytes. The first 64 hex characters
 *       are the master key; the rest, hashed with SHA-512, is the derived password.</li>
 *   <li>v3: Argon2id (t=3, m=64 MiB, p=4) over the hex-decoded salt, 64 bytes. The first
 *       half is the KEK, the second half the derived password.</li>
 * </ul>
 */
public final class PasswordDerivation {

    static final int V2_ITERATIONS = 200_000;
    static final int ARGON2_ITERATIONS = 3;
    static final int ARGON2_MEMORY_KIB = 65_536;
    static final int ARGON2_PARALLELISM = 4;

    private PasswordDerivation() {}

    public static DerivedCredentials derive(int authVersion, String password, String salt) {
        switch (authVersion) {
            case 1:
                return deriveV1(password);
            case 2:
                return deriveV2(password, salt);
            case 3:
                return deriveV3(password, salt);
            default:
                throw new IllegalArgumentException("unsupported auth version " + authVersion);
        }
    }

    static DerivedCredentials deriveV1(String password) {
        return new DerivedCredentials(new MasterKey(Digests.v2Hash(password)), v1HashPassword(password));
    }

    static String v1HashPassword(String password) {
        String sha = Digests.hex(new SHA512Digest(),
                Digests.hex(new SHA384Digest(),
                        Digests.hex(new SHA256Digest(),
                                Digests.hex(new SHA1Digest(), password))));
        String md = Digests.hex(new SHA512Digest(),
                Digests.hex(new MD5Digest(),
                        Digests.hex(new MD4Digest(),
                                Digests.hex(new MD2Digest(), password))));
        return sha + md;
    }

    static DerivedCredentials deriveV2(String password, String salt) {
        String derived = Hex.toHexString(MasterKey.pbkdf2Sha512(
                password.getBytes(StandardCharsets.UTF_8), salt.getBytes(StandardCharsets.UTF_8), V2_ITERATIONS, 64));
        MasterKey masterKey = new MasterKey(derived.substring(0, 64));
        String derivedPassword = Digests.hex(new SHA512Digest(), derived.substring(64));
        return new DerivedCredentials(masterKey, derivedPassword);
    }

    static DerivedCredentials deriveV3(String password, String salt) {
        byte[] saltBytes;
        try {
            saltBytes = Hex.decode(salt);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("v3 salt is not hex", e);
        }
        Argon2Parameters params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
                .withVersion(Argon2Parameters.ARGON2_VERSION_13)
                .withIterations(ARGON2_ITERATIONS)
                .withMemoryAsKB(ARGON2_MEMORY_KIB)
                .withParallelism(ARGON2_PARALLELISM)
                .withSalt(saltBytes)
                .build();
        Argon2BytesGenerator generator = new Argon2BytesGenerator();
        generator.init(params);
        byte[] out = new byte[64];
        generator.generateBytes(password.getBytes(StandardCharsets.UTF_8), out);
        String derived = Hex.toHexString(out);
        EncryptionKey kek = EncryptionKey.fromHex(derived.substring(0, 64));
        return new DerivedCredentials(kek, derived.substring(64));
    }
}
