package com.filenvault.crypto;

/**
 * What a password derivation yields: the account's root key (a legacy {@link MasterKey} or
 * the v3 KEK) and the derived password sent to the server for authentication.
 */
public record DerivedCredentials(MetaCrypter rootKey, String derivedPassword) {

    @Override
    public String toString() {
        return "DerivedCredentials[redacted]";
    }
}
