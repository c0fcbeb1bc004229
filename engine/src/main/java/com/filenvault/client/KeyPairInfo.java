package com.filenvault.client;

/** The account keypair: {@code privateKey} is encrypted under the key hierarchy. */
public record KeyPairInfo(String privateKey, String publicKey) {
}
