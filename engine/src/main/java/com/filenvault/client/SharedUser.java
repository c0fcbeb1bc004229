package com.filenvault.client;

/** A recipient of a share; {@code publicKey} is base64 SubjectPublicKeyInfo. */
public record SharedUser(long id, String email, String publicKey) {
}
