package com.filenvault.client;

/** Answer of {@code /v3/auth/info}: which derivation to run and with what salt. */
public record AuthInfo(int authVersion, String salt) {
}
