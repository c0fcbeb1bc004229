package com.filenvault.client;

/**
 * Creates a share of one item for one recipient. {@code parent} is {@code "none"} for the
 * shared root; {@code metadata} is RSA-encrypted for the recipient.
 */
public record ItemShareRequest(String uuid, String parent, String email, String type, String metadata) {
}
