package com.filenvault.client;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Adds one item to a public link. {@code parent} is {@code "base"} for the linked root;
 * {@code metadata} is encrypted with the link key, {@code key} is the link key encrypted
 * under the owner's hierarchy.
 */
public record DirLinkAddRequest(
        @JsonProperty("uuid") String uuid,
        @JsonProperty("parent") String parent,
        @JsonProperty("linkUUID") String linkUuid,
        @JsonProperty("type") String type,
        @JsonProperty("metadata") String metadata,
        @JsonProperty("key") String key,
        @JsonProperty("expiration") String expiration
) {

    public static final String NEVER = "never";
}
