package com.filenvault.client;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Directory metadata update; the wire field {@code name} carries the encrypted metadata. */
public record DirMetadataRequest(
        @JsonProperty("uuid") String uuid,
        @JsonProperty("nameHashed") String nameHashed,
        @JsonProperty("name") String metadata
) {
}
