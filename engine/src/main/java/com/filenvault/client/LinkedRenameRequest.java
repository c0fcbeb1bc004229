package com.filenvault.client;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LinkedRenameRequest(
        @JsonProperty("uuid") String uuid,
        @JsonProperty("linkUUID") String linkUuid,
        @JsonProperty("metadata") String metadata
) {
}
